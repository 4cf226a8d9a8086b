package com.errorengine.source;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by a fetch, in source order. Each row maps column name to a scalar
 * (String, Number, Boolean or null).
 */
@Value
public class SourceResult {
    List<String> columns;
    List<Map<String, Object>> rows;

    public int size() {
        return rows.size();
    }
}
