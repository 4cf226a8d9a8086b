package com.errorengine.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourceTestResponse {
    private boolean success;
    private String message;
    private String errorKind;
    private List<String> columns;
    private int rowCount;
    private List<Map<String, Object>> sampleRows;
    private long durationMs;
}
