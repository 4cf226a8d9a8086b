package com.errorengine.lifecycle;

import com.errorengine.model.KeySignature;
import com.errorengine.util.RowValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class KeySignatures {

    private KeySignatures() {
    }

    /**
     * Build the signature of a row from the key fields, in declared order. Column lookup is
     * case-insensitive; values are normalized with {@link RowValues#normalize(Object)}.
     *
     * @param row fetched row
     * @param keyFields key field names
     * @return signature
     * @throws KeyFieldMissingException when the row lacks a key field
     */
    public static KeySignature compute(Map<String, Object> row, List<String> keyFields) {
        List<String> values = new ArrayList<>(keyFields.size());
        for (String field : keyFields) {
            String column = RowValues.findColumn(row, field)
                    .orElseThrow(() -> new KeyFieldMissingException(field, row.keySet()));
            values.add(RowValues.normalize(row.get(column)));
        }
        return new KeySignature(values);
    }
}
