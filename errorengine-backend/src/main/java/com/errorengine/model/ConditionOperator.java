package com.errorengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Comparison operators available to routing conditions. The wire form is the lowercase code.
 */
public enum ConditionOperator {
    EQUALS("equals", true),
    NOT_EQUALS("not_equals", true),
    CONTAINS("contains", true),
    NOT_CONTAINS("not_contains", true),
    STARTSWITH("startswith", true),
    ENDSWITH("endswith", true),
    IN("in", true),
    NOT_IN("not_in", true),
    GT("gt", true),
    GTE("gte", true),
    LT("lt", true),
    LTE("lte", true),
    IS_EMPTY("is_empty", false),
    IS_NOT_EMPTY("is_not_empty", false),
    REGEX("regex", true),
    NOT_REGEX("not_regex", true);

    private final String code;
    private final boolean needsValue;

    ConditionOperator(String code, boolean needsValue) {
        this.code = code;
        this.needsValue = needsValue;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @return false for operators that ignore the condition literal
     */
    public boolean needsValue() {
        return needsValue;
    }

    /**
     * Resolve an operator from its code or enum name, case-insensitively.
     *
     * @param code operator code
     * @return operator
     * @throws IllegalArgumentException for unknown operators
     */
    @JsonCreator
    public static ConditionOperator fromCode(String code) {
        if (code != null) {
            String c = code.trim().toLowerCase(Locale.ROOT);
            for (ConditionOperator op : values()) {
                if (op.code.equals(c)) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + code);
    }
}
