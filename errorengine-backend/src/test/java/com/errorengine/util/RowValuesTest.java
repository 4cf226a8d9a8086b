package com.errorengine.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RowValuesTest {

    @Test
    void numbersOfDifferentTypesHaveTheSameText() {
        assertThat(RowValues.asText(42)).isEqualTo("42");
        assertThat(RowValues.asText(42L)).isEqualTo("42");
        assertThat(RowValues.asText(new BigDecimal("42.00"))).isEqualTo("42");
        assertThat(RowValues.asText(42.0d)).isEqualTo("42");
        assertThat(RowValues.asText(new BigDecimal("1E+3"))).isEqualTo("1000");
        assertThat(RowValues.asText(null)).isEmpty();
    }

    @Test
    void normalizeTrims() {
        assertThat(RowValues.normalize("  1001 ")).isEqualTo("1001");
    }

    @Test
    void lookupIgnoresCase() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ORDER_ID", 7);

        assertThat(RowValues.lookup(row, "order_id")).isEqualTo(7);
        assertThat(RowValues.findColumn(row, "Order_Id")).contains("ORDER_ID");
        assertThat(RowValues.lookup(row, "missing")).isNull();
    }

    @Test
    void parseNumberRejectsText() {
        assertThat(RowValues.parseNumber(" 12.5 ")).contains(new BigDecimal("12.5"));
        assertThat(RowValues.parseNumber("abc")).isEmpty();
        assertThat(RowValues.parseNumber("")).isEmpty();
    }
}
