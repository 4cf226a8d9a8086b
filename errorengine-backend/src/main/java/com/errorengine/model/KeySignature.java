package com.errorengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;

/**
 * Identity of an error within its query: the normalized key-field values in declared order.
 * Two signatures are equal only when every position is equal.
 */
public final class KeySignature {

    private final List<String> values;

    @JsonCreator
    public KeySignature(List<String> values) {
        this.values = List.copyOf(Objects.requireNonNull(values, "values"));
    }

    public static KeySignature of(String... values) {
        return new KeySignature(List.of(values));
    }

    @JsonValue
    public List<String> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeySignature other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return String.join("|", values);
    }
}
