package com.xizhooou.anomaly.dimension;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered, immutable list of field values. Equality is structural, so two keys built
 * from different events with the same values in the same order are the same key.
 */
public final class HashableDimensionKey {

    public static final HashableDimensionKey EMPTY = new HashableDimensionKey(List.of());

    private final List<FieldValue> values;

    public HashableDimensionKey(List<FieldValue> values) {
        this.values = List.copyOf(Objects.requireNonNull(values, "values"));
    }

    public static HashableDimensionKey of(FieldValue... values) {
        return new HashableDimensionKey(List.of(values));
    }

    public List<FieldValue> getValues() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HashableDimensionKey)) return false;
        return values.equals(((HashableDimensionKey) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.stream().map(FieldValue::toString).collect(Collectors.joining(",", "{", "}"));
    }
}
