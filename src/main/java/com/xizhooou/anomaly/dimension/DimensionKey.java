package com.xizhooou.anomaly.dimension;

import java.util.Objects;

/**
 * One slice of a metric: the "what" values extracted from the matched event plus the
 * condition key, which stays {@link HashableDimensionKey#EMPTY} when the metric is not sliced
 * by a condition.
 */
public record DimensionKey(HashableDimensionKey what, HashableDimensionKey condition) {
    public DimensionKey {
        Objects.requireNonNull(what, "what");
        condition = (condition == null) ? HashableDimensionKey.EMPTY : condition;
    }

    public static DimensionKey of(HashableDimensionKey what) {
        return new DimensionKey(what, HashableDimensionKey.EMPTY);
    }

    public static DimensionKey of(FieldValue... what) {
        return of(HashableDimensionKey.of(what));
    }

    @Override
    public String toString() {
        return condition.isEmpty() ? what.toString() : what + "|" + condition;
    }
}
