package com.xizhooou.anomaly.dimension;

import java.util.Objects;

/**
 * 事件中抽取出的一个字段值，例如 attribution 链第一个 uid
 * 值只能是标量：整数统一为 Long，浮点统一为 Double，另有 String / Boolean，
 * 因此 ("uid", 111) 与 ("uid", 111L) 是同一个字段值
 *
 * @param field 字段标识
 * @param value 规范化后的字段值
 */
public record FieldValue(String field, Object value) {
    public FieldValue {
        Objects.requireNonNull(field, "field");
        value = normalize(Objects.requireNonNull(value, "value"));
    }

    public static FieldValue of(String field, long value) {
        return new FieldValue(field, value);
    }

    public static FieldValue of(String field, double value) {
        return new FieldValue(field, value);
    }

    public static FieldValue of(String field, String value) {
        return new FieldValue(field, value);
    }

    public static FieldValue of(String field, boolean value) {
        return new FieldValue(field, value);
    }

    private static Object normalize(Object value) {
        if (value instanceof Long || value instanceof Double || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        throw new IllegalArgumentException("unsupported field value type " + value.getClass().getName()
                + ", expected an integral, floating point, string or boolean value");
    }

    @Override
    public String toString() {
        return field + "=" + value;
    }
}
