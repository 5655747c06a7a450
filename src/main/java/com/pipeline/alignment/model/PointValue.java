package com.pipeline.alignment.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * 数据点取值：数值 / 文本 / 布尔 / 缺失 四选一的带标签值。
 *
 * 是否可插值由 {@link #isNumeric()} 决定，不依赖运行时类型判断。
 */
public final class PointValue implements Serializable {

    private static final PointValue MISSING = new PointValue(ValueType.MISSING, 0.0, null, false);
    private static final PointValue TRUE = new PointValue(ValueType.BOOLEAN, 0.0, null, true);
    private static final PointValue FALSE = new PointValue(ValueType.BOOLEAN, 0.0, null, false);

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;

    private PointValue(ValueType type, double number, String text, boolean bool) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
    }

    public static PointValue ofNumber(double number) {
        return new PointValue(ValueType.NUMBER, number, null, false);
    }

    public static PointValue ofText(String text) {
        if (text == null) {
            return MISSING;
        }
        return new PointValue(ValueType.TEXT, 0.0, text, false);
    }

    public static PointValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static PointValue missing() {
        return MISSING;
    }

    /**
     * 从采集层的原始对象构造取值。null映射为缺失值，Number映射为数值。
     */
    public static PointValue of(Object raw) {
        if (raw == null) {
            return MISSING;
        }
        if (raw instanceof PointValue) {
            return (PointValue) raw;
        }
        if (raw instanceof Number) {
            return ofNumber(((Number) raw).doubleValue());
        }
        if (raw instanceof Boolean) {
            return ofBoolean((Boolean) raw);
        }
        return ofText(raw.toString());
    }

    public ValueType getType() { return type; }

    public boolean isNumeric() { return type == ValueType.NUMBER; }
    public boolean isMissing() { return type == ValueType.MISSING; }

    public double asDouble() {
        if (type != ValueType.NUMBER) {
            throw new IllegalStateException("Value of type " + type + " is not numeric");
        }
        return number;
    }

    public String asText() {
        if (type != ValueType.TEXT) {
            throw new IllegalStateException("Value of type " + type + " is not text");
        }
        return text;
    }

    public boolean asBoolean() {
        if (type != ValueType.BOOLEAN) {
            throw new IllegalStateException("Value of type " + type + " is not boolean");
        }
        return bool;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointValue)) return false;
        PointValue other = (PointValue) o;
        if (type != other.type) return false;
        switch (type) {
            case NUMBER:
                return Double.compare(number, other.number) == 0;
            case TEXT:
                return text.equals(other.text);
            case BOOLEAN:
                return bool == other.bool;
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NUMBER:
                return Objects.hash(type, number);
            case TEXT:
                return Objects.hash(type, text);
            case BOOLEAN:
                return Objects.hash(type, bool);
            default:
                return type.hashCode();
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return String.valueOf(number);
            case TEXT:
                return text;
            case BOOLEAN:
                return String.valueOf(bool);
            default:
                return "";
        }
    }
}
