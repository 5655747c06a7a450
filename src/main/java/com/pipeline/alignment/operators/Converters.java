package com.pipeline.alignment.operators;

import com.pipeline.alignment.core.ValueConverter;
import com.pipeline.alignment.model.ConversionResult;
import com.pipeline.alignment.model.PointValue;

import java.util.Objects;

/**
 * 常用列值转换器。
 *
 * 设备相关的单位换算大多可以表达为线性变换 y = gain * x + offset，
 * 由配置层按列给出 gain/offset；更复杂的公式由调用方自行实现 {@link ValueConverter}。
 */
public final class Converters {

    private Converters() {
    }

    public static ValueConverter identity() {
        return ValueConverter.identity();
    }

    /**
     * 线性换算，仅接受数值。
     */
    public static ValueConverter linear(double gain, double offset) {
        if (!Double.isFinite(gain) || !Double.isFinite(offset)) {
            throw new IllegalArgumentException("Linear converter requires finite gain and offset, got gain="
                    + gain + ", offset=" + offset);
        }
        return raw -> {
            if (!raw.isNumeric()) {
                return ConversionResult.failure("Expected numeric value but got " + raw.getType());
            }
            double result = gain * raw.asDouble() + offset;
            if (!Double.isFinite(result)) {
                return ConversionResult.failure("Linear conversion overflowed for input " + raw);
            }
            return ConversionResult.success(PointValue.ofNumber(result));
        };
    }

    /**
     * 只放行数值，其余类型视为转换失败
     */
    public static ValueConverter numericOnly() {
        return raw -> raw.isNumeric()
                ? ConversionResult.success(raw)
                : ConversionResult.failure("Expected numeric value but got " + raw.getType());
    }

    /**
     * 将文本解析为数值；数值原样通过，布尔映射为 1/0。
     */
    public static ValueConverter parseNumber() {
        return raw -> {
            switch (raw.getType()) {
                case NUMBER:
                    return ConversionResult.success(raw);
                case BOOLEAN:
                    return ConversionResult.success(PointValue.ofNumber(raw.asBoolean() ? 1.0 : 0.0));
                case TEXT:
                    try {
                        return ConversionResult.success(PointValue.ofNumber(Double.parseDouble(raw.asText().trim())));
                    } catch (NumberFormatException e) {
                        return ConversionResult.failure("Cannot parse '" + raw.asText() + "' as number");
                    }
                default:
                    return ConversionResult.failure("Missing value cannot be converted to number");
            }
        };
    }

    /**
     * 串联两个转换器，前一个失败时直接返回失败
     */
    public static ValueConverter chain(ValueConverter first, ValueConverter second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        return raw -> {
            ConversionResult intermediate = first.convert(raw);
            if (!intermediate.isSuccess()) {
                return intermediate;
            }
            return second.convert(intermediate.getValue());
        };
    }
}
