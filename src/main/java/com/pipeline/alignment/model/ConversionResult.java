package com.pipeline.alignment.model;

import java.io.Serializable;

/**
 * 值转换结果：成功时携带转换后的值，失败时携带原因。
 * 转换失败是普通的数据路径，不通过异常传递。
 */
public final class ConversionResult implements Serializable {
    private final PointValue value;
    private final String error;

    private ConversionResult(PointValue value, String error) {
        this.value = value;
        this.error = error;
    }

    public static ConversionResult success(PointValue value) {
        if (value == null) {
            return failure("Converter produced no value");
        }
        return new ConversionResult(value, null);
    }

    public static ConversionResult failure(String error) {
        return new ConversionResult(null, error != null ? error : "Conversion failed");
    }

    public boolean isSuccess() { return value != null; }

    /** 转换后的值；失败时返回null */
    public PointValue getValue() { return value; }

    /** 失败原因；成功时返回null */
    public String getError() { return error; }

    @Override
    public String toString() {
        return isSuccess() ? "ConversionResult{value=" + value + "}" : "ConversionResult{error='" + error + "'}";
    }
}
