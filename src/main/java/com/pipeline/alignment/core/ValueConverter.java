package com.pipeline.alignment.core;

import com.pipeline.alignment.model.ConversionResult;
import com.pipeline.alignment.model.PointValue;

/**
 * 列值转换器接口 —— 将通道原始值转换为输出单位。
 *
 * 转换失败通过 {@link ConversionResult#failure(String)} 返回，
 * 只影响当前单元格，不会中断整行或整个构建。
 * 设备相关的换算公式由配置层提供，引擎只负责调用。
 */
@FunctionalInterface
public interface ValueConverter {

    /**
     * 转换一个已解析出的原始值。
     *
     * @param raw 原始值，不为null
     * @return 转换结果
     */
    ConversionResult convert(PointValue raw);

    /**
     * 恒等转换器
     */
    static ValueConverter identity() {
        return ConversionResult::success;
    }
}
