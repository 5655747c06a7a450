package com.pipeline.alignment.model;

/**
 * 构建失败分类
 */
public enum FailureKind {
    /** 参考通道不存在或为空，预热阶段的常态，下次调用自动重试 */
    MISSING_REFERENCE,
    /** 结构性错误：计数与序列不一致、末时刻早于首时刻、时间修复失败等，本次调用中止 */
    STRUCTURAL_ERROR,
    /** 时间跨度异常，已通过绝对时间戳重算修复 */
    TIMING_ANOMALY,
    /** 单元格值转换失败，仅影响该单元格 */
    CONVERSION_ERROR,
    /** 配置错误（采样率非正），不重试 */
    CONFIGURATION_ERROR
}
