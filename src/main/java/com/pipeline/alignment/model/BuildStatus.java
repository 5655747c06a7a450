package com.pipeline.alignment.model;

/**
 * build/rebuild 调用结果状态
 */
public enum BuildStatus {
    /** 完整构建完成 */
    BUILT,
    /** 增量构建追加了新行 */
    EXTENDED,
    /** 已构建且无新数据，未做任何改动 */
    UP_TO_DATE,
    /** 参考通道未就绪，软失败 */
    MISSING_REFERENCE,
    /** 结构性错误，表保持原状 */
    STRUCTURAL_ERROR,
    /** 配置错误，表保持原状 */
    CONFIGURATION_ERROR;

    public boolean isFailure() {
        return this == MISSING_REFERENCE || this == STRUCTURAL_ERROR || this == CONFIGURATION_ERROR;
    }
}
