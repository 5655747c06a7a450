package com.pipeline.alignment.model;

/**
 * 数据点取值类型
 */
public enum ValueType {
    /** 数值，可参与线性插值 */
    NUMBER,
    /** 文本 */
    TEXT,
    /** 布尔量 */
    BOOLEAN,
    /** 缺失值（采集端上报了时间戳但没有有效值） */
    MISSING
}
