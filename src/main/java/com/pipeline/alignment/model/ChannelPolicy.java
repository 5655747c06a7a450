package com.pipeline.alignment.model;

/**
 * 列对齐策略：决定某一通道的数据如何映射到规则时间网格上。
 */
public enum ChannelPolicy {
    /** 同步：按参考锚点的绝对时间戳精确匹配（微秒级容差），匹配不到即为空 */
    SYNCHRONIZED(false),
    /** 插值：取网格时刻前后的数据点线性插值，无匹配时沿用上一个有效值 */
    INTERPOLATED(true),
    /** 异步：吸附到最近的数据点，不做插值，无匹配时沿用上一个有效值 */
    ASYNCHRONOUS(true);

    private final boolean forwardFilled;

    ChannelPolicy(boolean forwardFilled) {
        this.forwardFilled = forwardFilled;
    }

    /** 无匹配时是否沿用上一个成功解析并转换的值 */
    public boolean isForwardFilled() { return forwardFilled; }
}
