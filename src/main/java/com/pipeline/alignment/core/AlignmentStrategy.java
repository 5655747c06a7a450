package com.pipeline.alignment.core;

import com.pipeline.alignment.model.AlignmentContext;
import com.pipeline.alignment.model.ChannelPolicy;
import com.pipeline.alignment.model.PointValue;
import com.pipeline.alignment.storage.LedgerSnapshot;

/**
 * 对齐策略接口 —— 每种 {@link ChannelPolicy} 对应一个实现。
 *
 * 策略只负责在通道快照中为某个网格时刻找出原始值，
 * 不做值转换，也不维护沿用（forward-fill）状态，这两者由表构建器处理。
 *
 * 实现约定：
 * - 只读访问传入的快照，不持有任何跨调用状态，可被并发调用
 * - 找不到满足容差的数据时返回null，而不是近似值或异常
 */
public interface AlignmentStrategy {

    /**
     * 为给定网格时刻解析原始值。
     *
     * @param channel 该通道在本次构建中的不可变快照
     * @param context 当前网格时刻的对齐上下文
     * @return 原始值；未解析出时返回null
     */
    PointValue resolve(LedgerSnapshot channel, AlignmentContext context);

    /**
     * @return 该策略对应的列策略
     */
    ChannelPolicy getPolicy();
}
