package com.pipeline.alignment.model;

import com.pipeline.alignment.core.ValueConverter;

import java.util.Objects;

/**
 * 虚拟表的列定义，与输出表的列一一对应。
 * 表构造完成后不可变。
 */
public final class ColumnSpec {
    /** 列名（输出表头），同一张表内唯一 */
    private final String name;
    /** 数据来源通道；为null表示计算列，由下游消费者填充 */
    private final String channelId;
    /** 对齐策略 */
    private final ChannelPolicy policy;
    /** 原始值到输出值的转换器 */
    private final ValueConverter converter;

    public ColumnSpec(String name, String channelId, ChannelPolicy policy, ValueConverter converter) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be null or blank");
        }
        this.name = name;
        this.channelId = channelId;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.converter = converter != null ? converter : ValueConverter.identity();
    }

    /** 使用恒等转换器的数据列 */
    public static ColumnSpec of(String name, String channelId, ChannelPolicy policy) {
        return new ColumnSpec(name, channelId, policy, null);
    }

    /** 计算列，不绑定任何通道 */
    public static ColumnSpec computed(String name) {
        return new ColumnSpec(name, null, ChannelPolicy.SYNCHRONIZED, null);
    }

    public String getName() { return name; }
    public String getChannelId() { return channelId; }
    public ChannelPolicy getPolicy() { return policy; }
    public ValueConverter getConverter() { return converter; }

    public boolean isComputed() { return channelId == null; }

    @Override
    public String toString() {
        return "ColumnSpec{name='" + name + "', channel='" + channelId + "', policy=" + policy + "}";
    }
}
