package com.pipeline.alignment.model;

import java.io.Serializable;

/**
 * 单通道统计信息
 */
public class ChannelStatistics implements Serializable {
    private final String channelId;
    private final int count;
    /** 最早保留点的绝对时间戳；通道为空时为null */
    private final Long firstTimestamp;
    /** 最近写入点的绝对时间戳；通道为空时为null */
    private final Long lastTimestamp;
    /** 时间跨度（秒） */
    private final double timeSpan;
    /** 平均采集速率（点/秒） */
    private final double rate;

    public ChannelStatistics(String channelId, int count, Long firstTimestamp, Long lastTimestamp) {
        this.channelId = channelId;
        this.count = count;
        this.firstTimestamp = firstTimestamp;
        this.lastTimestamp = lastTimestamp;
        if (count > 0 && firstTimestamp != null && lastTimestamp != null) {
            this.timeSpan = (lastTimestamp - firstTimestamp) / 1e9;
        } else {
            this.timeSpan = 0.0;
        }
        this.rate = timeSpan > 0 ? count / timeSpan : 0.0;
    }

    public String getChannelId() { return channelId; }
    public int getCount() { return count; }
    public Long getFirstTimestamp() { return firstTimestamp; }
    public Long getLastTimestamp() { return lastTimestamp; }
    public double getTimeSpan() { return timeSpan; }
    public double getRate() { return rate; }

    @Override
    public String toString() {
        return "ChannelStatistics{channel='" + channelId + "', count=" + count
                + ", timeSpan=" + timeSpan + "s, rate=" + rate + "/s}";
    }
}
