package com.pipeline.alignment.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 遥测存储的汇总统计，含逐通道明细
 */
public class StoreStatistics implements Serializable {
    private final Long globalFirstTimestamp;
    private final long sessionStartMillis;
    private final double sessionDurationSeconds;
    private final int totalChannels;
    private final long totalPoints;
    private final Map<String, ChannelStatistics> channels;

    public StoreStatistics(Long globalFirstTimestamp, long sessionStartMillis, double sessionDurationSeconds,
                           Map<String, ChannelStatistics> channels) {
        this.globalFirstTimestamp = globalFirstTimestamp;
        this.sessionStartMillis = sessionStartMillis;
        this.sessionDurationSeconds = sessionDurationSeconds;
        this.channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
        this.totalChannels = channels.size();
        long total = 0;
        for (ChannelStatistics stats : channels.values()) {
            total += stats.getCount();
        }
        this.totalPoints = total;
    }

    public Long getGlobalFirstTimestamp() { return globalFirstTimestamp; }
    public long getSessionStartMillis() { return sessionStartMillis; }
    public double getSessionDurationSeconds() { return sessionDurationSeconds; }
    public int getTotalChannels() { return totalChannels; }
    public long getTotalPoints() { return totalPoints; }
    public Map<String, ChannelStatistics> getChannels() { return channels; }

    @Override
    public String toString() {
        return "StoreStatistics{channels=" + totalChannels + ", points=" + totalPoints
                + ", globalFirstTimestamp=" + globalFirstTimestamp + "}";
    }
}
