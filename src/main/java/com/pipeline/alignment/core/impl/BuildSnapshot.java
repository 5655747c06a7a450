package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.core.TelemetryStore;
import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.storage.ChannelLedger;
import com.pipeline.alignment.storage.LedgerSnapshot;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 单次 build/rebuild 范围内的通道快照集合。
 *
 * 每次调用开始时对涉及的每个通道各取一次快照，之后整轮列解析都只读这些快照，
 * 调用结束即丢弃，不跨调用缓存。
 */
final class BuildSnapshot {

    private final Map<String, LedgerSnapshot> channels;

    private BuildSnapshot(Map<String, LedgerSnapshot> channels) {
        this.channels = channels;
    }

    /**
     * 采集快照。参考通道的快照由调用方预先取得（范围判定与列解析必须基于同一份数据）。
     *
     * @param store       遥测存储
     * @param reference   已取得的参考通道快照（已应用时间基）
     * @param channelIds  列引用的通道
     * @param maxPoints   单通道快照点数上限
     * @param keep        回看窗口条件，按记录的原始点判定
     * @param timeBase    时间基
     */
    static BuildSnapshot capture(TelemetryStore store, LedgerSnapshot reference, Collection<String> channelIds,
                                 int maxPoints, Predicate<Point> keep, TimeBase timeBase) {
        Map<String, LedgerSnapshot> snapshots = new LinkedHashMap<>();
        snapshots.put(reference.getChannelId(), reference);
        for (String channelId : channelIds) {
            if (snapshots.containsKey(channelId)) {
                continue;
            }
            ChannelLedger ledger = store.ledger(channelId);
            LedgerSnapshot snapshot = ledger != null
                    ? timeBase.apply(ledger.snapshotSince(keep, maxPoints))
                    : LedgerSnapshot.empty(channelId);
            snapshots.put(channelId, snapshot);
        }
        return new BuildSnapshot(Collections.unmodifiableMap(snapshots));
    }

    /** 通道快照；通道不存在时返回空快照 */
    LedgerSnapshot channel(String channelId) {
        LedgerSnapshot snapshot = channels.get(channelId);
        return snapshot != null ? snapshot : LedgerSnapshot.empty(channelId);
    }

    /**
     * 被点数上限截断的快照中最早的末点经过时间，即本次调用能完整覆盖的最晚时刻；
     * 没有截断时返回正无穷。
     */
    double coverageLimit() {
        double limit = Double.POSITIVE_INFINITY;
        for (LedgerSnapshot snapshot : channels.values()) {
            if (snapshot.isTruncated() && !snapshot.isEmpty()) {
                limit = Math.min(limit, snapshot.last().getElapsed());
            }
        }
        return limit;
    }

    int totalPoints() {
        int total = 0;
        for (LedgerSnapshot snapshot : channels.values()) {
            total += snapshot.size();
        }
        return total;
    }
}
