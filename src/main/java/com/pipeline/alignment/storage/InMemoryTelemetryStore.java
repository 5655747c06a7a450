package com.pipeline.alignment.storage;

import com.pipeline.alignment.core.TelemetryStore;
import com.pipeline.alignment.model.ChannelStatistics;
import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.model.PointValue;
import com.pipeline.alignment.model.StoreStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 基于内存的遥测存储实现。
 *
 * 核心设计：
 * - 一通道一账本，通道在首次写入时惰性创建，仅在 clear 时销毁
 * - 全局参考时间戳取整个会话第一个有效时间戳，所有通道共用
 * - 会话期间持续增长，由调用方按经过时间和单通道点数上限主动裁剪
 */
public class InMemoryTelemetryStore implements TelemetryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTelemetryStore.class);

    /** 通道账本：channelId -> ChannelLedger */
    private final ConcurrentHashMap<String, ChannelLedger> ledgers = new ConcurrentHashMap<>();

    /** 通道首次出现的顺序 */
    private final CopyOnWriteArrayList<String> channelOrder = new CopyOnWriteArrayList<>();

    /** 全局参考时间戳（纳秒），首个大于0的时间戳 */
    private final AtomicReference<Long> globalFirstTimestamp = new AtomicReference<>();

    /** 会话起点（墙钟毫秒） */
    private volatile long sessionStartMillis = System.currentTimeMillis();

    // ==================== 写入 ====================

    @Override
    public void addPoint(String channelId, Object value, long timestamp) {
        if (channelId == null) {
            throw new IllegalArgumentException("Channel id must not be null");
        }
        ChannelLedger ledger = ledgers.computeIfAbsent(channelId, id -> {
            channelOrder.add(id);
            log.debug("Channel '{}' created on first point.", id);
            return new ChannelLedger(id);
        });

        if (timestamp > 0 && globalFirstTimestamp.get() == null
                && globalFirstTimestamp.compareAndSet(null, timestamp)) {
            log.info("Global reference timestamp set to {} by channel '{}'.", timestamp, channelId);
        }

        ledger.addPoint(PointValue.of(value), timestamp, globalFirstTimestamp.get());
    }

    // ==================== 查询 ====================

    @Override
    public ChannelLedger ledger(String channelId) {
        if (channelId == null) {
            return null;
        }
        return ledgers.get(channelId);
    }

    @Override
    public List<String> channelIds() {
        return new ArrayList<>(channelOrder);
    }

    @Override
    public Map<String, Point> snapshotAt(double targetElapsed, double tolerance) {
        Map<String, Point> result = new LinkedHashMap<>();
        for (String channelId : channelOrder) {
            ChannelLedger ledger = ledgers.get(channelId);
            result.put(channelId, ledger != null ? ledger.nearestPoint(targetElapsed, tolerance) : null);
        }
        return result;
    }

    @Override
    public Map<String, List<Point>> pointsInRange(double startElapsed, double endElapsed) {
        Map<String, List<Point>> result = new LinkedHashMap<>();
        for (String channelId : channelOrder) {
            ChannelLedger ledger = ledgers.get(channelId);
            if (ledger != null) {
                result.put(channelId, ledger.pointsInRange(startElapsed, endElapsed));
            }
        }
        return result;
    }

    // ==================== 裁剪 ====================

    @Override
    public Map<String, Integer> prune(double minElapsed, int maxPointsPerChannel) {
        return prune(minElapsed, maxPointsPerChannel, Double.POSITIVE_INFINITY);
    }

    @Override
    public Map<String, Integer> prune(double minElapsed, int maxPointsPerChannel, double protectFromElapsed) {
        Map<String, Integer> prunedCounts = new LinkedHashMap<>();
        int total = 0;

        for (String channelId : channelOrder) {
            ChannelLedger ledger = ledgers.get(channelId);
            if (ledger == null) continue;

            int removed = ledger.pruneOlderThan(minElapsed);
            // 时间裁剪后仍超出上限，再按点数截断
            removed += ledger.trimToMaxPoints(maxPointsPerChannel, protectFromElapsed);

            if (removed > 0) {
                prunedCounts.put(channelId, removed);
                total += removed;
            }
        }

        if (total > 0) {
            log.debug("Pruned {} points across {} channels (minElapsed={}, maxPointsPerChannel={}).",
                    total, prunedCounts.size(), minElapsed, maxPointsPerChannel);
        }
        return prunedCounts;
    }

    // ==================== 统计 ====================

    @Override
    public Long globalFirstTimestamp() {
        return globalFirstTimestamp.get();
    }

    @Override
    public int channelCount(String channelId) {
        ChannelLedger ledger = ledger(channelId);
        return ledger != null ? ledger.count() : 0;
    }

    @Override
    public long totalCount() {
        long total = 0;
        for (ChannelLedger ledger : ledgers.values()) {
            total += ledger.count();
        }
        return total;
    }

    @Override
    public StoreStatistics statistics() {
        Map<String, ChannelStatistics> channels = new LinkedHashMap<>();
        for (String channelId : channelOrder) {
            ChannelLedger ledger = ledgers.get(channelId);
            if (ledger != null) {
                channels.put(channelId, ledger.statistics());
            }
        }
        long start = sessionStartMillis;
        double duration = (System.currentTimeMillis() - start) / 1000.0;
        return new StoreStatistics(globalFirstTimestamp.get(), start, duration, channels);
    }

    @Override
    public synchronized void clear() {
        int channels = ledgers.size();
        ledgers.clear();
        channelOrder.clear();
        globalFirstTimestamp.set(null);
        sessionStartMillis = System.currentTimeMillis();
        log.info("Telemetry store cleared ({} channels dropped).", channels);
    }

    public long getSessionStartMillis() { return sessionStartMillis; }
}
