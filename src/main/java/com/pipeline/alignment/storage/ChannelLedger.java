package com.pipeline.alignment.storage;

import com.pipeline.alignment.model.ChannelStatistics;
import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.model.PointValue;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * 单个通道的观测点账本。
 *
 * 按写入顺序（即时间顺序）保存数据点，只在尾部追加、只从头部裁剪。
 * ArrayDeque 在迭代期间不允许并发修改，因此写入、裁剪与快照创建都在账本自身的监视器内完成；
 * 查询一律先取 {@link LedgerSnapshot} 再在快照上计算，锁只覆盖复制过程。
 */
public class ChannelLedger {

    private final String channelId;

    /** 有序数据点（按写入顺序） */
    private final ArrayDeque<Point> points = new ArrayDeque<>();

    private Long firstTimestamp;
    private Long lastTimestamp;
    /**
     * 点数，由写入与裁剪各自记账，不从序列长度推导。
     * 快照同时携带它与复制出的点，两者不一致即说明记账出错，构建据此判为结构错误；正常运行时始终相等。
     */
    private int count;

    /** 累计写入点数，裁剪不回退 */
    private long appendedCount;

    public ChannelLedger(String channelId) {
        this.channelId = channelId;
    }

    public String getChannelId() { return channelId; }

    // ==================== 写入 ====================

    /**
     * 追加一个数据点。
     *
     * 经过时间的参考时刻：有全局参考时间戳时用全局参考，否则用本通道的首个时间戳；
     * 时间戳无效（小于等于0）时总是用本通道的首个时间戳，避免无效样本与有效的全局参考混算出负值。
     *
     * @param value           取值
     * @param timestamp       绝对时间戳（纳秒）
     * @param globalReference 全局参考时间戳；尚未确定时为null
     */
    public synchronized void addPoint(PointValue value, long timestamp, Long globalReference) {
        if (firstTimestamp == null) {
            firstTimestamp = timestamp;
        }
        lastTimestamp = timestamp;

        long reference;
        if (timestamp <= 0 || globalReference == null) {
            reference = firstTimestamp;
        } else {
            reference = globalReference;
        }

        double elapsed = (timestamp - reference) / 1e9;
        points.addLast(new Point(value, timestamp, elapsed));
        count++;
        appendedCount++;
    }

    // ==================== 快照 ====================

    /**
     * 全量快照
     */
    public synchronized LedgerSnapshot snapshot() {
        return new LedgerSnapshot(channelId, points.toArray(new Point[0]), count);
    }

    /**
     * 最近 maxPoints 个点的快照，用于限制单次构建的工作集大小
     */
    public synchronized LedgerSnapshot snapshotTail(int maxPoints) {
        int take = Math.max(0, Math.min(maxPoints, points.size()));
        if (take == points.size()) {
            return new LedgerSnapshot(channelId, points.toArray(new Point[0]), count);
        }
        Point[] result = new Point[take];
        Iterator<Point> it = points.descendingIterator();
        for (int i = take - 1; i >= 0; i--) {
            result[i] = it.next();
        }
        return new LedgerSnapshot(channelId, result, take + (count - points.size()));
    }

    /**
     * 窗口快照：从满足 keep 的最早的点开始，按时间顺序最多取 maxPoints 个点。
     * keep 应随时间单调（如经过时间不早于某阈值），从最新的点向前判定，遇到第一个不满足的点即停止。
     * 窗口内的点超过上限时只保留较早的部分，并把快照标记为截断，调用方据此把本次处理范围限制在快照末点之前。
     */
    public synchronized LedgerSnapshot snapshotSince(Predicate<Point> keep, int maxPoints) {
        int matching = 0;
        Iterator<Point> back = points.descendingIterator();
        while (back.hasNext() && keep.test(back.next())) {
            matching++;
        }
        int take = Math.min(matching, Math.max(0, maxPoints));
        if (take == points.size()) {
            return new LedgerSnapshot(channelId, points.toArray(new Point[0]), count);
        }

        Point[] result = new Point[take];
        Iterator<Point> it = points.iterator();
        for (int skip = points.size() - matching; skip > 0; skip--) {
            it.next();
        }
        for (int i = 0; i < take; i++) {
            result[i] = it.next();
        }
        // 窗口快照只代表一段，报告点数按同样的截取量折算，保留计数与序列之间的差异
        return new LedgerSnapshot(channelId, result, take + (count - points.size()), matching > take);
    }

    // ==================== 查询（均经由快照） ====================

    public Point nearestPoint(double targetElapsed, double tolerance) {
        return snapshot().nearest(targetElapsed, tolerance);
    }

    public List<Point> pointsInRange(double startElapsed, double endElapsed) {
        return snapshot().range(startElapsed, endElapsed);
    }

    // ==================== 裁剪 ====================

    /**
     * 从最旧端移除经过时间早于阈值的点。
     *
     * @return 移除的点数
     */
    public synchronized int pruneOlderThan(double minElapsed) {
        int removed = 0;
        while (!points.isEmpty() && points.peekFirst().getElapsed() < minElapsed) {
            points.pollFirst();
            removed++;
        }
        if (removed > 0) {
            afterRemoval(removed);
        }
        return removed;
    }

    /**
     * 点数超过上限时从最旧端截断。
     *
     * @return 移除的点数
     */
    public int trimToMaxPoints(int maxPoints) {
        return trimToMaxPoints(maxPoints, Double.POSITIVE_INFINITY);
    }

    /**
     * 点数超过上限时从最旧端截断，但不移除经过时间不早于 protectFromElapsed 的点。
     * 这些点仍可能被增量构建读取，此时通道可以暂时超出上限。
     *
     * @return 移除的点数
     */
    public synchronized int trimToMaxPoints(int maxPoints, double protectFromElapsed) {
        int limit = Math.max(0, maxPoints);
        int removed = 0;
        while (points.size() > limit && points.peekFirst().getElapsed() < protectFromElapsed) {
            points.pollFirst();
            removed++;
        }
        if (removed > 0) {
            afterRemoval(removed);
        }
        return removed;
    }

    private void afterRemoval(int removed) {
        count -= removed;
        if (points.isEmpty()) {
            firstTimestamp = null;
            lastTimestamp = null;
        } else {
            firstTimestamp = points.peekFirst().getTimestamp();
        }
    }

    // ==================== 状态 ====================

    public synchronized int count() { return count; }
    public synchronized boolean isEmpty() { return count == 0; }
    public synchronized long appendedCount() { return appendedCount; }
    public synchronized Long firstTimestamp() { return firstTimestamp; }
    public synchronized Long lastTimestamp() { return lastTimestamp; }

    public synchronized ChannelStatistics statistics() {
        return new ChannelStatistics(channelId, count, firstTimestamp, lastTimestamp);
    }

    @Override
    public String toString() {
        return "ChannelLedger{channel='" + channelId + "', count=" + count() + "}";
    }
}
