package com.pipeline.alignment.storage;

import com.pipeline.alignment.model.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * 通道账本的不可变快照。
 *
 * 所有读路径（就近查询、区间查询、插值前后点查找、同步时间戳匹配）都基于快照完成，
 * 快照在账本锁内一次性复制，之后的二分查找不受采集线程并发写入影响。
 *
 * 小数据量使用线性扫描，大数据量且有序时使用二分查找；
 * 若快照内的经过时间或时间戳并非单调（乱序到达、无效时间戳），自动退回线性扫描。
 * 距离相等的两个候选点取较早的一个。
 */
public final class LedgerSnapshot {

    /** 就近查询改用二分查找的点数阈值 */
    static final int NEAREST_LINEAR_LIMIT = 50;
    /** 区间查询改用二分查找的点数阈值 */
    static final int RANGE_LINEAR_LIMIT = 100;

    private final String channelId;
    private final Point[] points;
    /** 快照时刻账本报告的点数，用于结构一致性校验 */
    private final int reportedCount;
    /** 账本中还有满足窗口条件、晚于末点的点，快照因点数上限被截断 */
    private final boolean truncated;
    private final boolean elapsedOrdered;
    private final boolean timestampOrdered;

    LedgerSnapshot(String channelId, Point[] points, int reportedCount) {
        this(channelId, points, reportedCount, false);
    }

    LedgerSnapshot(String channelId, Point[] points, int reportedCount, boolean truncated) {
        this.channelId = channelId;
        this.points = points;
        this.reportedCount = reportedCount;
        this.truncated = truncated;

        boolean byElapsed = true;
        boolean byTimestamp = true;
        for (int i = 1; i < points.length && (byElapsed || byTimestamp); i++) {
            if (points[i].getElapsed() < points[i - 1].getElapsed()) {
                byElapsed = false;
            }
            if (points[i].getTimestamp() < points[i - 1].getTimestamp()) {
                byTimestamp = false;
            }
        }
        this.elapsedOrdered = byElapsed;
        this.timestampOrdered = byTimestamp;
    }

    /**
     * 由现成的点列表构造快照（测试及离线数据使用）
     */
    public static LedgerSnapshot of(String channelId, List<Point> points) {
        Point[] copy = points.toArray(new Point[0]);
        return new LedgerSnapshot(channelId, copy, copy.length);
    }

    public static LedgerSnapshot empty(String channelId) {
        return new LedgerSnapshot(channelId, new Point[0], 0);
    }

    public String getChannelId() { return channelId; }
    public int size() { return points.length; }
    public boolean isEmpty() { return points.length == 0; }
    public int getReportedCount() { return reportedCount; }

    /**
     * 快照点数与账本报告的点数是否一致。
     * 账本的计数与点序列分别维护，快照在同一把锁内同时读取两者，
     * 计数记账出错时在这里暴露为结构错误，而不是生成错误的行。
     */
    public boolean isConsistent() { return reportedCount == points.length; }

    public boolean isTruncated() { return truncated; }

    public Point get(int index) { return points[index]; }

    public Point first() { return points.length > 0 ? points[0] : null; }

    public Point last() { return points.length > 0 ? points[points.length - 1] : null; }

    public List<Point> points() {
        return Collections.unmodifiableList(Arrays.asList(points));
    }

    /**
     * 按给定函数重新计算每个点的经过时间，返回新的快照。
     * 用于经过时间异常时改由绝对时间戳推算的时间基。
     */
    public LedgerSnapshot reproject(ToDoubleFunction<Point> elapsedOf) {
        Point[] projected = new Point[points.length];
        for (int i = 0; i < points.length; i++) {
            projected[i] = points[i].withElapsed(elapsedOf.applyAsDouble(points[i]));
        }
        return new LedgerSnapshot(channelId, projected, reportedCount, truncated);
    }

    // ==================== 就近查询 ====================

    /**
     * 查找经过时间最接近目标且在容差内的点。
     *
     * @return 最近点；容差内无数据时返回null
     */
    public Point nearest(double targetElapsed, double tolerance) {
        if (points.length == 0) {
            return null;
        }
        if (points.length < NEAREST_LINEAR_LIMIT || !elapsedOrdered) {
            return nearestLinear(targetElapsed, tolerance);
        }

        int idx = lowerBound(targetElapsed);
        Point closest = null;
        double minDiff = Double.POSITIVE_INFINITY;

        // 先检查较早一侧，保证等距时较早的点胜出
        if (idx > 0) {
            Point before = points[lowerBound(points[idx - 1].getElapsed())];
            double diff = Math.abs(before.getElapsed() - targetElapsed);
            if (diff <= tolerance) {
                closest = before;
                minDiff = diff;
            }
        }
        if (idx < points.length) {
            Point after = points[idx];
            double diff = Math.abs(after.getElapsed() - targetElapsed);
            if (diff < minDiff && diff <= tolerance) {
                closest = after;
            }
        }
        return closest;
    }

    private Point nearestLinear(double targetElapsed, double tolerance) {
        Point closest = null;
        double minDiff = Double.POSITIVE_INFINITY;
        for (Point point : points) {
            double diff = Math.abs(point.getElapsed() - targetElapsed);
            if (diff < minDiff && diff <= tolerance) {
                minDiff = diff;
                closest = point;
            }
        }
        return closest;
    }

    // ==================== 区间查询 ====================

    /**
     * 经过时间落在 [start, end] 内的连续点。
     */
    public List<Point> range(double startElapsed, double endElapsed) {
        if (points.length == 0 || endElapsed < startElapsed) {
            return Collections.emptyList();
        }
        if (points.length < RANGE_LINEAR_LIMIT || !elapsedOrdered) {
            List<Point> result = new ArrayList<>();
            for (Point point : points) {
                if (point.getElapsed() >= startElapsed && point.getElapsed() <= endElapsed) {
                    result.add(point);
                }
            }
            return result;
        }
        int from = lowerBound(startElapsed);
        int to = upperBound(endElapsed);
        if (from >= to) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(Arrays.asList(Arrays.copyOfRange(points, from, to)));
    }

    // ==================== 前后点查找 ====================

    /**
     * 查找目标时刻前后的点：before 为经过时间不晚于目标的最近点，after 为晚于目标的最近点，
     * 两者都必须在容差内，否则对应一侧为null。
     */
    public Bracket bracket(double targetElapsed, double tolerance) {
        if (points.length == 0) {
            return Bracket.EMPTY;
        }

        Point before = null;
        Point after = null;
        if (points.length < NEAREST_LINEAR_LIMIT || !elapsedOrdered) {
            double beforeDiff = Double.POSITIVE_INFINITY;
            double afterDiff = Double.POSITIVE_INFINITY;
            for (Point point : points) {
                double diff = point.getElapsed() - targetElapsed;
                if (diff <= 0) {
                    if (-diff < beforeDiff) {
                        beforeDiff = -diff;
                        before = point;
                    }
                } else if (diff < afterDiff) {
                    afterDiff = diff;
                    after = point;
                }
            }
        } else {
            int upper = upperBound(targetElapsed);
            if (upper > 0) {
                before = points[lowerBound(points[upper - 1].getElapsed())];
            }
            if (upper < points.length) {
                after = points[upper];
            }
        }

        if (before != null && targetElapsed - before.getElapsed() > tolerance) {
            before = null;
        }
        if (after != null && after.getElapsed() - targetElapsed > tolerance) {
            after = null;
        }
        if (before == null && after == null) {
            return Bracket.EMPTY;
        }
        return new Bracket(before, after);
    }

    // ==================== 绝对时间戳匹配 ====================

    /**
     * 查找绝对时间戳与目标相差不超过容差的点，取差值最小者，等距取较早者。
     *
     * @param timestamp   目标绝对时间戳（纳秒）
     * @param toleranceNs 容差（纳秒）
     * @return 匹配点；无匹配返回null
     */
    public Point matchTimestamp(long timestamp, long toleranceNs) {
        if (points.length == 0) {
            return null;
        }
        if (points.length < NEAREST_LINEAR_LIMIT || !timestampOrdered) {
            Point closest = null;
            long minDiff = Long.MAX_VALUE;
            for (Point point : points) {
                long diff = Math.abs(point.getTimestamp() - timestamp);
                if (diff < minDiff && diff <= toleranceNs) {
                    minDiff = diff;
                    closest = point;
                }
            }
            return closest;
        }

        int lo = 0;
        int hi = points.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (points[mid].getTimestamp() < timestamp) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }

        Point closest = null;
        long minDiff = Long.MAX_VALUE;
        if (lo > 0) {
            // 回退到相同时间戳的第一个点
            int before = lo - 1;
            while (before > 0 && points[before - 1].getTimestamp() == points[before].getTimestamp()) {
                before--;
            }
            long diff = Math.abs(points[before].getTimestamp() - timestamp);
            if (diff <= toleranceNs) {
                closest = points[before];
                minDiff = diff;
            }
        }
        if (lo < points.length) {
            long diff = Math.abs(points[lo].getTimestamp() - timestamp);
            if (diff < minDiff && diff <= toleranceNs) {
                closest = points[lo];
            }
        }
        return closest;
    }

    // ==================== 二分查找辅助 ====================

    /** 第一个经过时间不小于 value 的下标 */
    private int lowerBound(double value) {
        int lo = 0;
        int hi = points.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (points[mid].getElapsed() < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** 第一个经过时间大于 value 的下标 */
    private int upperBound(double value) {
        int lo = 0;
        int hi = points.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (points[mid].getElapsed() <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * 目标时刻前后的一对点
     */
    public static final class Bracket {
        static final Bracket EMPTY = new Bracket(null, null);

        private final Point before;
        private final Point after;

        Bracket(Point before, Point after) {
            this.before = before;
            this.after = after;
        }

        public Point getBefore() { return before; }
        public Point getAfter() { return after; }
        public boolean isEmpty() { return before == null && after == null; }
        public boolean isComplete() { return before != null && after != null; }
    }
}
