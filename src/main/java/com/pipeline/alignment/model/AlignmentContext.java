package com.pipeline.alignment.model;

/**
 * 单个网格时刻的对齐上下文，由表构建器逐行生成并传给各对齐策略。
 */
public final class AlignmentContext {
    /** 网格时刻（经过时间，秒） */
    private final double targetElapsed;
    /** 参考通道在该时刻的锚点；未找到时为null */
    private final Point anchor;
    /** 插值/就近匹配的时间容差（秒） */
    private final double searchTolerance;
    /** 同步列绝对时间戳匹配容差（纳秒） */
    private final long syncToleranceNs;

    public AlignmentContext(double targetElapsed, Point anchor, double searchTolerance, long syncToleranceNs) {
        this.targetElapsed = targetElapsed;
        this.anchor = anchor;
        this.searchTolerance = searchTolerance;
        this.syncToleranceNs = syncToleranceNs;
    }

    public double getTargetElapsed() { return targetElapsed; }
    public Point getAnchor() { return anchor; }
    public double getSearchTolerance() { return searchTolerance; }
    public long getSyncToleranceNs() { return syncToleranceNs; }
}
