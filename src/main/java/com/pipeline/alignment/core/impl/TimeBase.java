package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.storage.LedgerSnapshot;

/**
 * 构建所用的时间基。
 *
 * 正常情况下直接使用点上记录的经过时间；经过时间异常（跨度超出合理上限）时，
 * 改为由绝对时间戳推算：elapsed = originElapsed + (timestamp - originTimestamp) / 1e9。
 * 同一次构建中所有通道的快照使用同一个时间基，保证各列与网格对齐。
 */
public final class TimeBase {

    private static final TimeBase RECORDED = new TimeBase(false, 0L, 0.0);

    private final boolean reprojected;
    private final long originTimestamp;
    private final double originElapsed;

    private TimeBase(boolean reprojected, long originTimestamp, double originElapsed) {
        this.reprojected = reprojected;
        this.originTimestamp = originTimestamp;
        this.originElapsed = originElapsed;
    }

    /** 使用点上记录的经过时间 */
    public static TimeBase recorded() {
        return RECORDED;
    }

    /** 以给定时间戳对应 originElapsed，由绝对时间戳推算经过时间 */
    public static TimeBase anchoredAt(long originTimestamp, double originElapsed) {
        return new TimeBase(true, originTimestamp, originElapsed);
    }

    public double elapsedOf(Point point) {
        if (!reprojected) {
            return point.getElapsed();
        }
        return originElapsed + (point.getTimestamp() - originTimestamp) / 1e9;
    }

    public LedgerSnapshot apply(LedgerSnapshot snapshot) {
        return reprojected ? snapshot.reproject(this::elapsedOf) : snapshot;
    }

    public boolean isReprojected() { return reprojected; }
    public long getOriginTimestamp() { return originTimestamp; }
    public double getOriginElapsed() { return originElapsed; }

    @Override
    public String toString() {
        return reprojected
                ? "TimeBase{anchored at " + originTimestamp + "ns = " + originElapsed + "s}"
                : "TimeBase{recorded}";
    }
}
