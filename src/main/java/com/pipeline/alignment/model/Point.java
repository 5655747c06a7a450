package com.pipeline.alignment.model;

import java.io.Serializable;

/**
 * 单个观测点：取值 + 绝对时间戳（纳秒）+ 相对会话参考时刻的经过时间（秒）
 */
public final class Point implements Serializable {
    private final PointValue value;
    private final long timestamp;
    private final double elapsed;

    public Point(PointValue value, long timestamp, double elapsed) {
        this.value = value != null ? value : PointValue.missing();
        this.timestamp = timestamp;
        this.elapsed = elapsed;
    }

    public PointValue getValue() { return value; }
    public long getTimestamp() { return timestamp; }
    public double getElapsed() { return elapsed; }

    /**
     * 以新的经过时间复制该点（时间基重投影时使用）
     */
    public Point withElapsed(double newElapsed) {
        return new Point(value, timestamp, newElapsed);
    }

    @Override
    public String toString() {
        return "Point{value=" + value + ", timestamp=" + timestamp + ", elapsed=" + elapsed + "}";
    }
}
