package com.pipeline.alignment.model;

import java.io.Serializable;

/**
 * 虚拟表统计信息
 */
public class TableStatistics implements Serializable {
    private final int rowCount;
    private final double samplingRate;
    private final Double firstTimestamp;
    private final Double lastTimestamp;
    private final double timeSpan;
    private final long expectedRows;
    private final double coverage;

    public TableStatistics(int rowCount, double samplingRate, Double firstTimestamp, Double lastTimestamp) {
        this.rowCount = rowCount;
        this.samplingRate = samplingRate;
        this.firstTimestamp = firstTimestamp;
        this.lastTimestamp = lastTimestamp;
        this.timeSpan = (firstTimestamp != null && lastTimestamp != null) ? lastTimestamp - firstTimestamp : 0.0;
        this.expectedRows = rowCount > 0 ? (long) (timeSpan * samplingRate) : 0L;
        this.coverage = expectedRows > 0 ? (double) rowCount / expectedRows : 0.0;
    }

    public int getRowCount() { return rowCount; }
    public double getSamplingRate() { return samplingRate; }
    public Double getFirstTimestamp() { return firstTimestamp; }
    public Double getLastTimestamp() { return lastTimestamp; }
    public double getTimeSpan() { return timeSpan; }
    public long getExpectedRows() { return expectedRows; }
    public double getCoverage() { return coverage; }

    @Override
    public String toString() {
        return "TableStatistics{rows=" + rowCount + ", timeSpan=" + timeSpan
                + "s, rate=" + samplingRate + "Hz, coverage=" + coverage + "}";
    }
}
