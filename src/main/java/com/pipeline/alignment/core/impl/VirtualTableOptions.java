package com.pipeline.alignment.core.impl;

/**
 * 虚拟表构建参数。各项均有默认值，可链式覆盖。
 */
public class VirtualTableOptions {

    /** 经过时间跨度的合理上限（秒），默认24小时 */
    private double plausibleSpanSeconds = 86400.0;

    /** 单通道快照点数上限，只取最近的点 */
    private int snapshotMaxPoints = 100_000;

    /** 首次构建最多生成的行数，超出部分由后续增量构建追赶 */
    private int buildMaxRows = 1_000_000;

    /** 单次增量构建最多生成的行数 */
    private int rebuildMaxRows = 10_000;

    /** 大规模构建的进度诊断间隔（行） */
    private int progressInterval = 10_000;

    /** 同步列绝对时间戳匹配容差（纳秒），默认1微秒 */
    private long syncToleranceNs = 1_000L;

    private BurstPolicy burstPolicy = new BurstPolicy(1000, 10);

    /** 连续失败时每隔多少次输出一次诊断 */
    private int diagnosticsLogEvery = 100;

    /** 参考通道缺失的连续失败次数达到该值后升级为 ERROR */
    private int diagnosticsEscalateAfter = 50;

    public static VirtualTableOptions defaults() {
        return new VirtualTableOptions();
    }

    public VirtualTableOptions plausibleSpanSeconds(double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("plausibleSpanSeconds must be a positive finite number, got " + value);
        }
        this.plausibleSpanSeconds = value;
        return this;
    }

    public VirtualTableOptions snapshotMaxPoints(int value) {
        this.snapshotMaxPoints = requirePositive("snapshotMaxPoints", value);
        return this;
    }

    public VirtualTableOptions buildMaxRows(int value) {
        this.buildMaxRows = requirePositive("buildMaxRows", value);
        return this;
    }

    public VirtualTableOptions rebuildMaxRows(int value) {
        this.rebuildMaxRows = requirePositive("rebuildMaxRows", value);
        return this;
    }

    public VirtualTableOptions progressInterval(int value) {
        this.progressInterval = requirePositive("progressInterval", value);
        return this;
    }

    public VirtualTableOptions syncToleranceNs(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("syncToleranceNs must not be negative, got " + value);
        }
        this.syncToleranceNs = value;
        return this;
    }

    public VirtualTableOptions burstPolicy(BurstPolicy value) {
        this.burstPolicy = value != null ? value : BurstPolicy.disabled();
        return this;
    }

    public VirtualTableOptions diagnosticsLogEvery(int value) {
        this.diagnosticsLogEvery = requirePositive("diagnosticsLogEvery", value);
        return this;
    }

    public VirtualTableOptions diagnosticsEscalateAfter(int value) {
        this.diagnosticsEscalateAfter = requirePositive("diagnosticsEscalateAfter", value);
        return this;
    }

    private static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    public double getPlausibleSpanSeconds() { return plausibleSpanSeconds; }
    public int getSnapshotMaxPoints() { return snapshotMaxPoints; }
    public int getBuildMaxRows() { return buildMaxRows; }
    public int getRebuildMaxRows() { return rebuildMaxRows; }
    public int getProgressInterval() { return progressInterval; }
    public long getSyncToleranceNs() { return syncToleranceNs; }
    public BurstPolicy getBurstPolicy() { return burstPolicy; }
    public int getDiagnosticsLogEvery() { return diagnosticsLogEvery; }
    public int getDiagnosticsEscalateAfter() { return diagnosticsEscalateAfter; }
}
