package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.core.DiagnosticSink;
import com.pipeline.alignment.core.RowSink;
import com.pipeline.alignment.core.TelemetryStore;
import com.pipeline.alignment.core.VirtualTable;
import com.pipeline.alignment.model.BuildResult;
import com.pipeline.alignment.model.DiagnosticLevel;
import com.pipeline.alignment.model.VirtualRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 采样会话 —— 将一个遥测存储与一张虚拟表串成一个轮询循环。
 *
 * 调用方在自己的调度线程中周期性调用 {@link #poll(RowSink)}，本类不创建任何线程。每一轮：
 * 1. 增量构建虚拟表
 * 2. 把尚未投递的行交给 {@link RowSink} 持久化
 * 3. 接收端正常返回后推进投递序号，并把表裁剪到 retainRows 行
 * 4. 按保留时长与单通道上限裁剪遥测存储
 *
 * 接收端抛出异常时本轮不推进、不裁剪，这些行在下一轮重新投递。
 */
public class SamplingSession {

    private static final Logger log = LoggerFactory.getLogger(SamplingSession.class);

    private final TelemetryStore store;
    private final VirtualTable table;
    private final DiagnosticSink sink;

    /** 表中保留的已投递行数 */
    private final int retainRows;
    /** 存储中保留的经过时间窗口（秒），相对水位线；小于等于0表示不按时间裁剪 */
    private final double storeRetentionSeconds;
    /** 存储单通道最多保留点数 */
    private final int storeMaxPoints;

    /** 下一个待投递的网格序号 */
    private long nextIndex;
    private long deliveredRows;
    private BuildResult lastBuildResult;

    public SamplingSession(TelemetryStore store, VirtualTable table, DiagnosticSink sink,
                           int retainRows, double storeRetentionSeconds, int storeMaxPoints) {
        this.store = Objects.requireNonNull(store, "store");
        this.table = Objects.requireNonNull(table, "table");
        if (retainRows < 0) {
            throw new IllegalArgumentException("retainRows must not be negative, got " + retainRows);
        }
        if (storeMaxPoints <= 0) {
            throw new IllegalArgumentException("storeMaxPoints must be positive, got " + storeMaxPoints);
        }
        this.sink = GuardedDiagnosticSink.wrap(sink);
        this.retainRows = retainRows;
        this.storeRetentionSeconds = storeRetentionSeconds;
        this.storeMaxPoints = storeMaxPoints;
    }

    /**
     * 采集层写入入口，直接转发给存储
     */
    public void ingest(String channelId, Object value, long timestampNs) {
        store.addPoint(channelId, value, timestampNs);
    }

    /**
     * 执行一轮构建与投递。
     *
     * @param rowSink 持久化接收端
     * @return 本轮投递的行数
     */
    public int poll(RowSink rowSink) {
        Objects.requireNonNull(rowSink, "rowSink");
        lastBuildResult = table.rebuild();

        List<VirtualRow> pending = table.rowsFrom(nextIndex);
        if (pending.isEmpty()) {
            return 0;
        }

        try {
            rowSink.accept(pending);
        } catch (Exception e) {
            sink.report("Row sink failed to persist " + pending.size() + " rows starting at index "
                    + pending.get(0).getIndex() + ": " + e.getMessage(), DiagnosticLevel.ERROR);
            log.debug("Row sink failure detail", e);
            return 0;
        }

        nextIndex = pending.get(pending.size() - 1).getIndex() + 1;
        deliveredRows += pending.size();

        int prunedRows = table.pruneRows(retainRows);
        Map<String, Integer> prunedPoints = pruneStore();
        if (prunedRows > 0 || !prunedPoints.isEmpty()) {
            log.debug("Delivered {} rows; pruned {} rows and points from {} channels.",
                    pending.size(), prunedRows, prunedPoints.size());
        }
        return pending.size();
    }

    private Map<String, Integer> pruneStore() {
        Double watermark = table.lastBuiltTime();
        // 下一次增量构建还要读取的点不裁剪，点数上限可以暂时被突破
        Double floor = table.retentionFloor();
        double protectFrom = floor != null ? floor : Double.POSITIVE_INFINITY;
        double minElapsed = Double.NEGATIVE_INFINITY;
        if (storeRetentionSeconds > 0 && watermark != null) {
            minElapsed = Math.min(watermark - storeRetentionSeconds, protectFrom);
        }
        return store.prune(minElapsed, storeMaxPoints, protectFrom);
    }

    /**
     * @return 表中已投递、可安全裁剪的行数（超出保留量的部分）
     */
    public int prunableRowCount() {
        int undelivered = table.rowsFrom(nextIndex).size();
        int delivered = table.rowCount() - undelivered;
        return Math.max(0, delivered - retainRows);
    }

    /**
     * 清空存储与虚拟表，开始新的会话
     */
    public void reset() {
        table.clear();
        store.clear();
        nextIndex = 0;
        deliveredRows = 0;
        lastBuildResult = null;
        log.info("Sampling session reset.");
    }

    public long deliveredRows() { return deliveredRows; }
    public long nextIndex() { return nextIndex; }
    public BuildResult lastBuildResult() { return lastBuildResult; }
    public TelemetryStore getStore() { return store; }
    public VirtualTable getTable() { return table; }
}
