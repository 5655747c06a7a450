package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.core.TelemetryStore;
import com.pipeline.alignment.core.VirtualTable;
import com.pipeline.alignment.model.ColumnSpec;
import com.pipeline.alignment.model.DiagnosisReport;
import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.storage.ChannelLedger;
import com.pipeline.alignment.storage.LedgerSnapshot;

/**
 * 遥测存储与虚拟表的离线诊断工具，用于排查构建缓慢或数据异常。
 * 只读，不修改任何状态。
 */
public class TelemetryInspector {

    /** 纳秒级 Unix 时间戳的下限（约 1970-01-12），更小的值多半单位不对 */
    private static final long MIN_EPOCH_NANOS = 1_000_000_000_000_000L;

    /** 单点经过时间的合理上限（秒），一年 */
    private static final double MAX_POINT_ELAPSED = 86400.0 * 365;

    private final int maxSnapshotPoints;
    private final long maxEstimatedRows;

    public TelemetryInspector() {
        this(100_000, 100_000L);
    }

    public TelemetryInspector(int maxSnapshotPoints, long maxEstimatedRows) {
        this.maxSnapshotPoints = maxSnapshotPoints;
        this.maxEstimatedRows = maxEstimatedRows;
    }

    /**
     * 检查存储：计数与序列不一致、通道过大、时间戳倒置。
     */
    public DiagnosisReport diagnoseStore(TelemetryStore store) {
        DiagnosisReport report = new DiagnosisReport();
        report.putMetric("totalChannels", store.channelIds().size());
        report.putMetric("totalPoints", store.totalCount());

        for (String channelId : store.channelIds()) {
            ChannelLedger ledger = store.ledger(channelId);
            if (ledger == null) {
                report.addIssue("Channel " + channelId + " is listed but has no ledger");
                continue;
            }

            LedgerSnapshot snapshot = ledger.snapshot();
            if (!snapshot.isConsistent()) {
                report.addWarning("Channel " + channelId + ": count (" + snapshot.getReportedCount()
                        + ") != sequence length (" + snapshot.size() + ")");
            }
            if (snapshot.size() > maxSnapshotPoints) {
                report.addWarning("Channel " + channelId + " has " + snapshot.size()
                        + " points - may cause performance issues");
            }

            Long first = ledger.firstTimestamp();
            Long last = ledger.lastTimestamp();
            if (first != null && last != null && last < first) {
                report.addIssue("Channel " + channelId + ": last timestamp < first timestamp");
            }
        }
        return report;
    }

    /**
     * 检查虚拟表的构建条件：参考通道、估算行数、列引用的通道。
     */
    public DiagnosisReport diagnoseTable(VirtualTable table, TelemetryStore store) {
        DiagnosisReport report = new DiagnosisReport();
        String referenceId = table.referenceChannelId();
        report.putMetric("referenceChannel", referenceId);
        report.putMetric("samplingRate", table.samplingRate());
        report.putMetric("columns", table.columns().size());
        report.putMetric("built", table.isBuilt());
        report.putMetric("rowCount", table.rowCount());
        report.putMetric("lastBuiltTime", table.lastBuiltTime());

        if (!(table.samplingRate() > 0)) {
            report.addIssue("Sampling rate must be positive, got " + table.samplingRate());
        }

        ChannelLedger reference = store.ledger(referenceId);
        if (reference == null) {
            report.addIssue("Reference channel '" + referenceId + "' not found");
        } else {
            LedgerSnapshot snapshot = reference.snapshot();
            report.putMetric("referenceChannelCount", snapshot.size());
            if (snapshot.size() > maxSnapshotPoints) {
                report.addWarning("Reference channel has " + snapshot.size()
                        + " points, exceeds max snapshot size (" + maxSnapshotPoints + ")");
            }
            if (!snapshot.isEmpty()) {
                double span = snapshot.last().getElapsed() - snapshot.first().getElapsed();
                report.putMetric("timeSpan", span);
                if (table.samplingRate() > 0) {
                    long estimatedRows = (long) (span * table.samplingRate()) + 1;
                    report.putMetric("estimatedRows", estimatedRows);
                    if (estimatedRows > maxEstimatedRows) {
                        report.addWarning("Estimated rows (" + estimatedRows + ") is very large - build may be slow");
                    }
                }
            } else {
                report.addIssue("Reference channel '" + referenceId + "' is empty");
            }
        }

        for (ColumnSpec column : table.columns()) {
            if (column.isComputed()) {
                continue;
            }
            ChannelLedger ledger = store.ledger(column.getChannelId());
            if (ledger == null) {
                report.addWarning("Channel " + column.getChannelId() + " for column '" + column.getName()
                        + "' not found in store");
            } else if (ledger.count() > maxSnapshotPoints) {
                report.addWarning("Channel " + column.getChannelId() + " has " + ledger.count()
                        + " points, exceeds max snapshot size (" + maxSnapshotPoints + ")");
            }
        }
        return report;
    }

    /**
     * 检查单个数据点的时间戳、经过时间与取值。
     */
    public DiagnosisReport validatePoint(Point point) {
        DiagnosisReport report = new DiagnosisReport();
        if (point.getTimestamp() <= 0) {
            report.addIssue("Invalid timestamp: " + point.getTimestamp());
        } else if (point.getTimestamp() < MIN_EPOCH_NANOS) {
            report.addIssue("Timestamp " + point.getTimestamp() + " seems too small for nanoseconds since 1970");
        }
        if (!Double.isFinite(point.getElapsed())) {
            report.addIssue("Non-finite elapsed time: " + point.getElapsed());
        } else if (point.getElapsed() < 0) {
            report.addIssue("Negative elapsed time: " + point.getElapsed());
        } else if (point.getElapsed() > MAX_POINT_ELAPSED) {
            report.addIssue("Elapsed time " + point.getElapsed() + " seems unreasonably large");
        }
        if (point.getValue().isMissing()) {
            report.addWarning("Data point value is missing");
        }
        return report;
    }
}
