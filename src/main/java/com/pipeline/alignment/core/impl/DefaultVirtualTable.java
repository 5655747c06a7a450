package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.core.AlignmentStrategy;
import com.pipeline.alignment.core.DiagnosticSink;
import com.pipeline.alignment.core.TelemetryStore;
import com.pipeline.alignment.core.VirtualTable;
import com.pipeline.alignment.model.AlignmentContext;
import com.pipeline.alignment.model.BuildResult;
import com.pipeline.alignment.model.BuildStatus;
import com.pipeline.alignment.model.ChannelPolicy;
import com.pipeline.alignment.model.ColumnSpec;
import com.pipeline.alignment.model.ConversionResult;
import com.pipeline.alignment.model.DiagnosticLevel;
import com.pipeline.alignment.model.FailureKind;
import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.model.PointValue;
import com.pipeline.alignment.model.TableStatistics;
import com.pipeline.alignment.model.VirtualRow;
import com.pipeline.alignment.operators.AsynchronousAlignment;
import com.pipeline.alignment.operators.InterpolatedAlignment;
import com.pipeline.alignment.operators.SynchronizedAlignment;
import com.pipeline.alignment.storage.ChannelLedger;
import com.pipeline.alignment.storage.LedgerSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * 虚拟表默认实现。
 *
 * 以参考通道的经过时间范围生成规则网格 t_k = origin + k * Δ（Δ = 1 / 采样率），
 * 每一行按列策略从各通道快照中解析取值，再经列转换器输出。
 *
 * 构建流程：
 * 1. 前置检查：采样率非法直接返回配置错误；参考通道无数据记为软失败，限流输出诊断
 * 2. 结构检查：快照点数与账本计数不一致，或末点早于首点，判为结构错误
 * 3. 时间异常保护：经过时间跨度超出合理上限时，改由绝对时间戳重算时间基；仍不合理则判为结构错误
 * 4. 逐行解析：锚点取参考通道 Δ/2 内最近点，同步列按锚点绝对时间戳匹配，
 *    插值列与异步列在 2Δ 窗口内查找，未命中时沿用该列上一次成功解析并转换的值
 * 5. 提交：新行在锁外计算，整体一次性追加，水位线取最后生成的行的时间
 *
 * 增量构建从水位线后的下一个网格序号继续，只截取回看窗口内的数据，沿用状态由最后一行播种。
 * 快照按单通道点数上限从窗口起点向后截取，被截断时本次只生成到截断处，剩余部分留给下一次调用。
 * 表只通过 {@link DiagnosticSink} 输出诊断。
 */
public class DefaultVirtualTable implements VirtualTable {

    /** 网格时刻比较容差（秒） */
    private static final double GRID_EPSILON = 1e-9;

    /** 增量构建回看窗口，单位为网格步长 */
    private static final int LOOK_BACK_STEPS = 4;

    /** 首次构建迭代上限相对估算行数的最小余量 */
    private static final int MIN_ITERATION_SLACK = 10;

    private final TelemetryStore store;
    private final String referenceChannelId;
    private final double samplingRate;
    private final boolean samplingRateValid;
    private final List<ColumnSpec> columns;
    private final List<String> headers;
    /** 列引用的全部通道（去重，保持列顺序） */
    private final Set<String> sourceChannels;
    private final Map<ChannelPolicy, AlignmentStrategy> strategies;
    private final VirtualTableOptions options;
    private final DiagnosticSink sink;
    private final FailureTracker failureTracker;

    // ==================== 行与构建状态 ====================

    private final Object rowLock = new Object();
    private final ArrayList<VirtualRow> rows = new ArrayList<>();
    private volatile boolean built;
    private volatile Double lastBuiltTime;

    /** 最后生成的行，行被裁剪后仍保留，用于增量构建播种沿用状态 */
    private VirtualRow lastRow;
    private long lastGridIndex = -1;
    private double gridOrigin;
    private TimeBase timeBase = TimeBase.recorded();
    /** 以首行为原点、由绝对时间戳推算的备用时间基，增量构建遇到时间异常时切换 */
    private TimeBase recoveryTimeBase;
    /** 上次产出行时参考通道的累计写入点数 */
    private long referenceAppendedAtLastRows;

    private final AtomicLong conversionFailures = new AtomicLong();
    private final Set<String> conversionFailureColumns = ConcurrentHashMap.newKeySet();

    public DefaultVirtualTable(TelemetryStore store, String referenceChannelId, double samplingRate,
                               List<ColumnSpec> columns) {
        this(store, referenceChannelId, samplingRate, columns, new LoggingDiagnosticSink(),
                VirtualTableOptions.defaults());
    }

    public DefaultVirtualTable(TelemetryStore store,
                               String referenceChannelId,
                               double samplingRate,
                               List<ColumnSpec> columns,
                               DiagnosticSink sink,
                               VirtualTableOptions options) {
        this.store = Objects.requireNonNull(store, "store");
        if (referenceChannelId == null || referenceChannelId.isBlank()) {
            throw new IllegalArgumentException("Reference channel id must not be null or blank");
        }
        if (columns == null) {
            throw new IllegalArgumentException("Column list must not be null");
        }

        Set<String> names = new LinkedHashSet<>();
        Set<String> channels = new LinkedHashSet<>();
        for (ColumnSpec column : columns) {
            if (column == null) {
                throw new IllegalArgumentException("Column list must not contain null entries");
            }
            if (!names.add(column.getName())) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
            if (!column.isComputed()) {
                channels.add(column.getChannelId());
            }
        }

        this.referenceChannelId = referenceChannelId;
        this.samplingRate = samplingRate;
        this.samplingRateValid = samplingRate > 0 && !Double.isInfinite(samplingRate);
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.headers = Collections.unmodifiableList(new ArrayList<>(names));
        this.sourceChannels = Collections.unmodifiableSet(channels);
        this.options = options != null ? options : VirtualTableOptions.defaults();
        this.sink = GuardedDiagnosticSink.wrap(sink);
        this.failureTracker = new FailureTracker(this.sink,
                this.options.getDiagnosticsLogEvery(), this.options.getDiagnosticsEscalateAfter());
        this.strategies = defaultStrategies();

        if (!samplingRateValid) {
            this.sink.report("Invalid sampling rate " + samplingRate
                    + " Hz for virtual table on '" + referenceChannelId + "'; builds are disabled",
                    DiagnosticLevel.ERROR);
        }
    }

    private static Map<ChannelPolicy, AlignmentStrategy> defaultStrategies() {
        Map<ChannelPolicy, AlignmentStrategy> map = new EnumMap<>(ChannelPolicy.class);
        for (AlignmentStrategy strategy : List.of(
                new SynchronizedAlignment(), new InterpolatedAlignment(), new AsynchronousAlignment())) {
            map.put(strategy.getPolicy(), strategy);
        }
        return map;
    }

    // ==================== 完整构建 ====================

    @Override
    public BuildResult build() {
        if (!samplingRateValid) {
            return configurationFailure();
        }
        if (built) {
            return BuildResult.of(BuildStatus.UP_TO_DATE, 0);
        }

        ChannelLedger reference = store.ledger(referenceChannelId);
        if (reference == null || reference.isEmpty()) {
            return missingReference();
        }

        long appendedAtSnapshot = reference.appendedCount();
        // 超出点数上限时从最早的点开始取，其余范围留给增量构建
        LedgerSnapshot recorded = reference.snapshotSince(p -> true, options.getSnapshotMaxPoints());
        if (recorded.isEmpty()) {
            return missingReference();
        }
        if (!recorded.isConsistent()) {
            return structuralFailure("Reference channel '" + referenceChannelId + "' reports "
                    + recorded.getReportedCount() + " points but holds " + recorded.size());
        }

        double first = recorded.first().getElapsed();
        double last = recorded.last().getElapsed();
        if (last < first) {
            return structuralFailure(String.format(
                    "Reference channel '%s' last elapsed %.9f precedes first elapsed %.9f",
                    referenceChannelId, last, first));
        }

        TimeBase base = TimeBase.recorded();
        if (!isPlausibleSpan(first, last)) {
            TimeBase candidate = TimeBase.anchoredAt(recorded.first().getTimestamp(), 0.0);
            double correctedFirst = candidate.elapsedOf(recorded.first());
            double correctedLast = candidate.elapsedOf(recorded.last());
            if (correctedLast < correctedFirst || !isPlausibleSpan(correctedFirst, correctedLast)) {
                return structuralFailure(String.format(
                        "Implausible reference span [%s, %s] on '%s' could not be recovered from absolute "
                                + "timestamps (recomputed [%s, %s])",
                        first, last, referenceChannelId, correctedFirst, correctedLast));
            }
            sink.report(String.format(
                    "Timing anomaly on '%s': elapsed span [%s, %s] is implausible, recomputed from absolute "
                            + "timestamps as [%.6f, %.6f]",
                    referenceChannelId, first, last, correctedFirst, correctedLast), DiagnosticLevel.INFO);
            base = candidate;
            first = correctedFirst;
            last = correctedLast;
        }

        double step = 1.0 / samplingRate;
        TimeBase projection = base;
        double windowFrom = first - 2.0 * step;
        LedgerSnapshot referenceSnapshot = base.apply(recorded);
        BuildSnapshot snapshot = BuildSnapshot.capture(store, referenceSnapshot, sourceChannels,
                options.getSnapshotMaxPoints(), p -> projection.elapsedOf(p) >= windowFrom, base);

        double limit = clampToCoverage(last, first, snapshot);
        double span = limit - first;
        Map<String, PointValue> fill = new HashMap<>();
        List<VirtualRow> produced;

        if (last == first) {
            // 全部参考点落在同一时刻，只生成一行
            produced = Collections.singletonList(computeRow(0, first, step, snapshot, fill));
            sink.report("All reference points on '" + referenceChannelId
                    + "' share one instant; built a single row at " + first, DiagnosticLevel.INFO);
        } else {
            long estimated = (long) Math.floor((span + GRID_EPSILON) / step) + 1;
            long iterationCap = estimated + Math.max(MIN_ITERATION_SLACK, estimated / 100);
            int maxRows = (int) Math.min(options.getBuildMaxRows(), iterationCap);

            produced = generateRows(first, 0, maxRows, limit, step, snapshot, fill, estimated);

            if (gridTime(first, produced.size(), step) <= limit + GRID_EPSILON) {
                if (maxRows == options.getBuildMaxRows()) {
                    sink.report("Initial build capped at " + maxRows + " of ~" + estimated
                            + " rows; the remaining span will be produced by rebuild", DiagnosticLevel.WARNING);
                } else {
                    sink.report("Build iteration cap of " + iterationCap + " reached before the end of the "
                            + "reference span (estimated " + estimated + " rows)", DiagnosticLevel.WARNING);
                }
            }
        }

        synchronized (rowLock) {
            rows.addAll(produced);
            commitWatermark(produced.get(produced.size() - 1));
            gridOrigin = first;
            timeBase = base;
            recoveryTimeBase = TimeBase.anchoredAt(recorded.first().getTimestamp(), first);
            built = true;
        }
        referenceAppendedAtLastRows = appendedAtSnapshot;
        failureTracker.recordSuccess();

        sink.report(String.format("Virtual table built on '%s': %d rows over [%.6f, %.6f] s at %s Hz "
                        + "(%d snapshot points)",
                referenceChannelId, produced.size(), first, limit, samplingRate, snapshot.totalPoints()),
                DiagnosticLevel.INFO);
        return BuildResult.of(BuildStatus.BUILT, produced.size());
    }

    // ==================== 增量构建 ====================

    @Override
    public BuildResult rebuild() {
        if (!samplingRateValid) {
            return configurationFailure();
        }
        if (!built) {
            return build();
        }

        ChannelLedger reference = store.ledger(referenceChannelId);
        if (reference == null || reference.isEmpty()) {
            // 已构建的行保留，等待数据恢复
            return missingReference();
        }
        LedgerSnapshot newestSnapshot = reference.snapshotTail(1);
        if (newestSnapshot.isEmpty()) {
            return missingReference();
        }

        Point newestPoint = newestSnapshot.last();
        double watermark = lastBuiltTime;
        double newest = timeBase.elapsedOf(newestPoint);

        // 只检查最新的参考点
        if (!isPlausibleAdvance(watermark, newest)) {
            if (timeBase.isReprojected() || recoveryTimeBase == null) {
                return structuralFailure(String.format(
                        "Newest reference point on '%s' has implausible elapsed time %s (watermark %s)",
                        referenceChannelId, newest, watermark));
            }
            double corrected = recoveryTimeBase.elapsedOf(newestPoint);
            if (!isPlausibleAdvance(watermark, corrected)) {
                return structuralFailure(String.format(
                        "Newest reference point on '%s' has implausible elapsed time %s (recomputed %s, "
                                + "watermark %s)", referenceChannelId, newest, corrected, watermark));
            }
            sink.report(String.format(
                    "Timing anomaly on '%s': newest elapsed %s is implausible, switching to absolute-timestamp "
                            + "time base (recomputed %.6f)", referenceChannelId, newest, corrected),
                    DiagnosticLevel.INFO);
            timeBase = recoveryTimeBase;
            newest = corrected;
        }

        double step = 1.0 / samplingRate;
        long startIndex = lastGridIndex + 1;
        double startTime = gridTime(gridOrigin, startIndex, step);
        long appendedNow = reference.appendedCount();
        int maxRows = options.getRebuildMaxRows();
        double limit = newest;
        int burstRows = 0;

        if (newest + GRID_EPSILON < startTime) {
            burstRows = options.getBurstPolicy().extensionRows(appendedNow - referenceAppendedAtLastRows);
            if (burstRows == 0) {
                failureTracker.recordSuccess();
                return BuildResult.of(BuildStatus.UP_TO_DATE, 0);
            }
            maxRows = Math.min(maxRows, burstRows);
            limit = gridTime(gridOrigin, startIndex + maxRows - 1, step);
        }

        TimeBase base = timeBase;
        double lookBackFrom = startTime - LOOK_BACK_STEPS * step;
        Predicate<Point> withinLookBack = p -> base.elapsedOf(p) >= lookBackFrom;

        LedgerSnapshot referenceSnapshot = base.apply(
                reference.snapshotSince(withinLookBack, options.getSnapshotMaxPoints()));
        if (!referenceSnapshot.isConsistent()) {
            return structuralFailure("Reference channel '" + referenceChannelId + "' reports "
                    + reference.count() + " points but its sequence disagrees");
        }
        BuildSnapshot snapshot = BuildSnapshot.capture(store, referenceSnapshot, sourceChannels,
                options.getSnapshotMaxPoints(), withinLookBack, base);

        if (burstRows == 0) {
            limit = clampToCoverage(limit, startTime, snapshot);
        }

        Map<String, PointValue> fill = seedFill();
        long expected = (long) Math.floor((limit - startTime + GRID_EPSILON) / step) + 1;
        List<VirtualRow> produced = generateRows(gridOrigin, startIndex, maxRows, limit, step,
                snapshot, fill, expected);
        if (produced.isEmpty()) {
            failureTracker.recordSuccess();
            return BuildResult.of(BuildStatus.UP_TO_DATE, 0);
        }

        synchronized (rowLock) {
            rows.addAll(produced);
            commitWatermark(produced.get(produced.size() - 1));
        }
        referenceAppendedAtLastRows = appendedNow;
        failureTracker.recordSuccess();

        if (burstRows > 0) {
            sink.report("Reference burst on '" + referenceChannelId + "': synthesized " + produced.size()
                    + " rows past the watermark", DiagnosticLevel.INFO);
        } else if (expected > produced.size()) {
            sink.report("Rebuild capped at " + produced.size() + " rows; " + (expected - produced.size())
                    + " rows remain for the next call", DiagnosticLevel.INFO);
        }
        return BuildResult.of(BuildStatus.EXTENDED, produced.size());
    }

    /**
     * 快照被点数上限截断时，本次调用只生成到各截断快照共同覆盖的时刻为止，
     * 至少保留起始网格点，保证每次调用都有进展。
     */
    private double clampToCoverage(double limit, double floor, BuildSnapshot snapshot) {
        double coverage = snapshot.coverageLimit();
        if (coverage >= limit) {
            return limit;
        }
        double clamped = Math.max(coverage, floor);
        sink.report(String.format("Working set capped at %d points per channel on '%s'; rows past %.6f s "
                        + "deferred to the next call", options.getSnapshotMaxPoints(), referenceChannelId, clamped),
                DiagnosticLevel.INFO);
        return clamped;
    }

    // ==================== 行解析 ====================

    private List<VirtualRow> generateRows(double origin, long fromIndex, int maxRows, double limit, double step,
                                          BuildSnapshot snapshot, Map<String, PointValue> fill, long expected) {
        int progressInterval = options.getProgressInterval();
        List<VirtualRow> produced = new ArrayList<>((int) Math.min(maxRows, 4096));
        long index = fromIndex;
        while (produced.size() < maxRows) {
            double t = gridTime(origin, index, step);
            if (t > limit + GRID_EPSILON) {
                break;
            }
            produced.add(computeRow(index, t, step, snapshot, fill));
            index++;

            if (expected > progressInterval && produced.size() % progressInterval == 0) {
                sink.report("Building '" + referenceChannelId + "': " + produced.size() + " / ~" + expected
                        + " rows", DiagnosticLevel.INFO);
            }
        }
        return produced;
    }

    private VirtualRow computeRow(long index, double t, double step, BuildSnapshot snapshot,
                                  Map<String, PointValue> fill) {
        Point anchor = snapshot.channel(referenceChannelId).nearest(t, step / 2.0);
        AlignmentContext context = new AlignmentContext(t, anchor, 2.0 * step, options.getSyncToleranceNs());

        LinkedHashMap<String, PointValue> data = new LinkedHashMap<>();
        for (ColumnSpec column : columns) {
            data.put(column.getName(), resolveCell(column, snapshot, context, fill));
        }
        return new VirtualRow(index, t, data);
    }

    private PointValue resolveCell(ColumnSpec column, BuildSnapshot snapshot, AlignmentContext context,
                                   Map<String, PointValue> fill) {
        if (column.isComputed()) {
            return null;
        }
        boolean forwardFilled = column.getPolicy().isForwardFilled();
        AlignmentStrategy strategy = strategies.get(column.getPolicy());
        PointValue raw = strategy.resolve(snapshot.channel(column.getChannelId()), context);
        if (raw == null) {
            return forwardFilled ? fill.get(column.getName()) : null;
        }

        ConversionResult converted;
        try {
            converted = column.getConverter().convert(raw);
        } catch (RuntimeException e) {
            converted = ConversionResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (converted == null || !converted.isSuccess()) {
            recordConversionFailure(column, converted != null ? converted.getError() : "Converter returned null");
            return null;
        }

        PointValue value = converted.getValue();
        if (forwardFilled) {
            fill.put(column.getName(), value);
        }
        return value;
    }

    private void recordConversionFailure(ColumnSpec column, String error) {
        conversionFailures.incrementAndGet();
        // 每列只报告第一次
        if (conversionFailureColumns.add(column.getName())) {
            sink.report("Conversion failed for column '" + column.getName() + "': " + error,
                    DiagnosticLevel.WARNING);
        }
    }

    private Map<String, PointValue> seedFill() {
        Map<String, PointValue> fill = new HashMap<>();
        VirtualRow seed = lastRow;
        if (seed == null) {
            return fill;
        }
        for (ColumnSpec column : columns) {
            if (column.isComputed() || !column.getPolicy().isForwardFilled()) {
                continue;
            }
            PointValue value = seed.get(column.getName());
            if (value != null) {
                fill.put(column.getName(), value);
            }
        }
        return fill;
    }

    // ==================== 辅助 ====================

    private static double gridTime(double origin, long index, double step) {
        return origin + index * step;
    }

    private void commitWatermark(VirtualRow last) {
        lastRow = last;
        lastGridIndex = last.getIndex();
        lastBuiltTime = last.getTimestamp();
    }

    private boolean isPlausibleSpan(double first, double last) {
        double ceiling = options.getPlausibleSpanSeconds();
        return Double.isFinite(first) && Double.isFinite(last)
                && Math.abs(first) <= ceiling
                && last - first <= ceiling;
    }

    private boolean isPlausibleAdvance(double watermark, double newest) {
        double ceiling = options.getPlausibleSpanSeconds();
        return Double.isFinite(newest)
                && newest - watermark <= ceiling
                && watermark - newest <= ceiling;
    }

    private BuildResult missingReference() {
        String message = "Reference channel '" + referenceChannelId + "' has no data yet; build deferred";
        failureTracker.recordFailure(FailureKind.MISSING_REFERENCE, message);
        return BuildResult.failure(BuildStatus.MISSING_REFERENCE, message);
    }

    private BuildResult structuralFailure(String message) {
        failureTracker.recordFailure(FailureKind.STRUCTURAL_ERROR, message);
        return BuildResult.failure(BuildStatus.STRUCTURAL_ERROR, message);
    }

    private BuildResult configurationFailure() {
        String message = "Sampling rate must be a positive finite number, got " + samplingRate;
        failureTracker.recordFailure(FailureKind.CONFIGURATION_ERROR, message);
        return BuildResult.failure(BuildStatus.CONFIGURATION_ERROR, message);
    }

    // ==================== 行维护 ====================

    @Override
    public int pruneRows(int keepLastN) {
        int keep = Math.max(0, keepLastN);
        synchronized (rowLock) {
            int excess = rows.size() - keep;
            if (excess <= 0) {
                return 0;
            }
            rows.subList(0, excess).clear();
            return excess;
        }
    }

    @Override
    public void clear() {
        synchronized (rowLock) {
            rows.clear();
            built = false;
            lastBuiltTime = null;
            lastRow = null;
            lastGridIndex = -1;
            gridOrigin = 0.0;
            timeBase = TimeBase.recorded();
            recoveryTimeBase = null;
            referenceAppendedAtLastRows = 0;
        }
        sink.report("Virtual table on '" + referenceChannelId + "' cleared", DiagnosticLevel.INFO);
    }

    // ==================== 读取 ====================

    @Override
    public String referenceChannelId() { return referenceChannelId; }

    @Override
    public double samplingRate() { return samplingRate; }

    @Override
    public List<ColumnSpec> columns() { return columns; }

    @Override
    public List<String> headers() { return headers; }

    @Override
    public List<VirtualRow> rows() {
        synchronized (rowLock) {
            return Collections.unmodifiableList(new ArrayList<>(rows));
        }
    }

    @Override
    public List<VirtualRow> rowsFrom(long gridIndex) {
        synchronized (rowLock) {
            if (rows.isEmpty()) {
                return Collections.emptyList();
            }
            // 网格序号在保留行内连续
            long firstIndex = rows.get(0).getIndex();
            int offset = (int) Math.max(0, Math.min(rows.size(), gridIndex - firstIndex));
            return Collections.unmodifiableList(new ArrayList<>(rows.subList(offset, rows.size())));
        }
    }

    @Override
    public int rowCount() {
        synchronized (rowLock) {
            return rows.size();
        }
    }

    @Override
    public VirtualRow rowAt(int position) {
        synchronized (rowLock) {
            if (position < 0 || position >= rows.size()) {
                return null;
            }
            return rows.get(position);
        }
    }

    @Override
    public VirtualRow rowNearest(double targetElapsed, double tolerance) {
        synchronized (rowLock) {
            if (rows.isEmpty()) {
                return null;
            }
            int lo = 0;
            int hi = rows.size();
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (rows.get(mid).getTimestamp() < targetElapsed) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            VirtualRow closest = null;
            double minDiff = Double.POSITIVE_INFINITY;
            if (lo > 0) {
                VirtualRow before = rows.get(lo - 1);
                double diff = targetElapsed - before.getTimestamp();
                if (diff <= tolerance) {
                    closest = before;
                    minDiff = diff;
                }
            }
            if (lo < rows.size()) {
                VirtualRow after = rows.get(lo);
                double diff = after.getTimestamp() - targetElapsed;
                if (diff < minDiff && diff <= tolerance) {
                    closest = after;
                }
            }
            return closest;
        }
    }

    @Override
    public boolean isBuilt() { return built; }

    @Override
    public Double lastBuiltTime() { return lastBuiltTime; }

    @Override
    public Double retentionFloor() {
        synchronized (rowLock) {
            if (!built) {
                return null;
            }
            // 重投影后的经过时间与记录值不可比，不给出下限
            if (timeBase.isReprojected()) {
                return Double.NEGATIVE_INFINITY;
            }
            double step = 1.0 / samplingRate;
            return gridTime(gridOrigin, lastGridIndex + 1, step) - LOOK_BACK_STEPS * step;
        }
    }

    @Override
    public TableStatistics statistics() {
        synchronized (rowLock) {
            Double first = rows.isEmpty() ? null : rows.get(0).getTimestamp();
            Double last = rows.isEmpty() ? null : rows.get(rows.size() - 1).getTimestamp();
            return new TableStatistics(rows.size(), samplingRate, first, last);
        }
    }

    @Override
    public int consecutiveFailures() { return failureTracker.getConsecutiveFailures(); }

    @Override
    public long totalFailures() { return failureTracker.getTotalFailures(); }

    @Override
    public FailureKind lastFailure() { return failureTracker.getLastFailure(); }

    /** 累计单元格转换失败次数（不计入构建失败） */
    public long conversionFailures() { return conversionFailures.get(); }

    /** 当前使用的时间基 */
    public TimeBase timeBase() { return timeBase; }

    public VirtualTableOptions getOptions() { return options; }
}
