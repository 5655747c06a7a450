package com.pipeline.alignment;

import com.pipeline.alignment.core.ValueConverter;
import com.pipeline.alignment.core.impl.BurstPolicy;
import com.pipeline.alignment.core.impl.VirtualTableOptions;
import com.pipeline.alignment.model.ChannelPolicy;
import com.pipeline.alignment.model.ColumnSpec;
import com.pipeline.alignment.operators.Converters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的参考通道、采样率、构建上限、诊断限流以及列定义表。
 *
 * 列定义按序号连续编号，从1开始，遇到第一个缺少 name 的序号即停止：
 * <pre>
 * column.1.name=Dose
 * column.1.channel=io.dose.value
 * column.1.policy=SYNCHRONIZED
 * column.1.gain=0.001
 * column.1.offset=0
 * </pre>
 * 未配置 channel 的列为计算列；配置了 gain 或 offset 的列使用线性换算；
 * parse=true 时先把文本解析为数值。
 */
public class AlignmentConfig {

    private static final Logger log = LoggerFactory.getLogger(AlignmentConfig.class);

    // ---- 虚拟表 ----
    private String referenceChannel = "reference";
    private double samplingRate = 500.0;
    private double plausibleSpanSeconds = 86400.0;
    private int snapshotMaxPoints = 100_000;
    private int buildMaxRows = 1_000_000;
    private int rebuildMaxRows = 10_000;
    private int buildProgressInterval = 10_000;
    private long syncToleranceNs = 1_000L;

    // ---- 突发扩展 ----
    private int burstMinPoints = 1000;
    private int burstMaxRows = 10;

    // ---- 诊断 ----
    private int diagnosticsLogEvery = 100;
    private int diagnosticsEscalateAfter = 50;

    // ---- 存储与会话 ----
    private int storePruneMaxPoints = 100_000;
    private double storeRetainSeconds = 60.0;
    private int sessionRetainRows = 1_000;

    // ---- 列定义 ----
    private List<ColumnSpec> columns = Collections.emptyList();

    /**
     * 从文件加载配置；读取或解析失败时记录警告并返回默认配置。
     */
    public static AlignmentConfig load(String configPath) {
        try (InputStream in = new FileInputStream(configPath)) {
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
            return new AlignmentConfig();
        }
    }

    /**
     * 从类路径资源加载配置；资源不存在或解析失败时记录警告并返回默认配置。
     */
    public static AlignmentConfig loadResource(String resourceName) {
        try (InputStream in = AlignmentConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                log.warn("Config resource '{}' not found, using defaults.", resourceName);
                return new AlignmentConfig();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load config resource {}, using defaults. Error: {}", resourceName, e.getMessage());
            return new AlignmentConfig();
        }
    }

    /**
     * 从属性集解析配置。
     *
     * @throws IllegalArgumentException 数值格式错误或列定义非法
     */
    public static AlignmentConfig fromProperties(Properties props) {
        AlignmentConfig config = new AlignmentConfig();

        config.referenceChannel = props.getProperty("alignment.reference.channel", config.referenceChannel).trim();
        config.samplingRate = parseDouble(props, "alignment.sampling.rate", config.samplingRate);
        config.plausibleSpanSeconds = parseDouble(props, "alignment.plausible.span.seconds",
                config.plausibleSpanSeconds);
        config.snapshotMaxPoints = parseInt(props, "alignment.snapshot.max.points", config.snapshotMaxPoints);
        config.buildMaxRows = parseInt(props, "alignment.build.max.rows", config.buildMaxRows);
        config.rebuildMaxRows = parseInt(props, "alignment.rebuild.max.rows", config.rebuildMaxRows);
        config.buildProgressInterval = parseInt(props, "alignment.build.progress.interval",
                config.buildProgressInterval);
        config.syncToleranceNs = parseLong(props, "alignment.sync.tolerance.ns", config.syncToleranceNs);
        config.burstMinPoints = parseInt(props, "alignment.burst.min.points", config.burstMinPoints);
        config.burstMaxRows = parseInt(props, "alignment.burst.max.rows", config.burstMaxRows);
        config.diagnosticsLogEvery = parseInt(props, "alignment.diagnostics.log.every", config.diagnosticsLogEvery);
        config.diagnosticsEscalateAfter = parseInt(props, "alignment.diagnostics.escalate.after",
                config.diagnosticsEscalateAfter);
        config.storePruneMaxPoints = parseInt(props, "store.prune.max.points", config.storePruneMaxPoints);
        config.storeRetainSeconds = parseDouble(props, "store.retain.seconds", config.storeRetainSeconds);
        config.sessionRetainRows = parseInt(props, "session.retain.rows", config.sessionRetainRows);
        config.columns = parseColumns(props);

        if (config.referenceChannel.isEmpty()) {
            throw new IllegalArgumentException("alignment.reference.channel must not be blank");
        }
        return config;
    }

    // ==================== 列定义解析 ====================

    private static List<ColumnSpec> parseColumns(Properties props) {
        List<ColumnSpec> result = new ArrayList<>();
        for (int n = 1; ; n++) {
            String prefix = "column." + n + ".";
            String name = props.getProperty(prefix + "name");
            if (name == null) {
                break;
            }

            String channel = props.getProperty(prefix + "channel");
            if (channel != null && channel.isBlank()) {
                channel = null;
            }
            String policyText = props.getProperty(prefix + "policy", ChannelPolicy.SYNCHRONIZED.name());
            ChannelPolicy policy;
            try {
                policy = ChannelPolicy.valueOf(policyText.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown policy '" + policyText + "' for " + prefix + "policy");
            }

            result.add(new ColumnSpec(name.trim(), channel != null ? channel.trim() : null, policy,
                    converterFor(props, prefix)));
        }
        return Collections.unmodifiableList(result);
    }

    private static ValueConverter converterFor(Properties props, String prefix) {
        boolean parse = Boolean.parseBoolean(props.getProperty(prefix + "parse", "false").trim());
        boolean linear = props.getProperty(prefix + "gain") != null || props.getProperty(prefix + "offset") != null;

        ValueConverter converter = parse ? Converters.parseNumber() : null;
        if (linear) {
            ValueConverter scale = Converters.linear(parseDouble(props, prefix + "gain", 1.0),
                    parseDouble(props, prefix + "offset", 0.0));
            converter = converter != null ? Converters.chain(converter, scale) : scale;
        }
        return converter != null ? converter : Converters.identity();
    }

    // ==================== 数值解析 ====================

    private static double parseDouble(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": '" + value + "'", e);
        }
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    /**
     * 转换为虚拟表构建参数
     */
    public VirtualTableOptions toTableOptions() {
        return VirtualTableOptions.defaults()
                .plausibleSpanSeconds(plausibleSpanSeconds)
                .snapshotMaxPoints(snapshotMaxPoints)
                .buildMaxRows(buildMaxRows)
                .rebuildMaxRows(rebuildMaxRows)
                .progressInterval(buildProgressInterval)
                .syncToleranceNs(syncToleranceNs)
                .burstPolicy(new BurstPolicy(burstMinPoints, burstMaxRows))
                .diagnosticsLogEvery(diagnosticsLogEvery)
                .diagnosticsEscalateAfter(diagnosticsEscalateAfter);
    }

    // ---- Getters ----
    public String getReferenceChannel() { return referenceChannel; }
    public double getSamplingRate() { return samplingRate; }
    public double getPlausibleSpanSeconds() { return plausibleSpanSeconds; }
    public int getSnapshotMaxPoints() { return snapshotMaxPoints; }
    public int getBuildMaxRows() { return buildMaxRows; }
    public int getRebuildMaxRows() { return rebuildMaxRows; }
    public int getBuildProgressInterval() { return buildProgressInterval; }
    public long getSyncToleranceNs() { return syncToleranceNs; }
    public int getBurstMinPoints() { return burstMinPoints; }
    public int getBurstMaxRows() { return burstMaxRows; }
    public int getDiagnosticsLogEvery() { return diagnosticsLogEvery; }
    public int getDiagnosticsEscalateAfter() { return diagnosticsEscalateAfter; }
    public int getStorePruneMaxPoints() { return storePruneMaxPoints; }
    public double getStoreRetainSeconds() { return storeRetainSeconds; }
    public int getSessionRetainRows() { return sessionRetainRows; }
    public List<ColumnSpec> getColumns() { return columns; }

    @Override
    public String toString() {
        return "AlignmentConfig{reference='" + referenceChannel + "'"
                + ", rate=" + samplingRate + "Hz"
                + ", columns=" + columns.size()
                + ", rebuildMaxRows=" + rebuildMaxRows
                + ", burst=" + burstMinPoints + "/" + burstMaxRows
                + ", retainRows=" + sessionRetainRows + "}";
    }
}
