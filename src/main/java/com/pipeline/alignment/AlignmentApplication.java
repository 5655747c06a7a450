package com.pipeline.alignment;

import com.pipeline.alignment.core.DiagnosticSink;
import com.pipeline.alignment.core.TelemetryStore;
import com.pipeline.alignment.core.impl.DefaultVirtualTable;
import com.pipeline.alignment.core.impl.LoggingDiagnosticSink;
import com.pipeline.alignment.core.impl.SamplingSession;
import com.pipeline.alignment.storage.InMemoryTelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 启动引导类。
 * 按配置组装遥测存储、虚拟表与采样会话，调度线程与采集层由宿主程序提供。
 */
public final class AlignmentApplication {

    private static final Logger log = LoggerFactory.getLogger(AlignmentApplication.class);

    private AlignmentApplication() {
    }

    public static SamplingSession assemble(AlignmentConfig config) {
        return assemble(config, new LoggingDiagnosticSink());
    }

    public static SamplingSession assemble(AlignmentConfig config, DiagnosticSink sink) {
        log.info("Assembling telemetry alignment session with config: {}", config);

        // 1. 遥测存储
        TelemetryStore store = new InMemoryTelemetryStore();

        // 2. 虚拟表
        DefaultVirtualTable table = new DefaultVirtualTable(
                store,
                config.getReferenceChannel(),
                config.getSamplingRate(),
                config.getColumns(),
                sink,
                config.toTableOptions()
        );

        // 3. 采样会话
        SamplingSession session = new SamplingSession(
                store,
                table,
                sink,
                config.getSessionRetainRows(),
                config.getStoreRetainSeconds(),
                config.getStorePruneMaxPoints()
        );

        log.info("Session ready: reference '{}', {} columns at {} Hz.",
                config.getReferenceChannel(), table.headers().size(), config.getSamplingRate());
        return session;
    }
}
