package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.core.DiagnosticSink;
import com.pipeline.alignment.model.DiagnosticLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 包装调用方提供的诊断接收端，接收端抛出的异常只记录日志，不向构建流程传播。
 */
final class GuardedDiagnosticSink implements DiagnosticSink {

    private static final Logger log = LoggerFactory.getLogger(GuardedDiagnosticSink.class);

    private final DiagnosticSink delegate;

    private GuardedDiagnosticSink(DiagnosticSink delegate) {
        this.delegate = delegate;
    }

    static DiagnosticSink wrap(DiagnosticSink sink) {
        if (sink == null) {
            return new LoggingDiagnosticSink();
        }
        if (sink instanceof GuardedDiagnosticSink) {
            return sink;
        }
        return new GuardedDiagnosticSink(sink);
    }

    @Override
    public void report(String message, DiagnosticLevel level) {
        try {
            delegate.report(message, level);
        } catch (Exception e) {
            log.error("Diagnostic sink failed while reporting [{}] '{}': {}",
                    level, message, e.getMessage(), e);
        }
    }
}
