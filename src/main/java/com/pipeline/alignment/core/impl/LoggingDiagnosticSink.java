package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.core.DiagnosticSink;
import com.pipeline.alignment.model.DiagnosticLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 默认诊断接收端：按级别转发到 SLF4J。
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    private final Logger logger;

    public LoggingDiagnosticSink() {
        this(LoggerFactory.getLogger(DefaultVirtualTable.class));
    }

    public LoggingDiagnosticSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void report(String message, DiagnosticLevel level) {
        switch (level) {
            case ERROR:
                logger.error(message);
                break;
            case WARNING:
                logger.warn(message);
                break;
            default:
                logger.info(message);
                break;
        }
    }
}
