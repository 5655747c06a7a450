package com.pipeline.alignment.model;

/**
 * 诊断信息级别
 */
public enum DiagnosticLevel {
    INFO,
    WARNING,
    ERROR
}
