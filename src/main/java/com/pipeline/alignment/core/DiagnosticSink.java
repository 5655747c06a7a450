package com.pipeline.alignment.core;

import com.pipeline.alignment.model.DiagnosticLevel;

/**
 * 诊断信息接收端，由调用方提供。
 *
 * 虚拟表的全部诊断输出都经由此接口上报；
 * 实现抛出的异常会被引擎捕获，不会中断 build/rebuild 调用。
 */
@FunctionalInterface
public interface DiagnosticSink {

    /**
     * 上报一条诊断信息。
     *
     * @param message 诊断内容
     * @param level   级别
     */
    void report(String message, DiagnosticLevel level);
}
