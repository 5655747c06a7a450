package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.core.DiagnosticSink;
import com.pipeline.alignment.model.DiagnosticLevel;
import com.pipeline.alignment.model.FailureKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * 构建失败的诊断状态机。
 *
 * 连续失败计数在每次失败时递增，下一次成功时归零并输出一条恢复信息。
 * 为避免长时间卡在失败状态的会话刷屏，诊断输出做限流：
 * 第一次失败总是输出，之后每 logEvery 次输出一次。
 *
 * 级别规则：
 * - MISSING_REFERENCE 为预期中的预热状态，输出 WARNING，连续失败达到 escalateAfter 次后升级为 ERROR
 * - 其余分类一律 ERROR
 *
 * 非线程安全，由虚拟表在串行的 build/rebuild 调用中使用。
 */
public class FailureTracker {

    private final DiagnosticSink sink;
    private final int logEvery;
    private final int escalateAfter;

    private int consecutiveFailures;
    private long totalFailures;
    private FailureKind lastFailure;
    private final Map<FailureKind, Long> failuresByKind = new EnumMap<>(FailureKind.class);

    public FailureTracker(DiagnosticSink sink, int logEvery, int escalateAfter) {
        if (logEvery <= 0) {
            throw new IllegalArgumentException("logEvery must be positive, got " + logEvery);
        }
        if (escalateAfter <= 0) {
            throw new IllegalArgumentException("escalateAfter must be positive, got " + escalateAfter);
        }
        this.sink = GuardedDiagnosticSink.wrap(sink);
        this.logEvery = logEvery;
        this.escalateAfter = escalateAfter;
    }

    /**
     * 记录一次失败，按限流规则决定是否输出诊断。
     *
     * @return 本次是否输出了诊断
     */
    public boolean recordFailure(FailureKind kind, String message) {
        consecutiveFailures++;
        totalFailures++;
        lastFailure = kind;
        failuresByKind.merge(kind, 1L, Long::sum);

        if (consecutiveFailures != 1 && consecutiveFailures % logEvery != 0) {
            return false;
        }
        sink.report(message + " (consecutive failures: " + consecutiveFailures + ")", levelFor(kind));
        return true;
    }

    /**
     * 记录一次成功；此前处于失败状态时输出恢复信息并归零。
     */
    public void recordSuccess() {
        if (consecutiveFailures > 0) {
            sink.report("Recovered after " + consecutiveFailures + " consecutive failures (last: "
                    + lastFailure + ")", DiagnosticLevel.INFO);
            consecutiveFailures = 0;
        }
    }

    DiagnosticLevel levelFor(FailureKind kind) {
        if (kind == FailureKind.MISSING_REFERENCE) {
            return consecutiveFailures >= escalateAfter ? DiagnosticLevel.ERROR : DiagnosticLevel.WARNING;
        }
        return DiagnosticLevel.ERROR;
    }

    public int getConsecutiveFailures() { return consecutiveFailures; }
    public long getTotalFailures() { return totalFailures; }
    public FailureKind getLastFailure() { return lastFailure; }

    public long getFailureCount(FailureKind kind) {
        return failuresByKind.getOrDefault(kind, 0L);
    }
}
