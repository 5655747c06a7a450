package com.pipeline.alignment.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 诊断报告：问题（issues）会导致构建失败或数据错误，警告（warnings）仅提示潜在性能或质量风险。
 */
public class DiagnosisReport implements Serializable {
    private final List<String> issues;
    private final List<String> warnings;
    /** 附加的数值指标，如估算行数、快照大小 */
    private final Map<String, Object> metrics;

    public DiagnosisReport() {
        this.issues = new ArrayList<>();
        this.warnings = new ArrayList<>();
        this.metrics = new LinkedHashMap<>();
    }

    public void addIssue(String issue) {
        this.issues.add(issue);
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    public void putMetric(String name, Object value) {
        this.metrics.put(name, value);
    }

    public boolean isHealthy() { return issues.isEmpty(); }
    public List<String> getIssues() { return Collections.unmodifiableList(issues); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }
    public Map<String, Object> getMetrics() { return Collections.unmodifiableMap(metrics); }

    @Override
    public String toString() {
        return "DiagnosisReport{issues=" + issues + ", warnings=" + warnings + ", metrics=" + metrics + "}";
    }
}
