package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.model.ChannelPolicy;
import com.pipeline.alignment.model.ColumnSpec;
import com.pipeline.alignment.model.DiagnosisReport;
import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.model.PointValue;
import com.pipeline.alignment.storage.InMemoryTelemetryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TelemetryInspectorTest {

    private static final long T0 = 1_700_000_000_000_000_000L;
    private static final String REF = "io.reference";

    private InMemoryTelemetryStore store;
    private TelemetryInspector inspector;

    @BeforeEach
    void setUp() {
        store = new InMemoryTelemetryStore();
        inspector = new TelemetryInspector(5, 50L);
    }

    private static long ns(double seconds) {
        return T0 + Math.round(seconds * 1e9);
    }

    private void fillReference(int points) {
        for (int k = 0; k < points; k++) {
            store.addPoint(REF, k, ns(k * 0.1));
        }
    }

    @Test
    void shouldSummarizeStoreAndFlagOversizedChannels() {
        // Given
        fillReference(10);
        store.addPoint("temp", 20.5, ns(0.0));

        // When
        DiagnosisReport report = inspector.diagnoseStore(store);

        // Then
        assertThat(report.isHealthy()).isTrue();
        assertThat(report.getMetrics())
                .containsEntry("totalChannels", 2)
                .containsEntry("totalPoints", 11L);
        assertThat(report.getWarnings())
                .containsExactly("Channel " + REF + " has 10 points - may cause performance issues");
    }

    @Test
    void shouldReportReversedTimestamps() {
        store.addPoint(REF, 1.0, ns(1.0));
        store.addPoint(REF, 2.0, ns(0.0));

        DiagnosisReport report = inspector.diagnoseStore(store);

        assertThat(report.isHealthy()).isFalse();
        assertThat(report.getIssues()).containsExactly("Channel " + REF + ": last timestamp < first timestamp");
    }

    @Test
    void shouldReportMissingReferenceAndUnknownColumnChannel() {
        // Given
        DefaultVirtualTable table = new DefaultVirtualTable(store, REF, 10.0, List.of(
                ColumnSpec.of("Temp", "temp", ChannelPolicy.INTERPOLATED),
                ColumnSpec.computed("Power")));

        // When
        DiagnosisReport report = inspector.diagnoseTable(table, store);

        // Then
        assertThat(report.getIssues()).containsExactly("Reference channel '" + REF + "' not found");
        assertThat(report.getWarnings()).containsExactly("Channel temp for column 'Temp' not found in store");
        assertThat(report.getMetrics()).containsEntry("built", false).containsEntry("columns", 2);
    }

    @Test
    void shouldEstimateRowsFromReferenceSpan() {
        // Given: 1 s of reference data at 100 Hz
        fillReference(11);
        DefaultVirtualTable table = new DefaultVirtualTable(store, REF, 100.0,
                List.of(ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED)));

        // When
        DiagnosisReport report = inspector.diagnoseTable(table, store);

        // Then
        assertThat(report.isHealthy()).isTrue();
        assertThat(report.getMetrics()).containsEntry("estimatedRows", 101L);
        assertThat(report.getWarnings())
                .anyMatch(w -> w.startsWith("Estimated rows (101)"))
                .anyMatch(w -> w.startsWith("Reference channel has 11 points"));
    }

    @Test
    void shouldFlagNonPositiveSamplingRate() {
        fillReference(2);
        DefaultVirtualTable table = new DefaultVirtualTable(store, REF, 0.0,
                List.of(ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED)));

        DiagnosisReport report = inspector.diagnoseTable(table, store);

        assertThat(report.getIssues()).containsExactly("Sampling rate must be positive, got 0.0");
        assertThat(report.getMetrics()).doesNotContainKey("estimatedRows");
    }

    @Test
    void shouldValidateIndividualPoints() {
        assertThat(inspector.validatePoint(new Point(PointValue.ofNumber(1), T0, 1.0)).isHealthy()).isTrue();

        assertThat(inspector.validatePoint(new Point(PointValue.ofNumber(1), 0L, 0.0)).getIssues())
                .containsExactly("Invalid timestamp: 0");
        assertThat(inspector.validatePoint(new Point(PointValue.ofNumber(1), 1_000L, 0.0)).getIssues())
                .hasSize(1).allMatch(issue -> issue.contains("seems too small"));
        assertThat(inspector.validatePoint(new Point(PointValue.ofNumber(1), T0, Double.NaN)).getIssues())
                .hasSize(1).allMatch(issue -> issue.startsWith("Non-finite elapsed time"));
        assertThat(inspector.validatePoint(new Point(PointValue.ofNumber(1), T0, -2.0)).getIssues())
                .hasSize(1).allMatch(issue -> issue.startsWith("Negative elapsed time"));

        DiagnosisReport missing = inspector.validatePoint(new Point(PointValue.missing(), T0, 1.0));
        assertThat(missing.isHealthy()).isTrue();
        assertThat(missing.getWarnings()).containsExactly("Data point value is missing");
    }
}
