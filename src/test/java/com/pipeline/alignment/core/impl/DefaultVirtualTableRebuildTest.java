package com.pipeline.alignment.core.impl;

import com.pipeline.alignment.core.DiagnosticSink;
import com.pipeline.alignment.core.TelemetryStore;
import com.pipeline.alignment.model.BuildResult;
import com.pipeline.alignment.model.BuildStatus;
import com.pipeline.alignment.model.ChannelPolicy;
import com.pipeline.alignment.model.ColumnSpec;
import com.pipeline.alignment.model.DiagnosticLevel;
import com.pipeline.alignment.model.PointValue;
import com.pipeline.alignment.model.VirtualRow;
import com.pipeline.alignment.storage.ChannelLedger;
import com.pipeline.alignment.storage.InMemoryTelemetryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Incremental rebuild behaviour: watermark continuation, row caps, burst extension,
 * forward-fill seeding and the newest-point timing guard.
 */
@ExtendWith(MockitoExtension.class)
class DefaultVirtualTableRebuildTest {

    private static final long T0 = 1_700_000_000_000_000_000L;
    private static final String REF = "io.reference";

    @Mock
    private DiagnosticSink sink;

    private InMemoryTelemetryStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTelemetryStore();
    }

    private static long ns(double seconds) {
        return T0 + Math.round(seconds * 1e9);
    }

    private DefaultVirtualTable table(VirtualTableOptions options, ColumnSpec... columns) {
        return new DefaultVirtualTable(store, REF, 10.0, List.of(columns), sink, options);
    }

    private DefaultVirtualTable table(ColumnSpec... columns) {
        return table(VirtualTableOptions.defaults(), columns);
    }

    @Test
    void shouldAppendNewRowsWithoutTouchingExistingOnes() {
        // Given
        for (int k = 0; k <= 100; k++) {
            store.addPoint(REF, k, ns(k * 0.01));
        }
        for (int j = 0; j <= 20; j++) {
            store.addPoint("temp", j, ns(j * 0.05));
        }
        DefaultVirtualTable table = table(
                ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED),
                ColumnSpec.of("Temp", "temp", ChannelPolicy.INTERPOLATED));
        table.build();
        List<VirtualRow> before = table.rows();
        double previousWatermark = table.lastBuiltTime();

        // When
        for (int k = 101; k <= 200; k++) {
            store.addPoint(REF, k, ns(k * 0.01));
        }
        for (int j = 21; j <= 40; j++) {
            store.addPoint("temp", j, ns(j * 0.05));
        }
        BuildResult result = table.rebuild();

        // Then
        assertThat(result.getStatus()).isEqualTo(BuildStatus.EXTENDED);
        assertThat(result.getRowsAdded()).isEqualTo(10);
        assertThat(table.rowCount()).isGreaterThan(before.size());
        assertThat(table.lastBuiltTime()).isGreaterThan(previousWatermark);

        List<VirtualRow> after = table.rows();
        assertThat(after.subList(0, before.size())).containsExactlyElementsOf(before);
        for (int i = 1; i < after.size(); i++) {
            assertThat(after.get(i).getTimestamp() - after.get(i - 1).getTimestamp()).isCloseTo(0.1, within(1e-9));
        }
        assertThat(after.subList(before.size(), after.size()))
                .allSatisfy(row -> assertThat(row.isResolved("Temp")).isTrue());
        assertThat(after.get(after.size() - 1).get("Temp").asDouble()).isCloseTo(40.0, within(1e-6));
    }

    @Test
    void shouldDelegateToBuildWhenNotYetBuilt() {
        store.addPoint(REF, 1.0, ns(0.0));
        store.addPoint(REF, 1.0, ns(1.0));
        DefaultVirtualTable table = table(ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED));

        BuildResult result = table.rebuild();

        assertThat(result.getStatus()).isEqualTo(BuildStatus.BUILT);
        assertThat(table.isBuilt()).isTrue();
    }

    @Test
    void shouldReportUpToDateWithoutNewData() {
        store.addPoint(REF, 1.0, ns(0.0));
        store.addPoint(REF, 1.0, ns(1.0));
        DefaultVirtualTable table = table(ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED));
        table.build();

        BuildResult result = table.rebuild();

        assertThat(result.getStatus()).isEqualTo(BuildStatus.UP_TO_DATE);
        assertThat(result.getRowsAdded()).isZero();
    }

    @Test
    void shouldPreserveRowsWhenReferenceDisappears() {
        // Given
        store.addPoint(REF, 1.0, ns(0.0));
        store.addPoint(REF, 1.0, ns(1.0));
        DefaultVirtualTable table = table(ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED));
        table.build();
        int rows = table.rowCount();

        // When
        store.clear();
        BuildResult result = table.rebuild();

        // Then
        assertThat(result.getStatus()).isEqualTo(BuildStatus.MISSING_REFERENCE);
        assertThat(table.rowCount()).isEqualTo(rows);
        assertThat(table.isBuilt()).isTrue();
    }

    @Test
    void shouldCatchUpAcrossCallsWhenRowCapIsHit() {
        // Given
        store.addPoint(REF, 1.0, ns(0.0));
        store.addPoint(REF, 1.0, ns(1.0));
        DefaultVirtualTable table = table(VirtualTableOptions.defaults().rebuildMaxRows(5),
                ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED));
        table.build();
        store.addPoint(REF, 1.0, ns(2.0));
        store.addPoint(REF, 1.0, ns(3.0));

        // When / Then
        for (int call = 0; call < 4; call++) {
            BuildResult result = table.rebuild();
            assertThat(result.getStatus()).isEqualTo(BuildStatus.EXTENDED);
            assertThat(result.getRowsAdded()).isEqualTo(5);
        }
        assertThat(table.rebuild().getStatus()).isEqualTo(BuildStatus.UP_TO_DATE);
        assertThat(table.rowCount()).isEqualTo(31);
        assertThat(table.lastBuiltTime()).isCloseTo(3.0, within(1e-9));
        verify(sink, atLeastOnce())
                .report(contains("Rebuild capped"), eq(DiagnosticLevel.INFO));
    }

    @Test
    void shouldCatchUpOldestFirstWhenWorkingSetIsCapped() {
        // Given: 100 Hz reference and a matching interpolated channel, 10 Hz grid
        for (int k = 0; k <= 100; k++) {
            store.addPoint(REF, k, ns(k * 0.01));
            store.addPoint("temp", k, ns(k * 0.01));
        }
        DefaultVirtualTable table = table(VirtualTableOptions.defaults().snapshotMaxPoints(150),
                ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED),
                ColumnSpec.of("Temp", "temp", ChannelPolicy.INTERPOLATED));
        table.build();
        assertThat(table.rowCount()).isEqualTo(11);
        for (int k = 101; k <= 400; k++) {
            store.addPoint(REF, k, ns(k * 0.01));
            store.addPoint("temp", k, ns(k * 0.01));
        }

        // When
        int calls = 0;
        while (table.rebuild().getStatus() == BuildStatus.EXTENDED && calls < 20) {
            calls++;
        }

        // Then
        assertThat(calls).isGreaterThan(1);
        assertThat(table.rowCount()).isEqualTo(41);
        assertThat(table.lastBuiltTime()).isCloseTo(4.0, within(1e-9));
        List<VirtualRow> rows = table.rows();
        for (int i = 0; i < rows.size(); i++) {
            VirtualRow row = rows.get(i);
            assertThat(row.isResolved("Ref")).as("Ref at row %d", i).isTrue();
            assertThat(row.get("Ref").asDouble()).isEqualTo(10.0 * i);
            assertThat(row.get("Temp").asDouble()).as("Temp at row %d", i).isCloseTo(10.0 * i, within(1e-6));
        }
        verify(sink, atLeastOnce()).report(contains("Working set capped at 150 points"), eq(DiagnosticLevel.INFO));
    }

    @Test
    void shouldNotLetDenseChannelHideEarlyRowsFromBuild() {
        // Given: 10 Hz reference, 1 kHz channel over the same 3 s
        for (int k = 0; k <= 30; k++) {
            store.addPoint(REF, k, ns(k * 0.1));
        }
        for (int j = 0; j <= 3000; j++) {
            store.addPoint("temp", j, ns(j * 0.001));
        }
        DefaultVirtualTable table = table(VirtualTableOptions.defaults().snapshotMaxPoints(500),
                ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED),
                ColumnSpec.of("Temp", "temp", ChannelPolicy.INTERPOLATED));

        // When
        BuildResult built = table.build();
        int calls = 0;
        while (table.rebuild().getStatus() == BuildStatus.EXTENDED && calls < 100) {
            calls++;
        }

        // Then: the build stops where the capped channel's window ends
        assertThat(built.getRowsAdded()).isEqualTo(5);
        assertThat(table.rowCount()).isEqualTo(31);
        List<VirtualRow> rows = table.rows();
        for (int i = 0; i < rows.size(); i++) {
            VirtualRow row = rows.get(i);
            assertThat(row.isResolved("Ref")).as("Ref at row %d", i).isTrue();
            assertThat(row.get("Temp").asDouble()).as("Temp at row %d", i).isCloseTo(100.0 * i, within(1e-6));
        }
    }

    @Test
    void shouldExtendPastWatermarkOnReferenceBurst() {
        // Given
        store.addPoint(REF, 1.0, ns(0.0));
        store.addPoint(REF, 1.0, ns(1.0));
        DefaultVirtualTable table = table(VirtualTableOptions.defaults().burstPolicy(new BurstPolicy(10, 3)),
                ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED));
        table.build();
        double watermark = table.lastBuiltTime();

        // When: 25 points arrive at nearly the same instant, short of the next grid time
        for (int i = 0; i < 25; i++) {
            store.addPoint(REF, 2.0, ns(1.01));
        }
        BuildResult burst = table.rebuild();
        BuildResult idle = table.rebuild();

        // Then
        assertThat(burst.getStatus()).isEqualTo(BuildStatus.EXTENDED);
        assertThat(burst.getRowsAdded()).isEqualTo(2);
        assertThat(table.lastBuiltTime()).isCloseTo(watermark + 0.2, within(1e-9));
        assertThat(idle.getStatus()).isEqualTo(BuildStatus.UP_TO_DATE);
        verify(sink).report(contains("Reference burst"), eq(DiagnosticLevel.INFO));
    }

    @Test
    void shouldStayIdleOnBurstWhenPolicyIsDisabled() {
        store.addPoint(REF, 1.0, ns(0.0));
        store.addPoint(REF, 1.0, ns(1.0));
        DefaultVirtualTable table = table(VirtualTableOptions.defaults().burstPolicy(BurstPolicy.disabled()),
                ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED));
        table.build();

        for (int i = 0; i < 5_000; i++) {
            store.addPoint(REF, 2.0, ns(1.01));
        }

        assertThat(table.rebuild().getStatus()).isEqualTo(BuildStatus.UP_TO_DATE);
    }

    @Test
    void shouldSeedForwardFillFromLastRowAfterPruning() {
        // Given
        store.addPoint(REF, 1.0, ns(0.0));
        store.addPoint("gate", "OPEN", ns(0.0));
        store.addPoint(REF, 1.0, ns(1.0));
        DefaultVirtualTable table = table(ColumnSpec.of("Gate", "gate", ChannelPolicy.ASYNCHRONOUS));
        table.build();
        table.pruneRows(0);

        // When
        store.addPoint(REF, 1.0, ns(2.0));
        BuildResult result = table.rebuild();

        // Then
        assertThat(result.getRowsAdded()).isEqualTo(10);
        assertThat(table.rows()).allSatisfy(row -> assertThat(row.get("Gate").asText()).isEqualTo("OPEN"));
        assertThat(table.rowAt(0).getIndex()).isEqualTo(11);
    }

    @Test
    void shouldSwitchToTimestampTimeBaseWhenNewestPointIsImplausible() {
        // Given
        ChannelLedger ledger = new ChannelLedger(REF);
        for (int k = 0; k <= 10; k++) {
            ledger.addPoint(PointValue.ofNumber(k), T0 + k * 100_000_000L, T0);
        }
        TelemetryStore mockedStore = mock(TelemetryStore.class);
        when(mockedStore.ledger(REF)).thenReturn(ledger);
        DefaultVirtualTable table = new DefaultVirtualTable(mockedStore, REF, 10.0,
                List.of(ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED)), sink, VirtualTableOptions.defaults());
        table.build();
        assertThat(table.rowCount()).isEqualTo(11);

        // When: the newest point carries an elapsed time computed against a reference three days back
        long threeDays = 3L * 86_400 * 1_000_000_000L;
        ledger.addPoint(PointValue.ofNumber(11), T0 + 1_100_000_000L, T0 - threeDays);
        BuildResult result = table.rebuild();

        // Then
        assertThat(result.getStatus()).isEqualTo(BuildStatus.EXTENDED);
        assertThat(result.getRowsAdded()).isEqualTo(1);
        assertThat(table.rowAt(11).getTimestamp()).isCloseTo(1.1, within(1e-9));
        assertThat(table.rowAt(11).get("Ref").asDouble()).isEqualTo(11.0);
        assertThat(table.timeBase().isReprojected()).isTrue();
        verify(sink).report(contains("Timing anomaly"), eq(DiagnosticLevel.INFO));
    }

    @Test
    void shouldFailRebuildWhenNewestPointCannotBeRecovered() {
        // Given
        store.addPoint(REF, 1.0, ns(0.0));
        store.addPoint(REF, 1.0, ns(1.0));
        DefaultVirtualTable table = table(ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED));
        table.build();
        int rows = table.rowCount();

        // When
        store.addPoint(REF, 1.0, T0 + 3L * 86_400 * 1_000_000_000L);
        BuildResult result = table.rebuild();

        // Then
        assertThat(result.getStatus()).isEqualTo(BuildStatus.STRUCTURAL_ERROR);
        assertThat(table.rowCount()).isEqualTo(rows);
        verify(sink).report(contains("implausible elapsed time"), eq(DiagnosticLevel.ERROR));
    }

    @Test
    void shouldNeverMoveWatermarkBackwards() {
        store.addPoint(REF, 1.0, ns(0.0));
        store.addPoint(REF, 1.0, ns(1.0));
        DefaultVirtualTable table = table(ColumnSpec.of("Ref", REF, ChannelPolicy.SYNCHRONIZED));
        table.build();
        double watermark = table.lastBuiltTime();

        // 迟到的旧点不会让表收缩或回退
        store.addPoint(REF, 1.0, ns(0.5));
        table.rebuild();

        assertThat(table.lastBuiltTime()).isGreaterThanOrEqualTo(watermark);
        assertThat(table.rowCount()).isEqualTo(11);
    }
}
