package com.modellifecycle.service;

import com.modellifecycle.client.SnapshotProviderClient;
import com.modellifecycle.domain.AlertEvent;
import com.modellifecycle.domain.BreachedCondition;
import com.modellifecycle.domain.ColumnType;
import com.modellifecycle.domain.DriftReport;
import com.modellifecycle.domain.TabularSnapshot;
import com.modellifecycle.domain.ThresholdConfig;
import com.modellifecycle.domain.TriggerOutcome;
import com.modellifecycle.dto.DriftCheckResponse;
import com.modellifecycle.dto.RetrainTriggerResponse;
import com.modellifecycle.dto.SnapshotPayload;
import com.modellifecycle.dto.ThresholdOverrides;
import com.modellifecycle.entity.AlertOrigin;
import com.modellifecycle.entity.LifecycleEventRecord;
import com.modellifecycle.entity.LifecycleEventType;
import com.modellifecycle.exception.SnapshotProviderException;
import com.modellifecycle.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DriftMonitoringServiceTest {

    private static final String MODEL = "fraud_model";

    @Mock MetricStoreService     metricStore;
    @Mock RetrainService         retrainService;
    @Mock SnapshotProviderClient snapshotClient;

    private DriftMonitoringService service;

    @BeforeEach
    void setUp() {
        service = new DriftMonitoringService(new DriftEvaluator(), new AlertPolicy(), metricStore, retrainService, snapshotClient);
        ReflectionTestUtils.setField(service, "defaultMaxMissingShare", 0.1);
        ReflectionTestUtils.setField(service, "defaultMaxDriftedColumns", 0);
        ReflectionTestUtils.setField(service, "defaultMaxPredictionDrift", 0.2);
        ReflectionTestUtils.setField(service, "monitoringEnabled", true);
        ReflectionTestUtils.setField(service, "monitoredModels", List.of(MODEL));
    }

    private static List<Double> range(int rows, double shift) {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            values.add(i + shift);
        }
        return values;
    }

    private void recordReportsWithIds() {
        when(metricStore.recordDriftReport(eq(MODEL), any(DriftReport.class))).thenAnswer(inv -> {
            DriftReport report = inv.getArgument(1);
            return report.toBuilder().reportId(UUID.randomUUID()).modelName(MODEL).generatedAt(Instant.now()).build();
        });
    }

    @Test
    void checkDrift_withoutBreach_recordsReportOnly() {
        recordReportsWithIds();
        TabularSnapshot snapshot = TabularSnapshot.builder("ds").numeric("amount", range(100, 0)).build();

        DriftCheckResponse response = service.checkDrift(MODEL, snapshot, snapshot, null, "req-1");

        assertThat(response.isAlertFired()).isFalse();
        assertThat(response.getSeverity()).isZero();
        assertThat(response.getReport().getReportId()).isNotNull();
        assertThat(response.getAlert()).isNull();
        verify(metricStore, never()).recordAlert(any(), any(), any(), anyInt(), any(), any());
        verifyNoInteractions(retrainService);
    }

    @Test
    void checkDrift_onBreach_recordsInternalAlertAndTriggersRetrain() {
        recordReportsWithIds();
        AlertEvent alert = AlertEvent.builder().alertId("alert-1").modelName(MODEL).severity(1)
            .origin(AlertOrigin.INTERNAL).triggeredAt(Instant.now()).build();
        when(metricStore.recordAlert(isNull(), eq(MODEL), any(UUID.class), eq(1), eq(AlertOrigin.INTERNAL), eq("req-2")))
            .thenReturn(alert);
        when(retrainService.onAlert(alert, null, "req-2"))
            .thenReturn(RetrainTriggerResponse.builder().outcome(TriggerOutcome.QUEUED).build());

        DriftCheckResponse response = service.checkDrift(MODEL,
            TabularSnapshot.builder("ref").numeric("amount", range(100, 0)).build(),
            TabularSnapshot.builder("cur").numeric("amount", range(100, 50)).build(),
            null, "req-2");

        assertThat(response.isAlertFired()).isTrue();
        assertThat(response.getBreaches()).containsExactly(BreachedCondition.COLUMN_DRIFT);
        assertThat(response.getAlert().getAlertId()).isEqualTo("alert-1");
        assertThat(response.getRetrain().getOutcome()).isEqualTo(TriggerOutcome.QUEUED);
    }

    @Test
    void checkDrift_overridesCanSuppressAlert() {
        recordReportsWithIds();

        DriftCheckResponse response = service.checkDrift(MODEL,
            TabularSnapshot.builder("ref").numeric("amount", range(100, 0)).build(),
            TabularSnapshot.builder("cur").numeric("amount", range(100, 50)).build(),
            ThresholdOverrides.builder().maxDriftedColumns(1).build(), "req-3");

        assertThat(response.isAlertFired()).isFalse();
        assertThat(response.getReport().getColumnDriftCount()).isEqualTo(1);
    }

    @Test
    void resolveThresholds_fallsBackPerField() {
        ThresholdConfig resolved = service.resolveThresholds(
            ThresholdOverrides.builder().maxPredictionDrift(0.5).build());

        assertThat(resolved.getMaxMissingShare()).isEqualTo(0.1);
        assertThat(resolved.getMaxDriftedColumns()).isZero();
        assertThat(resolved.getMaxPredictionDrift()).isEqualTo(0.5);
        assertThatThrownBy(() -> service.resolveThresholds(ThresholdOverrides.builder().maxMissingShare(2.0).build()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void evaluateModel_providerFailure_isRecordedAndSwallowedPerModel() {
        when(snapshotClient.reference(MODEL))
            .thenReturn(Mono.error(new SnapshotProviderException("Snapshot provider unreachable")));

        service.evaluateModel(MODEL);

        ArgumentCaptor<LifecycleEventRecord.LifecycleEventRecordBuilder> event =
            ArgumentCaptor.forClass(LifecycleEventRecord.LifecycleEventRecordBuilder.class);
        verify(metricStore).recordEvent(event.capture());
        assertThat(event.getValue().build().getEventType()).isEqualTo(LifecycleEventType.EVALUATION_FAILED);
        verify(metricStore, never()).recordDriftReport(anyString(), any());
    }

    @Test
    void scheduledEvaluation_pullsSnapshotsForConfiguredModels() {
        recordReportsWithIds();
        SnapshotPayload payload = SnapshotPayload.builder()
            .datasetId("transactions")
            .columns(List.of(SnapshotPayload.ColumnPayload.builder()
                .name("amount").type(ColumnType.NUMERIC)
                .values(new ArrayList<>(range(20, 0))).build()))
            .build();
        when(snapshotClient.reference(MODEL)).thenReturn(Mono.just(payload));
        when(snapshotClient.current(MODEL)).thenReturn(Mono.just(payload));

        service.scheduledEvaluation();

        verify(metricStore).recordDriftReport(eq(MODEL), any(DriftReport.class));
        verifyNoInteractions(retrainService);
    }

    @Test
    void scheduledEvaluation_disabled_doesNothing() {
        ReflectionTestUtils.setField(service, "monitoringEnabled", false);

        service.scheduledEvaluation();

        verifyNoInteractions(snapshotClient, metricStore);
    }
}
