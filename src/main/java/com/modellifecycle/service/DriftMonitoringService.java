package com.modellifecycle.service;

import com.modellifecycle.client.SnapshotProviderClient;
import com.modellifecycle.domain.AlertDecision;
import com.modellifecycle.domain.AlertEvent;
import com.modellifecycle.domain.DriftReport;
import com.modellifecycle.domain.TabularSnapshot;
import com.modellifecycle.domain.ThresholdConfig;
import com.modellifecycle.dto.AlertEventResponse;
import com.modellifecycle.dto.DriftCheckResponse;
import com.modellifecycle.dto.DriftReportResponse;
import com.modellifecycle.dto.RetrainTriggerResponse;
import com.modellifecycle.dto.SnapshotPayload;
import com.modellifecycle.dto.ThresholdOverrides;
import com.modellifecycle.entity.AlertOrigin;
import com.modellifecycle.entity.LifecycleEventRecord;
import com.modellifecycle.entity.LifecycleEventType;
import com.modellifecycle.exception.SnapshotProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DriftMonitoringService {

    private final DriftEvaluator         evaluator;
    private final AlertPolicy            alertPolicy;
    private final MetricStoreService     metricStore;
    private final RetrainService         retrainService;
    private final SnapshotProviderClient snapshotClient;

    @Value("${lifecycle.alert.max-missing-share:0.1}")
    private double defaultMaxMissingShare;

    @Value("${lifecycle.alert.max-drifted-columns:0}")
    private int defaultMaxDriftedColumns;

    @Value("${lifecycle.alert.max-prediction-drift:0.2}")
    private double defaultMaxPredictionDrift;

    @Value("${lifecycle.monitoring.enabled:false}")
    private boolean monitoringEnabled;

    @Value("${lifecycle.monitoring.models:}")
    private List<String> monitoredModels;

    public DriftCheckResponse checkDrift(String modelName, TabularSnapshot reference, TabularSnapshot current,
                                         ThresholdOverrides overrides, String requestId) {
        ThresholdConfig thresholds = resolveThresholds(overrides);
        DriftReport report = metricStore.recordDriftReport(modelName,
            evaluator.evaluate(reference, current, thresholds));
        AlertDecision decision = alertPolicy.decide(report, thresholds);

        DriftCheckResponse.DriftCheckResponseBuilder response = DriftCheckResponse.builder()
            .report(DriftReportResponse.from(report))
            .alertFired(decision.isFire())
            .severity(decision.getSeverity())
            .breaches(decision.getBreaches());
        if (!decision.isFire()) {
            log.info("Drift check passed | model={} | reportId={} | requestId={}", modelName, report.getReportId(), requestId);
            return response.build();
        }

        AlertEvent alert = metricStore.recordAlert(null, modelName, report.getReportId(),
            decision.getSeverity(), AlertOrigin.INTERNAL, requestId);
        log.warn("Drift alert fired | model={} | reportId={} | alertId={} | severity={} | breaches={} | requestId={}",
            modelName, report.getReportId(), alert.getAlertId(), decision.getSeverity(), decision.getBreaches(), requestId);
        RetrainTriggerResponse retrain = retrainService.onAlert(alert, null, requestId);
        return response
            .alert(AlertEventResponse.from(alert))
            .retrain(retrain)
            .build();
    }

    public Page<DriftReportResponse> getDriftHistory(String modelName, Instant from, Instant to, Pageable pageable) {
        return metricStore.getDriftHistory(modelName, from, to, pageable);
    }

    ThresholdConfig resolveThresholds(ThresholdOverrides overrides) {
        ThresholdConfig.ThresholdConfigBuilder builder = ThresholdConfig.builder()
            .maxMissingShare(defaultMaxMissingShare)
            .maxDriftedColumns(defaultMaxDriftedColumns)
            .maxPredictionDrift(defaultMaxPredictionDrift);
        if (overrides != null) {
            if (overrides.getMaxMissingShare() != null) {
                builder.maxMissingShare(overrides.getMaxMissingShare());
            }
            if (overrides.getMaxDriftedColumns() != null) {
                builder.maxDriftedColumns(overrides.getMaxDriftedColumns());
            }
            if (overrides.getMaxPredictionDrift() != null) {
                builder.maxPredictionDrift(overrides.getMaxPredictionDrift());
            }
        }
        return builder.build().validated();
    }

    @Scheduled(fixedDelayString = "${lifecycle.monitoring.interval-ms:3600000}",
               initialDelayString = "${lifecycle.monitoring.initial-delay-ms:60000}")
    void scheduledEvaluation() {
        if (!monitoringEnabled || monitoredModels == null) {
            return;
        }
        monitoredModels.stream()
            .filter(m -> m != null && !m.isBlank())
            .map(String::trim)
            .forEach(this::evaluateModel);
    }

    void evaluateModel(String modelName) {
        String requestId = "scheduled-" + Instant.now().toEpochMilli();
        try {
            SnapshotPayload reference = snapshotClient.reference(modelName).block();
            SnapshotPayload current = snapshotClient.current(modelName).block();
            if (reference == null || current == null) {
                throw new SnapshotProviderException("Snapshot provider returned no data for '" + modelName + "'");
            }
            DriftCheckResponse result = checkDrift(modelName, reference.toSnapshot(), current.toSnapshot(), null, requestId);
            log.info("Scheduled drift check | model={} | alertFired={} | severity={}",
                modelName, result.isAlertFired(), result.getSeverity());
        } catch (RuntimeException ex) {
            log.error("Scheduled drift check failed | model={} | error={}", modelName, ex.getMessage(), ex);
            metricStore.recordEvent(LifecycleEventRecord.builder()
                .modelName(modelName)
                .eventType(LifecycleEventType.EVALUATION_FAILED)
                .detail(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName())
                .requestId(requestId));
        }
    }
}
