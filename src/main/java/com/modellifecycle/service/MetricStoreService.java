package com.modellifecycle.service;

import com.modellifecycle.domain.AlertEvent;
import com.modellifecycle.domain.ColumnDrift;
import com.modellifecycle.domain.DriftReport;
import com.modellifecycle.dto.DriftReportResponse;
import com.modellifecycle.dto.LifecycleEventResponse;
import com.modellifecycle.entity.AlertEventRecord;
import com.modellifecycle.entity.AlertOrigin;
import com.modellifecycle.entity.ColumnDriftEntry;
import com.modellifecycle.entity.DriftReportRecord;
import com.modellifecycle.entity.LifecycleEventRecord;
import com.modellifecycle.entity.LifecycleEventType;
import com.modellifecycle.entity.TrainingMetricRecord;
import com.modellifecycle.repository.AlertEventRepository;
import com.modellifecycle.repository.DriftReportRepository;
import com.modellifecycle.repository.LifecycleEventRepository;
import com.modellifecycle.repository.TrainingMetricRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class MetricStoreService {

    private static final int MAX_DETAIL_LENGTH = 2000;

    private final DriftReportRepository    driftReportRepository;
    private final AlertEventRepository     alertEventRepository;
    private final LifecycleEventRepository lifecycleEventRepository;
    private final TrainingMetricRepository trainingMetricRepository;

    @Transactional
    public DriftReport recordDriftReport(String modelName, DriftReport report) {
        DriftReportRecord saved = driftReportRepository.save(DriftReportRecord.builder()
            .modelName(modelName)
            .generatedAt(Instant.now())
            .referenceWindow(report.getReferenceWindow())
            .currentWindow(report.getCurrentWindow())
            .columnDriftCount(report.getColumnDriftCount())
            .totalColumns(report.getTotalColumns())
            .missingValueShare(report.getMissingValueShare())
            .predictionDriftScore(report.getPredictionDriftScore())
            .columns(report.getColumns().stream().map(this::toEntry).collect(Collectors.toCollection(ArrayList::new)))
            .build());
        log.info("Drift report recorded | id={} | model={} | driftedColumns={}/{} | missingShare={} | predictionDrift={}",
            saved.getId(), modelName, saved.getColumnDriftCount(), saved.getTotalColumns(),
            saved.getMissingValueShare(), saved.getPredictionDriftScore());
        return toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Optional<DriftReport> findDriftReport(UUID reportId) {
        return driftReportRepository.findById(reportId).map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public Page<DriftReportResponse> getDriftHistory(String modelName, Instant from, Instant to, Pageable pageable) {
        Instant effectiveFrom = from != null ? from : Instant.EPOCH;
        Instant effectiveTo = to != null ? to : Instant.now();
        return driftReportRepository.findHistory(modelName, effectiveFrom, effectiveTo, pageable)
            .map(r -> DriftReportResponse.from(toDomain(r)));
    }

    // a known alert id is returned as stored
    @Transactional
    public AlertEvent recordAlert(String alertId, String modelName, UUID sourceReportId,
                                  int severity, AlertOrigin origin, String requestId) {
        String id = alertId != null ? alertId : UUID.randomUUID().toString();
        Optional<AlertEventRecord> existing = alertEventRepository.findById(id);
        if (existing.isPresent()) {
            return toDomain(existing.get());
        }
        AlertEventRecord saved = alertEventRepository.save(AlertEventRecord.builder()
            .alertId(id)
            .modelName(modelName)
            .sourceReportId(sourceReportId)
            .severity(severity)
            .origin(origin)
            .consumed(false)
            .triggeredAt(Instant.now())
            .build());
        recordEvent(LifecycleEventRecord.builder()
            .modelName(modelName)
            .eventType(LifecycleEventType.ALERT_RECORDED)
            .alertId(id)
            .detail("severity=" + severity + ", origin=" + origin + ", sourceReport=" + sourceReportId)
            .requestId(requestId));
        log.info("Alert recorded | alertId={} | model={} | severity={} | origin={}", id, modelName, severity, origin);
        return toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Optional<AlertEvent> findAlert(String alertId) {
        return alertEventRepository.findById(alertId).map(this::toDomain);
    }

    @Transactional
    public void markAlertConsumed(String alertId) {
        alertEventRepository.findById(alertId).ifPresent(alert -> {
            if (!alert.isConsumed()) {
                alert.setConsumed(true);
                alert.setConsumedAt(Instant.now());
                alertEventRepository.save(alert);
            }
        });
    }

    @Transactional
    public void recordTrainingMetric(String modelName, String trainingRunId, UUID jobId,
                                     double validationScore, Map<String, Object> hyperparameters) {
        trainingMetricRepository.save(TrainingMetricRecord.builder()
            .modelName(modelName)
            .trainingRunId(trainingRunId)
            .jobId(jobId)
            .validationScore(validationScore)
            .hyperparameters(hyperparameters)
            .recordedAt(Instant.now())
            .build());
    }

    @Transactional
    public LifecycleEventRecord recordEvent(LifecycleEventRecord.LifecycleEventRecordBuilder event) {
        LifecycleEventRecord record = event.occurredAt(Instant.now()).build();
        if (record.getDetail() != null && record.getDetail().length() > MAX_DETAIL_LENGTH) {
            record = event.detail(record.getDetail().substring(0, MAX_DETAIL_LENGTH)).build();
        }
        return lifecycleEventRepository.save(record);
    }

    @Transactional(readOnly = true)
    public Page<LifecycleEventResponse> getEvents(String modelName, Pageable pageable) {
        return lifecycleEventRepository.findByModelNameOrderByOccurredAtDesc(modelName, pageable)
            .map(this::toResponse);
    }

    @Transactional(readOnly = true)
    public List<LifecycleEventResponse> getJobEvents(UUID jobId) {
        return lifecycleEventRepository.findByJobIdOrderByOccurredAtAsc(jobId).stream()
            .map(this::toResponse)
            .toList();
    }

    private ColumnDriftEntry toEntry(ColumnDrift c) {
        return ColumnDriftEntry.builder()
            .columnName(c.getColumn())
            .columnType(c.getType())
            .distance(c.getDistance())
            .missingShare(c.getMissingShare())
            .drifted(c.isDrifted())
            .build();
    }

    private DriftReport toDomain(DriftReportRecord r) {
        return DriftReport.builder()
            .reportId(r.getId())
            .modelName(r.getModelName())
            .generatedAt(r.getGeneratedAt())
            .referenceWindow(r.getReferenceWindow())
            .currentWindow(r.getCurrentWindow())
            .columnDriftCount(r.getColumnDriftCount())
            .totalColumns(r.getTotalColumns())
            .missingValueShare(r.getMissingValueShare())
            .predictionDriftScore(r.getPredictionDriftScore())
            .columns(r.getColumns().stream()
                .map(e -> ColumnDrift.builder()
                    .column(e.getColumnName())
                    .type(e.getColumnType())
                    .distance(e.getDistance())
                    .missingShare(e.getMissingShare())
                    .drifted(e.isDrifted())
                    .build())
                .toList())
            .build();
    }

    private AlertEvent toDomain(AlertEventRecord r) {
        return AlertEvent.builder()
            .alertId(r.getAlertId())
            .modelName(r.getModelName())
            .sourceReportId(r.getSourceReportId())
            .severity(r.getSeverity())
            .origin(r.getOrigin())
            .consumed(r.isConsumed())
            .triggeredAt(r.getTriggeredAt())
            .build();
    }

    private LifecycleEventResponse toResponse(LifecycleEventRecord r) {
        return LifecycleEventResponse.builder()
            .eventId(r.getId())
            .modelName(r.getModelName())
            .eventType(r.getEventType())
            .jobId(r.getJobId())
            .alertId(r.getAlertId())
            .versionNumber(r.getVersionNumber())
            .fromStage(r.getFromStage())
            .toStage(r.getToStage())
            .detail(r.getDetail())
            .requestId(r.getRequestId())
            .occurredAt(r.getOccurredAt())
            .build();
    }
}
