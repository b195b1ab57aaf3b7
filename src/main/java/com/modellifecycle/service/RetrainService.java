package com.modellifecycle.service;

import com.modellifecycle.client.TrainingPipelineClient;
import com.modellifecycle.client.TrainingPipelineClient.TrainingRunResult;
import com.modellifecycle.domain.AlertEvent;
import com.modellifecycle.domain.DriftReport;
import com.modellifecycle.domain.ModelVersion;
import com.modellifecycle.domain.PromotionPolicy;
import com.modellifecycle.domain.TriggerOutcome;
import com.modellifecycle.dto.AlertNotificationRequest;
import com.modellifecycle.dto.LifecycleEventResponse;
import com.modellifecycle.dto.RegisterVersionRequest;
import com.modellifecycle.dto.RetrainJobResponse;
import com.modellifecycle.dto.RetrainTriggerResponse;
import com.modellifecycle.entity.AlertOrigin;
import com.modellifecycle.entity.LifecycleEventRecord;
import com.modellifecycle.entity.LifecycleEventType;
import com.modellifecycle.entity.RetrainJobRecord;
import com.modellifecycle.entity.RetrainJobStatus;
import com.modellifecycle.entity.TriggerSource;
import com.modellifecycle.exception.JobNotCancellableException;
import com.modellifecycle.exception.PipelineFailureException;
import com.modellifecycle.exception.RetrainJobNotFoundException;
import com.modellifecycle.exception.ValidationException;
import com.modellifecycle.repository.RetrainJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-model retrain state machine: Idle → QUEUED → RUNNING → Idle.
 * At most one job per model is QUEUED or RUNNING; the pipeline call runs outside every lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainService {

    private final RetrainJobRepository   jobRepository;
    private final MetricStoreService     metricStore;
    private final ModelRegistryService   registry;
    private final ModelLockRegistry      locks;
    private final TransactionTemplate    transactionTemplate;
    private final TrainingPipelineClient pipelineClient;
    private final RetrainWorker          worker;

    @Value("${lifecycle.retrain.retry-budget:1}")
    private int retryBudget;

    @Value("${lifecycle.retrain.retry-backoff-ms:2000}")
    private long retryBackoffMillis;

    @Value("${lifecycle.retrain.pipeline-timeout-seconds:1800}")
    private long pipelineTimeoutSeconds;

    @Value("${lifecycle.retrain.promotion-policy:IF_BETTER}")
    private PromotionPolicy promotionPolicy;

    @Value("${lifecycle.retrain.top-k:3}")
    private int topK;

    @Value("${lifecycle.retrain.default-dataset-reference:latest}")
    private String defaultDatasetReference;

    @Value("${lifecycle.retrain.terminal-commit-attempts:3}")
    private int terminalCommitAttempts;

    public RetrainTriggerResponse triggerManual(String modelName, String datasetReference, String requestId) {
        return enqueue(modelName, TriggerSource.MANUAL, null, datasetReference, requestId);
    }

    public RetrainTriggerResponse onAlert(AlertEvent alert, String datasetReference, String requestId) {
        return enqueue(alert.getModelName(), TriggerSource.ALERT, alert.getAlertId(), datasetReference, requestId);
    }

    // delivery is at-least-once: a replay of a consumed alert id is a DUPLICATE_ALERT
    public RetrainTriggerResponse onAlertNotification(AlertNotificationRequest notification, String requestId) {
        String modelName = resolveModelName(notification);
        return locks.withLock(ModelLockRegistry.Scope.RETRAIN, modelName, () -> {
            AlertEvent alert = metricStore.recordAlert(notification.getAlertId(), modelName,
                notification.getSourceReportId(), notification.getSeverity(), AlertOrigin.INBOUND, requestId);
            if (!alert.getModelName().equals(modelName)) {
                throw new ValidationException("Alert '" + alert.getAlertId() + "' belongs to model '"
                    + alert.getModelName() + "', not '" + modelName + "'");
            }
            return onAlert(alert, notification.getDatasetReference(), requestId);
        });
    }

    private RetrainTriggerResponse enqueue(String modelName, TriggerSource source, String alertId,
                                           String datasetReference, String requestId) {
        if (modelName == null || modelName.isBlank()) {
            throw new ValidationException("modelName is required");
        }
        String dataset = datasetReference == null || datasetReference.isBlank()
            ? defaultDatasetReference : datasetReference;

        RetrainTriggerResponse response = locks.withLock(ModelLockRegistry.Scope.RETRAIN, modelName,
            () -> transactionTemplate.execute(status -> {
                if (alertId != null) {
                    if (metricStore.findAlert(alertId).map(AlertEvent::isConsumed).orElse(false)) {
                        Optional<RetrainJobRecord> handledBy = jobRepository
                            .findFirstByTriggeringAlertIdOrderByQueuedAtDesc(alertId);
                        log.info("Duplicate alert ignored | alertId={} | model={} | jobId={} | requestId={}",
                            alertId, modelName, handledBy.map(RetrainJobRecord::getId).orElse(null), requestId);
                        return RetrainTriggerResponse.builder()
                            .outcome(TriggerOutcome.DUPLICATE_ALERT)
                            .message(handledBy
                                .map(j -> "Alert '" + alertId + "' was already handled by job " + j.getId())
                                .orElse("Alert '" + alertId + "' was already consumed while another job was in flight"))
                            .job(handledBy.map(this::toResponse).orElse(null))
                            .build();
                    }
                    metricStore.markAlertConsumed(alertId);
                }

                Optional<RetrainJobRecord> inFlight = jobRepository
                    .findFirstByModelNameAndStatusInOrderByQueuedAtAsc(modelName, RetrainJobStatus.IN_FLIGHT);
                if (inFlight.isPresent()) {
                    metricStore.recordEvent(LifecycleEventRecord.builder()
                        .modelName(modelName)
                        .eventType(LifecycleEventType.RETRAIN_REJECTED)
                        .jobId(inFlight.get().getId())
                        .alertId(alertId)
                        .detail("trigger=" + source + ", inFlightStatus=" + inFlight.get().getStatus())
                        .requestId(requestId));
                    log.info("Retrain rejected, job in flight | model={} | source={} | inFlightJob={} | requestId={}",
                        modelName, source, inFlight.get().getId(), requestId);
                    return RetrainTriggerResponse.builder()
                        .outcome(TriggerOutcome.REJECTED_ALREADY_IN_FLIGHT)
                        .message("Model '" + modelName + "' already has a retrain job " + inFlight.get().getStatus())
                        .job(toResponse(inFlight.get()))
                        .build();
                }

                RetrainJobRecord job = jobRepository.save(RetrainJobRecord.builder()
                    .modelName(modelName)
                    .status(RetrainJobStatus.QUEUED)
                    .triggerSource(source)
                    .triggeringAlertId(alertId)
                    .datasetReference(dataset)
                    .requestId(requestId)
                    .queuedAt(Instant.now())
                    .attempts(0)
                    .build());
                metricStore.recordEvent(LifecycleEventRecord.builder()
                    .modelName(modelName)
                    .eventType(LifecycleEventType.RETRAIN_QUEUED)
                    .jobId(job.getId())
                    .alertId(alertId)
                    .detail("trigger=" + source + ", dataset=" + dataset)
                    .requestId(requestId));
                log.info("Retrain queued | model={} | jobId={} | source={} | alertId={} | requestId={}",
                    modelName, job.getId(), source, alertId, requestId);
                return RetrainTriggerResponse.builder()
                    .outcome(TriggerOutcome.QUEUED)
                    .message("Retrain job queued")
                    .job(toResponse(job))
                    .build();
            }));

        if (response.getOutcome() == TriggerOutcome.QUEUED) {
            worker.dispatch(response.getJob().getJobId(), this::runJob);
        }
        return response;
    }

    void runJob(UUID jobId) {
        Optional<RetrainJobRecord> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            log.warn("Dispatched retrain job vanished | jobId={}", jobId);
            return;
        }
        try {
            execute(found.get());
        } catch (RuntimeException ex) {
            log.error("Retrain job aborted | model={} | jobId={} | error={}",
                found.get().getModelName(), jobId, describe(ex), ex);
            fail(found.get(), null, "Retrain job aborted: " + describe(ex), null);
        }
    }

    private void execute(RetrainJobRecord queued) {
        RetrainJobRecord job = claim(queued);
        if (job == null) {
            return;
        }
        String modelName = job.getModelName();
        Duration timeout = Duration.ofSeconds(pipelineTimeoutSeconds);
        AtomicInteger attempts = new AtomicInteger();

        TrainingRunResult result;
        try {
            result = Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return pipelineClient.runTraining(modelName, job.getDatasetReference(), job.getRequestId())
                        .timeout(timeout);
                })
                .onErrorMap(TimeoutException.class, ex -> PipelineFailureException.timedOut(timeout))
                .retryWhen(Retry.backoff(Math.max(0, retryBudget), Duration.ofMillis(retryBackoffMillis))
                    .filter(RetrainService::isRetryable)
                    .doBeforeRetry(signal -> recordAttemptFailure(job, attempts.get(), signal.failure()))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
        } catch (RuntimeException ex) {
            fail(job, attempts.get(), "Training pipeline failed after " + attempts.get() + " attempt(s): "
                + describe(ex), null);
            return;
        }
        if (result == null) {
            fail(job, attempts.get(), "Training pipeline returned no result", null);
            return;
        }
        complete(job, result, attempts.get());
    }

    private RetrainJobRecord claim(RetrainJobRecord queued) {
        UUID jobId = queued.getId();
        String modelName = queued.getModelName();
        return locks.withLock(ModelLockRegistry.Scope.RETRAIN, modelName, () -> transactionTemplate.execute(status -> {
            RetrainJobRecord job = jobRepository.findById(jobId).orElse(null);
            if (job == null || job.getStatus() != RetrainJobStatus.QUEUED) {
                log.info("Retrain job no longer queued, skipping | jobId={} | status={}",
                    jobId, job != null ? job.getStatus() : null);
                return null;
            }
            job.setStatus(RetrainJobStatus.RUNNING);
            job.setStartedAt(Instant.now());
            RetrainJobRecord saved = jobRepository.save(job);
            metricStore.recordEvent(LifecycleEventRecord.builder()
                .modelName(modelName)
                .eventType(LifecycleEventType.RETRAIN_STARTED)
                .jobId(jobId)
                .alertId(job.getTriggeringAlertId())
                .detail("dataset=" + job.getDatasetReference())
                .requestId(job.getRequestId()));
            log.info("Retrain started | model={} | jobId={} | dataset={}", modelName, jobId, job.getDatasetReference());
            return saved;
        }));
    }

    private void complete(RetrainJobRecord job, TrainingRunResult result, int attempts) {
        String modelName = job.getModelName();
        locks.withLock(ModelLockRegistry.Scope.RETRAIN, modelName, () -> {
            metricStore.recordTrainingMetric(modelName, result.trainingRunId(), job.getId(),
                result.validationScore(), result.hyperparameters());

            ModelVersion registered;
            try {
                registered = registry.register(modelName, RegisterVersionRequest.builder()
                    .trainingRunId(result.trainingRunId())
                    .validationScore(result.validationScore())
                    .hyperparameters(result.hyperparameters())
                    .artifactReference(result.artifactReference())
                    .build(), job.getRequestId());
            } catch (RuntimeException ex) {
                fail(job, attempts, "Registration of training run '" + result.trainingRunId()
                    + "' failed: " + describe(ex), null);
                return;
            }

            String promotion;
            try {
                promotion = applyPromotionPolicy(modelName, job.getRequestId());
            } catch (RuntimeException ex) {
                fail(job, attempts, "Version " + registered.getVersionNumber()
                    + " registered but promotion failed: " + describe(ex), registered);
                return;
            }

            try {
                commitSucceeded(job, result, attempts, registered, promotion);
            } catch (RuntimeException ex) {
                fail(job, attempts, "Version " + registered.getVersionNumber()
                    + " registered but the job result could not be committed: " + describe(ex), registered);
                return;
            }
            log.info("Retrain succeeded | model={} | jobId={} | version={} | score={} | attempts={} | {}",
                modelName, job.getId(), registered.getVersionNumber(), result.validationScore(), attempts, promotion);
        });
    }

    private void commitSucceeded(RetrainJobRecord job, TrainingRunResult result, int attempts,
                                 ModelVersion registered, String promotion) {
        transactionTemplate.executeWithoutResult(status -> {
            RetrainJobRecord current = reload(job.getId());
            current.setStatus(RetrainJobStatus.SUCCEEDED);
            current.setFinishedAt(Instant.now());
            current.setAttempts(attempts);
            current.setResultingModelVersion(registered.getVersionNumber());
            current.setResultingTrainingRunId(result.trainingRunId());
            jobRepository.save(current);
            metricStore.recordEvent(LifecycleEventRecord.builder()
                .modelName(job.getModelName())
                .eventType(LifecycleEventType.RETRAIN_SUCCEEDED)
                .jobId(job.getId())
                .alertId(job.getTriggeringAlertId())
                .versionNumber(registered.getVersionNumber())
                .detail("run=" + result.trainingRunId() + ", score=" + result.validationScore()
                    + ", attempts=" + attempts + ", " + promotion)
                .requestId(job.getRequestId()));
        });
    }

    private String applyPromotionPolicy(String modelName, String requestId) {
        if (promotionPolicy == PromotionPolicy.REGISTER_ONLY) {
            return "promotion=skipped";
        }
        List<ModelVersion> staging = registry.promoteTopK(modelName, topK, requestId);
        if (staging.isEmpty()) {
            return "promotion=no-staging-candidate";
        }
        if (promotionPolicy == PromotionPolicy.IF_BETTER) {
            ModelVersion best = staging.get(0);
            Optional<ModelVersion> production = registry.findProduction(modelName);
            if (production.isPresent() && best.getValidationScore() <= production.get().getValidationScore()) {
                return "promotion=staging-only (best staging " + best.getValidationScore()
                    + " <= production " + production.get().getValidationScore() + ")";
            }
        }
        ModelVersion promoted = registry.promoteProduction(modelName, requestId).promoted();
        return "promotion=production v" + promoted.getVersionNumber();
    }

    private void recordAttemptFailure(RetrainJobRecord job, int attempt, Throwable failure) {
        log.warn("Retrain attempt failed, retrying | model={} | jobId={} | attempt={} | error={}",
            job.getModelName(), job.getId(), attempt, describe(failure));
        transactionTemplate.executeWithoutResult(status -> {
            RetrainJobRecord current = reload(job.getId());
            current.setAttempts(attempt);
            jobRepository.save(current);
            metricStore.recordEvent(LifecycleEventRecord.builder()
                .modelName(job.getModelName())
                .eventType(LifecycleEventType.RETRAIN_ATTEMPT_FAILED)
                .jobId(job.getId())
                .alertId(job.getTriggeringAlertId())
                .detail("attempt=" + attempt + ": " + describe(failure))
                .requestId(job.getRequestId()));
        });
    }

    // retried under the RETRAIN lock, then written without it so the job never stays in flight
    private void fail(RetrainJobRecord job, Integer attempts, String reason, ModelVersion registered) {
        String modelName = job.getModelName();
        int lockedAttempts = Math.max(1, terminalCommitAttempts);
        for (int attempt = 1; attempt <= lockedAttempts; attempt++) {
            try {
                locks.withLock(ModelLockRegistry.Scope.RETRAIN, modelName,
                    () -> markFailed(job.getId(), attempts, reason, registered));
                log.error("Retrain failed | model={} | jobId={} | attempts={} | reason={}",
                    modelName, job.getId(), attempts, reason);
                return;
            } catch (RuntimeException ex) {
                log.warn("Retrain failure commit did not go through | jobId={} | attempt={}/{} | error={}",
                    job.getId(), attempt, lockedAttempts, describe(ex));
            }
        }
        try {
            markFailed(job.getId(), attempts, reason, registered);
            log.error("Retrain failed | model={} | jobId={} | attempts={} | reason={} | committedWithoutLock=true",
                modelName, job.getId(), attempts, reason);
        } catch (RuntimeException ex) {
            log.error("Retrain job could not be marked FAILED, it stays in flight until restart | model={} | jobId={} | reason={}",
                modelName, job.getId(), reason, ex);
        }
    }

    private void markFailed(UUID jobId, Integer attempts, String reason, ModelVersion registered) {
        transactionTemplate.executeWithoutResult(status -> {
            RetrainJobRecord current = reload(jobId);
            if (!RetrainJobStatus.IN_FLIGHT.contains(current.getStatus())) {
                log.info("Retrain job already terminal, failure not recorded | jobId={} | status={}",
                    jobId, current.getStatus());
                return;
            }
            current.setStatus(RetrainJobStatus.FAILED);
            current.setFinishedAt(Instant.now());
            if (attempts != null) {
                current.setAttempts(attempts);
            }
            current.setFailureReason(truncate(reason));
            if (registered != null) {
                current.setResultingModelVersion(registered.getVersionNumber());
                current.setResultingTrainingRunId(registered.getTrainingRunId());
            }
            jobRepository.save(current);
            metricStore.recordEvent(LifecycleEventRecord.builder()
                .modelName(current.getModelName())
                .eventType(LifecycleEventType.RETRAIN_FAILED)
                .jobId(jobId)
                .alertId(current.getTriggeringAlertId())
                .versionNumber(registered != null ? registered.getVersionNumber() : null)
                .detail(reason)
                .requestId(current.getRequestId()));
        });
    }

    public RetrainJobResponse cancel(UUID jobId, String requestId) {
        String modelName = jobRepository.findById(jobId)
            .map(RetrainJobRecord::getModelName)
            .orElseThrow(() -> new RetrainJobNotFoundException(jobId));
        return locks.withLock(ModelLockRegistry.Scope.RETRAIN, modelName, () -> transactionTemplate.execute(status -> {
            RetrainJobRecord job = reload(jobId);
            if (job.getStatus() != RetrainJobStatus.QUEUED) {
                throw new JobNotCancellableException(jobId, job.getStatus());
            }
            job.setStatus(RetrainJobStatus.CANCELLED);
            job.setFinishedAt(Instant.now());
            RetrainJobRecord saved = jobRepository.save(job);
            metricStore.recordEvent(LifecycleEventRecord.builder()
                .modelName(modelName)
                .eventType(LifecycleEventType.RETRAIN_CANCELLED)
                .jobId(jobId)
                .alertId(job.getTriggeringAlertId())
                .requestId(requestId));
            log.info("Retrain cancelled | model={} | jobId={} | requestId={}", modelName, jobId, requestId);
            return toResponse(saved);
        }));
    }

    public RetrainJobResponse getJob(UUID jobId) {
        return jobRepository.findById(jobId)
            .map(this::toResponse)
            .orElseThrow(() -> new RetrainJobNotFoundException(jobId));
    }

    public Page<RetrainJobResponse> listJobs(String modelName, Pageable pageable) {
        return jobRepository.findByModelNameOrderByQueuedAtDesc(modelName, pageable).map(this::toResponse);
    }

    public List<LifecycleEventResponse> getJobEvents(UUID jobId) {
        if (!jobRepository.existsById(jobId)) {
            throw new RetrainJobNotFoundException(jobId);
        }
        return metricStore.getJobEvents(jobId);
    }

    // RUNNING jobs from a stopped process cannot resume; QUEUED ones are dispatched again
    @EventListener(ApplicationReadyEvent.class)
    public void recoverInFlightJobs() {
        List<RetrainJobRecord> interrupted = jobRepository.findByStatusOrderByQueuedAtAsc(RetrainJobStatus.RUNNING);
        for (RetrainJobRecord job : interrupted) {
            locks.withLock(ModelLockRegistry.Scope.RETRAIN, job.getModelName(), () -> transactionTemplate.executeWithoutResult(status -> {
                RetrainJobRecord current = reload(job.getId());
                if (current.getStatus() != RetrainJobStatus.RUNNING) {
                    return;
                }
                current.setStatus(RetrainJobStatus.FAILED);
                current.setFinishedAt(Instant.now());
                current.setFailureReason("Interrupted by service restart");
                jobRepository.save(current);
                metricStore.recordEvent(LifecycleEventRecord.builder()
                    .modelName(current.getModelName())
                    .eventType(LifecycleEventType.RETRAIN_INTERRUPTED)
                    .jobId(current.getId())
                    .alertId(current.getTriggeringAlertId())
                    .detail("Job was RUNNING when the service stopped"));
            }));
        }
        List<RetrainJobRecord> queued = jobRepository.findByStatusOrderByQueuedAtAsc(RetrainJobStatus.QUEUED);
        queued.forEach(job -> worker.dispatch(job.getId(), this::runJob));
        if (!interrupted.isEmpty() || !queued.isEmpty()) {
            log.info("Retrain recovery | interrupted={} | redispatched={}", interrupted.size(), queued.size());
        }
    }

    private String resolveModelName(AlertNotificationRequest notification) {
        if (notification.getModelName() != null && !notification.getModelName().isBlank()) {
            return notification.getModelName();
        }
        if (notification.getSourceReportId() != null) {
            return metricStore.findDriftReport(notification.getSourceReportId())
                .map(DriftReport::getModelName)
                .orElseThrow(() -> new ValidationException("Unknown source report '"
                    + notification.getSourceReportId() + "' and no modelName given"));
        }
        throw new ValidationException("Alert notification needs a modelName or a known sourceReportId");
    }

    private RetrainJobRecord reload(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new RetrainJobNotFoundException(jobId));
    }

    private static boolean isRetryable(Throwable ex) {
        return ex instanceof PipelineFailureException pipeline && pipeline.isRetryable();
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private static String truncate(String reason) {
        return reason != null && reason.length() > 1000 ? reason.substring(0, 1000) : reason;
    }

    private RetrainJobResponse toResponse(RetrainJobRecord r) {
        return RetrainJobResponse.builder()
            .jobId(r.getId())
            .modelName(r.getModelName())
            .status(r.getStatus())
            .triggerSource(r.getTriggerSource())
            .triggeringAlertId(r.getTriggeringAlertId())
            .datasetReference(r.getDatasetReference())
            .queuedAt(r.getQueuedAt())
            .startedAt(r.getStartedAt())
            .finishedAt(r.getFinishedAt())
            .attempts(r.getAttempts())
            .failureReason(r.getFailureReason())
            .resultingModelVersion(r.getResultingModelVersion())
            .resultingTrainingRunId(r.getResultingTrainingRunId())
            .requestId(r.getRequestId())
            .build();
    }
}
