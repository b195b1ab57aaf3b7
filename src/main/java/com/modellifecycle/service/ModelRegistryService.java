package com.modellifecycle.service;

import com.modellifecycle.domain.ModelVersion;
import com.modellifecycle.dto.RegisterVersionRequest;
import com.modellifecycle.entity.LifecycleEventRecord;
import com.modellifecycle.entity.LifecycleEventType;
import com.modellifecycle.entity.ModelStage;
import com.modellifecycle.entity.ModelVersionRecord;
import com.modellifecycle.exception.DuplicateVersionException;
import com.modellifecycle.exception.ModelVersionNotFoundException;
import com.modellifecycle.exception.NoStagingCandidateException;
import com.modellifecycle.exception.ProductionModelNotFoundException;
import com.modellifecycle.exception.ValidationException;
import com.modellifecycle.repository.ModelVersionRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Stage machine NONE → STAGING → PRODUCTION → ARCHIVED. Writes run under the model's REGISTRY lock;
 * the Production pointer is swapped after commit, so readers never block on a promotion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    private static final Pattern MODEL_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]{1,100}$");

    // best first: score desc, earliest created, lowest version number
    static final Comparator<ModelVersionRecord> RANKING = Comparator
        .comparingDouble(ModelVersionRecord::getValidationScore).reversed()
        .thenComparing(ModelVersionRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparingInt(ModelVersionRecord::getVersionNumber);

    private final ModelVersionRepository repository;
    private final MetricStoreService     metricStore;
    private final ModelLockRegistry      locks;
    private final TransactionTemplate    transactionTemplate;

    private final ConcurrentHashMap<String, ModelVersion> productionPointers = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        repository.findByStage(ModelStage.PRODUCTION)
            .forEach(r -> productionPointers.put(r.getModelName(), toDomain(r)));
        log.info("Model registry initialised | productionModels={}", productionPointers.size());
    }

    public ModelVersion register(String modelName, RegisterVersionRequest request, String requestId) {
        validateModelName(modelName);
        Map<String, Object> hyperparameters = validateHyperparameters(request.getHyperparameters());
        if (request.getValidationScore() == null || !Double.isFinite(request.getValidationScore())) {
            throw new ValidationException("validationScore must be a finite number");
        }

        return locks.withLock(ModelLockRegistry.Scope.REGISTRY, modelName, () -> transactionTemplate.execute(status -> {
            if (repository.existsByModelNameAndTrainingRunId(modelName, request.getTrainingRunId())) {
                throw new DuplicateVersionException(modelName, "training run '" + request.getTrainingRunId() + "'");
            }
            int versionNumber;
            if (request.getVersionNumber() != null) {
                versionNumber = request.getVersionNumber();
                if (repository.existsByModelNameAndVersionNumber(modelName, versionNumber)) {
                    throw new DuplicateVersionException(modelName, "version number " + versionNumber);
                }
            } else {
                Integer max = repository.findMaxVersionNumber(modelName);
                versionNumber = max != null ? max + 1 : 1;
            }

            ModelVersionRecord saved = repository.save(ModelVersionRecord.builder()
                .modelName(modelName)
                .versionNumber(versionNumber)
                .trainingRunId(request.getTrainingRunId())
                .validationScore(request.getValidationScore())
                .hyperparameters(hyperparameters)
                .stage(ModelStage.NONE)
                .artifactReference(request.getArtifactReference())
                .createdAt(Instant.now())
                .build());

            metricStore.recordEvent(LifecycleEventRecord.builder()
                .modelName(modelName)
                .eventType(LifecycleEventType.VERSION_REGISTERED)
                .versionNumber(versionNumber)
                .toStage(ModelStage.NONE)
                .detail("trainingRunId=" + request.getTrainingRunId() + ", validationScore=" + request.getValidationScore())
                .requestId(requestId));
            log.info("Model version registered | model={} | version={} | run={} | score={} | requestId={}",
                modelName, versionNumber, request.getTrainingRunId(), request.getValidationScore(), requestId);
            return toDomain(saved);
        }));
    }

    public List<ModelVersion> promoteTopK(String modelName, int k, String requestId) {
        validateModelName(modelName);
        if (k < 0) {
            throw new ValidationException("k must be >= 0");
        }
        return locks.withLock(ModelLockRegistry.Scope.REGISTRY, modelName, () -> transactionTemplate.execute(status -> {
            List<ModelVersionRecord> candidates = new ArrayList<>(
                repository.findByModelNameAndStageIn(modelName, EnumSet.of(ModelStage.NONE, ModelStage.STAGING)));
            candidates.sort(RANKING);

            Instant now = Instant.now();
            List<ModelVersionRecord> changed = new ArrayList<>();
            List<ModelVersion> staging = new ArrayList<>();
            for (int i = 0; i < candidates.size(); i++) {
                ModelVersionRecord candidate = candidates.get(i);
                ModelStage target = i < k ? ModelStage.STAGING : ModelStage.NONE;
                if (candidate.getStage() != target) {
                    recordStageChange(candidate, target, now, requestId);
                    changed.add(candidate);
                }
                if (target == ModelStage.STAGING) {
                    staging.add(toDomain(candidate));
                }
            }
            repository.saveAll(changed);
            log.info("Top-k promotion | model={} | k={} | candidates={} | staging={} | changed={} | requestId={}",
                modelName, k, candidates.size(), staging.stream().map(ModelVersion::getVersionNumber).toList(),
                changed.size(), requestId);
            return staging;
        }));
    }

    public ProductionPromotion promoteProduction(String modelName, String requestId) {
        validateModelName(modelName);
        return locks.withLock(ModelLockRegistry.Scope.REGISTRY, modelName, () -> {
            ProductionPromotion promotion = transactionTemplate.execute(status -> {
                ModelVersionRecord best = repository.findByModelNameAndStage(modelName, ModelStage.STAGING).stream()
                    .min(RANKING)
                    .orElseThrow(() -> new NoStagingCandidateException(modelName));

                Instant now = Instant.now();
                List<ModelVersionRecord> changed = new ArrayList<>();
                ModelVersion archived = null;
                for (ModelVersionRecord current : repository.findByModelNameAndStage(modelName, ModelStage.PRODUCTION)) {
                    recordStageChange(current, ModelStage.ARCHIVED, now, requestId);
                    changed.add(current);
                    archived = toDomain(current);
                }
                recordStageChange(best, ModelStage.PRODUCTION, now, requestId);
                changed.add(best);
                repository.saveAll(changed);
                return new ProductionPromotion(toDomain(best), archived);
            });
            productionPointers.put(modelName, promotion.promoted());
            log.info("Production promotion | model={} | version={} | archived={} | requestId={}",
                modelName, promotion.promoted().getVersionNumber(),
                promotion.archived() != null ? promotion.archived().getVersionNumber() : null, requestId);
            return promotion;
        });
    }

    public ModelVersion getProduction(String modelName) {
        ModelVersion pointer = productionPointers.get(modelName);
        if (pointer != null) {
            return pointer;
        }
        ModelVersion loaded = repository.findByModelNameAndStage(modelName, ModelStage.PRODUCTION).stream()
            .findFirst()
            .map(this::toDomain)
            .orElseThrow(() -> new ProductionModelNotFoundException(modelName));
        ModelVersion raced = productionPointers.putIfAbsent(modelName, loaded);
        return raced != null ? raced : loaded;
    }

    public Optional<ModelVersion> findProduction(String modelName) {
        try {
            return Optional.of(getProduction(modelName));
        } catch (ProductionModelNotFoundException ex) {
            return Optional.empty();
        }
    }

    @Transactional(readOnly = true)
    public List<ModelVersion> listVersions(String modelName) {
        return repository.findByModelNameOrderByVersionNumberAsc(modelName).stream()
            .map(this::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public ModelVersion getVersion(String modelName, int versionNumber) {
        return repository.findByModelNameAndVersionNumber(modelName, versionNumber)
            .map(this::toDomain)
            .orElseThrow(() -> new ModelVersionNotFoundException(modelName, versionNumber));
    }

    private void recordStageChange(ModelVersionRecord record, ModelStage target, Instant now, String requestId) {
        ModelStage from = record.getStage();
        record.setStage(target);
        record.setStageChangedAt(now);
        metricStore.recordEvent(LifecycleEventRecord.builder()
            .modelName(record.getModelName())
            .eventType(LifecycleEventType.STAGE_CHANGED)
            .versionNumber(record.getVersionNumber())
            .fromStage(from)
            .toStage(target)
            .detail("validationScore=" + record.getValidationScore())
            .requestId(requestId));
    }

    private void validateModelName(String modelName) {
        if (modelName == null || !MODEL_NAME_PATTERN.matcher(modelName).matches()) {
            throw new ValidationException("Model name must match ^[a-zA-Z0-9._-]{1,100}$");
        }
    }

    private Map<String, Object> validateHyperparameters(Map<String, Object> hyperparameters) {
        if (hyperparameters == null) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        hyperparameters.forEach((key, value) -> {
            if (value != null && !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new ValidationException("Hyperparameter '" + key + "' must be a string, number or boolean");
            }
            copy.put(key, value);
        });
        return copy;
    }

    private ModelVersion toDomain(ModelVersionRecord r) {
        return ModelVersion.builder()
            .id(r.getId())
            .modelName(r.getModelName())
            .versionNumber(r.getVersionNumber())
            .trainingRunId(r.getTrainingRunId())
            .validationScore(r.getValidationScore())
            .hyperparameters(r.getHyperparameters() != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(r.getHyperparameters()))
                : Map.of())
            .stage(r.getStage())
            .artifactReference(r.getArtifactReference())
            .createdAt(r.getCreatedAt())
            .stageChangedAt(r.getStageChangedAt())
            .build();
    }

    public record ProductionPromotion(ModelVersion promoted, ModelVersion archived) {}
}
