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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelRegistryServiceTest {

    private static final String MODEL = "fraud_model";

    @Mock ModelVersionRepository repository;
    @Mock MetricStoreService     metricStore;
    @Mock PlatformTransactionManager transactionManager;

    private ModelRegistryService registry;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistryService(repository, metricStore, new ModelLockRegistry(),
            new TransactionTemplate(transactionManager));
    }

    private static RegisterVersionRequest request(Integer versionNumber, String runId, double score) {
        return RegisterVersionRequest.builder()
            .versionNumber(versionNumber)
            .trainingRunId(runId)
            .validationScore(score)
            .hyperparameters(Map.of("max_depth", 6, "learning_rate", 0.1))
            .artifactReference("s3://models/" + runId)
            .build();
    }

    private static ModelVersionRecord record(int version, double score, ModelStage stage, Instant createdAt) {
        return ModelVersionRecord.builder()
            .id(UUID.randomUUID())
            .modelName(MODEL)
            .versionNumber(version)
            .trainingRunId("run-" + version)
            .validationScore(score)
            .hyperparameters(Map.of())
            .stage(stage)
            .artifactReference("s3://models/run-" + version)
            .createdAt(createdAt)
            .build();
    }

    @Test
    void register_assignsNextVersionNumberInStageNone() {
        when(repository.existsByModelNameAndTrainingRunId(MODEL, "run-7")).thenReturn(false);
        when(repository.findMaxVersionNumber(MODEL)).thenReturn(4);
        when(repository.save(any(ModelVersionRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        ModelVersion version = registry.register(MODEL, request(null, "run-7", 0.93), "req-1");

        assertThat(version.getVersionNumber()).isEqualTo(5);
        assertThat(version.getStage()).isEqualTo(ModelStage.NONE);
        assertThat(version.getHyperparameters()).containsEntry("max_depth", 6);
        ArgumentCaptor<LifecycleEventRecord.LifecycleEventRecordBuilder> event =
            ArgumentCaptor.forClass(LifecycleEventRecord.LifecycleEventRecordBuilder.class);
        verify(metricStore).recordEvent(event.capture());
        assertThat(event.getValue().build().getEventType()).isEqualTo(LifecycleEventType.VERSION_REGISTERED);
    }

    @Test
    void register_sameVersionNumberTwice_secondFailsAndFirstIsUnaffected() {
        when(repository.existsByModelNameAndTrainingRunId(eq(MODEL), anyString())).thenReturn(false);
        when(repository.existsByModelNameAndVersionNumber(MODEL, 1)).thenReturn(false, true);
        when(repository.save(any(ModelVersionRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        ModelVersion first = registry.register(MODEL, request(1, "run-a", 0.9), "req-1");

        assertThatThrownBy(() -> registry.register(MODEL, request(1, "run-b", 0.95), "req-2"))
            .isInstanceOf(DuplicateVersionException.class)
            .hasMessageContaining("version number 1");
        assertThat(first.getTrainingRunId()).isEqualTo("run-a");
        verify(repository, times(1)).save(any(ModelVersionRecord.class));
    }

    @Test
    void register_duplicateTrainingRun_fails() {
        when(repository.existsByModelNameAndTrainingRunId(MODEL, "run-a")).thenReturn(true);

        assertThatThrownBy(() -> registry.register(MODEL, request(null, "run-a", 0.9), "req-1"))
            .isInstanceOf(DuplicateVersionException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void register_nonScalarHyperparameter_isRejected() {
        RegisterVersionRequest bad = RegisterVersionRequest.builder()
            .trainingRunId("run-x").validationScore(0.5)
            .hyperparameters(Map.of("layers", List.of(64, 32)))
            .artifactReference("s3://x").build();

        assertThatThrownBy(() -> registry.register(MODEL, bad, "req-1"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("layers");
        verifyNoInteractions(repository);
    }

    @Test
    void register_invalidModelName_isRejected() {
        assertThatThrownBy(() -> registry.register("bad name!", request(null, "run-1", 0.5), "req-1"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void promoteTopK_ranksByScoreThenCreationThenVersion() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        List<ModelVersionRecord> candidates = new ArrayList<>(List.of(
            record(1, 0.91, ModelStage.NONE, t0),
            record(2, 0.88, ModelStage.NONE, t0.plusSeconds(1)),
            record(3, 0.95, ModelStage.NONE, t0.plusSeconds(2)),
            record(4, 0.70, ModelStage.NONE, t0.plusSeconds(3)),
            record(5, 0.95, ModelStage.NONE, t0.plusSeconds(4))));
        when(repository.findByModelNameAndStageIn(eq(MODEL), anyCollection())).thenReturn(candidates);

        List<ModelVersion> staging = registry.promoteTopK(MODEL, 3, "req-1");

        assertThat(staging).extracting(ModelVersion::getVersionNumber).containsExactly(3, 5, 1);
        assertThat(candidates).filteredOn(r -> r.getStage() == ModelStage.STAGING)
            .extracting(ModelVersionRecord::getVersionNumber).containsExactlyInAnyOrder(1, 3, 5);
        assertThat(candidates).filteredOn(r -> r.getStage() == ModelStage.NONE)
            .extracting(ModelVersionRecord::getVersionNumber).containsExactlyInAnyOrder(2, 4);
        verify(metricStore, times(3)).recordEvent(any());
    }

    @Test
    void promoteTopK_demotesStagingThatFallsOutOfTopK() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        ModelVersionRecord old = record(1, 0.80, ModelStage.STAGING, t0);
        ModelVersionRecord better = record(2, 0.90, ModelStage.NONE, t0.plusSeconds(1));
        when(repository.findByModelNameAndStageIn(eq(MODEL), anyCollection()))
            .thenReturn(new ArrayList<>(List.of(old, better)));

        registry.promoteTopK(MODEL, 1, "req-1");

        assertThat(better.getStage()).isEqualTo(ModelStage.STAGING);
        assertThat(old.getStage()).isEqualTo(ModelStage.NONE);
    }

    @Test
    void promoteTopK_sameScoreAndTime_prefersLowerVersion() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        ModelVersionRecord v2 = record(2, 0.9, ModelStage.NONE, t0);
        ModelVersionRecord v1 = record(1, 0.9, ModelStage.NONE, t0);
        when(repository.findByModelNameAndStageIn(eq(MODEL), anyCollection()))
            .thenReturn(new ArrayList<>(List.of(v2, v1)));

        assertThat(registry.promoteTopK(MODEL, 1, "req-1"))
            .extracting(ModelVersion::getVersionNumber).containsExactly(1);
    }

    @Test
    void promoteTopK_negativeK_isRejected() {
        assertThatThrownBy(() -> registry.promoteTopK(MODEL, -1, "req-1"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void promoteProduction_archivesPreviousAndPublishesPointer() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        ModelVersionRecord current = record(1, 0.85, ModelStage.PRODUCTION, t0);
        ModelVersionRecord candidateA = record(2, 0.90, ModelStage.STAGING, t0.plusSeconds(1));
        ModelVersionRecord candidateB = record(3, 0.92, ModelStage.STAGING, t0.plusSeconds(2));
        when(repository.findByModelNameAndStage(MODEL, ModelStage.STAGING)).thenReturn(List.of(candidateA, candidateB));
        when(repository.findByModelNameAndStage(MODEL, ModelStage.PRODUCTION)).thenReturn(List.of(current));

        ModelRegistryService.ProductionPromotion promotion = registry.promoteProduction(MODEL, "req-1");

        assertThat(promotion.promoted().getVersionNumber()).isEqualTo(3);
        assertThat(promotion.archived().getVersionNumber()).isEqualTo(1);
        assertThat(current.getStage()).isEqualTo(ModelStage.ARCHIVED);
        assertThat(candidateB.getStage()).isEqualTo(ModelStage.PRODUCTION);
        assertThat(candidateA.getStage()).isEqualTo(ModelStage.STAGING);

        // served from the pointer, no further repository reads
        clearInvocations(repository);
        assertThat(registry.getProduction(MODEL).getVersionNumber()).isEqualTo(3);
        verifyNoInteractions(repository);
    }

    @Test
    void promoteProduction_withoutStaging_fails() {
        when(repository.findByModelNameAndStage(MODEL, ModelStage.STAGING)).thenReturn(List.of());

        assertThatThrownBy(() -> registry.promoteProduction(MODEL, "req-1"))
            .isInstanceOf(NoStagingCandidateException.class);
        verify(repository, never()).saveAll(any());
    }

    @Test
    void getProduction_loadsLazilyAndDoesNotCacheAbsence() {
        when(repository.findByModelNameAndStage(MODEL, ModelStage.PRODUCTION))
            .thenReturn(List.of())
            .thenReturn(List.of(record(4, 0.9, ModelStage.PRODUCTION, Instant.now())));

        assertThatThrownBy(() -> registry.getProduction(MODEL)).isInstanceOf(ProductionModelNotFoundException.class);
        assertThat(registry.getProduction(MODEL).getVersionNumber()).isEqualTo(4);
        assertThat(registry.findProduction(MODEL)).isPresent();
        verify(repository, times(2)).findByModelNameAndStage(MODEL, ModelStage.PRODUCTION);
    }

    @Test
    void init_warmsPointersFromStore() {
        when(repository.findByStage(ModelStage.PRODUCTION))
            .thenReturn(List.of(record(2, 0.9, ModelStage.PRODUCTION, Instant.now())));

        registry.init();

        assertThat(registry.getProduction(MODEL).getVersionNumber()).isEqualTo(2);
        verify(repository, never()).findByModelNameAndStage(anyString(), any());
    }

    @Test
    void getVersion_unknown_throwsNotFound() {
        when(repository.findByModelNameAndVersionNumber(MODEL, 9)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> registry.getVersion(MODEL, 9)).isInstanceOf(ModelVersionNotFoundException.class);
    }
}
