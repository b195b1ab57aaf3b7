package com.modellifecycle.repository;

import com.modellifecycle.entity.ModelStage;
import com.modellifecycle.entity.ModelVersionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ModelVersionRepository extends JpaRepository<ModelVersionRecord, UUID> {

    List<ModelVersionRecord> findByModelNameOrderByVersionNumberAsc(String modelName);

    List<ModelVersionRecord> findByModelNameAndStageIn(String modelName, Collection<ModelStage> stages);

    List<ModelVersionRecord> findByModelNameAndStage(String modelName, ModelStage stage);

    List<ModelVersionRecord> findByStage(ModelStage stage);

    Optional<ModelVersionRecord> findByModelNameAndVersionNumber(String modelName, int versionNumber);

    boolean existsByModelNameAndVersionNumber(String modelName, int versionNumber);

    boolean existsByModelNameAndTrainingRunId(String modelName, String trainingRunId);

    @Query("SELECT MAX(v.versionNumber) FROM ModelVersionRecord v WHERE v.modelName = :modelName")
    Integer findMaxVersionNumber(@Param("modelName") String modelName);
}
