package com.modellifecycle.repository;

import com.modellifecycle.entity.TrainingMetricRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TrainingMetricRepository extends JpaRepository<TrainingMetricRecord, UUID> {

    List<TrainingMetricRecord> findByModelNameOrderByRecordedAtDesc(String modelName);
}
