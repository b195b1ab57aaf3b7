package com.modellifecycle.repository;

import com.modellifecycle.entity.LifecycleEventRecord;
import com.modellifecycle.entity.LifecycleEventType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface LifecycleEventRepository extends JpaRepository<LifecycleEventRecord, UUID> {

    Page<LifecycleEventRecord> findByModelNameOrderByOccurredAtDesc(String modelName, Pageable pageable);

    List<LifecycleEventRecord> findByJobIdOrderByOccurredAtAsc(UUID jobId);

    List<LifecycleEventRecord> findByModelNameAndEventTypeOrderByOccurredAtAsc(
        String modelName, LifecycleEventType eventType);
}
