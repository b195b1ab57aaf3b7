package com.modellifecycle.repository;

import com.modellifecycle.entity.RetrainJobRecord;
import com.modellifecycle.entity.RetrainJobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RetrainJobRepository extends JpaRepository<RetrainJobRecord, UUID> {

    Optional<RetrainJobRecord> findFirstByModelNameAndStatusInOrderByQueuedAtAsc(
        String modelName, Collection<RetrainJobStatus> statuses);

    Optional<RetrainJobRecord> findFirstByTriggeringAlertIdOrderByQueuedAtDesc(String alertId);

    Page<RetrainJobRecord> findByModelNameOrderByQueuedAtDesc(String modelName, Pageable pageable);

    List<RetrainJobRecord> findByStatusOrderByQueuedAtAsc(RetrainJobStatus status);
}
