package com.modellifecycle.repository;

import com.modellifecycle.entity.DriftReportRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.UUID;

public interface DriftReportRepository extends JpaRepository<DriftReportRecord, UUID> {

    @Query("""
        SELECT r FROM DriftReportRecord r
        WHERE r.modelName = :modelName
          AND r.generatedAt >= :from
          AND r.generatedAt <= :to
        ORDER BY r.generatedAt DESC
    """)
    Page<DriftReportRecord> findHistory(
        @Param("modelName") String modelName,
        @Param("from") Instant from,
        @Param("to") Instant to,
        Pageable pageable);
}
