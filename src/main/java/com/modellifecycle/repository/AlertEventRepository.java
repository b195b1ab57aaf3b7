package com.modellifecycle.repository;

import com.modellifecycle.entity.AlertEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AlertEventRepository extends JpaRepository<AlertEventRecord, String> {
}
