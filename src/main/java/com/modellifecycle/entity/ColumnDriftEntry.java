package com.modellifecycle.entity;

import com.modellifecycle.domain.ColumnType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ColumnDriftEntry {

    @Column(name = "column_name", nullable = false, length = 128)
    private String columnName;

    @Enumerated(EnumType.STRING)
    @Column(name = "column_type", nullable = false, length = 20)
    private ColumnType columnType;

    @Column(nullable = false)
    private double distance;

    @Column(name = "missing_share", nullable = false)
    private double missingShare;

    @Column(nullable = false)
    private boolean drifted;
}
