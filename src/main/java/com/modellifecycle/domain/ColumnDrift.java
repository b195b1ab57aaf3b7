package com.modellifecycle.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ColumnDrift {
    String column;
    ColumnType type;
    double distance;
    double missingShare;
    boolean drifted;
}
