package com.modellifecycle.dto;

import com.modellifecycle.domain.ColumnType;
import com.modellifecycle.domain.TabularSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class SnapshotPayload {

    @NotBlank(message = "datasetId is required")
    String datasetId;

    String window;

    @NotNull(message = "columns are required")
    List<@Valid ColumnPayload> columns;

    List<String> predictions;

    public TabularSnapshot toSnapshot() {
        TabularSnapshot.Builder builder = TabularSnapshot.builder(datasetId).window(window);
        if (columns != null) {
            columns.forEach(c -> builder.column(c.getName(), c.getType(), c.getValues()));
        }
        return builder.predictions(predictions).build();
    }

    @Value
    @Builder
    @Jacksonized
    public static class ColumnPayload {
        @NotBlank(message = "column name is required")
        String name;

        @NotNull(message = "column type is required")
        ColumnType type;

        List<Object> values;
    }
}
