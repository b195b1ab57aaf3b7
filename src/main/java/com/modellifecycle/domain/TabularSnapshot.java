package com.modellifecycle.domain;

import com.modellifecycle.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Point-in-time tabular dataset handed over by the snapshot provider.
 * Columns are equally long; {@code null} (and NaN in numeric columns) marks a missing value.
 * Prediction labels, when present, are the current model's outputs on the same rows.
 */
public final class TabularSnapshot {

    private final String datasetId;
    private final String window;
    private final Map<String, Column> columns;
    private final List<String> predictions;
    private final int rowCount;

    private TabularSnapshot(String datasetId, String window, Map<String, Column> columns, List<String> predictions) {
        this.datasetId = datasetId;
        this.window = window;
        this.columns = Collections.unmodifiableMap(columns);
        this.predictions = Collections.unmodifiableList(predictions);
        this.rowCount = resolveRowCount(columns, predictions);
    }

    public static Builder builder(String datasetId) {
        return new Builder(datasetId);
    }

    public String datasetId() {
        return datasetId;
    }

    public String describe() {
        return window == null || window.isBlank() ? datasetId : datasetId + " [" + window + "]";
    }

    public int rowCount() {
        return rowCount;
    }

    public Set<String> columnNames() {
        return columns.keySet();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public ColumnType columnType(String name) {
        Column column = columns.get(name);
        return column != null ? column.type() : null;
    }

    public List<Object> values(String name) {
        Column column = columns.get(name);
        return column != null ? column.values() : List.of();
    }

    public List<String> predictions() {
        return predictions;
    }

    private static int resolveRowCount(Map<String, Column> columns, List<String> predictions) {
        Integer rows = null;
        for (Map.Entry<String, Column> entry : columns.entrySet()) {
            int size = entry.getValue().values().size();
            if (rows == null) {
                rows = size;
            } else if (rows != size) {
                throw new ValidationException("Column '" + entry.getKey() + "' has " + size
                    + " rows but the snapshot has " + rows);
            }
        }
        if (rows == null) {
            return predictions.size();
        }
        if (!predictions.isEmpty() && predictions.size() != rows) {
            throw new ValidationException("Snapshot has " + rows + " rows but "
                + predictions.size() + " prediction labels");
        }
        return rows;
    }

    private record Column(ColumnType type, List<Object> values) {}

    public static final class Builder {
        private final String datasetId;
        private String window;
        private final Map<String, Column> columns = new LinkedHashMap<>();
        private final List<String> predictions = new ArrayList<>();

        private Builder(String datasetId) {
            if (datasetId == null || datasetId.isBlank()) {
                throw new ValidationException("Snapshot datasetId is required");
            }
            this.datasetId = datasetId;
        }

        public Builder window(String window) {
            this.window = window;
            return this;
        }

        public Builder numeric(String name, List<? extends Number> values) {
            return column(name, ColumnType.NUMERIC, values);
        }

        public Builder categorical(String name, List<?> values) {
            return column(name, ColumnType.CATEGORICAL, values);
        }

        public Builder column(String name, ColumnType type, List<?> values) {
            if (name == null || name.isBlank()) {
                throw new ValidationException("Snapshot column name is required");
            }
            Objects.requireNonNull(type, "type");
            if (columns.containsKey(name)) {
                throw new ValidationException("Duplicate column '" + name + "' in snapshot " + datasetId);
            }
            List<Object> copy = new ArrayList<>(values != null ? values : List.of());
            if (type == ColumnType.NUMERIC) {
                for (Object value : copy) {
                    if (value != null && !(value instanceof Number)) {
                        throw new ValidationException("Numeric column '" + name + "' holds non-numeric value '"
                            + value + "'");
                    }
                }
            }
            columns.put(name, new Column(type, Collections.unmodifiableList(copy)));
            return this;
        }

        public Builder predictions(List<String> labels) {
            predictions.clear();
            if (labels != null) {
                predictions.addAll(labels);
            }
            return this;
        }

        public TabularSnapshot build() {
            return new TabularSnapshot(datasetId, window, new LinkedHashMap<>(columns), new ArrayList<>(predictions));
        }
    }
}
