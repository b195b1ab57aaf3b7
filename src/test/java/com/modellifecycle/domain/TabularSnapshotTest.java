package com.modellifecycle.domain;

import com.modellifecycle.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TabularSnapshotTest {

    @Test
    void build_keepsColumnsAndRowCount() {
        TabularSnapshot snapshot = TabularSnapshot.builder("transactions")
            .window("2026-10-01/2026-10-07")
            .numeric("amount", Arrays.asList(1.0, null, 3.0))
            .categorical("country", List.of("DE", "FR", "DE"))
            .predictions(List.of("ok", "fraud", "ok"))
            .build();

        assertThat(snapshot.rowCount()).isEqualTo(3);
        assertThat(snapshot.columnNames()).containsExactly("amount", "country");
        assertThat(snapshot.columnType("country")).isEqualTo(ColumnType.CATEGORICAL);
        assertThat(snapshot.values("amount")).containsExactly(1.0, null, 3.0);
        assertThat(snapshot.describe()).isEqualTo("transactions [2026-10-01/2026-10-07]");
        assertThat(snapshot.values("unknown")).isEmpty();
    }

    @Test
    void unevenColumns_areRejected() {
        TabularSnapshot.Builder builder = TabularSnapshot.builder("ds")
            .numeric("a", List.of(1, 2, 3))
            .numeric("b", List.of(1, 2));

        assertThatThrownBy(builder::build)
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("'b'");
    }

    @Test
    void predictionCountMustMatchRows() {
        TabularSnapshot.Builder builder = TabularSnapshot.builder("ds")
            .numeric("a", List.of(1, 2, 3))
            .predictions(List.of("ok"));

        assertThatThrownBy(builder::build).isInstanceOf(ValidationException.class);
    }

    @Test
    void nonNumericValueInNumericColumn_isRejected() {
        assertThatThrownBy(() -> TabularSnapshot.builder("ds")
                .column("amount", ColumnType.NUMERIC, List.of(1.0, "n/a")))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("n/a");
    }

    @Test
    void duplicateColumnAndMissingDatasetId_areRejected() {
        assertThatThrownBy(() -> TabularSnapshot.builder("ds")
                .numeric("a", List.of(1)).numeric("a", List.of(2)))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> TabularSnapshot.builder(" "))
            .isInstanceOf(ValidationException.class);
    }
}
