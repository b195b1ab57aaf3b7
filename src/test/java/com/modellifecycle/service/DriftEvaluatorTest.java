package com.modellifecycle.service;

import com.modellifecycle.domain.ColumnDrift;
import com.modellifecycle.domain.ColumnType;
import com.modellifecycle.domain.DriftReport;
import com.modellifecycle.domain.TabularSnapshot;
import com.modellifecycle.exception.InsufficientDataException;
import com.modellifecycle.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.*;

class DriftEvaluatorTest {

    private final DriftEvaluator evaluator = new DriftEvaluator();

    private static List<Double> numbers(int rows, IntFunction<Double> value) {
        List<Double> values = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            values.add(value.apply(i));
        }
        return values;
    }

    private static TabularSnapshot shifted(String id, double shift) {
        return TabularSnapshot.builder(id).numeric("amount", numbers(100, i -> i + shift)).build();
    }

    private static ColumnDrift column(DriftReport report, String name) {
        return report.getColumns().stream()
            .filter(c -> c.getColumn().equals(name))
            .findFirst()
            .orElseThrow();
    }

    @Test
    void identicalSnapshots_reportNoDrift() {
        TabularSnapshot snapshot = TabularSnapshot.builder("ds-1")
            .numeric("amount", numbers(100, i -> (double) i))
            .categorical("country", Collections.nCopies(100, "DE"))
            .build();

        DriftReport report = evaluator.evaluate(snapshot, snapshot, null);

        assertThat(report.getColumnDriftCount()).isZero();
        assertThat(report.getTotalColumns()).isEqualTo(2);
        assertThat(report.getMissingValueShare()).isZero();
        assertThat(report.getPredictionDriftScore()).isZero();
        assertThat(report.getColumns()).allSatisfy(c -> assertThat(c.getDistance()).isZero());
        assertThat(report.getReportId()).isNull();
        assertThat(report.getGeneratedAt()).isNull();
    }

    @Test
    void numericShift_isDetectedAsDrift() {
        DriftReport report = evaluator.evaluate(shifted("ref", 0), shifted("cur", 50), null);

        ColumnDrift amount = column(report, "amount");
        assertThat(amount.getType()).isEqualTo(ColumnType.NUMERIC);
        assertThat(amount.getDistance()).isGreaterThan(0.25);
        assertThat(amount.isDrifted()).isTrue();
        assertThat(report.getColumnDriftCount()).isEqualTo(1);
    }

    @Test
    void distance_isSymmetricUnderSwappingInputs() {
        TabularSnapshot a = shifted("a", 0);
        TabularSnapshot b = shifted("b", 20);

        double forward = column(evaluator.evaluate(a, b, null), "amount").getDistance();
        double backward = column(evaluator.evaluate(b, a, null), "amount").getDistance();

        assertThat(forward).isCloseTo(backward, within(1e-12));
    }

    @Test
    void distance_growsWithSeparation() {
        TabularSnapshot reference = shifted("ref", 0);

        double small = column(evaluator.evaluate(reference, shifted("cur", 5), null), "amount").getDistance();
        double medium = column(evaluator.evaluate(reference, shifted("cur", 20), null), "amount").getDistance();
        double large = column(evaluator.evaluate(reference, shifted("cur", 50), null), "amount").getDistance();

        assertThat(small).isLessThan(medium);
        assertThat(medium).isLessThan(large);
        assertThat(column(evaluator.evaluate(reference, shifted("cur", 5), null), "amount").isDrifted()).isFalse();
    }

    @Test
    void unseenCategory_drifts() {
        TabularSnapshot reference = TabularSnapshot.builder("ref")
            .categorical("channel", repeat(List.of("web", "app"), 50)).build();
        TabularSnapshot current = TabularSnapshot.builder("cur")
            .categorical("channel", repeat(List.of("web", "pos"), 50)).build();

        ColumnDrift channel = column(evaluator.evaluate(reference, current, null), "channel");

        assertThat(channel.getType()).isEqualTo(ColumnType.CATEGORICAL);
        assertThat(channel.isDrifted()).isTrue();
    }

    @Test
    void mildCategoricalShift_staysBelowThreshold() {
        List<String> reference = new ArrayList<>(Collections.nCopies(50, "a"));
        reference.addAll(Collections.nCopies(50, "b"));
        List<String> current = new ArrayList<>(Collections.nCopies(55, "a"));
        current.addAll(Collections.nCopies(45, "b"));

        ColumnDrift column = column(evaluator.evaluate(
            TabularSnapshot.builder("ref").categorical("segment", reference).build(),
            TabularSnapshot.builder("cur").categorical("segment", current).build(), null), "segment");

        assertThat(column.getDistance()).isGreaterThan(0.0).isLessThan(0.2);
        assertThat(column.isDrifted()).isFalse();
    }

    @Test
    void columnMissingFromCurrent_countsAsFullyMissingAndDrifts() {
        TabularSnapshot reference = TabularSnapshot.builder("ref")
            .numeric("amount", numbers(100, i -> (double) i))
            .numeric("balance", numbers(100, i -> (double) i))
            .build();
        TabularSnapshot current = TabularSnapshot.builder("cur")
            .numeric("amount", numbers(100, i -> (double) i))
            .build();

        DriftReport report = evaluator.evaluate(reference, current, null);

        ColumnDrift balance = column(report, "balance");
        assertThat(balance.getMissingShare()).isEqualTo(1.0);
        assertThat(balance.isDrifted()).isTrue();
        assertThat(report.getMissingValueShare()).isEqualTo(0.5);
        assertThat(report.getTotalColumns()).isEqualTo(2);
    }

    @Test
    void missingShare_isMonotoneInMissingValues() {
        TabularSnapshot reference = TabularSnapshot.builder("ref").numeric("balance", numbers(100, i -> (double) i)).build();

        double previous = -1.0;
        for (int missingEvery : new int[]{0, 10, 5, 2}) {
            int every = missingEvery;
            TabularSnapshot current = TabularSnapshot.builder("cur")
                .numeric("balance", numbers(100, i -> every > 0 && i % every == 0 ? null : (double) i))
                .build();
            double share = evaluator.evaluate(reference, current, null).getMissingValueShare();
            assertThat(share).isGreaterThan(previous);
            previous = share;
        }
    }

    @Test
    void nanCountsAsMissing() {
        TabularSnapshot reference = TabularSnapshot.builder("ref").numeric("x", List.of(1.0, 2.0, 3.0, 4.0)).build();
        TabularSnapshot current = TabularSnapshot.builder("cur").numeric("x", List.of(1.0, Double.NaN, 3.0, 4.0)).build();

        assertThat(column(evaluator.evaluate(reference, current, null), "x").getMissingShare()).isEqualTo(0.25);
    }

    @Test
    void predictionDrift_comparesLabelDistributions() {
        List<String> referenceLabels = new ArrayList<>(Collections.nCopies(10, "fraud"));
        referenceLabels.addAll(Collections.nCopies(90, "ok"));
        List<String> currentLabels = new ArrayList<>(Collections.nCopies(40, "fraud"));
        currentLabels.addAll(Collections.nCopies(60, "ok"));

        TabularSnapshot reference = TabularSnapshot.builder("ref")
            .numeric("amount", numbers(100, i -> (double) i)).predictions(referenceLabels).build();
        TabularSnapshot current = TabularSnapshot.builder("cur")
            .numeric("amount", numbers(100, i -> (double) i)).predictions(currentLabels).build();

        assertThat(evaluator.evaluate(reference, current, null).getPredictionDriftScore()).isGreaterThan(0.2);
        assertThat(evaluator.evaluate(reference, reference, null).getPredictionDriftScore()).isZero();
    }

    @Test
    void evaluation_isDeterministic() {
        TabularSnapshot reference = shifted("ref", 0);
        TabularSnapshot current = shifted("cur", 7);

        assertThat(evaluator.evaluate(reference, current, null))
            .isEqualTo(evaluator.evaluate(reference, current, null));
    }

    @Test
    void columns_areReportedInNameOrder() {
        TabularSnapshot reference = TabularSnapshot.builder("ref")
            .numeric("zeta", List.of(1.0)).numeric("alpha", List.of(1.0)).build();
        TabularSnapshot current = TabularSnapshot.builder("cur")
            .numeric("mid", List.of(1.0)).numeric("alpha", List.of(1.0)).build();

        assertThat(evaluator.evaluate(reference, current, null).getColumns())
            .extracting(ColumnDrift::getColumn)
            .containsExactly("alpha", "mid", "zeta");
    }

    @Test
    void emptyCurrentSnapshot_throwsInsufficientData() {
        TabularSnapshot reference = shifted("ref", 0);
        TabularSnapshot empty = TabularSnapshot.builder("cur").numeric("amount", List.of()).build();

        assertThatThrownBy(() -> evaluator.evaluate(reference, empty, null))
            .isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> evaluator.evaluate(empty, reference, null))
            .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void conflictingColumnTypes_throwValidation() {
        TabularSnapshot reference = TabularSnapshot.builder("ref").numeric("code", List.of(1, 2)).build();
        TabularSnapshot current = TabularSnapshot.builder("cur").categorical("code", List.of("1", "2")).build();

        assertThatThrownBy(() -> evaluator.evaluate(reference, current, null))
            .isInstanceOf(ValidationException.class)
            .isNotInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("code");
    }

    @Test
    void customThresholds_changeDriftVerdict() {
        DriftEvaluator strict = new DriftEvaluator(0.01, 0.01, 10);

        ColumnDrift amount = column(strict.evaluate(shifted("ref", 0), shifted("cur", 5), null), "amount");

        assertThat(amount.isDrifted()).isTrue();
    }

    private static List<String> repeat(List<String> pattern, int times) {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            values.addAll(pattern);
        }
        return values;
    }
}
