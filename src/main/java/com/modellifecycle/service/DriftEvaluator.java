package com.modellifecycle.service;

import com.modellifecycle.domain.ColumnDrift;
import com.modellifecycle.domain.ColumnType;
import com.modellifecycle.domain.DriftReport;
import com.modellifecycle.domain.TabularSnapshot;
import com.modellifecycle.domain.ThresholdConfig;
import com.modellifecycle.exception.InsufficientDataException;
import com.modellifecycle.exception.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Population stability index over bins shared by both snapshots. Every bin set carries a
 * missing-value bin, so a column that goes missing shows up as drift.
 */
@Component
public class DriftEvaluator {

    static final double PROPORTION_FLOOR = 1e-4;

    private static final String MISSING_BIN = "\u0000missing";

    @Value("${lifecycle.drift.numeric-threshold:0.25}")
    private double numericThreshold;

    @Value("${lifecycle.drift.categorical-threshold:0.2}")
    private double categoricalThreshold;

    @Value("${lifecycle.drift.numeric-bins:10}")
    private int numericBins;

    public DriftEvaluator() {
        this(0.25, 0.2, 10);
    }

    DriftEvaluator(double numericThreshold, double categoricalThreshold, int numericBins) {
        this.numericThreshold = numericThreshold;
        this.categoricalThreshold = categoricalThreshold;
        this.numericBins = numericBins;
    }

    public DriftReport evaluate(TabularSnapshot reference, TabularSnapshot current, ThresholdConfig thresholds) {
        if (thresholds != null) {
            thresholds.validated();
        }
        if (reference == null || reference.rowCount() == 0) {
            throw new InsufficientDataException("Reference snapshot has no rows");
        }
        if (current == null || current.rowCount() == 0) {
            throw new InsufficientDataException("Current snapshot has no rows");
        }

        SortedSet<String> columnNames = new TreeSet<>(reference.columnNames());
        columnNames.addAll(current.columnNames());

        List<ColumnDrift> columns = new ArrayList<>(columnNames.size());
        int driftCount = 0;
        double missingShareSum = 0.0;
        for (String name : columnNames) {
            ColumnType type = resolveType(name, reference, current);
            List<Object> referenceValues = valuesOrAllMissing(reference, name);
            List<Object> currentValues = valuesOrAllMissing(current, name);

            double distance = type == ColumnType.NUMERIC
                ? numericPsi(referenceValues, currentValues)
                : categoricalPsi(referenceValues, currentValues);
            double missingShare = missingShare(currentValues);
            boolean drifted = distance > thresholdFor(type);

            if (drifted) {
                driftCount++;
            }
            missingShareSum += missingShare;
            columns.add(ColumnDrift.builder()
                .column(name)
                .type(type)
                .distance(distance)
                .missingShare(missingShare)
                .drifted(drifted)
                .build());
        }

        return DriftReport.builder()
            .referenceWindow(reference.describe())
            .currentWindow(current.describe())
            .columnDriftCount(driftCount)
            .totalColumns(columns.size())
            .missingValueShare(columns.isEmpty() ? 0.0 : missingShareSum / columns.size())
            .predictionDriftScore(predictionDrift(reference, current))
            .columns(Collections.unmodifiableList(columns))
            .build();
    }

    double thresholdFor(ColumnType type) {
        return type == ColumnType.NUMERIC ? numericThreshold : categoricalThreshold;
    }

    double predictionDrift(TabularSnapshot reference, TabularSnapshot current) {
        List<String> referenceLabels = reference.predictions();
        List<String> currentLabels = current.predictions();
        if (referenceLabels.isEmpty() && currentLabels.isEmpty()) {
            return 0.0;
        }
        return categoricalPsi(
            referenceLabels.isEmpty() ? allMissing(reference.rowCount()) : new ArrayList<>(referenceLabels),
            currentLabels.isEmpty() ? allMissing(current.rowCount()) : new ArrayList<>(currentLabels));
    }

    double numericPsi(List<Object> reference, List<Object> current) {
        double[] edges = quantileEdges(reference, current);
        int bins = edges.length + 2;
        return psi(numericHistogram(reference, edges, bins), reference.size(),
                   numericHistogram(current, edges, bins), current.size());
    }

    double categoricalPsi(List<Object> reference, List<Object> current) {
        Map<String, Integer> referenceCounts = categoryCounts(reference);
        Map<String, Integer> currentCounts = categoryCounts(current);
        SortedSet<String> categories = new TreeSet<>(referenceCounts.keySet());
        categories.addAll(currentCounts.keySet());
        categories.add(MISSING_BIN);

        int[] referenceHistogram = new int[categories.size()];
        int[] currentHistogram = new int[categories.size()];
        int i = 0;
        for (String category : categories) {
            referenceHistogram[i] = referenceCounts.getOrDefault(category, 0);
            currentHistogram[i] = currentCounts.getOrDefault(category, 0);
            i++;
        }
        return psi(referenceHistogram, reference.size(), currentHistogram, current.size());
    }

    // interior edges at the pooled quantiles, deduplicated
    private double[] quantileEdges(List<Object> reference, List<Object> current) {
        double[] pooled = new double[reference.size() + current.size()];
        int n = 0;
        for (List<Object> side : List.of(reference, current)) {
            for (Object value : side) {
                if (!isMissing(value)) {
                    pooled[n++] = ((Number) value).doubleValue();
                }
            }
        }
        if (n == 0) {
            return new double[0];
        }
        double[] sorted = Arrays.copyOf(pooled, n);
        Arrays.sort(sorted);

        TreeSet<Double> edges = new TreeSet<>();
        int bins = Math.max(1, numericBins);
        for (int b = 1; b < bins; b++) {
            int index = (int) Math.floor((double) b * n / bins);
            edges.add(sorted[Math.min(index, n - 1)]);
        }
        return edges.stream().mapToDouble(Double::doubleValue).toArray();
    }

    // slot 0 holds missing values; slot k + 1 holds values with exactly k edges <= value
    private int[] numericHistogram(List<Object> values, double[] edges, int bins) {
        int[] histogram = new int[bins];
        for (Object value : values) {
            if (isMissing(value)) {
                histogram[0]++;
                continue;
            }
            double v = ((Number) value).doubleValue();
            int position = Arrays.binarySearch(edges, v);
            int edgesAtOrBelow = position >= 0 ? position + 1 : -position - 1;
            histogram[edgesAtOrBelow + 1]++;
        }
        return histogram;
    }

    private Map<String, Integer> categoryCounts(List<Object> values) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Object value : values) {
            counts.merge(value == null ? MISSING_BIN : String.valueOf(value), 1, Integer::sum);
        }
        return counts;
    }

    private double psi(int[] referenceHistogram, int referenceTotal, int[] currentHistogram, int currentTotal) {
        double sum = 0.0;
        for (int i = 0; i < referenceHistogram.length; i++) {
            double p = proportion(referenceHistogram[i], referenceTotal);
            double q = proportion(currentHistogram[i], currentTotal);
            sum += (p - q) * Math.log(p / q);
        }
        return sum;
    }

    private double proportion(int count, int total) {
        return total == 0 ? PROPORTION_FLOOR : Math.max(PROPORTION_FLOOR, (double) count / total);
    }

    private double missingShare(List<Object> values) {
        if (values.isEmpty()) {
            return 1.0;
        }
        long missing = values.stream().filter(DriftEvaluator::isMissing).count();
        return (double) missing / values.size();
    }

    private ColumnType resolveType(String name, TabularSnapshot reference, TabularSnapshot current) {
        ColumnType referenceType = reference.columnType(name);
        ColumnType currentType = current.columnType(name);
        if (referenceType != null && currentType != null && referenceType != currentType) {
            throw new ValidationException("Column '" + name + "' is " + referenceType
                + " in the reference snapshot but " + currentType + " in the current snapshot");
        }
        return referenceType != null ? referenceType : currentType;
    }

    private List<Object> valuesOrAllMissing(TabularSnapshot snapshot, String name) {
        return snapshot.hasColumn(name) ? snapshot.values(name) : allMissing(snapshot.rowCount());
    }

    private static List<Object> allMissing(int rows) {
        return new ArrayList<>(Collections.nCopies(rows, null));
    }

    private static boolean isMissing(Object value) {
        return value == null || (value instanceof Double d && d.isNaN()) || (value instanceof Float f && f.isNaN());
    }
}
