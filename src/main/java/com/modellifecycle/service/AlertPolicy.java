package com.modellifecycle.service;

import com.modellifecycle.domain.AlertDecision;
import com.modellifecycle.domain.BreachedCondition;
import com.modellifecycle.domain.DriftReport;
import com.modellifecycle.domain.ThresholdConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class AlertPolicy {

    public AlertDecision decide(DriftReport report, ThresholdConfig thresholds) {
        ThresholdConfig config = thresholds.validated();
        List<BreachedCondition> breaches = new ArrayList<>(3);
        if (report.getMissingValueShare() > config.getMaxMissingShare()) {
            breaches.add(BreachedCondition.MISSING_VALUES);
        }
        if (report.getColumnDriftCount() > config.getMaxDriftedColumns()) {
            breaches.add(BreachedCondition.COLUMN_DRIFT);
        }
        if (report.getPredictionDriftScore() > config.getMaxPredictionDrift()) {
            breaches.add(BreachedCondition.PREDICTION_DRIFT);
        }
        return AlertDecision.of(breaches);
    }
}
