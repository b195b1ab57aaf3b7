package com.modellifecycle.domain;

import lombok.Value;

import java.util.List;

@Value
public class AlertDecision {
    boolean fire;
    int severity;
    List<BreachedCondition> breaches;

    public static AlertDecision of(List<BreachedCondition> breaches) {
        List<BreachedCondition> copy = List.copyOf(breaches);
        return new AlertDecision(!copy.isEmpty(), copy.size(), copy);
    }
}
