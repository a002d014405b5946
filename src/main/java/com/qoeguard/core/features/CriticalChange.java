package com.qoeguard.core.features;

import com.qoeguard.core.model.Change;

/**
 * A change that fell under a critical path, kept for evidence ranking.
 */
public record CriticalChange(Change change, CriticalityRule rule) {

    public double criticality() {
        return rule.weight();
    }
}
