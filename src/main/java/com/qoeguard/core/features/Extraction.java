package com.qoeguard.core.features;

import com.qoeguard.core.model.FeatureVector;

import java.util.List;

/**
 * Feature vector plus the critical-path changes that produced its {@code critical_changes} count.
 */
public record Extraction(FeatureVector features, List<CriticalChange> criticalEvidence) {

    public static final Extraction EMPTY = new Extraction(FeatureVector.ZERO, List.of());

    public Extraction {
        criticalEvidence = List.copyOf(criticalEvidence);
    }
}
