package com.qoeguard.core.features;

import com.qoeguard.core.model.Change;
import com.qoeguard.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Reduces a change list to a {@link FeatureVector} in a single pass.
 * <p>
 * Length markers count only toward {@code array_len_changes}; the index-wise added/removed
 * entries that accompany them are counted separately, so cardinality drift is not counted twice.
 * Stateless and safe to share between threads.
 */
public class FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    public Extraction extract(List<Change> changes, CriticalityConfig criticality) {
        if (changes.isEmpty()) {
            return Extraction.EMPTY;
        }

        int added = 0;
        int removed = 0;
        int typeChanges = 0;
        int valueChanges = 0;
        int arrayLenChanges = 0;
        int critical = 0;
        double deltaSum = 0.0;
        double deltaMax = 0.0;
        List<CriticalChange> evidence = new ArrayList<>();

        for (Change change : changes) {
            if (change.isLengthMarker()) {
                arrayLenChanges++;
            } else {
                switch (change.kind()) {
                    case ADDED -> added++;
                    case REMOVED -> removed++;
                    case TYPE_CHANGED -> typeChanges++;
                    case VALUE_CHANGED -> valueChanges++;
                }
                OptionalDouble delta = change.numericDelta();
                if (delta.isPresent()) {
                    deltaSum = saturatingAdd(deltaSum, delta.getAsDouble());
                    deltaMax = Math.max(deltaMax, delta.getAsDouble());
                }
            }

            Optional<CriticalityRule> rule = criticality.match(change.path());
            if (rule.isPresent() && rule.get().isCritical()) {
                critical++;
                evidence.add(new CriticalChange(change, rule.get()));
            }
        }

        FeatureVector features = new FeatureVector(added, removed, typeChanges, valueChanges,
                deltaSum, deltaMax, arrayLenChanges, critical);
        log.debug("Extracted features from {} changes: {}", changes.size(), features);
        return new Extraction(features, evidence);
    }

    static double saturatingAdd(double a, double b) {
        double sum = a + b;
        return Double.isFinite(sum) ? sum : Double.MAX_VALUE;
    }
}
