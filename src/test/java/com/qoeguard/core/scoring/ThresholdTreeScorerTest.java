package com.qoeguard.core.scoring;

import com.qoeguard.core.model.Feature;
import com.qoeguard.core.model.FeatureVector;
import com.qoeguard.core.model.RiskScore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdTreeScorerTest {

    private final ThresholdTreeScorer scorer = new ThresholdTreeScorer();

    private RiskScore score(FeatureVector f) {
        return scorer.score(f, WeightConfig.defaults());
    }

    private double contributionSum(RiskScore score) {
        return score.contributions().values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @Test
    @DisplayName("no changes lands in the lowest leaf")
    void zeroVector() {
        RiskScore score = score(FeatureVector.ZERO);
        assertEquals(0.05, score.risk(), 1e-12);
        assertEquals(-0.05, score.contribution(Feature.TYPE_CHANGES), 1e-12);
        assertEquals(-0.05, score.contribution(Feature.REMOVED_FIELDS), 1e-12);
        assertEquals(-0.02, score.contribution(Feature.NUMERIC_DELTA_MAX), 1e-12);
        assertEquals(-0.03, score.contribution(Feature.ADDED_FIELDS), 1e-12);
        assertEquals(0.0, score.contribution(Feature.CRITICAL_CHANGES));
        assertEquals("tree", score.scorer());
    }

    @Test
    @DisplayName("type changes with several critical changes reach the top leaf")
    void criticalTypeChanges() {
        RiskScore score = score(FeatureVector.ZERO
                .with(Feature.TYPE_CHANGES, 1)
                .with(Feature.CRITICAL_CHANGES, 3));
        assertEquals(0.90, score.risk(), 1e-12);
        assertEquals(0.50, score.contribution(Feature.TYPE_CHANGES), 1e-12);
        assertEquals(0.20, score.contribution(Feature.CRITICAL_CHANGES), 1e-12);
    }

    @Test
    @DisplayName("selected leaves")
    void leaves() {
        assertEquals(0.62, score(FeatureVector.ZERO.with(Feature.TYPE_CHANGES, 2)).risk(), 1e-12);
        assertEquals(0.60, score(FeatureVector.ZERO
                .with(Feature.REMOVED_FIELDS, 1)
                .with(Feature.CRITICAL_CHANGES, 1)).risk(), 1e-12);
        assertEquals(0.38, score(FeatureVector.ZERO.with(Feature.REMOVED_FIELDS, 4)).risk(), 1e-12);
        assertEquals(0.35, score(FeatureVector.ZERO.with(Feature.NUMERIC_DELTA_MAX, 50)).risk(), 1e-12);
        assertEquals(0.25, score(FeatureVector.ZERO.with(Feature.ADDED_FIELDS, 5)).risk(), 1e-12);
    }

    @Test
    @DisplayName("contributions sum to the distance from the root value")
    void pathAttribution() {
        Random random = new Random(5);
        for (int i = 0; i < 200; i++) {
            FeatureVector f = new FeatureVector(random.nextInt(8), random.nextInt(3), random.nextInt(2),
                    random.nextInt(5), random.nextInt(200), random.nextInt(100), random.nextInt(3),
                    random.nextInt(5));
            RiskScore score = score(f);
            assertTrue(score.risk() >= 0.0 && score.risk() <= 1.0);
            assertEquals(score.risk() - scorer.baseValue(), contributionSum(score), 1e-9);
        }
    }

    @Test
    @DisplayName("more type, removal or critical changes never lower the risk")
    void monotonicInSevereFeatures() {
        Random random = new Random(17);
        Feature[] severe = {Feature.TYPE_CHANGES, Feature.REMOVED_FIELDS, Feature.CRITICAL_CHANGES};
        for (int i = 0; i < 200; i++) {
            FeatureVector f = new FeatureVector(random.nextInt(8), random.nextInt(3), random.nextInt(2),
                    random.nextInt(5), random.nextInt(200), random.nextInt(100), random.nextInt(3),
                    random.nextInt(5));
            double risk = score(f).risk();
            for (Feature feature : severe) {
                assertTrue(score(f.with(feature, f.get(feature) + 1)).risk() >= risk,
                        feature.key() + " on " + f);
            }
        }
    }
}
