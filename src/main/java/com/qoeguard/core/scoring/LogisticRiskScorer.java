package com.qoeguard.core.scoring;

import com.qoeguard.core.model.Feature;
import com.qoeguard.core.model.FeatureVector;
import com.qoeguard.core.model.RiskScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Linear model squashed through the logistic function:
 * {@code risk = 1 / (1 + e^-(bias + sum(weight_i * scaled_i)))}.
 * Each feature's contribution is {@code weight_i * scaled_i}.
 */
public class LogisticRiskScorer implements RiskScorer {

    public static final String NAME = "logistic";

    private static final Logger log = LoggerFactory.getLogger(LogisticRiskScorer.class);

    @Override
    public RiskScore score(FeatureVector features, WeightConfig weights) {
        Map<Feature, Double> contributions = new EnumMap<>(Feature.class);
        double z = weights.bias();
        for (Feature feature : Feature.values()) {
            double contribution = weights.weight(feature) * weights.scaled(feature, features.get(feature));
            contributions.put(feature, contribution);
            z += contribution;
        }
        double risk = sigmoid(z);
        log.debug("Logistic score z={} risk={}", z, risk);
        return new RiskScore(risk, contributions, NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    /** Logistic function that stays within [0, 1] for any finite or infinite input. */
    static double sigmoid(double z) {
        if (Double.isNaN(z)) {
            return 0.5;
        }
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }
}
