package com.qoeguard.core.scoring;

import com.qoeguard.core.model.FeatureVector;
import com.qoeguard.core.model.RiskScore;

/**
 * Strategy turning a feature vector into a bounded risk score.
 * <p>
 * Implementations must be pure: the same inputs always produce the same score, the score
 * lies in {@code [0, 1]}, and every feature receives a signed contribution so the policy
 * engine can rank evidence regardless of which strategy produced it.
 */
public interface RiskScorer {

    RiskScore score(FeatureVector features, WeightConfig weights);

    /** Short identifier used in configuration and reports. */
    String name();
}
