package com.qoeguard.core.scoring;

import com.qoeguard.core.model.Feature;
import com.qoeguard.core.model.FeatureVector;
import com.qoeguard.core.model.RiskScore;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed decision tree over the feature vector, an alternative to {@link LogisticRiskScorer}.
 * <p>
 * The risk is the value of the leaf reached. Contributions use path attribution: each split
 * taken credits its feature with the change in node value from parent to child, so the
 * contributions sum to {@code risk - rootValue}. Leaves are arranged so that raising
 * {@code type_changes}, {@code critical_changes} or {@code removed_fields} never lowers the risk.
 * The tree carries its own thresholds; {@link WeightConfig} is not consulted.
 */
public class ThresholdTreeScorer implements RiskScorer {

    public static final String NAME = "tree";

    private record Node(Feature feature, double threshold, double value, Node below, Node atOrAbove) {
        static Node leaf(double value) {
            return new Node(null, 0, value, null, null);
        }

        static Node split(Feature feature, double threshold, double value, Node below, Node atOrAbove) {
            return new Node(feature, threshold, value, below, atOrAbove);
        }

        boolean isLeaf() {
            return feature == null;
        }
    }

    private static final Node ROOT = Node.split(Feature.TYPE_CHANGES, 1, 0.20,
            Node.split(Feature.REMOVED_FIELDS, 1, 0.15,
                    Node.split(Feature.NUMERIC_DELTA_MAX, 50, 0.10,
                            Node.split(Feature.ADDED_FIELDS, 5, 0.08,
                                    Node.leaf(0.05),
                                    Node.leaf(0.25)),
                            Node.leaf(0.35)),
                    Node.split(Feature.CRITICAL_CHANGES, 1, 0.45,
                            Node.leaf(0.38),
                            Node.leaf(0.60))),
            Node.split(Feature.CRITICAL_CHANGES, 1, 0.70,
                    Node.leaf(0.62),
                    Node.split(Feature.CRITICAL_CHANGES, 3, 0.80,
                            Node.leaf(0.70),
                            Node.leaf(0.90))));

    @Override
    public RiskScore score(FeatureVector features, WeightConfig weights) {
        Map<Feature, Double> contributions = new EnumMap<>(Feature.class);
        Node node = ROOT;
        while (!node.isLeaf()) {
            Node next = features.get(node.feature()) >= node.threshold() ? node.atOrAbove() : node.below();
            contributions.merge(node.feature(), next.value() - node.value(), Double::sum);
            node = next;
        }
        return new RiskScore(node.value(), contributions, NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    /** Value of the root node; contributions are measured relative to it. */
    public double baseValue() {
        return ROOT.value();
    }
}
