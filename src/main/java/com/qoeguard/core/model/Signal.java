package com.qoeguard.core.model;

import java.util.Objects;

/**
 * One ranked piece of evidence behind a {@link Decision}: either a feature's score
 * contribution or a change on a critical path.
 */
public sealed interface Signal permits Signal.FeatureSignal, Signal.ChangeSignal {

    /** Signed contribution used for ranking; evidence is ordered by its magnitude. */
    double contribution();

    /** Feature key or rendered path. */
    String label();

    record FeatureSignal(Feature feature, double value, double contribution) implements Signal {
        public FeatureSignal {
            Objects.requireNonNull(feature, "feature");
        }

        @Override
        public String label() {
            return feature.key();
        }
    }

    /**
     * @param criticality weight of the criticality rule the change matched
     * @param pattern     the matching rule's pattern, as configured
     */
    record ChangeSignal(Change change, double criticality, String pattern, double contribution) implements Signal {
        public ChangeSignal {
            Objects.requireNonNull(change, "change");
        }

        @Override
        public String label() {
            return change.path().toString();
        }
    }
}
