package com.qoeguard.core.policy;

import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.model.FeatureVector;
import com.qoeguard.core.model.GateDecision;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Forces a gating outcome when all of its conditions hold, bypassing the score thresholds.
 */
public record OverrideRule(String name, List<FeatureCondition> conditions, GateDecision outcome) {

    public OverrideRule {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Override rule name must not be blank");
        }
        Objects.requireNonNull(outcome, "outcome");
        if (conditions == null || conditions.isEmpty()) {
            throw new ConfigurationException("Override rule '" + name + "' has no conditions");
        }
        conditions = List.copyOf(conditions);
    }

    /**
     * Parse {@code "critical_changes>=3 && type_changes>=1"} into a rule.
     */
    public static OverrideRule parse(String name, String expression, GateDecision outcome) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Override rule '" + name + "' has an empty condition");
        }
        List<FeatureCondition> conditions = new ArrayList<>();
        for (String part : expression.split("&&")) {
            conditions.add(FeatureCondition.parse(part));
        }
        return new OverrideRule(name, conditions, outcome);
    }

    /** Built-in rule: several critical changes together with a representation change always fail. */
    public static OverrideRule criticalTypeChanges() {
        return parse("critical-type-changes", "critical_changes>=3 && type_changes>=1", GateDecision.FAIL);
    }

    public boolean matches(FeatureVector features) {
        for (FeatureCondition condition : conditions) {
            if (!condition.test(features)) {
                return false;
            }
        }
        return true;
    }

    public String expression() {
        return conditions.stream().map(FeatureCondition::toString).collect(Collectors.joining(" && "));
    }

    @Override
    public String toString() {
        return name + ": " + expression() + " => " + outcome;
    }
}
