package com.qoeguard.core.policy;

import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.model.GateDecision;

import java.util.List;
import java.util.Locale;

/**
 * Named policies for common environments.
 */
public final class PolicyPresets {

    public static final PolicyConfig DEFAULT = new PolicyConfig("default", 0.45, 0.72,
            List.of(OverrideRule.criticalTypeChanges()), PolicyConfig.DEFAULT_TOP_N, List.of());

    /** Production: lower thresholds, and any removal on a critical path fails. */
    public static final PolicyConfig STRICT = new PolicyConfig("strict", 0.35, 0.60,
            List.of(OverrideRule.criticalTypeChanges(),
                    OverrideRule.parse("critical-removals", "removed_fields>=1 && critical_changes>=1",
                            GateDecision.FAIL)),
            PolicyConfig.DEFAULT_TOP_N, List.of());

    /** Development: only the score gates, and only at high risk. */
    public static final PolicyConfig PERMISSIVE = new PolicyConfig("permissive", 0.60, 0.85,
            List.of(), PolicyConfig.DEFAULT_TOP_N, List.of());

    private PolicyPresets() {
        // utility class
    }

    public static PolicyConfig forName(String name) {
        String key = name == null ? "default" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "", "default" -> DEFAULT;
            case "strict" -> STRICT;
            case "permissive" -> PERMISSIVE;
            default -> throw new ConfigurationException("Unknown policy preset '" + name
                    + "'. Valid presets: default, strict, permissive");
        };
    }
}
