package com.qoeguard.core.features;

import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.model.JsonPath;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered criticality rules. The first rule whose pattern prefixes a change's path decides
 * that change's criticality.
 */
public record CriticalityConfig(List<CriticalityRule> rules) {

    private static final CriticalityConfig DEFAULTS = CriticalityConfig.of(defaultWeights());

    public CriticalityConfig {
        rules = List.copyOf(rules);
        Set<PathPattern> seen = new HashSet<>();
        for (CriticalityRule rule : rules) {
            if (!seen.add(rule.pattern())) {
                throw new ConfigurationException("Duplicate criticality pattern " + rule.pattern());
            }
        }
    }

    /** Build from pattern strings to weights, keeping the map's iteration order. */
    public static CriticalityConfig of(Map<String, Double> weights) {
        List<CriticalityRule> rules = new ArrayList<>();
        weights.forEach((pattern, weight) -> rules.add(CriticalityRule.of(pattern, weight)));
        return new CriticalityConfig(rules);
    }

    public static CriticalityConfig none() {
        return new CriticalityConfig(List.of());
    }

    /** Streaming-service defaults: playback, DRM and entitlement dominate. */
    public static CriticalityConfig defaults() {
        return DEFAULTS;
    }

    public Optional<CriticalityRule> match(JsonPath path) {
        for (CriticalityRule rule : rules) {
            if (rule.pattern().matchesPrefixOf(path)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("$.playback", 1.00);
        weights.put("$.drm", 0.95);
        weights.put("$.entitlement", 0.95);
        weights.put("$.manifest", 0.95);
        weights.put("$.license", 0.90);
        weights.put("$.ads", 0.85);
        weights.put("$.auth", 0.80);
        return weights;
    }
}
