package com.qoeguard.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw {@code qoeguard.*} settings. Converted once into immutable scoring, policy and
 * criticality configuration by {@link GuardConfiguration}; unset values fall back to the
 * selected preset.
 */
@Component
@ConfigurationProperties(prefix = "qoeguard")
public class QoeGuardProperties {

    private String preset = "default";
    private String scorer = "logistic";
    private Policy policy = new Policy();
    private Weights weights = new Weights();
    private Criticality criticality = new Criticality();
    private Batch batch = new Batch();

    public String getPreset() { return preset; }
    public void setPreset(String preset) { this.preset = preset; }
    public String getScorer() { return scorer; }
    public void setScorer(String scorer) { this.scorer = scorer; }
    public Policy getPolicy() { return policy; }
    public void setPolicy(Policy policy) { this.policy = policy; }
    public Weights getWeights() { return weights; }
    public void setWeights(Weights weights) { this.weights = weights; }
    public Criticality getCriticality() { return criticality; }
    public void setCriticality(Criticality criticality) { this.criticality = criticality; }
    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }

    public static class Policy {
        private Double warnThreshold;
        private Double failThreshold;
        private Integer topN;
        /** Replaces the preset's override rules when set. */
        private List<OverrideEntry> overrides;
        private List<String> allowedDriftPaths = new ArrayList<>();

        public Double getWarnThreshold() { return warnThreshold; }
        public void setWarnThreshold(Double warnThreshold) { this.warnThreshold = warnThreshold; }
        public Double getFailThreshold() { return failThreshold; }
        public void setFailThreshold(Double failThreshold) { this.failThreshold = failThreshold; }
        public Integer getTopN() { return topN; }
        public void setTopN(Integer topN) { this.topN = topN; }
        public List<OverrideEntry> getOverrides() { return overrides; }
        public void setOverrides(List<OverrideEntry> overrides) { this.overrides = overrides; }
        public List<String> getAllowedDriftPaths() { return allowedDriftPaths; }
        public void setAllowedDriftPaths(List<String> allowedDriftPaths) { this.allowedDriftPaths = allowedDriftPaths; }
    }

    public static class OverrideEntry {
        private String name;
        /** Conditions joined by {@code &&}, e.g. {@code critical_changes>=3 && type_changes>=1}. */
        private String when;
        private String outcome = "FAIL";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getWhen() { return when; }
        public void setWhen(String when) { this.when = when; }
        public String getOutcome() { return outcome; }
        public void setOutcome(String outcome) { this.outcome = outcome; }
    }

    public static class Weights {
        private Double bias;
        private boolean allowNegative = false;
        /** Per-feature weight overrides keyed by feature name. */
        private Map<String, Double> values = new LinkedHashMap<>();
        private Map<String, Scale> scales = new LinkedHashMap<>();

        public Double getBias() { return bias; }
        public void setBias(Double bias) { this.bias = bias; }
        public boolean isAllowNegative() { return allowNegative; }
        public void setAllowNegative(boolean allowNegative) { this.allowNegative = allowNegative; }
        public Map<String, Double> getValues() { return values; }
        public void setValues(Map<String, Double> values) { this.values = values; }
        public Map<String, Scale> getScales() { return scales; }
        public void setScales(Map<String, Scale> scales) { this.scales = scales; }
    }

    public static class Scale {
        private double divisor = 1.0;
        private double cap = Double.POSITIVE_INFINITY;

        public double getDivisor() { return divisor; }
        public void setDivisor(double divisor) { this.divisor = divisor; }
        public double getCap() { return cap; }
        public void setCap(double cap) { this.cap = cap; }
    }

    public static class Criticality {
        /** Replaces the built-in streaming rules when set; an empty list disables criticality. */
        private List<Rule> rules;

        public List<Rule> getRules() { return rules; }
        public void setRules(List<Rule> rules) { this.rules = rules; }
    }

    public static class Rule {
        private String pattern;
        private double weight = 1.0;

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }
    }

    public static class Batch {
        private int maxParallel = 4;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    }
}
