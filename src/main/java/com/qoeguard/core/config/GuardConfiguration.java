package com.qoeguard.core.config;

import com.qoeguard.core.engine.ValidationEngine;
import com.qoeguard.core.features.CriticalityConfig;
import com.qoeguard.core.features.CriticalityRule;
import com.qoeguard.core.features.PathPattern;
import com.qoeguard.core.model.Feature;
import com.qoeguard.core.model.GateDecision;
import com.qoeguard.core.policy.OverrideRule;
import com.qoeguard.core.policy.PolicyConfig;
import com.qoeguard.core.policy.PolicyPresets;
import com.qoeguard.core.scoring.FeatureScale;
import com.qoeguard.core.scoring.RiskScorer;
import com.qoeguard.core.scoring.RiskScorers;
import com.qoeguard.core.scoring.WeightConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the immutable pipeline configuration from {@link QoeGuardProperties}.
 * <p>
 * Any malformed value fails application startup with a {@link ConfigurationException}.
 */
@Configuration
public class GuardConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GuardConfiguration.class);

    @Bean
    public CriticalityConfig criticalityConfig(QoeGuardProperties properties) {
        return toCriticalityConfig(properties.getCriticality());
    }

    @Bean
    public WeightConfig weightConfig(QoeGuardProperties properties) {
        return toWeightConfig(properties.getWeights());
    }

    @Bean
    public PolicyConfig policyConfig(QoeGuardProperties properties) {
        return toPolicyConfig(properties.getPreset(), properties.getPolicy());
    }

    @Bean
    public RiskScorer riskScorer(QoeGuardProperties properties) {
        return RiskScorers.forName(properties.getScorer());
    }

    @Bean
    public ValidationEngine validationEngine(RiskScorer riskScorer, CriticalityConfig criticalityConfig,
                                             WeightConfig weightConfig, PolicyConfig policyConfig) {
        log.info("Validation engine: scorer={} policy={} warn={} fail={} criticalityRules={}",
                riskScorer.name(), policyConfig.name(), policyConfig.warnThreshold(),
                policyConfig.failThreshold(), criticalityConfig.rules().size());
        return new ValidationEngine(riskScorer, criticalityConfig, weightConfig, policyConfig);
    }

    static CriticalityConfig toCriticalityConfig(QoeGuardProperties.Criticality criticality) {
        if (criticality == null || criticality.getRules() == null) {
            return CriticalityConfig.defaults();
        }
        List<CriticalityRule> rules = new ArrayList<>();
        for (QoeGuardProperties.Rule rule : criticality.getRules()) {
            rules.add(CriticalityRule.of(rule.getPattern(), rule.getWeight()));
        }
        return new CriticalityConfig(rules);
    }

    static WeightConfig toWeightConfig(QoeGuardProperties.Weights weights) {
        WeightConfig.Builder builder = WeightConfig.defaults().toBuilder();
        if (weights == null) {
            return builder.build();
        }
        if (weights.getBias() != null) {
            builder.bias(weights.getBias());
        }
        builder.allowNegative(weights.isAllowNegative());
        for (Map.Entry<String, Double> entry : weights.getValues().entrySet()) {
            if (entry.getValue() == null) {
                throw new ConfigurationException("Weight for " + entry.getKey() + " must not be empty");
            }
            builder.weight(feature(entry.getKey()), entry.getValue());
        }
        for (Map.Entry<String, QoeGuardProperties.Scale> entry : weights.getScales().entrySet()) {
            QoeGuardProperties.Scale scale = entry.getValue();
            builder.scale(feature(entry.getKey()), new FeatureScale(scale.getDivisor(), scale.getCap()));
        }
        return builder.build();
    }

    static PolicyConfig toPolicyConfig(String preset, QoeGuardProperties.Policy policy) {
        PolicyConfig base = PolicyPresets.forName(preset);
        if (policy == null) {
            return base;
        }
        double warn = policy.getWarnThreshold() != null ? policy.getWarnThreshold() : base.warnThreshold();
        double fail = policy.getFailThreshold() != null ? policy.getFailThreshold() : base.failThreshold();
        PolicyConfig config = base.withThresholds(warn, fail);
        if (policy.getTopN() != null) {
            config = config.withTopN(policy.getTopN());
        }
        if (policy.getOverrides() != null) {
            List<OverrideRule> rules = new ArrayList<>();
            for (QoeGuardProperties.OverrideEntry override : policy.getOverrides()) {
                rules.add(OverrideRule.parse(override.getName(), override.getWhen(), outcome(override)));
            }
            config = config.withOverrides(rules);
        }
        if (policy.getAllowedDriftPaths() != null && !policy.getAllowedDriftPaths().isEmpty()) {
            List<PathPattern> allowed = new ArrayList<>();
            for (String path : policy.getAllowedDriftPaths()) {
                allowed.add(PathPattern.parse(path));
            }
            config = config.withAllowedDriftPaths(allowed);
        }
        return config;
    }

    private static Feature feature(String key) {
        try {
            return Feature.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static GateDecision outcome(QoeGuardProperties.OverrideEntry override) {
        String raw = override.getOutcome() == null ? "" : override.getOutcome().trim().toUpperCase(Locale.ROOT);
        try {
            return GateDecision.valueOf(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Override rule '" + override.getName()
                    + "' has invalid outcome '" + override.getOutcome() + "'. Valid outcomes: PASS, WARN, FAIL", e);
        }
    }
}
