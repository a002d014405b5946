package com.qoeguard.core.policy;

import com.qoeguard.core.features.CriticalChange;
import com.qoeguard.core.features.CriticalityRule;
import com.qoeguard.core.features.Extraction;
import com.qoeguard.core.json.JsonValue;
import com.qoeguard.core.model.Change;
import com.qoeguard.core.model.Decision;
import com.qoeguard.core.model.Feature;
import com.qoeguard.core.model.FeatureVector;
import com.qoeguard.core.model.GateDecision;
import com.qoeguard.core.model.JsonPath;
import com.qoeguard.core.model.RiskScore;
import com.qoeguard.core.model.Signal;
import com.qoeguard.core.scoring.LogisticRiskScorer;
import com.qoeguard.core.scoring.WeightConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PolicyEngineTest {

    private final PolicyEngine engine = new PolicyEngine();

    private static RiskScore risk(double value) {
        return new RiskScore(value, Map.of(), "fixed");
    }

    private static Extraction features(FeatureVector vector) {
        return new Extraction(vector, List.of());
    }

    @Nested
    @DisplayName("Threshold bands")
    class Bands {

        private final PolicyConfig policy = PolicyPresets.PERMISSIVE.withThresholds(0.45, 0.72);

        @Test
        @DisplayName("risk just below warn passes")
        void belowWarn() {
            assertEquals(GateDecision.PASS, engine.decide(risk(0.4499), Extraction.EMPTY, policy).outcome());
        }

        @Test
        @DisplayName("risk exactly at warn warns")
        void atWarn() {
            assertEquals(GateDecision.WARN, engine.decide(risk(0.45), Extraction.EMPTY, policy).outcome());
        }

        @Test
        @DisplayName("risk exactly at fail fails")
        void atFail() {
            assertEquals(GateDecision.FAIL, engine.decide(risk(0.72), Extraction.EMPTY, policy).outcome());
        }

        @Test
        @DisplayName("bounds of the risk range")
        void extremes() {
            assertEquals(GateDecision.PASS, engine.decide(risk(0.0), Extraction.EMPTY, policy).outcome());
            assertEquals(GateDecision.FAIL, engine.decide(risk(1.0), Extraction.EMPTY, policy).outcome());
        }

        @Test
        @DisplayName("no override recorded when thresholds decide")
        void noOverride() {
            Decision decision = engine.decide(risk(0.5), Extraction.EMPTY, policy);
            assertFalse(decision.overridden());
            assertTrue(decision.override().isEmpty());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        private final FeatureVector severe = FeatureVector.ZERO
                .with(Feature.CRITICAL_CHANGES, 6)
                .with(Feature.TYPE_CHANGES, 1);

        @Test
        @DisplayName("critical type changes fail regardless of risk")
        void builtInOverride() {
            Decision decision = engine.decide(risk(0.01), features(severe), PolicyPresets.DEFAULT);
            assertEquals(GateDecision.FAIL, decision.outcome());
            assertEquals("critical-type-changes", decision.overrideRule());
            assertEquals(0.01, decision.riskScore());
        }

        @Test
        @DisplayName("below the override condition thresholds decide")
        void conditionNotMet() {
            FeatureVector twoCritical = severe.with(Feature.CRITICAL_CHANGES, 2);
            Decision decision = engine.decide(risk(0.01), features(twoCritical), PolicyPresets.DEFAULT);
            assertEquals(GateDecision.PASS, decision.outcome());
            assertNull(decision.overrideRule());
        }

        @Test
        @DisplayName("the first matching rule wins")
        void firstMatchWins() {
            PolicyConfig policy = PolicyPresets.DEFAULT.withOverrides(List.of(
                    OverrideRule.parse("review-types", "type_changes>=1", GateDecision.WARN),
                    OverrideRule.criticalTypeChanges()));

            Decision decision = engine.decide(risk(0.95), features(severe), policy);

            assertEquals(GateDecision.WARN, decision.outcome());
            assertEquals("review-types", decision.overrideRule());
        }

        @Test
        @DisplayName("strict preset fails on any critical removal")
        void strictCriticalRemovals() {
            FeatureVector removal = FeatureVector.ZERO
                    .with(Feature.REMOVED_FIELDS, 1)
                    .with(Feature.CRITICAL_CHANGES, 1);
            Decision decision = engine.decide(risk(0.1), features(removal), PolicyPresets.STRICT);
            assertEquals(GateDecision.FAIL, decision.outcome());
            assertEquals("critical-removals", decision.overrideRule());
        }
    }

    @Nested
    @DisplayName("Evidence")
    class Evidence {

        private final LogisticRiskScorer scorer = new LogisticRiskScorer();

        @Test
        @DisplayName("no changes, no evidence")
        void empty() {
            RiskScore score = scorer.score(FeatureVector.ZERO, WeightConfig.defaults());
            assertTrue(engine.decide(score, Extraction.EMPTY, PolicyPresets.DEFAULT).topSignals().isEmpty());
        }

        @Test
        @DisplayName("signals are ranked by absolute contribution")
        void ranked() {
            FeatureVector f = new FeatureVector(1, 0, 1, 3, 12.0, 5.0, 0, 1);
            JsonPath bitrate = JsonPath.root().field("playback").field("bitrate");
            Change typeChange = Change.typeChanged(bitrate, JsonValue.of(8000), JsonValue.of("8000"));
            Extraction extraction = new Extraction(f,
                    List.of(new CriticalChange(typeChange, CriticalityRule.of("$.playback", 1.0))));
            RiskScore score = scorer.score(f, WeightConfig.defaults());

            List<Signal> signals = PolicyEngine.rankEvidence(score, extraction, 10);

            for (int i = 1; i < signals.size(); i++) {
                assertTrue(Math.abs(signals.get(i - 1).contribution()) >= Math.abs(signals.get(i).contribution()));
            }
            Signal top = signals.get(0);
            assertInstanceOf(Signal.ChangeSignal.class, top);
            // criticality 1.0 x (critical 0.18 + type 0.14)
            assertEquals(0.32, top.contribution(), 1e-12);
            assertEquals("$.playback.bitrate", top.label());
            assertEquals("critical_changes", signals.get(1).label());
            assertEquals("numeric_delta_max", signals.get(2).label());
        }

        @Test
        @DisplayName("evidence is truncated to top-N")
        void truncated() {
            FeatureVector f = new FeatureVector(1, 1, 1, 1, 1.0, 1.0, 1, 0);
            RiskScore score = scorer.score(f, WeightConfig.defaults());
            Decision decision = engine.decide(score, features(f), PolicyPresets.DEFAULT.withTopN(3));
            assertEquals(3, decision.topSignals().size());
            assertEquals("type_changes", decision.topSignals().get(0).label());
        }

        @Test
        @DisplayName("ties keep feature order")
        void stableTies() {
            RiskScore score = new RiskScore(0.5, Map.of(
                    Feature.VALUE_CHANGES, 0.1,
                    Feature.ADDED_FIELDS, 0.1), "fixed");
            FeatureVector f = FeatureVector.ZERO.with(Feature.ADDED_FIELDS, 1).with(Feature.VALUE_CHANGES, 1);
            List<Signal> signals = PolicyEngine.rankEvidence(score, features(f), 5);
            assertEquals(List.of("added_fields", "value_changes"), signals.stream().map(Signal::label).toList());
        }
    }
}
