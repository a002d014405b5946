package com.qoeguard.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qoeguard.core.engine.BatchReport;
import com.qoeguard.core.engine.ValidationEngine;
import com.qoeguard.core.features.CriticalityRule;
import com.qoeguard.core.features.PathPattern;
import com.qoeguard.core.json.JsonValues;
import com.qoeguard.core.model.Change;
import com.qoeguard.core.model.Decision;
import com.qoeguard.core.model.Feature;
import com.qoeguard.core.model.GateDecision;
import com.qoeguard.core.model.Signal;
import com.qoeguard.core.model.ValidationResult;
import com.qoeguard.core.policy.OverrideRule;
import com.qoeguard.core.policy.PolicyConfig;
import com.qoeguard.core.scoring.FeatureScale;
import com.qoeguard.core.scoring.WeightConfig;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders validation results as a console summary, a JSON document, or GitHub Actions
 * workflow annotations.
 * <p>
 * Output depends only on the result, so the same comparison always renders the same bytes.
 */
@Component
public class ReportFormatter {

    /** Path-level changes listed in the console summary before eliding the rest. */
    static final int SUMMARY_CHANGE_LIMIT = 10;

    private final ObjectMapper objectMapper;

    public ReportFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ── Console summary ─────────────────────────────────────────────

    public String summary(ValidationResult result) {
        Decision decision = result.decision();
        StringBuilder sb = new StringBuilder();
        sb.append("Comparison: ").append(result.name()).append('\n');
        sb.append("Decision:   ").append(decision.outcome())
                .append(String.format(Locale.ROOT, " (risk %.4f, scorer %s)", decision.riskScore(),
                        result.riskScore().scorer()))
                .append('\n');
        decision.override().ifPresent(rule -> sb.append("Override:   ").append(rule).append('\n'));
        sb.append("Changes:    ").append(result.changes().size()).append(" scored, ")
                .append(result.suppressed().size()).append(" suppressed\n");

        sb.append("\nFeatures\n");
        for (Feature feature : Feature.values()) {
            sb.append(String.format(Locale.ROOT, "  %-20s %10s  %+.4f%n", feature.key(),
                    number(decision.features().get(feature)), decision.contributions().get(feature)));
        }

        if (!decision.topSignals().isEmpty()) {
            sb.append("\nTop signals\n");
            int rank = 1;
            for (Signal signal : decision.topSignals()) {
                sb.append(String.format(Locale.ROOT, "  %d. %s%n", rank++, describe(signal)));
            }
        }

        if (!result.changes().isEmpty()) {
            sb.append("\nChanges\n");
            List<Change> changes = result.changes();
            int shown = Math.min(changes.size(), SUMMARY_CHANGE_LIMIT);
            for (int i = 0; i < shown; i++) {
                Change change = changes.get(i);
                sb.append(String.format(Locale.ROOT, "  %-13s %s  %s -> %s%n",
                        change.kind().label(), change.path(),
                        JsonValues.toDisplayString(change.before()),
                        JsonValues.toDisplayString(change.after())));
            }
            if (changes.size() > shown) {
                sb.append("  ... and ").append(changes.size() - shown).append(" more\n");
            }
        }
        return sb.toString();
    }

    public String batchSummary(BatchReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Batch ").append(report.runId()).append(": ")
                .append(report.results().size()).append(" comparisons in ")
                .append(report.durationMs()).append("ms\n\n");
        for (ValidationResult result : report.results()) {
            sb.append(String.format(Locale.ROOT, "  %-4s  %.4f  %-40s %d changes%s%n",
                    result.outcome(), result.decision().riskScore(), result.name(),
                    result.changes().size(),
                    result.decision().override().map(r -> " [override " + r + "]").orElse("")));
        }
        sb.append(String.format(Locale.ROOT, "%nPASS %d, WARN %d, FAIL %d. Worst outcome: %s%n",
                report.count(GateDecision.PASS), report.count(GateDecision.WARN),
                report.count(GateDecision.FAIL), report.worstOutcome()));
        return sb.toString();
    }

    public String policySummary(ValidationEngine engine) {
        PolicyConfig policy = engine.policy();
        WeightConfig weights = engine.weights();
        StringBuilder sb = new StringBuilder();
        sb.append("Policy:     ").append(policy.name()).append('\n');
        sb.append(String.format(Locale.ROOT, "Thresholds: warn >= %.2f, fail >= %.2f%n",
                policy.warnThreshold(), policy.failThreshold()));
        sb.append("Scorer:     ").append(engine.scorer().name()).append('\n');
        sb.append("Top-N:      ").append(policy.topN()).append('\n');

        sb.append("\nOverrides\n");
        if (policy.overrides().isEmpty()) {
            sb.append("  (none)\n");
        }
        for (OverrideRule rule : policy.overrides()) {
            sb.append("  ").append(rule).append('\n');
        }

        sb.append(String.format(Locale.ROOT, "%nWeights (bias %+.2f)%n", weights.bias()));
        for (Feature feature : Feature.values()) {
            FeatureScale scale = weights.scale(feature);
            sb.append(String.format(Locale.ROOT, "  %-20s %+.2f", feature.key(), weights.weight(feature)));
            if (!scale.isIdentity()) {
                sb.append(String.format(Locale.ROOT, "  scaled /%s cap %s",
                        number(scale.divisor()), number(scale.cap())));
            }
            sb.append('\n');
        }

        sb.append("\nCritical paths\n");
        if (engine.criticality().isEmpty()) {
            sb.append("  (none)\n");
        }
        for (CriticalityRule rule : engine.criticality().rules()) {
            sb.append(String.format(Locale.ROOT, "  %-24s %.2f%n", rule.pattern().source(), rule.weight()));
        }

        if (!policy.allowedDriftPaths().isEmpty()) {
            sb.append("\nAllowed drift\n");
            for (PathPattern allowed : policy.allowedDriftPaths()) {
                sb.append("  ").append(allowed.source()).append('\n');
            }
        }
        return sb.toString();
    }

    // ── JSON ────────────────────────────────────────────────────────

    public String json(ValidationResult result) {
        return write(toJson(result));
    }

    public String batchJson(BatchReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("run_id", report.runId());
        root.put("decision", report.worstOutcome().name());
        root.put("duration_ms", report.durationMs());
        ObjectNode counts = root.putObject("counts");
        for (GateDecision outcome : GateDecision.values()) {
            counts.put(outcome.name(), report.count(outcome));
        }
        ArrayNode results = root.putArray("results");
        for (ValidationResult result : report.results()) {
            results.add(toJson(result));
        }
        return write(root);
    }

    ObjectNode toJson(ValidationResult result) {
        Decision decision = result.decision();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("name", result.name());
        root.put("decision", decision.outcome().name());
        root.put("risk_score", decision.riskScore());
        root.put("scorer", result.riskScore().scorer());
        if (decision.overridden()) {
            root.put("override", decision.overrideRule());
        } else {
            root.putNull("override");
        }

        ObjectNode features = root.putObject("features");
        decision.features().toReportMap().forEach((key, value) -> {
            if (value instanceof Integer i) {
                features.put(key, i);
            } else {
                features.put(key, value.doubleValue());
            }
        });

        ObjectNode contributions = root.putObject("contributions");
        for (Feature feature : Feature.values()) {
            contributions.put(feature.key(), decision.contributions().get(feature));
        }

        ArrayNode signals = root.putArray("top_signals");
        for (Signal signal : decision.topSignals()) {
            signals.add(toJson(signal));
        }

        ArrayNode changes = root.putArray("changes");
        for (Change change : result.changes()) {
            changes.add(toJson(change));
        }
        root.put("change_count", result.changes().size());
        root.put("suppressed_count", result.suppressed().size());
        return root;
    }

    private ObjectNode toJson(Signal signal) {
        ObjectNode node = objectMapper.createObjectNode();
        if (signal instanceof Signal.FeatureSignal fs) {
            node.put("type", "feature");
            node.put("feature", fs.feature().key());
            node.put("value", fs.value());
        } else if (signal instanceof Signal.ChangeSignal cs) {
            node.put("type", "change");
            node.setAll(toJson(cs.change()));
            node.put("criticality", cs.criticality());
            node.put("pattern", cs.pattern());
        }
        node.put("contribution", signal.contribution());
        return node;
    }

    private ObjectNode toJson(Change change) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("path", change.path().toString());
        node.put("change_type", change.kind().label());
        // Absent sides are omitted so that they stay distinct from a JSON null
        if (change.before() != null) {
            node.set("before", JsonValues.toNode(change.before()));
        }
        if (change.after() != null) {
            node.set("after", JsonValues.toNode(change.after()));
        }
        return node;
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize report: " + e.getOriginalMessage(), e);
        }
    }

    // ── GitHub Actions annotations ──────────────────────────────────

    public String github(ValidationResult result) {
        StringBuilder sb = new StringBuilder();
        appendAnnotations(sb, result);
        return sb.toString();
    }

    public String batchGithub(BatchReport report) {
        StringBuilder sb = new StringBuilder();
        for (ValidationResult result : report.results()) {
            appendAnnotations(sb, result);
        }
        sb.append("::notice title=qoe-guard batch::")
                .append(escapeData(String.format(Locale.ROOT, "%d comparisons, worst outcome %s",
                        report.results().size(), report.worstOutcome())))
                .append('\n');
        return sb.toString();
    }

    private void appendAnnotations(StringBuilder sb, ValidationResult result) {
        Decision decision = result.decision();
        String level = level(decision.outcome());
        String message = String.format(Locale.ROOT, "%s: %s with risk %.4f, %d changes",
                result.name(), decision.outcome(), decision.riskScore(), result.changes().size());
        if (decision.overridden()) {
            message += " (override " + decision.overrideRule() + ")";
        }
        sb.append("::").append(level).append(" title=").append(escapeProperty("qoe-guard " + decision.outcome()))
                .append("::").append(escapeData(message)).append('\n');
        if (decision.outcome() == GateDecision.PASS) {
            return;
        }
        for (Signal signal : decision.topSignals()) {
            sb.append("::").append(level).append(" title=").append(escapeProperty(result.name()))
                    .append("::").append(escapeData(describe(signal))).append('\n');
        }
    }

    private static String level(GateDecision outcome) {
        return switch (outcome) {
            case PASS -> "notice";
            case WARN -> "warning";
            case FAIL -> "error";
        };
    }

    static String escapeData(String value) {
        return value.replace("%", "%25").replace("\r", "%0D").replace("\n", "%0A");
    }

    static String escapeProperty(String value) {
        return escapeData(value).replace(":", "%3A").replace(",", "%2C");
    }

    // ── Shared ──────────────────────────────────────────────────────

    static String describe(Signal signal) {
        if (signal instanceof Signal.ChangeSignal cs) {
            return String.format(Locale.ROOT, "%s %s (critical %.2f via %s) %+.4f",
                    cs.change().kind().label(), cs.change().path(), cs.criticality(), cs.pattern(),
                    cs.contribution());
        }
        Signal.FeatureSignal fs = (Signal.FeatureSignal) signal;
        return String.format(Locale.ROOT, "%s = %s %+.4f", fs.feature().key(), number(fs.value()),
                fs.contribution());
    }

    static String number(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
