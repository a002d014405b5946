package com.qoeguard.core.engine;

import com.qoeguard.core.features.CriticalityConfig;
import com.qoeguard.core.metrics.QoeGuardMetrics;
import com.qoeguard.core.model.GateDecision;
import com.qoeguard.core.model.ValidationResult;
import com.qoeguard.core.policy.PolicyConfig;
import com.qoeguard.core.scoring.LogisticRiskScorer;
import com.qoeguard.core.scoring.WeightConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;

import static com.qoeguard.core.json.TestJson.parse;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ValidationServiceTest {

    private final ValidationEngine engine = new ValidationEngine(new LogisticRiskScorer(),
            CriticalityConfig.of(Map.of("$.a", 1.0)), WeightConfig.defaults(), PolicyConfig.defaults());

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("overrides and decisions are counted")
    void recordsMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ValidationService service = new ValidationService(engine, new QoeGuardMetrics(registry));

        ValidationResult result = service.validate("playback",
                parse("{'a':{'bitrate':8000,'b':1,'c':1,'d':1}}"),
                parse("{'a':{'bitrate':'8000'}}"));

        assertEquals(GateDecision.FAIL, result.outcome());
        assertEquals("playback", result.name());
        assertEquals(1.0, registry.find("qoeguard.decisions.total").tag("decision", "FAIL").counter().count());
        assertEquals(1.0, registry.find("qoeguard.overrides.total")
                .tag("rule", "critical-type-changes").counter().count());
        assertEquals(1L, registry.find("qoeguard.comparison.duration").timer().count());
        assertEquals(4.0, registry.find("qoeguard.changes.count").summary().totalAmount());
    }

    @Test
    @DisplayName("passing comparisons do not record overrides")
    void noOverride() {
        QoeGuardMetrics metrics = mock(QoeGuardMetrics.class);
        ValidationService service = new ValidationService(engine, metrics);

        service.validate("same", parse("{'a':1}"), parse("{'a':1}"));

        verify(metrics).recordDecision(GateDecision.PASS);
        verify(metrics, never()).recordOverride(anyString());
    }

    @Test
    @DisplayName("MDC is cleared after a standalone comparison and kept inside a batch")
    void mdcLifecycle() {
        ValidationService service = new ValidationService(engine);
        service.validate("one", parse("{}"), parse("{}"));
        assertNull(MDC.get("comparison"));

        MDC.put("comparison", "outer");
        service.validate("two", parse("{}"), parse("{}"));
        assertEquals("outer", MDC.get("comparison"));
    }
}
