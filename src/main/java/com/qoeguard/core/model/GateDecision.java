package com.qoeguard.core.model;

/**
 * Deployment gating outcome, ordered from least to most severe.
 */
public enum GateDecision {
    PASS,
    WARN,
    FAIL;

    public boolean isWorseThan(GateDecision other) {
        return ordinal() > other.ordinal();
    }

    public static GateDecision worst(GateDecision a, GateDecision b) {
        return a.isWorseThan(b) ? a : b;
    }
}
