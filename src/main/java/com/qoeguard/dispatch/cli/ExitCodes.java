package com.qoeguard.dispatch.cli;

import com.qoeguard.core.model.GateDecision;

/**
 * Process exit codes for CI gating.
 */
public final class ExitCodes {

    public static final int PASS = 0;
    public static final int WARN = 1;
    public static final int FAIL = 2;
    public static final int ERROR = 3;

    private ExitCodes() {
        // utility class
    }

    /**
     * @param failOnWarn treat WARN as a failing build
     */
    public static int forDecision(GateDecision decision, boolean failOnWarn) {
        return switch (decision) {
            case PASS -> ExitCodes.PASS;
            case WARN -> failOnWarn ? ExitCodes.FAIL : ExitCodes.WARN;
            case FAIL -> ExitCodes.FAIL;
        };
    }
}
