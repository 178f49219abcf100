package com.example.i18n.resolve;

/**
 * Decides whether error details may be written into a response trace.
 * The {@code prod} run mode always wins, then the static flag, then the
 * request's debug header.
 */
public class DebugPolicy {

    public static final String PROD = "prod";

    private final String runEnv;
    private final boolean debugMode;

    public DebugPolicy(String runEnv, boolean debugMode) {
        this.runEnv = runEnv == null ? "" : runEnv;
        this.debugMode = debugMode;
    }

    public boolean isDebugAllowed(RequestSignals signals) {
        if (PROD.equals(runEnv)) {
            return false;
        }
        if (debugMode) {
            return true;
        }
        return signals != null && signals.debugHeader() != null && !signals.debugHeader().isEmpty();
    }

    public String getRunEnv() {
        return runEnv;
    }

    public boolean isDebugMode() {
        return debugMode;
    }
}
