package com.vcc.governance.model;

/**
 * Per-request governance states. Transitions only move forward.
 */
public enum GovernanceState {
    RESOLVING_IDENTITY,
    CHECKING_EXCLUSION,
    PASSTHROUGH,
    RATE_LIMITING,
    DENIED_429,
    QUOTA_CHECKING,
    DENIED_402,
    HANDLING,
    RECORDING,
    DONE;

    public boolean isTerminal() {
        return this == DONE || this == DENIED_429 || this == DENIED_402;
    }
}
