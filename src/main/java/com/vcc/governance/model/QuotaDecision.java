package com.vcc.governance.model;

/**
 * Outcome of a quota pre-check. {@code status} is null when the check was skipped
 * or failed open.
 */
public record QuotaDecision(boolean allowed, QuotaStatus status, String reason) {

    private static final QuotaDecision SKIPPED = new QuotaDecision(true, null, null);

    public static QuotaDecision skipped() {
        return SKIPPED;
    }

    public static QuotaDecision allowed(QuotaStatus status) {
        return new QuotaDecision(true, status, null);
    }

    public static QuotaDecision denied(QuotaStatus status) {
        String reason = "Quota exceeded for " + status.category().key()
                + ": " + status.used() + "/" + status.limit() + " used this billing period";
        return new QuotaDecision(false, status, reason);
    }
}
