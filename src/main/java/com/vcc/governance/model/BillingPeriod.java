package com.vcc.governance.model;

import java.time.Instant;

/**
 * Half-open billing period {@code [start, end)}.
 */
public record BillingPeriod(Instant start, Instant end) {

    public BillingPeriod {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Billing period end must be after start");
        }
    }
}
