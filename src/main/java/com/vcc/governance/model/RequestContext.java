package com.vcc.governance.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable per-request governance context.
 * Created once by the orchestrator and discarded when the request ends.
 */
public record RequestContext(
        String tenantId,        // May be null when no identity signal resolved
        String userId,          // May be null
        String billingTier,
        String endpoint,
        String method,
        Instant startedAt
) {

    public RequestContext {
        Objects.requireNonNull(billingTier, "billingTier");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(startedAt, "startedAt");
    }

    public boolean hasTenant() {
        return tenantId != null;
    }

    public boolean hasUser() {
        return userId != null;
    }

    @Override
    public String toString() {
        return "RequestContext{" +
                "tenantId='" + tenantId + '\'' +
                ", userId='" + userId + '\'' +
                ", tier='" + billingTier + '\'' +
                ", " + method + ' ' + endpoint +
                '}';
    }
}
