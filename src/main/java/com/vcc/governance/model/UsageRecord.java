package com.vcc.governance.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only record of one unit of resource consumption.
 */
public record UsageRecord(
        String tenantId,
        String userId,
        ResourceCategory category,
        long quantity,
        String unit,
        String endpoint,
        String method,
        int responseStatus,
        long processingTimeMs,
        String billingTier,
        Instant recordedAt
) {

    public UsageRecord {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(recordedAt, "recordedAt");
        unit = unit != null ? unit : category.unit();
    }

    /**
     * Build a record for a completed request.
     */
    public static UsageRecord of(RequestContext ctx, ResourceCategory category, long quantity,
                                 int responseStatus, Instant completedAt) {
        long elapsed = Math.max(0, completedAt.toEpochMilli() - ctx.startedAt().toEpochMilli());
        return new UsageRecord(
                ctx.tenantId(),
                ctx.userId(),
                category,
                quantity,
                category.unit(),
                ctx.endpoint(),
                ctx.method(),
                responseStatus,
                elapsed,
                ctx.billingTier(),
                completedAt
        );
    }
}
