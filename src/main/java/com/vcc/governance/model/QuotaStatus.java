package com.vcc.governance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Consumption of one resource category for a tenant in the current billing period.
 */
public record QuotaStatus(
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("resource_type") ResourceCategory category,
        @JsonProperty("current_usage") long used,
        @JsonProperty("quota_limit") long limit   // -1 = unlimited
) {

    @JsonIgnore
    public boolean isUnlimited() {
        return limit < 0;
    }

    @JsonProperty("remaining")
    public long remaining() {
        return isUnlimited() ? -1 : Math.max(0, limit - used);
    }

    @JsonProperty("usage_percentage")
    public double usagePercentage() {
        if (limit <= 0) {
            return limit == 0 ? 100.0 : 0.0;
        }
        return (used * 100.0) / limit;
    }

    @JsonProperty("quota_exceeded")
    public boolean exceeded() {
        return !isUnlimited() && used >= limit;
    }

    /**
     * True once usage crosses the given soft threshold (percent).
     */
    public boolean approachingLimit(double softThresholdPercent) {
        return !isUnlimited() && usagePercentage() >= softThresholdPercent;
    }
}
