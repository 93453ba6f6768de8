package com.vcc.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vcc.governance.model.BillingPeriod;
import com.vcc.governance.model.QuotaStatus;

import java.time.Instant;
import java.util.List;

/**
 * Current-period quota status of every category for a tenant.
 */
public record QuotaReportResponse(
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("billing_tier") String billingTier,
        @JsonProperty("period_start") Instant periodStart,
        @JsonProperty("period_end") Instant periodEnd,
        @JsonProperty("quotas") List<QuotaStatus> quotas
) {

    public static QuotaReportResponse of(String tenantId, String tier, BillingPeriod period, List<QuotaStatus> quotas) {
        return new QuotaReportResponse(tenantId, tier, period.start(), period.end(), quotas);
    }
}
