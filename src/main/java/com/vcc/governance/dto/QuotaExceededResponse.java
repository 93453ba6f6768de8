package com.vcc.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vcc.governance.model.QuotaDecision;
import com.vcc.governance.model.QuotaStatus;

/**
 * Body of a 402 response.
 */
public record QuotaExceededResponse(
        @JsonProperty("error") String error,
        @JsonProperty("message") String message,
        @JsonProperty("quota_status") QuotaStatus quotaStatus,
        @JsonProperty("upgrade_url") String upgradeUrl
) {

    public static QuotaExceededResponse from(QuotaDecision decision, String upgradeUrl) {
        return new QuotaExceededResponse("quota_exceeded", decision.reason(), decision.status(), upgradeUrl);
    }
}
