package com.vcc.governance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vcc.governance.model.RateLimitDecision;

/**
 * Body of a 429 response.
 */
public record RateLimitExceededResponse(
        @JsonProperty("error") String error,
        @JsonProperty("message") String message,
        @JsonProperty("retry_after_seconds") long retryAfterSeconds,
        @JsonProperty("current_usage") long currentUsage,
        @JsonProperty("limit") long limit,
        @JsonProperty("window_reset") String windowReset   // ISO-8601 instant
) {

    public static RateLimitExceededResponse from(RateLimitDecision decision) {
        return new RateLimitExceededResponse(
                "rate_limit_exceeded",
                decision.message(),
                decision.retryAfterSeconds(),
                decision.currentCount(),
                decision.maxRequests(),
                decision.windowEnd() != null ? decision.windowEnd().toString() : null
        );
    }
}
