package com.vcc.governance.web;

import com.vcc.governance.config.GovernanceOptions;
import com.vcc.governance.dto.QuotaReportResponse;
import com.vcc.governance.model.RequestContext;
import com.vcc.governance.service.BillingPeriodProvider;
import com.vcc.governance.service.GovernanceOrchestrator;
import com.vcc.governance.service.QuotaEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Read-only view of a tenant's consumption in the current billing period.
 * Callers only see their own tenant, as resolved by the governance filter.
 */
@RestController
@RequestMapping("/governance")
public class QuotaStatusController {
    private static final Logger log = LoggerFactory.getLogger(QuotaStatusController.class);

    private final GovernanceOptions options;
    private final QuotaEnforcer quotaEnforcer;
    private final BillingPeriodProvider periodProvider;

    public QuotaStatusController(GovernanceOptions options,
                                 QuotaEnforcer quotaEnforcer,
                                 BillingPeriodProvider periodProvider) {
        this.options = options;
        this.quotaEnforcer = quotaEnforcer;
        this.periodProvider = periodProvider;
    }

    /**
     * GET /governance/tenants/{tenantId}/quota?tier=
     * Missing tier uses the caller's resolved tier; unknown tier falls back to the default tier.
     */
    @GetMapping("/tenants/{tenantId}/quota")
    public Mono<QuotaReportResponse> quota(
            @PathVariable String tenantId,
            @RequestParam(name = "tier", required = false) String tier,
            ServerWebExchange exchange
    ) {
        RequestContext caller = GovernanceOrchestrator.contextOf(exchange);
        if (caller == null || !caller.hasTenant()) {
            return Mono.error(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Tenant identity required"));
        }
        if (!caller.tenantId().equals(tenantId)) {
            log.warn("Tenant {} attempted to read quota of tenant {}", caller.tenantId(), tenantId);
            return Mono.error(new ResponseStatusException(HttpStatus.FORBIDDEN, "Not allowed to read this tenant's quota"));
        }

        String tierName = options.tier(tier != null ? tier : caller.billingTier()).name();
        return quotaEnforcer.statusAll(tenantId, tierName)
                .collectList()
                .map(quotas -> QuotaReportResponse.of(tenantId, tierName, periodProvider.currentPeriod(), quotas))
                .onErrorMap(e -> !(e instanceof ResponseStatusException), e -> {
                    log.warn("Quota store unavailable while reporting tenant {}: {}", tenantId, e.getMessage());
                    return new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Quota store unavailable", e);
                });
    }
}
