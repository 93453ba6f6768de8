package com.vcc.governance.store;

import com.vcc.governance.model.BillingPeriod;
import com.vcc.governance.model.ResourceCategory;
import reactor.core.publisher.Mono;

/**
 * Cumulative per-tenant consumption per category and billing period.
 */
public interface QuotaStore {

    Mono<Long> getUsage(String tenantId, ResourceCategory category, BillingPeriod period);

    /**
     * Atomically add to the period total.
     *
     * @return the total after the addition
     */
    Mono<Long> addUsage(String tenantId, ResourceCategory category, BillingPeriod period, long quantity);
}
