package com.vcc.governance.store;

import com.vcc.governance.model.BillingPeriod;
import com.vcc.governance.model.ResourceCategory;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Quota totals kept as counters, one key per tenant, category and period start.
 * Keys outlive the period by a grace interval so late reconciliation can still read them.
 */
public class CounterBackedQuotaStore implements QuotaStore {

    static final Duration RETENTION_GRACE = Duration.ofDays(7);

    private final CounterStore counters;
    private final String keyPrefix;

    public CounterBackedQuotaStore(CounterStore counters, String keyPrefix) {
        this.counters = counters;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Mono<Long> getUsage(String tenantId, ResourceCategory category, BillingPeriod period) {
        return counters.get(key(tenantId, category, period));
    }

    @Override
    public Mono<Long> addUsage(String tenantId, ResourceCategory category, BillingPeriod period, long quantity) {
        Duration ttl = Duration.between(period.start(), period.end()).plus(RETENTION_GRACE);
        return counters.incrementWithExpiry(key(tenantId, category, period), quantity, ttl);
    }

    String key(String tenantId, ResourceCategory category, BillingPeriod period) {
        return keyPrefix + "quota:" + tenantId + ":" + category.key() + ":" + period.start().getEpochSecond();
    }
}
