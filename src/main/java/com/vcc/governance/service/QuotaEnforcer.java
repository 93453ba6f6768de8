package com.vcc.governance.service;

import com.vcc.governance.config.GovernanceOptions;
import com.vcc.governance.model.BillingPeriod;
import com.vcc.governance.model.BillingTier;
import com.vcc.governance.model.QuotaDecision;
import com.vcc.governance.model.QuotaStatus;
import com.vcc.governance.model.RequestContext;
import com.vcc.governance.model.ResourceCategory;
import com.vcc.governance.store.QuotaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Billing-period quota checks against tier ceilings.
 *
 * Only api_calls is checked before the handler runs. Categories whose quantity is known
 * after the fact (tokens, content, storage, bandwidth) are added through
 * {@link #consume}, which reports crossings but never blocks.
 */
public class QuotaEnforcer {
    private static final Logger log = LoggerFactory.getLogger(QuotaEnforcer.class);

    private final GovernanceOptions options;
    private final QuotaStore quotaStore;
    private final BillingPeriodProvider periodProvider;

    public QuotaEnforcer(GovernanceOptions options, QuotaStore quotaStore, BillingPeriodProvider periodProvider) {
        this.options = options;
        this.quotaStore = quotaStore;
        this.periodProvider = periodProvider;
        log.info("QuotaEnforcer initialized: enabled={}, tiers={}, softLimitThreshold={}%",
                options.quotaEnforcement(), options.tiers().keySet(), options.softLimitThreshold());
    }

    /**
     * Pre-handler check: may this request consume one more api call?
     */
    public Mono<QuotaDecision> checkBeforeRequest(RequestContext ctx) {
        if (!ctx.hasTenant()) {
            return Mono.just(QuotaDecision.skipped());
        }
        return check(ctx.tenantId(), ctx.billingTier(), ResourceCategory.API_CALLS, 1);
    }

    /**
     * Compare {@code used + requested} against the tier ceiling for the current period.
     * Fails open when the quota store is unreachable.
     */
    public Mono<QuotaDecision> check(String tenantId, String tierName, ResourceCategory category, long requested) {
        if (!options.quotaEnforcement() || tenantId == null) {
            return Mono.just(QuotaDecision.skipped());
        }
        long limit = options.tier(tierName).quotaFor(category);
        if (limit == BillingTier.UNLIMITED) {
            return Mono.just(QuotaDecision.skipped());
        }

        BillingPeriod period = periodProvider.currentPeriod();
        return quotaStore.getUsage(tenantId, category, period)
                .map(used -> {
                    QuotaStatus status = new QuotaStatus(tenantId, category, used, limit);
                    if (used + requested > limit) {
                        log.debug("Quota exceeded for tenant {} ({}: {}/{})", tenantId, category.key(), used, limit);
                        return QuotaDecision.denied(status);
                    }
                    return QuotaDecision.allowed(status);
                })
                .onErrorResume(e -> {
                    log.warn("Quota store unavailable for tenant {} ({}), failing open: {}",
                            tenantId, category.key(), e.getMessage());
                    return Mono.just(QuotaDecision.skipped());
                });
    }

    /**
     * Add consumption to the period total and report threshold crossings.
     * Errors propagate to the caller.
     */
    public Mono<QuotaStatus> consume(String tenantId, String tierName, ResourceCategory category, long quantity) {
        long limit = options.tier(tierName).quotaFor(category);
        BillingPeriod period = periodProvider.currentPeriod();
        return quotaStore.addUsage(tenantId, category, period, quantity)
                .map(total -> new QuotaStatus(tenantId, category, total, limit))
                .doOnNext(status -> reportCrossing(status, quantity));
    }

    /**
     * Current-period status of one category.
     */
    public Mono<QuotaStatus> status(String tenantId, String tierName, ResourceCategory category) {
        long limit = options.tier(tierName).quotaFor(category);
        return quotaStore.getUsage(tenantId, category, periodProvider.currentPeriod())
                .map(used -> new QuotaStatus(tenantId, category, used, limit));
    }

    /**
     * Current-period status of every category, in declaration order.
     */
    public Flux<QuotaStatus> statusAll(String tenantId, String tierName) {
        return Flux.fromArray(ResourceCategory.values())
                .concatMap(category -> status(tenantId, tierName, category));
    }

    private void reportCrossing(QuotaStatus status, long added) {
        if (status.isUnlimited()) {
            return;
        }
        long before = status.used() - added;
        QuotaStatus previous = new QuotaStatus(status.tenantId(), status.category(), before, status.limit());
        if (status.exceeded() && !previous.exceeded()) {
            log.info("Tenant {} reached its {} quota ({}/{})",
                    status.tenantId(), status.category().key(), status.used(), status.limit());
        } else if (status.approachingLimit(options.softLimitThreshold())
                && !previous.approachingLimit(options.softLimitThreshold())) {
            log.info("Tenant {} is approaching its {} quota ({}/{}, {}%)",
                    status.tenantId(), status.category().key(), status.used(), status.limit(),
                    Math.round(status.usagePercentage()));
        }
    }
}
