package com.vcc.governance.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.governance.repository.UsageRecordRepository;
import com.vcc.governance.service.BillingPeriodProvider;
import com.vcc.governance.service.ExclusionFilter;
import com.vcc.governance.service.GovernanceOrchestrator;
import com.vcc.governance.service.IdentityResolver;
import com.vcc.governance.service.MonthlyBillingPeriodProvider;
import com.vcc.governance.service.QuotaEnforcer;
import com.vcc.governance.service.RateLimiter;
import com.vcc.governance.service.UsageRecorder;
import com.vcc.governance.store.CounterBackedQuotaStore;
import com.vcc.governance.store.CounterStore;
import com.vcc.governance.store.QuotaStore;
import com.vcc.governance.store.R2dbcUsageLedger;
import com.vcc.governance.store.RedisCounterStore;
import com.vcc.governance.store.UsageLedger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Clock;

/**
 * Wires the governance components. Stores are replaceable by declaring a bean of the same type.
 */
@Configuration
public class GovernanceConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GovernanceOptions governanceOptions(GovernanceProperties properties) {
        return GovernanceOptions.from(properties);
    }

    // ==================== Stores ====================

    @Bean
    @ConditionalOnMissingBean(CounterStore.class)
    public CounterStore counterStore(ReactiveStringRedisTemplate redisTemplate) {
        return new RedisCounterStore(redisTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(QuotaStore.class)
    public QuotaStore quotaStore(CounterStore counterStore, GovernanceOptions options) {
        return new CounterBackedQuotaStore(counterStore, options.keyPrefix());
    }

    @Bean
    @ConditionalOnMissingBean(UsageLedger.class)
    public UsageLedger usageLedger(UsageRecordRepository repository) {
        return new R2dbcUsageLedger(repository);
    }

    @Bean
    @ConditionalOnMissingBean(BillingPeriodProvider.class)
    public BillingPeriodProvider billingPeriodProvider(Clock clock) {
        return new MonthlyBillingPeriodProvider(clock);
    }

    // ==================== Pipeline ====================

    @Bean
    public IdentityResolver identityResolver(GovernanceOptions options, ObjectMapper objectMapper, Clock clock) {
        return new IdentityResolver(options, objectMapper, clock);
    }

    @Bean
    public ExclusionFilter exclusionFilter(GovernanceOptions options) {
        return new ExclusionFilter(options.excludePatterns());
    }

    @Bean
    public RateLimiter rateLimiter(GovernanceOptions options, CounterStore counterStore, Clock clock) {
        return new RateLimiter(options, counterStore, clock);
    }

    @Bean
    public QuotaEnforcer quotaEnforcer(GovernanceOptions options, QuotaStore quotaStore,
                                       BillingPeriodProvider billingPeriodProvider) {
        return new QuotaEnforcer(options, quotaStore, billingPeriodProvider);
    }

    @Bean
    public UsageRecorder usageRecorder(GovernanceOptions options, UsageLedger usageLedger,
                                       QuotaEnforcer quotaEnforcer, Clock clock) {
        return new UsageRecorder(options, usageLedger, quotaEnforcer, clock);
    }

    @Bean
    public GovernanceOrchestrator governanceOrchestrator(GovernanceOptions options,
                                                         IdentityResolver identityResolver,
                                                         ExclusionFilter exclusionFilter,
                                                         RateLimiter rateLimiter,
                                                         QuotaEnforcer quotaEnforcer,
                                                         UsageRecorder usageRecorder,
                                                         ObjectMapper objectMapper,
                                                         Clock clock) {
        return new GovernanceOrchestrator(options, identityResolver, exclusionFilter, rateLimiter,
                quotaEnforcer, usageRecorder, objectMapper, clock);
    }
}
