package com.vcc.governance.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.vcc.governance.config.GovernanceOptions;
import com.vcc.governance.model.BillingPeriod;
import com.vcc.governance.model.QuotaStatus;
import com.vcc.governance.model.RequestContext;
import com.vcc.governance.model.ResourceCategory;
import com.vcc.governance.store.CounterBackedQuotaStore;
import com.vcc.governance.support.InMemoryCounterStore;
import com.vcc.governance.support.MutableClock;
import com.vcc.governance.support.TestOptions;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

@DisplayName("QuotaEnforcer")
class QuotaEnforcerTest {

    private MutableClock clock;
    private InMemoryCounterStore counters;
    private CounterBackedQuotaStore quotaStore;
    private MonthlyBillingPeriodProvider periods;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-15T12:00:00Z");
        counters = new InMemoryCounterStore(clock);
        quotaStore = new CounterBackedQuotaStore(counters, "gov:");
        periods = new MonthlyBillingPeriodProvider(clock);
    }

    private QuotaEnforcer enforcer(GovernanceOptions options) {
        return new QuotaEnforcer(options, quotaStore, periods);
    }

    private GovernanceOptions freeTier(Map<String, Long> quotas) {
        return TestOptions.builder().tier("free", quotas).build();
    }

    private RequestContext request(String tenant) {
        return new RequestContext(tenant, null, "free", "/api/items", "GET", clock.instant());
    }

    private void seed(String tenant, ResourceCategory category, long quantity) {
        BillingPeriod period = periods.currentPeriod();
        quotaStore.addUsage(tenant, category, period, quantity).block();
    }

    @Test
    @DisplayName("denies the next api call once usage has reached the ceiling")
    void deniesAtCeiling() {
        QuotaEnforcer enforcer = enforcer(freeTier(Map.of("api_calls", 100L)));
        seed("T2", ResourceCategory.API_CALLS, 100);

        StepVerifier.create(enforcer.checkBeforeRequest(request("T2")))
                .assertNext(decision -> {
                    assertThat(decision.allowed()).isFalse();
                    assertThat(decision.status().used()).isEqualTo(100);
                    assertThat(decision.status().limit()).isEqualTo(100);
                    assertThat(decision.status().exceeded()).isTrue();
                    assertThat(decision.reason()).contains("api_calls").contains("100/100");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("allows while usage plus the request stays within the ceiling")
    void allowsBelowCeiling() {
        QuotaEnforcer enforcer = enforcer(freeTier(Map.of("api_calls", 100L)));
        seed("T2", ResourceCategory.API_CALLS, 99);

        StepVerifier.create(enforcer.checkBeforeRequest(request("T2")))
                .assertNext(decision -> {
                    assertThat(decision.allowed()).isTrue();
                    assertThat(decision.status().remaining()).isEqualTo(1);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("skips unlimited categories, anonymous requests and disabled enforcement")
    void skipsWhenNotApplicable() {
        QuotaEnforcer unlimited = enforcer(freeTier(Map.of("api_calls", -1L)));
        StepVerifier.create(unlimited.checkBeforeRequest(request("T1")))
                .assertNext(decision -> assertThat(decision.status()).isNull())
                .verifyComplete();

        QuotaEnforcer limited = enforcer(freeTier(Map.of("api_calls", 0L)));
        StepVerifier.create(limited.checkBeforeRequest(request(null)))
                .assertNext(decision -> assertThat(decision.allowed()).isTrue())
                .verifyComplete();

        QuotaEnforcer disabled = enforcer(TestOptions.builder()
                .tier("free", Map.of("api_calls", 0L))
                .quotaEnforcement(false)
                .build());
        StepVerifier.create(disabled.checkBeforeRequest(request("T1")))
                .assertNext(decision -> assertThat(decision.allowed()).isTrue())
                .verifyComplete();
    }

    @Test
    @DisplayName("fails open when the quota store is unreachable")
    void failsOpen() {
        QuotaEnforcer enforcer = enforcer(freeTier(Map.of("api_calls", 1L)));
        counters.setFailing(true);

        StepVerifier.create(enforcer.checkBeforeRequest(request("T1")))
                .assertNext(decision -> {
                    assertThat(decision.allowed()).isTrue();
                    assertThat(decision.status()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("checks post-hoc categories against the requested quantity")
    void checksRequestedQuantity() {
        QuotaEnforcer enforcer = enforcer(freeTier(Map.of("ai_tokens", 1000L)));
        seed("T1", ResourceCategory.AI_TOKENS, 900);

        StepVerifier.create(enforcer.check("T1", "free", ResourceCategory.AI_TOKENS, 100))
                .assertNext(decision -> assertThat(decision.allowed()).isTrue())
                .verifyComplete();
        StepVerifier.create(enforcer.check("T1", "free", ResourceCategory.AI_TOKENS, 101))
                .assertNext(decision -> assertThat(decision.allowed()).isFalse())
                .verifyComplete();
    }

    @Test
    @DisplayName("consume adds to the period total and propagates store errors")
    void consume() {
        QuotaEnforcer enforcer = enforcer(freeTier(Map.of("ai_tokens", 1000L)));

        StepVerifier.create(enforcer.consume("T1", "free", ResourceCategory.AI_TOKENS, 850))
                .assertNext(status -> {
                    assertThat(status.used()).isEqualTo(850);
                    assertThat(status.approachingLimit(80)).isTrue();
                    assertThat(status.exceeded()).isFalse();
                })
                .verifyComplete();

        counters.setFailing(true);
        StepVerifier.create(enforcer.consume("T1", "free", ResourceCategory.AI_TOKENS, 1))
                .verifyError(IllegalStateException.class);
    }

    @Test
    @DisplayName("starts every calendar month from zero")
    void newPeriodStartsFresh() {
        QuotaEnforcer enforcer = enforcer(freeTier(Map.of("api_calls", 10L)));
        seed("T1", ResourceCategory.API_CALLS, 10);
        assertThat(enforcer.checkBeforeRequest(request("T1")).block().allowed()).isFalse();

        clock.set(Instant.parse("2026-04-01T00:00:00Z"));

        assertThat(enforcer.checkBeforeRequest(request("T1")).block().allowed()).isTrue();
    }

    @Test
    @DisplayName("reports every category with unknown tiers mapped to the default tier")
    void statusAll() {
        QuotaEnforcer enforcer = enforcer(freeTier(Map.of("api_calls", 100L, "storage", 2048L)));
        seed("T1", ResourceCategory.API_CALLS, 40);

        StepVerifier.create(enforcer.statusAll("T1", "does-not-exist").collectList())
                .assertNext(statuses -> {
                    assertThat(statuses).extracting(QuotaStatus::category)
                            .containsExactly(ResourceCategory.values());
                    assertThat(statuses.get(0).used()).isEqualTo(40);
                    assertThat(statuses.get(0).usagePercentage()).isEqualTo(40.0);
                    assertThat(statuses).filteredOn(s -> s.category() == ResourceCategory.AI_TOKENS)
                            .allMatch(QuotaStatus::isUnlimited);
                })
                .verifyComplete();
    }
}
