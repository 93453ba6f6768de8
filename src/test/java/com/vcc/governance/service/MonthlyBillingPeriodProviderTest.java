package com.vcc.governance.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.vcc.governance.model.BillingPeriod;
import com.vcc.governance.support.MutableClock;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MonthlyBillingPeriodProvider")
class MonthlyBillingPeriodProviderTest {

    @Test
    @DisplayName("spans the current UTC calendar month")
    void currentMonth() {
        BillingPeriod period = new MonthlyBillingPeriodProvider(MutableClock.at("2026-02-14T23:59:59Z"))
                .currentPeriod();

        assertThat(period.start()).isEqualTo(Instant.parse("2026-02-01T00:00:00Z"));
        assertThat(period.end()).isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
    }

    @Test
    @DisplayName("rolls over at the year boundary")
    void december() {
        MutableClock clock = MutableClock.at("2026-12-31T23:59:59.999Z");
        MonthlyBillingPeriodProvider provider = new MonthlyBillingPeriodProvider(clock);

        assertThat(provider.currentPeriod().end()).isEqualTo(Instant.parse("2027-01-01T00:00:00Z"));

        clock.set(Instant.parse("2027-01-01T00:00:00Z"));
        assertThat(provider.currentPeriod().start()).isEqualTo(Instant.parse("2027-01-01T00:00:00Z"));
    }
}
