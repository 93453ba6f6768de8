package com.vcc.governance.service;

import com.vcc.governance.model.BillingPeriod;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Calendar-month billing periods in UTC.
 */
public class MonthlyBillingPeriodProvider implements BillingPeriodProvider {

    private final Clock clock;

    public MonthlyBillingPeriodProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public BillingPeriod currentPeriod() {
        YearMonth month = YearMonth.now(clock.withZone(ZoneOffset.UTC));
        return new BillingPeriod(
                month.atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC),
                month.plusMonths(1).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC)
        );
    }
}
