package com.vcc.governance.service;

import com.vcc.governance.model.BillingPeriod;

/**
 * Supplies the billing period quotas are accounted against.
 * Period rollover is owned by billing, outside the governance layer.
 */
@FunctionalInterface
public interface BillingPeriodProvider {

    BillingPeriod currentPeriod();
}
