package com.vcc.governance.store;

import com.vcc.governance.model.UsageRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Durable append-only sink for usage records, read later for billing reconciliation.
 */
public interface UsageLedger {

    Mono<Void> append(List<UsageRecord> batch);
}
