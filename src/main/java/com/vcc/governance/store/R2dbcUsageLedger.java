package com.vcc.governance.store;

import com.vcc.governance.entity.UsageRecordEntity;
import com.vcc.governance.model.UsageRecord;
import com.vcc.governance.repository.UsageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Usage ledger persisted through R2DBC, one insert per record within a batch.
 */
public class R2dbcUsageLedger implements UsageLedger {
    private static final Logger log = LoggerFactory.getLogger(R2dbcUsageLedger.class);

    private final UsageRecordRepository repository;

    public R2dbcUsageLedger(UsageRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<Void> append(List<UsageRecord> batch) {
        if (batch.isEmpty()) {
            return Mono.empty();
        }
        List<UsageRecordEntity> entities = batch.stream()
                .map(UsageRecordEntity::fromRecord)
                .toList();
        return repository.saveAll(entities)
                .count()
                .doOnNext(count -> log.debug("Appended {} usage records", count))
                .then();
    }
}
