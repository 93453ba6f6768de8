package com.vcc.governance.repository;

import com.vcc.governance.entity.UsageRecordEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UsageRecordRepository extends ReactiveCrudRepository<UsageRecordEntity, Long> {
}
