package com.vcc.governance.service;

import com.vcc.governance.config.GovernanceOptions;
import com.vcc.governance.model.RequestContext;
import com.vcc.governance.model.ResourceCategory;
import com.vcc.governance.model.UsageMetrics;
import com.vcc.governance.model.UsageRecord;
import com.vcc.governance.store.UsageLedger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous usage metering: a bounded queue drained in batches by a background flusher.
 *
 * A flush runs when the queue reaches the batch size or every flush interval, appends each
 * batch to the ledger and adds it to the quota totals. Failures are logged and the batch is
 * discarded; nothing here is retried and nothing reaches the caller.
 */
public class UsageRecorder {
    private static final Logger log = LoggerFactory.getLogger(UsageRecorder.class);

    private final GovernanceOptions options;
    private final UsageLedger ledger;
    private final QuotaEnforcer quotaEnforcer;
    private final Clock clock;
    private final int batchSize;

    private final BlockingQueue<UsageRecord> queue;
    private final AtomicBoolean flushing = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    private final Scheduler scheduler = Schedulers.newSingle("usage-recorder", true);
    private volatile Disposable periodicFlush;

    public UsageRecorder(GovernanceOptions options, UsageLedger ledger, QuotaEnforcer quotaEnforcer, Clock clock) {
        this.options = options;
        this.ledger = ledger;
        this.quotaEnforcer = quotaEnforcer;
        this.clock = clock;
        this.batchSize = options.recorder().batchSize();
        this.queue = new ArrayBlockingQueue<>(options.recorder().queueCapacity());
        log.info("UsageRecorder initialized: enabled={}, tracked={}, queueCapacity={}, batchSize={}, flushInterval={}",
                options.usageTracking(), options.trackedCategories(), options.recorder().queueCapacity(),
                batchSize, options.recorder().flushInterval());
    }

    @PostConstruct
    public void start() {
        if (periodicFlush == null) {
            periodicFlush = Flux.interval(options.recorder().flushInterval(), scheduler)
                    .subscribe(tick -> triggerFlush());
        }
    }

    /**
     * Drain what is queued, bounded by the configured shutdown timeout.
     */
    @PreDestroy
    public void shutdown() {
        if (periodicFlush != null) {
            periodicFlush.dispose();
        }
        try {
            Integer written = flush().block(options.recorder().shutdownTimeout());
            log.info("UsageRecorder drained {} records on shutdown ({} dropped overall)",
                    written != null ? written : 0, dropped.get());
        } catch (RuntimeException e) {
            log.error("UsageRecorder could not drain {} records on shutdown: {}", queue.size(), e.getMessage());
        } finally {
            scheduler.dispose();
        }
    }

    // ==================== Recording ====================

    /**
     * Queue the records for a request the handler processed.
     * Never throws and never blocks.
     *
     * @return the number of records queued
     */
    public int record(RequestContext ctx, int responseStatus, UsageMetrics metrics) {
        if (!options.usageTracking()) {
            return 0;
        }
        if (!ctx.hasTenant()) {
            log.debug("Skipping usage record for unattributed request {} {}", ctx.method(), ctx.endpoint());
            return 0;
        }
        try {
            int queued = 0;
            for (UsageRecord record : buildRecords(ctx, responseStatus, metrics, clock.instant())) {
                if (enqueue(record)) {
                    queued++;
                }
            }
            return queued;
        } catch (RuntimeException e) {
            log.error("Failed to record usage for tenant {}: {}", ctx.tenantId(), e.getMessage(), e);
            return 0;
        }
    }

    /**
     * One api_calls record per request plus one per tracked category the handler reported.
     */
    public List<UsageRecord> buildRecords(RequestContext ctx, int responseStatus, UsageMetrics metrics,
                                          Instant completedAt) {
        List<UsageRecord> records = new ArrayList<>();
        if (options.isTracked(ResourceCategory.API_CALLS)) {
            records.add(UsageRecord.of(ctx, ResourceCategory.API_CALLS, 1, responseStatus, completedAt));
        }
        if (metrics != null) {
            for (ResourceCategory category : ResourceCategory.values()) {
                if (category == ResourceCategory.API_CALLS || !options.isTracked(category)) {
                    continue;
                }
                long quantity = metrics.get(category);
                if (quantity > 0) {
                    records.add(UsageRecord.of(ctx, category, quantity, responseStatus, completedAt));
                }
            }
        }
        return records;
    }

    boolean enqueue(UsageRecord record) {
        if (!queue.offer(record)) {
            long total = dropped.incrementAndGet();
            log.warn("Usage queue full ({}), dropping {} record for tenant {} (dropped={})",
                    options.recorder().queueCapacity(), record.category().key(), record.tenantId(), total);
            return false;
        }
        if (queue.size() >= batchSize) {
            triggerFlush();
        }
        return true;
    }

    // ==================== Flushing ====================

    /**
     * Write everything currently queued, batch by batch.
     *
     * @return number of records the ledger accepted; never signals an error
     */
    public Mono<Integer> flush() {
        return Flux.defer(() -> Flux.fromIterable(drainBatches()))
                .concatMap(this::writeBatch)
                .reduce(0, Integer::sum);
    }

    private void triggerFlush() {
        if (!flushing.compareAndSet(false, true)) {
            return;
        }
        flush()
                .subscribeOn(scheduler)
                .doFinally(signal -> {
                    flushing.set(false);
                    if (queue.size() >= batchSize) {
                        triggerFlush();
                    }
                })
                .subscribe(
                        written -> {
                            if (written > 0) {
                                log.debug("Flushed {} usage records", written);
                            }
                        },
                        e -> log.error("Usage flush failed: {}", e.getMessage()));
    }

    private List<List<UsageRecord>> drainBatches() {
        List<List<UsageRecord>> batches = new ArrayList<>();
        while (true) {
            List<UsageRecord> batch = new ArrayList<>(batchSize);
            if (queue.drainTo(batch, batchSize) == 0) {
                return batches;
            }
            batches.add(batch);
        }
    }

    private Mono<Integer> writeBatch(List<UsageRecord> batch) {
        Mono<Integer> appended = ledger.append(batch)
                .thenReturn(batch.size())
                .onErrorResume(e -> {
                    log.error("Failed to append {} usage records, discarding batch: {}", batch.size(), e.getMessage());
                    return Mono.just(0);
                });
        return appended.flatMap(count -> addToQuotaTotals(batch).thenReturn(count));
    }

    /**
     * One independent increment per tenant and category in the batch.
     */
    private Mono<Void> addToQuotaTotals(List<UsageRecord> batch) {
        Map<QuotaKey, Long> totals = new LinkedHashMap<>();
        for (UsageRecord record : batch) {
            totals.merge(new QuotaKey(record.tenantId(), record.billingTier(), record.category()),
                    record.quantity(), Long::sum);
        }
        return Flux.fromIterable(totals.entrySet())
                .concatMap(entry -> quotaEnforcer.consume(
                                entry.getKey().tenantId(), entry.getKey().tier(), entry.getKey().category(), entry.getValue())
                        .onErrorResume(e -> {
                            log.warn("Failed to add {} {} to quota of tenant {}: {}",
                                    entry.getValue(), entry.getKey().category().key(),
                                    entry.getKey().tenantId(), e.getMessage());
                            return Mono.empty();
                        }))
                .then();
    }

    // ==================== Diagnostics ====================

    public int pending() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    private record QuotaKey(String tenantId, String tier, ResourceCategory category) {
    }
}
