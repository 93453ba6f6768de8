package com.vcc.governance.service;

import static com.vcc.governance.support.TestOptions.rule;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.governance.config.GovernanceOptions;
import com.vcc.governance.model.GovernanceState;
import com.vcc.governance.model.ResourceCategory;
import com.vcc.governance.model.UsageMetrics;
import com.vcc.governance.model.UsageRecord;
import com.vcc.governance.store.CounterBackedQuotaStore;
import com.vcc.governance.support.InMemoryCounterStore;
import com.vcc.governance.support.InMemoryUsageLedger;
import com.vcc.governance.support.MutableClock;
import com.vcc.governance.support.TestOptions;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.WebHandler;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@DisplayName("GovernanceOrchestrator")
class GovernanceOrchestratorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private InMemoryCounterStore counters;
    private InMemoryUsageLedger ledger;
    private MonthlyBillingPeriodProvider periods;
    private CounterBackedQuotaStore quotaStore;
    private UsageRecorder recorder;
    private GovernanceOrchestrator orchestrator;
    private AtomicInteger handlerCalls;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        counters = new InMemoryCounterStore(clock);
        ledger = new InMemoryUsageLedger();
        periods = new MonthlyBillingPeriodProvider(clock);
        quotaStore = new CounterBackedQuotaStore(counters, "gov:");
        handlerCalls = new AtomicInteger();
        orchestrator = orchestrator(TestOptions.builder()
                .tier("free", Map.of("api_calls", 100L), rule("per-minute", "tenant", Duration.ofSeconds(60), 5)));
    }

    @AfterEach
    void tearDown() {
        recorder.shutdown();
    }

    private GovernanceOrchestrator orchestrator(TestOptions builder) {
        if (recorder != null) {
            recorder.shutdown();
        }
        GovernanceOptions options = builder.recorder(1000, 1000, Duration.ofHours(1)).build();
        QuotaEnforcer quotaEnforcer = new QuotaEnforcer(options, quotaStore, periods);
        recorder = new UsageRecorder(options, ledger, quotaEnforcer, clock);
        return new GovernanceOrchestrator(
                options,
                new IdentityResolver(options, objectMapper, clock),
                new ExclusionFilter(options.excludePatterns()),
                new RateLimiter(options, counters, clock),
                quotaEnforcer,
                recorder,
                objectMapper,
                clock);
    }

    private MockServerWebExchange tenantRequest(String path, String tenant) {
        return MockServerWebExchange.from(MockServerHttpRequest.get(path).header("x-tenant-id", tenant));
    }

    private WebHandler ok() {
        return exchange -> {
            handlerCalls.incrementAndGet();
            exchange.getResponse().setStatusCode(HttpStatus.OK);
            return exchange.getResponse().setComplete();
        };
    }

    private WebHandler failing(Throwable error) {
        return exchange -> {
            handlerCalls.incrementAndGet();
            return Mono.error(error);
        };
    }

    private WebHandler throwing(RuntimeException error) {
        return exchange -> {
            handlerCalls.incrementAndGet();
            throw error;
        };
    }

    private List<UsageRecord> flushedRecords() {
        recorder.flush().block();
        return ledger.records();
    }

    private JsonNode body(MockServerWebExchange exchange) throws Exception {
        return objectMapper.readTree(exchange.getResponse().getBodyAsString().block());
    }

    @Nested
    @DisplayName("Rate limiting")
    class RateLimiting {

        @Test
        @DisplayName("counts remaining down on each admitted request and rejects the next with 429")
        void admitsThenRejects() throws Exception {
            for (int expectedRemaining = 4; expectedRemaining >= 0; expectedRemaining--) {
                clock.advance(Duration.ofSeconds(2));
                MockServerWebExchange exchange = tenantRequest("/api/items", "T1");
                StepVerifier.create(orchestrator.handle(exchange, ok())).verifyComplete();

                HttpHeaders headers = exchange.getResponse().getHeaders();
                assertThat(headers.getFirst(GovernanceOrchestrator.HEADER_LIMIT)).isEqualTo("5");
                assertThat(headers.getFirst(GovernanceOrchestrator.HEADER_REMAINING))
                        .isEqualTo(String.valueOf(expectedRemaining));
                assertThat(headers.getFirst(GovernanceOrchestrator.HEADER_RESET))
                        .isEqualTo(String.valueOf(Instant.parse("2026-03-02T10:01:00Z").getEpochSecond()));
            }

            MockServerWebExchange rejected = tenantRequest("/api/items", "T1");
            StepVerifier.create(orchestrator.handle(rejected, ok())).verifyComplete();

            assertThat(rejected.getResponse().getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
            assertThat(rejected.getResponse().getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("50");
            assertThat(rejected.getResponse().getHeaders().getFirst(GovernanceOrchestrator.HEADER_REMAINING))
                    .isEqualTo("0");
            JsonNode body = body(rejected);
            assertThat(body.get("error").asText()).isEqualTo("rate_limit_exceeded");
            assertThat(body.get("retry_after_seconds").asLong()).isPositive();
            assertThat(body.get("current_usage").asLong()).isEqualTo(6);
            assertThat(body.get("limit").asLong()).isEqualTo(5);
            assertThat(body.get("window_reset").asText()).isEqualTo("2026-03-02T10:01:00Z");
            assertThat(body.get("message").asText()).isNotBlank();

            assertThat(handlerCalls).hasValue(5);
            assertThat(rejected.<GovernanceState>getAttribute(GovernanceOrchestrator.STATE_ATTR))
                    .isEqualTo(GovernanceState.DENIED_429);
            assertThat(flushedRecords()).hasSize(5);
        }

        @Test
        @DisplayName("emits no rate-limit headers when no rule applies")
        void noRuleNoHeaders() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/items"));

            StepVerifier.create(orchestrator.handle(exchange, ok())).verifyComplete();

            assertThat(exchange.getResponse().getHeaders().containsKey(GovernanceOrchestrator.HEADER_LIMIT)).isFalse();
            assertThat(handlerCalls).hasValue(1);
        }
    }

    @Nested
    @DisplayName("Quota")
    class Quota {

        @Test
        @DisplayName("rejects with 402 once the api_calls ceiling is used up")
        void quotaExceeded() throws Exception {
            quotaStore.addUsage("T2", ResourceCategory.API_CALLS, periods.currentPeriod(), 100).block();
            MockServerWebExchange exchange = tenantRequest("/api/items", "T2");

            StepVerifier.create(orchestrator.handle(exchange, ok())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.PAYMENT_REQUIRED);
            JsonNode body = body(exchange);
            assertThat(body.get("error").asText()).isEqualTo("quota_exceeded");
            assertThat(body.get("upgrade_url").asText()).isEqualTo("/pricing");
            JsonNode status = body.get("quota_status");
            assertThat(status.get("tenant_id").asText()).isEqualTo("T2");
            assertThat(status.get("resource_type").asText()).isEqualTo("api_calls");
            assertThat(status.get("current_usage").asLong()).isEqualTo(100);
            assertThat(status.get("quota_limit").asLong()).isEqualTo(100);
            assertThat(status.get("quota_exceeded").asBoolean()).isTrue();

            assertThat(handlerCalls).hasValue(0);
            assertThat(exchange.<GovernanceState>getAttribute(GovernanceOrchestrator.STATE_ATTR))
                    .isEqualTo(GovernanceState.DENIED_402);
            assertThat(flushedRecords()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Exclusion")
    class Exclusion {

        @Test
        @DisplayName("runs the handler for excluded paths without checks, headers or records")
        void excludedPath() {
            MockServerWebExchange exchange = tenantRequest("/health", "T1");

            StepVerifier.create(orchestrator.handle(exchange, ok())).verifyComplete();

            assertThat(handlerCalls).hasValue(1);
            assertThat(exchange.getResponse().getHeaders().containsKey(GovernanceOrchestrator.HEADER_LIMIT)).isFalse();
            assertThat(counters.snapshot()).isEmpty();
            assertThat(recorder.pending()).isZero();
            assertThat(flushedRecords()).isEmpty();
            assertThat(exchange.<GovernanceState>getAttribute(GovernanceOrchestrator.STATE_ATTR))
                    .isEqualTo(GovernanceState.DONE);
            assertThat(GovernanceOrchestrator.contextOf(exchange)).isNull();
        }

        @Test
        @DisplayName("runs a synchronously throwing handler once and surfaces its error through the Mono")
        void excludedPathHandlerThrows() {
            MockServerWebExchange exchange = tenantRequest("/health", "T1");

            Mono<Void> result = orchestrator.handle(exchange, throwing(new IllegalStateException("boom")));

            assertThat(handlerCalls).hasValue(0);
            StepVerifier.create(result).verifyErrorMessage("boom");
            assertThat(handlerCalls).hasValue(1);
            assertThat(exchange.<GovernanceState>getAttribute(GovernanceOrchestrator.STATE_ATTR))
                    .isEqualTo(GovernanceState.DONE);
        }
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("records 500 when the handler fails and keeps the rate-limit count")
        void handlerFailure() {
            MockServerWebExchange exchange = tenantRequest("/api/items", "T1");

            StepVerifier.create(orchestrator.handle(exchange, failing(new IllegalStateException("boom"))))
                    .verifyErrorMessage("boom");

            List<UsageRecord> records = flushedRecords();
            assertThat(records).hasSize(1);
            assertThat(records.get(0).responseStatus()).isEqualTo(500);
            assertThat(records.get(0).category()).isEqualTo(ResourceCategory.API_CALLS);
            long windowIndex = clock.instant().toEpochMilli() / 60_000;
            assertThat(counters.peek("gov:rl:tenant:T1:per-minute:" + windowIndex)).isEqualTo(1L);
        }

        @Test
        @DisplayName("records the status carried by a ResponseStatusException")
        void responseStatusException() {
            MockServerWebExchange exchange = tenantRequest("/api/items", "T1");

            StepVerifier.create(orchestrator.handle(exchange,
                            failing(new ResponseStatusException(HttpStatus.NOT_FOUND))))
                    .expectError(ResponseStatusException.class)
                    .verify();

            assertThat(flushedRecords()).extracting(UsageRecord::responseStatus).containsExactly(404);
        }

        @Test
        @DisplayName("records exactly one api call with status and latency per handled request")
        void oneRecordPerRequest() {
            WebHandler slowCreated = exchange -> {
                clock.advance(Duration.ofMillis(120));
                exchange.getResponse().setStatusCode(HttpStatus.CREATED);
                UsageMetrics.current(exchange).addAiTokens(42);
                return exchange.getResponse().setComplete();
            };
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.post("/api/assistant/chat").header("x-tenant-id", "T1").header("x-user-id", "u7"));

            StepVerifier.create(orchestrator.handle(exchange, slowCreated)).verifyComplete();

            List<UsageRecord> records = flushedRecords();
            assertThat(records).extracting(UsageRecord::category)
                    .containsExactly(ResourceCategory.API_CALLS, ResourceCategory.AI_TOKENS);
            UsageRecord apiCall = records.get(0);
            assertThat(apiCall.responseStatus()).isEqualTo(201);
            assertThat(apiCall.processingTimeMs()).isEqualTo(120);
            assertThat(apiCall.userId()).isEqualTo("u7");
            assertThat(apiCall.method()).isEqualTo("POST");
            assertThat(records.get(1).quantity()).isEqualTo(42);
            assertThat(exchange.<GovernanceState>getAttribute(GovernanceOrchestrator.STATE_ATTR))
                    .isEqualTo(GovernanceState.DONE);
        }

        @Test
        @DisplayName("records 499 when the client goes away mid-request")
        void cancellation() {
            MockServerWebExchange exchange = tenantRequest("/api/items", "T1");
            WebHandler never = ex -> Mono.never();

            StepVerifier.create(orchestrator.handle(exchange, never))
                    .thenAwait(Duration.ofMillis(10))
                    .thenCancel()
                    .verify();

            assertThat(flushedRecords()).extracting(UsageRecord::responseStatus)
                    .containsExactly(GovernanceOrchestrator.CLIENT_CLOSED_REQUEST);
        }

        @Test
        @DisplayName("does not record anonymous requests")
        void anonymousNotRecorded() {
            StepVerifier.create(orchestrator.handle(
                    MockServerWebExchange.from(MockServerHttpRequest.get("/api/items")), ok())).verifyComplete();

            assertThat(flushedRecords()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Store outage")
    class StoreOutage {

        @Test
        @DisplayName("admits requests and runs the handler exactly once when stores are unreachable")
        void failsOpen() {
            counters.setFailing(true);
            MockServerWebExchange exchange = tenantRequest("/api/items", "T1");

            StepVerifier.create(orchestrator.handle(exchange, ok())).verifyComplete();

            assertThat(handlerCalls).hasValue(1);
            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(exchange.getResponse().getHeaders().containsKey(GovernanceOrchestrator.HEADER_LIMIT)).isFalse();
            assertThat(flushedRecords()).hasSize(1);
        }

        @Test
        @DisplayName("passes the request through when identity resolution cannot even start")
        void setupFailure() {
            GovernanceOptions options = TestOptions.builder().tier("free", Map.of()).build();
            ExclusionFilter broken = new ExclusionFilter(List.of()) {
                @Override
                public boolean isExcluded(String path) {
                    throw new IllegalStateException("broken filter");
                }
            };
            GovernanceOrchestrator fragile = new GovernanceOrchestrator(options,
                    new IdentityResolver(options, objectMapper, clock), broken,
                    new RateLimiter(options, counters, clock),
                    new QuotaEnforcer(options, quotaStore, periods), recorder, objectMapper, clock);

            StepVerifier.create(fragile.handle(tenantRequest("/api/items", "T1"), ok())).verifyComplete();

            assertThat(handlerCalls).hasValue(1);
        }

        @Test
        @DisplayName("invokes a throwing handler once when governance setup fails")
        void setupFailureWithThrowingHandler() {
            GovernanceOptions options = TestOptions.builder().tier("free", Map.of()).build();
            ExclusionFilter broken = new ExclusionFilter(List.of()) {
                @Override
                public boolean isExcluded(String path) {
                    throw new IllegalStateException("broken filter");
                }
            };
            GovernanceOrchestrator fragile = new GovernanceOrchestrator(options,
                    new IdentityResolver(options, objectMapper, clock), broken,
                    new RateLimiter(options, counters, clock),
                    new QuotaEnforcer(options, quotaStore, periods), recorder, objectMapper, clock);

            StepVerifier.create(fragile.handle(tenantRequest("/api/items", "T1"),
                            throwing(new IllegalArgumentException("handler"))))
                    .verifyErrorMessage("handler");

            assertThat(handlerCalls).hasValue(1);
        }
    }

    @Test
    @DisplayName("wraps a handler so every call is governed")
    void wrap() {
        WebHandler governed = orchestrator.wrap(ok());
        for (int i = 0; i < 6; i++) {
            governed.handle(tenantRequest("/api/items", "T1")).block();
        }

        assertThat(handlerCalls).hasValue(5);
    }
}
