package com.vcc.governance.web;

import com.vcc.governance.service.GovernanceOrchestrator;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Runs every request through the governance pipeline before the rest of the chain.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class GovernanceWebFilter implements WebFilter {

    private final GovernanceOrchestrator orchestrator;

    public GovernanceWebFilter(GovernanceOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        return orchestrator.handle(exchange, chain::filter);
    }
}
