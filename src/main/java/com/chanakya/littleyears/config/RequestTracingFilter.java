package com.chanakya.littleyears.config;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

/**
 * Assigns each request a correlation id (the caller's {@code X-Correlation-ID} when given),
 * echoes it on the response and publishes it to the Reactor context for
 * {@link RequestCorrelation#withMdc}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTracingFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = RequestCorrelation.resolve(
                exchange.getRequest().getHeaders().getFirst(RequestCorrelation.HEADER));
        exchange.getResponse().getHeaders().set(RequestCorrelation.HEADER, correlationId);

        ServerWebExchange traced = exchange.mutate()
                .request(request -> request.header(RequestCorrelation.HEADER, correlationId))
                .build();
        return chain.filter(traced)
                .contextWrite(Context.of(RequestCorrelation.MDC_KEY, correlationId));
    }
}
