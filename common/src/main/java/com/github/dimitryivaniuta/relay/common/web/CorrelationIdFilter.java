package com.github.dimitryivaniuta.relay.common.web;

import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Ensures every request carries a correlation id:
 * <ul>
 *   <li>Reads or creates {@code X-Correlation-ID}.</li>
 *   <li>Writes the header to the HTTP response.</li>
 *   <li>Exposes the id via exchange attribute and Reactor Context for downstream code.</li>
 * </ul>
 */
@Slf4j
public class CorrelationIdFilter implements WebFilter, Ordered {

    /** Exchange attribute key containing the correlation id. */
    public static final String ATTR_CORRELATION_ID = "com.github.dimitryivaniuta.relay.correlation-id";

    /** Reactor context key containing the correlation id. */
    public static final String CTX_CORRELATION_ID = "correlationId";

    /** HTTP header name for correlation id propagation. */
    public static final String HEADER_CORRELATION_ID = "X-Correlation-ID";

    static final int MAX_LENGTH = 200;

    @Override
    public Mono<Void> filter(final ServerWebExchange exchange, final WebFilterChain chain) {
        final String id = ensureCorrelationId(exchange);
        exchange.getResponse().getHeaders().set(HEADER_CORRELATION_ID, id);
        return chain.filter(exchange).contextWrite(ctx -> ctx.put(CTX_CORRELATION_ID, id));
    }

    /**
     * Run very early so the header is available to subsequent filters/handlers.
     */
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    /**
     * Returns the correlation id of the exchange, or null when the filter did not run.
     */
    public static String current(final ServerWebExchange exchange) {
        return exchange.getAttribute(ATTR_CORRELATION_ID);
    }

    private String ensureCorrelationId(final ServerWebExchange exchange) {
        final String cached = exchange.getAttribute(ATTR_CORRELATION_ID);
        if (cached != null && !cached.isBlank()) {
            return cached;
        }

        final String raw = exchange.getRequest().getHeaders().getFirst(HEADER_CORRELATION_ID);
        String cid = normalizeCorrelationId(raw);

        if (cid == null) {
            cid = UUID.randomUUID().toString();
            final String toSet = cid;
            final ServerHttpRequest mutated = exchange.getRequest()
                    .mutate()
                    .headers(h -> h.set(HEADER_CORRELATION_ID, toSet))
                    .build();
            exchange.mutate().request(mutated).build();
            if (log.isDebugEnabled()) {
                log.debug("Generated new correlation id {}", toSet);
            }
        }

        exchange.getAttributes().put(ATTR_CORRELATION_ID, cid);
        return cid;
    }

    /**
     * Returns a sanitized correlation id or null if the incoming value is unusable.
     */
    static String normalizeCorrelationId(final String raw) {
        if (raw == null) return null;
        final String v = raw.trim();
        if (v.isEmpty()) return null;
        if (v.length() > MAX_LENGTH) return null;
        return v;
    }
}
