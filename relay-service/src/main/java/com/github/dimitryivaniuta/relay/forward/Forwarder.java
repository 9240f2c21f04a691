package com.github.dimitryivaniuta.relay.forward;

import reactor.core.publisher.Mono;

/**
 * Delivers a transformed payload to its destination. Implementations never emit an
 * error signal: every failure is reported as a {@link ForwardResult}.
 */
public interface Forwarder {

    Mono<ForwardResult> forward(ForwardRequest request);
}
