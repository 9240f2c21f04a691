package com.github.dimitryivaniuta.relay.forward;

import java.net.URI;
import reactor.core.publisher.Mono;

/** One transport, selected by {@link RoutingForwarder} from the destination URI. */
public interface DestinationForwarder {

    boolean supports(URI destination);

    Mono<ForwardResult> forward(URI destination, ForwardRequest request);
}
