package com.github.dimitryivaniuta.relay.forward;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Picks the {@link DestinationForwarder} for a destination URL. A URL that does not parse,
 * or whose scheme no transport supports, is a permanent failure and causes no I/O.
 */
@Slf4j
public class RoutingForwarder implements Forwarder {

    private final List<DestinationForwarder> transports;

    public RoutingForwarder(List<DestinationForwarder> transports) {
        this.transports = List.copyOf(transports);
    }

    @Override
    public Mono<ForwardResult> forward(ForwardRequest request) {
        if (request.payloadJson() == null) {
            return Mono.just(ForwardResult.permanentFailure(null, "Record has no transformed payload"));
        }
        URI destination;
        try {
            destination = new URI(request.destinationUrl() == null ? "" : request.destinationUrl().trim());
        } catch (URISyntaxException e) {
            return Mono.just(ForwardResult.permanentFailure(null, "Malformed destination URL: " + e.getMessage()));
        }
        if (destination.getScheme() == null) {
            return Mono.just(ForwardResult.permanentFailure(null,
                    "Destination URL '" + request.destinationUrl() + "' has no scheme"));
        }
        for (DestinationForwarder t : transports) {
            if (t.supports(destination)) {
                return t.forward(destination, request)
                        .onErrorResume(ex -> {
                            log.error("Transport {} failed for record {}", t.getClass().getSimpleName(),
                                    request.recordId(), ex);
                            return Mono.just(ForwardResult.transientFailure(null, ex.toString()));
                        });
            }
        }
        return Mono.just(ForwardResult.permanentFailure(null,
                "Unsupported destination scheme '" + destination.getScheme() + "'"));
    }
}
