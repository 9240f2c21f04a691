package com.github.dimitryivaniuta.relay.forward;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * JSON POST to an {@code http(s)} destination.
 *
 * <p>2xx is success; 408, 425, 429, 5xx, I/O errors and timeouts are transient;
 * every other status is permanent.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class HttpForwarder implements DestinationForwarder {

    private static final int MAX_BODY_IN_ERROR = 300;

    private final WebClient client;
    private final Duration requestTimeout;

    @Override
    public boolean supports(URI destination) {
        String scheme = destination.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    @Override
    public Mono<ForwardResult> forward(URI destination, ForwardRequest request) {
        return client.post()
                .uri(destination)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .header(RelayHeaders.RECORD_ID, Long.toString(request.recordId()))
                .header(RelayHeaders.SCHEMA, request.schemaName())
                .header(RelayHeaders.SCHEMA_VERSION, Integer.toString(request.schemaVersion()))
                .bodyValue(request.payloadJson())
                .exchangeToMono(resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> classify(resp.statusCode().value(), body)))
                .timeout(requestTimeout)
                .onErrorResume(ex -> Mono.just(fromError(ex)))
                .doOnNext(r -> log.debug("POST {} record={} -> {} {}", destination, request.recordId(),
                        r.outcome(), r.statusCode()));
    }

    static ForwardResult classify(int status, String body) {
        if (status >= 200 && status < 300) {
            return ForwardResult.success(status);
        }
        String error = "HTTP " + status + (body == null || body.isBlank() ? "" : ": " + abbreviate(body));
        if (status == 408 || status == 425 || status == 429 || status >= 500) {
            return ForwardResult.transientFailure(status, error);
        }
        return ForwardResult.permanentFailure(status, error);
    }

    private static ForwardResult fromError(Throwable ex) {
        if (ex instanceof TimeoutException) {
            return ForwardResult.transientFailure(null, "Destination timed out");
        }
        if (ex instanceof WebClientRequestException) {
            return ForwardResult.transientFailure(null, "Destination unreachable: " + ex.getMessage());
        }
        // Anything unexpected on the wire is retried; the attempt budget bounds it.
        return ForwardResult.transientFailure(null, "Forward failed: " + ex);
    }

    private static String abbreviate(String body) {
        String s = body.strip();
        return s.length() <= MAX_BODY_IN_ERROR ? s : s.substring(0, MAX_BODY_IN_ERROR) + "...";
    }
}
