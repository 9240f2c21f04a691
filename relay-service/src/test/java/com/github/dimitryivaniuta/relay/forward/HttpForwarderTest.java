package com.github.dimitryivaniuta.relay.forward;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class HttpForwarderTest {

    private static final URI DEST = URI.create("http://dest.local/orders");
    private static final ForwardRequest REQUEST =
            new ForwardRequest(42L, "order", 3, DEST.toString(), "{\"order_id\":1}");

    private static HttpForwarder forwarder(ExchangeFunction exchange, Duration timeout) {
        return new HttpForwarder(WebClient.builder().exchangeFunction(exchange).build(), timeout);
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return req -> Mono.just(ClientResponse.create(status).body(body).build());
    }

    @Test
    void postsPayloadWithRelayHeaders() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        HttpForwarder f = forwarder(req -> {
            seen.set(req);
            return Mono.just(ClientResponse.create(HttpStatus.CREATED).build());
        }, Duration.ofSeconds(1));

        StepVerifier.create(f.forward(DEST, REQUEST))
                .assertNext(r -> {
                    assertTrue(r.isSuccess());
                    assertEquals(201, r.statusCode());
                })
                .verifyComplete();

        ClientRequest req = seen.get();
        assertEquals(HttpMethod.POST, req.method());
        assertEquals(DEST, req.url());
        assertEquals("42", req.headers().getFirst(RelayHeaders.RECORD_ID));
        assertEquals("order", req.headers().getFirst(RelayHeaders.SCHEMA));
        assertEquals("3", req.headers().getFirst(RelayHeaders.SCHEMA_VERSION));
        assertEquals("application/json", req.headers().getFirst(HttpHeaders.CONTENT_TYPE));
    }

    @Test
    void serverErrorsAndThrottlingAreTransient() {
        for (HttpStatus s : new HttpStatus[]{HttpStatus.INTERNAL_SERVER_ERROR, HttpStatus.BAD_GATEWAY,
                HttpStatus.SERVICE_UNAVAILABLE, HttpStatus.TOO_MANY_REQUESTS, HttpStatus.REQUEST_TIMEOUT}) {
            StepVerifier.create(forwarder(respond(s, "busy"), Duration.ofSeconds(1)).forward(DEST, REQUEST))
                    .assertNext(r -> {
                        assertEquals(ForwardResult.Outcome.TRANSIENT, r.outcome(), s.toString());
                        assertEquals(s.value(), r.statusCode());
                    })
                    .verifyComplete();
        }
    }

    @Test
    void clientErrorsArePermanentAndCarryTheBody() {
        StepVerifier.create(forwarder(respond(HttpStatus.BAD_REQUEST, "missing order_id"), Duration.ofSeconds(1))
                        .forward(DEST, REQUEST))
                .assertNext(r -> {
                    assertEquals(ForwardResult.Outcome.PERMANENT, r.outcome());
                    assertEquals("HTTP 400: missing order_id", r.error());
                })
                .verifyComplete();
    }

    @Test
    void connectionRefusedIsTransient() {
        HttpForwarder f = forwarder(req -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), HttpMethod.POST, DEST, new HttpHeaders())),
                Duration.ofSeconds(1));

        StepVerifier.create(f.forward(DEST, REQUEST))
                .assertNext(r -> {
                    assertTrue(r.isTransient());
                    assertNull(r.statusCode());
                    assertTrue(r.error().contains("unreachable"));
                })
                .verifyComplete();
    }

    @Test
    void slowDestinationTimesOutAsTransient() {
        HttpForwarder f = forwarder(req -> Mono.never(), Duration.ofMillis(50));

        StepVerifier.create(f.forward(DEST, REQUEST))
                .assertNext(r -> {
                    assertTrue(r.isTransient());
                    assertEquals("Destination timed out", r.error());
                })
                .verifyComplete();
    }

    @Test
    void classifiesStatusCodes() {
        assertTrue(HttpForwarder.classify(204, "").isSuccess());
        assertEquals(ForwardResult.Outcome.TRANSIENT, HttpForwarder.classify(425, "").outcome());
        assertEquals(ForwardResult.Outcome.PERMANENT, HttpForwarder.classify(404, "").outcome());
        assertEquals(ForwardResult.Outcome.PERMANENT, HttpForwarder.classify(301, "").outcome());
        assertEquals("HTTP 404", HttpForwarder.classify(404, " ").error());
    }
}
