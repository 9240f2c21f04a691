package com.github.dimitryivaniuta.relay.forward;

import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RoutingForwarderTest {

    private static ForwardRequest request(String url) {
        return new ForwardRequest(7L, "order", 1, url, "{}");
    }

    @Test
    void routesByScheme() {
        DestinationForwarder http = mock(DestinationForwarder.class);
        DestinationForwarder kafka = mock(DestinationForwarder.class);
        when(http.supports(any())).thenAnswer(inv -> "http".equals(((URI) inv.getArgument(0)).getScheme()));
        when(kafka.supports(any())).thenAnswer(inv -> "kafka".equals(((URI) inv.getArgument(0)).getScheme()));
        when(kafka.forward(any(), any())).thenReturn(Mono.just(ForwardResult.success(null)));

        RoutingForwarder router = new RoutingForwarder(List.of(http, kafka));

        StepVerifier.create(router.forward(request("kafka://orders")))
                .assertNext(r -> assertTrue(r.isSuccess()))
                .verifyComplete();
        verify(kafka).forward(eq(URI.create("kafka://orders")), any());
        verify(http, never()).forward(any(), any());
    }

    @Test
    void malformedOrUnsupportedDestinationIsPermanentWithoutIo() {
        DestinationForwarder http = mock(DestinationForwarder.class);
        when(http.supports(any())).thenAnswer(inv -> "http".equals(((URI) inv.getArgument(0)).getScheme()));
        RoutingForwarder router = new RoutingForwarder(List.of(http));

        for (String url : new String[]{"http://bad host/x", "ftp://files/x", "no-scheme", ""}) {
            StepVerifier.create(router.forward(request(url)))
                    .assertNext(r -> assertEquals(ForwardResult.Outcome.PERMANENT, r.outcome(), url))
                    .verifyComplete();
        }
        verify(http, never()).forward(any(), any());
    }

    @Test
    void transportErrorSignalBecomesTransientResult() {
        DestinationForwarder http = mock(DestinationForwarder.class);
        when(http.supports(any())).thenReturn(true);
        when(http.forward(any(), any())).thenReturn(Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(new RoutingForwarder(List.of(http)).forward(request("http://dest/x")))
                .assertNext(r -> assertTrue(r.isTransient()))
                .verifyComplete();
    }
}
