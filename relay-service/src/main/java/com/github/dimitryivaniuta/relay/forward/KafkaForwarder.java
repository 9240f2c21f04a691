package com.github.dimitryivaniuta.relay.forward;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.header.internals.RecordHeader;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderRecord;

/**
 * Publishes to a {@code kafka://<topic>} destination. The record id is the message key.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaForwarder implements DestinationForwarder {

    public static final String SCHEME = "kafka";

    private final KafkaSender<String, byte[]> sender;
    private final Duration requestTimeout;

    @Override
    public boolean supports(URI destination) {
        return SCHEME.equalsIgnoreCase(destination.getScheme());
    }

    @Override
    public Mono<ForwardResult> forward(URI destination, ForwardRequest request) {
        String topic = topicOf(destination);
        if (topic == null) {
            return Mono.just(ForwardResult.permanentFailure(null, "No topic in destination " + destination));
        }

        String key = Long.toString(request.recordId());
        ProducerRecord<String, byte[]> pr = new ProducerRecord<>(topic, key,
                request.payloadJson().getBytes(StandardCharsets.UTF_8));
        pr.headers().add(new RecordHeader(RelayHeaders.RECORD_ID, bytes(key)));
        pr.headers().add(new RecordHeader(RelayHeaders.SCHEMA, bytes(request.schemaName())));
        pr.headers().add(new RecordHeader(RelayHeaders.SCHEMA_VERSION, bytes(Integer.toString(request.schemaVersion()))));

        return sender.send(Mono.just(SenderRecord.create(pr, request.recordId())))
                .next()
                .map(result -> result.exception() == null
                        ? ForwardResult.success(null)
                        : fromError(result.exception()))
                .timeout(requestTimeout)
                .onErrorResume(ex -> Mono.just(fromError(ex)))
                .defaultIfEmpty(ForwardResult.transientFailure(null, "Kafka send completed without a result"))
                .doOnNext(r -> log.debug("Kafka topic={} record={} -> {}", topic, request.recordId(), r.outcome()));
    }

    /** {@code kafka://orders} and {@code kafka:orders} both name topic {@code orders}. */
    static String topicOf(URI destination) {
        String topic = destination.getHost() != null ? destination.getHost() : destination.getSchemeSpecificPart();
        if (topic == null) return null;
        topic = topic.replaceFirst("^/+", "").trim();
        return topic.isEmpty() ? null : topic;
    }

    static ForwardResult fromError(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof RetriableException || t instanceof TimeoutException) {
                return ForwardResult.transientFailure(null, "Kafka transient error: " + ex.getMessage());
            }
        }
        return ForwardResult.permanentFailure(null, "Kafka error: " + ex);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
