package com.github.dimitryivaniuta.relay.forward;

import com.github.dimitryivaniuta.relay.config.RelayProperties;
import com.github.dimitryivaniuta.relay.record.RecordStatus;
import com.github.dimitryivaniuta.relay.record.RecordStore;
import com.github.dimitryivaniuta.relay.record.RelayRecord;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Moves persisted records to a terminal state by forwarding them.
 *
 * <p>Work arrives two ways: {@link #submit(long)} right after ingest, and a polling loop that
 * picks up every {@code persisted}/{@code forwarding} record whose retry time has come,
 * which is also how work left behind by a crash or restart is resumed. A record is leased
 * before its attempt, so concurrent workers never forward the same record at once.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForwardingWorker {

    private final RecordStore store;
    private final Forwarder forwarder;
    private final RelayProperties props;
    private final Clock clock;
    private final MeterRegistry meters;

    private volatile Disposable subscription;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        RelayProperties.Forwarding f = props.getForwarding();
        if (!f.isPollerEnabled()) {
            log.info("ForwardingWorker poller disabled (relay.forwarding.poller-enabled=false)");
            return;
        }
        stop();

        log.info("ForwardingWorker starting: batchSize={}, pollInterval={}, leaseDuration={}, maxAttempts={}",
                f.getBatchSize(), f.getPollInterval(), f.getLeaseDuration(), f.getMaxAttempts());

        // One cycle -> delay -> repeat.
        subscription = Mono.defer(this::drainOnceSafe)
                .repeatWhen(r -> r.delayElements(f.getPollInterval()))
                .subscribe(
                        null,
                        ex -> log.error("ForwardingWorker stream terminated", ex),
                        () -> log.info("ForwardingWorker stream completed")
                );
    }

    @PreDestroy
    public void stop() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
            log.info("ForwardingWorker stopped");
        }
    }

    private Mono<Long> drainOnceSafe() {
        return drainOnce()
                .onErrorResume(ex -> {
                    log.error("Forwarding cycle failed (will retry next tick)", ex);
                    return Mono.empty();
                });
    }

    /**
     * One polling cycle: attempts every due record once.
     *
     * @return number of records that had an attempt recorded
     */
    public Mono<Long> drainOnce() {
        RelayProperties.Forwarding f = props.getForwarding();
        return store.findDue(clock.instant(), f.getBatchSize())
                .flatMap(r -> process(r.id())
                        .onErrorResume(ex -> {
                            log.error("Forward attempt for record {} failed to complete; lease will expire", r.id(), ex);
                            return Mono.empty();
                        }), f.getConcurrency())
                .count()
                .doOnNext(n -> {
                    if (n > 0) log.debug("Forwarding cycle processed {} record(s)", n);
                });
    }

    /** Schedules an attempt for a freshly persisted record without waiting for it. */
    public void submit(long recordId) {
        process(recordId).subscribe(
                r -> log.debug("Record {} after first attempt: {}", r.id(), r.status().label()),
                ex -> log.error("Immediate forward of record {} failed; the poller will retry", recordId, ex));
    }

    /**
     * Claims the record and performs one attempt. Completes empty when the record is not due,
     * is leased by another worker, or is already terminal.
     */
    public Mono<RelayRecord> process(long recordId) {
        Instant now = clock.instant();
        return store.claim(recordId, now, props.getForwarding().getLeaseDuration())
                .flatMap(r -> r.status() == RecordStatus.PERSISTED
                        ? store.markForwarding(r.id(), now).filter(Boolean::booleanValue).map(ok -> r)
                        : Mono.just(r))
                .flatMap(r -> forwarder.forward(ForwardRequest.of(r))
                        .flatMap(result -> complete(r, result)));
    }

    private Mono<RelayRecord> complete(RelayRecord r, ForwardResult result) {
        int attempt = r.forwardAttempts() + 1;
        int max = props.getForwarding().getMaxAttempts();
        Instant done = clock.instant();
        meters.counter("relay.forward", "outcome", result.outcome().name().toLowerCase(Locale.ROOT)).increment();

        Mono<RelayRecord> update;
        switch (result.outcome()) {
            case SUCCESS -> {
                log.info("Record {} forwarded to {} (attempt {})", r.id(), r.destinationUrl(), attempt);
                update = store.recordAttempt(r.id(), RecordStatus.FORWARDED, null, null, done);
            }
            case PERMANENT -> {
                log.warn("Record {} rejected permanently by {} (attempt {}): {}",
                        r.id(), r.destinationUrl(), attempt, result.error());
                update = store.recordAttempt(r.id(), RecordStatus.FAILED_FORWARD, result.error(), null, done);
            }
            default -> {
                if (attempt >= max) {
                    String error = result.error() + " (retry budget of " + max + " attempts exhausted)";
                    log.warn("Record {} failed after {} attempts: {}", r.id(), attempt, result.error());
                    update = store.recordAttempt(r.id(), RecordStatus.FAILED_FORWARD, error, null, done);
                } else {
                    Duration backoff = computeBackoff(attempt);
                    log.warn("Record {} transient failure (attempt {}/{}), retry in {}: {}",
                            r.id(), attempt, max, backoff, result.error());
                    update = store.recordAttempt(r.id(), RecordStatus.FORWARDING, result.error(),
                            done.plus(backoff), done);
                }
            }
        }
        return update.switchIfEmpty(Mono.defer(() -> {
            log.warn("Record {} left forwarding before its attempt was recorded", r.id());
            return Mono.empty();
        }));
    }

    /** {@code min(base * 2^(attempt-1), max)}. */
    Duration computeBackoff(int attempt) {
        if (attempt < 1) attempt = 1;
        RelayProperties.Forwarding f = props.getForwarding();
        Duration candidate = f.getBaseBackoff().multipliedBy(1L << Math.min(attempt - 1, 20));
        return candidate.compareTo(f.getMaxBackoff()) > 0 ? f.getMaxBackoff() : candidate;
    }
}
