package com.github.dimitryivaniuta.relay.config;

import com.github.dimitryivaniuta.relay.transform.SchemaMapping;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Relay pipeline tunables.
 *
 * YAML prefix: {@code relay}
 *
 * Example:
 * <pre>
 * relay:
 *   registry:
 *     base-url: http://localhost:8081/apis/registry/v2
 *     group-id: default
 *   forwarding:
 *     max-attempts: 5
 *     base-backoff: 2s
 *     max-backoff: 2m
 *   query:
 *     max-limit: 100
 *   schemas:
 *     order:
 *       destination-url: http://localhost:8001/orders
 *       mapping:
 *         rename:
 *           "[id]": order_id
 * </pre>
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    @Valid
    private Registry registry = new Registry();

    @Valid
    private Forwarding forwarding = new Forwarding();

    @Valid
    private Query query = new Query();

    @Valid
    private Upload upload = new Upload();

    /** Per-schema local settings keyed by schema name. */
    @Valid
    private Map<String, SchemaSettings> schemas = new LinkedHashMap<>();

    public SchemaSettings schema(String name) {
        SchemaSettings s = schemas.get(name);
        return s != null ? s : new SchemaSettings();
    }

    @Getter
    @Setter
    @ToString
    public static class Registry {
        /** Apicurio v2 REST root, e.g. {@code http://apicurio:8080/apis/registry/v2}. */
        @NotBlank
        private String baseUrl = "http://localhost:8081/apis/registry/v2";

        @NotBlank
        private String groupId = "default";

        /** Artifact property carrying the destination URL. */
        @NotBlank
        private String destinationProperty = "destinationUrl";

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(2);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    @ToString
    public static class Forwarding {
        /** Total attempts allowed per record, the first one included. */
        @Min(1)
        private int maxAttempts = 5;

        /** Initial backoff used when a transient failure occurs (exponential strategy). */
        @NotNull
        private Duration baseBackoff = Duration.ofSeconds(2);

        /** Maximum backoff cap for retries. */
        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(2);

        /** How often the worker wakes up to look for due records. */
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(1);

        /** Max records claimed per poll tick. */
        @Min(1)
        private int batchSize = 50;

        /** Parallel forward calls per tick. */
        @Min(1)
        private int concurrency = 8;

        /** Lease applied when a record is claimed; an expired lease makes the record claimable again. */
        @NotNull
        private Duration leaseDuration = Duration.ofSeconds(30);

        /** Upper bound for one destination call. */
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(10);

        /** Await the first forward attempt before answering the ingest call. */
        private boolean inlineFirstAttempt = false;

        /** Start the background polling loop on application start-up. */
        private boolean pollerEnabled = true;

        /** A lease that expires mid-call would let the poller re-claim the record and send it twice. */
        @AssertTrue(message = "lease-duration must be longer than request-timeout")
        public boolean isLeaseLongerThanRequestTimeout() {
            return leaseDuration == null || requestTimeout == null || leaseDuration.compareTo(requestTimeout) > 0;
        }
    }

    @Getter
    @Setter
    @ToString
    public static class Query {
        @Min(1)
        @Max(10_000)
        private int maxLimit = 100;

        @Min(1)
        private int defaultLimit = 10;
    }

    @Getter
    @Setter
    @ToString
    public static class Upload {
        @Min(1)
        private int maxRows = 10_000;
    }

    @Getter
    @Setter
    @ToString
    public static class SchemaSettings {
        /** Used when the registry artifact carries no destination property. */
        private String destinationUrl;

        @Valid
        private SchemaMapping mapping;
    }
}
