package com.github.dimitryivaniuta.relay.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.relay.config.RelayProperties;
import com.github.dimitryivaniuta.relay.error.InvalidSchemaDefinitionException;
import com.github.dimitryivaniuta.relay.error.RegistryUnavailableException;
import com.github.dimitryivaniuta.relay.error.RelayException;
import com.github.dimitryivaniuta.relay.error.SchemaNotFoundException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@link RegistryClient} over the Apicurio Registry v2 REST API.
 *
 * <p>Endpoints used (relative to {@code relay.registry.base-url}):</p>
 * <ul>
 *   <li>{@code GET /groups/{group}/artifacts/{id}/meta} resolves the latest version</li>
 *   <li>{@code GET /groups/{group}/artifacts/{id}/versions/{v}} returns the JSON Schema content</li>
 *   <li>{@code GET /groups/{group}/artifacts/{id}/versions/{v}/meta} returns version properties</li>
 * </ul>
 *
 * <p>Descriptors are cached by (name, resolved version) with no expiry. Concurrent misses for the
 * same key share one registry round-trip; failed loads are not cached.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ApicurioRegistryClient implements RegistryClient {

    private static final String ARTIFACT_META = "/groups/{group}/artifacts/{id}/meta";
    private static final String VERSION_CONTENT = "/groups/{group}/artifacts/{id}/versions/{version}";
    private static final String VERSION_META = "/groups/{group}/artifacts/{id}/versions/{version}/meta";

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final RelayProperties props;

    private final ConcurrentMap<SchemaKey, SchemaDescriptor> cache = new ConcurrentHashMap<>();
    private final ConcurrentMap<SchemaKey, Mono<SchemaDescriptor>> inFlight = new ConcurrentHashMap<>();

    @Override
    public Mono<SchemaDescriptor> fetch(String name, Integer version) {
        return resolveKey(name, version).flatMap(this::cachedOrLoad);
    }

    @Override
    public Mono<SchemaDescriptor> refetch(String name, Integer version) {
        return resolveKey(name, version)
                .flatMap(this::load)
                .doOnNext(d -> {
                    cache.put(d.key(), d);
                    log.info("Schema {} refetched from registry; cache entry replaced", d.key());
                });
    }

    /** Number of cached descriptors. */
    int cachedCount() {
        return cache.size();
    }

    private Mono<SchemaDescriptor> cachedOrLoad(SchemaKey key) {
        SchemaDescriptor hit = cache.get(key);
        if (hit != null) {
            log.debug("Schema cache hit: {}", key);
            return Mono.just(hit);
        }
        return inFlight.computeIfAbsent(key, k -> load(k)
                .doOnNext(d -> cache.putIfAbsent(k, d))
                .doFinally(signal -> inFlight.remove(k))
                .cache());
    }

    private Mono<SchemaKey> resolveKey(String name, Integer version) {
        if (name == null || name.isBlank()) {
            return Mono.error(new SchemaNotFoundException(name, version, "Schema name must not be blank"));
        }
        if (version != null) {
            return version < 1
                    ? Mono.error(SchemaNotFoundException.of(name, version))
                    : Mono.just(new SchemaKey(name, version));
        }
        return client.get()
                .uri(ARTIFACT_META, groupId(), name)
                .retrieve()
                .bodyToMono(String.class)
                .map(body -> new SchemaKey(name, parseVersion(name, readJson(body, name).path("version").asText(null))))
                .onErrorMap(ex -> translate(ex, name, null))
                .doOnNext(k -> log.debug("Resolved latest version of '{}' to {}", name, k.version()));
    }

    private Mono<SchemaDescriptor> load(SchemaKey key) {
        Mono<String> content = client.get()
                .uri(VERSION_CONTENT, groupId(), key.name(), key.version())
                .retrieve()
                .bodyToMono(String.class);

        Mono<String> meta = client.get()
                .uri(VERSION_META, groupId(), key.name(), key.version())
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("{}");

        return Mono.zip(content, meta)
                .map(t -> toDescriptor(key, t.getT1(), t.getT2()))
                .onErrorMap(ex -> translate(ex, key.name(), key.version()))
                .doOnNext(d -> log.info("Fetched schema {} from registry (destination={})", key, d.destinationUrl()));
    }

    private SchemaDescriptor toDescriptor(SchemaKey key, String content, String metaJson) {
        JsonNode definition;
        try {
            definition = objectMapper.readTree(content);
        } catch (Exception e) {
            throw new InvalidSchemaDefinitionException("Schema " + key + " content is not valid JSON", e);
        }
        if (definition == null || !definition.isObject()) {
            throw new InvalidSchemaDefinitionException("Schema " + key + " content is not a JSON object", null);
        }

        JsonNode meta = readJson(metaJson, key.name());
        String destination = meta.path("properties").path(props.getRegistry().getDestinationProperty()).asText(null);
        if (destination == null || destination.isBlank()) {
            destination = props.schema(key.name()).getDestinationUrl();
        }
        if (destination == null || destination.isBlank()) {
            throw new SchemaNotFoundException(key.name(), key.version(),
                    "Schema " + key + " has no destination configured (artifact property '"
                            + props.getRegistry().getDestinationProperty() + "' or relay.schemas."
                            + key.name() + ".destination-url)");
        }
        return new SchemaDescriptor(key.name(), key.version(), definition, destination.trim());
    }

    private JsonNode readJson(String body, String name) {
        try {
            JsonNode node = objectMapper.readTree(body == null ? "{}" : body);
            return node == null ? objectMapper.createObjectNode() : node;
        } catch (Exception e) {
            throw new RegistryUnavailableException("Registry returned unreadable metadata for '" + name + "'", e);
        }
    }

    private static int parseVersion(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new RegistryUnavailableException("Registry metadata for '" + name + "' carries no version");
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new RegistryUnavailableException("Registry version '" + raw + "' of '" + name + "' is not numeric", e);
        }
    }

    private static Throwable translate(Throwable ex, String name, Integer version) {
        if (ex instanceof RelayException) {
            return ex;
        }
        if (ex instanceof WebClientResponseException wre) {
            if (wre.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return SchemaNotFoundException.of(name, version);
            }
            return new RegistryUnavailableException(
                    "Registry responded " + wre.getStatusCode().value() + " for schema '" + name + "'", ex);
        }
        if (ex instanceof WebClientRequestException || ex instanceof TimeoutException) {
            return new RegistryUnavailableException("Registry unreachable: " + ex.getMessage(), ex);
        }
        return new RegistryUnavailableException("Registry call failed for schema '" + name + "': " + ex, ex);
    }

    private String groupId() {
        return props.getRegistry().getGroupId();
    }
}
