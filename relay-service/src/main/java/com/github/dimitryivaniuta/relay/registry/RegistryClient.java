package com.github.dimitryivaniuta.relay.registry;

import reactor.core.publisher.Mono;

/**
 * Read-only access to the external schema registry.
 *
 * <p>Errors: {@link com.github.dimitryivaniuta.relay.error.SchemaNotFoundException} when no
 * artifact matches, {@link com.github.dimitryivaniuta.relay.error.RegistryUnavailableException}
 * on transport, timeout or server failure.</p>
 */
public interface RegistryClient {

    /**
     * Returns the descriptor for {@code name} at {@code version}; a null version resolves to the
     * latest registered version at call time. Successful fetches are cached per resolved version
     * for the process lifetime.
     */
    Mono<SchemaDescriptor> fetch(String name, Integer version);

    /**
     * Like {@link #fetch(String, Integer)} but always goes to the registry and replaces the cached entry.
     */
    Mono<SchemaDescriptor> refetch(String name, Integer version);
}
