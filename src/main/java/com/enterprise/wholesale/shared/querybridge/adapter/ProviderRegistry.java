package com.enterprise.wholesale.shared.querybridge.adapter;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Statements registered by name at startup and looked up by the step beans
 * that build readers and writers.
 *
 * <p>Names are unique across all job configurations sharing the registry; a
 * second registration under the same name is a wiring error.
 *
 * @param <P> provider type
 */
@Slf4j
public abstract class ProviderRegistry<P> {

    private final Map<String, P> providers = new LinkedHashMap<>();
    private final String kind;

    protected ProviderRegistry(String kind) {
        this.kind = kind;
    }

    public void register(String name, P provider) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(kind + " name must not be blank");
        }
        Objects.requireNonNull(provider, name);
        P previous = providers.putIfAbsent(name, provider);
        if (previous != null && previous != provider) {
            throw new IllegalStateException(kind + " already registered: " + name);
        }
        log.debug("Registered {} {}", kind, name);
    }

    public P get(String name) {
        P provider = providers.get(name);
        if (provider == null) {
            throw new IllegalArgumentException("No " + kind + " registered: " + name
                    + " (known: " + providers.keySet() + ")");
        }
        return provider;
    }

    public Map<String, P> all() {
        return Collections.unmodifiableMap(providers);
    }
}
