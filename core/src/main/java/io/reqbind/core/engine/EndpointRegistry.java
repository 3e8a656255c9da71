package io.reqbind.core.engine;

import io.reqbind.core.error.EndpointConfigException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of compiled endpoints keyed by id, in load order. Built once at startup;
 * thread-safe.
 */
public final class EndpointRegistry {

    private static final EndpointRegistry EMPTY = new EndpointRegistry(Map.of());

    private final Map<String, Endpoint> endpoints;

    private EndpointRegistry(Map<String, Endpoint> endpoints) {
        this.endpoints = Collections.unmodifiableMap(new LinkedHashMap<>(endpoints));
    }

    public static EndpointRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Endpoint> find(String id) {
        return Optional.ofNullable(endpoints.get(id));
    }

    /** All endpoints, in load order. */
    public Collection<Endpoint> endpoints() {
        return endpoints.values();
    }

    public int size() {
        return endpoints.size();
    }

    public boolean isEmpty() {
        return endpoints.isEmpty();
    }

    /** Builder for {@link EndpointRegistry}. */
    public static final class Builder {

        private final Map<String, Endpoint> endpoints = new LinkedHashMap<>();
        private final Map<String, String> routes = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Adds an endpoint.
         *
         * @throws EndpointConfigException if the id or the method and path are already taken
         */
        public Builder add(Endpoint endpoint) {
            Endpoint existing = endpoints.get(endpoint.id());
            if (existing != null) {
                throw new EndpointConfigException(
                        "Duplicate endpoint id '" + endpoint.id() + "' (also defined in " + existing.source() + ")",
                        endpoint.id(),
                        endpoint.source());
            }
            String route = endpoint.method() + " " + endpoint.path();
            String owner = routes.putIfAbsent(route, endpoint.id());
            if (owner != null) {
                throw new EndpointConfigException(
                        "Route " + route + " is already served by endpoint '" + owner + "'",
                        endpoint.id(),
                        endpoint.source());
            }
            endpoints.put(endpoint.id(), endpoint);
            return this;
        }

        public EndpointRegistry build() {
            return new EndpointRegistry(endpoints);
        }
    }
}
