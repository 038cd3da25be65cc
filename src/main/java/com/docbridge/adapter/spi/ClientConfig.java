package com.docbridge.adapter.spi;

import com.docbridge.exceptions.ConfigurationException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings of a client: endpoint, credential and free-form options.
 *
 * <p>Options are interpreted by the layer that owns them: {@value #PARTITION_KEY_CANDIDATES}
 * by the partition-key resolver, everything else by the transport (for example
 * {@code maxPoolSize} for MongoDB).
 */
public final class ClientConfig {

    /**
     * Ordered field names scanned for a partition key, as a list or a comma separated string.
     */
    public static final String PARTITION_KEY_CANDIDATES = "partitionKeyCandidates";

    private final String endpoint;
    private final Credential credential;
    private final Map<String, Object> options;

    public ClientConfig(String endpoint, Credential credential, Map<String, ?> options) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new ConfigurationException("endpoint is required");
        }
        if (credential == null) {
            throw new ConfigurationException("credential is required");
        }
        this.endpoint = endpoint;
        this.credential = credential;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(options, "options must not be null")));
    }

    public static ClientConfig of(String endpoint, Credential credential) {
        return new ClientConfig(endpoint, credential, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getEndpoint() {
        return endpoint;
    }

    public Credential getCredential() {
        return credential;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public Optional<Object> getOption(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public String getStringOption(String name, String defaultValue) {
        return getOption(name).map(Object::toString).orElse(defaultValue);
    }

    /**
     * Reads an integer option given either as a number or as text.
     *
     * @throws ConfigurationException if the value is not an integer or does not fit in an {@code int}
     */
    public int getIntOption(String name, int defaultValue) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            try {
                return Math.toIntExact(((Number) value).longValue());
            } catch (ArithmeticException e) {
                throw new ConfigurationException("Option " + name + " is out of range: " + value, e);
            }
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + name + " must be an integer, got: " + value, e);
        }
    }

    /**
     * Reads a list option given either as a collection or as a comma separated string.
     */
    public List<String> getListOption(String name, List<String> defaultValue) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Collection<?> values) {
            return values.stream().map(Object::toString).toList();
        }
        return Arrays.stream(value.toString().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return "ClientConfig{endpoint=" + endpoint + ", credential=" + credential + ", options=" + options.keySet() + "}";
    }

    /**
     * Builder for {@link ClientConfig}.
     */
    public static final class Builder {
        private String endpoint;
        private Credential credential;
        private final Map<String, Object> options = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder credential(Credential credential) {
            this.credential = credential;
            return this;
        }

        public Builder key(String key) {
            this.credential = new KeyCredential(key);
            return this;
        }

        public Builder option(String name, Object value) {
            options.put(Objects.requireNonNull(name, "name must not be null"), value);
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(endpoint, credential, options);
        }
    }
}
