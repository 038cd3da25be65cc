package com.docbridge.adapter.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call option map, threaded unchanged from the caller to the transport.
 *
 * <p>Unknown keys are carried along so transports can pick up options this layer does
 * not know about. Instances are immutable; {@link #with(String, Object)} returns a copy.
 */
public final class RequestOptions {

    /**
     * Partition key of an item operation.
     */
    public static final String PARTITION_KEY = "partition_key";

    /**
     * Expected {@code _etag} of the item for conditional replace and delete.
     */
    public static final String IF_MATCH = "if_match";

    private static final RequestOptions NONE = new RequestOptions(Map.of());

    private final Map<String, Object> values;

    private RequestOptions(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RequestOptions none() {
        return NONE;
    }

    public static RequestOptions of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        return values.isEmpty() ? NONE : new RequestOptions(values);
    }

    public static RequestOptions partitionKey(Object partitionKey) {
        return NONE.with(PARTITION_KEY, partitionKey);
    }

    /**
     * Returns a copy with one option added or replaced.
     */
    public RequestOptions with(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new RequestOptions(copy);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<Object> partitionKey() {
        return get(PARTITION_KEY);
    }

    public Optional<String> ifMatch() {
        return get(IF_MATCH).map(Object::toString);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RequestOptions other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RequestOptions" + values;
    }
}
