package com.docbridge.adapter.spi;

import java.util.Objects;

/**
 * Account-key authentication.
 */
public record KeyCredential(String key) implements Credential {

    public KeyCredential {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }

    @Override
    public String scheme() {
        return "key";
    }

    @Override
    public String toString() {
        return "KeyCredential[key=****]";
    }
}
