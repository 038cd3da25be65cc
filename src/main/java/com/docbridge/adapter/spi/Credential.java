package com.docbridge.adapter.spi;

/**
 * Authentication material handed to a transport.
 * Implementations must not reveal secrets from {@code toString()}.
 */
public interface Credential {

    /**
     * Short name of the credential scheme, e.g. {@code key}.
     */
    String scheme();
}
