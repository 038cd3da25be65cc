package com.docbridge.exceptions;

/**
 * Closed set of failure kinds surfaced to callers.
 */
public enum ErrorKind {
    /**
     * The addressed database, container or item does not exist.
     */
    RESOURCE_NOT_FOUND,

    /**
     * A resource with the same identity already exists.
     */
    RESOURCE_EXISTS,

    /**
     * An access condition such as {@code if_match} did not hold.
     */
    PRECONDITION_FAILED,

    /**
     * Any other non-success response, or a failure that could not be classified.
     */
    GENERIC_HTTP_ERROR,

    /**
     * No response was obtained (connectivity, timeout, interruption).
     */
    TRANSPORT_ERROR,

    /**
     * The payload was rejected for its syntax or content.
     */
    INVALID_PAYLOAD,

    /**
     * The payload was neither text nor a supported structural value.
     */
    TYPE_MISMATCH,

    /**
     * No partition key could be determined for an item operation.
     */
    MISSING_PARTITION_KEY;

    /**
     * Returns true for kinds that can only be produced by a response from the server.
     */
    public boolean isHttpClass() {
        return this == RESOURCE_NOT_FOUND
                || this == RESOURCE_EXISTS
                || this == PRECONDITION_FAILED
                || this == GENERIC_HTTP_ERROR;
    }
}
