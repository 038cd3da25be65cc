package com.docbridge.adapter.spi;

import java.util.Objects;

/**
 * Identifies a container within a database.
 */
public record ContainerAddress(String databaseId, String containerId) {

    public ContainerAddress {
        Objects.requireNonNull(databaseId, "databaseId must not be null");
        Objects.requireNonNull(containerId, "containerId must not be null");
    }

    @Override
    public String toString() {
        return databaseId + "/" + containerId;
    }
}
