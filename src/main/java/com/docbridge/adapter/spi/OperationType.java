package com.docbridge.adapter.spi;

import java.util.Locale;

/**
 * Types of operations routed through a {@link DocumentTransport}.
 */
public enum OperationType {
    CREATE_DATABASE,
    READ_DATABASE,
    DELETE_DATABASE,
    LIST_DATABASES,
    CREATE_CONTAINER,
    READ_CONTAINER,
    DELETE_CONTAINER,
    LIST_CONTAINERS,
    CREATE_ITEM,
    READ_ITEM,
    UPSERT_ITEM,
    REPLACE_ITEM,
    DELETE_ITEM,
    QUERY_ITEMS;

    /**
     * Lower-case name used in log lines, e.g. {@code read_item}.
     */
    public String operationName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns true for operations addressed by a partition key.
     */
    public boolean isItemScoped() {
        return ordinal() >= CREATE_ITEM.ordinal();
    }
}
