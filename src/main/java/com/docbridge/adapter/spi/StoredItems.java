package com.docbridge.adapter.spi;

import com.docbridge.partition.PartitionKeyDefinition;
import com.docbridge.partition.PartitionKeyValue;
import com.docbridge.util.TimeSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.UUID;

/**
 * Server-side item rules shared by the bundled transports.
 */
public final class StoredItems {

    public static final String ID = "id";
    public static final String ETAG = "_etag";
    public static final String TIMESTAMP = "_ts";
    public static final String PARTITION_KEY = "partitionKey";

    private StoredItems() {
    }

    /**
     * Returns the item's id.
     *
     * @throws TransportFailure with status 400 if the item has no string id
     */
    public static String requireId(ObjectNode item) {
        JsonNode id = item.get(ID);
        if (id == null || !id.isTextual() || id.textValue().isEmpty()) {
            throw TransportFailure.badRequest("Item must have a non-empty string 'id'");
        }
        return id.textValue();
    }

    /**
     * Rejects an item whose value at the declared path contradicts the routing key.
     * An item with no value at that path is routed by the supplied key.
     *
     * @throws TransportFailure with status 400 on mismatch
     */
    public static void checkPartitionKey(PartitionKeyDefinition definition, PartitionKeyValue partitionKey,
                                         ObjectNode item) {
        JsonNode declared = definition.primaryPath().extractFrom(item);
        if (declared == null || declared.isNull()) {
            return;
        }
        PartitionKeyValue fromBody;
        try {
            fromBody = PartitionKeyValue.fromJson(declared);
        } catch (RuntimeException e) {
            throw TransportFailure.badRequest("Value at " + definition.paths().get(0) + " is not a valid partition key");
        }
        if (!fromBody.equals(partitionKey)) {
            throw TransportFailure.badRequest("Partition key " + partitionKey.value()
                    + " does not match item value " + fromBody.value() + " at " + definition.paths().get(0));
        }
    }

    /**
     * Fails when {@code if_match} is set and differs from the stored {@code _etag}.
     */
    public static void checkIfMatch(ObjectNode existing, RequestOptions options, String description) {
        options.ifMatch().ifPresent(expected -> {
            JsonNode etag = existing.get(ETAG);
            if (etag == null || !expected.equals(etag.asText())) {
                throw TransportFailure.preconditionFailed("Precondition failed for " + description);
            }
        });
    }

    /**
     * Returns a copy of the item carrying fresh system properties.
     */
    public static ObjectNode stamp(ObjectNode item, TimeSource clock) {
        ObjectNode stored = item.deepCopy();
        stored.put(ETAG, UUID.randomUUID().toString());
        stored.put(TIMESTAMP, clock.epochSeconds());
        return stored;
    }

    public static ObjectNode databaseProperties(String databaseId, TimeSource clock) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(ID, databaseId);
        node.put(ETAG, UUID.randomUUID().toString());
        node.put(TIMESTAMP, clock.epochSeconds());
        return node;
    }

    public static ObjectNode containerProperties(String containerId, PartitionKeyDefinition definition,
                                                 TimeSource clock) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(ID, containerId);
        node.set(PARTITION_KEY, definition.toJson());
        node.put(ETAG, UUID.randomUUID().toString());
        node.put(TIMESTAMP, clock.epochSeconds());
        return node;
    }
}
