package com.docbridge.client;

import com.docbridge.adapter.spi.ContainerAddress;
import com.docbridge.adapter.spi.OperationType;
import com.docbridge.adapter.spi.RequestOptions;
import com.docbridge.partition.PartitionKeyDefinition;
import com.docbridge.partition.PartitionKeyPath;
import com.docbridge.partition.PartitionKeyValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Handle for one container: item CRUD and single-partition queries.
 *
 * <p>Item bodies may be given as maps (walked directly into wire values) or as JSON
 * text (parsed as is). Every item operation encodes the body and resolves the partition
 * key before any network call, so payload and partition-key errors never leave a
 * partial remote effect.
 *
 * <p>Create and upsert may omit the partition key: it is then read from the body at
 * the container's declared path when that path is known to this handle, or else from
 * the first configured candidate field present ({@code category}, {@code partitionKey},
 * {@code pk}, {@code type}, {@code tenantId} by default). Read, replace, delete and
 * query require it explicitly.
 */
public class ContainerProxy {

    private static final Logger log = LoggerFactory.getLogger(ContainerProxy.class);

    private final ClientConnection connection;
    private final ContainerAddress address;
    private volatile PartitionKeyPath partitionKeyPath;

    ContainerProxy(ClientConnection connection, String databaseId, String containerId,
                   PartitionKeyPath partitionKeyPath) {
        this.connection = connection;
        this.address = new ContainerAddress(databaseId, containerId);
        this.partitionKeyPath = partitionKeyPath;
    }

    public String getId() {
        return address.containerId();
    }

    public String getDatabaseId() {
        return address.databaseId();
    }

    // Items

    public Map<String, Object> createItem(Object body) {
        return createItem(body, RequestOptions.none());
    }

    /**
     * Creates an item.
     *
     * @param body    a map or JSON text
     * @param options per-call options; {@code partition_key} overrides detection
     * @return the stored item, including server-assigned properties
     * @throws com.docbridge.exceptions.ResourceExistsException      if the id is taken within the partition
     * @throws com.docbridge.exceptions.InvalidPayloadException      if the body is malformed
     * @throws com.docbridge.exceptions.MissingPartitionKeyException if no partition key can be determined
     */
    public Map<String, Object> createItem(Object body, RequestOptions options) {
        connection.ensureOpen();
        ObjectNode item = connection.marshaler().encodeItem(body);
        PartitionKeyValue partitionKey = resolveForWrite(options, item);
        return connection.executeForMap(OperationType.CREATE_ITEM,
                () -> connection.transport().createItem(address, partitionKey, item, options));
    }

    public Map<String, Object> upsertItem(Object body) {
        return upsertItem(body, RequestOptions.none());
    }

    /**
     * Creates the item or replaces the existing one with the same id and partition key.
     */
    public Map<String, Object> upsertItem(Object body, RequestOptions options) {
        connection.ensureOpen();
        ObjectNode item = connection.marshaler().encodeItem(body);
        PartitionKeyValue partitionKey = resolveForWrite(options, item);
        return connection.executeForMap(OperationType.UPSERT_ITEM,
                () -> connection.transport().upsertItem(address, partitionKey, item, options));
    }

    public Map<String, Object> readItem(String itemId, Object partitionKey) {
        return readItem(itemId, partitionKey, RequestOptions.none());
    }

    /**
     * Reads one item.
     *
     * @throws com.docbridge.exceptions.ResourceNotFoundException if no such item exists in the partition
     */
    public Map<String, Object> readItem(String itemId, Object partitionKey, RequestOptions options) {
        connection.ensureOpen();
        Objects.requireNonNull(itemId, "itemId must not be null");
        PartitionKeyValue key = requirePartitionKey(partitionKey, options);
        return connection.executeForMap(OperationType.READ_ITEM,
                () -> connection.transport().readItem(address, itemId, key, options));
    }

    public Map<String, Object> replaceItem(String itemId, Object body, Object partitionKey) {
        return replaceItem(itemId, body, RequestOptions.partitionKey(partitionKey));
    }

    /**
     * Replaces an existing item. The partition key must be given in the options;
     * {@code if_match} makes the replace conditional on the item's {@code _etag}.
     *
     * @throws com.docbridge.exceptions.ResourceNotFoundException   if the item does not exist
     * @throws com.docbridge.exceptions.PreconditionFailedException if {@code if_match} does not match
     */
    public Map<String, Object> replaceItem(String itemId, Object body, RequestOptions options) {
        connection.ensureOpen();
        Objects.requireNonNull(itemId, "itemId must not be null");
        ObjectNode item = connection.marshaler().encodeItem(body);
        PartitionKeyValue key = connection.resolver().requireExplicit(options.partitionKey());
        return connection.executeForMap(OperationType.REPLACE_ITEM,
                () -> connection.transport().replaceItem(address, itemId, key, item, options));
    }

    public void deleteItem(String itemId, Object partitionKey) {
        deleteItem(itemId, partitionKey, RequestOptions.none());
    }

    /**
     * Deletes an item.
     *
     * @throws com.docbridge.exceptions.ResourceNotFoundException if the item does not exist
     */
    public void deleteItem(String itemId, Object partitionKey, RequestOptions options) {
        connection.ensureOpen();
        Objects.requireNonNull(itemId, "itemId must not be null");
        PartitionKeyValue key = requirePartitionKey(partitionKey, options);
        connection.executeVoid(OperationType.DELETE_ITEM,
                () -> connection.transport().deleteItem(address, itemId, key, options));
    }

    public List<Map<String, Object>> queryItems(String query, Object partitionKey) {
        return queryItems(query, RequestOptions.partitionKey(partitionKey));
    }

    /**
     * Runs a query within the partition given in the options.
     * Cross-partition queries are not supported.
     */
    public List<Map<String, Object>> queryItems(String query, RequestOptions options) {
        connection.ensureOpen();
        Objects.requireNonNull(query, "query must not be null");
        PartitionKeyValue key = connection.resolver().requireExplicit(options.partitionKey());
        return connection.executeForList(OperationType.QUERY_ITEMS,
                () -> connection.transport().queryItems(address, query, key, options));
    }

    // Container metadata

    /**
     * Reads the container properties and caches its partition-key path.
     *
     * @throws com.docbridge.exceptions.ResourceNotFoundException if the container does not exist
     */
    public Map<String, Object> read() {
        return read(RequestOptions.none());
    }

    public Map<String, Object> read(RequestOptions options) {
        ObjectNode properties = connection.execute(OperationType.READ_CONTAINER,
                () -> connection.transport().readContainer(address, options));
        cachePartitionKeyPath(properties);
        return connection.marshaler().decodeItem(properties);
    }

    /**
     * Returns the container's partition-key path, reading the container properties on
     * first use.
     */
    public Optional<PartitionKeyPath> getPartitionKeyPath() {
        if (partitionKeyPath == null) {
            read();
        }
        return Optional.ofNullable(partitionKeyPath);
    }

    public void delete() {
        delete(RequestOptions.none());
    }

    public void delete(RequestOptions options) {
        connection.executeVoid(OperationType.DELETE_CONTAINER,
                () -> connection.transport().deleteContainer(address, options));
    }

    private PartitionKeyValue resolveForWrite(RequestOptions options, ObjectNode item) {
        return connection.resolver().resolveForWrite(options.partitionKey(), item, partitionKeyPath);
    }

    private PartitionKeyValue requirePartitionKey(Object partitionKey, RequestOptions options) {
        Optional<Object> explicit = partitionKey != null ? Optional.of(partitionKey) : options.partitionKey();
        return connection.resolver().requireExplicit(explicit);
    }

    private void cachePartitionKeyPath(ObjectNode properties) {
        JsonNode definition = properties.get("partitionKey");
        if (definition == null) {
            return;
        }
        try {
            partitionKeyPath = PartitionKeyDefinition.fromJson(definition).primaryPath();
        } catch (IllegalArgumentException e) {
            log.warn("Container {} reported an unusable partition key definition: {}", address, definition);
        }
    }
}
