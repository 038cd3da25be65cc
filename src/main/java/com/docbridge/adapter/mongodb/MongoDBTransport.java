package com.docbridge.adapter.mongodb;

import com.docbridge.adapter.spi.ContainerAddress;
import com.docbridge.adapter.spi.DocumentTransport;
import com.docbridge.adapter.spi.ItemQuery;
import com.docbridge.adapter.spi.RequestOptions;
import com.docbridge.adapter.spi.StoredItems;
import com.docbridge.adapter.spi.TransportFailure;
import com.docbridge.partition.PartitionKeyDefinition;
import com.docbridge.partition.PartitionKeyValue;
import com.docbridge.util.TimeSource;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoServerException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * {@link DocumentTransport} over the MongoDB sync driver.
 *
 * <p>Layout per database: a {@value #DATABASE_COLLECTION} collection holding the
 * database properties, a {@value #CONTAINERS_COLLECTION} collection holding one
 * properties document per container, and one collection per container whose documents
 * are keyed by {@code _id = {pk, id}}.
 *
 * <p>Each verb runs the driver call on the calling thread (a thread of the shared
 * execution runtime) and returns an already completed future.
 */
public class MongoDBTransport implements DocumentTransport {

    private static final Logger log = LoggerFactory.getLogger(MongoDBTransport.class);

    static final String DATABASE_COLLECTION = "_database";
    static final String CONTAINERS_COLLECTION = "_containers";

    private static final String MONGO_ID = "_id";

    private final MongoClient client;
    private final TimeSource clock;

    public MongoDBTransport(MongoClient client, TimeSource clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // Databases

    @Override
    public CompletableFuture<ObjectNode> createDatabase(String databaseId, RequestOptions options) {
        return call("create database " + databaseId, () -> {
            ObjectNode properties = StoredItems.databaseProperties(databaseId, clock);
            insertMetadata(metadata(databaseId, DATABASE_COLLECTION), databaseId, properties,
                    "Database " + databaseId + " already exists");
            return properties;
        });
    }

    @Override
    public CompletableFuture<ObjectNode> readDatabase(String databaseId, RequestOptions options) {
        return call("read database " + databaseId, () -> requireDatabase(databaseId));
    }

    @Override
    public CompletableFuture<Void> deleteDatabase(String databaseId, RequestOptions options) {
        return call("delete database " + databaseId, () -> {
            requireDatabase(databaseId);
            client.getDatabase(databaseId).drop();
            return null;
        });
    }

    @Override
    public CompletableFuture<List<ObjectNode>> listDatabases(RequestOptions options) {
        return call("list databases", () -> {
            List<ObjectNode> result = new ArrayList<>();
            for (String name : client.listDatabaseNames()) {
                BsonDocument found = metadata(name, DATABASE_COLLECTION).find(idFilter(name)).first();
                if (found != null) {
                    result.add(fromDocument(found));
                }
            }
            return result;
        });
    }

    // Containers

    @Override
    public CompletableFuture<ObjectNode> createContainer(String databaseId, String containerId,
                                                         PartitionKeyDefinition partitionKey,
                                                         RequestOptions options) {
        return call("create container " + databaseId + "/" + containerId, () -> {
            requireDatabase(databaseId);
            ObjectNode properties = StoredItems.containerProperties(containerId, partitionKey, clock);
            insertMetadata(metadata(databaseId, CONTAINERS_COLLECTION), containerId, properties,
                    "Container " + databaseId + "/" + containerId + " already exists");
            return properties;
        });
    }

    @Override
    public CompletableFuture<ObjectNode> readContainer(ContainerAddress container, RequestOptions options) {
        return call("read container " + container, () -> requireContainer(container));
    }

    @Override
    public CompletableFuture<Void> deleteContainer(ContainerAddress container, RequestOptions options) {
        return call("delete container " + container, () -> {
            DeleteResult result = metadata(container.databaseId(), CONTAINERS_COLLECTION)
                    .deleteOne(idFilter(container.containerId()));
            if (result.getDeletedCount() == 0) {
                throw TransportFailure.notFound("Container " + container + " not found");
            }
            items(container).drop();
            return null;
        });
    }

    @Override
    public CompletableFuture<List<ObjectNode>> listContainers(String databaseId, RequestOptions options) {
        return call("list containers in " + databaseId, () -> {
            requireDatabase(databaseId);
            List<ObjectNode> result = new ArrayList<>();
            for (BsonDocument document : metadata(databaseId, CONTAINERS_COLLECTION).find()) {
                result.add(fromDocument(document));
            }
            return result;
        });
    }

    // Items

    @Override
    public CompletableFuture<ObjectNode> createItem(ContainerAddress container, PartitionKeyValue partitionKey,
                                                    ObjectNode item, RequestOptions options) {
        return call("create item in " + container, () -> {
            String id = prepare(container, partitionKey, item);
            ObjectNode stored = StoredItems.stamp(item, clock);
            try {
                items(container).insertOne(toDocument(partitionKey, id, stored));
            } catch (MongoServerException e) {
                if (isDuplicateKey(e)) {
                    throw TransportFailure.conflict("Item " + id + " already exists in " + container, e);
                }
                throw e;
            }
            return stored;
        });
    }

    @Override
    public CompletableFuture<ObjectNode> readItem(ContainerAddress container, String itemId,
                                                  PartitionKeyValue partitionKey, RequestOptions options) {
        return call("read item " + itemId + " in " + container, () -> {
            BsonDocument found = items(container).find(itemKey(partitionKey, itemId)).first();
            if (found == null) {
                requireContainer(container);
                throw itemNotFound(container, itemId, partitionKey);
            }
            return fromDocument(found);
        });
    }

    @Override
    public CompletableFuture<ObjectNode> upsertItem(ContainerAddress container, PartitionKeyValue partitionKey,
                                                    ObjectNode item, RequestOptions options) {
        return call("upsert item in " + container, () -> {
            String id = prepare(container, partitionKey, item);
            ObjectNode stored = StoredItems.stamp(item, clock);
            BsonDocument document = toDocument(partitionKey, id, stored);
            ReplaceOptions upsert = new ReplaceOptions().upsert(true);
            try {
                items(container).replaceOne(itemKey(partitionKey, id), document, upsert);
            } catch (MongoServerException e) {
                if (!isDuplicateKey(e)) {
                    throw e;
                }
                // A concurrent upsert inserted the same _id first; the document now exists.
                log.debug("Retrying upsert of {} in {} after a concurrent insert", id, container);
                items(container).replaceOne(itemKey(partitionKey, id), document, upsert);
            }
            return stored;
        });
    }

    @Override
    public CompletableFuture<ObjectNode> replaceItem(ContainerAddress container, String itemId,
                                                     PartitionKeyValue partitionKey, ObjectNode item,
                                                     RequestOptions options) {
        return call("replace item " + itemId + " in " + container, () -> {
            String id = prepare(container, partitionKey, item);
            if (!id.equals(itemId)) {
                throw TransportFailure.badRequest("Item id '" + id + "' does not match '" + itemId + "'");
            }
            ObjectNode stored = StoredItems.stamp(item, clock);
            UpdateResult result = items(container).replaceOne(
                    conditional(partitionKey, itemId, options), toDocument(partitionKey, itemId, stored));
            if (result.getMatchedCount() == 0) {
                throw missedWrite(container, itemId, partitionKey);
            }
            return stored;
        });
    }

    @Override
    public CompletableFuture<Void> deleteItem(ContainerAddress container, String itemId,
                                              PartitionKeyValue partitionKey, RequestOptions options) {
        return call("delete item " + itemId + " in " + container, () -> {
            DeleteResult result = items(container).deleteOne(conditional(partitionKey, itemId, options));
            if (result.getDeletedCount() == 0) {
                requireContainer(container);
                throw missedWrite(container, itemId, partitionKey);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<List<ObjectNode>> queryItems(ContainerAddress container, String query,
                                                          PartitionKeyValue partitionKey, RequestOptions options) {
        return call("query items in " + container, () -> {
            Bson filter = MongoQueryTranslator.toFilter(ItemQuery.parse(query), partitionKey);
            requireContainer(container);
            List<ObjectNode> result = new ArrayList<>();
            for (BsonDocument document : items(container).find(filter)) {
                result.add(fromDocument(document));
            }
            return result;
        });
    }

    @Override
    public void close() {
        client.close();
    }

    private <T> CompletableFuture<T> call(String description, Supplier<T> action) {
        try {
            return CompletableFuture.completedFuture(action.get());
        } catch (TransportFailure e) {
            return CompletableFuture.failedFuture(e);
        } catch (MongoException e) {
            log.debug("MongoDB failure during {}", description, e);
            return CompletableFuture.failedFuture(classify(description, e));
        }
    }

    /**
     * Maps a driver exception onto the transport failure classification.
     */
    static TransportFailure classify(String description, MongoException e) {
        String message = description + " failed: " + e.getMessage();
        if (e instanceof MongoServerException && isDuplicateKey((MongoServerException) e)) {
            return TransportFailure.conflict(message, e);
        }
        if (e instanceof MongoTimeoutException
                || e instanceof MongoSocketException
                || e instanceof MongoExecutionTimeoutException) {
            return TransportFailure.noResponse(message, e);
        }
        if (e instanceof MongoSecurityException) {
            return TransportFailure.httpError(401, message, e);
        }
        return TransportFailure.httpError(500, message, e);
    }

    private static boolean isDuplicateKey(MongoServerException e) {
        return ErrorCategory.fromErrorCode(e.getCode()) == ErrorCategory.DUPLICATE_KEY;
    }

    private String prepare(ContainerAddress container, PartitionKeyValue partitionKey, ObjectNode item) {
        String id = StoredItems.requireId(item);
        if (item.has(MONGO_ID)) {
            throw TransportFailure.badRequest("Field '" + MONGO_ID + "' is reserved");
        }
        ObjectNode properties = requireContainer(container);
        StoredItems.checkPartitionKey(PartitionKeyDefinition.fromJson(properties.get(StoredItems.PARTITION_KEY)),
                partitionKey, item);
        return id;
    }

    private TransportFailure missedWrite(ContainerAddress container, String itemId, PartitionKeyValue partitionKey) {
        if (items(container).find(itemKey(partitionKey, itemId)).first() != null) {
            return TransportFailure.preconditionFailed("Precondition failed for item " + itemId);
        }
        return itemNotFound(container, itemId, partitionKey);
    }

    private static TransportFailure itemNotFound(ContainerAddress container, String itemId,
                                                 PartitionKeyValue partitionKey) {
        return TransportFailure.notFound("Item " + itemId + " not found in " + container
                + " for partition key " + partitionKey.value());
    }

    private ObjectNode requireDatabase(String databaseId) {
        BsonDocument found = metadata(databaseId, DATABASE_COLLECTION).find(idFilter(databaseId)).first();
        if (found == null) {
            throw TransportFailure.notFound("Database " + databaseId + " not found");
        }
        return fromDocument(found);
    }

    private ObjectNode requireContainer(ContainerAddress container) {
        BsonDocument found = metadata(container.databaseId(), CONTAINERS_COLLECTION)
                .find(idFilter(container.containerId())).first();
        if (found == null) {
            throw TransportFailure.notFound("Container " + container + " not found");
        }
        return fromDocument(found);
    }

    private void insertMetadata(MongoCollection<BsonDocument> collection, String id, ObjectNode properties,
                                String conflictMessage) {
        BsonDocument document = BsonNodes.toBson(properties);
        document.put(MONGO_ID, new BsonString(id));
        try {
            collection.insertOne(document);
        } catch (MongoServerException e) {
            if (isDuplicateKey(e)) {
                throw TransportFailure.conflict(conflictMessage, e);
            }
            throw e;
        }
    }

    private MongoCollection<BsonDocument> metadata(String databaseId, String collection) {
        return database(databaseId).getCollection(collection, BsonDocument.class);
    }

    private MongoCollection<BsonDocument> items(ContainerAddress container) {
        return database(container.databaseId()).getCollection(container.containerId(), BsonDocument.class);
    }

    private MongoDatabase database(String databaseId) {
        return client.getDatabase(databaseId);
    }

    private static Bson idFilter(String id) {
        return Filters.eq(MONGO_ID, id);
    }

    private static Bson itemKey(PartitionKeyValue partitionKey, String itemId) {
        return Filters.eq(MONGO_ID, compoundId(partitionKey, itemId));
    }

    private static Bson conditional(PartitionKeyValue partitionKey, String itemId, RequestOptions options) {
        Bson key = itemKey(partitionKey, itemId);
        return options.ifMatch()
                .map(etag -> Filters.and(key, Filters.eq(StoredItems.ETAG, etag)))
                .orElse(key);
    }

    static BsonDocument compoundId(PartitionKeyValue partitionKey, String itemId) {
        return new BsonDocument()
                .append("pk", BsonNodes.toBson(partitionKey.toJson()))
                .append("id", new BsonString(itemId));
    }

    private static BsonDocument toDocument(PartitionKeyValue partitionKey, String itemId, ObjectNode stored) {
        BsonDocument document = new BsonDocument(MONGO_ID, compoundId(partitionKey, itemId));
        document.putAll(BsonNodes.toBson(stored));
        return document;
    }

    private static ObjectNode fromDocument(BsonDocument document) {
        ObjectNode item = BsonNodes.toJson(document);
        item.remove(MONGO_ID);
        return item;
    }
}
