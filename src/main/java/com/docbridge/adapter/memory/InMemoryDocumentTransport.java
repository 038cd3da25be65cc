package com.docbridge.adapter.memory;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Document store held in process memory.
 *
 * <p>Follows the same server rules as the MongoDB transport (ids, partition keys,
 * {@code _etag}/{@code _ts}, conditional writes, the query subset) so code written
 * against it behaves the same against a real server. An optional simulated latency
 * delays completion of every future without occupying a thread.
 */
public final class InMemoryDocumentTransport implements DocumentTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentTransport.class);

    private final ConcurrentHashMap<String, Database> databases = new ConcurrentHashMap<>();
    private final TimeSource clock;
    private final Duration latency;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InMemoryDocumentTransport() {
        this(TimeSource.system(), Duration.ZERO);
    }

    public InMemoryDocumentTransport(TimeSource clock, Duration latency) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.latency = Objects.requireNonNull(latency, "latency must not be null");
        if (latency.isNegative()) {
            throw new IllegalArgumentException("latency must not be negative");
        }
    }

    // Databases

    @Override
    public CompletableFuture<ObjectNode> createDatabase(String databaseId, RequestOptions options) {
        return respond(() -> {
            Database created = new Database(StoredItems.databaseProperties(databaseId, clock));
            if (databases.putIfAbsent(databaseId, created) != null) {
                throw TransportFailure.conflict("Database " + databaseId + " already exists", null);
            }
            return created.properties.deepCopy();
        });
    }

    @Override
    public CompletableFuture<ObjectNode> readDatabase(String databaseId, RequestOptions options) {
        return respond(() -> database(databaseId).properties.deepCopy());
    }

    @Override
    public CompletableFuture<Void> deleteDatabase(String databaseId, RequestOptions options) {
        return respond(() -> {
            if (databases.remove(databaseId) == null) {
                throw TransportFailure.notFound("Database " + databaseId + " not found");
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<List<ObjectNode>> listDatabases(RequestOptions options) {
        return respond(() -> {
            List<ObjectNode> result = new ArrayList<>();
            databases.values().forEach(db -> result.add(db.properties.deepCopy()));
            return result;
        });
    }

    // Containers

    @Override
    public CompletableFuture<ObjectNode> createContainer(String databaseId, String containerId,
                                                         PartitionKeyDefinition partitionKey,
                                                         RequestOptions options) {
        return respond(() -> {
            Container created = new Container(partitionKey,
                    StoredItems.containerProperties(containerId, partitionKey, clock));
            if (database(databaseId).containers.putIfAbsent(containerId, created) != null) {
                throw TransportFailure.conflict("Container " + databaseId + "/" + containerId + " already exists", null);
            }
            return created.properties.deepCopy();
        });
    }

    @Override
    public CompletableFuture<ObjectNode> readContainer(ContainerAddress container, RequestOptions options) {
        return respond(() -> container(container).properties.deepCopy());
    }

    @Override
    public CompletableFuture<Void> deleteContainer(ContainerAddress container, RequestOptions options) {
        return respond(() -> {
            if (database(container.databaseId()).containers.remove(container.containerId()) == null) {
                throw TransportFailure.notFound("Container " + container + " not found");
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<List<ObjectNode>> listContainers(String databaseId, RequestOptions options) {
        return respond(() -> {
            List<ObjectNode> result = new ArrayList<>();
            database(databaseId).containers.values().forEach(c -> result.add(c.properties.deepCopy()));
            return result;
        });
    }

    // Items

    @Override
    public CompletableFuture<ObjectNode> createItem(ContainerAddress container, PartitionKeyValue partitionKey,
                                                    ObjectNode item, RequestOptions options) {
        return respond(() -> {
            Container target = container(container);
            String id = StoredItems.requireId(item);
            StoredItems.checkPartitionKey(target.definition, partitionKey, item);
            ObjectNode stored = StoredItems.stamp(item, clock);
            synchronized (target) {
                if (target.items.putIfAbsent(new ItemKey(partitionKey, id), stored) != null) {
                    throw TransportFailure.conflict("Item " + id + " already exists in " + container, null);
                }
            }
            return stored.deepCopy();
        });
    }

    @Override
    public CompletableFuture<ObjectNode> readItem(ContainerAddress container, String itemId,
                                                  PartitionKeyValue partitionKey, RequestOptions options) {
        return respond(() -> existing(container(container), container, itemId, partitionKey).deepCopy());
    }

    @Override
    public CompletableFuture<ObjectNode> upsertItem(ContainerAddress container, PartitionKeyValue partitionKey,
                                                    ObjectNode item, RequestOptions options) {
        return respond(() -> {
            Container target = container(container);
            String id = StoredItems.requireId(item);
            StoredItems.checkPartitionKey(target.definition, partitionKey, item);
            ObjectNode stored = StoredItems.stamp(item, clock);
            synchronized (target) {
                target.items.put(new ItemKey(partitionKey, id), stored);
            }
            return stored.deepCopy();
        });
    }

    @Override
    public CompletableFuture<ObjectNode> replaceItem(ContainerAddress container, String itemId,
                                                     PartitionKeyValue partitionKey, ObjectNode item,
                                                     RequestOptions options) {
        return respond(() -> {
            Container target = container(container);
            String id = StoredItems.requireId(item);
            if (!id.equals(itemId)) {
                throw TransportFailure.badRequest("Item id '" + id + "' does not match '" + itemId + "'");
            }
            StoredItems.checkPartitionKey(target.definition, partitionKey, item);
            ItemKey key = new ItemKey(partitionKey, itemId);
            synchronized (target) {
                StoredItems.checkIfMatch(existing(target, container, itemId, partitionKey), options,
                        "item " + itemId);
                ObjectNode stored = StoredItems.stamp(item, clock);
                target.items.put(key, stored);
                return stored.deepCopy();
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteItem(ContainerAddress container, String itemId,
                                              PartitionKeyValue partitionKey, RequestOptions options) {
        return respond(() -> {
            Container target = container(container);
            synchronized (target) {
                StoredItems.checkIfMatch(existing(target, container, itemId, partitionKey), options,
                        "item " + itemId);
                target.items.remove(new ItemKey(partitionKey, itemId));
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<List<ObjectNode>> queryItems(ContainerAddress container, String query,
                                                          PartitionKeyValue partitionKey, RequestOptions options) {
        return respond(() -> {
            ItemQuery parsed = ItemQuery.parse(query);
            List<ObjectNode> result = new ArrayList<>();
            for (Map.Entry<ItemKey, ObjectNode> entry : container(container).items.entrySet()) {
                if (entry.getKey().partitionKey().equals(partitionKey) && parsed.matches(entry.getValue())) {
                    result.add(entry.getValue().deepCopy());
                }
            }
            return result;
        });
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("In-memory transport closed with {} databases", databases.size());
        }
    }

    private <T> CompletableFuture<T> respond(Supplier<T> action) {
        CompletableFuture<T> result = settle(action);
        if (latency.isZero()) {
            return result;
        }
        CompletableFuture<T> delayed = new CompletableFuture<>();
        Executor timer = CompletableFuture.delayedExecutor(latency.toNanos(), TimeUnit.NANOSECONDS);
        timer.execute(() -> result.whenComplete((value, failure) -> {
            if (failure != null) {
                delayed.completeExceptionally(failure);
            } else {
                delayed.complete(value);
            }
        }));
        return delayed;
    }

    private <T> CompletableFuture<T> settle(Supplier<T> action) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(TransportFailure.noResponse("Transport is closed", null));
        }
        try {
            return CompletableFuture.completedFuture(action.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Database database(String databaseId) {
        Database database = databases.get(databaseId);
        if (database == null) {
            throw TransportFailure.notFound("Database " + databaseId + " not found");
        }
        return database;
    }

    private Container container(ContainerAddress address) {
        Container container = database(address.databaseId()).containers.get(address.containerId());
        if (container == null) {
            throw TransportFailure.notFound("Container " + address + " not found");
        }
        return container;
    }

    private static ObjectNode existing(Container target, ContainerAddress address, String itemId,
                                       PartitionKeyValue partitionKey) {
        ObjectNode item = target.items.get(new ItemKey(partitionKey, itemId));
        if (item == null) {
            throw TransportFailure.notFound("Item " + itemId + " not found in " + address
                    + " for partition key " + partitionKey.value());
        }
        return item;
    }

    private record ItemKey(PartitionKeyValue partitionKey, String id) {
    }

    private static final class Database {
        final ObjectNode properties;
        final ConcurrentHashMap<String, Container> containers = new ConcurrentHashMap<>();

        Database(ObjectNode properties) {
            this.properties = properties;
        }
    }

    private static final class Container {
        final PartitionKeyDefinition definition;
        final ObjectNode properties;
        // Writes hold the container monitor so conditional writes see a stable version.
        final ConcurrentHashMap<ItemKey, ObjectNode> items = new ConcurrentHashMap<>();

        Container(PartitionKeyDefinition definition, ObjectNode properties) {
            this.definition = definition;
            this.properties = properties;
        }
    }
}
