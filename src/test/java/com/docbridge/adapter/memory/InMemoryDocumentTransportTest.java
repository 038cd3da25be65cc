package com.docbridge.adapter.memory;

import com.docbridge.adapter.spi.ClientConfig;
import com.docbridge.adapter.spi.ContainerAddress;
import com.docbridge.adapter.spi.KeyCredential;
import com.docbridge.adapter.spi.RequestOptions;
import com.docbridge.adapter.spi.TransportFailure;
import com.docbridge.marshal.PayloadMarshaler;
import com.docbridge.partition.PartitionKeyDefinition;
import com.docbridge.partition.PartitionKeyValue;
import com.docbridge.util.MockTimeSource;
import com.docbridge.util.TimeSource;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemoryDocumentTransport")
class InMemoryDocumentTransportTest {

    private static final ContainerAddress PRODUCTS = new ContainerAddress("shop", "products");
    private static final PartitionKeyValue ELECTRONICS = PartitionKeyValue.of("electronics");

    private final PayloadMarshaler marshaler = new PayloadMarshaler();
    private MockTimeSource clock;
    private InMemoryDocumentTransport transport;

    @BeforeEach
    void setUp() {
        clock = TimeSource.mockAt(Instant.parse("2024-01-01T00:00:00Z"));
        transport = new InMemoryDocumentTransport(clock, Duration.ZERO);
        transport.createDatabase("shop", RequestOptions.none()).join();
        transport.createContainer("shop", "products", PartitionKeyDefinition.of("/category"), RequestOptions.none())
                .join();
    }

    private ObjectNode item(String json) {
        return marshaler.encodeItem(json);
    }

    private static TransportFailure failure(CompletableFuture<?> future) {
        Throwable thrown = catchThrowable(() -> future.get(5, TimeUnit.SECONDS));
        assertThat(thrown).isInstanceOf(ExecutionException.class).hasCauseInstanceOf(TransportFailure.class);
        return (TransportFailure) thrown.getCause();
    }

    @Nested
    @DisplayName("Databases and containers")
    class ResourceTests {

        @Test
        @DisplayName("should report conflicts on duplicate creation")
        void create_duplicate_shouldConflict() {
            assertThat(failure(transport.createDatabase("shop", RequestOptions.none())).getClassification())
                    .isEqualTo(TransportFailure.Classification.CONFLICT);
            assertThat(failure(transport.createContainer("shop", "products",
                    PartitionKeyDefinition.of("/category"), RequestOptions.none())).getStatusCode())
                    .isEqualTo(409);
        }

        @Test
        @DisplayName("should return container properties with the partition key definition")
        void readContainer_shouldReturnDefinition() {
            ObjectNode properties = transport.readContainer(PRODUCTS, RequestOptions.none()).join();

            assertThat(properties.get("id").textValue()).isEqualTo("products");
            assertThat(properties.at("/partitionKey/paths/0").textValue()).isEqualTo("/category");
            assertThat(properties.get("_ts").longValue()).isEqualTo(1704067200L);
        }

        @Test
        @DisplayName("should report missing databases and containers")
        void missingResources_shouldBeNotFound() {
            assertThat(failure(transport.readDatabase("nope", RequestOptions.none())).getClassification())
                    .isEqualTo(TransportFailure.Classification.NOT_FOUND);
            assertThat(failure(transport.readContainer(new ContainerAddress("shop", "nope"), RequestOptions.none()))
                    .getStatusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should list and delete")
        void listAndDelete_shouldReflectState() {
            assertThat(transport.listContainers("shop", RequestOptions.none()).join()).hasSize(1);

            transport.deleteContainer(PRODUCTS, RequestOptions.none()).join();
            transport.deleteDatabase("shop", RequestOptions.none()).join();

            assertThat(transport.listDatabases(RequestOptions.none()).join()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Items")
    class ItemTests {

        @Test
        @DisplayName("should stamp system properties on write")
        void createItem_shouldStamp() {
            ObjectNode stored = transport.createItem(PRODUCTS, ELECTRONICS,
                    item("{\"id\":\"1\",\"category\":\"electronics\"}"), RequestOptions.none()).join();

            assertThat(stored.get("_etag").textValue()).isNotBlank();
            assertThat(stored.get("_ts").longValue()).isEqualTo(1704067200L);
        }

        @Test
        @DisplayName("should key items by partition key and id")
        void items_shouldBeScopedByPartition() {
            transport.createItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\"}"), RequestOptions.none()).join();
            transport.createItem(PRODUCTS, PartitionKeyValue.of("books"), item("{\"id\":\"1\"}"),
                    RequestOptions.none()).join();

            assertThat(failure(transport.createItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\"}"),
                    RequestOptions.none())).getClassification()).isEqualTo(TransportFailure.Classification.CONFLICT);
            assertThat(failure(transport.readItem(PRODUCTS, "1", PartitionKeyValue.of("toys"),
                    RequestOptions.none())).getClassification()).isEqualTo(TransportFailure.Classification.NOT_FOUND);
        }

        @Test
        @DisplayName("should reject items without a string id")
        void createItem_withoutId_shouldBeBadRequest() {
            assertThat(failure(transport.createItem(PRODUCTS, ELECTRONICS, item("{\"id\":1}"),
                    RequestOptions.none())).getStatusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should reject a key contradicting the item's declared path value")
        void createItem_keyMismatch_shouldBeBadRequest() {
            assertThat(failure(transport.createItem(PRODUCTS, PartitionKeyValue.of("books"),
                    item("{\"id\":\"1\",\"category\":\"electronics\"}"), RequestOptions.none())).getStatusCode())
                    .isEqualTo(400);
        }

        @Test
        @DisplayName("should replace only when if_match holds")
        void replaceItem_ifMatch_shouldBeChecked() {
            ObjectNode stored = transport.createItem(PRODUCTS, ELECTRONICS,
                    item("{\"id\":\"1\",\"price\":1}"), RequestOptions.none()).join();
            String etag = stored.get("_etag").textValue();

            assertThat(failure(transport.replaceItem(PRODUCTS, "1", ELECTRONICS, item("{\"id\":\"1\",\"price\":2}"),
                    RequestOptions.none().with(RequestOptions.IF_MATCH, "stale"))).getClassification())
                    .isEqualTo(TransportFailure.Classification.PRECONDITION_FAILED);

            clock.advance(Duration.ofSeconds(5));
            ObjectNode replaced = transport.replaceItem(PRODUCTS, "1", ELECTRONICS, item("{\"id\":\"1\",\"price\":2}"),
                    RequestOptions.none().with(RequestOptions.IF_MATCH, etag)).join();
            assertThat(replaced.get("price").intValue()).isEqualTo(2);
            assertThat(replaced.get("_etag").textValue()).isNotEqualTo(etag);
            assertThat(replaced.get("_ts").longValue()).isEqualTo(1704067205L);
        }

        @Test
        @DisplayName("should treat an etag read before an upsert as stale")
        void conditionalWrites_afterUpsert_shouldFailPrecondition() {
            String etag = transport.createItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\",\"v\":1}"),
                    RequestOptions.none()).join().get("_etag").textValue();
            transport.upsertItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\",\"v\":2}"), RequestOptions.none()).join();
            RequestOptions ifMatch = RequestOptions.none().with(RequestOptions.IF_MATCH, etag);

            assertThat(failure(transport.replaceItem(PRODUCTS, "1", ELECTRONICS, item("{\"id\":\"1\",\"v\":3}"),
                    ifMatch)).getStatusCode()).isEqualTo(412);
            assertThat(failure(transport.deleteItem(PRODUCTS, "1", ELECTRONICS, ifMatch)).getStatusCode())
                    .isEqualTo(412);
            assertThat(transport.readItem(PRODUCTS, "1", ELECTRONICS, RequestOptions.none()).join()
                    .get("v").intValue()).isEqualTo(2);
        }

        @Test
        @DisplayName("should apply each conditional replace to the version it checked while upserts interleave")
        void conditionalReplace_concurrentUpserts_shouldNeverSkipAVersion() throws Exception {
            transport.createItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\"}"), RequestOptions.none()).join();
            Map<String, String> replacedVersions = new ConcurrentHashMap<>();
            AtomicInteger reusedVersions = new AtomicInteger();
            AtomicInteger skippedUpserts = new AtomicInteger();
            AtomicBoolean done = new AtomicBoolean(false);
            ExecutorService pool = Executors.newFixedThreadPool(4);
            List<Future<?>> replacers = new ArrayList<>();
            try {
                for (int w = 0; w < 3; w++) {
                    replacers.add(pool.submit(() -> {
                        while (!done.get()) {
                            String etag = transport.readItem(PRODUCTS, "1", ELECTRONICS, RequestOptions.none())
                                    .join().get("_etag").textValue();
                            CompletableFuture<ObjectNode> replace = transport.replaceItem(PRODUCTS, "1", ELECTRONICS,
                                    item("{\"id\":\"1\"}"), RequestOptions.none().with(RequestOptions.IF_MATCH, etag));
                            if (!replace.isCompletedExceptionally()
                                    && replacedVersions.putIfAbsent(etag, replace.join().get("_etag").textValue()) != null) {
                                reusedVersions.incrementAndGet();
                            }
                        }
                        return null;
                    }));
                }
                // Each upserted version must be overwritten by a replace that checked exactly that version.
                Future<?> upserter = pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        String upserted = transport.upsertItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\"}"),
                                RequestOptions.none()).join().get("_etag").textValue();
                        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                        while (!replacedVersions.containsKey(upserted)) {
                            if (System.nanoTime() > deadline) {
                                skippedUpserts.incrementAndGet();
                                return null;
                            }
                            Thread.onSpinWait();
                        }
                    }
                    return null;
                });
                upserter.get(60, TimeUnit.SECONDS);
                done.set(true);
                for (Future<?> replacer : replacers) {
                    replacer.get(10, TimeUnit.SECONDS);
                }
            } finally {
                done.set(true);
                pool.shutdownNow();
            }

            assertThat(skippedUpserts.get()).isZero();
            assertThat(reusedVersions.get()).isZero();
        }

        @Test
        @DisplayName("should reject replacing with a different id")
        void replaceItem_idMismatch_shouldBeBadRequest() {
            transport.createItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\"}"), RequestOptions.none()).join();

            assertThat(failure(transport.replaceItem(PRODUCTS, "1", ELECTRONICS, item("{\"id\":\"2\"}"),
                    RequestOptions.none())).getStatusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should report missing items on replace and delete")
        void replaceAndDelete_missing_shouldBeNotFound() {
            assertThat(failure(transport.replaceItem(PRODUCTS, "9", ELECTRONICS, item("{\"id\":\"9\"}"),
                    RequestOptions.none())).getStatusCode()).isEqualTo(404);
            assertThat(failure(transport.deleteItem(PRODUCTS, "9", ELECTRONICS, RequestOptions.none()))
                    .getStatusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should upsert new and existing items")
        void upsertItem_shouldCreateThenReplace() {
            transport.upsertItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\",\"v\":1}"), RequestOptions.none()).join();
            transport.upsertItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\",\"v\":2}"), RequestOptions.none()).join();

            ObjectNode read = transport.readItem(PRODUCTS, "1", ELECTRONICS, RequestOptions.none()).join();
            assertThat(read.get("v").intValue()).isEqualTo(2);
        }

        @Test
        @DisplayName("should query within one partition")
        void queryItems_shouldFilterByPartitionAndConditions() {
            transport.createItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\",\"price\":999}"), RequestOptions.none()).join();
            transport.createItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"2\",\"price\":20}"), RequestOptions.none()).join();
            transport.createItem(PRODUCTS, PartitionKeyValue.of("books"), item("{\"id\":\"3\",\"price\":30}"),
                    RequestOptions.none()).join();

            List<ObjectNode> cheap = transport.queryItems(PRODUCTS, "SELECT * FROM c WHERE c.price < 100",
                    ELECTRONICS, RequestOptions.none()).join();

            assertThat(cheap).extracting(n -> n.get("id").textValue()).containsExactly("2");
            assertThat(failure(transport.queryItems(PRODUCTS, "SELECT VALUE COUNT(1) FROM c", ELECTRONICS,
                    RequestOptions.none())).getStatusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should return copies that callers cannot use to mutate the store")
        void readItem_shouldReturnCopies() {
            transport.createItem(PRODUCTS, ELECTRONICS, item("{\"id\":\"1\",\"v\":1}"), RequestOptions.none()).join();

            transport.readItem(PRODUCTS, "1", ELECTRONICS, RequestOptions.none()).join().put("v", 99);

            assertThat(transport.readItem(PRODUCTS, "1", ELECTRONICS, RequestOptions.none()).join().get("v").intValue())
                    .isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Lifecycle and factory")
    class LifecycleTests {

        @Test
        @DisplayName("should fail calls after close with no response")
        void close_shouldRejectCalls() {
            transport.close();

            assertThat(failure(transport.readDatabase("shop", RequestOptions.none())).hasResponse()).isFalse();
        }

        @Test
        @DisplayName("should delay completion by the simulated latency")
        void latency_shouldDelayCompletion() {
            InMemoryDocumentTransport slow = new InMemoryDocumentTransport(TimeSource.system(), Duration.ofMillis(100));

            long start = System.nanoTime();
            slow.listDatabases(RequestOptions.none()).join();

            assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
        }

        @Test
        @DisplayName("should deliver failures after the simulated latency")
        void latency_failingCall_shouldFailLate() {
            InMemoryDocumentTransport slow = new InMemoryDocumentTransport(TimeSource.system(), Duration.ofMillis(100));

            long start = System.nanoTime();
            CompletableFuture<ObjectNode> missing = slow.readDatabase("nope", RequestOptions.none());

            assertThat(missing).isNotDone();
            assertThat(failure(missing).getStatusCode()).isEqualTo(404);
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
        }

        @Test
        @DisplayName("should fail closed-transport calls after the simulated latency too")
        void latency_afterClose_shouldFailWithoutResponse() {
            InMemoryDocumentTransport slow = new InMemoryDocumentTransport(TimeSource.system(), Duration.ofMillis(50));
            slow.close();

            assertThat(failure(slow.listDatabases(RequestOptions.none())).hasResponse()).isFalse();
        }

        @Test
        @DisplayName("should reject latency values the factory cannot open")
        void factory_validateConfig_outOfRangeLatency_shouldBeInvalid() {
            InMemoryTransportFactory factory = new InMemoryTransportFactory();

            assertThat(factory.validateConfig(new ClientConfig("memory:", new KeyCredential("k"),
                    Map.of(InMemoryTransportFactory.LATENCY_MS, 5_000_000_000L))).isInvalid()).isTrue();
            assertThat(factory.validateConfig(new ClientConfig("memory:", new KeyCredential("k"),
                    Map.of(InMemoryTransportFactory.LATENCY_MS, "soon"))).isInvalid()).isTrue();
        }

        @Test
        @DisplayName("should validate the latency option")
        void factory_validateConfig_shouldCheckLatency() {
            InMemoryTransportFactory factory = new InMemoryTransportFactory();

            assertThat(factory.validateConfig(new ClientConfig("memory:", new KeyCredential("k"),
                    Map.of(InMemoryTransportFactory.LATENCY_MS, "-1"))).isInvalid()).isTrue();
            assertThat(factory.validateConfig(new ClientConfig("memory:", new KeyCredential("k"),
                    Map.of(InMemoryTransportFactory.LATENCY_MS, "5"))).isValid()).isTrue();
            assertThat(factory.supports("mongodb://x")).isFalse();
        }
    }
}
