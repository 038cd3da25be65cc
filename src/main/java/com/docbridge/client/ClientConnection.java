package com.docbridge.client;

import com.docbridge.adapter.spi.ClientConfig;
import com.docbridge.adapter.spi.DocumentTransport;
import com.docbridge.adapter.spi.OperationType;
import com.docbridge.bridge.ExecutionBridge;
import com.docbridge.bridge.TransportCall;
import com.docbridge.exceptions.ClientClosedException;
import com.docbridge.marshal.PayloadMarshaler;
import com.docbridge.partition.PartitionKeyResolver;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State shared by a client and every handle derived from it.
 * Only {@link DocumentClient} closes it.
 */
final class ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    private final ClientConfig config;
    private final DocumentTransport transport;
    private final ExecutionBridge bridge;
    private final PayloadMarshaler marshaler;
    private final PartitionKeyResolver resolver;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ClientConnection(ClientConfig config, DocumentTransport transport, ExecutionBridge bridge,
                     PayloadMarshaler marshaler, PartitionKeyResolver resolver) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.bridge = Objects.requireNonNull(bridge, "bridge must not be null");
        this.marshaler = Objects.requireNonNull(marshaler, "marshaler must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    ClientConfig config() {
        return config;
    }

    DocumentTransport transport() {
        return transport;
    }

    PayloadMarshaler marshaler() {
        return marshaler;
    }

    PartitionKeyResolver resolver() {
        return resolver;
    }

    void ensureOpen() {
        if (closed.get()) {
            throw new ClientClosedException(config.getEndpoint());
        }
    }

    boolean isClosed() {
        return closed.get();
    }

    <T> T execute(OperationType operation, TransportCall<T> call) {
        ensureOpen();
        return bridge.runBlocking(operation, call);
    }

    Map<String, Object> executeForMap(OperationType operation, TransportCall<ObjectNode> call) {
        return marshaler.decodeItem(execute(operation, call));
    }

    List<Map<String, Object>> executeForList(OperationType operation, TransportCall<List<ObjectNode>> call) {
        return marshaler.decodeItems(execute(operation, call));
    }

    void executeVoid(OperationType operation, TransportCall<Void> call) {
        execute(operation, call);
    }

    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            transport.close();
            log.info("Closed client for {}", config.getEndpoint());
        } catch (RuntimeException e) {
            log.warn("Transport for {} failed to close cleanly", config.getEndpoint(), e);
        }
    }
}
