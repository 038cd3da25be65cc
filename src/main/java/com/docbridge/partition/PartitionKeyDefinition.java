package com.docbridge.partition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partition-key definition of a container.
 * Only single-path hash partitioning is supported.
 */
public record PartitionKeyDefinition(List<String> paths, String kind) {

    public static final String DEFAULT_KIND = "Hash";

    public PartitionKeyDefinition {
        Objects.requireNonNull(paths, "paths must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        paths = List.copyOf(paths);
        if (paths.size() != 1) {
            throw new IllegalArgumentException("Exactly one partition key path is supported, got " + paths);
        }
        PartitionKeyPath.parse(paths.get(0));
    }

    public static PartitionKeyDefinition of(String path) {
        return new PartitionKeyDefinition(List.of(path), DEFAULT_KIND);
    }

    public PartitionKeyPath primaryPath() {
        return PartitionKeyPath.parse(paths.get(0));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        ArrayNode array = node.putArray("paths");
        paths.forEach(array::add);
        node.put("kind", kind);
        return node;
    }

    /**
     * Reads a definition of the form {@code {"paths": ["/id"], "kind": "Hash"}}.
     *
     * @throws IllegalArgumentException if the node has no usable paths
     */
    public static PartitionKeyDefinition fromJson(JsonNode node) {
        if (node == null || !node.isObject() || !node.path("paths").isArray()) {
            throw new IllegalArgumentException("Partition key definition must contain a 'paths' array");
        }
        List<String> paths = new ArrayList<>();
        for (JsonNode path : node.get("paths")) {
            paths.add(path.asText());
        }
        String kind = node.hasNonNull("kind") ? node.get("kind").asText() : DEFAULT_KIND;
        return new PartitionKeyDefinition(paths, kind);
    }
}
