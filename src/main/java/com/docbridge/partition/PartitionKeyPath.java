package com.docbridge.partition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * A declared partition-key path such as {@code /category} or {@code /address/city}.
 */
public record PartitionKeyPath(String path, List<String> segments) {

    public PartitionKeyPath {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(segments, "segments must not be null");
        segments = List.copyOf(segments);
    }

    /**
     * Parses a slash separated path.
     *
     * @throws IllegalArgumentException if the path does not start with '/' or has empty segments
     */
    public static PartitionKeyPath parse(String path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!path.startsWith("/") || path.length() < 2) {
            throw new IllegalArgumentException("Partition key path must start with '/': " + path);
        }
        String[] parts = path.substring(1).split("/", -1);
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Partition key path has an empty segment: " + path);
            }
        }
        return new PartitionKeyPath(path, List.of(parts));
    }

    /**
     * Reads the field this path points at, or null when any segment is absent.
     */
    public JsonNode extractFrom(ObjectNode item) {
        JsonNode current = item;
        for (String segment : segments) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    @Override
    public String toString() {
        return path;
    }
}
