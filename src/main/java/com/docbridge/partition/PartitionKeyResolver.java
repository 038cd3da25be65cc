package com.docbridge.partition;

import com.docbridge.exceptions.MissingPartitionKeyException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Determines the partition key of item operations.
 *
 * <p>Precedence for writes that may infer the key (create, upsert):
 * <ol>
 *   <li>an explicit value, used verbatim;</li>
 *   <li>the container's declared path, when known;</li>
 *   <li>the first candidate field present in the body, in list order.</li>
 * </ol>
 * All other item operations take the explicit value only.
 * Resolution never performs I/O.
 */
public final class PartitionKeyResolver {

    /**
     * Conventional field names scanned, in order, when the declared path is unknown.
     */
    public static final List<String> DEFAULT_CANDIDATE_FIELDS =
            List.of("category", "partitionKey", "pk", "type", "tenantId");

    private final List<String> candidateFields;

    public PartitionKeyResolver() {
        this(DEFAULT_CANDIDATE_FIELDS);
    }

    public PartitionKeyResolver(List<String> candidateFields) {
        Objects.requireNonNull(candidateFields, "candidateFields must not be null");
        this.candidateFields = List.copyOf(candidateFields);
    }

    public List<String> getCandidateFields() {
        return candidateFields;
    }

    /**
     * Resolves the key of a create or upsert.
     *
     * @param explicit     caller-supplied key, may be empty
     * @param body         the encoded item
     * @param declaredPath the container's declared path, may be null when unknown
     * @throws MissingPartitionKeyException if no key can be determined
     */
    public PartitionKeyValue resolveForWrite(Optional<Object> explicit, ObjectNode body, PartitionKeyPath declaredPath) {
        if (explicit.isPresent()) {
            return PartitionKeyValue.of(explicit.get());
        }
        Objects.requireNonNull(body, "body must not be null");

        if (declaredPath != null) {
            JsonNode value = declaredPath.extractFrom(body);
            if (isPresent(value)) {
                return PartitionKeyValue.fromJson(value);
            }
            throw new MissingPartitionKeyException(
                    "Partition key not found: item has no value at declared path " + declaredPath);
        }

        for (String field : candidateFields) {
            JsonNode value = body.get(field);
            if (isPresent(value)) {
                return PartitionKeyValue.fromJson(value);
            }
        }
        throw new MissingPartitionKeyException(
                "Partition key not found in options or in body fields " + candidateFields);
    }

    /**
     * Resolves the key of an operation that requires it explicitly (read, replace, delete, query).
     *
     * @throws MissingPartitionKeyException if no key was supplied
     */
    public PartitionKeyValue requireExplicit(Optional<Object> explicit) {
        return explicit.map(PartitionKeyValue::of)
                .orElseThrow(() -> new MissingPartitionKeyException(
                        "Partition key must be supplied explicitly for this operation"));
    }

    private static boolean isPresent(JsonNode value) {
        return value != null && !value.isNull() && !value.isMissingNode();
    }
}
