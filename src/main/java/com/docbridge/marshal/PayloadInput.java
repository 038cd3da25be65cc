package com.docbridge.marshal;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Map;

/**
 * Classification of a caller-supplied payload, computed once at the marshaling boundary.
 */
public sealed interface PayloadInput
        permits PayloadInput.TextInput, PayloadInput.StructuralInput, PayloadInput.Unsupported {

    /**
     * Pre-serialized JSON text, parsed directly.
     */
    record TextInput(CharSequence text) implements PayloadInput {
    }

    /**
     * A map, sequence or JSON tree, walked directly into wire nodes.
     */
    record StructuralInput(Object value) implements PayloadInput {
    }

    /**
     * Anything else.
     */
    record Unsupported(Object value) implements PayloadInput {
    }

    static PayloadInput classify(Object input) {
        if (input instanceof CharSequence text) {
            return new TextInput(text);
        }
        if (input instanceof Map<?, ?>
                || input instanceof Collection<?>
                || input instanceof Object[]
                || input instanceof JsonNode) {
            return new StructuralInput(input);
        }
        return new Unsupported(input);
    }
}
