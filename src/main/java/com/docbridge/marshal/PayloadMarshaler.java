package com.docbridge.marshal;

import com.docbridge.exceptions.InvalidPayloadException;
import com.docbridge.exceptions.TypeMismatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts caller values into wire values ({@link JsonNode}) and back.
 *
 * <p>Text is parsed as strict JSON. Maps, sequences and scalars are walked directly into
 * nodes without an intermediate textual form, so callers should hand over their maps
 * as they are rather than serializing them first. Responses always decode to
 * {@code LinkedHashMap}, {@code ArrayList} and boxed scalars.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class PayloadMarshaler {

    /**
     * Maximum nesting accepted on the structural path.
     */
    public static final int MAX_DEPTH = 1000;

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private final ObjectMapper mapper;

    public PayloadMarshaler() {
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Encodes any supported payload.
     *
     * @throws InvalidPayloadException if text is not valid JSON or a structure holds an unsupported value
     * @throws TypeMismatchException   if the input is neither text nor a supported structure
     */
    public JsonNode encode(Object input) {
        PayloadInput classified = PayloadInput.classify(input);
        if (classified instanceof PayloadInput.TextInput text) {
            return parse(text.text());
        }
        if (classified instanceof PayloadInput.StructuralInput structural) {
            return walk(structural.value(), 0);
        }
        throw new TypeMismatchException(
                "Payload must be JSON text or a map/sequence of JSON values, got "
                        + (input == null ? "null" : input.getClass().getName()),
                input == null ? null : input.getClass());
    }

    /**
     * Encodes an item body, which must be a JSON object.
     *
     * @throws TypeMismatchException if the payload does not encode to an object
     */
    public ObjectNode encodeItem(Object body) {
        JsonNode node = encode(body);
        if (node instanceof ObjectNode item) {
            return item;
        }
        throw new TypeMismatchException(
                "Item body must be a JSON object, got " + node.getNodeType(), body.getClass());
    }

    /**
     * Decodes a wire value into host-native types.
     */
    public Object decode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        switch (node.getNodeType()) {
            case OBJECT: {
                Map<String, Object> map = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    map.put(field.getKey(), decode(field.getValue()));
                }
                return map;
            }
            case ARRAY: {
                List<Object> list = new ArrayList<>(node.size());
                for (JsonNode element : node) {
                    list.add(decode(element));
                }
                return list;
            }
            case STRING:
                return node.textValue();
            case BOOLEAN:
                return node.booleanValue();
            case NUMBER:
                return node.numberValue();
            default:
                throw new InvalidPayloadException("Unsupported wire value of type " + node.getNodeType());
        }
    }

    /**
     * Decodes an item returned by the server.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> decodeItem(JsonNode node) {
        Object decoded = decode(node);
        if (decoded instanceof Map<?, ?>) {
            return (Map<String, Object>) decoded;
        }
        throw new InvalidPayloadException("Expected a JSON object from the server, got "
                + (node == null ? "nothing" : node.getNodeType()));
    }

    public List<Map<String, Object>> decodeItems(List<? extends JsonNode> nodes) {
        List<Map<String, Object>> items = new ArrayList<>(nodes.size());
        for (JsonNode node : nodes) {
            items.add(decodeItem(node));
        }
        return items;
    }

    private JsonNode parse(CharSequence text) {
        JsonNode node;
        try {
            node = mapper.readTree(text.toString());
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new InvalidPayloadException("Invalid JSON: empty payload");
        }
        return node;
    }

    private JsonNode walk(Object value, int depth) {
        if (depth > MAX_DEPTH) {
            throw new InvalidPayloadException("Payload nesting exceeds " + MAX_DEPTH + " levels");
        }
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode object = NODES.objectNode();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new InvalidPayloadException("Map keys must be strings, got "
                            + (entry.getKey() == null ? "null" : entry.getKey().getClass().getName()));
                }
                object.set(key, walk(entry.getValue(), depth + 1));
            }
            return object;
        }
        if (value instanceof Collection<?> collection) {
            ArrayNode array = NODES.arrayNode(collection.size());
            for (Object element : collection) {
                array.add(walk(element, depth + 1));
            }
            return array;
        }
        if (value instanceof Object[] elements) {
            ArrayNode array = NODES.arrayNode(elements.length);
            for (Object element : elements) {
                array.add(walk(element, depth + 1));
            }
            return array;
        }
        if (value instanceof JsonNode node) {
            return node.deepCopy();
        }
        return scalar(value);
    }

    private JsonNode scalar(Object value) {
        if (value instanceof CharSequence || value instanceof Character) {
            return NODES.textNode(value.toString());
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return NODES.numberNode(((Number) value).intValue());
        }
        if (value instanceof Long l) {
            return NODES.numberNode(l);
        }
        if (value instanceof BigInteger big) {
            return NODES.numberNode(big);
        }
        if (value instanceof BigDecimal dec) {
            return NODES.numberNode(dec);
        }
        if (value instanceof Float f) {
            requireFinite(f);
            return NODES.numberNode(f);
        }
        if (value instanceof Double d) {
            requireFinite(d);
            return NODES.numberNode(d);
        }
        throw new InvalidPayloadException("Unsupported value of type " + value.getClass().getName());
    }

    private static void requireFinite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidPayloadException("JSON cannot represent " + value);
        }
    }
}
