package com.docbridge.adapter.mongodb;

import com.docbridge.adapter.spi.TransportFailure;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.types.Decimal128;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.Map;

/**
 * Converts between Jackson trees and BSON values.
 *
 * <p>Integers keep their width ({@code int32}/{@code int64}), arbitrary precision
 * numbers become {@code decimal128}. BSON types with no JSON counterpart (object ids,
 * dates, binaries) are read back as their string form or epoch millis.
 */
final class BsonNodes {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private BsonNodes() {
    }

    static BsonDocument toBson(ObjectNode node) {
        BsonDocument document = new BsonDocument();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            document.append(field.getKey(), toBson(field.getValue()));
        }
        return document;
    }

    static BsonValue toBson(JsonNode node) {
        switch (node.getNodeType()) {
            case OBJECT:
                return toBson((ObjectNode) node);
            case ARRAY: {
                BsonArray array = new BsonArray();
                for (JsonNode element : node) {
                    array.add(toBson(element));
                }
                return array;
            }
            case STRING:
                return new BsonString(node.textValue());
            case BOOLEAN:
                return BsonBoolean.valueOf(node.booleanValue());
            case NULL:
                return BsonNull.VALUE;
            case NUMBER:
                return number(node);
            default:
                throw TransportFailure.badRequest("Cannot store value of type " + node.getNodeType());
        }
    }

    private static BsonValue number(JsonNode node) {
        if (node.isInt() || node.isShort()) {
            return new BsonInt32(node.intValue());
        }
        if (node.isLong()) {
            return new BsonInt64(node.longValue());
        }
        if (node.isBigInteger()) {
            BigInteger big = node.bigIntegerValue();
            if (big.bitLength() < Long.SIZE) {
                return new BsonInt64(big.longValue());
            }
            return decimal(new BigDecimal(big));
        }
        if (node.isBigDecimal()) {
            return decimal(node.decimalValue());
        }
        return new BsonDouble(node.doubleValue());
    }

    private static BsonValue decimal(BigDecimal value) {
        try {
            return new BsonDecimal128(new Decimal128(value));
        } catch (NumberFormatException e) {
            throw TransportFailure.badRequest("Number " + value + " exceeds decimal128 precision");
        }
    }

    static ObjectNode toJson(BsonDocument document) {
        ObjectNode node = NODES.objectNode();
        for (Map.Entry<String, BsonValue> field : document.entrySet()) {
            node.set(field.getKey(), toJson(field.getValue()));
        }
        return node;
    }

    static JsonNode toJson(BsonValue value) {
        switch (value.getBsonType()) {
            case DOCUMENT:
                return toJson(value.asDocument());
            case ARRAY: {
                ArrayNode array = NODES.arrayNode();
                for (BsonValue element : value.asArray()) {
                    array.add(toJson(element));
                }
                return array;
            }
            case STRING:
                return NODES.textNode(value.asString().getValue());
            case BOOLEAN:
                return NODES.booleanNode(value.asBoolean().getValue());
            case NULL:
            case UNDEFINED:
                return NODES.nullNode();
            case INT32:
                return NODES.numberNode(value.asInt32().getValue());
            case INT64:
                return NODES.numberNode(value.asInt64().getValue());
            case DOUBLE:
                return NODES.numberNode(value.asDouble().getValue());
            case DECIMAL128: {
                Decimal128 decimal = value.asDecimal128().getValue();
                if (decimal.isNaN() || decimal.isInfinite()) {
                    return NODES.textNode(decimal.toString());
                }
                return NODES.numberNode(decimal.bigDecimalValue());
            }
            case OBJECT_ID:
                return NODES.textNode(value.asObjectId().getValue().toHexString());
            case DATE_TIME:
                return NODES.numberNode(value.asDateTime().getValue());
            default:
                return NODES.textNode(value.toString());
        }
    }
}
