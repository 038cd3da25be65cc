package com.docbridge.partition;

import com.docbridge.exceptions.TypeMismatchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Scalar routing key of an item: a string, a number or a boolean.
 *
 * <p>Numbers are normalized so that equal keys compare equal regardless of the boxed
 * type the caller used: integral values that fit a {@code long} become {@link Long},
 * everything else becomes {@link Double}.
 */
public sealed interface PartitionKeyValue
        permits PartitionKeyValue.Text, PartitionKeyValue.Number, PartitionKeyValue.Bool {

    /**
     * The normalized host value ({@code String}, {@code Long}, {@code Double} or {@code Boolean}).
     */
    Object value();

    /**
     * The wire form of this key.
     */
    JsonNode toJson();

    record Text(String value) implements PartitionKeyValue {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public JsonNode toJson() {
            return TextNode.valueOf(value);
        }
    }

    record Number(java.lang.Number value) implements PartitionKeyValue {
        public Number {
            Objects.requireNonNull(value, "value must not be null");
            if (!(value instanceof Long) && !(value instanceof Double)) {
                throw new IllegalArgumentException("number partition keys must be normalized to Long or Double");
            }
        }

        @Override
        public JsonNode toJson() {
            return value instanceof Long l ? LongNode.valueOf(l) : DoubleNode.valueOf(value.doubleValue());
        }
    }

    record Bool(Boolean value) implements PartitionKeyValue {
        public Bool {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public JsonNode toJson() {
            return BooleanNode.valueOf(value);
        }
    }

    /**
     * Converts a caller-supplied value into a partition key.
     *
     * @throws TypeMismatchException if the value is not a string, number or boolean
     */
    static PartitionKeyValue of(Object value) {
        if (value instanceof PartitionKeyValue pk) {
            return pk;
        }
        if (value instanceof CharSequence text) {
            return new Text(text.toString());
        }
        if (value instanceof Character c) {
            return new Text(c.toString());
        }
        if (value instanceof Boolean b) {
            return new Bool(b);
        }
        if (value instanceof java.lang.Number n) {
            return new Number(normalize(n));
        }
        if (value instanceof JsonNode node) {
            return fromJson(node);
        }
        throw new TypeMismatchException(
                "Partition key must be a string, number or boolean, got "
                        + (value == null ? "null" : value.getClass().getName()),
                value == null ? null : value.getClass());
    }

    /**
     * Converts a wire scalar into a partition key.
     *
     * @throws TypeMismatchException if the node is not a string, number or boolean
     */
    static PartitionKeyValue fromJson(JsonNode node) {
        if (node != null) {
            if (node.isTextual()) {
                return new Text(node.textValue());
            }
            if (node.isBoolean()) {
                return new Bool(node.booleanValue());
            }
            if (node.isNumber()) {
                return new Number(normalize(node.numberValue()));
            }
        }
        throw new TypeMismatchException(
                "Partition key must be a string, number or boolean, got "
                        + (node == null ? "nothing" : node.getNodeType()),
                node == null ? null : node.getClass());
    }

    private static java.lang.Number normalize(java.lang.Number n) {
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return n.longValue();
        }
        if (n instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        if (n instanceof BigDecimal dec) {
            try {
                return dec.longValueExact();
            } catch (ArithmeticException notIntegral) {
                return dec.doubleValue();
            }
        }
        double d = n.doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p63) {
            return (long) d;
        }
        return d;
    }
}
