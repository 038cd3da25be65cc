package com.docbridge.adapter.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The query subset understood by the bundled transports:
 * {@code SELECT * FROM <alias> [WHERE <alias>.<path> <op> <literal> [AND ...]]}.
 *
 * <p>Operators are {@code = != <> < <= > >=}; literals are quoted strings, numbers,
 * {@code true}, {@code false} and {@code null}. A condition on a missing field never matches.
 */
public record ItemQuery(String alias, List<Condition> conditions) {

    private static final Pattern SELECT = Pattern.compile(
            "^\\s*SELECT\\s+\\*\\s+FROM\\s+([A-Za-z_][A-Za-z0-9_]*)(?:\\s+WHERE\\s+(.+?))?\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern CONDITION = Pattern.compile(
            "\\s*([A-Za-z_][A-Za-z0-9_]*)((?:\\.[A-Za-z_][A-Za-z0-9_]*)+)\\s*(<=|>=|!=|<>|=|<|>)\\s*"
                    + "('(?:[^'\\\\]|\\\\.)*'|\"(?:[^\"\\\\]|\\\\.)*\"|-?\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?|true|false|null)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern AND = Pattern.compile("\\s+AND\\s+", Pattern.CASE_INSENSITIVE);

    public ItemQuery {
        Objects.requireNonNull(alias, "alias must not be null");
        conditions = List.copyOf(conditions);
    }

    /**
     * Parses query text.
     *
     * @throws TransportFailure with status 400 if the text is outside the supported subset
     */
    public static ItemQuery parse(String text) {
        if (text == null) {
            throw TransportFailure.badRequest("Query text is required");
        }
        Matcher select = SELECT.matcher(text);
        if (!select.matches()) {
            throw TransportFailure.badRequest("Unsupported query syntax: " + text);
        }
        String alias = select.group(1);
        String where = select.group(2);
        List<Condition> conditions = new ArrayList<>();
        if (where != null) {
            int pos = 0;
            Matcher condition = CONDITION.matcher(where);
            Matcher and = AND.matcher(where);
            while (true) {
                condition.region(pos, where.length());
                if (!condition.lookingAt()) {
                    throw TransportFailure.badRequest("Unsupported condition near: " + where.substring(pos));
                }
                if (!condition.group(1).equals(alias)) {
                    throw TransportFailure.badRequest("Unknown alias '" + condition.group(1) + "' in: " + text);
                }
                conditions.add(new Condition(
                        List.of(condition.group(2).substring(1).split("\\.")),
                        Comparison.fromSymbol(condition.group(3)),
                        literal(condition.group(4))));
                pos = condition.end();
                if (pos == where.length()) {
                    break;
                }
                and.region(pos, where.length());
                if (!and.lookingAt()) {
                    throw TransportFailure.badRequest("Expected AND near: " + where.substring(pos));
                }
                pos = and.end();
            }
        }
        return new ItemQuery(alias, conditions);
    }

    public boolean matches(ObjectNode item) {
        for (Condition condition : conditions) {
            if (!condition.test(item)) {
                return false;
            }
        }
        return true;
    }

    private static JsonNode literal(String token) {
        char first = token.charAt(0);
        if (first == '\'' || first == '"') {
            return TextNode.valueOf(token.substring(1, token.length() - 1).replaceAll("\\\\(.)", "$1"));
        }
        String lower = token.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "true":
                return BooleanNode.TRUE;
            case "false":
                return BooleanNode.FALSE;
            case "null":
                return NullNode.getInstance();
            default:
                break;
        }
        try {
            if (lower.indexOf('.') >= 0 || lower.indexOf('e') >= 0) {
                double value = Double.parseDouble(token);
                if (!Double.isFinite(value)) {
                    throw TransportFailure.badRequest("Numeric literal out of range: " + token);
                }
                return DoubleNode.valueOf(value);
            }
            return LongNode.valueOf(Long.parseLong(token));
        } catch (NumberFormatException e) {
            throw TransportFailure.badRequest("Numeric literal out of range: " + token);
        }
    }

    /**
     * One {@code alias.path op literal} term.
     */
    public record Condition(List<String> path, Comparison comparison, JsonNode literal) {

        public Condition {
            path = List.copyOf(path);
            Objects.requireNonNull(comparison, "comparison must not be null");
            Objects.requireNonNull(literal, "literal must not be null");
        }

        /**
         * Dotted form of the path, e.g. {@code address.city}.
         */
        public String dottedPath() {
            return String.join(".", path);
        }

        public boolean test(ObjectNode item) {
            JsonNode actual = item;
            for (String segment : path) {
                actual = actual.get(segment);
                if (actual == null) {
                    return false;
                }
            }
            return comparison.test(actual, literal);
        }
    }

    /**
     * Comparison operators.
     */
    public enum Comparison {
        EQ, NE, LT, LE, GT, GE;

        static Comparison fromSymbol(String symbol) {
            switch (symbol) {
                case "=":
                    return EQ;
                case "!=":
                case "<>":
                    return NE;
                case "<":
                    return LT;
                case "<=":
                    return LE;
                case ">":
                    return GT;
                default:
                    return GE;
            }
        }

        boolean test(JsonNode actual, JsonNode literal) {
            if (this == EQ) {
                return sameValue(actual, literal);
            }
            if (this == NE) {
                return !sameValue(actual, literal);
            }
            int order;
            if (actual.isNumber() && literal.isNumber()) {
                order = actual.decimalValue().compareTo(literal.decimalValue());
            } else if (actual.isTextual() && literal.isTextual()) {
                order = actual.textValue().compareTo(literal.textValue());
            } else {
                return false;
            }
            switch (this) {
                case LT:
                    return order < 0;
                case LE:
                    return order <= 0;
                case GT:
                    return order > 0;
                default:
                    return order >= 0;
            }
        }

        private static boolean sameValue(JsonNode actual, JsonNode literal) {
            if (actual.isNumber() && literal.isNumber()) {
                return actual.decimalValue().compareTo(literal.decimalValue()) == 0;
            }
            return actual.equals(literal);
        }
    }
}
