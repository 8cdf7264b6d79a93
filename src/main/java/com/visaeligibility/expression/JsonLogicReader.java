package com.visaeligibility.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.visaeligibility.exception.InvalidExpressionException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts a JSON-Logic document into an {@link Expression} tree.
 *
 * <p>Only {@code == === != !== > >= < <= and or ! in var} are accepted. Scalars
 * become {@link Literal}s; arrays are allowed only as the candidate list of
 * {@code in}. Depth and node count are bounded.
 */
public final class JsonLogicReader {

    public static final int MAX_DEPTH = 20;
    public static final int MAX_NODES = 1000;

    private int nodes;

    private JsonLogicReader() {
    }

    public static Expression read(JsonNode node) {
        return new JsonLogicReader().parse(node, 0);
    }

    private Expression parse(JsonNode node, int depth) {
        if (depth > MAX_DEPTH) {
            throw new InvalidExpressionException("Expression too deeply nested (max depth: " + MAX_DEPTH + ")");
        }
        if (++nodes > MAX_NODES) {
            throw new InvalidExpressionException("Expression too complex (max nodes: " + MAX_NODES + ")");
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new InvalidExpressionException("Null is not a valid expression");
        }
        if (node.isValueNode()) {
            return literal(node);
        }
        if (node.isArray()) {
            throw new InvalidExpressionException("Arrays are only allowed as the candidate list of 'in'");
        }
        if (node.size() != 1) {
            List<String> keys = new ArrayList<>();
            node.fieldNames().forEachRemaining(keys::add);
            throw new InvalidExpressionException(
                    "Expression object must have exactly one operator key, got " + keys);
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        Map.Entry<String, JsonNode> entry = fields.next();
        String operator = entry.getKey();
        JsonNode args = entry.getValue();

        switch (operator) {
            case "var":
                return variable(args);
            case "and":
                return new And(parseAll(arguments(operator, args, 1, Integer.MAX_VALUE), depth));
            case "or":
                return new Or(parseAll(arguments(operator, args, 1, Integer.MAX_VALUE), depth));
            case "!":
                return new Not(parse(arguments(operator, args, 1, 1).get(0), depth + 1));
            case "in":
                return membership(arguments(operator, args, 2, 2), depth);
            default:
                ComparisonOperator comparison = ComparisonOperator.fromSymbol(operator)
                        .orElseThrow(() -> new InvalidExpressionException("Unsupported operator: '" + operator + "'"));
                List<JsonNode> operands = arguments(operator, args, 2, 2);
                return new Compare(comparison,
                        parse(operands.get(0), depth + 1),
                        parse(operands.get(1), depth + 1));
        }
    }

    private Expression variable(JsonNode args) {
        JsonNode name = args;
        if (args.isArray()) {
            if (args.size() != 1) {
                throw new InvalidExpressionException("'var' takes a single fact key; default values are not supported");
            }
            name = args.get(0);
        }
        if (!name.isTextual() || name.asText().isBlank()) {
            throw new InvalidExpressionException("'var' requires a non-empty fact key");
        }
        return new Var(name.asText());
    }

    private Expression membership(List<JsonNode> operands, int depth) {
        Expression needle = parse(operands.get(0), depth + 1);
        JsonNode container = operands.get(1);

        if (container.isArray()) {
            List<Expression> candidates = new ArrayList<>();
            for (JsonNode candidate : container) {
                candidates.add(parse(candidate, depth + 2));
            }
            return In.anyOf(needle, candidates);
        }
        return In.substringOf(needle, parse(container, depth + 1));
    }

    private List<Expression> parseAll(List<JsonNode> nodes, int depth) {
        List<Expression> parsed = new ArrayList<>(nodes.size());
        for (JsonNode child : nodes) {
            parsed.add(parse(child, depth + 1));
        }
        return parsed;
    }

    private static List<JsonNode> arguments(String operator, JsonNode args, int min, int max) {
        List<JsonNode> list = new ArrayList<>();
        if (args.isArray()) {
            args.forEach(list::add);
        } else {
            list.add(args);
        }
        if (list.size() < min || list.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + ".." + (max == Integer.MAX_VALUE ? "n" : max);
            throw new InvalidExpressionException(
                    "'" + operator + "' expects " + expected + " argument(s), got " + list.size());
        }
        return list;
    }

    private static Literal literal(JsonNode node) {
        if (node.isNumber()) {
            return Literal.of(node.decimalValue());
        }
        if (node.isBoolean()) {
            return Literal.of(node.booleanValue());
        }
        if (node.isTextual()) {
            return Literal.of(node.textValue());
        }
        throw new InvalidExpressionException("Unsupported literal: " + node);
    }
}
