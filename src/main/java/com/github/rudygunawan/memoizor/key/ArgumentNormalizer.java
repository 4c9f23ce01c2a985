package com.github.rudygunawan.memoizor.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Serializes a resolved argument list to JSON that does not depend on map or property order.
 *
 * <p>Two structurally equal maps whose keys were inserted in different orders produce the same
 * text. Values Jackson has no description for (lambdas and other property-less objects) are
 * written as their {@code toString()} form.
 */
public class ArgumentNormalizer {
    private final ObjectMapper mapper;

    public ArgumentNormalizer() {
        this(new ObjectMapper());
    }

    public ArgumentNormalizer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    /**
     * Returns the normalized JSON of {@code {"prefix": uid, "signature": [args...]}}.
     *
     * @throws IllegalArgumentException if the arguments cannot be serialized
     */
    public String normalize(String uid, List<Object> args) {
        ObjectNode root = mapper.createObjectNode();
        root.put("prefix", uid);
        ArrayNode signature = root.putArray("signature");
        for (Object arg : args) {
            signature.add(toNode(arg));
        }

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize arguments for key derivation", e);
        }
    }

    JsonNode toNode(Object value) {
        JsonNodeFactory nodes = mapper.getNodeFactory();
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof JsonNode) {
            return sorted((JsonNode) value);
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return nodes.textNode(value.toString());
        }
        if (value instanceof Enum) {
            return nodes.textNode(((Enum<?>) value).name());
        }
        if (value instanceof Boolean) {
            return nodes.booleanNode((Boolean) value);
        }
        if (value instanceof Number) {
            return numberNode((Number) value, nodes);
        }
        if (value instanceof Optional) {
            return toNode(((Optional<?>) value).orElse(null));
        }
        if (value instanceof Map) {
            TreeMap<String, JsonNode> fields = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                fields.put(String.valueOf(entry.getKey()), toNode(entry.getValue()));
            }
            ObjectNode object = nodes.objectNode();
            fields.forEach(object::set);
            return object;
        }
        if (value instanceof Iterable) {
            ArrayNode array = nodes.arrayNode();
            for (Object element : (Iterable<?>) value) {
                array.add(toNode(element));
            }
            return array;
        }
        if (value.getClass().isArray()) {
            ArrayNode array = nodes.arrayNode();
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                array.add(toNode(Array.get(value, i)));
            }
            return array;
        }
        if (value.getClass().isSynthetic()) {
            return nodes.textNode(value.toString());
        }

        try {
            return sorted(mapper.valueToTree(value));
        } catch (IllegalArgumentException e) {
            return nodes.textNode(String.valueOf(value));
        }
    }

    private static JsonNode numberNode(Number number, JsonNodeFactory nodes) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return nodes.numberNode(number.intValue());
        }
        if (number instanceof Long) {
            return nodes.numberNode(number.longValue());
        }
        if (number instanceof Double) {
            return nodes.numberNode(number.doubleValue());
        }
        if (number instanceof Float) {
            return nodes.numberNode(number.floatValue());
        }
        if (number instanceof BigInteger) {
            return nodes.numberNode((BigInteger) number);
        }
        if (number instanceof BigDecimal) {
            return nodes.numberNode((BigDecimal) number);
        }
        return nodes.textNode(number.toString());
    }

    private JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> fields = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                fields.put(field.getKey(), sorted(field.getValue()));
            }
            ObjectNode object = mapper.getNodeFactory().objectNode();
            fields.forEach(object::set);
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = mapper.getNodeFactory().arrayNode();
            for (JsonNode element : node) {
                array.add(sorted(element));
            }
            return array;
        }
        return node;
    }
}
