package com.ocadapter.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured JSON value used for tool-call arguments.
 *
 * <p>Arguments travel through the adapter as a tree of these values so that they are always
 * emitted as native JSON on the wire and never as a JSON-encoded string.</p>
 */
public sealed interface JsonValue
        permits JsonValue.JsonString, JsonValue.JsonNumber, JsonValue.JsonBool,
        JsonValue.JsonNull, JsonValue.JsonArray, JsonValue.JsonObject {

    JsonNode toNode();

    record JsonString(String value) implements JsonValue {
        public JsonString {
            value = value == null ? "" : value;
        }

        @Override
        public JsonNode toNode() {
            return JsonNodeFactory.instance.textNode(value);
        }
    }

    record JsonNumber(BigDecimal value) implements JsonValue {
        @Override
        public JsonNode toNode() {
            if (value.scale() <= 0) {
                return JsonNodeFactory.instance.numberNode(value.toBigIntegerExact());
            }
            return DecimalNode.valueOf(value);
        }
    }

    record JsonBool(boolean value) implements JsonValue {
        @Override
        public JsonNode toNode() {
            return JsonNodeFactory.instance.booleanNode(value);
        }
    }

    record JsonNull() implements JsonValue {
        public static final JsonNull INSTANCE = new JsonNull();

        @Override
        public JsonNode toNode() {
            return JsonNodeFactory.instance.nullNode();
        }
    }

    record JsonArray(List<JsonValue> items) implements JsonValue {
        public JsonArray {
            items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public JsonNode toNode() {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            items.forEach(item -> array.add(item.toNode()));
            return array;
        }
    }

    record JsonObject(Map<String, JsonValue> fields) implements JsonValue {
        public JsonObject {
            fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public JsonNode toNode() {
            return toObjectNode(fields);
        }
    }

    static JsonValue of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JsonNull.INSTANCE;
        }
        if (node.isTextual()) {
            return new JsonString(node.asText());
        }
        if (node.isBoolean()) {
            return new JsonBool(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return new JsonNumber(new BigDecimal(node.bigIntegerValue()));
        }
        if (node.isNumber()) {
            return new JsonNumber(node.decimalValue());
        }
        if (node.isArray()) {
            List<JsonValue> items = new ArrayList<>(node.size());
            node.forEach(child -> items.add(of(child)));
            return new JsonArray(items);
        }
        if (node.isObject()) {
            return new JsonObject(objectOf(node));
        }
        // binary/POJO nodes only appear when callers build trees by hand
        return new JsonString(node.asText());
    }

    /**
     * Converts an object node into an ordered field map. Anything other than an object yields an
     * empty map.
     */
    static Map<String, JsonValue> objectOf(JsonNode node) {
        Map<String, JsonValue> fields = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return fields;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), of(entry.getValue()));
        }
        return fields;
    }

    static ObjectNode toObjectNode(Map<String, JsonValue> fields) {
        ObjectNode object = JsonNodeFactory.instance.objectNode();
        if (fields != null) {
            fields.forEach((key, value) -> object.set(key, value == null ? JsonNodeFactory.instance.nullNode() : value.toNode()));
        }
        return object;
    }
}
