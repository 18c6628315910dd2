package com.zzf.workbridge.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

public final class JsonUtils {

    private JsonUtils() {}

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public static ObjectNode objectSchema(ObjectMapper mapper, Map<String, JsonNode> props, String... required) {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        for (Map.Entry<String, JsonNode> entry : props.entrySet()) {
            properties.set(entry.getKey(), entry.getValue());
        }
        if (required != null && required.length > 0) {
            ArrayNode req = schema.putArray("required");
            for (String r : required) {
                req.add(r);
            }
        }
        schema.put("additionalProperties", false);
        return schema;
    }

    public static ObjectNode emptyObjectSchema(ObjectMapper mapper) {
        return objectSchema(mapper, Map.of());
    }

    public static ObjectNode stringSchema(ObjectMapper mapper, String description) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", "string");
        if (description != null) {
            node.put("description", description);
        }
        return node;
    }

    public static ObjectNode booleanSchema(ObjectMapper mapper, String description) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", "boolean");
        if (description != null) {
            node.put("description", description);
        }
        return node;
    }

    /**
     * Text value of {@code field}, or {@code null} when the field is absent or not a string.
     */
    public static String textOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return null;
        }
        return value.asText();
    }

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }
}
