package com.eainde.productresearch.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts JSON Schema documents kept under {@code src/main/resources/schemas} into langchain4j {@link JsonSchema}.
 * Nullable types written as {@code ["number", "null"]} map to the non-null type and are left out of {@code required}.
 */
public final class JsonSchemaConverter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    public static JsonSchema fromResource(String name, String classpathLocation) {
        try (InputStream in = new ClassPathResource(classpathLocation).getInputStream()) {
            return toLangChainSchema(name, objectMapper.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load JSON schema " + classpathLocation, e);
        }
    }

    public static JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        try {
            return toLangChainSchema(name, objectMapper.readTree(jsonSchemaString));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse JSON Schema string", e);
        }
    }

    private static JsonSchema toLangChainSchema(String name, JsonNode rootNode) {
        return JsonSchema.builder()
                .name(name != null ? name : "Schema")
                .rootElement(parseElement(rootNode))
                .build();
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        String type = typeOf(node);
        if (type == null) {
            if (node.has("properties")) return parseObject(node);
            return JsonStringSchema.builder().build();
        }

        return switch (type) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "integer" -> JsonIntegerSchema.builder().description(description(node)).build();
            case "number" -> JsonNumberSchema.builder().description(description(node)).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description(node)).build();
            default -> parseString(node);
        };
    }

    private static String typeOf(JsonNode node) {
        JsonNode type = node.get("type");
        if (type == null) return null;
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (!"null".equals(t.asText())) return t.asText();
            }
            return null;
        }
        return type.asText();
    }

    private static boolean isNullable(JsonNode node) {
        JsonNode type = node.get("type");
        if (type == null || !type.isArray()) return false;
        for (JsonNode t : type) {
            if ("null".equals(t.asText())) return true;
        }
        return false;
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        if (node.has("description")) {
            builder.description(node.get("description").asText());
        }

        List<String> nullable = new ArrayList<>();
        JsonNode props = node.get("properties");
        if (props != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
                if (isNullable(field.getValue())) {
                    nullable.add(field.getKey());
                }
            }
        }

        if (node.has("required") && node.get("required").isArray()) {
            List<String> required = new ArrayList<>();
            node.get("required").forEach(n -> {
                if (!nullable.contains(n.asText())) required.add(n.asText());
            });
            builder.required(required);
        }
        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder();
        if (node.has("description")) builder.description(node.get("description").asText());
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum")) {
            List<String> enumValues = new ArrayList<>();
            node.get("enum").forEach(n -> enumValues.add(n.asText()));
            return JsonEnumSchema.builder()
                    .description(description(node))
                    .enumValues(enumValues)
                    .build();
        }
        return JsonStringSchema.builder().description(description(node)).build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
