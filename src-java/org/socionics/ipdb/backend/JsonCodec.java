package org.socionics.ipdb.backend;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.socionics.ipdb.TypeCode;
import org.socionics.ipdb.TypingSystem;
import org.socionics.ipdb.ValidationException;

/**
 * JSON encoding shared by every backend: entity metadata, embedding vectors,
 * the seed catalog and the fallback snapshot.
 */
public final class JsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonCodec() {}

    /**
     * The shared mapper. Thread-safe once configured.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // =========================================================================
    // Metadata
    // =========================================================================

    /**
     * Round-trip metadata through JSON so every backend hands back the same
     * value types (Integer, Long, Double, String, Boolean, List, Map).
     *
     * @throws ValidationException if the map holds values JSON cannot carry
     */
    public static Map<String, Object> normalizeMetadata(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return readMetadata(writeMetadata(metadata));
    }

    public static String writeMetadata(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Metadata is not JSON-serializable: " + e.getOriginalMessage());
        }
    }

    public static Map<String, Object> readMetadata(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt metadata column", e);
        }
    }

    // =========================================================================
    // Vectors
    // =========================================================================

    public static String writeVector(float[] vector) {
        try {
            return MAPPER.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot encode vector", e);
        }
    }

    public static float[] readVector(String json) {
        try {
            return MAPPER.readValue(json, float[].class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt vector column", e);
        }
    }

    // =========================================================================
    // Catalog
    // =========================================================================

    /**
     * Parse a catalog document: an array of
     * {@code {name, displayName, description, types: [{code, name}]}}.
     */
    public static List<TypingSystem> readTypingSystems(InputStream in) throws IOException {
        JsonNode root = MAPPER.readTree(in);
        List<TypingSystem> systems = new ArrayList<>();
        for (JsonNode node : root) {
            List<TypeCode> types = new ArrayList<>();
            for (JsonNode type : node.path("types")) {
                types.add(new TypeCode(type.path("code").asText(), textOrNull(type, "name")));
            }
            systems.add(new TypingSystem(node.path("name").asText(),
                    textOrNull(node, "displayName"), textOrNull(node, "description"), types));
        }
        return systems;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
