package com.cbd.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of {@link SystemConfig}, as JSON text or as a Jackson tree.
 * Null values are excluded when serializing, so an absent field stays absent.
 */
public final class SystemConfigJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private SystemConfigJson() {
    }

    /**
     * Deserializes a configuration from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static SystemConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, SystemConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Serializes to compact JSON (nulls excluded). */
    public static String toJson(SystemConfig config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Serializes to pretty-printed JSON (nulls excluded). */
    public static String toJsonPretty(SystemConfig config) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Returns a fresh, mutable JSON tree for the configuration. The tree shares nothing with
     * {@code config}, so it can be edited freely.
     */
    public static ObjectNode toTree(SystemConfig config) {
        JsonNode tree = MAPPER.valueToTree(config);
        if (tree == null || !tree.isObject()) {
            throw new IllegalStateException("SystemConfig did not serialize to a JSON object");
        }
        return (ObjectNode) tree;
    }

    /**
     * Builds a configuration from a JSON tree.
     *
     * @throws IllegalArgumentException when the tree does not have the configuration shape
     */
    public static SystemConfig fromTree(JsonNode tree) {
        try {
            return MAPPER.treeToValue(tree, SystemConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON tree is not a valid SystemConfig: " + e.getOriginalMessage(), e);
        }
    }

    /** Pretty-prints any JSON tree with the same settings (used for reports). */
    public static String prettyPrint(JsonNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
