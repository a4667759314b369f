package com.cbd.config;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base for every configuration group. Fields the typed model does not name (e.g. {@code llms},
 * {@code nexus}, {@code rag.engines.kendra}) are kept here as raw JSON so a base document
 * survives load, merge and serialization without losing anything.
 */
public abstract class ConfigGroup {

    private final Map<String, JsonNode> additionalFields = new LinkedHashMap<>();

    /** Unmodeled fields in document order (read-only). */
    @JsonAnyGetter
    public Map<String, JsonNode> getAdditionalFields() {
        return Collections.unmodifiableMap(additionalFields);
    }

    @JsonAnySetter
    protected void putAdditionalField(String name, JsonNode value) {
        additionalFields.put(name, value);
    }

    protected boolean sameAdditionalFields(ConfigGroup other) {
        return Objects.equals(additionalFields, other.additionalFields);
    }

    protected int additionalFieldsHash() {
        return additionalFields.hashCode();
    }
}
