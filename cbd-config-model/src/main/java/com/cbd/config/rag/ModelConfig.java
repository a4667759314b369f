package com.cbd.config.rag;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Embeddings or cross-encoder model descriptor. */
public final class ModelConfig extends ConfigGroup {

    private final String provider;
    private final String name;
    private final Integer dimensions;
    private final Boolean defaultModel;

    @JsonCreator
    public ModelConfig(
            @JsonProperty("provider") String provider,
            @JsonProperty("name") String name,
            @JsonProperty("dimensions") Integer dimensions,
            @JsonProperty("default") Boolean defaultModel) {
        this.provider = provider;
        this.name = name;
        this.dimensions = dimensions;
        this.defaultModel = defaultModel;
    }

    /** One of sagemaker, bedrock, openai, nexus. */
    public String getProvider() {
        return provider;
    }

    public String getName() {
        return name;
    }

    public Integer getDimensions() {
        return dimensions;
    }

    @JsonProperty("default")
    public Boolean getDefaultModel() {
        return defaultModel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelConfig that = (ModelConfig) o;
        return Objects.equals(provider, that.provider)
                && Objects.equals(name, that.name)
                && Objects.equals(dimensions, that.dimensions)
                && Objects.equals(defaultModel, that.defaultModel)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, name, dimensions, defaultModel, additionalFieldsHash());
    }
}
