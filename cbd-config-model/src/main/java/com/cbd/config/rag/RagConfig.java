package com.cbd.config.rag;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Retrieval-augmented generation settings: engines and the model lists they use. */
public final class RagConfig extends ConfigGroup {

    private final Boolean enabled;
    private final Boolean deployDefaultSagemakerModels;
    private final Boolean crossEncodingEnabled;
    private final RagEngines engines;
    private final List<ModelConfig> embeddingsModels;
    private final List<ModelConfig> crossEncoderModels;

    @JsonCreator
    public RagConfig(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("deployDefaultSagemakerModels") Boolean deployDefaultSagemakerModels,
            @JsonProperty("crossEncodingEnabled") Boolean crossEncodingEnabled,
            @JsonProperty("engines") RagEngines engines,
            @JsonProperty("embeddingsModels") List<ModelConfig> embeddingsModels,
            @JsonProperty("crossEncoderModels") List<ModelConfig> crossEncoderModels) {
        this.enabled = enabled;
        this.deployDefaultSagemakerModels = deployDefaultSagemakerModels;
        this.crossEncodingEnabled = crossEncodingEnabled;
        this.engines = engines;
        this.embeddingsModels = embeddingsModels != null ? List.copyOf(embeddingsModels) : null;
        this.crossEncoderModels = crossEncoderModels != null ? List.copyOf(crossEncoderModels) : null;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public Boolean getDeployDefaultSagemakerModels() {
        return deployDefaultSagemakerModels;
    }

    public Boolean getCrossEncodingEnabled() {
        return crossEncodingEnabled;
    }

    public RagEngines getEngines() {
        return engines;
    }

    public List<ModelConfig> getEmbeddingsModels() {
        return embeddingsModels;
    }

    public List<ModelConfig> getCrossEncoderModels() {
        return crossEncoderModels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RagConfig that = (RagConfig) o;
        return Objects.equals(enabled, that.enabled)
                && Objects.equals(deployDefaultSagemakerModels, that.deployDefaultSagemakerModels)
                && Objects.equals(crossEncodingEnabled, that.crossEncodingEnabled)
                && Objects.equals(engines, that.engines)
                && Objects.equals(embeddingsModels, that.embeddingsModels)
                && Objects.equals(crossEncoderModels, that.crossEncoderModels)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, deployDefaultSagemakerModels, crossEncodingEnabled, engines,
                embeddingsModels, crossEncoderModels, additionalFieldsHash());
    }
}
