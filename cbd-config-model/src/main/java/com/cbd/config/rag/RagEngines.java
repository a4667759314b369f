package com.cbd.config.rag;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Retrieval engines. Engines without a typed model here (e.g. kendra) are carried in
 * {@link #getAdditionalFields()}.
 */
public final class RagEngines extends ConfigGroup {

    private final EngineToggle opensearch;
    private final EngineToggle aurora;
    private final KnowledgeBaseEngine knowledgeBase;

    @JsonCreator
    public RagEngines(
            @JsonProperty("opensearch") EngineToggle opensearch,
            @JsonProperty("aurora") EngineToggle aurora,
            @JsonProperty("knowledgeBase") KnowledgeBaseEngine knowledgeBase) {
        this.opensearch = opensearch;
        this.aurora = aurora;
        this.knowledgeBase = knowledgeBase;
    }

    public EngineToggle getOpensearch() {
        return opensearch;
    }

    public EngineToggle getAurora() {
        return aurora;
    }

    public KnowledgeBaseEngine getKnowledgeBase() {
        return knowledgeBase;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RagEngines that = (RagEngines) o;
        return Objects.equals(opensearch, that.opensearch)
                && Objects.equals(aurora, that.aurora)
                && Objects.equals(knowledgeBase, that.knowledgeBase)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opensearch, aurora, knowledgeBase, additionalFieldsHash());
    }
}
