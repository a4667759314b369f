package com.cbd.config.rag;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Bedrock Knowledge Base engine and the external knowledge bases it queries. */
public final class KnowledgeBaseEngine extends ConfigGroup {

    private final Boolean enabled;
    private final List<ExternalKnowledgeBase> external;

    @JsonCreator
    public KnowledgeBaseEngine(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("external") List<ExternalKnowledgeBase> external) {
        this.enabled = enabled;
        this.external = external != null ? List.copyOf(external) : null;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public List<ExternalKnowledgeBase> getExternal() {
        return external;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KnowledgeBaseEngine that = (KnowledgeBaseEngine) o;
        return Objects.equals(enabled, that.enabled)
                && Objects.equals(external, that.external)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, external, additionalFieldsHash());
    }
}
