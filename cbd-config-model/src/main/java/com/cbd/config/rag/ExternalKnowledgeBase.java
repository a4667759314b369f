package com.cbd.config.rag;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An existing Bedrock knowledge base attached as an external index, optionally in another
 * region or account (then reached through {@code roleArn}).
 */
public final class ExternalKnowledgeBase extends ConfigGroup {

    private final String name;
    private final String knowledgeBaseId;
    private final String region;
    private final String roleArn;
    private final Boolean enabled;

    @JsonCreator
    public ExternalKnowledgeBase(
            @JsonProperty("name") String name,
            @JsonProperty("knowledgeBaseId") String knowledgeBaseId,
            @JsonProperty("region") String region,
            @JsonProperty("roleArn") String roleArn,
            @JsonProperty("enabled") Boolean enabled) {
        this.name = name;
        this.knowledgeBaseId = knowledgeBaseId;
        this.region = region;
        this.roleArn = roleArn;
        this.enabled = enabled;
    }

    public String getName() {
        return name;
    }

    public String getKnowledgeBaseId() {
        return knowledgeBaseId;
    }

    public String getRegion() {
        return region;
    }

    public String getRoleArn() {
        return roleArn;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    /** Entries are active unless explicitly disabled. */
    @JsonIgnore
    public boolean isActive() {
        return !Boolean.FALSE.equals(enabled);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExternalKnowledgeBase that = (ExternalKnowledgeBase) o;
        return Objects.equals(name, that.name)
                && Objects.equals(knowledgeBaseId, that.knowledgeBaseId)
                && Objects.equals(region, that.region)
                && Objects.equals(roleArn, that.roleArn)
                && Objects.equals(enabled, that.enabled)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, knowledgeBaseId, region, roleArn, enabled, additionalFieldsHash());
    }
}
