package com.cbd.config.bedrock;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Bedrock guardrail applied to model invocations: identifier and version of an existing guardrail. */
public final class GuardrailsConfig extends ConfigGroup {

    private final Boolean enabled;
    private final String identifier;
    private final String version;

    @JsonCreator
    public GuardrailsConfig(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("identifier") String identifier,
            @JsonProperty("version") String version) {
        this.enabled = enabled;
        this.identifier = identifier;
        this.version = version;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GuardrailsConfig that = (GuardrailsConfig) o;
        return Objects.equals(enabled, that.enabled)
                && Objects.equals(identifier, that.identifier)
                && Objects.equals(version, that.version)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, identifier, version, additionalFieldsHash());
    }
}
