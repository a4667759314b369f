package com.cbd.config.bedrock;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Bedrock access: region, optional cross-account role and guardrails. */
public final class BedrockConfig extends ConfigGroup {

    private final Boolean enabled;
    private final String region;
    private final String roleArn;
    private final GuardrailsConfig guardrails;

    @JsonCreator
    public BedrockConfig(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("region") String region,
            @JsonProperty("roleArn") String roleArn,
            @JsonProperty("guardrails") GuardrailsConfig guardrails) {
        this.enabled = enabled;
        this.region = region;
        this.roleArn = roleArn;
        this.guardrails = guardrails;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public String getRegion() {
        return region;
    }

    public String getRoleArn() {
        return roleArn;
    }

    public GuardrailsConfig getGuardrails() {
        return guardrails;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BedrockConfig that = (BedrockConfig) o;
        return Objects.equals(enabled, that.enabled)
                && Objects.equals(region, that.region)
                && Objects.equals(roleArn, that.roleArn)
                && Objects.equals(guardrails, that.guardrails)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, region, roleArn, guardrails, additionalFieldsHash());
    }
}
