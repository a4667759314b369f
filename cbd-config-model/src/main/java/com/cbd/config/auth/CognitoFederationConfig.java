package com.cbd.config.auth;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identity federation settings for the user pool. {@code customProviderType} is the discriminant
 * that decides which of {@link #getCustomSAML()} / {@link #getCustomOIDC()} is meaningful;
 * {@code "later"} means the provider is configured after deployment.
 */
public final class CognitoFederationConfig extends ConfigGroup {

    public static final String PROVIDER_SAML = "SAML";
    public static final String PROVIDER_OIDC = "OIDC";
    public static final String PROVIDER_LATER = "later";

    private final Boolean enabled;
    private final Boolean autoRedirect;
    private final String customProviderName;
    private final String customProviderType;
    private final String cognitoDomain;
    private final SamlProviderConfig customSAML;
    private final OidcProviderConfig customOIDC;

    @JsonCreator
    public CognitoFederationConfig(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("autoRedirect") Boolean autoRedirect,
            @JsonProperty("customProviderName") String customProviderName,
            @JsonProperty("customProviderType") String customProviderType,
            @JsonProperty("cognitoDomain") String cognitoDomain,
            @JsonProperty("customSAML") SamlProviderConfig customSAML,
            @JsonProperty("customOIDC") OidcProviderConfig customOIDC) {
        this.enabled = enabled;
        this.autoRedirect = autoRedirect;
        this.customProviderName = customProviderName;
        this.customProviderType = customProviderType;
        this.cognitoDomain = cognitoDomain;
        this.customSAML = customSAML;
        this.customOIDC = customOIDC;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public Boolean getAutoRedirect() {
        return autoRedirect;
    }

    public String getCustomProviderName() {
        return customProviderName;
    }

    public String getCustomProviderType() {
        return customProviderType;
    }

    public String getCognitoDomain() {
        return cognitoDomain;
    }

    @JsonProperty("customSAML")
    public SamlProviderConfig getCustomSAML() {
        return customSAML;
    }

    @JsonProperty("customOIDC")
    public OidcProviderConfig getCustomOIDC() {
        return customOIDC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CognitoFederationConfig that = (CognitoFederationConfig) o;
        return Objects.equals(enabled, that.enabled)
                && Objects.equals(autoRedirect, that.autoRedirect)
                && Objects.equals(customProviderName, that.customProviderName)
                && Objects.equals(customProviderType, that.customProviderType)
                && Objects.equals(cognitoDomain, that.cognitoDomain)
                && Objects.equals(customSAML, that.customSAML)
                && Objects.equals(customOIDC, that.customOIDC)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, autoRedirect, customProviderName, customProviderType, cognitoDomain,
                customSAML, customOIDC, additionalFieldsHash());
    }
}
