package com.cbd.config.auth;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * OIDC identity provider. The client secret is never stored inline: {@code OIDCSecret} is the
 * ARN of a Secrets Manager secret.
 */
public final class OidcProviderConfig extends ConfigGroup {

    private final String clientId;
    private final String secretArn;
    private final String issuerUrl;

    @JsonCreator
    public OidcProviderConfig(
            @JsonProperty("OIDCClient") String clientId,
            @JsonProperty("OIDCSecret") String secretArn,
            @JsonProperty("OIDCIssuerURL") String issuerUrl) {
        this.clientId = clientId;
        this.secretArn = secretArn;
        this.issuerUrl = issuerUrl;
    }

    @JsonProperty("OIDCClient")
    public String getClientId() {
        return clientId;
    }

    @JsonProperty("OIDCSecret")
    public String getSecretArn() {
        return secretArn;
    }

    @JsonProperty("OIDCIssuerURL")
    public String getIssuerUrl() {
        return issuerUrl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OidcProviderConfig that = (OidcProviderConfig) o;
        return Objects.equals(clientId, that.clientId)
                && Objects.equals(secretArn, that.secretArn)
                && Objects.equals(issuerUrl, that.issuerUrl)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clientId, secretArn, issuerUrl, additionalFieldsHash());
    }
}
