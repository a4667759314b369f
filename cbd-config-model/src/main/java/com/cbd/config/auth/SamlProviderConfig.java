package com.cbd.config.auth;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** SAML identity provider: the HTTPS URL of the IdP metadata document. */
public final class SamlProviderConfig extends ConfigGroup {

    private final String metadataDocumentUrl;

    @JsonCreator
    public SamlProviderConfig(@JsonProperty("metadataDocumentUrl") String metadataDocumentUrl) {
        this.metadataDocumentUrl = metadataDocumentUrl;
    }

    public String getMetadataDocumentUrl() {
        return metadataDocumentUrl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SamlProviderConfig that = (SamlProviderConfig) o;
        return Objects.equals(metadataDocumentUrl, that.metadataDocumentUrl) && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadataDocumentUrl, additionalFieldsHash());
    }
}
