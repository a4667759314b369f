package com.cbd.config.rag;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** A retrieval engine that is only switched on or off (OpenSearch, Aurora). */
public final class EngineToggle extends ConfigGroup {

    private final Boolean enabled;

    @JsonCreator
    public EngineToggle(@JsonProperty("enabled") Boolean enabled) {
        this.enabled = enabled;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EngineToggle that = (EngineToggle) o;
        return Objects.equals(enabled, that.enabled) && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, additionalFieldsHash());
    }
}
