package com.cbd.manifest;

import com.cbd.config.SystemConfig;
import com.cbd.config.SystemConfigJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * A manifest that passed validation: only known fields, in document order, with defaults applied.
 * A field present here overrides the base configuration; an absent field leaves it untouched.
 * <p>
 * Instances are created by {@link com.cbd.manifest.schema.SchemaValidator}; the held tree is
 * never handed out, so the manifest is immutable.
 */
public final class DeploymentManifest {

    private final ObjectNode document;

    public DeploymentManifest(ObjectNode document) {
        this.document = Objects.requireNonNull(document, "document").deepCopy();
    }

    /** Deployment identifier (the only required field). */
    public String getPrefix() {
        return document.path("prefix").asText();
    }

    /** Copy of the validated document. */
    public ObjectNode getDocument() {
        return document.deepCopy();
    }

    /** True when the dotted path is present in the manifest (presence means override). */
    public boolean has(String dottedPath) {
        return get(dottedPath).isPresent();
    }

    /** Value at a dotted path; array indexes are segments. Returns a copy. */
    public Optional<JsonNode> get(String dottedPath) {
        JsonNode node = document.at("/" + dottedPath.replace('.', '/'));
        return node.isMissingNode() ? Optional.empty() : Optional.of(node.deepCopy());
    }

    /** The manifest read as a partial {@link SystemConfig}: absent groups and fields are null. */
    public SystemConfig asPartialConfig() {
        return SystemConfigJson.fromTree(document);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return document.equals(((DeploymentManifest) o).document);
    }

    @Override
    public int hashCode() {
        return document.hashCode();
    }

    @Override
    public String toString() {
        return "DeploymentManifest{prefix=" + getPrefix() + "}";
    }
}
