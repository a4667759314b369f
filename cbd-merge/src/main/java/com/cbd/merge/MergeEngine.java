package com.cbd.merge;

import com.cbd.config.SystemConfig;
import com.cbd.config.SystemConfigJson;
import com.cbd.manifest.DeploymentManifest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a validated manifest to a base configuration.
 * <p>
 * The base is serialized to a fresh JSON tree, the manifest is walked over it and the result is
 * read back, so the base instance is never touched. Within each group scalar fields are applied
 * first, then nested groups, then lists, each pass in document order. How a field is applied
 * comes from the {@link MergePolicyTable}.
 */
public final class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final MergePolicyTable policies;

    public MergeEngine() {
        this(MergePolicyTable.standard());
    }

    public MergeEngine(MergePolicyTable policies) {
        this.policies = Objects.requireNonNull(policies, "policies");
    }

    /**
     * @throws IllegalStateException when the base or the override has a shape the policy cannot
     *                               apply (a defect, not an input error)
     */
    public MergeResult merge(SystemConfig base, DeploymentManifest manifest) {
        ObjectNode tree = SystemConfigJson.toTree(base);
        List<ChangeRecord> changes = new ArrayList<>();
        mergeGroup(tree, manifest.getDocument(), "", changes);
        SystemConfig merged = SystemConfigJson.fromTree(tree);
        log.info("Applied {} manifest override(s) for prefix={}", changes.size(), merged.getPrefix());
        return new MergeResult(merged, changes);
    }

    private void mergeGroup(ObjectNode target, ObjectNode override, String path, List<ChangeRecord> changes) {
        for (Pass pass : Pass.values()) {
            Iterator<Map.Entry<String, JsonNode>> fields = override.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (pass.accepts(field.getValue())) {
                    apply(target, field.getKey(), field.getValue(), child(path, field.getKey()), changes);
                }
            }
        }
    }

    private void apply(ObjectNode target, String name, JsonNode value, String path, List<ChangeRecord> changes) {
        MergePolicy policy = policies.policyFor(path, value);
        switch (policy) {
            case REPLACE_UNLESS_EMPTY:
                if (value.isTextual() && value.textValue().isEmpty()) {
                    log.debug("Keeping base value of {}: empty override", path);
                    return;
                }
                replace(target, name, value, path, changes);
                return;
            case REPLACE:
            case REPLACE_ATOMIC:
                replace(target, name, value, path, changes);
                return;
            case MERGE_FIELDS:
                if (!value.isObject()) {
                    throw new IllegalStateException("Cannot merge fields of " + path + ": override is "
                            + value.getNodeType());
                }
                mergeGroup(groupFor(target, name, path), (ObjectNode) value, path, changes);
                return;
            default:
                throw new IllegalStateException("Unhandled merge policy " + policy);
        }
    }

    private void replace(ObjectNode target, String name, JsonNode value, String path, List<ChangeRecord> changes) {
        ChangeRecord change = new ChangeRecord(path, target.get(name), value.deepCopy());
        log.info("  {}", change.format());
        target.set(name, value.deepCopy());
        changes.add(change);
    }

    private ObjectNode groupFor(ObjectNode target, String name, String path) {
        JsonNode existing = target.get(name);
        if (existing == null || existing.isNull()) {
            ObjectNode created = policies.seedFor(path).orElseGet(JsonNodeFactory.instance::objectNode);
            log.debug("Creating group {} absent from base configuration", path);
            target.set(name, created);
            return created;
        }
        if (!existing.isObject()) {
            throw new IllegalStateException("Cannot merge fields into " + path + ": base value is "
                    + existing.getNodeType());
        }
        return (ObjectNode) existing;
    }

    private static String child(String parent, String name) {
        return parent.isEmpty() ? name : parent + "." + name;
    }

    /** Traversal passes within one group. */
    private enum Pass {
        SCALARS, GROUPS, LISTS;

        boolean accepts(JsonNode value) {
            switch (this) {
                case GROUPS:
                    return value.isObject();
                case LISTS:
                    return value.isArray();
                default:
                    return !value.isContainerNode();
            }
        }
    }
}
