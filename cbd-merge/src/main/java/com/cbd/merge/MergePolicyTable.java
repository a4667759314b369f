package com.cbd.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Merge policy per dotted configuration path. Paths without an entry get the default for the
 * override value's node type: {@link MergePolicy#MERGE_FIELDS} for objects, {@link MergePolicy#REPLACE}
 * otherwise. Also holds the seed used when a merged group is missing from the base.
 */
public final class MergePolicyTable {

    private final Map<String, MergePolicy> policies;
    private final Map<String, ObjectNode> seeds;

    private MergePolicyTable(Map<String, MergePolicy> policies, Map<String, ObjectNode> seeds) {
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
        this.seeds = Collections.unmodifiableMap(new LinkedHashMap<>(seeds));
    }

    /**
     * Policies of the deployment configuration: {@code pipeline} is replaced atomically, the log
     * bucket and Bedrock role fields ignore an empty override, and a created
     * {@code bedrock.guardrails} starts disabled with empty identifier and version.
     */
    public static MergePolicyTable standard() {
        ObjectNode guardrails = JsonNodeFactory.instance.objectNode()
                .put("enabled", false)
                .put("identifier", "")
                .put("version", "");
        return builder()
                .policy("pipeline", MergePolicy.REPLACE_ATOMIC)
                .policy("logArchiveBucketName", MergePolicy.REPLACE_UNLESS_EMPTY)
                .policy("cloudfrontLogBucketArn", MergePolicy.REPLACE_UNLESS_EMPTY)
                .policy("bedrock.roleArn", MergePolicy.REPLACE_UNLESS_EMPTY)
                .seed("bedrock.guardrails", guardrails)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public MergePolicy policyFor(String path, JsonNode overrideValue) {
        MergePolicy explicit = policies.get(path);
        if (explicit != null) return explicit;
        return overrideValue.isObject() ? MergePolicy.MERGE_FIELDS : MergePolicy.REPLACE;
    }

    /** Fresh copy of the seed for a group created at {@code path}, if one is registered. */
    public Optional<ObjectNode> seedFor(String path) {
        ObjectNode seed = seeds.get(path);
        return seed == null ? Optional.empty() : Optional.of(seed.deepCopy());
    }

    public Map<String, MergePolicy> getPolicies() {
        return policies;
    }

    public static final class Builder {
        private final Map<String, MergePolicy> policies = new LinkedHashMap<>();
        private final Map<String, ObjectNode> seeds = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder policy(String path, MergePolicy policy) {
            policies.put(Objects.requireNonNull(path, "path"), Objects.requireNonNull(policy, "policy"));
            return this;
        }

        public Builder seed(String path, ObjectNode seed) {
            seeds.put(Objects.requireNonNull(path, "path"), seed.deepCopy());
            return this;
        }

        public MergePolicyTable build() {
            return new MergePolicyTable(policies, seeds);
        }
    }
}
