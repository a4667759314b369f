package com.cbd.manifest.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered field descriptors of one object plus the refinements that run once its fields have been
 * checked. Field order is the order errors are reported in.
 */
public final class ObjectSchema {

    private final Map<String, FieldSpec> fields;
    private final List<Refinement> refinements;

    private ObjectSchema(Map<String, FieldSpec> fields, List<Refinement> refinements) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.refinements = List.copyOf(refinements);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<FieldSpec> getFields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldSpec> getField(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public List<Refinement> getRefinements() {
        return refinements;
    }

    /**
     * Resolves a dotted path ({@code vpc.subnetIds}) through nested object schemas. Array
     * fields resolve to their element descriptor when the path continues past them.
     */
    public Optional<FieldSpec> find(String dottedPath) {
        ObjectSchema current = this;
        FieldSpec spec = null;
        for (String segment : dottedPath.split("\\.")) {
            if (current == null) return Optional.empty();
            spec = current.fields.get(segment);
            if (spec == null) return Optional.empty();
            FieldSpec container = spec.getKind() == FieldKind.ARRAY ? spec.getElement() : spec;
            current = container.getSchema();
        }
        return Optional.ofNullable(spec);
    }

    public static final class Builder {
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
        private final List<Refinement> refinements = new ArrayList<>();

        private Builder() {
        }

        public Builder field(FieldSpec.Builder spec) {
            return field(spec.build());
        }

        public Builder field(FieldSpec spec) {
            if (fields.putIfAbsent(spec.getName(), spec) != null) {
                throw new IllegalStateException("Duplicate field " + spec.getName());
            }
            return this;
        }

        public Builder refine(Refinement refinement) {
            refinements.add(refinement);
            return this;
        }

        public ObjectSchema build() {
            return new ObjectSchema(fields, refinements);
        }
    }
}
