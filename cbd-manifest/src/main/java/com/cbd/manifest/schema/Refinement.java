package com.cbd.manifest.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Cross-field rule attached to an {@link ObjectSchema}. It is violated when {@code when} holds
 * and {@code require} does not. Paths ({@link #getReferences()}, {@link #getReportAt()}) are
 * relative to the object the rule is attached to; an empty report path means the object itself.
 */
public final class Refinement {

    private final String name;
    private final List<String> references;
    private final Predicate<ObjectNode> when;
    private final Predicate<ObjectNode> require;
    private final String reportAt;
    private final String message;

    private Refinement(Builder b) {
        this.name = b.name;
        this.references = List.copyOf(b.references);
        this.when = b.when;
        this.require = Objects.requireNonNull(b.require, "require");
        this.reportAt = b.reportAt;
        this.message = Objects.requireNonNull(b.message, "message");
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /** Fields the rule reads; the rule is skipped when one of them failed its kind check. */
    public List<String> getReferences() {
        return references;
    }

    public String getReportAt() {
        return reportAt;
    }

    public String getMessage() {
        return message;
    }

    public boolean isViolatedBy(ObjectNode object) {
        return when.test(object) && !require.test(object);
    }

    @Override
    public String toString() {
        return "Refinement{" + name + "}";
    }

    public static final class Builder {
        private final String name;
        private List<String> references = List.of();
        private Predicate<ObjectNode> when = o -> true;
        private Predicate<ObjectNode> require;
        private String reportAt = "";
        private String message;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder references(String... paths) {
            this.references = Arrays.asList(paths);
            return this;
        }

        public Builder when(Predicate<ObjectNode> condition) {
            this.when = Objects.requireNonNull(condition, "condition");
            return this;
        }

        public Builder require(Predicate<ObjectNode> condition) {
            this.require = Objects.requireNonNull(condition, "condition");
            return this;
        }

        public Builder reportAt(String path) {
            this.reportAt = Objects.requireNonNull(path, "path");
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Refinement build() {
            return new Refinement(this);
        }
    }
}
