package com.cbd.manifest.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Descriptor of one manifest field: name, kind, optionality, constraints, default, and the nested
 * schema (objects) or element descriptor (arrays). Immutable; built with the static factories.
 */
public final class FieldSpec {

    static final String ITEM = "*";

    private final String name;
    private final FieldKind kind;
    private final boolean required;
    private final boolean allowEmptyString;
    private final List<Constraint> constraints;
    private final JsonNode defaultValue;
    private final ObjectSchema schema;
    private final FieldSpec element;

    private FieldSpec(Builder b) {
        this.name = b.name;
        this.kind = b.kind;
        this.required = b.required;
        this.allowEmptyString = b.allowEmptyString;
        this.constraints = List.copyOf(b.constraints);
        this.defaultValue = b.defaultValue;
        this.schema = b.schema;
        this.element = b.element;
    }

    public static Builder string(String name) {
        return new Builder(name, FieldKind.STRING);
    }

    public static Builder bool(String name) {
        return new Builder(name, FieldKind.BOOLEAN);
    }

    public static Builder integer(String name) {
        return new Builder(name, FieldKind.INTEGER);
    }

    public static Builder object(String name, ObjectSchema schema) {
        Builder b = new Builder(name, FieldKind.OBJECT);
        b.schema = Objects.requireNonNull(schema, "schema");
        return b;
    }

    public static Builder array(String name, FieldSpec element) {
        Builder b = new Builder(name, FieldKind.ARRAY);
        b.element = Objects.requireNonNull(element, "element");
        return b;
    }

    /** Element descriptor for an array of strings. */
    public static Builder stringItem() {
        return string(ITEM);
    }

    /** Element descriptor for an array of objects. */
    public static Builder objectItem(ObjectSchema schema) {
        return object(ITEM, schema);
    }

    public String getName() {
        return name;
    }

    public FieldKind getKind() {
        return kind;
    }

    public boolean isRequired() {
        return required;
    }

    /** When true the literal {@code ""} is accepted and skips every constraint. */
    public boolean isAllowEmptyString() {
        return allowEmptyString;
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    /** Value filled in when the field is absent; null when the field has no default. */
    public JsonNode getDefaultValue() {
        return defaultValue;
    }

    /** Nested schema for {@link FieldKind#OBJECT}; null otherwise. */
    public ObjectSchema getSchema() {
        return schema;
    }

    /** Element descriptor for {@link FieldKind#ARRAY}; null otherwise. */
    public FieldSpec getElement() {
        return element;
    }

    @Override
    public String toString() {
        return "FieldSpec{" + name + ":" + kind.label() + (required ? ", required" : "") + "}";
    }

    public static final class Builder {
        private final String name;
        private final FieldKind kind;
        private boolean required;
        private boolean allowEmptyString;
        private final List<Constraint> constraints = new ArrayList<>();
        private JsonNode defaultValue;
        private ObjectSchema schema;
        private FieldSpec element;

        private Builder(String name, FieldKind kind) {
            this.name = Objects.requireNonNull(name, "name");
            this.kind = kind;
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder allowEmptyString() {
            if (kind != FieldKind.STRING) {
                throw new IllegalStateException("allowEmptyString applies to string fields only: " + name);
            }
            this.allowEmptyString = true;
            return this;
        }

        public Builder check(Constraint... checks) {
            constraints.addAll(Arrays.asList(checks));
            return this;
        }

        public Builder defaultValue(String value) {
            this.defaultValue = JsonNodeFactory.instance.textNode(value);
            return this;
        }

        public Builder defaultValue(boolean value) {
            this.defaultValue = JsonNodeFactory.instance.booleanNode(value);
            return this;
        }

        public FieldSpec build() {
            if (required && defaultValue != null) {
                throw new IllegalStateException("A required field cannot have a default: " + name);
            }
            return new FieldSpec(this);
        }
    }
}
