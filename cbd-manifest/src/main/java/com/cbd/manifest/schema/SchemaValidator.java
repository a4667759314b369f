package com.cbd.manifest.schema;

import com.cbd.manifest.DeploymentManifest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a parsed manifest against an {@link ObjectSchema}.
 * <p>
 * Every violation is collected before returning. Fields are checked in schema order, string
 * constraints all run (not only the first), and each object's refinements run after its fields.
 * A refinement is skipped when one of the fields it references failed its kind check. Fields the
 * schema does not know are dropped from the validated document with a warning. Defaults are
 * appended after the fields present in the document.
 */
public final class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private final ObjectSchema rootSchema;

    public SchemaValidator(ObjectSchema rootSchema) {
        this.rootSchema = Objects.requireNonNull(rootSchema, "rootSchema");
    }

    /** Validator for the deployment manifest rule table. */
    public static SchemaValidator forManifests() {
        return new SchemaValidator(ManifestSchema.ROOT);
    }

    /**
     * @param raw parsed document; a missing node (empty file) or non-object fails at the root
     */
    public ValidationResult validate(JsonNode raw) {
        Run run = new Run();
        if (raw == null || raw.isMissingNode()) {
            return ValidationResult.failure(List.of(new FieldError("", "Required")));
        }
        if (!raw.isObject()) {
            return ValidationResult.failure(List.of(new FieldError("",
                    "Expected object, received " + FieldKind.describe(raw))));
        }
        ObjectNode validated = run.object(rootSchema, (ObjectNode) raw, "");
        if (!run.errors.isEmpty()) {
            log.debug("Manifest validation found {} error(s)", run.errors.size());
            return ValidationResult.failure(run.errors);
        }
        return ValidationResult.success(new DeploymentManifest(validated));
    }

    private static String child(String parent, String name) {
        if (name.isEmpty()) return parent;
        return parent.isEmpty() ? name : parent + "." + name;
    }

    /** State of one validation call. */
    private static final class Run {
        private final List<FieldError> errors = new ArrayList<>();
        private final Set<String> kindFailures = new HashSet<>();

        ObjectNode object(ObjectSchema schema, ObjectNode node, String path) {
            Map<String, JsonNode> checked = new LinkedHashMap<>();
            Map<String, JsonNode> defaults = new LinkedHashMap<>();
            for (FieldSpec spec : schema.getFields()) {
                String fieldPath = child(path, spec.getName());
                JsonNode value = node.get(spec.getName());
                if (value == null) {
                    if (spec.isRequired()) {
                        errors.add(new FieldError(fieldPath, "Required"));
                        kindFailures.add(fieldPath);
                    } else if (spec.getDefaultValue() != null) {
                        defaults.put(spec.getName(), spec.getDefaultValue().deepCopy());
                    }
                    continue;
                }
                field(spec, value, fieldPath).ifPresent(v -> checked.put(spec.getName(), v));
            }

            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (schema.getField(name).isEmpty()) {
                    log.warn("Ignoring unknown manifest field {}", child(path, name));
                } else if (checked.containsKey(name)) {
                    out.set(name, checked.get(name));
                }
            }
            defaults.forEach(out::set);

            for (Refinement refinement : schema.getRefinements()) {
                if (referencesKindFailure(refinement, path)) {
                    log.debug("Skipping {} at {}: a referenced field has the wrong kind", refinement, path);
                    continue;
                }
                if (refinement.isViolatedBy(node)) {
                    errors.add(new FieldError(child(path, refinement.getReportAt()), refinement.getMessage()));
                }
            }
            return out;
        }

        Optional<JsonNode> field(FieldSpec spec, JsonNode value, String path) {
            if (!spec.getKind().matches(value)) {
                errors.add(new FieldError(path,
                        "Expected " + spec.getKind().label() + ", received " + FieldKind.describe(value)));
                kindFailures.add(path);
                return Optional.empty();
            }
            if (spec.getKind() == FieldKind.INTEGER && !value.canConvertToInt()) {
                // the configuration model binds integers as int
                errors.add(new FieldError(path, value.bigIntegerValue().signum() > 0
                        ? "Number must be less than or equal to " + Integer.MAX_VALUE
                        : "Number must be greater than or equal to " + Integer.MIN_VALUE));
                kindFailures.add(path);
                return Optional.empty();
            }
            if (spec.isAllowEmptyString() && value.textValue().isEmpty()) {
                return Optional.of(value);
            }
            for (Constraint constraint : spec.getConstraints()) {
                constraint.check(value).ifPresent(message -> errors.add(new FieldError(path, message)));
            }
            switch (spec.getKind()) {
                case OBJECT:
                    return Optional.of(object(spec.getSchema(), (ObjectNode) value, path));
                case ARRAY:
                    ArrayNode items = JsonNodeFactory.instance.arrayNode();
                    for (int i = 0; i < value.size(); i++) {
                        field(spec.getElement(), value.get(i), path + "." + i).ifPresent(items::add);
                    }
                    return Optional.of(items);
                default:
                    return Optional.of(value);
            }
        }

        private boolean referencesKindFailure(Refinement refinement, String objectPath) {
            for (String reference : refinement.getReferences()) {
                String absolute = child(objectPath, reference);
                for (String failed : kindFailures) {
                    if (failed.equals(absolute) || failed.startsWith(absolute + ".")
                            || absolute.startsWith(failed + ".")) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
