package com.cbd.manifest.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.function.Predicate;

/**
 * Predicates over an object node for use in {@link Refinement}s. Paths are dotted and relative
 * to the object; a missing segment reads as absent.
 */
public final class Conditions {

    private Conditions() {
    }

    /** Value at a dotted relative path; a missing node when absent. */
    public static JsonNode valueAt(ObjectNode object, String path) {
        return object.at("/" + path.replace('.', '/'));
    }

    public static Predicate<ObjectNode> isTrue(String path) {
        return o -> valueAt(o, path).isBoolean() && valueAt(o, path).booleanValue();
    }

    /**
     * Set to something meaningful: {@code true}, a non-empty string, a non-zero number, a
     * non-empty array, or any object.
     */
    public static Predicate<ObjectNode> truthy(String path) {
        return o -> {
            JsonNode v = valueAt(o, path);
            if (v.isBoolean()) return v.booleanValue();
            if (v.isTextual()) return !v.textValue().isEmpty();
            if (v.isNumber()) return v.doubleValue() != 0;
            if (v.isArray()) return v.size() > 0;
            return v.isObject();
        };
    }

    public static Predicate<ObjectNode> textEquals(String path, String expected) {
        return o -> expected.equals(valueAt(o, path).textValue());
    }

    public static Predicate<ObjectNode> nonEmptyArray(String path) {
        return o -> valueAt(o, path).isArray() && valueAt(o, path).size() > 0;
    }

    @SafeVarargs
    public static Predicate<ObjectNode> allOf(Predicate<ObjectNode>... conditions) {
        return o -> Arrays.stream(conditions).allMatch(c -> c.test(o));
    }

    @SafeVarargs
    public static Predicate<ObjectNode> anyOf(Predicate<ObjectNode>... conditions) {
        return o -> Arrays.stream(conditions).anyMatch(c -> c.test(o));
    }

    public static Predicate<ObjectNode> not(Predicate<ObjectNode> condition) {
        return condition.negate();
    }
}
