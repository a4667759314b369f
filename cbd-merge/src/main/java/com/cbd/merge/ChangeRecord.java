package com.cbd.merge;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One overridden field. {@code previous} is null when the base had no value at {@code path}.
 * Values are copied in and out, so a record cannot change after the merge.
 */
public record ChangeRecord(String path, JsonNode previous, JsonNode current) {

    public ChangeRecord {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(current, "current");
        previous = previous != null ? previous.deepCopy() : null;
        current = current.deepCopy();
    }

    @Override
    public JsonNode previous() {
        return previous != null ? previous.deepCopy() : null;
    }

    @Override
    public JsonNode current() {
        return current.deepCopy();
    }

    public boolean isAddition() {
        return previous == null;
    }

    /** Change log line: {@code path: old → new}. */
    public String format() {
        return path + ": " + formatValue(previous) + " → " + formatValue(current);
    }

    static String formatValue(JsonNode value) {
        if (value == null || value.isMissingNode()) return "undefined";
        if (value.isNull()) return "null";
        if (value.isContainerNode()) return value.toString();
        return value.asText();
    }
}
