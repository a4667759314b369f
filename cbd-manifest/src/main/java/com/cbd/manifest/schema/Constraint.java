package com.cbd.manifest.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * A single check on a value whose kind already matched. Returns the error message when the check
 * fails, empty otherwise.
 */
@FunctionalInterface
public interface Constraint {

    Optional<String> check(JsonNode value);
}
