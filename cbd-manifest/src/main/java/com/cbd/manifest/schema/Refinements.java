package com.cbd.manifest.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import static com.cbd.manifest.schema.Conditions.allOf;
import static com.cbd.manifest.schema.Conditions.anyOf;
import static com.cbd.manifest.schema.Conditions.isTrue;
import static com.cbd.manifest.schema.Conditions.nonEmptyArray;
import static com.cbd.manifest.schema.Conditions.textEquals;
import static com.cbd.manifest.schema.Conditions.truthy;

/** The recurring shapes of cross-field rule. */
public final class Refinements {

    private Refinements() {
    }

    /**
     * A non-empty {@code list} requires {@code companion}. The reverse is not required.
     * Reported at the companion.
     */
    public static Refinement companionPair(String list, String companion, String message) {
        return Refinement.named("companion-pair:" + list + "->" + companion)
                .references(list, companion)
                .when(nonEmptyArray(list))
                .require(truthy(companion))
                .reportAt(companion)
                .message(message)
                .build();
    }

    /** Exactly one of the two fields is set. Reported at the enclosing object. */
    public static Refinement exactlyOneOf(String first, String second, String message) {
        Predicate<ObjectNode> a = truthy(first);
        Predicate<ObjectNode> b = truthy(second);
        return Refinement.named("exactly-one-of:" + first + "|" + second)
                .references(first, second)
                .require(o -> a.test(o) != b.test(o))
                .message(message)
                .build();
    }

    /**
     * When {@code gate} is true and {@code discriminant} equals {@code value}, every path in
     * {@code required} must be set. Reported at {@code reportAt}.
     */
    public static Refinement requiredByDiscriminant(String gate, String discriminant, String value,
                                                    String reportAt, String message, String... required) {
        List<String> refs = new ArrayList<>(List.of(gate, discriminant));
        refs.addAll(Arrays.asList(required));
        return Refinement.named("required-by:" + discriminant + "=" + value)
                .references(refs.toArray(new String[0]))
                .when(allOf(isTrue(gate), textEquals(discriminant, value)))
                .require(o -> Arrays.stream(required).allMatch(p -> truthy(p).test(o)))
                .reportAt(reportAt)
                .message(message)
                .build();
    }

    /** {@code flag: true} requires {@code leaf}. Reported at the leaf. */
    public static Refinement featureGate(String flag, String leaf, String message) {
        return Refinement.named("feature-gate:" + flag + "->" + leaf)
                .references(flag, leaf)
                .when(isTrue(flag))
                .require(truthy(leaf))
                .reportAt(leaf)
                .message(message)
                .build();
    }

    /** {@code umbrella: true} requires at least one of the toggles to be true. */
    public static Refinement anyActive(String umbrella, String reportAt, String message, String... toggles) {
        List<String> refs = new ArrayList<>(List.of(umbrella));
        refs.addAll(Arrays.asList(toggles));
        @SuppressWarnings("unchecked")
        Predicate<ObjectNode>[] active = Arrays.stream(toggles).map(Conditions::isTrue).toArray(Predicate[]::new);
        return Refinement.named("any-active:" + umbrella)
                .references(refs.toArray(new String[0]))
                .when(isTrue(umbrella))
                .require(anyOf(active))
                .reportAt(reportAt)
                .message(message)
                .build();
    }
}
