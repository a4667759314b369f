package com.cbd.manifest.schema;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Factories for the {@link Constraint}s used by the manifest rule table. */
public final class Constraints {

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private Constraints() {
    }

    public static Constraint minLength(int min, String message) {
        return v -> v.textValue().length() < min ? Optional.of(message) : Optional.empty();
    }

    public static Constraint maxLength(int max, String message) {
        return v -> v.textValue().length() > max ? Optional.of(message) : Optional.empty();
    }

    public static Constraint exactLength(int length, String message) {
        return v -> v.textValue().length() != length ? Optional.of(message) : Optional.empty();
    }

    /** Whole-string match against {@code regex}. */
    public static Constraint pattern(String regex, String message) {
        Pattern compiled = Pattern.compile(regex);
        return v -> compiled.matcher(v.textValue()).matches() ? Optional.empty() : Optional.of(message);
    }

    /** Enumeration; the message lists the accepted values and the one received. */
    public static Constraint oneOf(Collection<String> values) {
        Set<String> allowed = new LinkedHashSet<>(values);
        String expected = allowed.stream().map(s -> "'" + s + "'").collect(Collectors.joining(" | "));
        return v -> allowed.contains(v.textValue())
                ? Optional.empty()
                : Optional.of("Invalid enum value. Expected " + expected + ", received '" + v.textValue() + "'");
    }

    /** Enumeration with a fixed message (for long value sets). */
    public static Constraint oneOf(Collection<String> values, String message) {
        Set<String> allowed = Set.copyOf(values);
        return v -> allowed.contains(v.textValue()) ? Optional.empty() : Optional.of(message);
    }

    public static Constraint allowedIntegers(Collection<Integer> values, String message) {
        Set<Integer> allowed = Set.copyOf(values);
        return v -> v.canConvertToInt() && allowed.contains(v.intValue()) ? Optional.empty() : Optional.of(message);
    }

    public static Constraint minimum(long min, String message) {
        return v -> v.longValue() < min ? Optional.of(message) : Optional.empty();
    }

    public static Constraint positive(String message) {
        return v -> v.doubleValue() > 0 ? Optional.empty() : Optional.of(message);
    }

    public static Constraint minItems(int min, String message) {
        return v -> v.size() < min ? Optional.of(message) : Optional.empty();
    }

    /** Absolute URL with a scheme and a host. */
    public static Constraint url(String message) {
        return v -> {
            try {
                URI uri = new URI(v.textValue());
                return uri.getScheme() != null && uri.getHost() != null ? Optional.empty() : Optional.of(message);
            } catch (URISyntaxException e) {
                return Optional.of(message);
            }
        };
    }

    public static Constraint httpsOnly(String message) {
        return v -> v.textValue().startsWith("https://") ? Optional.empty() : Optional.of(message);
    }

    public static Constraint email(String message) {
        return v -> EMAIL.matcher(v.textValue()).matches() ? Optional.empty() : Optional.of(message);
    }
}
