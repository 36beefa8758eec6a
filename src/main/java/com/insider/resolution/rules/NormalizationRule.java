package com.insider.resolution.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to a raw person name before it is tokenized.
 * Rules run in priority order (lower number first) and match case-insensitively.
 *
 * @param name        identifier used in trace logging
 * @param pattern     compiled, case-insensitive pattern
 * @param replacement replacement text, may reference groups
 * @param priority    ordering key; ties keep declaration order
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * Rule that deletes every match.
     */
    public static NormalizationRule removing(String name, String regex, int priority) {
        return rewriting(name, regex, "", priority);
    }

    /**
     * Rule that replaces every match with {@code replacement}.
     */
    public static NormalizationRule rewriting(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
                replacement, priority);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + "[" + pattern.pattern() + " @" + priority + "]";
    }
}
