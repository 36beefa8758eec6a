package com.insider.resolution.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A person name split into its parts, all lowercase. {@code first} is {@code null}
 * when the name had a single token.
 */
public record ParsedName(String first, List<String> middles, String last) {

    public ParsedName {
        Objects.requireNonNull(last, "last is required");
        middles = middles != null ? List.copyOf(middles) : List.of();
    }

    public boolean hasFirst() {
        return first != null;
    }

    public boolean hasMiddles() {
        return !middles.isEmpty();
    }

    public List<String> middleInitials() {
        return middles.stream().map(m -> m.substring(0, 1)).toList();
    }

    /**
     * "first middle last", lowercase, single-spaced.
     */
    public String canonical() {
        List<String> parts = new ArrayList<>();
        if (first != null) {
            parts.add(first);
        }
        parts.addAll(middles);
        parts.add(last);
        return String.join(" ", parts);
    }
}
