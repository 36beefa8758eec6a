package com.insider.resolution.core.model;

import java.util.Objects;

/**
 * A comparable rendering of a queried person name, such as {@code "Klappa, Gale"} or
 * {@code "KLAPPA GALE E"}. Two variants are equal when their text is equal; the kind only
 * records which rule produced the text.
 */
public record NameVariant(String text, Kind kind) {

    public NameVariant {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(kind, "kind is required");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Variant text must not be blank");
        }
    }

    public static NameVariant of(String text, Kind kind) {
        return new NameVariant(text, kind);
    }

    /**
     * True for forms worth sending to a term-based search surface.
     */
    public boolean searchable() {
        return kind != Kind.NICKNAME;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NameVariant that)) return false;
        return text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }

    public enum Kind {
        /** "Gale Klappa" */
        FIRST_LAST,
        /** "Klappa, Gale" */
        LAST_COMMA_FIRST,
        /** "KLAPPA GALE E", the form most filings use */
        FILING_FORM,
        /** "Gale E Klappa" */
        FULL,
        /** A formal-name or nickname substitution of the first name */
        NICKNAME
    }
}
