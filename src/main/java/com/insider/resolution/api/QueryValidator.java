package com.insider.resolution.api;

/**
 * Input validation for person-name queries.
 */
public final class QueryValidator {

    /** Maximum allowed length for a queried name. */
    public static final int MAX_QUERY_LENGTH = 500;

    private QueryValidator() {
        // utility class
    }

    /**
     * Rejects null, blank, overly long, or control-character-containing names.
     *
     * @throws InvalidQueryException if the name is invalid
     */
    public static void validateQuery(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidQueryException("Query name must not be null or blank");
        }
        if (name.length() > MAX_QUERY_LENGTH) {
            throw new InvalidQueryException(
                    "Query name exceeds maximum length of " + MAX_QUERY_LENGTH +
                            " characters (was " + name.length() + ")");
        }
        if (containsControlCharacters(name)) {
            throw new InvalidQueryException("Query name must not contain control characters");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
