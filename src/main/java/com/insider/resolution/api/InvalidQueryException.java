package com.insider.resolution.api;

/**
 * Thrown when a query cannot be resolved at all: null, blank, too long, containing control
 * characters, or leaving no name once titles and punctuation are removed.
 */
public class InvalidQueryException extends IllegalArgumentException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
