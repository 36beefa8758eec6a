package com.insider.resolution.strategy;

/**
 * Checked exception raised when the indexed search surface cannot answer.
 * Recovered by falling back to the exhaustive scan.
 */
public class SearchUnavailableException extends Exception {

    public SearchUnavailableException(String message) {
        super(message);
    }

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
