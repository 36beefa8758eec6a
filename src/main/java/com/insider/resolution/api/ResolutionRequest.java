package com.insider.resolution.api;

/**
 * A batch resolution request.
 *
 * @param name    the person name to resolve
 * @param options optional resolution options (null for defaults)
 */
public record ResolutionRequest(String name, ResolutionOptions options) {

    /**
     * Creates a request with default options.
     */
    public static ResolutionRequest of(String name) {
        return new ResolutionRequest(name, null);
    }

    /**
     * Creates a request with custom options.
     */
    public static ResolutionRequest of(String name, ResolutionOptions options) {
        return new ResolutionRequest(name, options);
    }
}
