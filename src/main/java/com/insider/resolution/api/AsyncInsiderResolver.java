package com.insider.resolution.api;

import com.insider.resolution.core.model.ResolvedIdentity;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Async interface for insider resolution.
 * All methods return {@link CompletableFuture} for non-blocking operation.
 */
public interface AsyncInsiderResolver extends AutoCloseable {

    /**
     * Asynchronously resolves a name with the resolver's default options.
     */
    CompletableFuture<ResolvedIdentity> resolveAsync(String name);

    /**
     * Asynchronously resolves a name with custom options.
     */
    CompletableFuture<ResolvedIdentity> resolveAsync(String name, ResolutionOptions options);

    /**
     * Resolves a batch of requests in parallel. Results are in request order.
     */
    CompletableFuture<List<ResolvedIdentity>> resolveBatchAsync(List<ResolutionRequest> requests);

    /**
     * Resolves a batch of requests with bounded concurrency.
     *
     * @param requests       the resolution requests
     * @param maxConcurrency maximum number of concurrent resolutions
     */
    CompletableFuture<List<ResolvedIdentity>> resolveBatchAsync(List<ResolutionRequest> requests,
                                                                int maxConcurrency);

    @Override
    void close();
}
