package com.insider.resolution.api;

import com.insider.resolution.core.model.ResolvedIdentity;
import com.insider.resolution.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-pool implementation of {@link AsyncInsiderResolver}. Caller MDC entries are carried
 * into the worker threads; a batch is tagged with a {@code batchId} unless the caller already
 * set one. Each future times out a little after the resolution deadline plus grace period,
 * since the resolution itself honors both.
 */
public class AsyncInsiderResolverImpl implements AsyncInsiderResolver {
    private static final Logger log = LoggerFactory.getLogger(AsyncInsiderResolverImpl.class);

    private static final int DEFAULT_THREADS = 4;
    private static final Duration TIMEOUT_SLACK = Duration.ofSeconds(5);

    private final InsiderResolver resolver;
    private final ResolutionOptions defaultOptions;
    private final ExecutorService pool;
    private final Executor executor;

    public AsyncInsiderResolverImpl(InsiderResolver resolver, ResolutionOptions defaultOptions) {
        this(resolver, defaultOptions, DEFAULT_THREADS);
    }

    public AsyncInsiderResolverImpl(InsiderResolver resolver, ResolutionOptions defaultOptions, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        this.resolver = resolver;
        this.defaultOptions = defaultOptions;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "insider-async-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.executor = LogContext.propagating(pool);
    }

    @Override
    public CompletableFuture<ResolvedIdentity> resolveAsync(String name) {
        return resolveAsync(name, defaultOptions);
    }

    @Override
    public CompletableFuture<ResolvedIdentity> resolveAsync(String name, ResolutionOptions options) {
        ResolutionOptions opts = options != null ? options : defaultOptions;
        return CompletableFuture.supplyAsync(() -> resolver.resolveIdentity(name, opts), executor)
                .orTimeout(timeoutMs(opts), TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<List<ResolvedIdentity>> resolveBatchAsync(List<ResolutionRequest> requests) {
        try (LogContext ignored = batchContext()) {
            List<CompletableFuture<ResolvedIdentity>> futures = requests.stream()
                    .map(req -> resolveAsync(req.name(), req.options()))
                    .toList();
            log.debug("Submitted batch of {} resolutions", requests.size());
            return allOf(futures);
        }
    }

    @Override
    public CompletableFuture<List<ResolvedIdentity>> resolveBatchAsync(List<ResolutionRequest> requests,
                                                                       int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }

        Semaphore semaphore = new Semaphore(maxConcurrency);

        try (LogContext ignored = batchContext()) {
            List<CompletableFuture<ResolvedIdentity>> futures = requests.stream()
                    .map(req -> {
                        ResolutionOptions opts = req.options() != null ? req.options() : defaultOptions;
                        return CompletableFuture.supplyAsync(() -> {
                            try {
                                semaphore.acquire();
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                throw new CompletionException(e);
                            }
                            try {
                                return resolver.resolveIdentity(req.name(), opts);
                            } finally {
                                semaphore.release();
                            }
                        }, executor);
                    })
                    .toList();
            log.debug("Submitted batch of {} resolutions, maxConcurrency={}", requests.size(), maxConcurrency);
            return allOf(futures);
        }
    }

    private static LogContext batchContext() {
        String batchId = MDC.get(LogContext.BATCH_ID);
        return LogContext.forBatch(batchId != null ? batchId : LogContext.generateCorrelationId());
    }

    private static CompletableFuture<List<ResolvedIdentity>> allOf(List<CompletableFuture<ResolvedIdentity>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    static long timeoutMs(ResolutionOptions options) {
        try {
            return options.getDeadline().plus(options.getGracePeriod()).plus(TIMEOUT_SLACK).toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
