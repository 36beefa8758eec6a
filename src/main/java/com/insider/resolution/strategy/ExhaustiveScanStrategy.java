package com.insider.resolution.strategy;

import com.insider.resolution.concurrent.Deadline;
import com.insider.resolution.concurrent.MdcPropagatingExecutor;
import com.insider.resolution.core.model.CandidateMatch;
import com.insider.resolution.core.model.Entity;
import com.insider.resolution.core.model.EntityFetchError;
import com.insider.resolution.core.model.FetchErrorReason;
import com.insider.resolution.core.model.FilingEvidence;
import com.insider.resolution.core.model.NameVariant;
import com.insider.resolution.core.model.StrategyKind;
import com.insider.resolution.logging.LogContext;
import com.insider.resolution.metrics.MetricsService;
import com.insider.resolution.metrics.NoOpMetricsService;
import com.insider.resolution.ratelimit.RateBudget;
import com.insider.resolution.ratelimit.RateLimitTimeoutException;
import com.insider.resolution.similarity.MatchScorer;
import com.insider.resolution.source.EntityFilingClient;
import com.insider.resolution.source.EntityUniverse;
import com.insider.resolution.source.FilerRecord;
import com.insider.resolution.tracing.NoOpTracingService;
import com.insider.resolution.tracing.Span;
import com.insider.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Walks an entity universe with a bounded worker pool, fetching each entity's recent filers
 * and scoring them against the query variants.
 *
 * <p>A failing entity becomes an {@link EntityFetchError} and never aborts the scan. The scan
 * runs until every entity is done or the deadline passes; there is no early stop on a confident
 * match. At the deadline no new fetches start, in-flight fetches get the grace period, and
 * everything unfinished is cancelled and recorded as a timeout.</p>
 */
public class ExhaustiveScanStrategy {
    private static final Logger log = LoggerFactory.getLogger(ExhaustiveScanStrategy.class);

    private static final int PROGRESS_INTERVAL = 100;

    private final EntityFilingClient client;
    private final RateBudget rateBudget;
    private final MatchScorer scorer;
    private final MetricsService metrics;
    private final TracingService tracing;

    public ExhaustiveScanStrategy(EntityFilingClient client, RateBudget rateBudget, MatchScorer scorer) {
        this(client, rateBudget, scorer, new NoOpMetricsService(), new NoOpTracingService());
    }

    public ExhaustiveScanStrategy(EntityFilingClient client, RateBudget rateBudget, MatchScorer scorer,
                                  MetricsService metrics, TracingService tracing) {
        this.client = client;
        this.rateBudget = rateBudget;
        this.scorer = scorer;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    /**
     * Scans the universe.
     *
     * @param variants         query variants to score against
     * @param universe         entities to walk
     * @param concurrencyLimit maximum concurrent fetches
     * @param entityLimit      when present, only the top-N entities by size rank are scanned
     * @param deadline         after which no new fetch starts
     * @param gracePeriod      how long in-flight fetches may run past the deadline
     * @throws IOException if the universe itself cannot be read
     */
    public ScanResult scan(Collection<NameVariant> variants, EntityUniverse universe, int concurrencyLimit,
                           OptionalInt entityLimit, Deadline deadline, Duration gracePeriod) throws IOException {
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("concurrencyLimit must be > 0");
        }
        List<Entity> entities = distinct(entityLimit.isPresent()
                ? universe.top(entityLimit.getAsInt())
                : universe.entities());
        if (entities.isEmpty()) {
            return ScanResult.empty();
        }

        try (Span span = tracing.startSpan(TracingService.EXHAUSTIVE_SCAN)) {
            span.tag("entities", (long) entities.size());
            log.info("Exhaustive scan of {} entities with {} workers", entities.size(), concurrencyLimit);

            Scan scan = new Scan(variants, deadline, entities.size());
            ExecutorService pool = Executors.newFixedThreadPool(
                    Math.min(concurrencyLimit, entities.size()), new ScanThreadFactory());
            Map<Entity, Future<List<CandidateMatch>>> futures = new LinkedHashMap<>();
            try {
                for (Entity entity : entities) {
                    futures.put(entity, pool.submit(MdcPropagatingExecutor.wrap(() -> scan.fetchAndScore(entity))));
                }
                ScanResult result = collect(futures, deadline.extendedBy(gracePeriod), scan);
                span.tag("scanned", (long) result.entitiesScanned());
                span.tag("errors", (long) result.errors().size());
                span.succeed();
                metrics.recordEntitiesScanned(result.entitiesScanned());
                log.info("Exhaustive scan finished: {} scanned, {} errors, {} matches, deadlineExceeded={}",
                        result.entitiesScanned(), result.errors().size(), result.matches().size(),
                        result.deadlineExceeded());
                return result;
            } finally {
                pool.shutdownNow();
            }
        }
    }

    private ScanResult collect(Map<Entity, Future<List<CandidateMatch>>> futures, Deadline hardDeadline, Scan scan) {
        List<CandidateMatch> matches = new ArrayList<>();
        Map<String, EntityFetchError> errors = new TreeMap<>();
        int scanned = 0;
        boolean deadlineExceeded = false;
        boolean interrupted = false;

        for (Map.Entry<Entity, Future<List<CandidateMatch>>> entry : futures.entrySet()) {
            String entityId = entry.getKey().id();
            Future<List<CandidateMatch>> future = entry.getValue();
            try {
                List<CandidateMatch> found = interrupted
                        ? future.get(0, TimeUnit.NANOSECONDS)
                        : future.get(hardDeadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
                matches.addAll(found);
                scanned++;
            } catch (TimeoutException e) {
                future.cancel(true);
                deadlineExceeded = true;
                errors.put(entityId, EntityFetchError.timeout(entityId, "Not completed within deadline"));
            } catch (InterruptedException e) {
                interrupted = true;
                future.cancel(true);
                deadlineExceeded = true;
                errors.put(entityId, EntityFetchError.timeout(entityId, "Scan interrupted"));
            } catch (ExecutionException e) {
                EntityFetchError error = toFetchError(entityId, e.getCause());
                deadlineExceeded |= error.reason() == FetchErrorReason.TIMEOUT;
                errors.put(entityId, error);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        errors.values().forEach(error -> {
            metrics.incrementFetchError(error.reason());
            log.warn("Entity {} excluded from scan: {} ({})", error.entityId(), error.reason(), error.message());
        });
        matches.sort(Comparator.comparing(CandidateMatch::entityId).thenComparing(CandidateMatch::matchedName));
        return new ScanResult(matches, new ArrayList<>(errors.values()), scanned, deadlineExceeded);
    }

    private static EntityFetchError toFetchError(String entityId, Throwable cause) {
        if (cause instanceof DeadlineReachedException) {
            return EntityFetchError.timeout(entityId, cause.getMessage());
        }
        if (cause instanceof RateLimitTimeoutException) {
            return EntityFetchError.rateLimited(entityId, cause.getMessage());
        }
        String message = cause != null && cause.getMessage() != null
                ? cause.getMessage()
                : String.valueOf(cause);
        return EntityFetchError.failed(entityId, message);
    }

    private static List<Entity> distinct(List<Entity> entities) {
        Map<String, Entity> byId = new LinkedHashMap<>();
        entities.forEach(e -> byId.putIfAbsent(e.id(), e));
        return new ArrayList<>(byId.values());
    }

    /**
     * Per-scan state: score memo and progress counter.
     */
    private final class Scan {
        private final Collection<NameVariant> variants;
        private final Deadline deadline;
        private final int total;
        private final Map<String, Double> scoreMemo = new ConcurrentHashMap<>();
        private final AtomicInteger completed = new AtomicInteger();

        Scan(Collection<NameVariant> variants, Deadline deadline, int total) {
            this.variants = variants;
            this.deadline = deadline;
            this.total = total;
        }

        List<CandidateMatch> fetchAndScore(Entity entity) throws IOException, InterruptedException {
            if (deadline.isExpired()) {
                throw new DeadlineReachedException("Deadline reached before fetch started");
            }
            try (LogContext ignored = LogContext.forScan(entity.id())) {
                long waited = rateBudget.acquire(
                        deadline.remainingOrAtMost(rateBudget.getConfig().acquireTimeout()));
                metrics.recordRateLimitWait(Duration.ofNanos(waited));
                List<FilerRecord> filers = client.fetchRecentFilers(entity.id());
                List<CandidateMatch> matches = score(entity, filers);
                int done = completed.incrementAndGet();
                if (done % PROGRESS_INTERVAL == 0) {
                    log.info("Scan progress: {}/{} entities", done, total);
                }
                log.debug("Entity {}: {} filers, {} matches", entity.id(), filers.size(), matches.size());
                return matches;
            }
        }

        private List<CandidateMatch> score(Entity entity, List<FilerRecord> filers) {
            Map<String, List<FilerRecord>> byName = new TreeMap<>();
            for (FilerRecord filer : filers) {
                byName.computeIfAbsent(filer.filerName(), k -> new ArrayList<>()).add(filer);
            }
            List<CandidateMatch> matches = new ArrayList<>();
            byName.forEach((name, records) -> {
                double score = scoreMemo.computeIfAbsent(name, n -> scorer.score(variants, n));
                if (!scorer.isMatch(score)) {
                    return;
                }
                metrics.recordMatchScore(score);
                List<FilingEvidence> evidence = records.stream()
                        .map(r -> new FilingEvidence(r.accessionNumber(), r.filingDate(), r.filerName(),
                                StrategyKind.EXHAUSTIVE_SCAN))
                        .distinct()
                        .toList();
                matches.add(new CandidateMatch(entity, name, score, evidence, StrategyKind.EXHAUSTIVE_SCAN));
            });
            return matches;
        }
    }

    /**
     * Raised inside a worker when the deadline passed before its fetch could start.
     */
    static final class DeadlineReachedException extends RuntimeException {
        DeadlineReachedException(String message) {
            super(message);
        }
    }

    private static final class ScanThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();
        private final int pool = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger thread = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "insider-scan-" + pool + "-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
