package com.insider.resolution.api;

import com.insider.resolution.cache.CacheKeys;
import com.insider.resolution.cache.IdentityCache;
import com.insider.resolution.concurrent.Deadline;
import com.insider.resolution.core.model.Affiliation;
import com.insider.resolution.core.model.AffiliationStatus;
import com.insider.resolution.core.model.AttemptStatus;
import com.insider.resolution.core.model.CandidateMatch;
import com.insider.resolution.core.model.EntityFetchError;
import com.insider.resolution.core.model.NameVariant;
import com.insider.resolution.core.model.ResolutionDiagnostics;
import com.insider.resolution.core.model.ResolutionOutcome;
import com.insider.resolution.core.model.ResolvedIdentity;
import com.insider.resolution.core.model.StrategyAttempt;
import com.insider.resolution.core.model.StrategyKind;
import com.insider.resolution.logging.LogContext;
import com.insider.resolution.metrics.MetricsService;
import com.insider.resolution.ratelimit.NanoClock;
import com.insider.resolution.rules.NameNormalizer;
import com.insider.resolution.strategy.ExhaustiveScanStrategy;
import com.insider.resolution.strategy.IndexedSearchResult;
import com.insider.resolution.strategy.IndexedSearchStrategy;
import com.insider.resolution.strategy.ScanResult;
import com.insider.resolution.strategy.SearchUnavailableException;
import com.insider.resolution.source.EntityUniverse;
import com.insider.resolution.tracing.Span;
import com.insider.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Coordinates one resolution from cache check to cache store:
 * <pre>
 * IDLE → CACHE_CHECK → (HIT_RETURN | NORMALIZE) → TRY_INDEXED → (AGGREGATE | TRY_EXHAUSTIVE)
 *      → AGGREGATE → CACHE_STORE → DONE
 * </pre>
 *
 * <p>The indexed search is preferred; the exhaustive scan runs when it is unavailable, or
 * when it found nothing and fallback-on-empty is set. Strategy failures end up in the
 * diagnostics of a normal result. The only exception callers see is
 * {@link InvalidQueryException}.</p>
 *
 * <p>Identical queries with equal options that arrive while one is in flight share its result.
 * The cached value always holds every affiliation found. Statuses are re-judged against the
 * caller's windows and today's date, then the include-former and minimum-filings filters are
 * applied, per caller. A cached value produced by a narrower search (an entity limit, or no
 * fallback after an empty index answer) is not served to a caller asking for more.</p>
 */
public class ResolutionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ResolutionOrchestrator.class);

    private final NameNormalizer normalizer;
    private final IndexedSearchStrategy indexedSearch;
    private final ExhaustiveScanStrategy exhaustiveScan;
    private final EntityUniverse universe;
    private final IdentityCache cache;
    private final AffiliationAggregator aggregator;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;
    private final NanoClock nanoClock;

    private final Map<InFlightKey, CompletableFuture<ResolvedIdentity>> inFlight = new ConcurrentHashMap<>();

    /**
     * @param indexedSearch  may be {@code null} when no indexed surface is configured
     * @param exhaustiveScan may be {@code null} when no per-entity client is configured
     * @param universe       may be {@code null} together with {@code exhaustiveScan}
     */
    public ResolutionOrchestrator(NameNormalizer normalizer,
                                  IndexedSearchStrategy indexedSearch,
                                  ExhaustiveScanStrategy exhaustiveScan,
                                  EntityUniverse universe,
                                  IdentityCache cache,
                                  AffiliationAggregator aggregator,
                                  MetricsService metrics,
                                  TracingService tracing,
                                  Clock clock,
                                  NanoClock nanoClock) {
        this.normalizer = normalizer;
        this.indexedSearch = indexedSearch;
        this.exhaustiveScan = exhaustiveScan;
        this.universe = universe;
        this.cache = cache;
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
        this.nanoClock = nanoClock;
    }

    /**
     * Resolves a name to an identity and its affiliations.
     *
     * @throws InvalidQueryException if the name is unusable
     */
    public ResolvedIdentity resolve(String query, ResolutionOptions options) {
        QueryValidator.validateQuery(query);
        ResolutionOptions effective = options != null ? options : ResolutionOptions.defaults();
        String key = CacheKeys.canonicalize(query);

        ResolvedIdentity complete = resolveShared(new InFlightKey(key, effective), query);
        return applyViewFilters(complete, effective);
    }

    private ResolvedIdentity resolveShared(InFlightKey key, String query) {
        CompletableFuture<ResolvedIdentity> mine = new CompletableFuture<>();
        CompletableFuture<ResolvedIdentity> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("Joining in-flight resolution for '{}'", key.cacheKey());
            return await(existing);
        }
        try {
            ResolvedIdentity result = doResolve(query, key.cacheKey(), key.options());
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private static ResolvedIdentity await(CompletableFuture<ResolvedIdentity> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for in-flight resolution", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new CompletionException(e.getCause());
        }
    }

    private ResolvedIdentity doResolve(String query, String cacheKey, ResolutionOptions options) {
        long start = nanoClock.nanoTime();
        try (LogContext ignored = LogContext.forResolution(LogContext.generateCorrelationId(), cacheKey);
             Span span = tracing.startSpan(TracingService.RESOLVE, Map.of("query", cacheKey))) {

            ResolutionState state = transition(ResolutionState.IDLE, ResolutionState.CACHE_CHECK);
            ResolvedIdentity cached = readCache(cacheKey);
            if (cached != null && !coversRequest(cached, options)) {
                log.debug("Cached result for '{}' came from a narrower search, resolving again", cacheKey);
                cached = null;
            }
            if (cached != null) {
                transition(state, ResolutionState.HIT_RETURN);
                metrics.recordCacheHit();
                ResolvedIdentity hit = cached.withDiagnostics(cached.diagnostics().asCacheHit());
                metrics.recordResolutionDuration(hit.outcome(), true, elapsed(start));
                span.tag("cacheHit", "true");
                span.succeed();
                log.info("Resolved '{}' from cache: {} with {} affiliations",
                        query, hit.outcome(), hit.affiliations().size());
                return hit;
            }
            metrics.recordCacheMiss();

            state = transition(state, ResolutionState.NORMALIZE);
            Set<NameVariant> variants = normalizer.normalize(query);
            if (variants.isEmpty()) {
                InvalidQueryException invalid = new InvalidQueryException("No usable name in query '" + query + "'");
                span.fail(invalid);
                throw invalid;
            }
            span.tag("variants", (long) variants.size());
            log.info("Resolving '{}' with {} variants", query, variants.size());

            Deadline deadline = Deadline.after(options.getDeadline(), nanoClock);
            Attempts attempts = new Attempts();

            state = transition(state, ResolutionState.TRY_INDEXED);
            boolean needExhaustive = tryIndexed(variants, deadline, options, attempts, span);

            if (needExhaustive) {
                state = transition(state, ResolutionState.TRY_EXHAUSTIVE);
                tryExhaustive(variants, deadline, options, attempts);
            }

            state = transition(state, ResolutionState.AGGREGATE);
            ResolvedIdentity identity = aggregate(query, variants, options, attempts);

            state = transition(state, ResolutionState.CACHE_STORE);
            writeCache(cacheKey, identity);

            transition(state, ResolutionState.DONE);
            identity.diagnostics().strategiesAttempted()
                    .forEach(a -> metrics.incrementStrategyAttempt(a.strategy(), a.status()));
            metrics.recordResolutionDuration(identity.outcome(), false, elapsed(start));
            span.tag("affiliations", (long) identity.affiliations().size());
            span.tag("confidence", identity.confidence());
            span.succeed();
            log.info("Resolved '{}': {} with {} affiliations (partialCoverage={})", query, identity.outcome(),
                    identity.affiliations().size(), identity.diagnostics().partialCoverage());
            return identity;
        }
    }

    /**
     * @return whether the exhaustive scan should run
     */
    private boolean tryIndexed(Set<NameVariant> variants, Deadline deadline, ResolutionOptions options,
                               Attempts attempts, Span span) {
        if (indexedSearch == null || !options.isUseIndexedSearch()) {
            log.debug("Indexed search skipped (configured={}, enabled={})",
                    indexedSearch != null, options.isUseIndexedSearch());
            return true;
        }
        try {
            IndexedSearchResult result = indexedSearch.searchDetailed(variants, deadline);
            attempts.matches.addAll(result.matches());
            AttemptStatus status = result.partial()
                    ? AttemptStatus.PARTIAL
                    : result.matches().isEmpty() ? AttemptStatus.EMPTY : AttemptStatus.SUCCEEDED;
            attempts.strategies.add(new StrategyAttempt(StrategyKind.INDEXED_SEARCH, status,
                    result.matches().size(), result.queriesFailed() + " of " + result.queriesIssued()
                    + " queries failed"));
            if (!result.matches().isEmpty()) {
                return false;
            }
            if (options.isFallbackOnEmpty()) {
                log.info("Indexed search found nothing, falling back to exhaustive scan");
                span.event(TracingService.FALLBACK_EMPTY);
                return true;
            }
            attempts.fallbackSkipped = exhaustiveScan != null && universe != null;
            return false;
        } catch (SearchUnavailableException e) {
            log.warn("Indexed search unavailable, falling back to exhaustive scan: {}", e.getMessage());
            attempts.strategies.add(StrategyAttempt.unavailable(StrategyKind.INDEXED_SEARCH, e.getMessage()));
            span.event(TracingService.FALLBACK_UNAVAILABLE);
            return true;
        }
    }

    private void tryExhaustive(Set<NameVariant> variants, Deadline deadline, ResolutionOptions options,
                               Attempts attempts) {
        if (exhaustiveScan == null || universe == null) {
            attempts.strategies.add(StrategyAttempt.unavailable(StrategyKind.EXHAUSTIVE_SCAN,
                    "No entity filing client or universe configured"));
            return;
        }
        if (deadline.isExpired()) {
            attempts.deadlineExceeded = true;
            attempts.strategies.add(StrategyAttempt.unavailable(StrategyKind.EXHAUSTIVE_SCAN,
                    "Deadline reached before scan started"));
            return;
        }
        try {
            ScanResult scan = exhaustiveScan.scan(variants, universe, options.getConcurrencyLimit(),
                    options.getEntityLimit(), deadline, options.getGracePeriod());
            attempts.matches.addAll(scan.matches());
            attempts.errors.addAll(scan.errors());
            attempts.entitiesScanned += scan.entitiesScanned();
            attempts.deadlineExceeded |= scan.deadlineExceeded();
            if (options.getEntityLimit().isPresent()) {
                attempts.entityLimit = options.getEntityLimit().getAsInt();
            }
            AttemptStatus status = !scan.errors().isEmpty() || scan.deadlineExceeded()
                    ? AttemptStatus.PARTIAL
                    : scan.matches().isEmpty() ? AttemptStatus.EMPTY : AttemptStatus.SUCCEEDED;
            attempts.strategies.add(new StrategyAttempt(StrategyKind.EXHAUSTIVE_SCAN, status,
                    scan.matches().size(), scan.entitiesScanned() + " scanned, " + scan.errors().size()
                    + " errors"));
        } catch (IOException e) {
            log.warn("Entity universe unavailable, exhaustive scan skipped: {}", e.getMessage());
            attempts.strategies.add(StrategyAttempt.unavailable(StrategyKind.EXHAUSTIVE_SCAN,
                    "Entity universe unavailable: " + e.getMessage()));
        }
    }

    private ResolvedIdentity aggregate(String query, Set<NameVariant> variants, ResolutionOptions options,
                                       Attempts attempts) {
        List<Affiliation> affiliations = aggregator.aggregate(attempts.matches, options);
        ResolutionDiagnostics diagnostics = new ResolutionDiagnostics(
                variants.stream().map(NameVariant::text).toList(),
                attempts.strategies,
                attempts.errors,
                attempts.entitiesScanned,
                attempts.deadlineExceeded,
                false,
                attempts.entityLimit,
                attempts.fallbackSkipped);
        Instant now = Instant.now(clock);

        if (affiliations.isEmpty()) {
            return ResolvedIdentity.notFound(query, normalizer.displayName(query), diagnostics, now);
        }
        Affiliation best = affiliations.stream()
                .max(Comparator.comparingDouble(Affiliation::confidence))
                .orElseThrow();
        double confidence = best.confidence();
        return new ResolvedIdentity(query, best.matchedName(), ResolutionOutcome.RESOLVED, affiliations,
                confidence, diagnostics, now);
    }

    private ResolvedIdentity readCache(String key) {
        try {
            return cache.get(key).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for '{}', resolving without cache: {}", key, e.getMessage());
            return null;
        }
    }

    private void writeCache(String key, ResolvedIdentity identity) {
        try {
            cache.put(key, identity);
        } catch (RuntimeException e) {
            log.warn("Cache write failed for '{}': {}", key, e.getMessage());
        }
    }

    private static boolean coversRequest(ResolvedIdentity cached, ResolutionOptions options) {
        Integer requestedLimit = options.getEntityLimit().isPresent() ? options.getEntityLimit().getAsInt() : null;
        return cached.diagnostics().coversScope(requestedLimit, options.isFallbackOnEmpty());
    }

    private ResolvedIdentity applyViewFilters(ResolvedIdentity identity, ResolutionOptions options) {
        ResolvedIdentity current = identity.withAffiliations(aggregator.reclassify(identity.affiliations(), options));
        Predicate<Affiliation> keep = a -> a.filingCount() >= options.getMinFilings();
        if (!options.isIncludeFormer()) {
            keep = keep.and(a -> a.status() != AffiliationStatus.FORMER);
        }
        return current.filtered(keep);
    }

    private static ResolutionState transition(ResolutionState from, ResolutionState to) {
        log.debug("state {} -> {}", from.name().toLowerCase(Locale.ROOT), to.name().toLowerCase(Locale.ROOT));
        return to;
    }

    private Duration elapsed(long startNanos) {
        return Duration.ofNanos(nanoClock.nanoTime() - startNanos);
    }

    /**
     * Number of resolutions currently in flight, for tests and health reporting.
     */
    int inFlightCount() {
        return inFlight.size();
    }

    private record InFlightKey(String cacheKey, ResolutionOptions options) {
    }

    /**
     * Mutable accumulator for one resolution's strategy outcomes.
     */
    private static final class Attempts {
        final List<CandidateMatch> matches = new ArrayList<>();
        final List<StrategyAttempt> strategies = new ArrayList<>();
        final List<EntityFetchError> errors = new ArrayList<>();
        int entitiesScanned;
        boolean deadlineExceeded;
        Integer entityLimit;
        boolean fallbackSkipped;
    }
}
