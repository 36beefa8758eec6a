package com.insider.resolution.api;

import com.insider.resolution.cache.CacheConfig;
import com.insider.resolution.cache.CacheKeys;
import com.insider.resolution.cache.CacheStats;
import com.insider.resolution.cache.CaffeineIdentityCache;
import com.insider.resolution.cache.IdentityCache;
import com.insider.resolution.cache.NoOpIdentityCache;
import com.insider.resolution.core.model.Affiliation;
import com.insider.resolution.core.model.NameVariant;
import com.insider.resolution.core.model.ResolvedIdentity;
import com.insider.resolution.metrics.MetricsService;
import com.insider.resolution.metrics.NoOpMetricsService;
import com.insider.resolution.ratelimit.NanoClock;
import com.insider.resolution.ratelimit.RateBudget;
import com.insider.resolution.ratelimit.RateBudgetConfig;
import com.insider.resolution.rules.NameNormalizer;
import com.insider.resolution.similarity.MatchScorer;
import com.insider.resolution.similarity.ScoringWeights;
import com.insider.resolution.source.EntityFilingClient;
import com.insider.resolution.source.EntityUniverse;
import com.insider.resolution.source.IndexedSearchClient;
import com.insider.resolution.strategy.ExhaustiveScanStrategy;
import com.insider.resolution.strategy.IndexedSearchStrategy;
import com.insider.resolution.tracing.NoOpTracingService;
import com.insider.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Main entry point for insider identity resolution.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * InsiderResolver resolver = InsiderResolver.builder()
 *     .indexedSearchClient(EdgarFullTextSearchClient.builder().userAgent(agent).build())
 *     .entityFilingClient(filingClient)
 *     .entityUniverse(CompanyTickersUniverse.remote(agent))
 *     .cacheConfig(CacheConfig.defaults())
 *     .build();
 *
 * ResolvedIdentity identity = resolver.resolveIdentity("Gale Klappa");
 * List&lt;Affiliation&gt; boards = resolver.currentPositions("Gale Klappa");
 * </pre>
 *
 * <p>All requests of one resolver, from both strategies and every concurrent call, share a
 * single {@link RateBudget}.</p>
 */
public class InsiderResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InsiderResolver.class);

    private final ResolutionOrchestrator orchestrator;
    private final NameNormalizer normalizer;
    private final IdentityCache cache;
    private final RateBudget rateBudget;
    private final ResolutionOptions defaultOptions;
    private final int asyncThreads;
    private AsyncInsiderResolver async;

    private InsiderResolver(Builder builder) {
        if (builder.indexedSearchClient == null && builder.entityFilingClient == null) {
            throw new IllegalStateException("At least an indexed search client or an entity filing client is required");
        }
        if (builder.entityFilingClient != null && builder.entityUniverse == null) {
            throw new IllegalStateException("An entity universe is required with an entity filing client");
        }

        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        NanoClock nanoClock = builder.nanoClock != null ? builder.nanoClock : NanoClock.system();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        this.normalizer = builder.normalizer != null ? builder.normalizer : new NameNormalizer();
        this.rateBudget = builder.rateBudget != null
                ? builder.rateBudget : new RateBudget(builder.rateBudgetConfig, nanoClock);
        this.cache = resolveCache(builder);
        this.defaultOptions = builder.options;
        this.asyncThreads = builder.asyncThreads;

        MatchScorer scorer = new MatchScorer(normalizer, builder.scoringWeights);
        IndexedSearchStrategy indexed = builder.indexedSearchClient != null
                ? new IndexedSearchStrategy(builder.indexedSearchClient, rateBudget, scorer,
                builder.maxIndexedQueries, metrics, tracing)
                : null;
        ExhaustiveScanStrategy exhaustive = builder.entityFilingClient != null
                ? new ExhaustiveScanStrategy(builder.entityFilingClient, rateBudget, scorer, metrics, tracing)
                : null;

        this.orchestrator = new ResolutionOrchestrator(normalizer, indexed, exhaustive, builder.entityUniverse,
                cache, new AffiliationAggregator(clock), metrics, tracing, clock, nanoClock);

        log.info("InsiderResolver initialized: indexedSearch={}, exhaustiveScan={}, cache={}",
                indexed != null, exhaustive != null, cache.getClass().getSimpleName());
    }

    private static IdentityCache resolveCache(Builder builder) {
        if (builder.identityCache != null) {
            return builder.identityCache;
        }
        if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            return new CaffeineIdentityCache(builder.cacheConfig);
        }
        return new NoOpIdentityCache();
    }

    // ========== Resolution API ==========

    /**
     * Resolves a name with the default options.
     *
     * @throws InvalidQueryException if the name is unusable
     */
    public ResolvedIdentity resolveIdentity(String name) {
        return orchestrator.resolve(name, defaultOptions);
    }

    /**
     * Resolves a name with custom options.
     *
     * @throws InvalidQueryException if the name is unusable
     */
    public ResolvedIdentity resolveIdentity(String name, ResolutionOptions options) {
        return orchestrator.resolve(name, options != null ? options : defaultOptions);
    }

    /**
     * Entities at which the person currently holds a reporting role.
     */
    public List<Affiliation> currentPositions(String name) {
        ResolutionOptions options = defaultOptions.toBuilder().includeFormer(false).build();
        return orchestrator.resolve(name, options).currentAffiliations();
    }

    /**
     * The name variants a query would be searched under.
     */
    public Set<NameVariant> nameVariations(String name) {
        QueryValidator.validateQuery(name);
        return normalizer.normalize(name);
    }

    /**
     * Async view of this resolver, sharing its rate budget and cache. Closed with the resolver.
     */
    public synchronized AsyncInsiderResolver async() {
        if (async == null) {
            async = new AsyncInsiderResolverImpl(this, defaultOptions, asyncThreads);
        }
        return async;
    }

    // ========== Cache ==========

    public void invalidate(String name) {
        cache.invalidate(CacheKeys.canonicalize(name));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public RateBudget getRateBudget() {
        return rateBudget;
    }

    public ResolutionOptions getDefaultOptions() {
        return defaultOptions;
    }

    public NameNormalizer getNormalizer() {
        return normalizer;
    }

    @Override
    public synchronized void close() {
        if (async != null) {
            async.close();
            async = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IndexedSearchClient indexedSearchClient;
        private EntityFilingClient entityFilingClient;
        private EntityUniverse entityUniverse;
        private IdentityCache identityCache;
        private CacheConfig cacheConfig;
        private RateBudget rateBudget;
        private RateBudgetConfig rateBudgetConfig = RateBudgetConfig.defaults();
        private ScoringWeights scoringWeights = ScoringWeights.defaults();
        private NameNormalizer normalizer;
        private ResolutionOptions options = ResolutionOptions.defaults();
        private int maxIndexedQueries = IndexedSearchStrategy.DEFAULT_MAX_QUERIES;
        private int asyncThreads = 4;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;
        private NanoClock nanoClock;

        /**
         * Sets the global search surface used first.
         */
        public Builder indexedSearchClient(IndexedSearchClient client) {
            this.indexedSearchClient = client;
            return this;
        }

        /**
         * Sets the per-entity client used by the exhaustive scan.
         */
        public Builder entityFilingClient(EntityFilingClient client) {
            this.entityFilingClient = client;
            return this;
        }

        public Builder entityUniverse(EntityUniverse universe) {
            this.entityUniverse = universe;
            return this;
        }

        /**
         * Uses the given cache; takes precedence over {@link #cacheConfig(CacheConfig)}.
         */
        public Builder identityCache(IdentityCache cache) {
            this.identityCache = cache;
            return this;
        }

        /**
         * Enables an in-memory Caffeine cache with this configuration.
         */
        public Builder cacheConfig(CacheConfig config) {
            this.cacheConfig = config;
            return this;
        }

        /**
         * Shares an existing budget, e.g. across resolvers hitting the same source.
         */
        public Builder rateBudget(RateBudget rateBudget) {
            this.rateBudget = rateBudget;
            return this;
        }

        public Builder rateBudgetConfig(RateBudgetConfig config) {
            this.rateBudgetConfig = config;
            return this;
        }

        public Builder scoringWeights(ScoringWeights weights) {
            this.scoringWeights = weights;
            return this;
        }

        public Builder normalizer(NameNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder maxIndexedQueries(int maxIndexedQueries) {
            if (maxIndexedQueries <= 0) {
                throw new IllegalArgumentException("maxIndexedQueries must be > 0");
            }
            this.maxIndexedQueries = maxIndexedQueries;
            return this;
        }

        public Builder asyncThreads(int asyncThreads) {
            if (asyncThreads <= 0) {
                throw new IllegalArgumentException("asyncThreads must be > 0");
            }
            this.asyncThreads = asyncThreads;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Wall clock for filing-age classification and result timestamps.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Monotonic clock for deadlines and the rate budget.
         */
        public Builder nanoClock(NanoClock nanoClock) {
            this.nanoClock = nanoClock;
            return this;
        }

        public InsiderResolver build() {
            return new InsiderResolver(this);
        }
    }
}
