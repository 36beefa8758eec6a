package com.insider.resolution.cdi;

import com.insider.resolution.api.InsiderResolver;
import com.insider.resolution.api.ResolutionOptions;
import com.insider.resolution.cache.CacheConfig;
import com.insider.resolution.cache.FileBackedIdentityCache;
import com.insider.resolution.mcp.InsiderResolutionMcpTools;
import com.insider.resolution.metrics.MetricsService;
import com.insider.resolution.ratelimit.RateBudgetConfig;
import com.insider.resolution.source.EntityFilingClient;
import com.insider.resolution.source.edgar.CompanyTickersUniverse;
import com.insider.resolution.source.edgar.EdgarFullTextSearchClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the insider resolver from MicroProfile Config properties.
 *
 * <p>The SEC requires a descriptive User-Agent on every request, so it has no default:</p>
 * <pre>
 * insider-resolution:
 *   user-agent: "Example Corp admin@example.com"
 *   rate-limit:
 *     permits-per-second: 10
 *   cache:
 *     file: /var/cache/insider-resolution.json
 * </pre>
 *
 * <p>The exhaustive scan is wired only when the application provides an
 * {@link EntityFilingClient} bean; otherwise the resolver runs on the full-text search alone.</p>
 */
@ApplicationScoped
public class InsiderResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(InsiderResolutionProducer.class);

    @Inject
    @ConfigProperty(name = "insider-resolution.user-agent")
    String userAgent;

    // ── Full-text search ──────────────────────────────────────

    @Inject
    @ConfigProperty(name = "insider-resolution.search.enabled", defaultValue = "true")
    boolean searchEnabled;

    @Inject
    @ConfigProperty(name = "insider-resolution.search.max-queries", defaultValue = "3")
    int searchMaxQueries;

    @Inject
    @ConfigProperty(name = "insider-resolution.search.timeout-seconds", defaultValue = "30")
    int searchTimeoutSeconds;

    // ── Rate Limiting ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "insider-resolution.rate-limit.permits-per-second", defaultValue = "10")
    int permitsPerSecond;

    @Inject
    @ConfigProperty(name = "insider-resolution.rate-limit.capacity", defaultValue = "10")
    int rateLimitCapacity;

    @Inject
    @ConfigProperty(name = "insider-resolution.rate-limit.acquire-timeout-seconds", defaultValue = "30")
    int acquireTimeoutSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "insider-resolution.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "insider-resolution.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "insider-resolution.cache.positive-ttl-minutes", defaultValue = "240")
    int positiveTtlMinutes;

    @Inject
    @ConfigProperty(name = "insider-resolution.cache.negative-ttl-minutes", defaultValue = "15")
    int negativeTtlMinutes;

    @Inject
    @ConfigProperty(name = "insider-resolution.cache.file")
    Optional<String> cacheFile;

    // ── Resolution ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "insider-resolution.resolution.deadline-seconds", defaultValue = "60")
    int deadlineSeconds;

    @Inject
    @ConfigProperty(name = "insider-resolution.resolution.grace-period-seconds", defaultValue = "2")
    int gracePeriodSeconds;

    @Inject
    @ConfigProperty(name = "insider-resolution.resolution.concurrency-limit", defaultValue = "8")
    int concurrencyLimit;

    @Inject
    @ConfigProperty(name = "insider-resolution.resolution.fallback-on-empty", defaultValue = "true")
    boolean fallbackOnEmpty;

    @Inject
    @ConfigProperty(name = "insider-resolution.resolution.entity-limit")
    Optional<Integer> entityLimit;

    @Inject
    @ConfigProperty(name = "insider-resolution.resolution.recency-window-days", defaultValue = "365")
    int recencyWindowDays;

    @Inject
    Instance<EntityFilingClient> filingClients;

    @Inject
    Instance<MetricsService> metricsServices;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public InsiderResolver insiderResolver() {
        log.info("Producing InsiderResolver: search={} rate={}/s cache={}",
                searchEnabled, permitsPerSecond, cacheEnabled);

        InsiderResolver.Builder builder = InsiderResolver.builder()
                .rateBudgetConfig(rateBudgetConfig())
                .options(resolutionOptions())
                .maxIndexedQueries(searchMaxQueries);

        if (searchEnabled) {
            builder.indexedSearchClient(EdgarFullTextSearchClient.builder()
                    .userAgent(userAgent)
                    .timeout(Duration.ofSeconds(searchTimeoutSeconds))
                    .build());
        }

        Optional<EntityFilingClient> filingClient = resolvable(filingClients);
        if (filingClient.isPresent()) {
            builder.entityFilingClient(filingClient.get())
                    .entityUniverse(CompanyTickersUniverse.remote(userAgent));
            log.info("Exhaustive scan enabled with {}", filingClient.get().getClass().getSimpleName());
        } else {
            log.info("No EntityFilingClient bean; exhaustive scan disabled");
        }

        resolvable(metricsServices).ifPresent(builder::metricsService);

        CacheConfig cacheConfig = cacheConfig();
        if (cacheConfig.enabled() && cacheFile != null && cacheFile.isPresent()) {
            builder.identityCache(new FileBackedIdentityCache(Path.of(cacheFile.get()), cacheConfig));
            log.info("Using file-backed cache at {}", cacheFile.get());
        } else {
            builder.cacheConfig(cacheConfig);
        }

        return builder.build();
    }

    public void closeResolver(@Disposes InsiderResolver resolver) {
        log.info("Closing InsiderResolver");
        resolver.close();
    }

    @Produces
    @ApplicationScoped
    public InsiderResolutionMcpTools mcpTools(InsiderResolver resolver) {
        return new InsiderResolutionMcpTools(resolver);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    RateBudgetConfig rateBudgetConfig() {
        return new RateBudgetConfig(permitsPerSecond, rateLimitCapacity,
                Duration.ofSeconds(acquireTimeoutSeconds));
    }

    CacheConfig cacheConfig() {
        return new CacheConfig(cacheMaxSize, Duration.ofMinutes(positiveTtlMinutes),
                Duration.ofMinutes(negativeTtlMinutes), cacheEnabled);
    }

    ResolutionOptions resolutionOptions() {
        return ResolutionOptions.builder()
                .deadline(Duration.ofSeconds(deadlineSeconds))
                .gracePeriod(Duration.ofSeconds(gracePeriodSeconds))
                .concurrencyLimit(concurrencyLimit)
                .fallbackOnEmpty(fallbackOnEmpty)
                .entityLimit(entityLimit != null ? entityLimit.orElse(null) : null)
                .recencyWindow(Duration.ofDays(recencyWindowDays))
                .build();
    }

    private static <T> Optional<T> resolvable(Instance<T> instance) {
        if (instance == null || !instance.isResolvable()) {
            return Optional.empty();
        }
        return Optional.of(instance.get());
    }
}
