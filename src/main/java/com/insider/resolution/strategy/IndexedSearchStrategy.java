package com.insider.resolution.strategy;

import com.insider.resolution.concurrent.Deadline;
import com.insider.resolution.core.model.CandidateMatch;
import com.insider.resolution.core.model.Entity;
import com.insider.resolution.core.model.FilingEvidence;
import com.insider.resolution.core.model.NameVariant;
import com.insider.resolution.core.model.StrategyKind;
import com.insider.resolution.metrics.MetricsService;
import com.insider.resolution.metrics.NoOpMetricsService;
import com.insider.resolution.ratelimit.RateBudget;
import com.insider.resolution.ratelimit.RateLimitTimeoutException;
import com.insider.resolution.similarity.MatchScorer;
import com.insider.resolution.source.FilingReference;
import com.insider.resolution.source.IndexedSearchClient;
import com.insider.resolution.tracing.NoOpTracingService;
import com.insider.resolution.tracing.Span;
import com.insider.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds candidates through a global filing search, one query per search-friendly variant.
 *
 * <p>Every query is gated by the shared {@link RateBudget}. References returned by several
 * variants are counted once. A single failed query is tolerated; the search is unavailable
 * only when every issued query failed.</p>
 */
public class IndexedSearchStrategy {
    private static final Logger log = LoggerFactory.getLogger(IndexedSearchStrategy.class);

    public static final int DEFAULT_MAX_QUERIES = 3;

    private final IndexedSearchClient client;
    private final RateBudget rateBudget;
    private final MatchScorer scorer;
    private final int maxQueries;
    private final MetricsService metrics;
    private final TracingService tracing;

    public IndexedSearchStrategy(IndexedSearchClient client, RateBudget rateBudget, MatchScorer scorer) {
        this(client, rateBudget, scorer, DEFAULT_MAX_QUERIES, new NoOpMetricsService(), new NoOpTracingService());
    }

    public IndexedSearchStrategy(IndexedSearchClient client, RateBudget rateBudget, MatchScorer scorer,
                                 int maxQueries, MetricsService metrics, TracingService tracing) {
        if (maxQueries <= 0) {
            throw new IllegalArgumentException("maxQueries must be > 0");
        }
        this.client = client;
        this.rateBudget = rateBudget;
        this.scorer = scorer;
        this.maxQueries = maxQueries;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    /**
     * Runs the search and returns the accepted candidates.
     *
     * @throws SearchUnavailableException if every issued query failed
     */
    public List<CandidateMatch> search(Collection<NameVariant> variants, Deadline deadline)
            throws SearchUnavailableException {
        return searchDetailed(variants, deadline).matches();
    }

    /**
     * Runs the search and reports how many queries failed alongside the candidates.
     *
     * @throws SearchUnavailableException if every issued query failed
     */
    public IndexedSearchResult searchDetailed(Collection<NameVariant> variants, Deadline deadline)
            throws SearchUnavailableException {
        List<String> terms = variants.stream()
                .filter(NameVariant::searchable)
                .map(NameVariant::text)
                .limit(maxQueries)
                .toList();
        if (terms.isEmpty()) {
            throw new SearchUnavailableException("No search-friendly variants to query");
        }

        try (Span span = tracing.startSpan(TracingService.INDEXED_SEARCH, Map.of("terms", String.join("|", terms)))) {
            List<FilingReference> references = new ArrayList<>();
            Set<String> seenKeys = new HashSet<>();
            int issued = 0;
            int failed = 0;
            SearchUnavailableException lastFailure = null;

            for (String term : terms) {
                if (deadline.isExpired()) {
                    log.warn("Deadline reached after {} of {} indexed queries", issued, terms.size());
                    break;
                }
                issued++;
                try {
                    Duration waited = Duration.ofNanos(rateBudget.acquire(
                            deadline.remainingOrAtMost(rateBudget.getConfig().acquireTimeout())));
                    metrics.recordRateLimitWait(waited);
                    List<FilingReference> hits = client.search(term);
                    int added = 0;
                    for (FilingReference reference : hits) {
                        if (seenKeys.add(dedupeKey(reference))) {
                            references.add(reference);
                            added++;
                        }
                    }
                    log.debug("Indexed query '{}' returned {} references ({} new)", term, hits.size(), added);
                } catch (SearchUnavailableException e) {
                    failed++;
                    lastFailure = e;
                    log.warn("Indexed query '{}' failed: {}", term, e.getMessage());
                } catch (RateLimitTimeoutException e) {
                    failed++;
                    lastFailure = new SearchUnavailableException("Rate budget exhausted for '" + term + "'", e);
                    log.warn("Indexed query '{}' skipped: {}", term, e.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SearchUnavailableException("Interrupted during indexed search", e);
                }
            }

            if (issued == 0 || failed == issued) {
                span.fail(lastFailure);
                String message = issued == 0
                        ? "Deadline reached before any indexed query was issued"
                        : "All " + issued + " indexed queries failed";
                throw lastFailure != null
                        ? new SearchUnavailableException(message, lastFailure)
                        : new SearchUnavailableException(message);
            }

            List<CandidateMatch> matches = score(variants, references);
            span.tag("references", (long) references.size());
            span.tag("matches", (long) matches.size());
            span.succeed();
            log.info("Indexed search: {} queries ({} failed), {} references, {} matches",
                    issued, failed, references.size(), matches.size());
            return new IndexedSearchResult(matches, issued, failed, references.size());
        }
    }

    private List<CandidateMatch> score(Collection<NameVariant> variants, Collection<FilingReference> references) {
        // entityId -> filer name -> references, sorted for deterministic output
        Map<String, Map<String, List<FilingReference>>> byEntity = new TreeMap<>();
        Map<String, String> entityNames = new HashMap<>();
        for (FilingReference reference : references) {
            byEntity.computeIfAbsent(reference.entityId(), k -> new TreeMap<>())
                    .computeIfAbsent(reference.filerName(), k -> new ArrayList<>())
                    .add(reference);
            if (reference.entityName() != null) {
                entityNames.putIfAbsent(reference.entityId(), reference.entityName());
            }
        }

        Map<String, Double> scores = new HashMap<>();
        List<CandidateMatch> matches = new ArrayList<>();
        byEntity.forEach((entityId, byFiler) -> {
            Entity entity = Entity.of(entityId, entityNames.get(entityId));
            byFiler.forEach((filerName, refs) -> {
                double score = scores.computeIfAbsent(filerName, name -> scorer.score(variants, name));
                if (!scorer.isMatch(score)) {
                    log.debug("Rejected '{}' at {} for entity {} (score {})", filerName, entity.displayName(),
                            entityId, score);
                    return;
                }
                metrics.recordMatchScore(score);
                List<FilingEvidence> evidence = refs.stream()
                        .map(r -> new FilingEvidence(r.accessionNumber(), r.filingDate(), r.filerName(),
                                StrategyKind.INDEXED_SEARCH))
                        .sorted(Comparator.comparing(FilingEvidence::filingDate,
                                Comparator.nullsLast(Comparator.reverseOrder())))
                        .toList();
                matches.add(new CandidateMatch(entity, filerName, score, evidence, StrategyKind.INDEXED_SEARCH));
            });
        });
        return matches;
    }

    /**
     * Accession number plus filer, so a filing naming several owners keeps each of them,
     * and the same filing returned for two variants is counted once.
     */
    private static String dedupeKey(FilingReference reference) {
        String accession = reference.accessionNumber() != null
                ? reference.accessionNumber()
                : reference.entityId() + "@" + reference.filingDate();
        return accession + "|" + reference.filerName();
    }

    public int getMaxQueries() {
        return maxQueries;
    }
}
