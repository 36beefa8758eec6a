package com.insider.resolution.strategy;

import com.insider.resolution.concurrent.Deadline;
import com.insider.resolution.core.model.CandidateMatch;
import com.insider.resolution.core.model.NameVariant;
import com.insider.resolution.core.model.StrategyKind;
import com.insider.resolution.metrics.NoOpMetricsService;
import com.insider.resolution.ratelimit.RateBudget;
import com.insider.resolution.ratelimit.RateBudgetConfig;
import com.insider.resolution.rules.NameNormalizer;
import com.insider.resolution.similarity.MatchScorer;
import com.insider.resolution.support.FakeNanoClock;
import com.insider.resolution.support.FakeSearchClient;
import com.insider.resolution.support.GaleKlappaFixture;
import com.insider.resolution.tracing.NoOpTracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static com.insider.resolution.support.GaleKlappaFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class IndexedSearchStrategyTest {

    private final NameNormalizer normalizer = new NameNormalizer();
    private final MatchScorer scorer = new MatchScorer();
    private FakeSearchClient client;
    private RateBudget budget;
    private Set<NameVariant> variants;

    @BeforeEach
    void setUp() {
        client = GaleKlappaFixture.searchClient();
        budget = new RateBudget(RateBudgetConfig.defaults(), new FakeNanoClock());
        variants = normalizer.normalize(QUERY);
    }

    private Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(30));
    }

    @Nested
    @DisplayName("Successful search")
    class SuccessTests {

        @Test
        @DisplayName("Should query each search-friendly variant once")
        void queriesVariants() throws SearchUnavailableException {
            new IndexedSearchStrategy(client, budget, scorer).search(variants, deadline());
            assertEquals(List.of("Gale Klappa", "Klappa, Gale", "KLAPPA GALE"), client.queries());
            assertEquals(7, budget.availableTokens());
        }

        @Test
        @DisplayName("Should deduplicate references and reject unrelated filers")
        void deduplicates() throws SearchUnavailableException {
            IndexedSearchResult result = new IndexedSearchStrategy(client, budget, scorer)
                    .searchDetailed(variants, deadline());

            assertEquals(5, result.referencesSeen());
            assertFalse(result.partial());
            List<String> entityIds = result.matches().stream().map(CandidateMatch::entityId).toList();
            assertEquals(List.of(ASB.id(), BMI.id(), WEC.id()), entityIds);
            assertTrue(result.matches().stream().allMatch(m -> m.strategy() == StrategyKind.INDEXED_SEARCH));
        }

        @Test
        @DisplayName("Should attach evidence newest first")
        void evidenceOrder() throws SearchUnavailableException {
            CandidateMatch wec = new IndexedSearchStrategy(client, budget, scorer).search(variants, deadline())
                    .stream().filter(m -> m.entityId().equals(WEC.id())).findFirst().orElseThrow();

            assertEquals("KLAPPA GALE E", wec.matchedName());
            assertEquals(1.0, wec.confidence());
            assertEquals(2, wec.evidence().size());
            assertEquals(LocalDate.parse("2025-03-01"), wec.evidence().get(0).filingDate());
            assertEquals("WEC ENERGY GROUP, INC.", wec.entity().displayName());
        }

        @Test
        @DisplayName("Should not query nickname variants")
        void skipsNicknames() throws SearchUnavailableException {
            new IndexedSearchStrategy(client, budget, scorer, 10, new NoOpMetricsService(), new NoOpTracingService())
                    .search(normalizer.normalize("Bill Smith"), deadline());
            assertEquals(List.of("Bill Smith", "Smith, Bill", "SMITH BILL"), client.queries());
        }

        @Test
        @DisplayName("Should honor the query limit")
        void queryLimit() throws SearchUnavailableException {
            new IndexedSearchStrategy(client, budget, scorer, 1, new NoOpMetricsService(), new NoOpTracingService())
                    .search(variants, deadline());
            assertEquals(List.of("Gale Klappa"), client.queries());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should tolerate a single failed query and report it as partial")
        void singleFailure() throws SearchUnavailableException {
            client.failOn("KLAPPA GALE");
            IndexedSearchResult result = new IndexedSearchStrategy(client, budget, scorer)
                    .searchDetailed(variants, deadline());

            assertTrue(result.partial());
            assertEquals(3, result.queriesIssued());
            assertEquals(1, result.queriesFailed());
            assertEquals(List.of(WEC.id()), result.matches().stream().map(CandidateMatch::entityId).toList());
        }

        @Test
        @DisplayName("Should be unavailable when every query fails")
        void allFail() {
            client.setUnavailable(true);
            IndexedSearchStrategy strategy = new IndexedSearchStrategy(client, budget, scorer);
            SearchUnavailableException e = assertThrows(SearchUnavailableException.class,
                    () -> strategy.search(variants, deadline()));
            assertTrue(e.getMessage().contains("All 3"));
        }

        @Test
        @DisplayName("Should count rate-budget timeouts as failed queries")
        void rateLimited() throws SearchUnavailableException {
            RateBudget tight = new RateBudget(new RateBudgetConfig(1, 1, Duration.ZERO), new FakeNanoClock());
            IndexedSearchResult result = new IndexedSearchStrategy(client, tight, scorer)
                    .searchDetailed(variants, deadline());

            assertEquals(2, result.queriesFailed());
            assertEquals(List.of("Gale Klappa"), client.queries());
        }

        @Test
        @DisplayName("Should be unavailable when the deadline passed before any query")
        void deadlineBeforeStart() {
            IndexedSearchStrategy strategy = new IndexedSearchStrategy(client, budget, scorer);
            assertThrows(SearchUnavailableException.class,
                    () -> strategy.search(variants, Deadline.after(Duration.ZERO)));
            assertTrue(client.queries().isEmpty());
        }

        @Test
        @DisplayName("Should be unavailable when no variant is searchable")
        void noSearchableVariants() {
            IndexedSearchStrategy strategy = new IndexedSearchStrategy(client, budget, scorer);
            Set<NameVariant> nicknamesOnly = Set.of(NameVariant.of("William Smith", NameVariant.Kind.NICKNAME));
            assertThrows(SearchUnavailableException.class, () -> strategy.search(nicknamesOnly, deadline()));
        }
    }
}
