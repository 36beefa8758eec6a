package com.insider.resolution.api;

import com.insider.resolution.core.model.Affiliation;
import com.insider.resolution.core.model.AffiliationStatus;
import com.insider.resolution.core.model.CandidateMatch;
import com.insider.resolution.core.model.Entity;
import com.insider.resolution.core.model.FilingEvidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges candidate matches from any strategy into one affiliation per entity.
 *
 * <p>The highest confidence wins; equal confidences are broken by the lexicographically
 * smallest filer name so the result does not depend on completion order. Other filer names
 * seen at the same entity are kept as alternates. Evidence is deduplicated by accession
 * number.</p>
 */
public class AffiliationAggregator {
    private static final Logger log = LoggerFactory.getLogger(AffiliationAggregator.class);

    static final Comparator<Affiliation> ORDER = Comparator
            .comparing(Affiliation::status)
            .thenComparing(Affiliation::lastFilingDate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Affiliation::entityId);

    private static final Comparator<CandidateMatch> BEST_FIRST = Comparator
            .comparingDouble(CandidateMatch::confidence).reversed()
            .thenComparing(CandidateMatch::matchedName);

    private final Clock clock;

    public AffiliationAggregator() {
        this(Clock.systemUTC());
    }

    public AffiliationAggregator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the affiliations, current ones first, then most recent filing, then entity id.
     */
    public List<Affiliation> aggregate(Collection<CandidateMatch> matches, ResolutionOptions options) {
        Map<String, List<CandidateMatch>> byEntity = new TreeMap<>();
        for (CandidateMatch match : matches) {
            byEntity.computeIfAbsent(match.entityId(), k -> new ArrayList<>()).add(match);
        }

        LocalDate today = LocalDate.now(clock);
        List<Affiliation> affiliations = new ArrayList<>(byEntity.size());
        byEntity.forEach((entityId, group) -> affiliations.add(merge(group, today, options)));
        affiliations.sort(ORDER);
        log.debug("Aggregated {} matches into {} affiliations", matches.size(), affiliations.size());
        return affiliations;
    }

    /**
     * Re-judges each status against today's date and {@code options}, then restores the order.
     * Cached affiliations go through this so a status never outlives the day or the windows it
     * was computed with.
     */
    public List<Affiliation> reclassify(List<Affiliation> affiliations, ResolutionOptions options) {
        LocalDate today = LocalDate.now(clock);
        List<Affiliation> result = new ArrayList<>(affiliations.size());
        for (Affiliation affiliation : affiliations) {
            result.add(affiliation.withStatus(classify(affiliation.lastFilingDate(), today, options)));
        }
        result.sort(ORDER);
        return result;
    }

    /**
     * CURRENT within the recency window, FORMER past {@code formerAfter}, UNKNOWN in between
     * or when no filing was dated.
     */
    public AffiliationStatus classify(LocalDate lastFilingDate, LocalDate today, ResolutionOptions options) {
        if (lastFilingDate == null) {
            return AffiliationStatus.UNKNOWN;
        }
        long ageDays = ChronoUnit.DAYS.between(lastFilingDate, today);
        if (ageDays <= options.getRecencyWindow().toDays()) {
            return AffiliationStatus.CURRENT;
        }
        if (ageDays > options.getFormerAfter().toDays()) {
            return AffiliationStatus.FORMER;
        }
        return AffiliationStatus.UNKNOWN;
    }

    private Affiliation merge(List<CandidateMatch> group, LocalDate today, ResolutionOptions options) {
        group.sort(BEST_FIRST);
        CandidateMatch best = group.get(0);

        Set<String> alternates = new TreeSet<>();
        Map<String, FilingEvidence> evidence = new LinkedHashMap<>();
        for (CandidateMatch match : group) {
            if (!match.matchedName().equals(best.matchedName())) {
                alternates.add(match.matchedName());
            }
            for (FilingEvidence filing : match.evidence()) {
                evidence.putIfAbsent(evidenceKey(filing), filing);
            }
        }

        LocalDate lastFilingDate = evidence.values().stream()
                .map(FilingEvidence::filingDate)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return new Affiliation(
                displayEntity(group, best),
                classify(lastFilingDate, today, options),
                best.confidence(),
                best.matchedName(),
                new ArrayList<>(alternates),
                lastFilingDate,
                evidence.size(),
                best.strategy());
    }

    /**
     * Prefers an entity record that carries a real display name over one named by its id.
     */
    private static Entity displayEntity(List<CandidateMatch> group, CandidateMatch best) {
        return group.stream()
                .map(CandidateMatch::entity)
                .filter(e -> !e.displayName().equals(e.id()))
                .findFirst()
                .orElse(best.entity());
    }

    private static String evidenceKey(FilingEvidence filing) {
        if (filing.accessionNumber() != null) {
            return filing.accessionNumber();
        }
        return filing.filingDate() + "|" + filing.filerName();
    }
}
