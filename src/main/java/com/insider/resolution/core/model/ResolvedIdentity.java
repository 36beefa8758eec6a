package com.insider.resolution.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * The canonical identity behind a queried name and every entity it is affiliated with.
 * Immutable once returned; the same instance may be served from the cache.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolvedIdentity(
        String query,
        String canonicalName,
        ResolutionOutcome outcome,
        List<Affiliation> affiliations,
        double confidence,
        ResolutionDiagnostics diagnostics,
        Instant resolvedAt
) {
    public ResolvedIdentity {
        Objects.requireNonNull(query, "query is required");
        Objects.requireNonNull(outcome, "outcome is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + confidence);
        }
        affiliations = affiliations != null ? List.copyOf(affiliations) : List.of();
        diagnostics = diagnostics != null ? diagnostics : ResolutionDiagnostics.empty();
        long distinct = affiliations.stream().map(Affiliation::entityId).distinct().count();
        if (distinct != affiliations.size()) {
            throw new IllegalArgumentException("Affiliations must be unique per entity");
        }
    }

    /**
     * Creates a not-found result carrying the diagnostics of what was tried.
     */
    public static ResolvedIdentity notFound(String query, String canonicalName,
                                            ResolutionDiagnostics diagnostics, Instant resolvedAt) {
        return new ResolvedIdentity(query, canonicalName, ResolutionOutcome.NOT_FOUND, List.of(),
                0.0, diagnostics, resolvedAt);
    }

    public boolean found() {
        return outcome == ResolutionOutcome.RESOLVED;
    }

    public List<Affiliation> currentAffiliations() {
        return filter(a -> a.status() == AffiliationStatus.CURRENT);
    }

    public List<Affiliation> formerAffiliations() {
        return filter(a -> a.status() == AffiliationStatus.FORMER);
    }

    public List<String> entityIds() {
        return affiliations.stream().map(Affiliation::entityId).toList();
    }

    /**
     * Returns a copy restricted to affiliations accepted by the filter. Outcome and confidence
     * are recomputed from what remains; diagnostics are preserved.
     */
    public ResolvedIdentity filtered(Predicate<Affiliation> keep) {
        List<Affiliation> kept = filter(keep);
        if (kept.size() == affiliations.size()) {
            return this;
        }
        return withAffiliations(kept);
    }

    /**
     * Returns a copy holding {@code replacement} as its affiliations, with outcome and confidence
     * recomputed from them.
     */
    public ResolvedIdentity withAffiliations(List<Affiliation> replacement) {
        if (affiliations.equals(replacement)) {
            return this;
        }
        double best = replacement.stream().mapToDouble(Affiliation::confidence).max().orElse(0.0);
        ResolutionOutcome newOutcome = replacement.isEmpty() ? ResolutionOutcome.NOT_FOUND : ResolutionOutcome.RESOLVED;
        return new ResolvedIdentity(query, canonicalName, newOutcome, replacement, best, diagnostics, resolvedAt);
    }

    public ResolvedIdentity withDiagnostics(ResolutionDiagnostics newDiagnostics) {
        return new ResolvedIdentity(query, canonicalName, outcome, affiliations, confidence,
                newDiagnostics, resolvedAt);
    }

    private List<Affiliation> filter(Predicate<Affiliation> predicate) {
        return affiliations.stream().filter(predicate).toList();
    }
}
