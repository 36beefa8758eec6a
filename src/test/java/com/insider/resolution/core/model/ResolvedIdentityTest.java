package com.insider.resolution.core.model;

import com.insider.resolution.support.GaleKlappaFixture;
import com.insider.resolution.support.Identities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolvedIdentityTest {

    private static Affiliation affiliation(Entity entity, AffiliationStatus status, double confidence, int filings) {
        return new Affiliation(entity, status, confidence, "KLAPPA GALE", List.of(),
                LocalDate.parse("2025-01-01"), filings, StrategyKind.EXHAUSTIVE_SCAN);
    }

    private static ResolvedIdentity identity(List<Affiliation> affiliations) {
        return new ResolvedIdentity("Gale Klappa", "KLAPPA GALE", ResolutionOutcome.RESOLVED, affiliations,
                1.0, ResolutionDiagnostics.empty(), Identities.RESOLVED_AT);
    }

    @Test
    @DisplayName("Should split affiliations by status")
    void testStatusViews() {
        ResolvedIdentity identity = identity(List.of(
                affiliation(GaleKlappaFixture.WEC, AffiliationStatus.CURRENT, 1.0, 2),
                affiliation(GaleKlappaFixture.ASB, AffiliationStatus.FORMER, 1.0, 1),
                affiliation(GaleKlappaFixture.QUIET, AffiliationStatus.UNKNOWN, 0.9, 1)));

        assertEquals(1, identity.currentAffiliations().size());
        assertEquals(1, identity.formerAffiliations().size());
        assertEquals(3, identity.entityIds().size());
        assertTrue(identity.found());
    }

    @Test
    @DisplayName("Should recompute outcome and confidence when filtering")
    void testFiltered() {
        ResolvedIdentity identity = identity(List.of(
                affiliation(GaleKlappaFixture.WEC, AffiliationStatus.CURRENT, 0.9, 2),
                affiliation(GaleKlappaFixture.ASB, AffiliationStatus.FORMER, 1.0, 1)));

        ResolvedIdentity current = identity.filtered(a -> a.status() == AffiliationStatus.CURRENT);
        assertEquals(0.9, current.confidence());
        assertEquals(ResolutionOutcome.RESOLVED, current.outcome());

        ResolvedIdentity none = identity.filtered(a -> a.filingCount() > 5);
        assertEquals(ResolutionOutcome.NOT_FOUND, none.outcome());
        assertEquals(0.0, none.confidence());
        assertSame(identity, identity.filtered(a -> true));
    }

    @Test
    @DisplayName("Should reject duplicate entities and out-of-range confidence")
    void testValidation() {
        Affiliation wec = affiliation(GaleKlappaFixture.WEC, AffiliationStatus.CURRENT, 1.0, 1);
        assertThrows(IllegalArgumentException.class, () -> identity(List.of(wec, wec)));
        assertThrows(IllegalArgumentException.class, () -> new ResolvedIdentity("q", "q",
                ResolutionOutcome.RESOLVED, List.of(), 1.5, null, Identities.RESOLVED_AT));
        assertThrows(NullPointerException.class, () -> new ResolvedIdentity(null, "q",
                ResolutionOutcome.RESOLVED, List.of(), 1.0, null, Identities.RESOLVED_AT));
    }

    @Test
    @DisplayName("Should default missing collections")
    void testDefaults() {
        ResolvedIdentity identity = new ResolvedIdentity("q", "q", ResolutionOutcome.NOT_FOUND, null, 0.0,
                null, Identities.RESOLVED_AT);
        assertTrue(identity.affiliations().isEmpty());
        assertEquals(ResolutionDiagnostics.empty(), identity.diagnostics());
    }
}
