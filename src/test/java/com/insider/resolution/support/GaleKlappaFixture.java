package com.insider.resolution.support;

import com.insider.resolution.core.model.Entity;
import com.insider.resolution.source.FilerRecord;
import com.insider.resolution.source.FilingReference;
import com.insider.resolution.source.InMemoryEntityUniverse;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * A director on three boards: two current (WEC Energy, Badger Meter) and one former
 * (Associated Banc-Corp), plus an unrelated filer with a similar surname.
 */
public final class GaleKlappaFixture {

    public static final String QUERY = "Gale Klappa";

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-30T12:00:00Z"), ZoneOffset.UTC);

    public static final Entity WEC = new Entity("0000783325", "WEC ENERGY GROUP, INC.", 180);
    public static final Entity BMI = new Entity("0000009092", "BADGER METER INC", 1450);
    public static final Entity ASB = new Entity("0000007789", "ASSOCIATED BANC-CORP", 1100);
    public static final Entity ACME = new Entity("0000012345", "ACME HOLDINGS", 2500);
    public static final Entity QUIET = new Entity("0000055555", "QUIET INDUSTRIES", 900);

    private GaleKlappaFixture() {
    }

    public static FakeSearchClient searchClient() {
        return new FakeSearchClient()
                .on("Gale Klappa",
                        reference(WEC, "KLAPPA GALE E", "2025-03-01", "0000783325-25-000010"),
                        reference(ACME, "KLAPP GARY", "2025-04-02", "0000012345-25-000003"))
                .on("KLAPPA GALE",
                        reference(WEC, "KLAPPA GALE E", "2025-03-01", "0000783325-25-000010"),
                        reference(WEC, "KLAPPA GALE E", "2024-11-15", "0000783325-24-000050"),
                        reference(BMI, "Klappa Gale E", "2025-05-10", "0000009092-25-000021"),
                        reference(ASB, "KLAPPA GALE", "2019-07-01", "0000007789-19-000005"));
    }

    public static FakeFilingClient filingClient() {
        return new FakeFilingClient()
                .on(WEC.id(),
                        filer("KLAPPA GALE E", "2025-03-01", "0000783325-25-000010"),
                        filer("KLAPPA GALE E", "2024-11-15", "0000783325-24-000050"),
                        filer("LAUBER SCOTT J", "2025-03-01", "0000783325-25-000011"))
                .on(BMI.id(), filer("Klappa Gale E", "2025-05-10", "0000009092-25-000021"))
                .on(ASB.id(), filer("KLAPPA GALE", "2019-07-01", "0000007789-19-000005"))
                .on(ACME.id(), filer("KLAPP GARY", "2025-04-02", "0000012345-25-000003"));
    }

    public static InMemoryEntityUniverse universe() {
        return InMemoryEntityUniverse.of(WEC, BMI, ASB, ACME, QUIET);
    }

    public static FilingReference reference(Entity entity, String filer, String date, String accession) {
        return new FilingReference(entity.id(), entity.displayName(), filer, LocalDate.parse(date), accession);
    }

    public static FilerRecord filer(String name, String date, String accession) {
        return new FilerRecord(name, LocalDate.parse(date), accession);
    }
}
