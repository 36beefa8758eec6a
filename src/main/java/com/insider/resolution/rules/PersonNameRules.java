package com.insider.resolution.rules;

import java.util.List;

/**
 * Built-in rules for cleaning person names as they appear in queries and on filings.
 */
public final class PersonNameRules {

    static final String HONORIFICS = "mr|mrs|ms|miss|dr|prof|sir|dame|lord|lady|rev|hon|father|sister|brother";
    static final String SUFFIXES = "jr|junior|sr|senior|ii|iii|iv|esq|md|phd|jd|cpa|cfa|mba|pe|rn";

    private PersonNameRules() {
        // Utility class
    }

    /**
     * Rules in the order {@link NameNormalizer} expects them: titles and suffixes are removed
     * while their punctuation still delimits them, then stray punctuation is cleaned up.
     */
    public static List<NormalizationRule> defaults() {
        return List.of(
                NormalizationRule.removing("person-honorific",
                        "^\\s*(" + HONORIFICS + ")\\.?(\\s+|$)", 10),

                // "Klappa, Gale E., Jr." and "KLAPPA GALE E JR"
                NormalizationRule.removing("person-suffix",
                        "(,\\s*|\\s+)(" + SUFFIXES + ")\\.?\\s*$", 10),

                NormalizationRule.rewriting("person-period", "\\.", " ", 50),

                // Keeps letters, digits, apostrophes, hyphens and the comma that marks "Last, First"
                NormalizationRule.rewriting("person-special-chars", "[^\\p{L}\\p{N}\\s,'\\-]", " ", 60),

                NormalizationRule.removing("person-trailing-comma", ",\\s*$", 90),

                NormalizationRule.rewriting("person-collapse-spaces", "\\s+", " ", 200)
        );
    }
}
