package com.insider.resolution.rules;

import com.insider.resolution.core.model.NameVariant;
import com.insider.resolution.core.model.NameVariant.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a raw person name into a bounded, deterministic set of comparable name variants.
 * Pure and free of I/O; safe to share between threads.
 *
 * <p>For {@code "Mr. Gale E. Klappa Jr."} the variants are, in priority order:</p>
 * <pre>
 * Gale Klappa
 * Klappa, Gale
 * KLAPPA GALE E
 * KLAPPA GALE
 * Gale E Klappa
 * </pre>
 * Nickname substitutions (Bill ↔ William) follow when the first name has any.
 */
public class NameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NameNormalizer.class);

    /** Upper bound on variants per query; scan cost scales with it. */
    public static final int MAX_VARIANTS = 8;

    private static final int MAX_PASSES = 8;

    private final List<NormalizationRule> rules;
    private final int maxVariants;

    public NameNormalizer() {
        this(PersonNameRules.defaults(), MAX_VARIANTS);
    }

    public NameNormalizer(List<NormalizationRule> rules, int maxVariants) {
        if (maxVariants < 1 || maxVariants > MAX_VARIANTS) {
            throw new IllegalArgumentException("maxVariants must be between 1 and " + MAX_VARIANTS);
        }
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
        this.maxVariants = maxVariants;
    }

    /**
     * Generates the variant set for a raw name. Returns an empty set when nothing usable
     * remains after cleaning (blank input, titles only, punctuation only).
     */
    public Set<NameVariant> normalize(String raw) {
        ParsedName parsed = parse(raw);
        if (parsed == null) {
            return Set.of();
        }

        Set<NameVariant> variants = new LinkedHashSet<>();
        String last = parsed.last();
        if (!parsed.hasFirst()) {
            add(variants, title(last), Kind.FIRST_LAST);
            add(variants, upper(last), Kind.FILING_FORM);
            return Collections.unmodifiableSet(variants);
        }

        String first = parsed.first();
        String middles = String.join(" ", parsed.middles());
        String initials = String.join(" ", parsed.middleInitials());

        add(variants, title(first + " " + last), Kind.FIRST_LAST);
        add(variants, title(last) + ", " + title(first), Kind.LAST_COMMA_FIRST);
        if (parsed.hasMiddles()) {
            add(variants, upper(last + " " + first + " " + middles), Kind.FILING_FORM);
        }
        add(variants, upper(last + " " + first), Kind.FILING_FORM);
        if (parsed.hasMiddles()) {
            add(variants, title(first + " " + middles + " " + last), Kind.FULL);
            if (!middles.equals(initials)) {
                add(variants, upper(last + " " + first + " " + initials), Kind.FILING_FORM);
            }
        }
        for (String alternative : NicknameTable.alternativesOf(first)) {
            add(variants, title(alternative + " " + last), Kind.NICKNAME);
            add(variants, upper(last + " " + alternative), Kind.NICKNAME);
        }

        if (log.isDebugEnabled()) {
            log.debug("Generated {} variants for '{}': {}", variants.size(), raw, variants);
        }
        return Collections.unmodifiableSet(variants);
    }

    /**
     * Lowercase "first [middle...] last" with titles, suffixes and punctuation removed,
     * or an empty string when the name has no usable tokens. Idempotent.
     */
    public String canonicalForm(String raw) {
        ParsedName parsed = parse(raw);
        return parsed != null ? parsed.canonical() : "";
    }

    /**
     * Title-cased "First Last" for display, or the trimmed input when no tokens remain.
     */
    public String displayName(String raw) {
        ParsedName parsed = parse(raw);
        if (parsed == null) {
            return raw == null ? "" : raw.strip();
        }
        return title(parsed.hasFirst() ? parsed.first() + " " + parsed.last() : parsed.last());
    }

    /**
     * Splits a cleaned name into first, middle and last parts.
     * "Last, First Middle" is reordered. An all-caps name without a comma that ends in a single
     * initial ("KLAPPA GALE E") is read in filing order, last name first.
     *
     * @return the parsed name, or {@code null} when no tokens remain
     */
    public ParsedName parse(String raw) {
        String cleaned = clean(raw);
        if (cleaned.isEmpty()) {
            return null;
        }

        int comma = cleaned.indexOf(',');
        if (comma >= 0) {
            List<String> lastTokens = tokens(cleaned.substring(0, comma));
            List<String> givenTokens = tokens(cleaned.substring(comma + 1).replace(',', ' '));
            if (lastTokens.isEmpty() && givenTokens.isEmpty()) {
                return null;
            }
            if (lastTokens.isEmpty()) {
                return fromOrdered(givenTokens);
            }
            if (givenTokens.isEmpty()) {
                return fromOrdered(lastTokens);
            }
            return new ParsedName(givenTokens.get(0), givenTokens.subList(1, givenTokens.size()),
                    String.join(" ", lastTokens));
        }

        List<String> tokens = tokens(cleaned);
        if (tokens.isEmpty()) {
            return null;
        }
        if (looksLikeFilingOrder(cleaned, tokens)) {
            return new ParsedName(tokens.get(1), tokens.subList(2, tokens.size()), tokens.get(0));
        }
        return fromOrdered(tokens);
    }

    /**
     * Order-free word and initial sets for scoring a name in any format.
     */
    public NameTokens significantTokens(String name) {
        String cleaned = clean(name);
        Set<String> words = new TreeSet<>();
        Set<String> initials = new TreeSet<>();
        for (String token : tokens(cleaned.replace(',', ' '))) {
            if (token.length() == 1) {
                initials.add(token);
            } else {
                words.add(token);
            }
        }
        return new NameTokens(new TreeSet<>(words), new TreeSet<>(initials));
    }

    /**
     * Applies the rules repeatedly until the name stops changing, so stacked titles or
     * suffixes ("Dr. Mr. ...", "... Jr. III") are all removed.
     */
    String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String current = raw.trim();
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String before = current;
            for (NormalizationRule rule : rules) {
                String applied = rule.apply(current);
                if (!applied.equals(current)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), current, applied);
                }
                current = applied;
            }
            current = current.trim();
            if (current.equals(before)) {
                break;
            }
        }
        return current;
    }

    private static ParsedName fromOrdered(List<String> tokens) {
        if (tokens.size() == 1) {
            return new ParsedName(null, List.of(), tokens.get(0));
        }
        return new ParsedName(tokens.get(0), tokens.subList(1, tokens.size() - 1),
                tokens.get(tokens.size() - 1));
    }

    private static boolean looksLikeFilingOrder(String cleaned, List<String> tokens) {
        return tokens.size() >= 3
                && cleaned.equals(cleaned.toUpperCase(Locale.ROOT))
                && tokens.get(tokens.size() - 1).length() == 1;
    }

    private static List<String> tokens(String s) {
        return Arrays.stream(s.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .map(t -> t.replaceAll("^['\\-]+|['\\-]+$", ""))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    private static void add(Set<NameVariant> variants, String text, Kind kind) {
        if (variants.size() < MAX_VARIANTS) {
            variants.add(NameVariant.of(text, kind));
        }
    }

    private static String upper(String s) {
        return s.toUpperCase(Locale.ROOT);
    }

    static String title(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean capitalize = true;
        for (char c : s.toCharArray()) {
            sb.append(capitalize ? Character.toUpperCase(c) : c);
            capitalize = c == ' ' || c == '-' || c == '\'';
        }
        return sb.toString();
    }
}
