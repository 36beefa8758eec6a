package com.insider.resolution.similarity;

import com.insider.resolution.core.model.NameVariant;
import com.insider.resolution.rules.NameNormalizer;
import com.insider.resolution.rules.NameTokens;
import com.insider.resolution.rules.NicknameTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Scores how likely a filer name refers to the queried person.
 *
 * <p>For each variant the score is:</p>
 * <ul>
 *   <li>1.0 when the word sets are equal, nickname-equivalent words counting as equal,
 *       unless both names carry disagreeing middle initials</li>
 *   <li>otherwise the token overlap scaled into [0, ceiling], raised by a Levenshtein credit
 *       for misspelled words when at least one word already matched</li>
 * </ul>
 * The result is the maximum over variants. Scoring is deterministic, ignores word order and is
 * symmetric for pairwise use.
 */
public class MatchScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(MatchScorer.class);

    /** Default score at or above which a candidate is accepted. */
    public static final double MATCH_THRESHOLD = 0.75;

    private final NameNormalizer normalizer;
    private final ScoringWeights weights;
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

    public MatchScorer() {
        this(new NameNormalizer(), ScoringWeights.defaults());
    }

    public MatchScorer(ScoringWeights weights) {
        this(new NameNormalizer(), weights);
    }

    public MatchScorer(NameNormalizer normalizer, ScoringWeights weights) {
        this.normalizer = normalizer;
        this.weights = weights;
    }

    /**
     * Best score of the candidate name against any of the variants.
     */
    public double score(Collection<NameVariant> variants, String candidateName) {
        return explain(variants, candidateName).score();
    }

    /**
     * Scores and reports which variant produced the best score.
     */
    public ScoreBreakdown explain(Collection<NameVariant> variants, String candidateName) {
        if (variants == null || variants.isEmpty() || candidateName == null) {
            return ScoreBreakdown.NONE;
        }
        NameTokens candidate = normalizer.significantTokens(candidateName);
        if (candidate.isEmpty()) {
            return ScoreBreakdown.NONE;
        }

        // short variants drop the middle name, so the query's initials apply to all of them
        Map<NameVariant, NameTokens> tokensByVariant = new LinkedHashMap<>();
        SortedSet<String> queryInitials = new TreeSet<>();
        for (NameVariant variant : variants) {
            NameTokens tokens = normalizer.significantTokens(variant.text());
            tokensByVariant.put(variant, tokens);
            queryInitials.addAll(tokens.initials());
        }
        // variants sharing a token set score identically
        Map<NameTokens, NameVariant> distinct = new LinkedHashMap<>();
        tokensByVariant.forEach((variant, tokens) ->
                distinct.putIfAbsent(new NameTokens(tokens.words(), queryInitials), variant));

        ScoreBreakdown best = ScoreBreakdown.NONE;
        for (Map.Entry<NameTokens, NameVariant> entry : distinct.entrySet()) {
            ScoreBreakdown current = scoreTokens(entry.getKey(), candidate, entry.getValue().text());
            if (current.score() > best.score()) {
                best = current;
            }
            if (best.score() >= 1.0) {
                break;
            }
        }
        log.debug("Scored '{}' at {} (best variant '{}')", candidateName, best.score(), best.variant());
        return best;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        NameTokens a = normalizer.significantTokens(s1);
        NameTokens b = normalizer.significantTokens(s2);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return scoreTokens(a, b, s1).score();
    }

    @Override
    public String getName() {
        return "MatchScorer";
    }

    public boolean isMatch(double score) {
        return score >= weights.matchThreshold();
    }

    public double threshold() {
        return weights.matchThreshold();
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public NameNormalizer getNormalizer() {
        return normalizer;
    }

    private ScoreBreakdown scoreTokens(NameTokens a, NameTokens b, String variant) {
        ScoreBreakdown forward = directional(a, b, variant);
        if (forward.score() >= 1.0) {
            return forward;
        }
        ScoreBreakdown backward = directional(b, a, variant);
        return backward.score() > forward.score() ? backward : forward;
    }

    private ScoreBreakdown directional(NameTokens query, NameTokens candidate, String variant) {
        double ceiling = weights.tokenOverlapCeiling();
        List<String> unmatchedQuery = new ArrayList<>(query.words());
        List<String> unmatchedCandidate = new ArrayList<>(candidate.words());

        int matched = pair(unmatchedQuery, unmatchedCandidate, true)
                + pair(unmatchedQuery, unmatchedCandidate, false);

        int sizeA = query.words().size();
        int sizeB = candidate.words().size();
        if (matched == sizeA && matched == sizeB) {
            double exact = query.initialsConflictWith(candidate) ? ceiling : 1.0;
            return new ScoreBreakdown(variant, exact, exact, 0.0);
        }

        double ratio = TokenSetOverlap.ratio(matched, sizeA, sizeB);
        double tokenScore = ceiling * ratio;
        double fuzzyCredit = 0.0;
        if (matched > 0 && ratio < 1.0) {
            double fuzzyMatched = matched + fuzzyMatches(unmatchedQuery, unmatchedCandidate);
            double fuzzyRatio = TokenSetOverlap.ratio(fuzzyMatched, sizeA, sizeB);
            fuzzyCredit = weights.editDistanceWeight() * ceiling * (fuzzyRatio - ratio);
        }
        double score = Math.min(ceiling, Math.max(0.0, tokenScore + fuzzyCredit));
        return new ScoreBreakdown(variant, score, tokenScore, fuzzyCredit);
    }

    /**
     * Removes paired words from both lists and returns how many pairs were made.
     */
    private static int pair(List<String> query, List<String> candidate, boolean exactOnly) {
        int count = 0;
        var it = query.iterator();
        while (it.hasNext()) {
            String word = it.next();
            String partner = null;
            for (String c : candidate) {
                if (exactOnly ? c.equals(word) : NicknameTable.areEquivalent(word, c)) {
                    partner = c;
                    break;
                }
            }
            if (partner != null) {
                candidate.remove(partner);
                it.remove();
                count++;
            }
        }
        return count;
    }

    /**
     * Sum of similarities of leftover words close enough to count as misspellings.
     */
    private double fuzzyMatches(List<String> query, List<String> candidate) {
        List<String> available = new ArrayList<>(candidate);
        double credit = 0.0;
        for (String word : query) {
            String bestWord = null;
            double bestSimilarity = 0.0;
            for (String c : available) {
                double similarity = levenshtein.compute(word, c);
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    bestWord = c;
                }
            }
            if (bestWord != null && bestSimilarity >= weights.fuzzyTokenFloor()) {
                available.remove(bestWord);
                credit += bestSimilarity;
            }
        }
        return credit;
    }

    /**
     * How a score was reached.
     *
     * @param variant     variant text that produced the score
     * @param score       final score
     * @param tokenScore  exact and nickname overlap part
     * @param fuzzyCredit Levenshtein credit added for misspelled words
     */
    public record ScoreBreakdown(String variant, double score, double tokenScore, double fuzzyCredit) {
        static final ScoreBreakdown NONE = new ScoreBreakdown(null, 0.0, 0.0, 0.0);

        @Override
        public String toString() {
            return String.format("ScoreBreakdown{variant=%s, score=%.4f, token=%.4f, fuzzy=%.4f}",
                    variant, score, tokenScore, fuzzyCredit);
        }
    }
}
