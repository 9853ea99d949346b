package com.cred.freestyle.deadpool.matching;

import com.cred.freestyle.deadpool.config.DeadpoolProperties;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalizes candidate names and scores their similarity to detect duplicates.
 *
 * Normalization:
 * - strip accents and lowercase
 * - turn punctuation into spaces and collapse runs of whitespace
 * - map a trailing suffix token through the configured suffix map ("Jr." and "junior" become "jr")
 *
 * Matching: identical normalized names match with score 1.0. Names shorter than the fuzzy
 * minimum must match exactly. Otherwise the score is the normalized Levenshtein similarity
 * {@code 1 - distance / max(length)} and names match at or above the configured threshold.
 *
 * Pure and total over any pair of strings.
 *
 * @author Deadpool Team
 */
@Component
public class NameMatcher {

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final double similarityThreshold;
    private final int minLengthForFuzzy;
    private final Map<String, String> suffixMap;
    private final LevenshteinDistance levenshtein = LevenshteinDistance.getDefaultInstance();

    public NameMatcher(DeadpoolProperties properties) {
        DeadpoolProperties.NameMatching config = properties.getNameMatching();
        this.similarityThreshold = config.getSimilarityThreshold();
        this.minLengthForFuzzy = config.getMinLengthForFuzzy();
        this.suffixMap = new HashMap<>();
        // keys go through the same cleanup as names, so "jr." and "jr" both land on "jr"
        for (Map.Entry<String, String> entry : config.getSuffixMap().entrySet()) {
            this.suffixMap.put(clean(entry.getKey()), entry.getValue());
        }
    }

    /**
     * @param name Raw name, may be null
     * @return Normalized name (empty for null or blank input)
     */
    public String normalize(String name) {
        String cleaned = clean(name);
        if (cleaned.isEmpty()) {
            return cleaned;
        }
        int lastSpace = cleaned.lastIndexOf(' ');
        String last = cleaned.substring(lastSpace + 1);
        String mapped = suffixMap.get(last);
        if (mapped == null) {
            return cleaned;
        }
        return lastSpace < 0 ? mapped : cleaned.substring(0, lastSpace + 1) + mapped;
    }

    public NameMatchResult match(String nameA, String nameB) {
        String a = normalize(nameA);
        String b = normalize(nameB);

        if (a.equals(b)) {
            return new NameMatchResult(true, 1.0, a, b);
        }
        if (a.length() < minLengthForFuzzy || b.length() < minLengthForFuzzy) {
            return new NameMatchResult(false, 0.0, a, b);
        }
        double score = similarity(a, b);
        return new NameMatchResult(score >= similarityThreshold, score, a, b);
    }

    /**
     * Similarity of two already-normalized names.
     */
    public double similarity(String normalizedA, String normalizedB) {
        int longest = Math.max(normalizedA.length(), normalizedB.length());
        if (longest == 0) {
            return 1.0;
        }
        int distance = levenshtein.apply(normalizedA, normalizedB);
        return 1.0 - (double) distance / longest;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    private static String clean(String name) {
        if (name == null) {
            return "";
        }
        String stripped = MARKS.matcher(Normalizer.normalize(name, Normalizer.Form.NFD)).replaceAll("");
        String spaced = PUNCTUATION.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }
}
