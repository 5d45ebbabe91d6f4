package com.docintegrity.analysis.service.plagiarism;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word n-gram overlap coefficient: shared shingles divided by the size of the smaller shingle set.
 * A passage fully contained in the other text scores 100, which suits comparing a chunk with a
 * search snippet cut from the middle of a page. When the smaller set is too small to be
 * meaningful, Jaccard similarity is used instead.
 */
public class ShingleOverlapMetric implements SimilarityMetric {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}]+");

    private final int shingleSize;
    private final int minShingles;

    public ShingleOverlapMetric(int shingleSize, int minShingles) {
        if (shingleSize < 1) {
            throw new IllegalArgumentException("shingleSize must be >= 1");
        }
        this.shingleSize = shingleSize;
        this.minShingles = Math.max(1, minShingles);
    }

    @Override
    public double score(String first, String second) {
        List<String> firstTokens = tokens(first);
        List<String> secondTokens = tokens(second);
        if (firstTokens.isEmpty() || secondTokens.isEmpty()) {
            return 0.0;
        }
        int size = Math.min(firstTokens.size(), secondTokens.size()) < shingleSize ? 1 : shingleSize;
        Set<String> a = shingles(firstTokens, size);
        Set<String> b = shingles(secondTokens, size);

        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int shared = 0;
        for (String shingle : smaller) {
            if (larger.contains(shingle)) {
                shared++;
            }
        }

        double ratio;
        if (smaller.size() < minShingles) {
            ratio = (double) shared / (a.size() + b.size() - shared);
        } else {
            ratio = (double) shared / smaller.size();
        }
        return Math.round(ratio * 10_000.0) / 100.0;
    }

    private static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return NON_WORD.splitAsStream(text.toLowerCase(Locale.ROOT))
            .filter(token -> !token.isEmpty())
            .toList();
    }

    private static Set<String> shingles(List<String> tokens, int size) {
        Set<String> shingles = new HashSet<>();
        for (int i = 0; i + size <= tokens.size(); i++) {
            shingles.add(String.join(" ", tokens.subList(i, i + size)));
        }
        return shingles;
    }
}
