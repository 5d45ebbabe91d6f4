package com.docintegrity.analysis.service.text;

import com.docintegrity.analysis.domain.TextMetrics;
import com.docintegrity.analysis.service.InsufficientTextException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public class TextStatistics {

    static final int TYPE_TOKEN_WINDOW = 100;
    static final int READABILITY_WINDOW_SENTENCES = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy]+");

    private final int minWords;

    public TextStatistics(int minWords) {
        this.minWords = Math.max(1, minWords);
    }

    public int getMinWords() {
        return minWords;
    }

    public TextMetrics compute(String text) {
        List<String> words = words(text);
        if (words.size() < minWords) {
            throw new InsufficientTextException(words.size(), minWords);
        }

        List<String> sentences = SentenceSplitter.sentences(text);
        int[] sentenceLengths = new int[sentences.size()];
        int[] sentenceSyllables = new int[sentences.size()];
        int sentenceWordTotal = 0;
        for (int i = 0; i < sentences.size(); i++) {
            List<String> sentenceWords = words(sentences.get(i));
            sentenceLengths[i] = sentenceWords.size();
            sentenceSyllables[i] = syllables(sentenceWords);
            sentenceWordTotal += sentenceWords.size();
        }

        int sentenceCount = Math.max(1, sentences.size());
        double avgSentenceLength = (double) sentenceWordTotal / sentenceCount;
        double variance = 0.0;
        for (int length : sentenceLengths) {
            variance += (length - avgSentenceLength) * (length - avgSentenceLength);
        }
        variance = sentences.isEmpty() ? 0.0 : variance / sentences.size();

        int syllableTotal = syllables(words);
        double readingEase = fleschReadingEase(words.size(), sentenceCount, syllableTotal);
        double grade = 0.39 * ((double) words.size() / sentenceCount)
            + 11.8 * ((double) syllableTotal / words.size())
            - 15.59;

        return new TextMetrics(
            words.size(),
            text.length(),
            sentences.size(),
            round2(avgSentenceLength),
            round2(variance),
            round2(uniqueWordRatio(words)),
            round2(readingEase),
            round2(grade),
            round2(readabilityDeviation(sentenceLengths, sentenceSyllables))
        );
    }

    public static List<String> words(String text) {
        String stripped = text == null ? "" : text.strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(stripped));
    }

    public static int countWords(String text) {
        return words(text).size();
    }

    static double uniqueWordRatio(List<String> words) {
        List<String> tokens = new ArrayList<>(words.size());
        for (String word : words) {
            String token = normalizeToken(word);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        if (tokens.isEmpty()) {
            return 0.0;
        }
        if (tokens.size() <= TYPE_TOKEN_WINDOW) {
            return (double) countTokens(tokens, 0, tokens.size()).size() / tokens.size();
        }

        Map<String, Integer> counts = countTokens(tokens, 0, TYPE_TOKEN_WINDOW);
        double ratioSum = (double) counts.size() / TYPE_TOKEN_WINDOW;
        int windows = 1;
        for (int end = TYPE_TOKEN_WINDOW; end < tokens.size(); end++) {
            String leaving = tokens.get(end - TYPE_TOKEN_WINDOW);
            counts.computeIfPresent(leaving, (key, count) -> count == 1 ? null : count - 1);
            counts.merge(tokens.get(end), 1, Integer::sum);
            ratioSum += (double) counts.size() / TYPE_TOKEN_WINDOW;
            windows++;
        }
        return ratioSum / windows;
    }

    static double readabilityDeviation(int[] sentenceLengths, int[] sentenceSyllables) {
        int groupSize = sentenceLengths.length >= 2 * READABILITY_WINDOW_SENTENCES ? READABILITY_WINDOW_SENTENCES : 1;
        List<Double> scores = new ArrayList<>();
        for (int start = 0; start < sentenceLengths.length; start += groupSize) {
            int end = Math.min(start + groupSize, sentenceLengths.length);
            int groupWords = 0;
            int groupSyllables = 0;
            for (int i = start; i < end; i++) {
                groupWords += sentenceLengths[i];
                groupSyllables += sentenceSyllables[i];
            }
            if (groupWords > 0) {
                scores.add(fleschReadingEase(groupWords, end - start, groupSyllables));
            }
        }
        if (scores.size() < 2) {
            return 0.0;
        }
        double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double sumSquares = 0.0;
        for (double score : scores) {
            sumSquares += (score - mean) * (score - mean);
        }
        return Math.sqrt(sumSquares / scores.size());
    }

    static double fleschReadingEase(int words, int sentences, int syllables) {
        return 206.835 - 1.015 * ((double) words / sentences) - 84.6 * ((double) syllables / words);
    }

    static int syllables(List<String> words) {
        int total = 0;
        for (String word : words) {
            total += syllables(word);
        }
        return total;
    }

    // Vowel groups, minus a silent trailing "e".
    static int syllables(String word) {
        String letters = word.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        if (letters.isEmpty()) {
            return 1;
        }
        if (letters.length() <= 3) {
            return 1;
        }
        int count = (int) VOWEL_GROUP.matcher(letters).results().count();
        if (letters.endsWith("e") && !letters.endsWith("le") && !letters.endsWith("ee")) {
            count--;
        }
        return Math.max(1, count);
    }

    private static Map<String, Integer> countTokens(List<String> tokens, int from, int to) {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = from; i < to; i++) {
            counts.merge(tokens.get(i), 1, Integer::sum);
        }
        return counts;
    }

    private static String normalizeToken(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        int start = 0;
        int end = lower.length();
        while (start < end && !Character.isLetterOrDigit(lower.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(lower.charAt(end - 1))) {
            end--;
        }
        return lower.substring(start, end);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
