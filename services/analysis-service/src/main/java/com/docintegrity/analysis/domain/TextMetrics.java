package com.docintegrity.analysis.domain;

public record TextMetrics(
    int totalWords,
    int totalCharacters,
    int totalSentences,
    double avgSentenceLength,
    double sentenceLengthVariance,
    double uniqueWordRatio,
    double fleschReadingEase,
    double fleschKincaidGrade,
    double readabilityDeviation
) {
}
