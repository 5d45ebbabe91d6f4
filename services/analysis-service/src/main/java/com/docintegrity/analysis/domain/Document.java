package com.docintegrity.analysis.domain;

public record Document(
    String text,
    int wordCount,
    int characterCount,
    int sentenceCount,
    String sourceName,
    String fingerprint
) {
}
