package com.docintegrity.analysis.domain;

public record SourceMatch(
    String title,
    String url,
    String snippet,
    double similarity,
    int chunkIndex
) {
}
