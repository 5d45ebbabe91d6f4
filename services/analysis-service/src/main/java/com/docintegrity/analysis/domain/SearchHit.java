package com.docintegrity.analysis.domain;

public record SearchHit(
    String title,
    String url,
    String snippet
) {
}
