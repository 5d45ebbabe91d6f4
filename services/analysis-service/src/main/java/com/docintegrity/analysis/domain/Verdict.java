package com.docintegrity.analysis.domain;

public record Verdict(
    RiskLevel riskLevel,
    boolean aiGenerated,
    boolean plagiarized,
    String summary
) {
}
