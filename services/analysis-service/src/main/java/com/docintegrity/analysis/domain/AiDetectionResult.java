package com.docintegrity.analysis.domain;

public record AiDetectionResult(
    double probability,
    Confidence confidence,
    AiVerdict verdict,
    TextMetrics metrics,
    DetectionSource source,
    double heuristicScore,
    ClassifierOutcome classifier,
    boolean complete
) {
}
