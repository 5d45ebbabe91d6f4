package com.docintegrity.analysis.service.detection;

public record HeuristicScore(
    double score,
    double uniformity,
    double repetition,
    double smoothness
) {
}
