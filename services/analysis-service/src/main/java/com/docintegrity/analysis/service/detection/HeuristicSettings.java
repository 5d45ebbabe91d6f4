package com.docintegrity.analysis.service.detection;

public record HeuristicSettings(
    double uniformityWeight,
    double repetitionWeight,
    double smoothnessWeight,
    double varianceFullAt,
    double varianceZeroAt,
    double uniqueRatioFullAt,
    double uniqueRatioZeroAt,
    double readabilityDeviationFullAt,
    double readabilityDeviationZeroAt
) {

    public HeuristicSettings {
        double total = uniformityWeight + repetitionWeight + smoothnessWeight;
        if (Math.abs(total - 1.0) > 1e-6) {
            throw new IllegalArgumentException("Heuristic weights must sum to 1.0 but were " + total);
        }
        if (varianceFullAt >= varianceZeroAt
            || uniqueRatioFullAt >= uniqueRatioZeroAt
            || readabilityDeviationFullAt >= readabilityDeviationZeroAt) {
            throw new IllegalArgumentException("Heuristic ramp bounds must satisfy fullAt < zeroAt");
        }
    }

    public static HeuristicSettings defaults() {
        return new HeuristicSettings(0.35, 0.30, 0.35, 10, 40, 0.45, 0.72, 6, 20);
    }
}
