package com.docintegrity.analysis.service.detection;

import com.docintegrity.analysis.domain.TextMetrics;

public class HeuristicScorer {

    private final HeuristicSettings settings;

    public HeuristicScorer(HeuristicSettings settings) {
        this.settings = settings;
    }

    public HeuristicScore score(TextMetrics metrics) {
        double uniformity = ramp(metrics.sentenceLengthVariance(), settings.varianceFullAt(), settings.varianceZeroAt());
        double repetition = ramp(metrics.uniqueWordRatio(), settings.uniqueRatioFullAt(), settings.uniqueRatioZeroAt());
        double smoothness = ramp(
            metrics.readabilityDeviation(),
            settings.readabilityDeviationFullAt(),
            settings.readabilityDeviationZeroAt()
        );

        double score = 100.0 * (settings.uniformityWeight() * uniformity
            + settings.repetitionWeight() * repetition
            + settings.smoothnessWeight() * smoothness);
        return new HeuristicScore(clamp(Math.round(score * 100.0) / 100.0), uniformity, repetition, smoothness);
    }

    private static double ramp(double value, double fullAt, double zeroAt) {
        if (value <= fullAt) {
            return 1.0;
        }
        if (value >= zeroAt) {
            return 0.0;
        }
        return (zeroAt - value) / (zeroAt - fullAt);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
