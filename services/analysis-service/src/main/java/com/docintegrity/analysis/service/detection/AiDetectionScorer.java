package com.docintegrity.analysis.service.detection;

import com.docintegrity.analysis.domain.AiDetectionResult;
import com.docintegrity.analysis.domain.ClassifierOutcome;
import com.docintegrity.analysis.domain.Confidence;
import com.docintegrity.analysis.domain.DetectionSource;
import com.docintegrity.analysis.domain.TextMetrics;
import com.docintegrity.analysis.service.verdict.ScoringThresholds;

public class AiDetectionScorer {

    private final ScoringThresholds thresholds;
    private final double classifierWeight;
    private final double agreementTolerance;
    private final int minSentencesForConfidence;

    public AiDetectionScorer(
        ScoringThresholds thresholds,
        double classifierWeight,
        double agreementTolerance,
        int minSentencesForConfidence
    ) {
        if (classifierWeight < 0 || classifierWeight > 1) {
            throw new IllegalArgumentException("classifierWeight must be within [0, 1]");
        }
        this.thresholds = thresholds;
        this.classifierWeight = classifierWeight;
        this.agreementTolerance = agreementTolerance;
        this.minSentencesForConfidence = minSentencesForConfidence;
    }

    public AiDetectionResult score(TextMetrics metrics, HeuristicScore heuristic, ClassifierOutcome outcome) {
        if (outcome instanceof ClassifierOutcome.Available available) {
            double probability = round2(classifierWeight * available.probability()
                + (1.0 - classifierWeight) * heuristic.score());
            boolean agree = Math.abs(available.probability() - heuristic.score()) <= agreementTolerance;
            DetectionSource source = available.chainPosition() == 0
                ? DetectionSource.CLASSIFIER_PRIMARY
                : DetectionSource.CLASSIFIER_FALLBACK;
            return new AiDetectionResult(
                probability,
                agree ? Confidence.HIGH : Confidence.MEDIUM,
                thresholds.aiVerdict(probability),
                metrics,
                source,
                heuristic.score(),
                outcome,
                true
            );
        }

        Confidence confidence = metrics.totalSentences() < minSentencesForConfidence ? Confidence.LOW : Confidence.MEDIUM;
        return heuristicOnly(metrics, heuristic, outcome, confidence, true);
    }

    public AiDetectionResult incomplete(TextMetrics metrics, HeuristicScore heuristic, ClassifierOutcome outcome) {
        return heuristicOnly(metrics, heuristic, outcome, Confidence.LOW, false);
    }

    private AiDetectionResult heuristicOnly(
        TextMetrics metrics,
        HeuristicScore heuristic,
        ClassifierOutcome outcome,
        Confidence confidence,
        boolean complete
    ) {
        double probability = heuristic.score();
        return new AiDetectionResult(
            probability,
            confidence.atMost(Confidence.MEDIUM),
            thresholds.aiVerdict(probability),
            metrics,
            DetectionSource.HEURISTIC_ONLY,
            heuristic.score(),
            outcome,
            complete
        );
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
