package com.docintegrity.analysis.service.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.docintegrity.analysis.domain.AiDetectionResult;
import com.docintegrity.analysis.domain.AiVerdict;
import com.docintegrity.analysis.domain.ClassifierOutcome;
import com.docintegrity.analysis.domain.Confidence;
import com.docintegrity.analysis.domain.DetectionSource;
import com.docintegrity.analysis.domain.TextMetrics;
import com.docintegrity.analysis.service.verdict.ScoringThresholds;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AiDetectionScorerTest {

    private static final TextMetrics TWENTY_SENTENCES = metrics(20);
    private static final TextMetrics THREE_SENTENCES = metrics(3);

    private final AiDetectionScorer scorer = new AiDetectionScorer(ScoringThresholds.defaults(), 0.7, 20, 5);

    @Nested
    @DisplayName("With a classifier answer")
    class WithClassifier {

        @Test
        @DisplayName("should weight the classifier higher and report high confidence when both agree")
        void agreement() {
            AiDetectionResult result = scorer.score(TWENTY_SENTENCES, heuristic(70), available(0, 80));

            assertThat(result.probability()).isEqualTo(77.0);
            assertThat(result.confidence()).isEqualTo(Confidence.HIGH);
            assertThat(result.verdict()).isEqualTo(AiVerdict.LIKELY_AI);
            assertThat(result.source()).isEqualTo(DetectionSource.CLASSIFIER_PRIMARY);
            assertThat(result.heuristicScore()).isEqualTo(70.0);
            assertThat(result.complete()).isTrue();
        }

        @Test
        @DisplayName("should drop to medium confidence when the signals disagree")
        void disagreement() {
            AiDetectionResult result = scorer.score(TWENTY_SENTENCES, heuristic(20), available(0, 90));

            assertThat(result.probability()).isEqualTo(69.0);
            assertThat(result.confidence()).isEqualTo(Confidence.MEDIUM);
        }

        @Test
        @DisplayName("should mark answers from further down the chain as fallback")
        void fallback() {
            AiDetectionResult result = scorer.score(TWENTY_SENTENCES, heuristic(30), available(1, 30));

            assertThat(result.source()).isEqualTo(DetectionSource.CLASSIFIER_FALLBACK);
            assertThat(result.verdict()).isEqualTo(AiVerdict.LIKELY_HUMAN);
        }
    }

    @Nested
    @DisplayName("Heuristic only")
    class HeuristicOnly {

        @Test
        @DisplayName("should use the heuristic score and never claim high confidence")
        void mediumConfidence() {
            AiDetectionResult result = scorer.score(TWENTY_SENTENCES, heuristic(55), unavailable());

            assertThat(result.probability()).isEqualTo(55.0);
            assertThat(result.confidence()).isEqualTo(Confidence.MEDIUM);
            assertThat(result.verdict()).isEqualTo(AiVerdict.UNCERTAIN);
            assertThat(result.source()).isEqualTo(DetectionSource.HEURISTIC_ONLY);
            assertThat(result.classifier()).isInstanceOf(ClassifierOutcome.Unavailable.class);
        }

        @Test
        @DisplayName("should report low confidence for very short documents")
        void fewSentences() {
            AiDetectionResult result = scorer.score(THREE_SENTENCES, heuristic(55), unavailable());

            assertThat(result.confidence()).isEqualTo(Confidence.LOW);
        }

        @Test
        @DisplayName("should report low confidence and incompleteness when the classifier did not finish")
        void incomplete() {
            AiDetectionResult result = scorer.incomplete(TWENTY_SENTENCES, heuristic(55), unavailable());

            assertThat(result.confidence()).isEqualTo(Confidence.LOW);
            assertThat(result.complete()).isFalse();
            assertThat(result.source()).isEqualTo(DetectionSource.HEURISTIC_ONLY);
        }
    }

    private static HeuristicScore heuristic(double score) {
        return new HeuristicScore(score, 0.5, 0.5, 0.5);
    }

    private static ClassifierOutcome available(int position, double probability) {
        return new ClassifierOutcome.Available("stub", position, probability, null, null, null, List.of());
    }

    private static ClassifierOutcome unavailable() {
        return new ClassifierOutcome.Unavailable(List.of("openai: HTTP 503"));
    }

    private static TextMetrics metrics(int sentences) {
        return new TextMetrics(300, 1800, sentences, 15.0, 30.0, 0.6, 60.0, 9.0, 10.0);
    }
}
