package com.docintegrity.analysis.service.verdict;

import static org.assertj.core.api.Assertions.assertThat;

import com.docintegrity.analysis.domain.AiVerdict;
import com.docintegrity.analysis.domain.RiskLevel;
import com.docintegrity.analysis.domain.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class VerdictFusionTest {

    private final VerdictFusion fusion = new VerdictFusion(ScoringThresholds.defaults());

    @Nested
    @DisplayName("Flags")
    class Flags {

        @Test
        @DisplayName("should flag AI generation only strictly above 60")
        void aiBoundary() {
            assertThat(fusion.fuse(60, 0).aiGenerated()).isFalse();
            assertThat(fusion.fuse(61, 0).aiGenerated()).isTrue();
        }

        @Test
        @DisplayName("should flag plagiarism only strictly above 30")
        void plagiarismBoundary() {
            assertThat(fusion.fuse(0, 30).plagiarized()).isFalse();
            assertThat(fusion.fuse(0, 31).plagiarized()).isTrue();
        }
    }

    @ParameterizedTest(name = "ai={0}, plagiarism={1} -> {2}")
    @CsvSource({
        "0, 0, LOW",
        "40, 30, LOW",
        "41, 0, MEDIUM",
        "0, 31, MEDIUM",
        "60, 50, MEDIUM",
        "61, 0, HIGH",
        "0, 51, HIGH",
        "100, 100, HIGH"
    })
    @DisplayName("should tier risk by the stricter of the two scores")
    void riskTiers(double ai, double plagiarism, RiskLevel expected) {
        assertThat(fusion.fuse(ai, plagiarism).riskLevel()).isEqualTo(expected);
    }

    @Test
    @DisplayName("should describe both findings in the summary")
    void summary() {
        Verdict verdict = fusion.fuse(85, 45);

        assertThat(verdict.summary()).isEqualTo("Likely AI-generated and overlaps with existing sources (high risk)");
    }

    @Test
    @DisplayName("should label AI probability with an uncertain band between the thresholds")
    void aiVerdictBands() {
        ScoringThresholds thresholds = ScoringThresholds.defaults();

        assertThat(thresholds.aiVerdict(40)).isEqualTo(AiVerdict.LIKELY_HUMAN);
        assertThat(thresholds.aiVerdict(40.01)).isEqualTo(AiVerdict.UNCERTAIN);
        assertThat(thresholds.aiVerdict(60)).isEqualTo(AiVerdict.UNCERTAIN);
        assertThat(thresholds.aiVerdict(60.01)).isEqualTo(AiVerdict.LIKELY_AI);
    }
}
