package com.docintegrity.analysis.service.verdict;

import com.docintegrity.analysis.domain.AiVerdict;
import com.docintegrity.analysis.domain.RiskLevel;

public record ScoringThresholds(
    double aiLikelyAbove,
    double humanAtOrBelow,
    double highRiskAi,
    double highRiskPlagiarism,
    double mediumRiskAi,
    double mediumRiskPlagiarism,
    double plagiarizedAbove
) {

    public ScoringThresholds {
        if (humanAtOrBelow > aiLikelyAbove) {
            throw new IllegalArgumentException("humanAtOrBelow must not exceed aiLikelyAbove");
        }
        if (mediumRiskAi > highRiskAi || mediumRiskPlagiarism > highRiskPlagiarism) {
            throw new IllegalArgumentException("medium risk thresholds must not exceed high risk thresholds");
        }
    }

    public static ScoringThresholds defaults() {
        return new ScoringThresholds(60, 40, 60, 50, 40, 30, 30);
    }

    public AiVerdict aiVerdict(double probability) {
        if (probability > aiLikelyAbove) {
            return AiVerdict.LIKELY_AI;
        }
        if (probability <= humanAtOrBelow) {
            return AiVerdict.LIKELY_HUMAN;
        }
        return AiVerdict.UNCERTAIN;
    }

    public boolean aiGenerated(double probability) {
        return probability > aiLikelyAbove;
    }

    public boolean plagiarized(double plagiarismScore) {
        return plagiarismScore > plagiarizedAbove;
    }

    public RiskLevel riskLevel(double aiProbability, double plagiarismScore) {
        if (aiProbability > highRiskAi || plagiarismScore > highRiskPlagiarism) {
            return RiskLevel.HIGH;
        }
        if (aiProbability > mediumRiskAi || plagiarismScore > mediumRiskPlagiarism) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
