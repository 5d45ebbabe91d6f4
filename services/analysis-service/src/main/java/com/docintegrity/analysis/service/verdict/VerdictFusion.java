package com.docintegrity.analysis.service.verdict;

import com.docintegrity.analysis.domain.AiDetectionResult;
import com.docintegrity.analysis.domain.PlagiarismResult;
import com.docintegrity.analysis.domain.RiskLevel;
import com.docintegrity.analysis.domain.Verdict;
import java.util.Locale;

public class VerdictFusion {

    private final ScoringThresholds thresholds;

    public VerdictFusion(ScoringThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Verdict fuse(AiDetectionResult aiDetection, PlagiarismResult plagiarism) {
        return fuse(aiDetection.probability(), plagiarism.score());
    }

    public Verdict fuse(double aiProbability, double plagiarismScore) {
        boolean aiGenerated = thresholds.aiGenerated(aiProbability);
        boolean plagiarized = thresholds.plagiarized(plagiarismScore);
        RiskLevel riskLevel = thresholds.riskLevel(aiProbability, plagiarismScore);
        return new Verdict(riskLevel, aiGenerated, plagiarized, summary(riskLevel, aiGenerated, plagiarized));
    }

    private static String summary(RiskLevel riskLevel, boolean aiGenerated, boolean plagiarized) {
        String finding;
        if (aiGenerated && plagiarized) {
            finding = "Likely AI-generated and overlaps with existing sources";
        } else if (aiGenerated) {
            finding = "Likely AI-generated; no significant source overlap found";
        } else if (plagiarized) {
            finding = "Overlaps with existing sources; no strong AI-generation signal";
        } else {
            finding = "No strong AI-generation or plagiarism signal";
        }
        return finding + " (" + riskLevel.name().toLowerCase(Locale.ROOT) + " risk)";
    }
}
