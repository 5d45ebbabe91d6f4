package com.docintegrity.analysis.domain;

import java.time.Instant;

public record AnalysisReport(
    String documentId,
    String sourceName,
    Instant analyzedAt,
    TextMetrics textStats,
    AiDetectionResult aiDetection,
    PlagiarismResult plagiarism,
    Verdict overallVerdict
) {
}
