package com.docintegrity.analysis.service.plagiarism;

public interface SimilarityMetric {

    double score(String first, String second);
}
