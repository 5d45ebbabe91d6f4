package com.docintegrity.analysis.domain;

public enum DetectionSource {
    HEURISTIC_ONLY,
    CLASSIFIER_PRIMARY,
    CLASSIFIER_FALLBACK
}
