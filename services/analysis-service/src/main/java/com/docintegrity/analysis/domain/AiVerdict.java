package com.docintegrity.analysis.domain;

public enum AiVerdict {
    LIKELY_HUMAN("Likely human-written"),
    UNCERTAIN("Uncertain"),
    LIKELY_AI("Likely AI-generated");

    private final String label;

    AiVerdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
