package com.docintegrity.analysis.client;

public record ClassifierVerdict(
    double probability,
    String label,
    Double rawConfidence
) {

    public ClassifierVerdict {
        if (Double.isNaN(probability) || probability < 0 || probability > 100) {
            throw new IllegalArgumentException("probability must be within 0-100 but was " + probability);
        }
    }
}
