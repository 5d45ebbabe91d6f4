package com.docintegrity.analysis.domain;

import java.util.Objects;

public record AnalysisInput(String text, byte[] bytes, String sourceName) {

    public static final String INLINE_SOURCE = "inline-text";

    public AnalysisInput {
        if ((text == null) == (bytes == null)) {
            throw new IllegalArgumentException("Exactly one of text or bytes must be provided");
        }
        sourceName = sourceName == null || sourceName.isBlank() ? INLINE_SOURCE : sourceName;
    }

    public static AnalysisInput ofText(String text) {
        return new AnalysisInput(Objects.requireNonNull(text, "text"), null, INLINE_SOURCE);
    }

    public static AnalysisInput ofText(String text, String sourceName) {
        return new AnalysisInput(Objects.requireNonNull(text, "text"), null, sourceName);
    }

    public static AnalysisInput ofDocument(byte[] bytes, String filename) {
        return new AnalysisInput(null, Objects.requireNonNull(bytes, "bytes"), filename);
    }

    public boolean hasText() {
        return text != null;
    }
}
