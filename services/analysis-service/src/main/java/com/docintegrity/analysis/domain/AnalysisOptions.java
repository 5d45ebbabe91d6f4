package com.docintegrity.analysis.domain;

public record AnalysisOptions(boolean bypassCache) {

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(false);
    }
}
