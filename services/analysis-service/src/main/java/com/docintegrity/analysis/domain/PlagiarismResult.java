package com.docintegrity.analysis.domain;

import java.util.List;

public record PlagiarismResult(
    double score,
    List<SourceMatch> sources,
    int chunksTotal,
    int chunksChecked,
    int chunksFailed,
    boolean complete,
    String note
) {

    public PlagiarismResult {
        sources = List.copyOf(sources);
    }

    public static PlagiarismResult notChecked(int chunksTotal, String note) {
        return new PlagiarismResult(0.0, List.of(), chunksTotal, 0, 0, true, note);
    }
}
