package com.docintegrity.analysis.domain;

public record Chunk(
    int index,
    String text,
    int startOffset,
    int endOffset
) {

    public int length() {
        return endOffset - startOffset;
    }
}
