package com.docintegrity.analysis.service;

public class InsufficientTextException extends InvalidInputException {

    private final int wordCount;
    private final int minimumWords;

    public InsufficientTextException(int wordCount, int minimumWords) {
        super("Text too short: " + wordCount + " words (minimum " + minimumWords + " words required)");
        this.wordCount = wordCount;
        this.minimumWords = minimumWords;
    }

    public int getWordCount() {
        return wordCount;
    }

    public int getMinimumWords() {
        return minimumWords;
    }
}
