package com.docintegrity.analysis.service;

public class ExtractionException extends InvalidInputException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
