package com.docintegrity.analysis.service;

import java.time.Duration;

public class PipelineTimeoutException extends RuntimeException {

    public PipelineTimeoutException(Duration budget) {
        super("Analysis did not produce any result within " + budget.toMillis() + " ms");
    }
}
