package com.docintegrity.analysis.service;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(String fingerprint) {
        super("Report not found: " + fingerprint);
    }
}
