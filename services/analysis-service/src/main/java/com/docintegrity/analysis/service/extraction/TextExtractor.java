package com.docintegrity.analysis.service.extraction;

public interface TextExtractor {

    boolean supports(String filename);

    String extract(byte[] bytes, String filename);
}
