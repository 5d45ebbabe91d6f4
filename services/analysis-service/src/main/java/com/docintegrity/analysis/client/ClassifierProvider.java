package com.docintegrity.analysis.client;

public interface ClassifierProvider {

    String id();

    ClassifierVerdict classify(String excerpt);
}
