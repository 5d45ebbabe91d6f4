package com.docintegrity.analysis.domain;

public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    public Confidence atMost(Confidence cap) {
        return this.compareTo(cap) > 0 ? cap : this;
    }
}
