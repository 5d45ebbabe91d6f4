package com.docintegrity.analysis.domain;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
