package com.docintegrity.analysis.service.cache;

import com.docintegrity.analysis.config.AnalysisProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ReportCacheSweeper {

    private final AnalysisProperties properties;
    private final ReportCache reportCache;

    public ReportCacheSweeper(AnalysisProperties properties, ReportCache reportCache) {
        this.properties = properties;
        this.reportCache = reportCache;
    }

    @Scheduled(fixedDelayString = "${analysis.cache.sweep-fixed-delay-ms:600000}")
    public void sweep() {
        if (!properties.getCache().isSweepEnabled()) {
            return;
        }
        reportCache.evictExpired();
    }
}
