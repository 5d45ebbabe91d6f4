package com.docintegrity.analysis.service.cache;

import com.docintegrity.analysis.domain.AnalysisReport;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ReportCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportCache.class);

    private final Cache<String, AnalysisReport> reports;
    private final Duration ttl;

    public ReportCache(Duration ttl, long maxEntries, Ticker ticker) {
        this.ttl = ttl;
        this.reports = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxEntries)
            .ticker(ticker)
            .recordStats()
            .build();
    }

    public Duration getTtl() {
        return ttl;
    }

    public Optional<AnalysisReport> get(String fingerprint) {
        try {
            return Optional.ofNullable(reports.getIfPresent(fingerprint));
        } catch (RuntimeException ex) {
            LOGGER.warn("Report cache lookup failed for {}, recomputing: {}", fingerprint, ex.toString());
            return Optional.empty();
        }
    }

    public void put(AnalysisReport report) {
        try {
            reports.put(report.documentId(), report);
        } catch (RuntimeException ex) {
            LOGGER.warn("Could not cache report {}: {}", report.documentId(), ex.toString());
        }
    }

    public long size() {
        return reports.estimatedSize();
    }

    public void evictExpired() {
        reports.cleanUp();
        LOGGER.debug("Report cache swept: {} entries, hit rate {}", reports.estimatedSize(), reports.stats().hitRate());
    }
}
