package com.docintegrity.analysis.service.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.docintegrity.analysis.domain.AnalysisReport;
import com.docintegrity.analysis.testing.FakeClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReportCacheTest {

    private final FakeClock clock = new FakeClock(Instant.parse("2024-05-01T09:00:00Z"));
    private final ReportCache cache = new ReportCache(Duration.ofHours(24), 100, clock);

    @Test
    @DisplayName("should return a stored report by fingerprint")
    void hit() {
        AnalysisReport report = report("abc123");
        cache.put(report);

        assertThat(cache.get("abc123")).containsSame(report);
        assertThat(cache.get("unknown")).isEmpty();
    }

    @Test
    @DisplayName("should keep a report until its time to live has passed")
    void expiry() {
        cache.put(report("abc123"));

        clock.advance(Duration.ofHours(24).minusSeconds(1));
        assertThat(cache.get("abc123")).isPresent();

        clock.advance(Duration.ofSeconds(2));
        assertThat(cache.get("abc123")).isEmpty();
    }

    @Test
    @DisplayName("should replace an entry written again for the same fingerprint")
    void overwrite() {
        cache.put(report("abc123"));
        AnalysisReport newer = report("abc123");
        cache.put(newer);

        assertThat(cache.get("abc123")).containsSame(newer);
    }

    @Test
    @DisplayName("should drop expired entries when swept")
    void sweep() {
        cache.put(report("one"));
        cache.put(report("two"));

        clock.advance(Duration.ofHours(25));
        cache.evictExpired();

        assertThat(cache.size()).isZero();
    }

    private AnalysisReport report(String fingerprint) {
        return new AnalysisReport(fingerprint, "inline-text", clock.instant(), null, null, null, null);
    }
}
