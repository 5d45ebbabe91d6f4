package com.docintegrity.analysis.service.plagiarism;

import static org.assertj.core.api.Assertions.assertThat;

import com.docintegrity.analysis.testing.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ShingleOverlapMetricTest {

    private final ShingleOverlapMetric metric = new ShingleOverlapMetric(3, 5);

    @Test
    @DisplayName("should score identical text at 100 regardless of case and punctuation")
    void identical() {
        assertThat(metric.score(Fixtures.COPIED_PASSAGE, Fixtures.COPIED_PASSAGE.toUpperCase())).isEqualTo(100.0);
    }

    @Test
    @DisplayName("should score a passage contained in a longer page at 100")
    void contained() {
        assertThat(metric.score(Fixtures.COPIED_PASSAGE, Fixtures.SOURCE_PAGE)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("should score unrelated text near 0")
    void unrelated() {
        assertThat(metric.score(Fixtures.COPIED_PASSAGE, Fixtures.UNIFORM_TEXT)).isLessThan(5.0);
    }

    @Test
    @DisplayName("should be symmetric")
    void symmetric() {
        String partial = "Honey bees communicate the location of distant flowers by smell and colour alone.";

        assertThat(metric.score(partial, Fixtures.COPIED_PASSAGE))
            .isEqualTo(metric.score(Fixtures.COPIED_PASSAGE, partial))
            .isBetween(20.0, 80.0);
    }

    @Test
    @DisplayName("should fall back to Jaccard similarity for very short texts")
    void shortTexts() {
        assertThat(metric.score("red green", "red blue")).isEqualTo(33.33);
        assertThat(metric.score("", "anything")).isZero();
    }
}
