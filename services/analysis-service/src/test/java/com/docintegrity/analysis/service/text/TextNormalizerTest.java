package com.docintegrity.analysis.service.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    @DisplayName("should unify line endings and page breaks")
    void lineEndings() {
        assertThat(TextNormalizer.normalize("one\r\ntwo\rthree\ffour")).isEqualTo("one\ntwo\nthree\nfour");
    }

    @Test
    @DisplayName("should collapse horizontal whitespace and trim around line breaks")
    void whitespace() {
        assertThat(TextNormalizer.normalize("  a  \t b \n c  d  ")).isEqualTo("a b\nc d");
    }

    @Test
    @DisplayName("should keep paragraph breaks but collapse longer runs of blank lines")
    void paragraphs() {
        assertThat(TextNormalizer.normalize("a\n\n\n\nb\n\nc")).isEqualTo("a\n\nb\n\nc");
    }

    @Test
    @DisplayName("should drop control characters")
    void controlCharacters() {
        assertThat(TextNormalizer.normalize("bell\u0007 and null\u0000 gone")).isEqualTo("bell and null gone");
    }

    @Test
    @DisplayName("should treat null as empty text")
    void nullText() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
    }

    @Test
    @DisplayName("should give the same fingerprint to texts that differ only in whitespace")
    void fingerprintOfNormalizedText() {
        String first = ContentFingerprint.of(TextNormalizer.normalize("Same words here.\r\n"));
        String second = ContentFingerprint.of(TextNormalizer.normalize("  Same   words here."));

        assertThat(first).isEqualTo(second).hasSize(64);
        assertThat(ContentFingerprint.of("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
