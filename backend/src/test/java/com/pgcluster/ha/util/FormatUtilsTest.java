package com.pgcluster.ha.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FormatUtils")
class FormatUtilsTest {

    @Test
    @DisplayName("should convert bytes to mebibytes")
    void shouldConvertToMebibytes() {
        assertThat(FormatUtils.toMebibytes(3L * 1024 * 1024)).isEqualTo(3.0);
        assertThat(FormatUtils.toMebibytes(512L * 1024)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("should format mebibytes with two decimals")
    void shouldFormatMebibytes() {
        assertThat(FormatUtils.formatMebibytes(3.0)).isEqualTo("3.00MiB");
        assertThat(FormatUtils.formatMebibytes(2.346)).isEqualTo("2.35MiB");
    }

    @Test
    @DisplayName("should use a dot separator regardless of default locale")
    void shouldIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertThat(FormatUtils.formatMebibytes(3.5)).isEqualTo("3.50MiB");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
