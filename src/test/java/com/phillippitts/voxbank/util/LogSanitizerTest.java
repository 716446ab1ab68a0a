package com.phillippitts.voxbank.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateKeepsShortStrings() {
        assertThat(LogSanitizer.truncate("gate", 10)).isEqualTo("gate");
        assertThat(LogSanitizer.truncate("breach in sector", 6)).isEqualTo("breach...");
        assertThat(LogSanitizer.truncate(null, 5)).isEmpty();
        assertThat(LogSanitizer.truncate("x", 0)).isEmpty();
    }

    @Test
    void describeReportsShapeOnly() {
        assertThat(LogSanitizer.describe("  Breach in   sector seven ")).isEqualTo("chars=27, words=4");
        assertThat(LogSanitizer.describe(null)).isEqualTo("chars=0, words=0");
        assertThat(LogSanitizer.describe("   ")).isEqualTo("chars=0, words=0");
    }
}
