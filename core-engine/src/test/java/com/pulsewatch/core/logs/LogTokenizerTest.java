package com.pulsewatch.core.logs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LogTokenizer} and {@link VariableMasker}.
 */
class LogTokenizerTest {

    @Test
    @DisplayName("Should split on whitespace and structural punctuation")
    void shouldSplitOnSeparators() {
        assertThat(LogTokenizer.tokenize("status=ok, [worker-1] took (12ms) \"fast\""))
                .containsExactly("status", "ok", "worker-1", "took", "12ms", "fast");
    }

    @Test
    @DisplayName("Should map an empty line to a single placeholder token")
    void shouldHandleEmptyLine() {
        assertThat(LogTokenizer.tokenize("   ")).containsExactly(LogTokenizer.EMPTY_TOKEN);
        assertThat(LogTokenizer.tokenize(null)).containsExactly(LogTokenizer.EMPTY_TOKEN);
    }

    @Test
    @DisplayName("Should mask typed variables")
    void shouldMaskVariables() {
        assertThat(VariableMasker.mask("Request 550e8400-e29b-41d4-a716-446655440000 from 10.1.2.3 took 35 ms"))
                .isEqualTo("Request <UUID> from <IP> took <NUM> ms");
        assertThat(VariableMasker.mask("alice@example.com fetched https://example.com/a?b=1 at 2026-04-01T09:00:00Z"))
                .isEqualTo("<EMAIL> fetched <URL> at <TIMESTAMP>");
        assertThat(VariableMasker.mask("segfault at 0x7ffe1234 reading /var/lib/app/data.db"))
                .isEqualTo("segfault at <ADDR> reading <PATH>");
        assertThat(VariableMasker.mask("")).isEmpty();
    }
}
