package com.pulsewatch.core.model;

import com.pulsewatch.core.error.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SloDefinition}.
 */
class SloDefinitionTest {

    @Test
    @DisplayName("Should derive error budget and SLI comparison")
    void shouldDeriveBudgetAndComparison() {
        SloDefinition def = new SloDefinition("api-latency", "api", "latency_ms", "latency", 300, "lte", 99.9, 30);

        def.validate();
        assertThat(def.errorBudgetFraction()).isCloseTo(0.001, within(1e-12));
        assertThat(def.sliKind()).isEqualTo(SliType.LATENCY);
        assertThat(def.comparison().isGood(300, 300)).isTrue();
        assertThat(def.comparison().isGood(301, 300)).isFalse();
        assertThat(def.getBurnRateFast()).isEqualTo(14.4);
    }

    @Test
    @DisplayName("Should list every problem of a malformed definition")
    void shouldListAllProblems() {
        SloDefinition def = new SloDefinition("broken", "", "m", "speed", 1, "lt", 100, 120);

        assertThatThrownBy(def::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("requires 'service'")
                .hasMessageContaining("targetPercentage")
                .hasMessageContaining("windowDays");
    }
}
