package com.voltsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertRuleFactory}.
 */
class AlertRuleFactoryTest {

    @Test
    @DisplayName("Should create every built-in rule by name, case-insensitively")
    void shouldCreateByName() {
        assertThat(AlertRuleFactory.create("DISPOSAL")).isInstanceOf(DisposalRule.class);
        assertThat(AlertRuleFactory.create("critical_level")).isInstanceOf(CriticalLevelRule.class);
        assertThat(AlertRuleFactory.create("low_level")).isInstanceOf(LowLevelRule.class);
        assertThat(AlertRuleFactory.create("health_degradation")).isInstanceOf(HealthDegradationRule.class);
        assertThat(AlertRuleFactory.create("swap_detection")).isInstanceOf(SwapDetectionRule.class);
        assertThat(AlertRuleFactory.create("sudden_drop")).isInstanceOf(SuddenDropRule.class);
    }

    @Test
    @DisplayName("Should build the defaults with the level tier first")
    void shouldBuildDefaultsInOrder() {
        List<AlertRule> rules = AlertRuleFactory.createDefaults();

        assertThat(rules).extracting(AlertRule::getRuleName).containsExactlyElementsOf(AlertRuleFactory.DEFAULT_ORDER);
        assertThat(rules.subList(0, 3)).allMatch(r -> r.getStage() == AlertRule.Stage.LEVEL);
        assertThat(rules.subList(3, 6)).allMatch(r -> r.getStage() == AlertRule.Stage.INDEPENDENT);
    }

    @Test
    @DisplayName("Should throw for unknown rule names")
    void shouldThrowForUnknownRule() {
        assertThatThrownBy(() -> AlertRuleFactory.create("voltage_spike"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown rule");
    }

    @Test
    @DisplayName("Should return an unmodifiable list")
    void shouldReturnUnmodifiableList() {
        List<AlertRule> rules = AlertRuleFactory.createAll(List.of("sudden_drop"));

        assertThatThrownBy(() -> rules.add(new DisposalRule()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
