package com.voltsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorConfigLoader} and {@link MonitorConfig}.
 */
class MonitorConfigLoaderTest {

    @Test
    @DisplayName("Should load the bundled monitor.yml with default thresholds")
    void shouldLoadBundledConfig() {
        MonitorConfig config = MonitorConfigLoader.fromClasspath(MonitorConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getProfiles()).extracting(ThresholdProfile::getName).containsExactly("9V", "12V");
        assertThat(config.getDetection().getDisposalVoltage()).isEqualTo(4.5);
        assertThat(config.getDetection().lowDebounceWindow().toMinutes()).isEqualTo(30);
        assertThat(config.getRetention().getMaxHistoryEntries()).isEqualTo(1000);
        assertThat(config.getRetention().retentionPeriod().toDays()).isEqualTo(7);
        assertThat(config.getAnalytics().getTrendMinDataPoints()).isEqualTo(10);
        assertThat(config.getRules()).containsExactly("disposal", "critical_level", "low_level",
                "health_degradation", "swap_detection", "sudden_drop");
    }

    @Test
    @DisplayName("Should merge partial YAML sections with the defaults")
    void shouldMergePartialConfig() {
        MonitorConfig config = MonitorConfigLoader.fromClasspath("test-monitor.yml");

        assertThat(config.getProfiles()).extracting(ThresholdProfile::getName).containsExactly("6V", "12V");
        assertThat(config.getDetection().getSuddenDropDelta()).isEqualTo(0.5);
        assertThat(config.getDetection().getLowDebounceSeconds()).isEqualTo(600);
        assertThat(config.getDetection().getSwapVoltage()).isEqualTo(5.0);
        assertThat(config.getRetention().getMaxAlerts()).isEqualTo(20);
        assertThat(config.getRetention().getCleanupIntervalMinutes()).isEqualTo(60);
    }

    @Test
    @DisplayName("Should resolve profiles by battery type token, falling back to the tokenless profile")
    void shouldResolveProfiles() {
        MonitorConfig config = MonitorConfig.defaults();

        assertThat(config.resolveProfile("9V Alkaline").getName()).isEqualTo("9V");
        assertThat(config.resolveProfile("ALKALINE").getName()).isEqualTo("9V");
        assertThat(config.resolveProfile("12V lead-acid").getName()).isEqualTo("12V");
        assertThat(config.resolveProfile("unknown").getName()).isEqualTo("12V");
        assertThat(config.resolveProfile(null).getName()).isEqualTo("12V");
    }

    @Test
    @DisplayName("Should collect every validation error into one exception")
    void shouldRejectInvalidConfig() {
        assertThatThrownBy(() -> MonitorConfigLoader.fromClasspath("invalid-monitor.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fallback")
                .hasMessageContaining("lowVoltage")
                .hasMessageContaining("maxHistoryEntries");
    }

    @Test
    @DisplayName("Should require exactly one fallback profile")
    void shouldRequireSingleFallback() {
        MonitorConfig config = new MonitorConfig();
        config.setProfiles(List.of(
                new ThresholdProfile("a", List.of(), 6.5, 7.5),
                new ThresholdProfile("b", List.of(), 11.5, 12.0)));

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("found 2");
    }

    @Test
    @DisplayName("Should read a rules selection and run every rule when it is omitted")
    void shouldReadRuleSelection(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("rules.yml"), "rules: [disposal, sudden_drop]\n");

        MonitorConfig selected = MonitorConfigLoader.fromFile(file.toString());

        assertThat(selected.usesDefaultRules()).isFalse();
        assertThat(selected.getRules()).containsExactly("disposal", "sudden_drop");
        assertThat(MonitorConfig.defaults().usesDefaultRules()).isTrue();
        assertThat(MonitorConfig.defaults().getRules()).isEmpty();
    }

    @Test
    @DisplayName("Should reject an empty or duplicated rules selection")
    void shouldRejectInvalidRuleSelection() {
        MonitorConfig empty = MonitorConfig.defaults();
        empty.setRules(List.of());
        MonitorConfig duplicated = MonitorConfig.defaults();
        duplicated.setRules(List.of("disposal", "Disposal"));

        assertThatThrownBy(empty::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("rules must not be empty");
        assertThatThrownBy(duplicated::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> MonitorConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the config file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> MonitorConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path empty = Files.writeString(dir.resolve("empty.yml"), "");

        MonitorConfig config = MonitorConfigLoader.fromFile(empty.toString());

        assertThat(config.getProfiles()).hasSize(2);
        assertThat(config.getDetection().getSuddenDropDelta()).isEqualTo(1.0);
    }
}
