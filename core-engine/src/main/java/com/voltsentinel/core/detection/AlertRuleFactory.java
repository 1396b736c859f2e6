package com.voltsentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates {@link AlertRule} instances by name.
 *
 * <p>
 * This is the single point of extension when adding new rules: register the
 * name here and, if it belongs in the default set, in {@link #DEFAULT_ORDER}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AlertRuleFactory.class);

    /** Evaluation order of the built-in rules. The level tier comes first. */
    public static final List<String> DEFAULT_ORDER = List.of(
            DisposalRule.NAME,
            CriticalLevelRule.NAME,
            LowLevelRule.NAME,
            HealthDegradationRule.NAME,
            SwapDetectionRule.NAME,
            SuddenDropRule.NAME);

    private AlertRuleFactory() {
        // utility class
    }

    /**
     * Create a rule by name.
     *
     * @param name rule name, case-insensitive; must not be {@code null}
     * @return the rule
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static AlertRule create(String name) {
        Objects.requireNonNull(name, "Rule name must not be null");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case DisposalRule.NAME -> new DisposalRule();
            case CriticalLevelRule.NAME -> new CriticalLevelRule();
            case LowLevelRule.NAME -> new LowLevelRule();
            case HealthDegradationRule.NAME -> new HealthDegradationRule();
            case SwapDetectionRule.NAME -> new SwapDetectionRule();
            case SuddenDropRule.NAME -> new SuddenDropRule();
            default -> throw new IllegalArgumentException(
                    "Unknown rule: '" + name + "'. Supported rules: " + String.join(", ", DEFAULT_ORDER));
        };
    }

    /**
     * Create rules for every name in the list, keeping the list order.
     *
     * @param names rule names; must not be {@code null}
     * @return unmodifiable list of rules
     */
    public static List<AlertRule> createAll(List<String> names) {
        Objects.requireNonNull(names, "Rule names must not be null");
        LOG.info("Creating {} alert rule(s)", names.size());
        return Collections.unmodifiableList(names.stream()
                .map(AlertRuleFactory::create)
                .toList());
    }

    /**
     * @return the built-in rules in {@link #DEFAULT_ORDER}
     */
    public static List<AlertRule> createDefaults() {
        return createAll(DEFAULT_ORDER);
    }
}
