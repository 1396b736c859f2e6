package com.voltsentinel.core.detection;

import com.voltsentinel.core.config.MonitorConfig;
import com.voltsentinel.core.config.ThresholdProfile;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.HealthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the configured {@link AlertRule}s against a newly ingested record.
 *
 * <h3>Scheduling</h3>
 * <ul>
 * <li>{@link AlertRule.Stage#LEVEL} rules form a tier: only the first rule
 * whose condition {@linkplain AlertRule#applies applies} is evaluated. If that
 * rule is suppressed, nothing in the tier fires.</li>
 * <li>{@link AlertRule.Stage#INDEPENDENT} rules are evaluated on every record.</li>
 * </ul>
 *
 * <p>
 * Every rule sees the same alert snapshot, taken before this pass. A rule that
 * throws is logged and skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AlertDetector.class);

    private final List<AlertRule> rules;
    private final MonitorConfig config;

    /**
     * Build the detector with the rules named in {@code config}, or every
     * built-in rule when the configuration names none.
     *
     * @throws IllegalArgumentException if a configured rule name is unknown
     */
    public AlertDetector(MonitorConfig config) {
        this(config, config.usesDefaultRules()
                ? AlertRuleFactory.createDefaults()
                : AlertRuleFactory.createAll(config.getRules()));
    }

    /**
     * @param config thresholds, profiles and windows; must not be {@code null}
     * @param rules  rules in evaluation order; must not be {@code null}
     */
    public AlertDetector(MonitorConfig config, List<AlertRule> rules) {
        this.config = Objects.requireNonNull(config, "MonitorConfig must not be null");
        Objects.requireNonNull(rules, "Rules must not be null");
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * Evaluate all rules for {@code record}.
     *
     * @param record        the newly ingested record; must not be {@code null}
     * @param history       the vehicle's history in append order, with or without {@code record} as last element
     * @param vehicleAlerts the vehicle's existing alerts, newest first
     * @return new alerts in rule order, possibly empty
     */
    public List<AlertRecord> evaluate(HealthRecord record, List<HealthRecord> history,
            List<AlertRecord> vehicleAlerts) {
        Objects.requireNonNull(record, "HealthRecord must not be null");

        ThresholdProfile profile = config.resolveProfile(record.getBatteryType());
        DetectionContext context = new DetectionContext(record, history, vehicleAlerts,
                profile, config.getDetection());

        List<AlertRecord> raised = new ArrayList<>();
        boolean levelTierTaken = false;
        for (AlertRule rule : rules) {
            try {
                if (rule.getStage() == AlertRule.Stage.LEVEL) {
                    if (levelTierTaken || !rule.applies(context)) {
                        continue;
                    }
                    levelTierTaken = true;
                }
                Optional<AlertRecord> alert = rule.evaluate(context);
                alert.ifPresent(raised::add);
            } catch (Exception e) {
                LOG.error("Rule [{}] threw an exception for vehicle {} - continuing with next rule",
                        rule.getRuleName(), record.getVehicleId(), e);
            }
        }
        return raised;
    }

    public List<AlertRule> getRules() {
        return rules;
    }

    public MonitorConfig getConfig() {
        return config;
    }
}
