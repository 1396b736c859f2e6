package com.voltsentinel.core.detection;

import com.voltsentinel.core.model.AlertRecord;

import java.io.Serializable;
import java.util.Optional;

/**
 * Contract for all battery alert rules.
 * <p>
 * Rules are <strong>stateless</strong>: everything a rule needs (the new
 * record, the vehicle's history and its existing alerts) arrives in the
 * {@link DetectionContext}, so a rule can be exercised in isolation.
 * </p>
 * <p>
 * Rules must be {@link Serializable} because the Flink job ships the
 * detector to its task managers.
 * </p>
 */
public interface AlertRule extends Serializable {

    /**
     * How a rule is scheduled by the {@link AlertDetector}.
     */
    enum Stage {
        /** Voltage/charge tier: only the first rule whose condition applies is evaluated. */
        LEVEL,
        /** Evaluated on every record regardless of the other rules. */
        INDEPENDENT
    }

    /**
     * @return the stage this rule belongs to
     */
    Stage getStage();

    /**
     * Decide whether the rule's trigger condition holds for the current record,
     * ignoring debounce and hysteresis.
     *
     * @param context detection input
     * @return {@code true} if the condition holds
     */
    boolean applies(DetectionContext context);

    /**
     * Evaluate the rule, applying its suppression window.
     *
     * @param context detection input
     * @return the alert to raise, or empty when the condition does not hold or is suppressed
     */
    Optional<AlertRecord> evaluate(DetectionContext context);

    /**
     * @return unique rule name
     */
    String getRuleName();
}
