package com.voltsentinel.core.detection;

import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertType;
import com.voltsentinel.core.model.HealthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Generic sudden voltage drop rule.
 *
 * <p>
 * The reference sample is the earliest record inside the
 * {@code suddenDropWindowSeconds} lookback, or the immediately previous
 * record when none falls inside it. Fires when
 * {@code reference.voltage - current.voltage >= suddenDropDelta} and no
 * sudden-drop alert of any reason exists within the same window.
 * </p>
 *
 * @since 1.0.0
 */
public class SuddenDropRule implements AlertRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SuddenDropRule.class);

    public static final String NAME = "sudden_drop";

    @Override
    public Stage getStage() {
        return Stage.INDEPENDENT;
    }

    @Override
    public boolean applies(DetectionContext context) {
        return reference(context)
                .filter(ref -> drop(ref, context.getCurrent()) >= context.getSettings().getSuddenDropDelta())
                .isPresent();
    }

    @Override
    public Optional<AlertRecord> evaluate(DetectionContext context) {
        if (!applies(context)) {
            return Optional.empty();
        }
        Duration window = context.getSettings().suddenDropWindow();
        if (context.anyAlertWithin(DetectionContext.ofType(AlertType.SUDDEN_DROP), window)) {
            LOG.trace("Rule [{}] debounced for {}", NAME, context.getCurrent().getVehicleId());
            return Optional.empty();
        }

        HealthRecord reference = reference(context).orElseThrow();
        LOG.debug("Rule [{}] fired: vehicle={} drop={}V", NAME,
                context.getCurrent().getVehicleId(), drop(reference, context.getCurrent()));
        return Optional.of(AlertFactory.suddenDrop(reference, context.getCurrent(), null));
    }

    /**
     * Walk backwards from the previous record while samples stay inside the
     * lookback window; the last one reached is the earliest in the window.
     */
    static Optional<HealthRecord> reference(DetectionContext context) {
        List<HealthRecord> history = context.getHistory();
        if (history.size() < 2) {
            return Optional.empty();
        }
        HealthRecord current = context.getCurrent();
        Duration window = context.getSettings().suddenDropWindow();

        HealthRecord reference = history.get(history.size() - 2);
        for (int i = history.size() - 2; i >= 0; i--) {
            HealthRecord candidate = history.get(i);
            Duration age = Duration.between(candidate.getTimestamp(), current.getTimestamp());
            if (age.compareTo(window) > 0) {
                break;
            }
            reference = candidate;
        }
        return Optional.of(reference);
    }

    private static double drop(HealthRecord reference, HealthRecord current) {
        return reference.getVoltage() - current.getVoltage();
    }

    @Override
    public String getRuleName() {
        return NAME;
    }
}
