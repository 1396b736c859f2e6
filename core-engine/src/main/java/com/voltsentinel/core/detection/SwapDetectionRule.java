package com.voltsentinel.core.detection;

import com.voltsentinel.core.config.DetectionSettings;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertType;
import com.voltsentinel.core.model.HealthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Detects a healthy battery replaced by a nearly empty one: the previous
 * sample was "good" (at least {@code lowVoltage + goodVoltageMargin}) and the
 * current one is at or below {@code swapVoltage}, no more than
 * {@code swapMaxGapSeconds} apart.
 *
 * <p>
 * Raises a critical sudden-drop alert tagged {@code reason=swap_detected}.
 * Repeats within {@code swapDebounceSeconds} of an earlier swap alert are
 * suppressed. The generic {@link SuddenDropRule} is not affected by this rule.
 * </p>
 *
 * @since 1.0.0
 */
public class SwapDetectionRule implements AlertRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SwapDetectionRule.class);

    public static final String NAME = "swap_detection";

    @Override
    public Stage getStage() {
        return Stage.INDEPENDENT;
    }

    @Override
    public boolean applies(DetectionContext context) {
        return reference(context).isPresent();
    }

    @Override
    public Optional<AlertRecord> evaluate(DetectionContext context) {
        Optional<HealthRecord> previous = reference(context);
        if (previous.isEmpty()) {
            return Optional.empty();
        }

        DetectionSettings settings = context.getSettings();
        if (context.anyAlertWithin(a -> a.getType() == AlertType.SUDDEN_DROP
                && a.hasReason(AlertFactory.REASON_SWAP), settings.swapDebounceWindow())) {
            LOG.trace("Rule [{}] debounced for {}", NAME, context.getCurrent().getVehicleId());
            return Optional.empty();
        }

        HealthRecord prev = previous.get();
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put(AlertRecord.REASON_KEY, AlertFactory.REASON_SWAP);
        extra.put("detected", "good_to_very_low");
        extra.put("previousWasGood", prev.getVoltage());
        extra.put("lowThreshold", context.getProfile().getLowVoltage());
        extra.put("margin", settings.getGoodVoltageMargin());

        LOG.debug("Rule [{}] fired: vehicle={} {}V -> {}V", NAME,
                context.getCurrent().getVehicleId(), prev.getVoltage(), context.getCurrent().getVoltage());
        return Optional.of(AlertFactory.suddenDrop(prev, context.getCurrent(), extra));
    }

    private static Optional<HealthRecord> reference(DetectionContext context) {
        Optional<HealthRecord> previous = context.previousRecord();
        if (previous.isEmpty()) {
            return Optional.empty();
        }
        HealthRecord prev = previous.get();
        HealthRecord current = context.getCurrent();
        DetectionSettings settings = context.getSettings();

        double goodVoltage = context.getProfile().getLowVoltage() + settings.getGoodVoltageMargin();
        Duration gap = Duration.between(prev.getTimestamp(), current.getTimestamp()).abs();

        boolean wasGood = prev.getVoltage() >= goodVoltage;
        boolean nowVeryLow = current.getVoltage() <= settings.getSwapVoltage();
        return wasGood && nowVeryLow && gap.compareTo(settings.swapMaxGap()) <= 0
                ? previous
                : Optional.empty();
    }

    @Override
    public String getRuleName() {
        return NAME;
    }
}
