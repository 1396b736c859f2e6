package com.voltsentinel.core.detection;

import com.voltsentinel.core.config.DetectionSettings;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertType;
import com.voltsentinel.core.model.HealthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Ultra-low voltage rule: a battery at or below the disposal voltage is dead,
 * whatever its class.
 *
 * <h3>Hysteresis</h3>
 * <p>
 * Once a disposal alert exists for the vehicle, another one is only raised
 * after some record newer than that alert has risen above
 * {@code disposalVoltage + disposalRecoveryMargin}. A dead battery hovering
 * around the floor therefore produces a single alert.
 * </p>
 *
 * @since 1.0.0
 */
public class DisposalRule implements AlertRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DisposalRule.class);

    public static final String NAME = "disposal";

    @Override
    public Stage getStage() {
        return Stage.LEVEL;
    }

    @Override
    public boolean applies(DetectionContext context) {
        return context.getCurrent().getVoltage() <= context.getSettings().getDisposalVoltage();
    }

    @Override
    public Optional<AlertRecord> evaluate(DetectionContext context) {
        if (!applies(context)) {
            return Optional.empty();
        }

        Optional<AlertRecord> existing = context.newestAlert(a -> a.getType() == AlertType.BATTERY_LOW
                && a.hasReason(AlertFactory.REASON_DISPOSAL));

        if (existing.isPresent() && !recoveredSince(existing.get(), context)) {
            LOG.trace("Rule [{}] suppressed for {}: no recovery since {}", NAME,
                    context.getCurrent().getVehicleId(), existing.get().getId());
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: vehicle={} voltage={}", NAME,
                context.getCurrent().getVehicleId(), context.getCurrent().getVoltage());
        return Optional.of(AlertFactory.disposal(context.getCurrent()));
    }

    private static boolean recoveredSince(AlertRecord alert, DetectionContext context) {
        DetectionSettings settings = context.getSettings();
        double recovery = settings.getDisposalVoltage() + settings.getDisposalRecoveryMargin();
        for (HealthRecord record : context.getHistory()) {
            if (record.getTimestamp().isAfter(alert.getTimestamp()) && record.getVoltage() > recovery) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getRuleName() {
        return NAME;
    }
}
