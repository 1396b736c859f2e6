package com.voltsentinel.core.detection;

import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertType;
import com.voltsentinel.core.model.HealthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Low charge rule: voltage at or below the class low threshold, or SOC at or
 * below {@code lowSoc}.
 *
 * <p>
 * Debounced: suppressed while any battery-low alert of the vehicle (low,
 * critical or disposal) is younger than {@code lowDebounceSeconds}.
 * </p>
 *
 * @since 1.0.0
 */
public class LowLevelRule implements AlertRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(LowLevelRule.class);

    public static final String NAME = "low_level";

    @Override
    public Stage getStage() {
        return Stage.LEVEL;
    }

    @Override
    public boolean applies(DetectionContext context) {
        HealthRecord record = context.getCurrent();
        return record.getVoltage() <= context.getProfile().getLowVoltage()
                || record.getStateOfCharge() <= context.getSettings().getLowSoc();
    }

    @Override
    public Optional<AlertRecord> evaluate(DetectionContext context) {
        if (!applies(context)) {
            return Optional.empty();
        }
        if (context.anyAlertYoungerThan(DetectionContext.ofType(AlertType.BATTERY_LOW),
                context.getSettings().lowDebounceWindow())) {
            LOG.trace("Rule [{}] debounced for {}", NAME, context.getCurrent().getVehicleId());
            return Optional.empty();
        }
        HealthRecord record = context.getCurrent();
        LOG.debug("Rule [{}] fired: vehicle={} voltage={} soc={}", NAME,
                record.getVehicleId(), record.getVoltage(), record.getStateOfCharge());
        return Optional.of(AlertFactory.lowLevel(record));
    }

    @Override
    public String getRuleName() {
        return NAME;
    }
}
