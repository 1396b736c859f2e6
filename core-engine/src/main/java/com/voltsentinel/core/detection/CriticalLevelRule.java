package com.voltsentinel.core.detection;

import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.HealthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Critical charge rule: voltage at or below the class critical threshold, or
 * SOC at or below {@code criticalSoc}.
 *
 * <p>
 * Not debounced; every qualifying record raises an alert.
 * </p>
 *
 * @since 1.0.0
 */
public class CriticalLevelRule implements AlertRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CriticalLevelRule.class);

    public static final String NAME = "critical_level";

    @Override
    public Stage getStage() {
        return Stage.LEVEL;
    }

    @Override
    public boolean applies(DetectionContext context) {
        HealthRecord record = context.getCurrent();
        return record.getVoltage() <= context.getProfile().getCriticalVoltage()
                || record.getStateOfCharge() <= context.getSettings().getCriticalSoc();
    }

    @Override
    public Optional<AlertRecord> evaluate(DetectionContext context) {
        if (!applies(context)) {
            return Optional.empty();
        }
        HealthRecord record = context.getCurrent();
        LOG.debug("Rule [{}] fired: vehicle={} voltage={} soc={} profile={}", NAME,
                record.getVehicleId(), record.getVoltage(), record.getStateOfCharge(),
                context.getProfile().getName());
        return Optional.of(AlertFactory.criticalLevel(record));
    }

    @Override
    public String getRuleName() {
        return NAME;
    }
}
