package com.voltsentinel.core.detection;

import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * State-of-health rule: SOH at or below {@code healthDegradationSoh}.
 * At most one alert per vehicle per {@code healthDebounceSeconds}.
 *
 * @since 1.0.0
 */
public class HealthDegradationRule implements AlertRule {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(HealthDegradationRule.class);

    public static final String NAME = "health_degradation";

    @Override
    public Stage getStage() {
        return Stage.INDEPENDENT;
    }

    @Override
    public boolean applies(DetectionContext context) {
        return context.getCurrent().getStateOfHealth() <= context.getSettings().getHealthDegradationSoh();
    }

    @Override
    public Optional<AlertRecord> evaluate(DetectionContext context) {
        if (!applies(context)) {
            return Optional.empty();
        }
        if (context.anyAlertYoungerThan(DetectionContext.ofType(AlertType.HEALTH_DEGRADATION),
                context.getSettings().healthDebounceWindow())) {
            return Optional.empty();
        }
        LOG.debug("Rule [{}] fired: vehicle={} soh={}", NAME,
                context.getCurrent().getVehicleId(), context.getCurrent().getStateOfHealth());
        return Optional.of(AlertFactory.healthDegradation(context.getCurrent(),
                context.getSettings().getHealthWarningSoh()));
    }

    @Override
    public String getRuleName() {
        return NAME;
    }
}
