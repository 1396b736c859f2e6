package com.voltsentinel.core.detection;

import com.voltsentinel.core.config.DetectionSettings;
import com.voltsentinel.core.config.ThresholdProfile;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertType;
import com.voltsentinel.core.model.HealthRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable input of one detection pass.
 *
 * <p>
 * {@code history} is the vehicle's history in append order and ends with the
 * record under evaluation. {@code alerts} are the vehicle's alerts as they
 * stood <em>before</em> this pass, newest first; alerts raised during the pass
 * are not visible to the other rules of the same pass.
 * </p>
 *
 * <p>
 * "Now" for every window is the current record's timestamp.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionContext {

    private final HealthRecord current;
    private final List<HealthRecord> history;
    private final List<AlertRecord> alerts;
    private final ThresholdProfile profile;
    private final DetectionSettings settings;

    public DetectionContext(HealthRecord current, List<HealthRecord> history, List<AlertRecord> alerts,
            ThresholdProfile profile, DetectionSettings settings) {
        this.current = Objects.requireNonNull(current, "current record must not be null");
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");

        List<HealthRecord> h = history != null ? new ArrayList<>(history) : new ArrayList<>();
        if (h.isEmpty() || h.get(h.size() - 1) != current) {
            h.add(current);
        }
        this.history = Collections.unmodifiableList(h);
        this.alerts = alerts != null
                ? Collections.unmodifiableList(new ArrayList<>(alerts))
                : Collections.emptyList();
    }

    public HealthRecord getCurrent() {
        return current;
    }

    public Instant now() {
        return current.getTimestamp();
    }

    /**
     * @return full history including the current record as last element
     */
    public List<HealthRecord> getHistory() {
        return history;
    }

    /**
     * @return the record appended immediately before the current one
     */
    public Optional<HealthRecord> previousRecord() {
        return history.size() >= 2 ? Optional.of(history.get(history.size() - 2)) : Optional.empty();
    }

    /**
     * @return the vehicle's alerts before this pass, newest first
     */
    public List<AlertRecord> getAlerts() {
        return alerts;
    }

    public ThresholdProfile getProfile() {
        return profile;
    }

    public DetectionSettings getSettings() {
        return settings;
    }

    /**
     * @return the newest existing alert matching {@code filter}
     */
    public Optional<AlertRecord> newestAlert(Predicate<AlertRecord> filter) {
        return alerts.stream().filter(filter).findFirst();
    }

    /**
     * Strict window: an alert exactly {@code window} old no longer counts.
     */
    public boolean anyAlertYoungerThan(Predicate<AlertRecord> filter, Duration window) {
        return alerts.stream()
                .filter(filter)
                .anyMatch(a -> Duration.between(a.getTimestamp(), now()).compareTo(window) < 0);
    }

    /**
     * Inclusive window: an alert exactly {@code window} old still counts.
     */
    public boolean anyAlertWithin(Predicate<AlertRecord> filter, Duration window) {
        return alerts.stream()
                .filter(filter)
                .anyMatch(a -> Duration.between(a.getTimestamp(), now()).compareTo(window) <= 0);
    }

    static Predicate<AlertRecord> ofType(AlertType type) {
        return a -> a.getType() == type;
    }

    @Override
    public String toString() {
        return "DetectionContext{current=" + current + ", historySize=" + history.size()
                + ", alerts=" + alerts.size() + ", profile=" + profile.getName() + '}';
    }
}
