package com.voltsentinel.core.service;

import com.voltsentinel.core.alert.AlertLedger;
import com.voltsentinel.core.analytics.AnalyticsEngine;
import com.voltsentinel.core.analytics.BatteryAnalytics;
import com.voltsentinel.core.config.MonitorConfig;
import com.voltsentinel.core.detection.AlertDetector;
import com.voltsentinel.core.history.HistoryStore;
import com.voltsentinel.core.ingest.HealthRecordNormalizer;
import com.voltsentinel.core.ingest.TopicRoute;
import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.HealthPayload;
import com.voltsentinel.core.model.HealthRecord;
import com.voltsentinel.core.notify.Broadcaster;
import com.voltsentinel.core.notify.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Battery monitoring orchestrator.
 *
 * <p>
 * Ingestion normalizes a payload, appends it to the vehicle's
 * {@link HistoryStore}, runs the {@link AlertDetector} against the history and
 * the vehicle's existing alerts, appends raised alerts to the
 * {@link AlertLedger}, updates the cached current health and notifies the
 * vehicle's health subscribers.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Ingestion and resets of one vehicle are serialized by a per-vehicle
 * {@link ReentrantLock}; different vehicles proceed in parallel. Health
 * updates are submitted to the notification executor while that lock is held,
 * so the default single-threaded executor delivers them in mutation order.
 * </p>
 *
 * <h3>Failure Semantics</h3>
 * <p>
 * {@link #ingest(String, HealthPayload)} never throws: blank vehicle ids and
 * internal failures are logged and the call becomes a no-op. Lookups of
 * unknown vehicles or alert ids return empty results.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorService.class);

    private final MonitorConfig config;
    private final Clock clock;
    private final AlertDetector detector;
    private final AnalyticsEngine analyticsEngine;
    private final AlertLedger ledger;
    private final RecordSink recordSink;
    private final Executor notificationExecutor;
    /** Non-null only when the service created the notification executor itself. */
    private final ExecutorService ownedNotificationExecutor;
    private final ScheduledExecutorService cleanupScheduler;
    private final ScheduledFuture<?> cleanupTask;

    private final Map<String, VehicleState> vehicles = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private MonitorService(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.recordSink = builder.recordSink;
        this.detector = new AlertDetector(config);
        this.analyticsEngine = new AnalyticsEngine(config.getAnalytics());

        if (builder.notificationExecutor != null) {
            this.ownedNotificationExecutor = null;
            this.notificationExecutor = builder.notificationExecutor;
        } else {
            this.ownedNotificationExecutor = Executors.newSingleThreadExecutor(
                    daemonFactory("volt-sentinel-notify"));
            this.notificationExecutor = ownedNotificationExecutor;
        }
        this.ledger = new AlertLedger(config.getRetention().getMaxAlerts(), notificationExecutor);

        if (builder.scheduleCleanup) {
            long intervalMs = config.getRetention().cleanupInterval().toMillis();
            this.cleanupScheduler = Executors.newSingleThreadScheduledExecutor(
                    daemonFactory("volt-sentinel-cleanup"));
            this.cleanupTask = cleanupScheduler.scheduleAtFixedRate(this::scheduledCleanup,
                    intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.cleanupScheduler = null;
            this.cleanupTask = null;
        }

        LOG.info("MonitorService started: {} profile(s), maxHistoryEntries={}, maxAlerts={}, cleanup={}",
                config.getProfiles().size(), config.getRetention().getMaxHistoryEntries(),
                config.getRetention().getMaxAlerts(),
                builder.scheduleCleanup ? config.getRetention().cleanupInterval() : "disabled");
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Ingest a decoded payload given as a plain map.
     *
     * @see #ingest(String, HealthPayload)
     */
    public List<AlertRecord> ingest(String vehicleId, Map<String, ?> payload) {
        return ingest(vehicleId, HealthPayload.of(payload));
    }

    /**
     * Ingest one health payload for a vehicle.
     *
     * @param vehicleId owning vehicle; blank ids make the call a no-op
     * @param payload   decoded payload; missing fields are defaulted
     * @return alerts raised by this record, possibly empty
     */
    public List<AlertRecord> ingest(String vehicleId, HealthPayload payload) {
        if (closed.get()) {
            LOG.warn("Ignoring health payload for {}: service is closed", vehicleId);
            return List.of();
        }
        if (vehicleId == null || vehicleId.isBlank()) {
            LOG.warn("Ignoring health payload without vehicle id: {}", payload);
            return List.of();
        }

        VehicleState state = lockedStateFor(vehicleId);
        HealthRecord record;
        List<AlertRecord> raised;
        try {
            record = HealthRecordNormalizer.normalize(vehicleId, payload, clock.instant());
            state.history.append(record);
            state.current = record;
            raised = detector.evaluate(record, state.history.snapshot(), ledger.query(vehicleId));
            ledger.appendAll(raised);
            state.channel.publish(Optional.of(record));
        } catch (RuntimeException e) {
            LOG.error("Failed to ingest health payload for {}", vehicleId, e);
            return List.of();
        } finally {
            state.lock.unlock();
        }

        writeThrough(record, raised);
        LOG.debug("Ingested {} ({} alert(s))", record, raised.size());
        return raised;
    }

    /**
     * Ingest a payload received on a telemetry topic. Only
     * {@code car/{vehicleId}/battery/health} topics are ingested; anything else
     * is ignored.
     *
     * @param topic   the topic the payload arrived on
     * @param payload decoded payload
     * @return alerts raised by this record, possibly empty
     */
    public List<AlertRecord> ingestFromTopic(String topic, Map<String, ?> payload) {
        Optional<TopicRoute> route = TopicRoute.parse(topic);
        if (route.isEmpty() || !route.get().isBatteryHealth()) {
            LOG.debug("Ignoring payload on non battery-health topic '{}'", topic);
            return List.of();
        }
        return ingest(route.get().getVehicleId(), payload);
    }

    // ---------------------------------------------------------------
    // Health queries
    // ---------------------------------------------------------------

    public Optional<HealthRecord> currentHealth(String vehicleId) {
        VehicleState state = vehicleId != null ? vehicles.get(vehicleId) : null;
        return state != null ? Optional.ofNullable(state.current) : Optional.empty();
    }

    /**
     * @return the vehicle's full history in ingestion order, empty for unknown vehicles
     */
    public List<HealthRecord> history(String vehicleId) {
        return existing(vehicleId).map(s -> s.history.snapshot()).orElse(List.of());
    }

    /**
     * @param limit number of most recent records to return
     * @return the {@code limit} most recent records in chronological order
     */
    public List<HealthRecord> history(String vehicleId, int limit) {
        return existing(vehicleId).map(s -> s.history.tail(limit)).orElse(List.of());
    }

    /**
     * Records with {@code start < timestamp < end}. Both bounds are exclusive.
     */
    public List<HealthRecord> historyBetween(String vehicleId, Instant start, Instant end) {
        return existing(vehicleId).map(s -> s.history.query(start, end)).orElse(List.of());
    }

    /**
     * Analytics over the configured default period.
     */
    public BatteryAnalytics analytics(String vehicleId) {
        return analytics(vehicleId, config.getAnalytics().defaultPeriod());
    }

    /**
     * Analytics over the records strictly inside {@code (now - period, now)}.
     *
     * @param period window length; {@code null} selects the configured default
     * @return the aggregates, zero-filled when no record falls in the window
     */
    public BatteryAnalytics analytics(String vehicleId, Duration period) {
        Duration window = period != null ? period : config.getAnalytics().defaultPeriod();
        Instant end = clock.instant();
        return analyticsEngine.compute(historyBetween(vehicleId, end.minus(window), end), window);
    }

    /**
     * @return ids of every vehicle the service holds state for, sorted
     */
    public Set<String> vehicles() {
        return Collections.unmodifiableSet(new TreeSet<>(vehicles.keySet()));
    }

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    public List<AlertRecord> alerts() {
        return ledger.query();
    }

    public List<AlertRecord> alerts(String vehicleId) {
        return ledger.query(vehicleId);
    }

    public List<AlertRecord> unreadAlerts() {
        return ledger.unread();
    }

    public List<AlertRecord> unreadAlerts(String vehicleId) {
        return ledger.unread(vehicleId);
    }

    public int unreadCount() {
        return ledger.unreadCount();
    }

    public int unreadCount(String vehicleId) {
        return ledger.unreadCount(vehicleId);
    }

    public void markRead(String alertId) {
        ledger.markRead(alertId);
    }

    public void markAllRead() {
        ledger.markAllRead();
    }

    public void markAllRead(String vehicleId) {
        ledger.markAllRead(vehicleId);
    }

    /**
     * @return {@code true} if an alert with {@code alertId} existed
     */
    public boolean clearAlert(String alertId) {
        return ledger.remove(alertId);
    }

    public void clearAlerts() {
        ledger.clear();
    }

    public void clearAlerts(String vehicleId) {
        ledger.clear(vehicleId);
    }

    // ---------------------------------------------------------------
    // Administrative resets
    // ---------------------------------------------------------------

    /**
     * Drop the vehicle's history and current health and publish an empty health update.
     */
    public void clearHistory(String vehicleId) {
        existing(vehicleId).ifPresent(state -> {
            state.lock.lock();
            try {
                state.history.clear();
                state.current = null;
                state.channel.publish(Optional.empty());
            } finally {
                state.lock.unlock();
            }
            LOG.info("Cleared history of {}", vehicleId);
        });
    }

    public void clearAllHistory() {
        vehicles.keySet().forEach(this::clearHistory);
    }

    /**
     * Keep only records timestamped at or after {@code now - keep}.
     * A zero or negative {@code keep} clears all history.
     *
     * @param keep retention window
     */
    public void resetAnalyticsWindow(Duration keep) {
        if (keep == null || keep.getSeconds() <= 0) {
            clearAllHistory();
            return;
        }
        Instant cutoff = clock.instant().minus(keep);
        for (VehicleState state : vehicles.values()) {
            state.lock.lock();
            try {
                state.history.pruneOlderThan(cutoff);
                Optional<HealthRecord> latest = state.history.latest();
                state.current = latest.orElse(null);
                state.channel.publish(latest);
            } finally {
                state.lock.unlock();
            }
        }
        LOG.info("Analytics window reset, keeping records since {}", cutoff);
    }

    /**
     * Prune every history and the alert ledger to the retention period.
     * Vehicles left with no history and no health subscribers are dropped
     * from the registry.
     *
     * @return number of removed history records and alerts
     */
    public int runRetentionCleanup() {
        Instant cutoff = clock.instant().minus(config.getRetention().retentionPeriod());
        int removed = 0;
        int evicted = 0;
        for (Map.Entry<String, VehicleState> entry : vehicles.entrySet()) {
            VehicleState state = entry.getValue();
            state.lock.lock();
            try {
                removed += state.history.pruneOlderThan(cutoff);
                if (state.history.isEmpty() && state.channel.subscriberCount() == 0) {
                    state.evicted = true;
                    vehicles.remove(entry.getKey(), state);
                    state.channel.close();
                    evicted++;
                }
            } finally {
                state.lock.unlock();
            }
        }
        removed += ledger.pruneOlderThan(cutoff);
        LOG.info("Retention cleanup removed {} entries older than {}, evicted {} idle vehicle(s)",
                removed, cutoff, evicted);
        return removed;
    }

    // ---------------------------------------------------------------
    // Subscriptions
    // ---------------------------------------------------------------

    /**
     * Subscribe to the vehicle's health updates. An empty value signals that
     * the vehicle's history was cleared. Only future updates are delivered;
     * use {@link #currentHealth(String)} for the cached value.
     */
    public Subscription subscribeHealth(String vehicleId, Consumer<? super Optional<HealthRecord>> listener) {
        Objects.requireNonNull(vehicleId, "vehicleId must not be null");
        VehicleState state = lockedStateFor(vehicleId);
        try {
            return state.channel.subscribe(listener);
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Subscribe to alert-list snapshots, published after every ledger mutation.
     */
    public Subscription subscribeAlerts(Consumer<? super List<AlertRecord>> listener) {
        return ledger.subscribe(listener);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public boolean isClosed() {
        return closed.get();
    }

    public MonitorConfig getConfig() {
        return config;
    }

    /**
     * Cancel the cleanup task, close every channel and release all state.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
            cleanupScheduler.shutdownNow();
        }
        vehicles.values().forEach(state -> state.channel.close());
        vehicles.clear();
        ledger.close();
        if (ownedNotificationExecutor != null) {
            ownedNotificationExecutor.shutdown();
        }
        LOG.info("MonitorService closed");
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private VehicleState stateFor(String vehicleId) {
        return vehicles.computeIfAbsent(vehicleId, id -> new VehicleState(id,
                config.getRetention().getMaxHistoryEntries(), notificationExecutor));
    }

    /**
     * Resolve the vehicle's state with its lock held, retrying if a concurrent
     * cleanup evicted the instance in between.
     */
    private VehicleState lockedStateFor(String vehicleId) {
        while (true) {
            VehicleState state = stateFor(vehicleId);
            state.lock.lock();
            if (!state.evicted) {
                return state;
            }
            state.lock.unlock();
        }
    }

    private Optional<VehicleState> existing(String vehicleId) {
        return vehicleId != null ? Optional.ofNullable(vehicles.get(vehicleId)) : Optional.empty();
    }

    private void writeThrough(HealthRecord record, List<AlertRecord> raised) {
        try {
            recordSink.onHealthRecord(record);
            raised.forEach(recordSink::onAlert);
        } catch (RuntimeException e) {
            LOG.error("Record sink failed for {}", record.getVehicleId(), e);
        }
    }

    private void scheduledCleanup() {
        try {
            runRetentionCleanup();
        } catch (RuntimeException e) {
            LOG.error("Retention cleanup failed, retrying next interval", e);
        }
    }

    private static ThreadFactory daemonFactory(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Per-vehicle state owned by the service.
     */
    private static final class VehicleState {
        private final HistoryStore history;
        private final Broadcaster<Optional<HealthRecord>> channel;
        private final ReentrantLock lock = new ReentrantLock();
        private volatile HealthRecord current;
        /** Guarded by {@link #lock}. */
        private boolean evicted;

        private VehicleState(String vehicleId, int maxEntries, Executor executor) {
            this.history = new HistoryStore(vehicleId, maxEntries);
            this.channel = new Broadcaster<>("health:" + vehicleId, executor);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MonitorService}.
     */
    public static class Builder {
        private MonitorConfig config = MonitorConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private Executor notificationExecutor;
        private RecordSink recordSink = RecordSink.noop();
        private boolean scheduleCleanup = true;

        public Builder config(MonitorConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Executor that delivers notifications. When unset the service starts
         * and owns a single daemon thread.
         */
        public Builder notificationExecutor(Executor notificationExecutor) {
            this.notificationExecutor = notificationExecutor;
            return this;
        }

        public Builder recordSink(RecordSink recordSink) {
            this.recordSink = recordSink;
            return this;
        }

        /**
         * Whether to run the retention cleanup periodically. Defaults to {@code true}.
         */
        public Builder scheduleCleanup(boolean scheduleCleanup) {
            this.scheduleCleanup = scheduleCleanup;
            return this;
        }

        /**
         * @return a new, started {@link MonitorService}
         * @throws NullPointerException  if config, clock or record sink is {@code null}
         * @throws IllegalStateException if the configuration is invalid
         */
        public MonitorService build() {
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            Objects.requireNonNull(recordSink, "recordSink must not be null");
            config.validate();
            return new MonitorService(this);
        }
    }
}
