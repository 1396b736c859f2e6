package com.voltsentinel.core.alert;

import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertSeverity;
import com.voltsentinel.core.notify.Broadcaster;
import com.voltsentinel.core.notify.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Bounded, newest-first list of alerts across all vehicles.
 *
 * <p>
 * Appending inserts at the head and evicts from the tail once the ledger holds
 * more than {@code maxAlerts} entries. Every mutating call publishes an
 * unmodifiable snapshot of the full list to the subscribers, even when it
 * matched nothing. Two calls are exempt: {@link #markRead(String)} with an
 * unknown id, and a {@link #pruneOlderThan(Instant)} that removes nothing.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Mutations and queries are guarded by a {@link ReentrantLock}. Snapshots are
 * handed to the dispatch executor before the lock is released, so an
 * executor that runs tasks in submission order delivers them in mutation
 * order.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertLedger implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertLedger.class);

    public static final int DEFAULT_MAX_ALERTS = 100;

    private final int maxAlerts;
    private final List<AlertRecord> alerts = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Broadcaster<List<AlertRecord>> channel;

    /**
     * @param maxAlerts capacity; must be positive
     * @param executor  dispatch executor for alert-list notifications
     */
    public AlertLedger(int maxAlerts, Executor executor) {
        if (maxAlerts < 1) {
            throw new IllegalArgumentException("maxAlerts must be >= 1, got: " + maxAlerts);
        }
        this.maxAlerts = maxAlerts;
        this.channel = new Broadcaster<>("alerts", executor);
    }

    // ---------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------

    public void append(AlertRecord alert) {
        Objects.requireNonNull(alert, "AlertRecord must not be null");
        appendAll(List.of(alert));
    }

    /**
     * Append alerts in the given order; the last one ends up at the head.
     * Publishes a single snapshot.
     *
     * @param newAlerts alerts to append; an empty collection is a no-op
     */
    public void appendAll(Collection<AlertRecord> newAlerts) {
        Objects.requireNonNull(newAlerts, "Alerts must not be null");
        if (newAlerts.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            for (AlertRecord alert : newAlerts) {
                alerts.add(0, Objects.requireNonNull(alert, "AlertRecord must not be null"));
                logAlert(alert);
            }
            while (alerts.size() > maxAlerts) {
                alerts.remove(alerts.size() - 1);
            }
            publishLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Mark the alert with {@code id} as read. An unknown id is a silent no-op;
     * a known id broadcasts even if the alert was already read.
     */
    public void markRead(String id) {
        lock.lock();
        try {
            boolean found = false;
            ListIterator<AlertRecord> it = alerts.listIterator();
            while (it.hasNext()) {
                AlertRecord alert = it.next();
                if (alert.getId().equals(id)) {
                    it.set(alert.markedRead());
                    found = true;
                }
            }
            if (found) {
                publishLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    public void markAllRead() {
        markAllReadWhere(a -> true);
    }

    public void markAllRead(String vehicleId) {
        markAllReadWhere(a -> a.getVehicleId().equals(vehicleId));
    }

    /**
     * Remove the alert with {@code id}. Broadcasts whether or not it existed.
     *
     * @return {@code true} if an alert was removed
     */
    public boolean remove(String id) {
        return removeWhere(a -> a.getId().equals(id), true) > 0;
    }

    public int clear() {
        return removeWhere(a -> true, true);
    }

    public int clear(String vehicleId) {
        return removeWhere(a -> a.getVehicleId().equals(vehicleId), true);
    }

    /**
     * Remove alerts timestamped strictly before {@code cutoff}. Broadcasts
     * only when something was removed.
     *
     * @return number of removed alerts
     */
    public int pruneOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        return removeWhere(a -> a.getTimestamp().isBefore(cutoff), false);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable snapshot of every alert, newest first
     */
    public List<AlertRecord> query() {
        return filter(a -> true);
    }

    public List<AlertRecord> query(String vehicleId) {
        return filter(a -> a.getVehicleId().equals(vehicleId));
    }

    public List<AlertRecord> unread() {
        return filter(a -> !a.isRead());
    }

    public List<AlertRecord> unread(String vehicleId) {
        return filter(a -> !a.isRead() && a.getVehicleId().equals(vehicleId));
    }

    public int unreadCount() {
        return unread().size();
    }

    public int unreadCount(String vehicleId) {
        return unread(vehicleId).size();
    }

    public int size() {
        lock.lock();
        try {
            return alerts.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxAlerts() {
        return maxAlerts;
    }

    /**
     * Subscribe to alert-list snapshots. Only mutations after this call are delivered.
     */
    public Subscription subscribe(Consumer<? super List<AlertRecord>> listener) {
        return channel.subscribe(listener);
    }

    @Override
    public void close() {
        channel.close();
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private void markAllReadWhere(Predicate<AlertRecord> predicate) {
        lock.lock();
        try {
            ListIterator<AlertRecord> it = alerts.listIterator();
            while (it.hasNext()) {
                AlertRecord alert = it.next();
                if (predicate.test(alert)) {
                    it.set(alert.markedRead());
                }
            }
            publishLocked();
        } finally {
            lock.unlock();
        }
    }

    private int removeWhere(Predicate<AlertRecord> predicate, boolean alwaysPublish) {
        lock.lock();
        try {
            int before = alerts.size();
            alerts.removeIf(predicate);
            int removed = before - alerts.size();
            if (removed > 0) {
                LOG.debug("Removed {} alert(s)", removed);
            }
            if (removed > 0 || alwaysPublish) {
                publishLocked();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private List<AlertRecord> filter(Predicate<AlertRecord> predicate) {
        lock.lock();
        try {
            return Collections.unmodifiableList(alerts.stream().filter(predicate).toList());
        } finally {
            lock.unlock();
        }
    }

    private void publishLocked() {
        channel.publish(Collections.unmodifiableList(new ArrayList<>(alerts)));
    }

    private static void logAlert(AlertRecord alert) {
        if (alert.getSeverity() == AlertSeverity.CRITICAL) {
            LOG.warn("ALERT [{}] vehicle={} type={} - {}", alert.getSeverity(), alert.getVehicleId(),
                    alert.getType(), alert.getTitle());
        } else {
            LOG.info("ALERT [{}] vehicle={} type={} - {}", alert.getSeverity(), alert.getVehicleId(),
                    alert.getType(), alert.getTitle());
        }
    }
}
