package com.voltsentinel.core.history;

import com.voltsentinel.core.model.HealthRecord;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, append-ordered buffer of {@link HealthRecord}s for one vehicle.
 *
 * <p>
 * Records are kept in the order they were appended, never re-sorted, so an
 * out-of-order timestamp stays where it arrived. When the buffer exceeds its
 * capacity the oldest entries are evicted from the head.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All operations synchronize on the store. Read operations return copies.
 * </p>
 *
 * @since 1.0.0
 */
public class HistoryStore implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private final String vehicleId;
    private final int maxEntries;
    private final Deque<HealthRecord> records = new ArrayDeque<>();

    public HistoryStore(String vehicleId) {
        this(vehicleId, DEFAULT_MAX_ENTRIES);
    }

    /**
     * @param vehicleId  owning vehicle; must not be {@code null}
     * @param maxEntries capacity; must be positive
     * @throws IllegalArgumentException if {@code maxEntries} is not positive
     */
    public HistoryStore(String vehicleId, int maxEntries) {
        this.vehicleId = Objects.requireNonNull(vehicleId, "vehicleId must not be null");
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Append a record at the tail, evicting from the head on overflow.
     *
     * @param record the record; must not be {@code null}
     */
    public synchronized void append(HealthRecord record) {
        Objects.requireNonNull(record, "HealthRecord must not be null");
        records.addLast(record);
        while (records.size() > maxEntries) {
            records.pollFirst();
        }
    }

    /**
     * Return records with {@code startTime < timestamp < endTime}, in stored order.
     * Both bounds are exclusive.
     *
     * @param startTime exclusive lower bound
     * @param endTime   exclusive upper bound
     * @return matching records, possibly empty
     */
    public synchronized List<HealthRecord> query(Instant startTime, Instant endTime) {
        Objects.requireNonNull(startTime, "startTime must not be null");
        Objects.requireNonNull(endTime, "endTime must not be null");
        List<HealthRecord> result = new ArrayList<>();
        for (HealthRecord record : records) {
            Instant ts = record.getTimestamp();
            if (ts.isAfter(startTime) && ts.isBefore(endTime)) {
                result.add(record);
            }
        }
        return result;
    }

    public synchronized Optional<HealthRecord> latest() {
        return Optional.ofNullable(records.peekLast());
    }

    /**
     * @return copy of every stored record, oldest first
     */
    public synchronized List<HealthRecord> snapshot() {
        return new ArrayList<>(records);
    }

    /**
     * Return the {@code limit} most recent records in chronological order.
     *
     * @param limit maximum number of records; non-positive yields an empty list
     * @return up to {@code limit} records, oldest first
     */
    public synchronized List<HealthRecord> tail(int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        List<HealthRecord> all = new ArrayList<>(records);
        int from = Math.max(0, all.size() - limit);
        return new ArrayList<>(all.subList(from, all.size()));
    }

    /**
     * Remove head entries timestamped strictly before {@code cutoff}.
     * Stops at the first entry that is not older, as the buffer is append-ordered.
     *
     * @param cutoff the retention boundary
     * @return number of removed entries
     */
    public synchronized int pruneOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        int removed = 0;
        while (!records.isEmpty() && records.peekFirst().getTimestamp().isBefore(cutoff)) {
            records.pollFirst();
            removed++;
        }
        return removed;
    }

    /**
     * Evict from the head until at most {@code size} entries remain.
     *
     * @param size entries to keep; negative is treated as zero
     * @return number of removed entries
     */
    public synchronized int pruneToSize(int size) {
        int keep = Math.max(0, size);
        int removed = 0;
        while (records.size() > keep) {
            records.pollFirst();
            removed++;
        }
        return removed;
    }

    public synchronized void clear() {
        records.clear();
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized boolean isEmpty() {
        return records.isEmpty();
    }

    public String getVehicleId() {
        return vehicleId;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    @Override
    public synchronized String toString() {
        return "HistoryStore{vehicleId='" + vehicleId + "', size=" + records.size()
                + ", maxEntries=" + maxEntries + '}';
    }
}
