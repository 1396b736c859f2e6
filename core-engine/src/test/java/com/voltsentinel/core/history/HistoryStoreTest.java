package com.voltsentinel.core.history;

import com.voltsentinel.core.model.HealthRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HistoryStore}.
 */
class HistoryStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private HistoryStore store;

    @BeforeEach
    void setUp() {
        store = new HistoryStore("car-1", 5);
    }

    @Test
    @DisplayName("Should never exceed capacity and evict the oldest entries")
    void shouldEvictOldestOnOverflow() {
        for (int i = 0; i < 12; i++) {
            store.append(record(i, 12.0 + i));
            assertThat(store.size()).isLessThanOrEqualTo(5);
        }

        assertThat(store.snapshot())
                .extracting(HealthRecord::getVoltage)
                .containsExactly(19.0, 20.0, 21.0, 22.0, 23.0);
    }

    @Test
    @DisplayName("Should keep append order even for out-of-order timestamps")
    void shouldKeepAppendOrder() {
        store.append(record(10, 12.1));
        store.append(record(5, 12.2));
        store.append(record(20, 12.3));

        assertThat(store.snapshot())
                .extracting(HealthRecord::getVoltage)
                .containsExactly(12.1, 12.2, 12.3);
        assertThat(store.latest()).get().extracting(HealthRecord::getVoltage).isEqualTo(12.3);
    }

    @Test
    @DisplayName("Should exclude records exactly at the query bounds")
    void shouldUseStrictQueryBounds() {
        store.append(record(0, 12.0));
        store.append(record(10, 12.1));
        store.append(record(20, 12.2));

        List<HealthRecord> result = store.query(T0, T0.plusSeconds(20));

        assertThat(result).extracting(HealthRecord::getVoltage).containsExactly(12.1);
    }

    @Test
    @DisplayName("Should return the most recent records in chronological order")
    void shouldReturnTailChronologically() {
        for (int i = 0; i < 5; i++) {
            store.append(record(i, 12.0 + i));
        }

        assertThat(store.tail(2)).extracting(HealthRecord::getVoltage).containsExactly(15.0, 16.0);
        assertThat(store.tail(50)).hasSize(5);
        assertThat(store.tail(0)).isEmpty();
    }

    @Test
    @DisplayName("Should prune head entries older than the cutoff")
    void shouldPruneOlderThanCutoff() {
        store.append(record(0, 12.0));
        store.append(record(10, 12.1));
        store.append(record(20, 12.2));

        int removed = store.pruneOlderThan(T0.plusSeconds(10));

        assertThat(removed).isEqualTo(1);
        assertThat(store.snapshot()).extracting(HealthRecord::getVoltage).containsExactly(12.1, 12.2);
    }

    @Test
    @DisplayName("Should prune to a given size and clear")
    void shouldPruneToSizeAndClear() {
        for (int i = 0; i < 4; i++) {
            store.append(record(i, 12.0 + i));
        }

        assertThat(store.pruneToSize(1)).isEqualTo(3);
        assertThat(store.snapshot()).extracting(HealthRecord::getVoltage).containsExactly(15.0);

        store.clear();
        assertThat(store.isEmpty()).isTrue();
        assertThat(store.latest()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new HistoryStore("car-1", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxEntries");
    }

    private static HealthRecord record(int secondsOffset, double voltage) {
        return HealthRecord.builder()
                .vehicleId("car-1")
                .voltage(voltage)
                .stateOfCharge(80)
                .stateOfHealth(90)
                .timestamp(T0.plusSeconds(secondsOffset))
                .build();
    }
}
