package com.voltsentinel.core.alert;

import com.voltsentinel.core.model.AlertRecord;
import com.voltsentinel.core.model.AlertSeverity;
import com.voltsentinel.core.model.AlertType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertLedger}.
 */
class AlertLedgerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private AlertLedger ledger;
    private List<List<AlertRecord>> published;

    @BeforeEach
    void setUp() {
        ledger = new AlertLedger(3, Runnable::run);
        published = new ArrayList<>();
        ledger.subscribe(published::add);
    }

    @Test
    @DisplayName("Should keep newest first and evict from the tail beyond capacity")
    void shouldBoundAndOrder() {
        for (int i = 0; i < 5; i++) {
            ledger.append(alert("a" + i, "car-1", i));
            assertThat(ledger.size()).isLessThanOrEqualTo(3);
        }

        assertThat(ledger.query()).extracting(AlertRecord::getId).containsExactly("a4", "a3", "a2");
    }

    @Test
    @DisplayName("Should mark a single alert read and leave unknown ids alone")
    void shouldMarkRead() {
        ledger.append(alert("a1", "car-1", 0));
        ledger.append(alert("a2", "car-1", 1));
        int before = published.size();

        ledger.markRead("a1");
        ledger.markRead("missing");

        assertThat(ledger.unread()).extracting(AlertRecord::getId).containsExactly("a2");
        assertThat(published).hasSize(before + 1);
    }

    @Test
    @DisplayName("Should produce the same state when markAllRead is called twice")
    void shouldMarkAllReadIdempotently() {
        ledger.append(alert("a1", "car-1", 0));
        ledger.append(alert("a2", "car-2", 1));

        ledger.markAllRead();
        List<AlertRecord> once = ledger.query();
        ledger.markAllRead();

        assertThat(ledger.query()).isEqualTo(once);
        assertThat(ledger.unreadCount()).isZero();
    }

    @Test
    @DisplayName("Should scope markAllRead, clear and queries to a vehicle")
    void shouldScopeByVehicle() {
        ledger.append(alert("a1", "car-1", 0));
        ledger.append(alert("a2", "car-2", 1));
        ledger.append(alert("a3", "car-1", 2));

        ledger.markAllRead("car-1");
        assertThat(ledger.unreadCount("car-1")).isZero();
        assertThat(ledger.unreadCount("car-2")).isEqualTo(1);

        assertThat(ledger.clear("car-1")).isEqualTo(2);
        assertThat(ledger.query()).extracting(AlertRecord::getId).containsExactly("a2");
        assertThat(ledger.query("car-1")).isEmpty();
    }

    @Test
    @DisplayName("Should remove a single alert by id")
    void shouldRemoveById() {
        ledger.append(alert("a1", "car-1", 0));

        assertThat(ledger.remove("a1")).isTrue();
        assertThat(ledger.remove("a1")).isFalse();
        assertThat(ledger.query()).isEmpty();
    }

    @Test
    @DisplayName("Should prune alerts older than the cutoff")
    void shouldPruneOlderThan() {
        ledger.append(alert("a1", "car-1", 0));
        ledger.append(alert("a2", "car-1", 100));

        assertThat(ledger.pruneOlderThan(T0.plusSeconds(100))).isEqualTo(1);
        assertThat(ledger.query()).extracting(AlertRecord::getId).containsExactly("a2");
    }

    @Test
    @DisplayName("Should broadcast an unmodifiable snapshot on every change")
    void shouldBroadcastSnapshots() {
        ledger.appendAll(List.of(alert("a1", "car-1", 0), alert("a2", "car-1", 1)));
        ledger.clear();

        assertThat(published).hasSize(2);
        assertThat(published.get(0)).extracting(AlertRecord::getId).containsExactly("a2", "a1");
        assertThat(published.get(1)).isEmpty();
        assertThatThrownBy(() -> published.get(0).clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should broadcast bulk mutations even when they match nothing")
    void shouldBroadcastBulkMutationsOnMiss() {
        ledger.clear();
        ledger.clear("car-9");
        ledger.markAllRead();
        ledger.markAllRead("car-9");
        ledger.remove("missing");

        assertThat(published).hasSize(5).allSatisfy(snapshot -> assertThat(snapshot).isEmpty());
    }

    @Test
    @DisplayName("Should stay silent for an unknown id, an empty append and an empty prune")
    void shouldNotBroadcastLookupMiss() {
        ledger.markRead("missing");
        ledger.appendAll(List.of());
        ledger.pruneOlderThan(T0);

        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("Should deliver the final state last when writers race")
    void shouldDeliverSnapshotsInMutationOrder() throws Exception {
        int writers = 4;
        int perWriter = 5;
        for (int round = 0; round < 200; round++) {
            AlertLedger shared = new AlertLedger(100, Runnable::run);
            AtomicReference<List<AlertRecord>> last = new AtomicReference<>(List.of());
            shared.subscribe(last::set);

            ExecutorService pool = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                String vehicle = "car-" + w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        shared.append(alert(vehicle + "-" + i, vehicle, i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertThat(last.get()).hasSize(writers * perWriter).isEqualTo(shared.query());
        }
    }

    @Test
    @DisplayName("Should not expose later changes through an earlier query result")
    void shouldReturnDefensiveCopies() {
        ledger.append(alert("a1", "car-1", 0));
        List<AlertRecord> snapshot = ledger.query();

        ledger.markRead("a1");

        assertThat(snapshot.get(0).isRead()).isFalse();
        assertThat(ledger.query().get(0).isRead()).isTrue();
    }

    private static AlertRecord alert(String id, String vehicleId, long secondsOffset) {
        return AlertRecord.builder()
                .id(id)
                .vehicleId(vehicleId)
                .type(AlertType.BATTERY_LOW)
                .severity(AlertSeverity.WARNING)
                .title("Low Battery Level")
                .timestamp(T0.plusSeconds(secondsOffset))
                .build();
    }
}
