package com.compliancescan.store;

import com.compliancescan.model.ScanRun;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryScanRunStoreTest {

    private final InMemoryScanRunStore store = new InMemoryScanRunStore();

    private static ScanRun running(String id, Instant startedAt) {
        return ScanRun.builder()
                .id(id)
                .trigger(ScanRun.Trigger.MANUAL)
                .startedAt(startedAt)
                .status(ScanRun.Status.RUNNING)
                .build();
    }

    @Test
    void shouldListNewestFirst() {
        store.insert(running("a", Instant.parse("2026-01-01T00:00:00Z")));
        store.insert(running("b", Instant.parse("2026-01-02T00:00:00Z")));

        assertEquals(List.of("b", "a"), store.findAll().stream().map(ScanRun::getId).toList());
    }

    @Test
    void shouldCompleteRunOnlyOnce() {
        ScanRun run = running("a", Instant.parse("2026-01-01T00:00:00Z"));
        store.insert(run);
        ScanRun completed = run.toBuilder()
                .status(ScanRun.Status.COMPLETED)
                .completedAt(Instant.parse("2026-01-01T00:05:00Z"))
                .build();

        store.complete(completed);

        assertEquals(ScanRun.Status.COMPLETED, store.findById("a").orElseThrow().getStatus());
        assertThrows(IllegalStateException.class, () -> store.complete(completed));
    }

    @Test
    void shouldRejectDuplicateInsert() {
        store.insert(running("a", Instant.now()));

        assertThrows(IllegalStateException.class, () -> store.insert(running("a", Instant.now())));
    }
}
