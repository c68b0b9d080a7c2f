package com.tickerwolf.intraday;

import com.tickerwolf.model.IntradaySnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemorySnapshotStoreTest {

    @Test
    void saveReplacesEntryForSameKey() {
        InMemorySnapshotStore store = new InMemorySnapshotStore("intraday");
        LocalDate date = LocalDate.of(2025, 1, 2);
        SnapshotKey key = new SnapshotKey("aapl", date);
        IntradaySnapshot first = new IntradaySnapshot("AAPL", date, StubBarsClient.bars(date), Instant.parse("2025-01-02T15:00:00Z"));
        IntradaySnapshot second = new IntradaySnapshot("AAPL", date, StubBarsClient.bars(date), Instant.parse("2025-01-02T15:05:00Z"));

        store.save(key, first);
        store.save(new SnapshotKey("AAPL", date), second);

        assertEquals(1, store.size());
        assertSame(second, store.load(key).orElseThrow());
        assertEquals("intraday:AAPL:2025-01-02", key.storeKey(store.namespace()));
    }

    @Test
    void purgeKeepsCutoffDate() {
        InMemorySnapshotStore store = new InMemorySnapshotStore(" ");
        for (int day = 1; day <= 5; day++) {
            LocalDate date = LocalDate.of(2025, 1, day);
            store.save(new SnapshotKey("MSFT", date),
                    new IntradaySnapshot("MSFT", date, StubBarsClient.bars(date), Instant.parse("2025-01-05T00:00:00Z")));
        }

        assertEquals(2, store.purgeOlderThan(LocalDate.of(2025, 1, 3)));
        assertEquals(3, store.size());
        assertTrue(store.load(new SnapshotKey("MSFT", LocalDate.of(2025, 1, 2))).isEmpty());
        assertEquals("intraday", store.namespace());
    }
}
