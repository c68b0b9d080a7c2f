package com.tickerwolf.intraday;

import com.tickerwolf.model.IntradaySnapshot;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotCodecTest {

    @Test
    void encodedSnapshotDecodesToSameBars() {
        LocalDate date = LocalDate.of(2025, 1, 2);
        IntradaySnapshot snapshot = new IntradaySnapshot("AAPL", date, StubBarsClient.bars(date),
                Instant.parse("2025-01-02T15:00:00Z"));

        String payload = SnapshotCodec.encode(snapshot);
        IntradaySnapshot decoded = SnapshotCodec.decode(payload);

        JSONObject root = new JSONObject(payload);
        assertEquals("2025-01-02", root.getString("trading_date"));
        assertEquals(2, root.getJSONArray("bars").length());
        assertEquals(snapshot.fetchedAt, decoded.fetchedAt);
        assertEquals(snapshot.asOf(), decoded.asOf());
        assertEquals(snapshot.totalVolume(), decoded.totalVolume());
    }

    @Test
    void snapshotWithoutBarsIsKept() {
        IntradaySnapshot decoded = SnapshotCodec.decode(
                "{\"symbol\":\"msft\",\"trading_date\":\"2025-01-03\",\"fetched_at\":\"2025-01-03T15:00:00Z\"}");

        assertTrue(decoded.isEmpty());
        assertEquals("MSFT", decoded.symbol);
    }

    @Test
    void brokenPayloadsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SnapshotCodec.decode(""));
        assertThrows(IllegalArgumentException.class, () -> SnapshotCodec.decode("{not json"));
        assertThrows(IllegalArgumentException.class, () -> SnapshotCodec.decode(
                "{\"symbol\":\"AAPL\",\"trading_date\":\"yesterday\",\"fetched_at\":\"2025-01-03T15:00:00Z\"}"));
    }
}
