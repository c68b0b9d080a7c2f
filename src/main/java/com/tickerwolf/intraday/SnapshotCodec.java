package com.tickerwolf.intraday;

import com.tickerwolf.model.IntradaySnapshot;
import com.tickerwolf.model.OhlcvBar;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a snapshot as persisted by {@link com.tickerwolf.db.JdbcSnapshotStore}.
 *
 * <pre>{"symbol":"AAPL","trading_date":"2025-01-02","fetched_at":"...","bars":[{"t":1735826400000,"o":..,"h":..,"l":..,"c":..,"v":..}]}</pre>
 */
public final class SnapshotCodec {
    private SnapshotCodec() {
    }

    public static String encode(IntradaySnapshot snapshot) {
        JSONArray bars = new JSONArray();
        for (OhlcvBar bar : snapshot.bars) {
            JSONObject item = new JSONObject();
            item.put("t", bar.timestamp.toEpochMilli());
            item.put("o", bar.open);
            item.put("h", bar.high);
            item.put("l", bar.low);
            item.put("c", bar.close);
            item.put("v", bar.volume);
            bars.put(item);
        }
        JSONObject root = new JSONObject();
        root.put("symbol", snapshot.symbol);
        root.put("trading_date", snapshot.tradingDate.toString());
        root.put("fetched_at", snapshot.fetchedAt.toString());
        root.put("bars", bars);
        return root.toString();
    }

    public static IntradaySnapshot decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("empty snapshot payload");
        }
        try {
            JSONObject root = new JSONObject(payload);
            JSONArray array = root.optJSONArray("bars");
            List<OhlcvBar> bars = new ArrayList<>();
            if (array != null) {
                for (int i = 0; i < array.length(); i++) {
                    JSONObject item = array.getJSONObject(i);
                    bars.add(new OhlcvBar(
                            Instant.ofEpochMilli(item.getLong("t")),
                            item.getDouble("o"),
                            item.getDouble("h"),
                            item.getDouble("l"),
                            item.getDouble("c"),
                            item.optLong("v", 0L)
                    ));
                }
            }
            return new IntradaySnapshot(
                    root.getString("symbol"),
                    LocalDate.parse(root.getString("trading_date")),
                    bars,
                    Instant.parse(root.getString("fetched_at"))
            );
        } catch (JSONException | DateTimeParseException e) {
            throw new IllegalArgumentException("invalid snapshot payload: " + e.getMessage(), e);
        }
    }
}
