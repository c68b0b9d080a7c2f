package com.tickerwolf.intraday;

import com.tickerwolf.model.IntradaySnapshot;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store. Snapshots are immutable, so a map put is an atomic replace.
 */
public final class InMemorySnapshotStore implements SnapshotStore {
    private final String namespace;
    private final ConcurrentMap<String, IntradaySnapshot> entries = new ConcurrentHashMap<>();

    public InMemorySnapshotStore(String namespace) {
        this.namespace = namespace == null || namespace.isBlank() ? "intraday" : namespace.trim();
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public Optional<IntradaySnapshot> load(SnapshotKey key) {
        return Optional.ofNullable(entries.get(key.storeKey(namespace)));
    }

    @Override
    public void save(SnapshotKey key, IntradaySnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        entries.put(key.storeKey(namespace), snapshot);
    }

    @Override
    public int purgeOlderThan(LocalDate cutoff) {
        int before = entries.size();
        entries.values().removeIf(snapshot -> snapshot.tradingDate.isBefore(cutoff));
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }
}
