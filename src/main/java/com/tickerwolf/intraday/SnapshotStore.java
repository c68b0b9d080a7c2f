package com.tickerwolf.intraday;

import com.tickerwolf.model.IntradaySnapshot;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Key-value store for intraday snapshots, one entry per {@link SnapshotKey}.
 *
 * <p>{@link #save} replaces the entry for its key atomically; a concurrent {@link #load}
 * sees either the previous snapshot or the new one.
 */
public interface SnapshotStore {

    String namespace();

    Optional<IntradaySnapshot> load(SnapshotKey key) throws SnapshotStoreException;

    void save(SnapshotKey key, IntradaySnapshot snapshot) throws SnapshotStoreException;

    /**
     * Removes entries whose trading date is before {@code cutoff}.
     *
     * @return number of removed entries
     */
    int purgeOlderThan(LocalDate cutoff) throws SnapshotStoreException;
}
