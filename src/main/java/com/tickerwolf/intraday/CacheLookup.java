package com.tickerwolf.intraday;

import com.tickerwolf.core.diagnostics.CauseCode;
import com.tickerwolf.model.IntradaySnapshot;

import java.util.Optional;

/**
 * What {@link SnapshotCache} served for one request and why.
 */
public final class CacheLookup {

    public enum Source {
        /** Fresh entry, no upstream call. */
        FRESH_HIT,
        /** Upstream fetch succeeded and the entry was replaced. */
        FETCHED,
        /** Upstream failed; the previous entry for the same key was served. */
        STALE,
        /** Upstream failed; an entry from an earlier trading date was served. */
        FALLBACK,
        MISS
    }

    public final Source source;
    public final IntradaySnapshot snapshot;
    public final CauseCode cause;

    private CacheLookup(Source source, IntradaySnapshot snapshot, CauseCode cause) {
        this.source = source;
        this.snapshot = snapshot;
        this.cause = cause == null ? CauseCode.NONE : cause;
    }

    static CacheLookup freshHit(IntradaySnapshot snapshot) {
        return new CacheLookup(Source.FRESH_HIT, snapshot, CauseCode.NONE);
    }

    static CacheLookup fetched(IntradaySnapshot snapshot) {
        return new CacheLookup(Source.FETCHED, snapshot, CauseCode.NONE);
    }

    static CacheLookup stale(IntradaySnapshot snapshot, CauseCode cause) {
        return new CacheLookup(Source.STALE, snapshot, cause);
    }

    static CacheLookup fallback(IntradaySnapshot snapshot, CauseCode cause) {
        return new CacheLookup(Source.FALLBACK, snapshot, cause);
    }

    static CacheLookup miss(CauseCode cause) {
        return new CacheLookup(Source.MISS, null, cause);
    }

    public boolean isAvailable() {
        return snapshot != null;
    }

    public Optional<IntradaySnapshot> asOptional() {
        return Optional.ofNullable(snapshot);
    }

    @Override
    public String toString() {
        return "CacheLookup{" + source + (cause == CauseCode.NONE ? "" : ", cause=" + cause)
                + (snapshot == null ? "" : ", " + snapshot) + "}";
    }
}
