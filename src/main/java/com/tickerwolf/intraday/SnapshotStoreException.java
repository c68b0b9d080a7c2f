package com.tickerwolf.intraday;

public class SnapshotStoreException extends Exception {
    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
