package com.convsync.sync;

public class SyncStateStoreException extends RuntimeException {

    public SyncStateStoreException(String message) {
        super(message);
    }

    public SyncStateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
