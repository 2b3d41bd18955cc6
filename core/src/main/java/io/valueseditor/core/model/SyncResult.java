package io.valueseditor.core.model;

import java.util.Objects;

/**
 * Outcome of a synchronization step against a remote copy of the values
 * document. Reported alongside fetch and update results; never gates them.
 *
 * @param status  outcome category
 * @param message human-readable detail
 */
public record SyncResult(Status status, String message) {

    /** Synchronization outcome category. */
    public enum Status {
        DISABLED,
        SUCCESS,
        FAILED
    }

    public SyncResult {
        Objects.requireNonNull(status, "status must not be null");
        message = message != null ? message : "";
    }

    /** No synchronizer is configured. */
    public static SyncResult disabled() {
        return new SyncResult(Status.DISABLED, "Synchronization is disabled");
    }

    public static SyncResult success(String message) {
        return new SyncResult(Status.SUCCESS, message);
    }

    public static SyncResult failed(String message) {
        return new SyncResult(Status.FAILED, message);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
