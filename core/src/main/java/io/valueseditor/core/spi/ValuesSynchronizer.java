package io.valueseditor.core.spi;

import io.valueseditor.core.model.SyncResult;

/**
 * Mirrors the persisted values document to and from a remote store.
 *
 * <p>
 * {@link #refresh()} runs before a schema or values fetch, {@link #publish}
 * after an update was written. Results are reported alongside the fetch or
 * update and never gate it. Exceptions thrown by implementations are caught
 * by the editor and reported as {@link SyncResult.Status#FAILED}.
 */
public interface ValuesSynchronizer {

    /**
     * Whether this synchronizer talks to a remote store at all. The editor
     * skips refreshes, and the exclusive lock they need, when it does not.
     */
    default boolean isEnabled() {
        return true;
    }

    /** Pulls the latest remote copy of the values document. */
    SyncResult refresh();

    /**
     * Publishes the locally written values document.
     *
     * @param summary short description of the change, e.g. for a commit message
     */
    SyncResult publish(String summary);

    /** Returns a synchronizer that does nothing and reports {@code DISABLED}. */
    static ValuesSynchronizer disabled() {
        return new ValuesSynchronizer() {
            @Override
            public boolean isEnabled() {
                return false;
            }

            @Override
            public SyncResult refresh() {
                return SyncResult.disabled();
            }

            @Override
            public SyncResult publish(String summary) {
                return SyncResult.disabled();
            }
        };
    }
}
