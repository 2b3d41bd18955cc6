package io.valueseditor.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a submitted partial update that was merged and written. The
 * synchronization result is diagnostic only: an update whose publish step
 * failed is still a successful update.
 */
public final class UpdateResult {

    private final MergeResult merge;
    private final SyncResult sync;

    public UpdateResult(MergeResult merge, SyncResult sync) {
        this.merge = Objects.requireNonNull(merge, "merge must not be null");
        this.sync = Objects.requireNonNull(sync, "sync must not be null");
    }

    /** The values tree as written to the store. */
    public ObjectNode values() {
        return merge.merged();
    }

    public List<String> applied() {
        return merge.applied();
    }

    public List<SkipNotice> skipped() {
        return merge.skipped();
    }

    public SyncResult sync() {
        return sync;
    }

    @Override
    public String toString() {
        return "UpdateResult[applied=" + applied().size() + ", skipped=" + skipped().size() + ", sync="
                + sync.status() + "]";
    }
}
