package io.valueseditor.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a selective merge.
 *
 * @param merged  the new values tree; shares no nodes with the merge inputs
 * @param applied paths whose value was written from the update, in traversal order
 * @param skipped protected paths the update tried to write
 */
public record MergeResult(ObjectNode merged, List<String> applied, List<SkipNotice> skipped) {

    public MergeResult {
        Objects.requireNonNull(merged, "merged must not be null");
        applied = List.copyOf(applied);
        skipped = List.copyOf(skipped);
    }

    /** Returns true if at least one protected field was skipped. */
    public boolean hasSkips() {
        return !skipped.isEmpty();
    }
}
