package io.valueseditor.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.valueseditor.core.descriptor.Descriptor;
import io.valueseditor.core.descriptor.DescriptorLoader;
import io.valueseditor.core.error.ValuesReadException;
import io.valueseditor.core.model.MergeResult;
import io.valueseditor.core.model.SyncResult;
import io.valueseditor.core.model.UpdateResult;
import io.valueseditor.core.spi.ValuesStore;
import io.valueseditor.core.spi.ValuesSynchronizer;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point that binds the engines to their collaborators: fetch the
 * schema, fetch the values, submit a partial update, reload the descriptor.
 *
 * <p>
 * Each operation captures one {@link Descriptor} snapshot and uses it
 * throughout, so a concurrent {@link #reloadDescriptor()} never affects an
 * operation already in progress.
 *
 * <p>
 * Thread-safe: reads of the values document run under a shared lock; the
 * read-merge-write-publish cycle of {@link #update(JsonNode)} and the
 * synchronizer refresh run under an exclusive lock, so concurrent updates do
 * not lose writes. With a disabled synchronizer there is no refresh and
 * fetches only take the shared lock.
 */
public final class ValuesEditor {

    private static final Logger LOG = LoggerFactory.getLogger(ValuesEditor.class);

    private final ValuesStore store;
    private final DescriptorLoader descriptors;
    private final ValuesSynchronizer synchronizer;
    private final SchemaSynthesizer synthesizer = new SchemaSynthesizer();
    private final SelectiveMerger merger = new SelectiveMerger();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Creates an editor without remote synchronization.
     *
     * @param store       the values document store
     * @param descriptors holder of the active descriptor
     */
    public ValuesEditor(ValuesStore store, DescriptorLoader descriptors) {
        this(store, descriptors, ValuesSynchronizer.disabled());
    }

    /**
     * Creates an editor with a synchronizer that is refreshed before fetches
     * and published to after updates.
     *
     * @param store        the values document store
     * @param descriptors  holder of the active descriptor
     * @param synchronizer the remote synchronizer
     */
    public ValuesEditor(ValuesStore store, DescriptorLoader descriptors, ValuesSynchronizer synchronizer) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.descriptors = Objects.requireNonNull(descriptors, "descriptors must not be null");
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer must not be null");
    }

    /**
     * Synthesizes the schema of the current values document.
     *
     * @return the annotated schema
     * @throws ValuesReadException if the values document cannot be read
     */
    public ObjectNode schema() {
        Descriptor snapshot = descriptors.current();
        refresh();
        return synthesizer.synthesize(readValues(), snapshot);
    }

    /**
     * Returns the current values document.
     *
     * @throws ValuesReadException if the values document cannot be read
     */
    public ObjectNode values() {
        refresh();
        return readValues();
    }

    /**
     * Merges a partial update into the values document, writes the result
     * and publishes it.
     *
     * @param update the partial update, must be a mapping
     * @return merged values, applied paths, skip notices and the publish result
     * @throws IllegalArgumentException if the update is not a mapping
     * @throws ValuesReadException      if the current document cannot be read
     * @throws io.valueseditor.core.error.ValuesWriteException if the merged
     *                                  document cannot be written
     */
    public UpdateResult update(JsonNode update) {
        if (update == null || !update.isObject()) {
            throw new IllegalArgumentException("Update must be a mapping of field names to values");
        }
        Descriptor snapshot = descriptors.current();

        lock.writeLock().lock();
        try {
            ObjectNode current = asMapping(store.read());
            MergeResult merge = merger.merge(current, update, snapshot);
            store.write(merge.merged());
            LOG.info(
                    "Values updated: store={}, applied={}, skipped={}",
                    store.name(),
                    merge.applied().size(),
                    merge.skipped().size());

            SyncResult sync = guarded("publish", () -> synchronizer.publish(summary(merge)));
            return new UpdateResult(merge, sync);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Reloads the descriptor from its source and makes it active.
     *
     * @return the newly active descriptor, an empty fallback if loading failed
     */
    public Descriptor reloadDescriptor() {
        return descriptors.reload();
    }

    /** Returns the active descriptor snapshot. */
    public Descriptor descriptor() {
        return descriptors.current();
    }

    private ObjectNode readValues() {
        lock.readLock().lock();
        try {
            return asMapping(store.read());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void refresh() {
        if (!synchronizer.isEnabled()) {
            return;
        }
        lock.writeLock().lock();
        try {
            SyncResult result = guarded("refresh", synchronizer::refresh);
            if (result.isFailed()) {
                LOG.warn(
                        "Values refresh failed, serving local copy: store={}, detail={}",
                        store.name(),
                        result.message());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ObjectNode asMapping(JsonNode values) {
        if (values == null || values.isNull() || values.isMissingNode()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!values.isObject()) {
            throw new ValuesReadException(
                    "Values document root must be a mapping, found " + values.getNodeType(), store.name());
        }
        return (ObjectNode) values;
    }

    private static SyncResult guarded(String step, Supplier<SyncResult> action) {
        try {
            SyncResult result = action.get();
            return result != null ? result : SyncResult.disabled();
        } catch (RuntimeException e) {
            LOG.error("Synchronizer {} failed: {}", step, e.getMessage(), e);
            return SyncResult.failed(step + " failed: " + e.getMessage());
        }
    }

    private static String summary(MergeResult merge) {
        if (merge.applied().isEmpty()) {
            return "Update values (no fields changed)";
        }
        return "Update values: " + String.join(", ", merge.applied());
    }
}
