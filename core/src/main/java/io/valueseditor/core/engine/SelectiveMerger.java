package io.valueseditor.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.valueseditor.core.descriptor.Descriptor;
import io.valueseditor.core.descriptor.FieldPaths;
import io.valueseditor.core.model.MergeResult;
import io.valueseditor.core.model.SkipNotice;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a partial update into a values tree, honoring the descriptor's
 * protection rules.
 *
 * <p>
 * For each entry of the update, at accumulated path {@code p}:
 * <ol>
 * <li>{@code p} read-only → skipped, current value kept</li>
 * <li>current and update values both mappings → merged recursively</li>
 * <li>current value a mapping with read-only fields below {@code p}, update
 * value not a mapping → skipped, current mapping kept</li>
 * <li>{@code p} is an enumeration path and the current value is a sequence →
 * skipped, the option list is kept</li>
 * <li>otherwise → the current value is replaced by the update value as a
 * whole</li>
 * </ol>
 * Keys absent from the update are copied unchanged; the merge never deletes.
 * Key order of the current tree is kept and keys new in the update are
 * appended.
 *
 * <p>
 * Thread-safe: stateless. Neither input is mutated, and the result shares
 * no nodes with them.
 */
public final class SelectiveMerger {

    private static final Logger LOG = LoggerFactory.getLogger(SelectiveMerger.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Merges {@code update} into {@code current}.
     *
     * @param current    the current values tree; null or non-mapping is treated
     *                   as an empty mapping
     * @param update     the partial update, must be a mapping
     * @param descriptor the protection rules
     * @return the merged tree with applied paths and skip notices
     * @throws IllegalArgumentException if {@code update} is not a mapping
     */
    public MergeResult merge(JsonNode current, JsonNode update, Descriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        if (update == null || !update.isObject()) {
            throw new IllegalArgumentException("Update must be a mapping, found "
                    + (update == null ? "null" : update.getNodeType().toString()));
        }
        ObjectNode base = current != null && current.isObject() ? (ObjectNode) current : NODES.objectNode();

        List<String> applied = new ArrayList<>();
        List<SkipNotice> skipped = new ArrayList<>();
        ObjectNode merged = mergeMapping(base, (ObjectNode) update, "", descriptor, applied, skipped);
        return new MergeResult(merged, applied, skipped);
    }

    private ObjectNode mergeMapping(
            ObjectNode current,
            ObjectNode update,
            String path,
            Descriptor descriptor,
            List<String> applied,
            List<SkipNotice> skipped) {
        ObjectNode merged = NODES.objectNode();

        Iterator<Map.Entry<String, JsonNode>> existing = current.fields();
        while (existing.hasNext()) {
            Map.Entry<String, JsonNode> entry = existing.next();
            JsonNode updateValue = update.get(entry.getKey());
            JsonNode value = updateValue == null
                    ? entry.getValue().deepCopy()
                    : mergeEntry(
                            entry.getValue(),
                            updateValue,
                            FieldPaths.child(path, entry.getKey()),
                            descriptor,
                            applied,
                            skipped);
            merged.set(entry.getKey(), value);
        }

        Iterator<Map.Entry<String, JsonNode>> incoming = update.fields();
        while (incoming.hasNext()) {
            Map.Entry<String, JsonNode> entry = incoming.next();
            if (current.has(entry.getKey())) {
                continue;
            }
            JsonNode value = mergeEntry(
                    null, entry.getValue(), FieldPaths.child(path, entry.getKey()), descriptor, applied, skipped);
            if (value != null) {
                merged.set(entry.getKey(), value);
            }
        }
        return merged;
    }

    /**
     * Resolves one update entry against the current value at the same key.
     *
     * @return the value to store, or null when the key is absent from the
     *         current tree and the entry was skipped
     */
    private JsonNode mergeEntry(
            JsonNode currentValue,
            JsonNode updateValue,
            String fieldPath,
            Descriptor descriptor,
            List<String> applied,
            List<SkipNotice> skipped) {
        if (descriptor.isReadonly(fieldPath)) {
            skip(new SkipNotice(fieldPath, SkipNotice.Reason.READ_ONLY), skipped);
            return currentValue != null ? currentValue.deepCopy() : null;
        }
        if (currentValue != null && currentValue.isObject()) {
            if (updateValue.isObject()) {
                return mergeMapping(
                        (ObjectNode) currentValue, (ObjectNode) updateValue, fieldPath, descriptor, applied, skipped);
            }
            if (descriptor.hasReadonlyBelow(fieldPath)) {
                skip(new SkipNotice(fieldPath, SkipNotice.Reason.READ_ONLY_CHILDREN), skipped);
                return currentValue.deepCopy();
            }
        }
        if (currentValue != null && currentValue.isArray() && descriptor.isEnum(fieldPath)) {
            skip(new SkipNotice(fieldPath, SkipNotice.Reason.ENUM_OPTIONS), skipped);
            return currentValue.deepCopy();
        }
        applied.add(fieldPath);
        return updateValue.deepCopy();
    }

    private static void skip(SkipNotice notice, List<SkipNotice> skipped) {
        skipped.add(notice);
        LOG.info("Skipped protected field: path={}, reason={}", notice.path(), notice.reason());
    }
}
