package io.valueseditor.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Persistence boundary for the values document.
 *
 * <p>
 * Implementations guarantee that the tree handed out has unique keys per
 * mapping and no cycles. The {@link io.valueseditor.core.engine.ValuesEditor}
 * serializes writes; implementations need not be thread-safe for concurrent
 * writes but must tolerate reads concurrent with other reads.
 */
public interface ValuesStore {

    /**
     * Reads the current values tree.
     *
     * @return the parsed document; an empty document is an empty mapping
     * @throws io.valueseditor.core.error.ValuesReadException if the document
     *                                                         cannot be read or
     *                                                         parsed
     */
    JsonNode read();

    /**
     * Replaces the persisted document with the given tree.
     *
     * @param values the tree to persist
     * @throws io.valueseditor.core.error.ValuesWriteException if the document
     *                                                          cannot be written
     */
    void write(ObjectNode values);

    /** Identifies the store in log messages and errors. */
    String name();
}
