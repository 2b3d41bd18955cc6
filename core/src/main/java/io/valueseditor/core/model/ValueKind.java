package io.valueseditor.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Runtime kind of a node in a values tree.
 *
 * <p>
 * Classification order is explicit: booleans are checked before integral
 * numbers, and integral numbers before floating point, so a boolean is never
 * reported as an integer. Node kinds that a YAML or JSON document cannot
 * produce (binary, POJO, missing) classify as {@link #TEXT}.
 */
public enum ValueKind {
    MAPPING,
    SEQUENCE,
    BOOLEAN,
    INTEGER,
    NUMBER,
    TEXT,
    NULL;

    /**
     * Classifies the given node.
     *
     * @param node the node to classify, may be null
     * @return the node's kind, {@link #NULL} for a Java or JSON null
     */
    public static ValueKind of(JsonNode node) {
        if (node == null || node.isNull()) {
            return NULL;
        }
        if (node.isObject()) {
            return MAPPING;
        }
        if (node.isArray()) {
            return SEQUENCE;
        }
        if (node.isBoolean()) {
            return BOOLEAN;
        }
        if (node.isIntegralNumber()) {
            return INTEGER;
        }
        if (node.isFloatingPointNumber()) {
            return NUMBER;
        }
        return TEXT;
    }

    /** Returns true for every kind except {@link #MAPPING} and {@link #SEQUENCE}. */
    public boolean isScalar() {
        return this != MAPPING && this != SEQUENCE;
    }
}
