package io.valueseditor.core.model;

/** Value of the {@code type} keyword on a synthesized schema node. */
public enum SchemaType {
    OBJECT("object"),
    ARRAY("array"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    NUMBER("number"),
    STRING("string");

    private final String keyword;

    SchemaType(String keyword) {
        this.keyword = keyword;
    }

    /** The lowercase keyword written into the schema. */
    public String keyword() {
        return keyword;
    }

    /**
     * Maps a value kind to its schema type. {@link ValueKind#NULL} and
     * {@link ValueKind#TEXT} both map to {@link #STRING}.
     */
    public static SchemaType of(ValueKind kind) {
        return switch (kind) {
            case MAPPING -> OBJECT;
            case SEQUENCE -> ARRAY;
            case BOOLEAN -> BOOLEAN;
            case INTEGER -> INTEGER;
            case NUMBER -> NUMBER;
            case TEXT, NULL -> STRING;
        };
    }
}
