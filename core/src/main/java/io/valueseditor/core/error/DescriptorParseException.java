package io.valueseditor.core.error;

/**
 * Thrown when a descriptor document cannot be read, is not valid YAML, or has an unexpected shape.
 * The descriptor loader recovers from it by falling back to an empty descriptor.
 */
public final class DescriptorParseException extends ValuesEditorException {

    private static final long serialVersionUID = 1L;

    public DescriptorParseException(String message, String source) {
        super(message, source);
    }

    public DescriptorParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
