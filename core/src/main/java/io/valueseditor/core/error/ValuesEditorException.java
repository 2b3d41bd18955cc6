package io.valueseditor.core.error;

/**
 * Abstract base for all values-editor exceptions. Never thrown directly; use one of the concrete
 * subclasses.
 */
public abstract class ValuesEditorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ValuesEditorException(String message, String source) {
        super(message);
        this.source = source;
    }

    protected ValuesEditorException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The file path or resource identifier involved, or {@code null} if unknown. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
