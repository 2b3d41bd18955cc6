package io.valueseditor.core.error;

/** Thrown when a merged values document cannot be written back to its store. */
public final class ValuesWriteException extends ValuesEditorException {

    private static final long serialVersionUID = 1L;

    public ValuesWriteException(String message, String source) {
        super(message, source);
    }

    public ValuesWriteException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
