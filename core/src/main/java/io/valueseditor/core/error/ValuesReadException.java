package io.valueseditor.core.error;

/** Thrown when the values document cannot be read or parsed. Not recoverable locally. */
public final class ValuesReadException extends ValuesEditorException {

    private static final long serialVersionUID = 1L;

    public ValuesReadException(String message, String source) {
        super(message, source);
    }

    public ValuesReadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
