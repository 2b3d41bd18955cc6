package io.valueseditor.standalone.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.valueseditor.core.engine.ValuesEditor;
import io.valueseditor.core.error.ValuesEditorException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code GET /values}: returns the current values document as JSON. */
public final class ValuesHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ValuesHandler.class);

    private final ValuesEditor editor;

    public ValuesHandler(ValuesEditor editor) {
        this.editor = Objects.requireNonNull(editor, "editor must not be null");
    }

    @Override
    public void handle(Context ctx) {
        try {
            String body = editor.values().toString();
            ctx.status(200);
            ctx.contentType("application/json");
            ctx.result(body);
        } catch (ValuesEditorException e) {
            LOG.error("Error loading values: source={}, detail={}", e.source(), e.getMessage(), e);
            ProblemDetail.send(ctx, ProblemDetail.valuesUnreadable(e.getMessage(), ctx.path()));
        }
    }
}
