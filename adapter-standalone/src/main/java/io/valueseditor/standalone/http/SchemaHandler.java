package io.valueseditor.standalone.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.valueseditor.core.engine.ValuesEditor;
import io.valueseditor.core.error.ValuesEditorException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code GET /schema}: synthesizes the annotated JSON Schema for the current
 * values document. A read failure answers 500 with a problem body.
 */
public final class SchemaHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaHandler.class);

    private final ValuesEditor editor;

    public SchemaHandler(ValuesEditor editor) {
        this.editor = Objects.requireNonNull(editor, "editor must not be null");
    }

    @Override
    public void handle(Context ctx) {
        try {
            ObjectNode schema = editor.schema();
            ctx.status(200);
            ctx.contentType("application/json");
            ctx.result(schema.toString());
        } catch (ValuesEditorException e) {
            LOG.error("Error loading schema: source={}, detail={}", e.source(), e.getMessage(), e);
            ProblemDetail.send(ctx, ProblemDetail.valuesUnreadable(e.getMessage(), ctx.path()));
        }
    }
}
