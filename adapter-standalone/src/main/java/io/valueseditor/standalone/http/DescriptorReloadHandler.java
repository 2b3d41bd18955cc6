package io.valueseditor.standalone.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.valueseditor.core.descriptor.Descriptor;
import io.valueseditor.core.engine.ValuesEditor;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admin endpoint that reloads the descriptor file and swaps it in.
 *
 * <p>
 * Response:
 *
 * <pre>
 * 200 OK
 * {"status": "reloaded", "readonly": 3, "enum": 1, "titles": 0, "descriptions": 2, "sections": 4}
 * </pre>
 *
 * <p>
 * A descriptor that cannot be loaded is replaced by empty rules; the response
 * then carries {@code "status": "fallback"} and the failure as
 * {@code detail}, still with status 200.
 */
public final class DescriptorReloadHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(DescriptorReloadHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ValuesEditor editor;

    public DescriptorReloadHandler(ValuesEditor editor) {
        this.editor = Objects.requireNonNull(editor, "editor must not be null");
    }

    @Override
    public void handle(Context ctx) {
        LOG.info("Descriptor reload triggered via POST {}", ctx.path());

        Descriptor descriptor = editor.reloadDescriptor();

        ObjectNode response = MAPPER.createObjectNode();
        response.put("status", descriptor.isFallback() ? "fallback" : "reloaded");
        response.put("readonly", descriptor.readonlyPaths().size());
        response.put("enum", descriptor.enumPaths().size());
        response.put("titles", descriptor.titles().size());
        response.put("descriptions", descriptor.descriptions().size());
        response.put("sections", descriptor.sections().size());
        if (descriptor.isFallback()) {
            response.put("detail", descriptor.loadFailure());
        }

        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(response.toString());
    }
}
