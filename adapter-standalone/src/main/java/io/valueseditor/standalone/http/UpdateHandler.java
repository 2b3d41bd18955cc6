package io.valueseditor.standalone.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.valueseditor.core.engine.ValuesEditor;
import io.valueseditor.core.error.ValuesReadException;
import io.valueseditor.core.error.ValuesWriteException;
import io.valueseditor.core.model.SkipNotice;
import io.valueseditor.core.model.UpdateResult;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /update}: merges the JSON mapping in the request body into the
 * values document.
 *
 * <p>
 * Response on success:
 *
 * <pre>
 * 200 OK
 * {"status": "updated", "message": "Updated successfully",
 *  "applied": ["image.tag"],
 *  "skipped": [{"path": "image.repository", "reason": "read_only", "message": "..."}],
 *  "sync": {"status": "disabled", "message": "..."}}
 * </pre>
 *
 * <p>
 * A body that is not JSON, or not a mapping, answers 400. Read and write
 * failures, and any unexpected error, answer 500. A failed publish is
 * reported in {@code sync} only.
 */
public final class UpdateHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ValuesEditor editor;

    public UpdateHandler(ValuesEditor editor) {
        this.editor = Objects.requireNonNull(editor, "editor must not be null");
    }

    @Override
    public void handle(Context ctx) {
        JsonNode update;
        try {
            update = MAPPER.readTree(ctx.body());
        } catch (JsonProcessingException e) {
            LOG.debug("Rejected malformed update body: {}", e.getOriginalMessage());
            ProblemDetail.send(
                    ctx, ProblemDetail.badRequest("Request body is not valid JSON: " + e.getOriginalMessage(), ctx.path()));
            return;
        }
        if (update == null || !update.isObject()) {
            ProblemDetail.send(
                    ctx, ProblemDetail.badRequest("Request body must be a JSON object of field values", ctx.path()));
            return;
        }

        try {
            UpdateResult result = editor.update(update);
            ctx.status(200);
            ctx.contentType("application/json");
            ctx.result(toJson(result).toString());
        } catch (ValuesReadException e) {
            LOG.error("Error updating values: source={}, detail={}", e.source(), e.getMessage(), e);
            ProblemDetail.send(ctx, ProblemDetail.valuesUnreadable(e.getMessage(), ctx.path()));
        } catch (ValuesWriteException e) {
            LOG.error("Error updating values: source={}, detail={}", e.source(), e.getMessage(), e);
            ProblemDetail.send(ctx, ProblemDetail.valuesUnwritable(e.getMessage(), ctx.path()));
        } catch (RuntimeException e) {
            LOG.error("Unexpected error updating values: {}", e.getMessage(), e);
            ProblemDetail.send(ctx, ProblemDetail.internalError("Update failed: " + e.getMessage(), ctx.path()));
        }
    }

    static ObjectNode toJson(UpdateResult result) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("status", "updated");
        response.put("message", "Updated successfully");

        ArrayNode applied = response.putArray("applied");
        result.applied().forEach(applied::add);

        ArrayNode skipped = response.putArray("skipped");
        for (SkipNotice notice : result.skipped()) {
            skipped.addObject()
                    .put("path", notice.path())
                    .put("reason", notice.reason().name().toLowerCase(Locale.ROOT))
                    .put("message", notice.message());
        }

        response.putObject("sync")
                .put("status", result.sync().status().name().toLowerCase(Locale.ROOT))
                .put("message", result.sync().message());
        return response;
    }
}
