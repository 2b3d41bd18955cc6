package io.valueseditor.standalone.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;

/**
 * Builds RFC 9457 Problem Details responses for API errors.
 *
 * <pre>{@code
 * {
 * "type": "urn:values-editor:values-unreadable",
 * "title": "Values Unreadable",
 * "status": 500,
 * "detail": "Values file not found: ./values.yaml",
 * "instance": "/schema"
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class ProblemDetail {

    static final String CONTENT_TYPE = "application/problem+json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_BAD_REQUEST = "urn:values-editor:bad-request";
    static final String URN_VALUES_UNREADABLE = "urn:values-editor:values-unreadable";
    static final String URN_VALUES_UNWRITABLE = "urn:values-editor:values-unwritable";
    static final String URN_INTERNAL_ERROR = "urn:values-editor:internal-error";

    private ProblemDetail() {
        // utility class
    }

    /** Malformed request body or an update that is not a mapping. */
    public static JsonNode badRequest(String detail, String instancePath) {
        return build(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    /** The values document could not be read or parsed. */
    public static JsonNode valuesUnreadable(String detail, String instancePath) {
        return build(URN_VALUES_UNREADABLE, "Values Unreadable", 500, detail, instancePath);
    }

    /** The merged values document could not be written. */
    public static JsonNode valuesUnwritable(String detail, String instancePath) {
        return build(URN_VALUES_UNWRITABLE, "Values Unwritable", 500, detail, instancePath);
    }

    /** Any other failure. */
    public static JsonNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    /** Writes the problem as the response, with its status code. */
    static void send(Context ctx, JsonNode problem) {
        ctx.status(problem.get("status").asInt());
        ctx.contentType(CONTENT_TYPE);
        ctx.result(problem.toString());
    }

    static JsonNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
