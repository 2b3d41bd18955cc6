package io.valueseditor.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.valueseditor.core.descriptor.Descriptor;
import io.valueseditor.core.descriptor.FieldPaths;
import io.valueseditor.core.model.SchemaType;
import io.valueseditor.core.model.ValueKind;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives an annotated JSON Schema from a values tree, cross-referenced
 * against a {@link Descriptor}.
 *
 * <p>
 * Classification per node:
 * <ul>
 * <li>mapping → {@code object} with one property per entry</li>
 * <li>empty sequence → {@code array} of {@code string} (nothing to infer
 * from)</li>
 * <li>sequence on an enumeration path whose first element is a scalar →
 * {@code array} of unique {@code string}s; the element list is both the
 * {@code default} and the {@code items.enum} option set</li>
 * <li>sequence whose first element is a mapping → {@code array} whose
 * {@code items} is the first element's schema, rules looked up at
 * {@code path[0]} and titled after the array ({@link #itemTitle(String)})</li>
 * <li>other sequence → {@code array} typed by its first element</li>
 * <li>scalar → {@code boolean}, {@code integer}, {@code number} or
 * {@code string}, in that priority</li>
 * </ul>
 * Every node then gets {@code readOnly} and {@code description} from the
 * descriptor where configured. Section and UI metadata go on the root only.
 *
 * <p>
 * Thread-safe: stateless. Output is a fresh tree on every call and depends
 * only on the arguments.
 */
public final class SchemaSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaSynthesizer.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final String SECTIONS_KEY = "sections";
    static final String UI_METADATA_KEY = "ui_metadata";

    /**
     * Synthesizes the schema for a values tree.
     *
     * @param values     the values tree; null, missing or non-mapping roots
     *                   yield an empty object schema
     * @param descriptor the field rules to apply
     * @return {@code {"type":"object","properties":{...}}} plus pass-through
     *         {@code sections} and {@code ui_metadata} when configured
     */
    public ObjectNode synthesize(JsonNode values, Descriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");

        ObjectNode schema = NODES.objectNode();
        schema.put("type", SchemaType.OBJECT.keyword());
        ObjectNode properties = schema.putObject("properties");
        if (values != null && values.isObject()) {
            addProperties(properties, values, "", descriptor);
        } else if (values != null && !values.isNull() && !values.isMissingNode()) {
            LOG.debug("Values root is not a mapping, synthesizing empty schema: nodeType={}", values.getNodeType());
        }

        ArrayNode sections = descriptor.sections();
        if (!sections.isEmpty()) {
            schema.set(SECTIONS_KEY, sections);
        }
        ObjectNode uiMetadata = descriptor.uiMetadata();
        if (!uiMetadata.isEmpty()) {
            schema.set(UI_METADATA_KEY, uiMetadata);
        }
        return schema;
    }

    /**
     * Derives the title of an array's representative item from the array's
     * own title: a trailing "s" is dropped ({@code Servers} → {@code Server}),
     * otherwise " Item" is appended ({@code Data} → {@code Data Item}).
     */
    static String itemTitle(String arrayTitle) {
        if (arrayTitle.endsWith("s")) {
            return arrayTitle.substring(0, arrayTitle.length() - 1);
        }
        return arrayTitle.isEmpty() ? "Item" : arrayTitle + " Item";
    }

    private ObjectNode synthesizeNode(JsonNode value, String path, Descriptor descriptor) {
        ValueKind kind = ValueKind.of(value);
        ObjectNode schema;
        if (kind == ValueKind.MAPPING) {
            schema = objectSchema(value, path, descriptor.titleFor(path), descriptor);
        } else if (kind == ValueKind.SEQUENCE) {
            schema = arraySchema((ArrayNode) value, path, descriptor);
        } else {
            schema = typed(SchemaType.of(kind), descriptor.titleFor(path));
        }
        annotate(schema, path, descriptor);
        return schema;
    }

    private ObjectNode objectSchema(JsonNode mapping, String path, String title, Descriptor descriptor) {
        ObjectNode schema = typed(SchemaType.OBJECT, title);
        addProperties(schema.putObject("properties"), mapping, path, descriptor);
        return schema;
    }

    private void addProperties(ObjectNode properties, JsonNode mapping, String path, Descriptor descriptor) {
        Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String fieldPath = FieldPaths.child(path, field.getKey());
            properties.set(field.getKey(), synthesizeNode(field.getValue(), fieldPath, descriptor));
        }
    }

    private ObjectNode arraySchema(ArrayNode array, String path, Descriptor descriptor) {
        String title = descriptor.titleFor(path);
        ObjectNode schema = typed(SchemaType.ARRAY, title);
        if (array.isEmpty()) {
            schema.set("items", typed(SchemaType.STRING));
            return schema;
        }

        JsonNode first = array.get(0);
        ValueKind firstKind = ValueKind.of(first);

        if (firstKind.isScalar() && descriptor.isEnum(path)) {
            ArrayNode options = NODES.arrayNode();
            array.forEach(option -> options.add(option.asText()));
            ObjectNode items = typed(SchemaType.STRING);
            items.set("enum", options);
            schema.set("items", items);
            schema.put("uniqueItems", true);
            schema.set("default", options.deepCopy());
            return schema;
        }

        if (firstKind == ValueKind.MAPPING) {
            // path[0] normalizes to path, so the item title always derives from the array title
            String itemPath = FieldPaths.element(path, 0);
            ObjectNode items = objectSchema(first, itemPath, itemTitle(title), descriptor);
            annotate(items, itemPath, descriptor);
            schema.set("items", items);
            return schema;
        }

        // nested sequences are typed as "array" without descending further
        schema.set("items", typed(SchemaType.of(firstKind)));
        return schema;
    }

    private static void annotate(ObjectNode schema, String path, Descriptor descriptor) {
        if (descriptor.isReadonly(path)) {
            schema.put("readOnly", true);
        }
        String description = descriptor.descriptionFor(path);
        if (description != null) {
            schema.put("description", description);
        }
    }

    private static ObjectNode typed(SchemaType type) {
        return NODES.objectNode().put("type", type.keyword());
    }

    private static ObjectNode typed(SchemaType type, String title) {
        return typed(type).put("title", title);
    }
}
