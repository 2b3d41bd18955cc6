package io.valueseditor.core.descriptor;

import com.fasterxml.jackson.databind.JsonNode;
import io.valueseditor.core.error.DescriptorParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Maps a parsed descriptor document onto a {@link Descriptor}.
 *
 * <p>
 * Recognized top-level keys:
 *
 * <pre>
 * readonly-fields: [image.repository, ingress.host]
 * enum-fields:     [environments]
 * titles:          {image.pullPolicy: "Pull policy"}
 * descriptions:    {replicaCount: "Number of pods"}
 * sections:        [{key: image, title: Image}]
 * ui-metadata:     {title: "Deployment Manager"}
 * </pre>
 *
 * <p>
 * Unknown keys and wrongly shaped values are rejected with
 * {@link DescriptorParseException} so that a typo does not silently drop a
 * protection rule. Thread-safe: stateless.
 */
public final class DescriptorParser {

    static final String READONLY_FIELDS = "readonly-fields";
    static final String ENUM_FIELDS = "enum-fields";
    static final String TITLES = "titles";
    static final String DESCRIPTIONS = "descriptions";
    static final String SECTIONS = "sections";
    static final String UI_METADATA = "ui-metadata";

    private static final Set<String> KNOWN_KEYS =
            Set.of(READONLY_FIELDS, ENUM_FIELDS, TITLES, DESCRIPTIONS, SECTIONS, UI_METADATA);

    /**
     * Parses the document. A null, missing or JSON-null document yields
     * {@link Descriptor#empty()}.
     *
     * @param root   the parsed document
     * @param source source name for error messages
     * @return the descriptor
     * @throws DescriptorParseException if the document has an unexpected shape
     */
    public Descriptor parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Descriptor.empty();
        }
        if (!root.isObject()) {
            throw new DescriptorParseException(
                    "Descriptor root must be a mapping, found " + root.getNodeType(), source);
        }
        rejectUnknownKeys(root, source);

        Descriptor.Builder builder = Descriptor.builder();
        stringList(root, READONLY_FIELDS, source).forEach(builder::readonly);
        stringList(root, ENUM_FIELDS, source).forEach(builder::enumeration);
        stringMap(root, TITLES, source).forEach(builder::title);
        stringMap(root, DESCRIPTIONS, source).forEach(builder::description);

        JsonNode sections = root.get(SECTIONS);
        if (sections != null && !sections.isNull()) {
            if (!sections.isArray()) {
                throw new DescriptorParseException("'" + SECTIONS + "' must be a list", source);
            }
            builder.sections(sections);
        }
        JsonNode ui = root.get(UI_METADATA);
        if (ui != null && !ui.isNull()) {
            if (!ui.isObject()) {
                throw new DescriptorParseException("'" + UI_METADATA + "' must be a mapping", source);
            }
            builder.uiMetadata(ui);
        }
        return builder.build();
    }

    private List<String> stringList(JsonNode root, String key, String source) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new DescriptorParseException("'" + key + "' must be a list of field paths", source);
        }
        return StreamSupport.stream(node.spliterator(), false)
                .map(entry -> {
                    if (!entry.isTextual() || entry.asText().isBlank()) {
                        throw new DescriptorParseException(
                                "'" + key + "' entries must be non-empty strings, found: " + entry, source);
                    }
                    return entry.asText().trim();
                })
                .collect(Collectors.toList());
    }

    private Map<String, String> stringMap(JsonNode root, String key, String source) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new DescriptorParseException("'" + key + "' must be a mapping of field path to text", source);
        }
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isValueNode() || field.getValue().isNull()) {
                throw new DescriptorParseException(
                        "'" + key + "." + field.getKey() + "' must be a scalar text value", source);
            }
            values.put(field.getKey(), field.getValue().asText());
        }
        return values;
    }

    private void rejectUnknownKeys(JsonNode root, String source) {
        List<String> unknown = StreamSupport.stream(((Iterable<String>) root::fieldNames).spliterator(), false)
                .filter(key -> !KNOWN_KEYS.contains(key))
                .sorted()
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new DescriptorParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in descriptor: " + unknown
                            + "; recognized keys are: " + KNOWN_KEYS.stream().sorted().collect(Collectors.toList()),
                    source);
        }
    }
}
