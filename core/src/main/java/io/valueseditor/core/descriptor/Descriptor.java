package io.valueseditor.core.descriptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the field rules that guide schema synthesis and
 * selective merge: read-only paths, enumeration paths, titles, descriptions,
 * section groupings and free-form UI hints.
 *
 * <p>
 * All rule keys are normalized field paths (see
 * {@link FieldPaths#normalize(String)}). Lookups normalize their argument, so
 * {@code servers[3].port} and {@code servers.port} resolve to the same rule.
 *
 * <p>
 * This is the unit of atomic swap in {@link DescriptorLoader#reload()}.
 * Thread-safe: all fields are final, collections are unmodifiable, and the
 * pass-through JSON nodes are copied on the way in and on the way out.
 */
public final class Descriptor {

    private static final Descriptor EMPTY = builder().build();

    private final Set<String> readonlyPaths;
    private final Set<String> enumPaths;
    private final Map<String, String> titles;
    private final Map<String, String> descriptions;
    private final ArrayNode sections;
    private final ObjectNode uiMetadata;
    private final String loadFailure;

    private Descriptor(Builder builder, String loadFailure) {
        this.readonlyPaths = Collections.unmodifiableSet(new LinkedHashSet<>(builder.readonlyPaths));
        this.enumPaths = Collections.unmodifiableSet(new LinkedHashSet<>(builder.enumPaths));
        this.titles = Collections.unmodifiableMap(new LinkedHashMap<>(builder.titles));
        this.descriptions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.descriptions));
        this.sections = builder.sections.deepCopy();
        this.uiMetadata = builder.uiMetadata.deepCopy();
        this.loadFailure = loadFailure;
    }

    /** Returns the shared descriptor with every rule set empty. */
    public static Descriptor empty() {
        return EMPTY;
    }

    /**
     * Returns an empty descriptor that records why loading the real one failed.
     *
     * @param reason human-readable failure description
     * @return an empty descriptor whose {@link #loadFailure()} is {@code reason}
     */
    public static Descriptor fallback(String reason) {
        return new Descriptor(builder(), Objects.requireNonNull(reason, "reason must not be null"));
    }

    /** Returns a new {@link Builder}. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns true if values at the path must never be overwritten by an update. */
    public boolean isReadonly(String path) {
        return readonlyPaths.contains(FieldPaths.normalize(path));
    }

    /**
     * Returns true if a read-only rule names a mapping key below the path,
     * for example {@code image.repository} below {@code image}.
     */
    public boolean hasReadonlyBelow(String path) {
        String prefix = FieldPaths.normalize(path) + ".";
        for (String readonly : readonlyPaths) {
            if (readonly.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /** Returns true if the sequence at the path is a fixed option list. */
    public boolean isEnum(String path) {
        return enumPaths.contains(FieldPaths.normalize(path));
    }

    /** Returns true if a custom title is configured for the path. */
    public boolean hasTitle(String path) {
        return titles.containsKey(FieldPaths.normalize(path));
    }

    /**
     * Returns the configured title for the path, or a title derived from its
     * last segment when none is configured.
     */
    public String titleFor(String path) {
        String title = titles.get(FieldPaths.normalize(path));
        return title != null ? title : FieldPaths.derivedTitle(path);
    }

    /** Returns the configured description for the path, or null. */
    public String descriptionFor(String path) {
        return descriptions.get(FieldPaths.normalize(path));
    }

    /** Returns a copy of the section declarations, in declaration order. */
    public ArrayNode sections() {
        return sections.deepCopy();
    }

    /** Returns a copy of the free-form UI hint bag. */
    public ObjectNode uiMetadata() {
        return uiMetadata.deepCopy();
    }

    public Set<String> readonlyPaths() {
        return readonlyPaths;
    }

    public Set<String> enumPaths() {
        return enumPaths;
    }

    public Map<String, String> titles() {
        return titles;
    }

    public Map<String, String> descriptions() {
        return descriptions;
    }

    /**
     * Returns why this descriptor is an empty fallback, or null if it was
     * loaded normally.
     */
    public String loadFailure() {
        return loadFailure;
    }

    /** Returns true if this descriptor replaced one that failed to load. */
    public boolean isFallback() {
        return loadFailure != null;
    }

    @Override
    public String toString() {
        return "Descriptor[readonly=" + readonlyPaths.size() + ", enum=" + enumPaths.size() + ", titles="
                + titles.size() + ", descriptions=" + descriptions.size() + ", sections=" + sections.size()
                + (loadFailure != null ? ", fallback" : "") + "]";
    }

    /**
     * Builder for {@link Descriptor}. Every path is normalized as it is added.
     */
    public static final class Builder {

        private final Set<String> readonlyPaths = new LinkedHashSet<>();
        private final Set<String> enumPaths = new LinkedHashSet<>();
        private final Map<String, String> titles = new LinkedHashMap<>();
        private final Map<String, String> descriptions = new LinkedHashMap<>();
        private ArrayNode sections = JsonNodeFactory.instance.arrayNode();
        private ObjectNode uiMetadata = JsonNodeFactory.instance.objectNode();

        Builder() {}

        public Builder readonly(String path) {
            readonlyPaths.add(FieldPaths.normalize(path));
            return this;
        }

        public Builder enumeration(String path) {
            enumPaths.add(FieldPaths.normalize(path));
            return this;
        }

        public Builder title(String path, String title) {
            titles.put(FieldPaths.normalize(path), title);
            return this;
        }

        public Builder description(String path, String description) {
            descriptions.put(FieldPaths.normalize(path), description);
            return this;
        }

        /**
         * Sets the section declarations. The array is opaque to the engine and
         * passed through to the schema root verbatim.
         */
        public Builder sections(JsonNode sections) {
            this.sections = sections != null && sections.isArray()
                    ? (ArrayNode) sections.deepCopy()
                    : JsonNodeFactory.instance.arrayNode();
            return this;
        }

        /** Sets the free-form UI hint bag, passed through to the schema root. */
        public Builder uiMetadata(JsonNode uiMetadata) {
            this.uiMetadata = uiMetadata != null && uiMetadata.isObject()
                    ? (ObjectNode) uiMetadata.deepCopy()
                    : JsonNodeFactory.instance.objectNode();
            return this;
        }

        public Descriptor build() {
            return new Descriptor(this, null);
        }
    }
}
