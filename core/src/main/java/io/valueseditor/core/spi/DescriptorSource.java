package io.valueseditor.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

/**
 * Supplies the raw descriptor document (read-only paths, enumeration paths,
 * titles, descriptions, sections, UI hints) as a parsed tree.
 *
 * <p>
 * Implementations signal "absent" by throwing; the
 * {@link io.valueseditor.core.descriptor.DescriptorLoader} turns any failure
 * into an empty fallback descriptor.
 */
public interface DescriptorSource {

    /**
     * Reads the descriptor document.
     *
     * @return the parsed document; null or a missing node means "no rules"
     * @throws IOException if the document cannot be read or parsed
     */
    JsonNode read() throws IOException;

    /** Identifies the source in log messages and errors. */
    String name();
}
