package io.valueseditor.core.descriptor;

import com.fasterxml.jackson.databind.JsonNode;
import io.valueseditor.core.spi.DescriptorSource;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the {@link Descriptor} from its source and holds the active snapshot.
 *
 * <p>
 * Loading fails softly: any read or parse error yields an empty fallback
 * descriptor and a WARN log entry, never an exception.
 *
 * <p>
 * Thread-safe: the active descriptor sits in an {@link AtomicReference}.
 * {@link #reload()} builds a complete new snapshot and swaps it in with a
 * single write. Callers that captured the previous snapshot via
 * {@link #current()} keep using it; later callers see the new one.
 */
public final class DescriptorLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DescriptorLoader.class);

    private final DescriptorSource source;
    private final DescriptorParser parser;
    private final AtomicReference<Descriptor> active = new AtomicReference<>(Descriptor.empty());

    /**
     * Creates a loader for the given source. Nothing is read until
     * {@link #reload()} is called; until then {@link #current()} is empty.
     *
     * @param source the descriptor source
     */
    public DescriptorLoader(DescriptorSource source) {
        this(source, new DescriptorParser());
    }

    public DescriptorLoader(DescriptorSource source, DescriptorParser parser) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /**
     * Reads and parses the descriptor without activating it.
     *
     * @return the loaded descriptor, or an empty fallback carrying the failure
     *         reason if anything went wrong
     */
    public Descriptor load() {
        try {
            JsonNode root = source.read();
            return parser.parse(root, source.name());
        } catch (Exception e) {
            String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
            LOG.warn("Descriptor load failed, using empty rules: source={}, reason={}", source.name(), reason);
            return Descriptor.fallback(reason);
        }
    }

    /**
     * Loads the descriptor and atomically replaces the active snapshot with it.
     *
     * @return the newly active descriptor
     */
    public Descriptor reload() {
        Descriptor next = load();
        active.set(next);
        LOG.info(
                "Descriptor reloaded: source={}, readonly={}, enum={}, titles={}, descriptions={}, sections={}, fallback={}",
                source.name(),
                next.readonlyPaths().size(),
                next.enumPaths().size(),
                next.titles().size(),
                next.descriptions().size(),
                next.sections().size(),
                next.isFallback());
        return next;
    }

    /** Returns the active descriptor snapshot. */
    public Descriptor current() {
        return active.get();
    }

    /** Returns the source this loader reads from. */
    public DescriptorSource source() {
        return source;
    }
}
