package io.valueseditor.standalone.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.valueseditor.core.error.ValuesReadException;
import io.valueseditor.core.error.ValuesWriteException;
import io.valueseditor.core.spi.ValuesStore;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the values document as a YAML file on disk.
 *
 * <p>
 * Reads treat an empty file as an empty mapping. Writes produce block-style
 * YAML in a temporary file next to the target and move it over the target, so
 * a reader never observes a half-written document. Key order is preserved in
 * both directions.
 */
public final class YamlValuesStore implements ValuesStore {

    private static final Logger LOG = LoggerFactory.getLogger(YamlValuesStore.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
            .build());

    private final Path file;

    public YamlValuesStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
    }

    @Override
    public JsonNode read() {
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = YAML_MAPPER.readTree(in);
        } catch (NoSuchFileException e) {
            throw new ValuesReadException("Values file not found: " + file, e, name());
        } catch (IOException e) {
            throw new ValuesReadException("Failed to parse values file: " + e.getMessage(), e, name());
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ValuesReadException(
                    "Values document root must be a mapping, found " + root.getNodeType(), name());
        }
        return root;
    }

    @Override
    public void write(ObjectNode values) {
        Objects.requireNonNull(values, "values must not be null");
        Path directory = file.toAbsolutePath().getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + file.getFileName(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                YAML_MAPPER.writeValue(out, values);
            }
            moveOver(temp);
            LOG.debug("Values written: file={}, keys={}", file, values.size());
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new ValuesWriteException("Failed to write values file: " + e.getMessage(), e, name());
        }
    }

    @Override
    public String name() {
        return file.toString();
    }

    /** Returns the path of the backing file. */
    public Path file() {
        return file;
    }

    private void moveOver(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported, falling back to replace: file={}", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, IOException original) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            original.addSuppressed(e);
        }
    }
}
