package io.valueseditor.core.descriptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.valueseditor.core.spi.DescriptorSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Reads a descriptor document from a YAML (or JSON) file. */
public final class YamlFileDescriptorSource implements DescriptorSource {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Path path;

    public YamlFileDescriptorSource(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public JsonNode read() throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return YAML_MAPPER.readTree(in);
        }
    }

    @Override
    public String name() {
        return path.toString();
    }

    public Path path() {
        return path;
    }
}
