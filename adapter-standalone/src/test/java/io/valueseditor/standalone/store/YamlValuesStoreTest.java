package io.valueseditor.standalone.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.valueseditor.core.error.ValuesReadException;
import io.valueseditor.core.error.ValuesWriteException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("YamlValuesStore")
class YamlValuesStoreTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path valuesFile;
    private YamlValuesStore store;

    @BeforeEach
    void setUp() {
        valuesFile = tempDir.resolve("values.yaml");
        store = new YamlValuesStore(valuesFile);
    }

    @Nested
    @DisplayName("Read")
    class Read {

        @Test
        void readsMappingInDocumentOrder() throws Exception {
            Files.writeString(valuesFile, """
                    replicaCount: 2
                    image:
                      repository: nginx
                      tag: "1.0"
                    enabled: true
                    """);

            JsonNode values = store.read();

            assertThat(values.fieldNames()).toIterable().containsExactly("replicaCount", "image", "enabled");
            assertThat(values.get("replicaCount").isIntegralNumber()).isTrue();
            assertThat(values.get("image").get("tag").isTextual()).isTrue();
            assertThat(values.get("enabled").isBoolean()).isTrue();
        }

        @Test
        void emptyFileIsEmptyMapping() throws Exception {
            Files.writeString(valuesFile, "");

            JsonNode values = store.read();

            assertThat(values.isObject()).isTrue();
            assertThat(values.isEmpty()).isTrue();
        }

        @Test
        void missingFileIsReadFailure() {
            assertThatThrownBy(store::read)
                    .isInstanceOf(ValuesReadException.class)
                    .hasMessageContaining("not found")
                    .satisfies(e -> assertThat(((ValuesReadException) e).source()).isEqualTo(valuesFile.toString()));
        }

        @Test
        void malformedYamlIsReadFailure() throws Exception {
            Files.writeString(valuesFile, "image: [unclosed\n");

            assertThatThrownBy(store::read).isInstanceOf(ValuesReadException.class);
        }

        @Test
        void nonMappingRootIsReadFailure() throws Exception {
            Files.writeString(valuesFile, "- a\n- b\n");

            assertThatThrownBy(store::read)
                    .isInstanceOf(ValuesReadException.class)
                    .hasMessageContaining("mapping");
        }
    }

    @Nested
    @DisplayName("Write")
    class Write {

        @Test
        void writtenDocumentReadsBackEqual() throws Exception {
            ObjectNode values = (ObjectNode) JSON.readTree(
                    "{\"image\":{\"repository\":\"nginx\",\"tag\":\"1.0\"},\"replicas\":3,\"ratio\":0.5,"
                            + "\"enabled\":false,\"empty\":null,\"servers\":[{\"name\":\"a\"}]}");

            store.write(values);

            assertThat(store.read()).isEqualTo(values);
        }

        @Test
        @DisplayName("Numeric-looking strings stay strings")
        void numericStringsKeepQuotes() throws Exception {
            store.write((ObjectNode) JSON.readTree("{\"tag\":\"1.0\",\"flag\":\"true\"}"));

            JsonNode values = store.read();

            assertThat(values.get("tag").isTextual()).isTrue();
            assertThat(values.get("flag").isTextual()).isTrue();
        }

        @Test
        void outputIsBlockStyleWithoutDocumentMarker() throws Exception {
            store.write((ObjectNode) JSON.readTree("{\"image\":{\"repository\":\"nginx\"},\"envs\":[\"dev\"]}"));

            String yaml = Files.readString(valuesFile);

            assertThat(yaml).doesNotStartWith("---");
            assertThat(yaml).contains("image:\n  repository: nginx");
            assertThat(yaml).doesNotContain("{").doesNotContain("[");
        }

        @Test
        void replacesExistingFileWithoutLeavingTempFiles() throws Exception {
            Files.writeString(valuesFile, "old: true\n");

            store.write((ObjectNode) JSON.readTree("{\"new\":1}"));

            assertThat(store.read()).isEqualTo(JSON.readTree("{\"new\":1}"));
            try (Stream<Path> files = Files.list(tempDir)) {
                assertThat(files).containsExactly(valuesFile);
            }
        }

        @Test
        void missingDirectoryIsWriteFailure() throws Exception {
            YamlValuesStore orphan = new YamlValuesStore(tempDir.resolve("missing/values.yaml"));

            assertThatThrownBy(() -> orphan.write(JSON.createObjectNode()))
                    .isInstanceOf(ValuesWriteException.class);
        }
    }
}
