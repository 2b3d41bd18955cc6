package io.valueseditor.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.valueseditor.core.descriptor.Descriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("SchemaSynthesizer")
class SchemaSynthesizerTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final SchemaSynthesizer synthesizer = new SchemaSynthesizer();

    private static JsonNode json(String text) throws Exception {
        return JSON.readTree(text);
    }

    @Nested
    @DisplayName("Empty roots")
    class EmptyRoots {

        @Test
        void emptyMappingYieldsEmptyObjectSchema() throws Exception {
            ObjectNode schema = synthesizer.synthesize(json("{}"), Descriptor.empty());

            assertThat(schema).isEqualTo(json("{\"type\":\"object\",\"properties\":{}}"));
        }

        @Test
        void absentValuesYieldEmptyObjectSchema() throws Exception {
            JsonNode expected = json("{\"type\":\"object\",\"properties\":{}}");

            assertThat(synthesizer.synthesize(null, Descriptor.empty())).isEqualTo(expected);
            assertThat(synthesizer.synthesize(MissingNode.getInstance(), Descriptor.empty()))
                    .isEqualTo(expected);
        }

        @Test
        void nonMappingRootYieldsEmptyObjectSchema() throws Exception {
            ObjectNode schema = synthesizer.synthesize(json("[1, 2]"), Descriptor.empty());

            assertThat(schema.get("properties").isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Scalar classification")
    class Scalars {

        @Test
        @DisplayName("Booleans are boolean, never integer")
        void booleanBeforeInteger() throws Exception {
            ObjectNode schema = synthesizer.synthesize(
                    YAML.readTree("enabled: true\nreplicas: 3\nratio: 0.5\nname: web\nnothing: null\n"),
                    Descriptor.empty());

            JsonNode properties = schema.get("properties");
            assertThat(properties.get("enabled").get("type").asText()).isEqualTo("boolean");
            assertThat(properties.get("replicas").get("type").asText()).isEqualTo("integer");
            assertThat(properties.get("ratio").get("type").asText()).isEqualTo("number");
            assertThat(properties.get("name").get("type").asText()).isEqualTo("string");
            assertThat(properties.get("nothing").get("type").asText()).isEqualTo("string");
        }

        @Test
        void everyNodeCarriesDerivedTitle() throws Exception {
            ObjectNode schema = synthesizer.synthesize(
                    json("{\"image\":{\"pullPolicy\":\"Always\"},\"max_retries\":3}"), Descriptor.empty());

            JsonNode image = schema.get("properties").get("image");
            assertThat(image.get("title").asText()).isEqualTo("Image");
            assertThat(image.get("properties").get("pullPolicy").get("title").asText())
                    .isEqualTo("Pull Policy");
            assertThat(schema.get("properties").get("max_retries").get("title").asText())
                    .isEqualTo("Max Retries");
        }

        @Test
        void propertyOrderFollowsValues() throws Exception {
            ObjectNode schema = synthesizer.synthesize(json("{\"b\":1,\"a\":2,\"c\":3}"), Descriptor.empty());

            assertThat(schema.get("properties").fieldNames()).toIterable().containsExactly("b", "a", "c");
        }
    }

    @Nested
    @DisplayName("Sequences")
    class Sequences {

        @Test
        void emptySequenceIsArrayOfStrings() throws Exception {
            ObjectNode schema = synthesizer.synthesize(json("{\"tags\":[]}"), Descriptor.empty());

            JsonNode tags = schema.get("properties").get("tags");
            assertThat(tags.get("type").asText()).isEqualTo("array");
            assertThat(tags.get("items")).isEqualTo(json("{\"type\":\"string\"}"));
        }

        @Test
        @DisplayName("Enumeration sequence exposes its elements as options")
        void enumerationSequence() throws Exception {
            Descriptor descriptor = Descriptor.builder().enumeration("environments").build();

            ObjectNode schema = synthesizer.synthesize(
                    json("{\"environments\":[\"dev\",\"staging\",\"prod\"]}"), descriptor);

            JsonNode environments = schema.get("properties").get("environments");
            assertThat(environments.get("type").asText()).isEqualTo("array");
            assertThat(environments.get("uniqueItems").asBoolean()).isTrue();
            assertThat(environments.get("items").get("type").asText()).isEqualTo("string");
            assertThat(environments.get("items").get("enum")).isEqualTo(json("[\"dev\",\"staging\",\"prod\"]"));
            assertThat(environments.get("default")).isEqualTo(json("[\"dev\",\"staging\",\"prod\"]"));
        }

        @Test
        void enumerationOptionsAreRenderedAsText() throws Exception {
            Descriptor descriptor = Descriptor.builder().enumeration("ports").build();

            ObjectNode schema = synthesizer.synthesize(json("{\"ports\":[80,443]}"), descriptor);

            assertThat(schema.get("properties").get("ports").get("items").get("enum"))
                    .isEqualTo(json("[\"80\",\"443\"]"));
        }

        @Test
        void sequenceWithoutEnumerationRuleIsTypedByFirstElement() throws Exception {
            ObjectNode schema = synthesizer.synthesize(json("{\"ports\":[80,443],\"flags\":[true]}"), Descriptor.empty());

            assertThat(schema.get("properties").get("ports").get("items"))
                    .isEqualTo(json("{\"type\":\"integer\"}"));
            assertThat(schema.get("properties").get("flags").get("items"))
                    .isEqualTo(json("{\"type\":\"boolean\"}"));
            assertThat(schema.get("properties").get("ports").has("uniqueItems")).isFalse();
        }

        @Test
        void nestedSequenceItemsAreArrays() throws Exception {
            ObjectNode schema = synthesizer.synthesize(json("{\"matrix\":[[1,2],[3]]}"), Descriptor.empty());

            assertThat(schema.get("properties").get("matrix").get("items"))
                    .isEqualTo(json("{\"type\":\"array\"}"));
        }

        @Test
        @DisplayName("Enumeration rule on a sequence of mappings falls through to object items")
        void enumerationOnMappingSequence() throws Exception {
            Descriptor descriptor = Descriptor.builder().enumeration("servers").build();

            ObjectNode schema = synthesizer.synthesize(json("{\"servers\":[{\"name\":\"a\"}]}"), descriptor);

            JsonNode servers = schema.get("properties").get("servers");
            assertThat(servers.get("items").get("type").asText()).isEqualTo("object");
            assertThat(servers.has("uniqueItems")).isFalse();
        }

        @Test
        @DisplayName("Sequence of mappings is described by its first element")
        void mappingSequence() throws Exception {
            ObjectNode schema = synthesizer.synthesize(
                    json("{\"servers\":[{\"name\":\"a\",\"port\":80},{\"name\":\"b\",\"extra\":true}]}"),
                    Descriptor.empty());

            JsonNode items = schema.get("properties").get("servers").get("items");
            assertThat(items.get("type").asText()).isEqualTo("object");
            assertThat(items.get("title").asText()).isEqualTo("Server");
            assertThat(items.get("properties").fieldNames()).toIterable().containsExactly("name", "port");
            assertThat(items.get("properties").get("port").get("type").asText()).isEqualTo("integer");
        }

        @Test
        void itemTitleAppendsItemWithoutTrailingS() throws Exception {
            ObjectNode schema = synthesizer.synthesize(json("{\"data\":[{\"k\":1}]}"), Descriptor.empty());

            assertThat(schema.get("properties").get("data").get("items").get("title").asText())
                    .isEqualTo("Data Item");
        }

        @Test
        void itemTitleDerivesFromCustomArrayTitle() throws Exception {
            Descriptor descriptor = Descriptor.builder().title("servers", "Backends").build();

            ObjectNode schema = synthesizer.synthesize(json("{\"servers\":[{\"name\":\"a\"}]}"), descriptor);

            JsonNode servers = schema.get("properties").get("servers");
            assertThat(servers.get("title").asText()).isEqualTo("Backends");
            assertThat(servers.get("items").get("title").asText()).isEqualTo("Backend");
        }

        @Test
        @DisplayName("Title configured on the first element titles the array, items derive from it")
        void elementTitleKeyIsTheArrayTitle() throws Exception {
            Descriptor descriptor = Descriptor.builder().title("servers[0]", "Upstreams").build();

            ObjectNode schema = synthesizer.synthesize(json("{\"servers\":[{\"name\":\"a\"}]}"), descriptor);

            JsonNode servers = schema.get("properties").get("servers");
            assertThat(servers.get("title").asText()).isEqualTo("Upstreams");
            assertThat(servers.get("items").get("title").asText()).isEqualTo("Upstream");
        }

        @Test
        void elementRulesApplyToEveryElementPath() throws Exception {
            Descriptor descriptor = Descriptor.builder()
                    .readonly("servers[0].name")
                    .description("servers.port", "Listen port")
                    .build();

            ObjectNode schema = synthesizer.synthesize(json("{\"servers\":[{\"name\":\"a\",\"port\":80}]}"), descriptor);

            JsonNode itemProperties = schema.get("properties").get("servers").get("items").get("properties");
            assertThat(itemProperties.get("name").get("readOnly").asBoolean()).isTrue();
            assertThat(itemProperties.get("port").get("description").asText()).isEqualTo("Listen port");
        }
    }

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({"Servers, Server", "Data, Data Item", "Hosts, Host", "'', Item", "s, ''"})
    void itemTitleRule(String arrayTitle, String expected) {
        assertThat(SchemaSynthesizer.itemTitle(arrayTitle)).isEqualTo(expected);
    }

    @Nested
    @DisplayName("Annotations")
    class Annotations {

        @Test
        @DisplayName("Read-only and description are attached where configured")
        void readOnlyAndDescription() throws Exception {
            Descriptor descriptor = Descriptor.builder()
                    .readonly("image.repository")
                    .description("image.repository", "Container registry path")
                    .title("image.tag", "Image tag")
                    .build();

            ObjectNode schema = synthesizer.synthesize(
                    json("{\"image\":{\"repository\":\"nginx\",\"tag\":\"1.0\"}}"), descriptor);

            JsonNode image = schema.get("properties").get("image").get("properties");
            assertThat(image.get("repository").get("readOnly").asBoolean()).isTrue();
            assertThat(image.get("repository").get("description").asText()).isEqualTo("Container registry path");
            assertThat(image.get("tag").has("readOnly")).isFalse();
            assertThat(image.get("tag").has("description")).isFalse();
            assertThat(image.get("tag").get("title").asText()).isEqualTo("Image tag");
        }

        @Test
        void readOnlyMappingIsMarked() throws Exception {
            Descriptor descriptor = Descriptor.builder().readonly("ingress").build();

            ObjectNode schema = synthesizer.synthesize(json("{\"ingress\":{\"host\":\"x\"}}"), descriptor);

            assertThat(schema.get("properties").get("ingress").get("readOnly").asBoolean()).isTrue();
            assertThat(schema.get("properties").get("ingress").get("properties").get("host").has("readOnly"))
                    .isFalse();
        }

        @Test
        @DisplayName("Sections and UI metadata pass through to the root")
        void rootPassThrough() throws Exception {
            Descriptor descriptor = Descriptor.builder()
                    .sections(json("[{\"key\":\"image\",\"title\":\"Image\"}]"))
                    .uiMetadata(json("{\"title\":\"Deployment Manager\"}"))
                    .build();

            ObjectNode schema = synthesizer.synthesize(json("{\"image\":{}}"), descriptor);

            assertThat(schema.get("sections")).isEqualTo(json("[{\"key\":\"image\",\"title\":\"Image\"}]"));
            assertThat(schema.get("ui_metadata")).isEqualTo(json("{\"title\":\"Deployment Manager\"}"));
            assertThat(schema.get("properties").get("image").has("sections")).isFalse();
        }

        @Test
        void emptySectionsAndMetadataAreOmitted() throws Exception {
            ObjectNode schema = synthesizer.synthesize(json("{\"a\":1}"), Descriptor.empty());

            assertThat(schema.has("sections")).isFalse();
            assertThat(schema.has("ui_metadata")).isFalse();
        }
    }

    @Test
    @DisplayName("Same inputs give an equal schema and never share the input nodes")
    void deterministicAndDetached() throws Exception {
        JsonNode values = YAML.readTree("""
                image:
                  repository: nginx
                  tag: "1.0"
                servers:
                  - name: a
                    port: 80
                environments: [dev, prod]
                """);
        JsonNode before = values.deepCopy();
        Descriptor descriptor = Descriptor.builder().enumeration("environments").build();

        ObjectNode first = synthesizer.synthesize(values, descriptor);
        ObjectNode second = synthesizer.synthesize(values, descriptor);
        ((ObjectNode) first.get("properties")).remove("image");

        assertThat(second.get("properties").has("image")).isTrue();
        assertThat(synthesizer.synthesize(values, descriptor)).isEqualTo(second);
        assertThat(values).isEqualTo(before);
    }
}
