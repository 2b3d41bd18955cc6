package io.valueseditor.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link EditorConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code values-editor.yaml} from the current
 * directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys receive the defaults from {@link EditorConfig.Builder}. Every
 * key can be overridden by an environment variable, which takes precedence
 * over the YAML value. An env var is "set" if and only if it is defined AND
 * its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "values-editor.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads an {@link EditorConfig} from the given YAML file, applying
     * overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EditorConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads an {@link EditorConfig} from the given YAML file, applying
     * overrides from the supplied lookup function. The lookup returns
     * {@code null} for an undefined variable.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static EditorConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                root = YAML_MAPPER.createObjectNode();
            }
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException(
                    "Failed to load configuration from: " + configPath + " (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static EditorConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EditorConfig.Builder builder = EditorConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.serverHost(server.get("host").asText());
        if (server.has("port")) builder.serverPort(server.get("port").asInt());
        if (server.has("cors-origins")) builder.corsOrigins(textList(server.get("cors-origins")));

        JsonNode values = root.path("values");
        if (values.has("file")) builder.valuesFile(values.get("file").asText());

        JsonNode descriptor = root.path("descriptor");
        if (descriptor.has("file")) builder.descriptorFile(descriptor.get("file").asText());
        JsonNode watch = descriptor.path("watch");
        if (watch.has("enabled")) builder.descriptorWatchEnabled(watch.get("enabled").asBoolean());
        if (watch.has("debounce-ms"))
            builder.descriptorWatchDebounceMs(watch.get("debounce-ms").asInt());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        JsonNode admin = root.path("admin");
        if (admin.has("reload-path"))
            builder.adminReloadPath(admin.get("reload-path").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "SERVER_HOST", builder::serverHost);
        envString(envLookup, "VALUES_FILE", builder::valuesFile);
        envString(envLookup, "DESCRIPTOR_FILE", builder::descriptorFile);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envString(envLookup, "ADMIN_RELOAD_PATH", builder::adminReloadPath);
        envString(envLookup, "CORS_ORIGINS", value -> builder.corsOrigins(commaSeparated(value)));

        envInt(envLookup, "SERVER_PORT", builder::serverPort);
        envInt(envLookup, "DESCRIPTOR_WATCH_DEBOUNCE_MS", builder::descriptorWatchDebounceMs);

        envBool(envLookup, "DESCRIPTOR_WATCH_ENABLED", builder::descriptorWatchEnabled);
        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);

        return builder.build();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static List<String> textList(JsonNode node) {
        if (node.isTextual()) {
            return commaSeparated(node.asText());
        }
        if (!node.isArray()) {
            throw new ConfigLoadException("server.cors-origins must be a list of origins");
        }
        List<String> origins = new ArrayList<>();
        node.forEach(origin -> origins.add(origin.asText().trim()));
        return origins;
    }

    private static List<String> commaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }
}
