package io.valueseditor.standalone.config;

import java.util.List;

/**
 * Root configuration for the standalone values editor service.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param serverHost                bind address of the HTTP server
 * @param serverPort                listen port of the HTTP server; 0 picks an
 *                                  ephemeral port
 * @param corsOrigins               origins allowed to call the API from a browser
 * @param valuesFile                path of the values YAML document
 * @param descriptorFile            path of the descriptor YAML document
 * @param descriptorWatchEnabled    reload the descriptor when its file changes
 * @param descriptorWatchDebounceMs debounce period for descriptor file events
 * @param healthEnabled             register the liveness endpoint
 * @param healthPath                liveness endpoint path
 * @param loggingFormat             json or text
 * @param loggingLevel              root log level
 * @param adminReloadPath           descriptor reload endpoint path
 */
public record EditorConfig(
        String serverHost,
        int serverPort,
        List<String> corsOrigins,
        String valuesFile,
        String descriptorFile,
        boolean descriptorWatchEnabled,
        int descriptorWatchDebounceMs,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel,
        String adminReloadPath) {

    public EditorConfig {
        corsOrigins = List.copyOf(corsOrigins);
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link EditorConfig}. */
    public static final class Builder {
        private String serverHost = "0.0.0.0";
        private int serverPort = 8000;
        private List<String> corsOrigins = List.of("http://localhost:3000");
        private String valuesFile = "./values.yaml";
        private String descriptorFile = "./descriptor.yaml";
        private boolean descriptorWatchEnabled = true;
        private int descriptorWatchDebounceMs = 500;
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";
        private String adminReloadPath = "/admin/reload";

        Builder() {}

        public Builder serverHost(String serverHost) {
            this.serverHost = serverHost;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder corsOrigins(List<String> corsOrigins) {
            this.corsOrigins = corsOrigins;
            return this;
        }

        public Builder valuesFile(String valuesFile) {
            this.valuesFile = valuesFile;
            return this;
        }

        public Builder descriptorFile(String descriptorFile) {
            this.descriptorFile = descriptorFile;
            return this;
        }

        public Builder descriptorWatchEnabled(boolean descriptorWatchEnabled) {
            this.descriptorWatchEnabled = descriptorWatchEnabled;
            return this;
        }

        public Builder descriptorWatchDebounceMs(int descriptorWatchDebounceMs) {
            this.descriptorWatchDebounceMs = descriptorWatchDebounceMs;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder adminReloadPath(String adminReloadPath) {
            this.adminReloadPath = adminReloadPath;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if a value is out of range
         */
        public EditorConfig build() {
            if (serverPort < 0 || serverPort > 65535) {
                throw new ConfigLoadException("server.port must be between 0 and 65535, got " + serverPort);
            }
            if (descriptorWatchDebounceMs < 0) {
                throw new ConfigLoadException(
                        "descriptor.watch.debounce-ms must not be negative, got " + descriptorWatchDebounceMs);
            }
            requirePath("health.path", healthPath);
            requirePath("admin.reload-path", adminReloadPath);
            return new EditorConfig(
                    serverHost,
                    serverPort,
                    corsOrigins,
                    valuesFile,
                    descriptorFile,
                    descriptorWatchEnabled,
                    descriptorWatchDebounceMs,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel,
                    adminReloadPath);
        }

        private static void requirePath(String key, String value) {
            if (value == null || !value.startsWith("/")) {
                throw new ConfigLoadException(key + " must start with '/', got " + value);
            }
        }
    }
}
