package io.valueseditor.standalone.http;

import io.javalin.Javalin;
import io.valueseditor.core.descriptor.Descriptor;
import io.valueseditor.core.descriptor.DescriptorLoader;
import io.valueseditor.core.descriptor.YamlFileDescriptorSource;
import io.valueseditor.core.engine.ValuesEditor;
import io.valueseditor.standalone.config.ConfigLoader;
import io.valueseditor.standalone.config.EditorConfig;
import io.valueseditor.standalone.store.YamlValuesStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the values editor service.
 *
 * <p>
 * Startup sequence:
 * <ol>
 * <li>Load configuration from YAML + env overlay and set up logging</li>
 * <li>Load the descriptor (a broken descriptor yields empty rules)</li>
 * <li>Open the values store and build the {@link ValuesEditor}</li>
 * <li>Start the Javalin HTTP server with CORS and the API routes</li>
 * <li>Start the descriptor file watcher (if enabled)</li>
 * </ol>
 *
 * <p>
 * Kept apart from {@link io.valueseditor.standalone.StandaloneMain} so tests
 * can start and stop the service without going through {@code main()}.
 */
public final class EditorApp {

    private static final Logger LOG = LoggerFactory.getLogger(EditorApp.class);

    static final String SCHEMA_PATH = "/schema";
    static final String VALUES_PATH = "/values";
    static final String UPDATE_PATH = "/update";

    private final Javalin app;
    private final ValuesEditor editor;
    private final FileWatcher fileWatcher;
    private final EditorConfig config;

    private EditorApp(Javalin app, ValuesEditor editor, FileWatcher fileWatcher, EditorConfig config) {
        this.app = app;
        this.editor = editor;
        this.fileWatcher = fileWatcher;
        this.config = config;
    }

    /**
     * Loads configuration from the command line, configures logging and
     * starts the service.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/config.yaml})
     * @return the running application
     * @throws IOException if the descriptor file watcher cannot be started
     */
    public static EditorApp start(String[] args) throws IOException {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        EditorConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config);
    }

    /**
     * Starts the service with an already loaded configuration.
     *
     * @param config the service configuration
     * @return the running application
     * @throws IOException if the descriptor file watcher cannot be started
     */
    public static EditorApp start(EditorConfig config) throws IOException {
        long startTime = System.nanoTime();

        Path descriptorPath = Path.of(config.descriptorFile());
        DescriptorLoader descriptors = new DescriptorLoader(new YamlFileDescriptorSource(descriptorPath));
        Descriptor descriptor = descriptors.reload();

        YamlValuesStore store = new YamlValuesStore(Path.of(config.valuesFile()));
        ValuesEditor editor = new ValuesEditor(store, descriptors);

        List<String> origins = config.corsOrigins();
        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            if (!origins.isEmpty()) {
                javalinConfig.bundledPlugins.enableCors(cors -> cors.addRule(rule -> {
                    if (origins.contains("*")) {
                        rule.anyHost();
                    } else {
                        origins.forEach(origin -> rule.allowHost(origin));
                    }
                }));
            }
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }
        app.get(SCHEMA_PATH, new SchemaHandler(editor));
        app.get(VALUES_PATH, new ValuesHandler(editor));
        app.post(UPDATE_PATH, new UpdateHandler(editor));
        app.post(config.adminReloadPath(), new DescriptorReloadHandler(editor));

        app.start(config.serverHost(), config.serverPort());

        FileWatcher fileWatcher = null;
        if (config.descriptorWatchEnabled()) {
            fileWatcher = FileWatcher.forFile(descriptorPath, config.descriptorWatchDebounceMs(), () -> {
                Descriptor reloaded = editor.reloadDescriptor();
                LOG.info("Descriptor hot reload complete: fallback={}", reloaded.isFallback());
            });
            try {
                fileWatcher.start();
            } catch (IOException e) {
                app.stop();
                throw e;
            }
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "values-editor started: port={}, values={}, descriptor={}, readonly={}, enum={}, watch={}, startupMs={}",
                app.port(),
                store.name(),
                descriptorPath,
                descriptor.readonlyPaths().size(),
                descriptor.enumPaths().size(),
                config.descriptorWatchEnabled(),
                elapsedMs);

        return new EditorApp(app, editor, fileWatcher, config);
    }

    /** Returns the port the server is listening on. */
    public int port() {
        return app.port();
    }

    public ValuesEditor editor() {
        return editor;
    }

    public EditorConfig config() {
        return config;
    }

    /** Stops the file watcher and the HTTP server. */
    public void stop() {
        if (fileWatcher != null) {
            fileWatcher.stop();
        }
        app.stop();
        LOG.info("values-editor stopped");
    }
}
