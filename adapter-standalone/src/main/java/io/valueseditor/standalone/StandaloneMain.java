package io.valueseditor.standalone;

import io.valueseditor.standalone.http.EditorApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone values editor service.
 *
 * <p>
 * Delegates to {@link EditorApp#start(String[])}. On failure, logs the error
 * and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/config.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            EditorApp app = EditorApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "values-editor-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
