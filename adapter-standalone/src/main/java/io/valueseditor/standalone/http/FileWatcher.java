package io.valueseditor.standalone.http;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a directory and fires a callback, debounced, when a matching file
 * is created, modified or deleted.
 *
 * <p>
 * Rapid successive changes are coalesced into a single callback invocation.
 * The callback runs on the debounce scheduler thread, never on the watch
 * thread. Both threads are daemons.
 */
public final class FileWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(FileWatcher.class);

    private final Path watchDir;
    private final Predicate<Path> fileFilter;
    private final int debounceMs;
    private final Runnable callback;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private WatchService watchService;
    private Thread watchThread;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pending;

    /**
     * Creates a watcher that reacts to every file in the directory.
     *
     * @param watchDir   directory to watch
     * @param debounceMs debounce period in milliseconds
     * @param callback   invoked once changes have settled
     */
    public FileWatcher(Path watchDir, int debounceMs, Runnable callback) {
        this(watchDir, file -> true, debounceMs, callback);
    }

    /**
     * Creates a watcher that reacts only to files accepted by the filter.
     *
     * @param watchDir   directory to watch
     * @param fileFilter receives the changed file name relative to
     *                   {@code watchDir}
     * @param debounceMs debounce period in milliseconds
     * @param callback   invoked once changes have settled
     */
    public FileWatcher(Path watchDir, Predicate<Path> fileFilter, int debounceMs, Runnable callback) {
        this.watchDir = Objects.requireNonNull(watchDir, "watchDir must not be null");
        this.fileFilter = Objects.requireNonNull(fileFilter, "fileFilter must not be null");
        this.debounceMs = debounceMs;
        this.callback = Objects.requireNonNull(callback, "callback must not be null");
    }

    /**
     * Creates a watcher for a single file: its parent directory is watched and
     * only events for the file's name pass.
     */
    public static FileWatcher forFile(Path file, int debounceMs, Runnable callback) {
        Path absolute = file.toAbsolutePath();
        Path name = absolute.getFileName();
        return new FileWatcher(absolute.getParent(), name::equals, debounceMs, callback);
    }

    /**
     * Starts watching on a daemon thread.
     *
     * @throws IOException if the watch service cannot be created or the
     *                     directory cannot be registered
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            LOG.warn("FileWatcher already running: dir={}", watchDir);
            return;
        }

        watchService = FileSystems.getDefault().newWatchService();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "file-watcher-debounce");
            t.setDaemon(true);
            return t;
        });

        watchDir.register(
                watchService,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY,
                StandardWatchEventKinds.ENTRY_DELETE);

        watchThread = new Thread(this::pollLoop, "file-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
        LOG.info("FileWatcher started: dir={}, debounceMs={}", watchDir, debounceMs);
    }

    /** Stops watching and releases all resources. */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        try {
            if (watchService != null) {
                watchService.close();
            }
        } catch (IOException e) {
            LOG.warn("Error closing WatchService: dir={}", watchDir, e);
        }

        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (watchThread != null) {
            watchThread.interrupt();
        }
        LOG.info("FileWatcher stopped: dir={}", watchDir);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void pollLoop() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }

            boolean relevant = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                WatchEvent.Kind<?> kind = event.kind();
                if (kind == StandardWatchEventKinds.OVERFLOW) {
                    // events were lost, assume the watched file changed
                    relevant = true;
                    continue;
                }
                Path changed = (Path) event.context();
                if (fileFilter.test(changed)) {
                    LOG.debug("File change detected: file={}, kind={}", changed, kind.name());
                    relevant = true;
                }
            }

            if (!key.reset()) {
                LOG.warn("Watch key no longer valid, directory deleted? dir={}", watchDir);
            }
            if (relevant) {
                scheduleCallback();
            }
        }
    }

    private synchronized void scheduleCallback() {
        if (pending != null && !pending.isDone()) {
            pending.cancel(false);
        }
        pending = scheduler.schedule(
                () -> {
                    try {
                        callback.run();
                    } catch (RuntimeException e) {
                        LOG.error("FileWatcher callback failed: dir={}", watchDir, e);
                    }
                },
                debounceMs,
                TimeUnit.MILLISECONDS);
    }
}
