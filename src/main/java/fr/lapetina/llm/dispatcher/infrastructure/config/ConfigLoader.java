package fr.lapetina.llm.dispatcher.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the dispatcher YAML, layers the environment on top and validates the result.
 *
 * A path that does not exist on disk is looked up on the classpath. Only a file on disk
 * can be watched: the watcher reloads it when it is rewritten or replaced, and an invalid
 * new version leaves the current configuration in place.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;
    private final AtomicReference<DispatcherConfig> current = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();

    private volatile FileTime loadedVersion;
    private WatchService watchService;
    private Thread watcher;

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = Map.copyOf(environment);
        this.yaml = new Yaml(new Constructor(DispatcherConfig.class, new LoaderOptions()));
    }

    /**
     * Loads the configuration and makes it current.
     *
     * @throws ConfigurationException if the source is missing, unreadable or invalid
     */
    public DispatcherConfig load() {
        try (InputStream source = openSource()) {
            return publish(parse(source));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration: " + configPath, e);
        }
    }

    /**
     * Loads the configuration from {@code inputStream} and makes it current.
     */
    public DispatcherConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream));
    }

    /**
     * Loads the configuration again. A failure is logged and the current one is kept.
     */
    public DispatcherConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Reload rejected, keeping current configuration: path={}, reason={}",
                    configPath, e.getMessage());
            return current.get();
        }
    }

    public DispatcherConfig getCurrentConfig() {
        return current.get();
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts the file watcher. Does nothing for a classpath configuration.
     */
    public synchronized void startWatching() {
        if (watcher != null) {
            return;
        }
        if (!Files.isRegularFile(configPath)) {
            log.warn("Hot reload disabled, not a file on disk: path={}", configPath);
            return;
        }

        Path directory = configPath.toAbsolutePath().getParent();
        try {
            watchService = FileSystems.getDefault().newWatchService();
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            log.error("Hot reload disabled, cannot watch directory: directory={}", directory, e);
            closeWatchService();
            return;
        }

        watcher = new Thread(this::watch, "config-watcher");
        watcher.setDaemon(true);
        watcher.start();
        log.info("Hot reload enabled: path={}", configPath);
    }

    public synchronized boolean isWatching() {
        return watcher != null && watcher.isAlive();
    }

    @Override
    public synchronized void close() {
        if (watcher != null) {
            watcher.interrupt();
            watcher = null;
        }
        closeWatchService();
    }

    private void watch() {
        Path fileName = configPath.getFileName();
        while (!Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            boolean touched = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                touched |= fileName.equals(event.context());
            }
            key.reset();

            if (touched && changedSinceLoad()) {
                log.info("Configuration file changed, reloading: path={}", configPath);
                reload();
            }
        }
    }

    // Editors often emit several events per save
    private boolean changedSinceLoad() {
        try {
            return !Files.getLastModifiedTime(configPath).equals(loadedVersion);
        } catch (IOException e) {
            log.warn("Cannot stat configuration file, skipping reload: path={}, reason={}",
                    configPath, e.getMessage());
            return false;
        }
    }

    private InputStream openSource() throws IOException {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: path={}", configPath);
            loadedVersion = Files.getLastModifiedTime(configPath);
            return Files.newInputStream(configPath);
        }

        String resource = configPath.toString().replace('\\', '/');
        if (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        InputStream stream = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new ConfigurationException("Configuration not found on disk or classpath: " + configPath);
        }
        log.info("Loading configuration from classpath: resource={}", resource);
        return stream;
    }

    private DispatcherConfig parse(InputStream inputStream) {
        DispatcherConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration YAML: " + e.getMessage(), e);
        }
        if (config == null) {
            config = new DispatcherConfig();
        }
        EnvironmentOverrides.apply(config, environment);
        return config.validate();
    }

    private DispatcherConfig publish(DispatcherConfig config) {
        DispatcherConfig previous = current.getAndSet(config);
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, config);
            } catch (RuntimeException e) {
                log.error("Config listener failed: listener={}", listener.getClass().getName(), e);
            }
        }
        return config;
    }

    private void closeWatchService() {
        if (watchService == null) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Error closing watch service: path={}", configPath, e);
        }
        watchService = null;
    }

    /**
     * Unreadable, malformed or invalid configuration.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
