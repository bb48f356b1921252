import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Owns the on-disk configuration file. Keeps the raw configuration tree so runtime toggles
 * can be written back without losing fields the proxy does not interpret. Every write is
 * atomic (temp file then rename) and preceded by a timestamped backup.
 */
public class ConfigurationManager {

    private static final DateTimeFormatter BACKUP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path configPath;
    private final ObjectMapper mapper;
    private final ObjectNode configTree;
    private final RuntimeConfig runtimeConfig;

    ConfigurationManager(Path configPath, ObjectNode configTree, RuntimeConfig runtimeConfig) {
        this.configPath = configPath;
        this.mapper = ConfigLoader.mapperFor(configPath);
        this.configTree = configTree;
        this.runtimeConfig = runtimeConfig;
    }

    /**
     * Loads and compiles the configuration file.
     *
     * @param path path to the TOML or JSON configuration file
     * @return the manager, or null if the file is missing or invalid (the reason is logged)
     */
    public static ConfigurationManager load(String path) {
        Path configPath = Path.of(path);
        try {
            if (!Files.exists(configPath)) {
                Logger.error("Configuration file not found: " + path);
                return null;
            }
            ObjectNode tree = ConfigLoader.readTree(configPath);
            RuntimeConfig compiled = ConfigLoader.compile(tree);
            Logger.info("Configuration loaded successfully from " + path);
            return new ConfigurationManager(configPath, tree, compiled);
        } catch (IOException e) {
            Logger.error("Failed to read configuration: " + path, e);
            return null;
        } catch (Exception e) {
            Logger.error("Invalid configuration", e);
            return null;
        }
    }

    /**
     * Returns the configuration compiled at load time. Runtime enable/disable state is
     * tracked by the {@link CircuitBreaker}, not here.
     */
    public RuntimeConfig getRuntimeConfig() {
        return runtimeConfig;
    }

    /**
     * Enables a backend by name and persists the change.
     *
     * @throws IllegalArgumentException if the backend does not exist or is already enabled
     * @throws IOException if the change could not be persisted (the change is reverted)
     */
    public synchronized void enableBackend(String name) throws IOException {
        setEnabled(name, true);
    }

    /**
     * Disables a backend by name and persists the change.
     *
     * @throws IllegalArgumentException if the backend does not exist or is already disabled
     * @throws IOException if the change could not be persisted (the change is reverted)
     */
    public synchronized void disableBackend(String name) throws IOException {
        setEnabled(name, false);
    }

    /**
     * Returns whether the named backend is enabled in the persisted configuration.
     *
     * @throws IllegalArgumentException if the backend does not exist
     */
    public synchronized boolean isBackendEnabled(String name) {
        return enabledFlag(findBackend(name));
    }

    private void setEnabled(String name, boolean enabled) throws IOException {
        ObjectNode backend = findBackend(name);
        boolean previous = enabledFlag(backend);
        if (previous == enabled) {
            throw new IllegalArgumentException("backend '" + name + "' is already " + (enabled ? "enabled" : "disabled"));
        }

        backend.put("enabled", enabled);
        try {
            persistConfig();
        } catch (IOException e) {
            backend.put("enabled", previous);
            throw new IOException("failed to persist config: " + e.getMessage(), e);
        }
        Logger.info("[config] " + name + " - " + (enabled ? "enabled" : "disabled") + " and persisted to " + configPath);
    }

    private ObjectNode findBackend(String name) {
        for (JsonNode backend : configTree.path("backends")) {
            if (backend.isObject() && name.equals(backend.path("name").asText(null))) {
                return (ObjectNode) backend;
            }
        }
        throw new IllegalArgumentException("backend '" + name + "' not found");
    }

    private static boolean enabledFlag(JsonNode backend) {
        JsonNode n = backend.get("enabled");
        return n == null || n.isNull() || n.asBoolean();
    }

    /**
     * Atomically writes the configuration tree to disk after creating a backup.
     */
    private void persistConfig() throws IOException {
        createBackup();

        String content = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(configTree);
        Path tempPath = configPath.resolveSibling(configPath.getFileName() + ".tmp");
        Files.writeString(tempPath, content, StandardCharsets.UTF_8);

        try {
            try {
                Files.move(tempPath, configPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempPath, configPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempPath);
            throw e;
        }
    }

    /**
     * Copies the current file to a timestamped backup and prunes old backups.
     */
    private void createBackup() throws IOException {
        if (!Files.exists(configPath)) {
            return;
        }

        Path backupDir = backupDirectory();
        Files.createDirectories(backupDir);

        String fileName = configPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String extension = dot >= 0 ? fileName.substring(dot) : "";
        String stem = dot >= 0 ? fileName.substring(0, dot) : fileName;
        Path backupPath = backupDir.resolve(stem + "." + LocalDateTime.now().format(BACKUP_TIMESTAMP) + extension);

        Files.copy(configPath, backupPath, StandardCopyOption.REPLACE_EXISTING);

        try {
            cleanupOldBackups(backupDir, stem + ".", extension);
        } catch (IOException e) {
            Logger.warning("Failed to clean up old config backups", e);
        }
    }

    Path backupDirectory() {
        Path parent = configPath.toAbsolutePath().getParent();
        return parent.resolve(Constants.BACKUP_DIRECTORY);
    }

    private static void cleanupOldBackups(Path backupDir, String prefix, String extension) throws IOException {
        List<Path> backups;
        try (Stream<Path> files = Files.list(backupDir)) {
            backups = files
                .filter(Files::isRegularFile)
                .filter(p -> {
                    String n = p.getFileName().toString();
                    return n.startsWith(prefix) && n.endsWith(extension);
                })
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()))
                .toList();
        }

        for (int i = 0; i < backups.size() - Constants.MAX_CONFIG_BACKUPS; i++) {
            Files.delete(backups.get(i));
        }
    }
}
