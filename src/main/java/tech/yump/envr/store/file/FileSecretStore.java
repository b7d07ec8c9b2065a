package tech.yump.envr.store.file;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.envr.key.KeyGrammar;
import tech.yump.envr.key.StoreDescriptor;
import tech.yump.envr.store.SecretStore;
import tech.yump.envr.store.SecretStoreException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Secrets as {@code KEY=value} lines of a single .env file.
 *
 * <p>The file is flat and unscoped: composite keys handed to this store are reduced to their
 * export name first, so {@code envr/prod/billing/1.0.0/API_KEY} and {@code API_KEY} address the
 * same line. Every mutation rewrites the whole file, sorted by key.
 */
@Slf4j
public class FileSecretStore implements SecretStore {

    public static final String NAME = "file";
    public static final StoreDescriptor DESCRIPTOR = StoreDescriptor.PATH_STYLE;

    private final Path filePath;

    public FileSecretStore(Path filePath) {
        if (filePath == null) {
            throw new IllegalArgumentException("File path cannot be null.");
        }
        this.filePath = filePath.toAbsolutePath().normalize();
        if (Files.isDirectory(this.filePath)) {
            throw new SecretStoreException("Configured env file path is a directory: " + this.filePath);
        }
        log.debug("FileSecretStore initialized with path: {}", this.filePath);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StoreDescriptor descriptor() {
        return DESCRIPTOR;
    }

    public Path getFilePath() {
        return filePath;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(read().get(flatName(key)));
    }

    @Override
    public void set(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null for set operation.");
        }
        String name = flatName(key);
        Map<String, String> entries = read();
        entries.put(name, value);
        write(entries);
        log.info("Stored key '{}' in env file {}", name, filePath);
    }

    @Override
    public void delete(String key) {
        String name = flatName(key);
        Map<String, String> entries = read();
        if (entries.remove(name) != null) {
            write(entries);
            log.info("Deleted key '{}' from env file {}", name, filePath);
        } else {
            log.debug("No key '{}' to delete in env file {}", name, filePath);
        }
    }

    @Override
    public List<String> listKeys() {
        return new ArrayList<>(new TreeMap<>(read()).keySet());
    }

    @Override
    public void clear() {
        write(Collections.emptyMap());
        log.info("Cleared env file {}", filePath);
    }

    private String flatName(String key) {
        if (!StringUtils.hasText(key)) {
            throw new IllegalArgumentException("Key cannot be null or empty.");
        }
        return KeyGrammar.keyToExportName(key, DESCRIPTOR);
    }

    private Map<String, String> read() {
        if (!Files.isRegularFile(filePath)) {
            return new TreeMap<>();
        }
        try {
            return new TreeMap<>(EnvFile.parse(Files.readAllLines(filePath, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            log.error("Failed to read env file {}: {}", filePath, e.getMessage(), e);
            throw new SecretStoreException("Failed to read env file: " + filePath, e);
        }
    }

    private void write(Map<String, String> entries) {
        try {
            Path parent = filePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(filePath, EnvFile.format(entries), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (AccessDeniedException e) {
            log.error("Permission denied writing env file {}: {}", filePath, e.getMessage(), e);
            throw new SecretStoreException("Permission denied writing env file: " + filePath, e);
        } catch (IOException e) {
            log.error("Failed to write env file {}: {}", filePath, e.getMessage(), e);
            throw new SecretStoreException("Failed to write env file: " + filePath, e);
        }
    }
}
