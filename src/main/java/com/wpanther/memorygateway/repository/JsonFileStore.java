package com.wpanther.memorygateway.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wpanther.memorygateway.exception.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A JSON object file mapping record keys to records.
 *
 * Every read goes to disk. Mutations run under a single-writer lock and replace
 * the whole file atomically, leaving it readable by the owner only.
 */
@Slf4j
public class JsonFileStore<V> {

    static final Set<PosixFilePermission> OWNER_ONLY_FILE = PosixFilePermissions.fromString("rw-------");
    static final Set<PosixFilePermission> OWNER_ONLY_DIR = PosixFilePermissions.fromString("rwx------");

    private final Path file;
    private final ObjectMapper objectMapper;
    private final TypeReference<LinkedHashMap<String, V>> type;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonFileStore(Path file, ObjectMapper objectMapper, TypeReference<LinkedHashMap<String, V>> type) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.type = type;
    }

    /**
     * Mapper for record files: snake_case keys, ISO-8601 timestamps.
     */
    public static ObjectMapper recordMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Map<String, V> readAll() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, V> records = objectMapper.readValue(file.toFile(), type);
            return records != null ? records : new LinkedHashMap<>();
        } catch (IOException e) {
            log.error("Unable to read record file {}", file, e);
            throw new StorageException("Unable to read " + file.getFileName(), e);
        }
    }

    /**
     * Read-modify-write cycle under the store lock. The file is rewritten only when
     * the mutation returns normally.
     */
    public <R> R update(Function<Map<String, V>, R> mutation) {
        writeLock.lock();
        try {
            Map<String, V> records = readAll();
            R result = mutation.apply(records);
            write(records);
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    private void write(Map<String, V> records) {
        try {
            ensureDirectory(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                restrict(temp, OWNER_ONLY_FILE);
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), records);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
            restrict(file, OWNER_ONLY_FILE);
        } catch (IOException e) {
            log.error("Unable to write record file {}", file, e);
            throw new StorageException("Unable to write " + file.getFileName(), e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static void ensureDirectory(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            Files.createDirectories(directory);
        }
        restrict(directory, OWNER_ONLY_DIR);
    }

    static void restrict(Path path, Set<PosixFilePermission> permissions) throws IOException {
        try {
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", path);
        }
    }
}
