package io.durableproxy.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.durableproxy.core.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Request id mappings kept in a single JSON file, rewritten atomically on every change.
 *
 * <p>Safe for concurrent use within one process. A file that cannot be parsed is treated as empty
 * and replaced on the next write.
 */
public final class FileRequestIdStore implements RequestIdStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileRequestIdStore.class);
    private static final TypeReference<LinkedHashMap<String, RequestMapping>> TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper = Json.mapper();
    private Map<String, RequestMapping> mappings;

    public FileRequestIdStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public synchronized Optional<RequestMapping> load(String key) {
        return Optional.ofNullable(mappings().get(key));
    }

    @Override
    public synchronized void save(String key, RequestMapping mapping) {
        mappings().put(key, mapping);
        flush();
    }

    @Override
    public synchronized void remove(String key) {
        if (mappings().remove(key) != null) flush();
    }

    private Map<String, RequestMapping> mappings() {
        if (mappings == null) mappings = read();
        return mappings;
    }

    private Map<String, RequestMapping> read() {
        if (!Files.exists(file)) return new LinkedHashMap<>();
        try {
            LinkedHashMap<String, RequestMapping> loaded = mapper.readValue(file.toFile(), TYPE);
            return loaded == null ? new LinkedHashMap<>() : loaded;
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable request id file {}: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void flush() {
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), mappings);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write request id file " + file, e);
        }
    }
}
