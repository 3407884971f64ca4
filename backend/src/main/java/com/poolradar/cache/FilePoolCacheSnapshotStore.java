package com.poolradar.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON snapshot in {@code {directory}/{storageKey}.json}. Writes go to a temp file first and are moved into place.
 */
@Slf4j
public class FilePoolCacheSnapshotStore implements PoolCacheSnapshotStore {

    private final Path file;
    private final ObjectMapper objectMapper;

    public FilePoolCacheSnapshotStore(Path directory, String storageKey, ObjectMapper objectMapper) {
        if (storageKey == null || storageKey.isBlank()) {
            throw new IllegalArgumentException("storageKey is required");
        }
        this.file = directory.resolve(storageKey + ".json");
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<PoolCacheSnapshot> load() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), PoolCacheSnapshot.class));
    }

    @Override
    public void save(PoolCacheSnapshot snapshot) throws IOException {
        Files.createDirectories(file.getParent());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(tmp.toFile(), snapshot);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Saved pool cache snapshot ({} entries) to {}", snapshot.cache().size(), file);
    }

    public Path getFile() {
        return file;
    }
}
