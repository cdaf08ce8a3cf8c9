package org.socionics.ipdb.fallback;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.socionics.ipdb.backend.JsonCodec;

/**
 * The fallback store's snapshot on disk.
 *
 * <p>Writes go to a sibling temp file which is then renamed over the
 * snapshot, so a crash mid-write leaves the previous snapshot intact. A
 * snapshot that fails to parse or convert is moved aside and an empty dataset is used
 * instead.</p>
 */
public final class SnapshotFile {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotFile.class);

    private final Path file;
    private final ObjectMapper mapper;

    public SnapshotFile(Path file) {
        this.file = file.toAbsolutePath();
        this.mapper = JsonCodec.mapper();
    }

    public Path path() {
        return file;
    }

    /**
     * Load the snapshot, or an empty one if the file is missing or corrupt.
     */
    public Snapshot load() {
        if (!Files.exists(file)) {
            logger.debug("No snapshot at {}, starting empty", file);
            return Snapshot.empty();
        }
        try {
            Snapshot snapshot = mapper.readValue(file.toFile(), Snapshot.class);
            return snapshot == null ? Snapshot.empty() : snapshot;
        } catch (JsonProcessingException | RuntimeException e) {
            discard(e.getMessage());
            return Snapshot.empty();
        } catch (IOException e) {
            logger.warn("Snapshot {} could not be read ({}); starting with an empty dataset", file, e.getMessage());
            return Snapshot.empty();
        }
    }

    /**
     * Replace the snapshot atomically.
     */
    public void write(Snapshot snapshot) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), snapshot);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Move a corrupt snapshot aside so the store can start empty. Also used
     * when the file parses but its rows do not convert.
     */
    void discard(String reason) {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        logger.warn("Snapshot {} is corrupt ({}); starting with an empty dataset, old file kept as {}",
                file, reason, aside.getFileName());
        if (!Files.exists(file)) {
            return;
        }
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.warn("Could not move corrupt snapshot aside: {}", e.getMessage());
        }
    }
}
