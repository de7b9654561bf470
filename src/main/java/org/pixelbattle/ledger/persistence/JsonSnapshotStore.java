package org.pixelbattle.ledger.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores a snapshot as a JSON file. Writes go to a sibling temporary file that is then moved over
 * the target, so the file on disk is always a complete snapshot.
 */
public class JsonSnapshotStore implements ISnapshotStore {
    private static final Logger LOG = LoggerFactory.getLogger(JsonSnapshotStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonSnapshotStore(final Path file) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Optional<LedgerSnapshot> load() throws IOException {
        if (!Files.isRegularFile(file)) {
            LOG.debug("No snapshot found at {}.", file);
            return Optional.empty();
        }
        final LedgerSnapshot snapshot = objectMapper.readValue(file.toFile(), LedgerSnapshot.class);
        if (snapshot.formatVersion() != LedgerSnapshot.CURRENT_FORMAT_VERSION) {
            throw new IOException("Unsupported snapshot format version " + snapshot.formatVersion() + " in " + file);
        }
        LOG.debug("Loaded snapshot of cycle {} with {} cells from {}.",
            snapshot.cycle().cycleId(), snapshot.cells().size(), file);
        return Optional.of(snapshot);
    }

    @Override
    public void save(final LedgerSnapshot snapshot) throws IOException {
        final Path absolute = file.toAbsolutePath();
        final Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path temp = Files.createTempFile(parent, absolute.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        LOG.debug("Saved snapshot of cycle {} with {} cells to {}.",
            snapshot.cycle().cycleId(), snapshot.cells().size(), absolute);
    }
}
