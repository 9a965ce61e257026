package com.camfleet.console.store;

import com.camfleet.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * One JSON document on disk.
 * <p>
 * Writes go to a temp file in the same directory which is then moved over the target, so a
 * crash mid-write leaves either the old or the new document, never a truncated one.
 * </p>
 *
 * @param <T> document type
 */
public class JsonFileStore<T> {
    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final Path file;
    private final Class<T> type;
    private final Supplier<T> emptyDocument;

    public JsonFileStore(Path file, Class<T> type, Supplier<T> emptyDocument) {
        this.file = file;
        this.type = type;
        this.emptyDocument = emptyDocument;
    }

    /**
     * Reads the document, or returns an empty one when the file does not exist yet.
     *
     * @throws UncheckedIOException when the file exists but cannot be read or parsed
     */
    public synchronized T load() {
        try {
            byte[] bytes = Files.readAllBytes(file);
            T document = JsonUtils.readValue(bytes, type);
            log.info("Loaded {}", file);
            return document != null ? document : emptyDocument.get();
        } catch (NoSuchFileException e) {
            log.info("No {} yet, starting empty", file);
            return emptyDocument.get();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public synchronized void save(T document) {
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, JsonUtils.writePrettyString(document), StandardCharsets.UTF_8);
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Saved {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
