package com.sommerph.zkinbox.repository.nullifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sommerph.zkinbox.model.nullifier.NullifierRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * One file per used nullifier under {@code <storagePath>/epoch-<epoch>/}. Registration
 * relies on {@link StandardOpenOption#CREATE_NEW}, which the file system performs atomically.
 */
@Slf4j
public class JsonFileNullifierRegistry implements NullifierRegistry {

    private static final String EPOCH_DIR_PREFIX = "epoch-";

    private final Path storageDir;
    private final ObjectMapper mapper;

    public JsonFileNullifierRegistry(String storagePath) throws IOException {
        this.storageDir = Paths.get(storagePath);
        Files.createDirectories(storageDir);
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public boolean registerIfAbsent(NullifierRecord record) {
        Path path = filePath(record.getEpoch(), record.getNullifier());
        try {
            Files.createDirectories(path.getParent());
        } catch (IOException e) {
            log.error("Failed to create epoch directory: {}", path.getParent(), e);
            throw new UncheckedIOException("Failed to create epoch directory: " + path.getParent(), e);
        }
        try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            mapper.writeValue(out, record);
        } catch (FileAlreadyExistsException e) {
            log.info("Duplicate nullifier for epoch {}", record.getEpoch());
            return false;
        } catch (IOException e) {
            log.error("Failed to write nullifier file: {}", path, e);
            deleteQuietly(path);
            throw new UncheckedIOException("Failed to write nullifier file: " + path, e);
        }
        log.info("Register nullifier for epoch {}", record.getEpoch());
        return true;
    }

    @Override
    public boolean exists(long epoch, String nullifier) {
        return Files.exists(filePath(epoch, nullifier));
    }

    @Override
    public void release(long epoch, String nullifier) {
        log.info("Release nullifier for epoch {}", epoch);
        try {
            Files.deleteIfExists(filePath(epoch, nullifier));
        } catch (IOException e) {
            log.error("Failed to release nullifier for epoch {}", epoch, e);
            throw new UncheckedIOException("Failed to release nullifier for epoch " + epoch, e);
        }
    }

    @Override
    public int purgeBefore(long epoch) {
        int removed = 0;
        try (DirectoryStream<Path> epochDirs = Files.newDirectoryStream(storageDir, EPOCH_DIR_PREFIX + "*")) {
            for (Path dir : epochDirs) {
                Long dirEpoch = parseEpoch(dir);
                if (dirEpoch != null && dirEpoch < epoch) {
                    removed += deleteTree(dir);
                }
            }
        } catch (IOException e) {
            log.error("Failed to purge nullifiers before epoch {}", epoch, e);
            throw new UncheckedIOException("Failed to purge nullifiers before epoch " + epoch, e);
        }
        return removed;
    }

    public Path getStorageDir() {
        return storageDir;
    }

    // File IO Helpers
    private Path filePath(long epoch, String nullifier) {
        if (!nullifier.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Nullifier must be a decimal field element");
        }
        return storageDir.resolve(EPOCH_DIR_PREFIX + epoch).resolve(nullifier + ".json");
    }

    private Long parseEpoch(Path dir) {
        try {
            return Long.parseLong(dir.getFileName().toString().substring(EPOCH_DIR_PREFIX.length()));
        } catch (NumberFormatException e) {
            log.warn("Skip unexpected directory in nullifier store: {}", dir);
            return null;
        }
    }

    private int deleteTree(Path dir) throws IOException {
        int files;
        try (Stream<Path> walk = Files.walk(dir)) {
            Path[] paths = walk.sorted(Comparator.reverseOrder()).toArray(Path[]::new);
            files = 0;
            for (Path p : paths) {
                if (Files.isRegularFile(p)) {
                    files++;
                }
                Files.delete(p);
            }
        }
        return files;
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove partially written nullifier file: {}", path, e);
        }
    }

}
