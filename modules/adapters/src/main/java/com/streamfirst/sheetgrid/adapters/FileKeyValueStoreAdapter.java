package com.streamfirst.sheetgrid.adapters;

import com.streamfirst.sheetgrid.ports.KeyValueStorePort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * KeyValueStorePort backed by one file per key in a local directory. Writes go to a temporary file
 * that is then moved over the target, so readers never see a partially written value.
 */
@Slf4j
public class FileKeyValueStoreAdapter implements KeyValueStorePort {

    private static final String SUFFIX = ".bin";

    @Getter private final Path directory;

    public FileKeyValueStoreAdapter(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path file = fileFor(key);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read key " + key + " from " + file, e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        Path file = fileFor(key);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try {
                Files.write(tmp, value);
                move(tmp, file);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Wrote key {} to {} ({} bytes)", key, file, value.length);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write key " + key + " to " + file, e);
        }
    }

    @Override
    public boolean delete(String key) {
        Path file = fileFor(key);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete key " + key + " at " + file, e);
        }
    }

    Path fileFor(String key) {
        Objects.requireNonNull(key, "Key cannot be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be blank");
        }
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
