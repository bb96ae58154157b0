package com.adapterhost.internal.adapters.storage;

import com.adapterhost.adapters.storage.Storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Blob storage on the local filesystem. Paths are relative to the base directory and use {@code /};
 * a path that would resolve outside the base directory is rejected.
 */
public final class LocalFileStorage implements Storage {

    private final Path baseDir;

    public LocalFileStorage(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public byte[] read(String path) {
        try {
            return Files.readAllBytes(resolve(path));
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    @Override
    public void write(String path, byte[] data) {
        Path file = resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, data != null ? data : new byte[0]);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + path, e);
        }
    }

    @Override
    public void delete(String path) {
        try {
            Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public List<String> list(String prefix) {
        if (!Files.isDirectory(baseDir)) return List.of();
        String p = prefix != null ? prefix : "";
        try (Stream<Path> files = Files.walk(baseDir)) {
            return files.filter(Files::isRegularFile)
                    .map(f -> baseDir.relativize(f).toString().replace(f.getFileSystem().getSeparator(), "/"))
                    .filter(name -> name.startsWith(p))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + baseDir, e);
        }
    }

    private Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Storage path is required");
        }
        Path resolved = baseDir.resolve(path).normalize();
        if (!resolved.startsWith(baseDir) || resolved.equals(baseDir)) {
            throw new IllegalArgumentException("Path escapes storage root: " + path);
        }
        return resolved;
    }
}
