package com.propertyintel.listing.media;

import com.propertyintel.listing.config.ListingScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores blobs as files below {@code media.storage-dir}. Writes go through a temp file and an
 * atomic move, so a reader never sees half an image.
 */
@Component
@Slf4j
public class FileSystemBlobStore implements BlobStore {

    private final Path root;

    public FileSystemBlobStore(ListingScraperProperties properties) {
        this.root = properties.getMedia().getStorageDir().toAbsolutePath().normalize();
    }

    @Override
    public String put(byte[] bytes, String name) {
        Path target = resolve(name);
        if (Files.exists(target)) {
            return target.toString();
        }
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), "blob", ".part");
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored {} bytes at {}", bytes.length, target);
            return target.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not store blob " + name, e);
        }
    }

    @Override
    public Optional<byte[]> get(String location) {
        Path path = Path.of(location).toAbsolutePath().normalize();
        if (!path.startsWith(root) || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read blob " + location, e);
        }
    }

    @Override
    public boolean exists(String name) {
        return Files.exists(resolve(name));
    }

    @Override
    public String locationOf(String name) {
        return resolve(name).toString();
    }

    private Path resolve(String name) {
        Path path = root.resolve(name).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Blob name escapes the storage directory: " + name);
        }
        return path;
    }
}
