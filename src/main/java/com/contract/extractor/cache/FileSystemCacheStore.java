package com.contract.extractor.cache;

import com.contract.extractor.model.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent store keeping one file per fingerprint, named by its hex form, in a single
 * directory. Writes go through a temporary file and an atomic move so readers never see a
 * partially written record.
 */
public class FileSystemCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemCacheStore.class);
    private static final String EXTENSION = ".contracts";

    private final Path directory;

    /**
     * @param directory cache directory, created if absent
     * @throws StoreException if the directory cannot be created
     */
    public FileSystemCacheStore(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreException("Could not create cache directory: " + directory, e);
        }
    }

    @Override
    public Optional<CacheRecord> read(Fingerprint key) {
        Path file = fileFor(key);
        try {
            return Optional.of(new CacheRecord(key, Files.readAllBytes(file)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreException("Failed to read cache record " + file, e);
        }
    }

    @Override
    public void write(CacheRecord record) {
        Path target = fileFor(record.getKey());
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, record.getKey().toHex(), ".tmp");
            Files.write(temp, record.getValue());
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Wrote {} bytes to {}", record.size(), target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StoreException("Failed to write cache record " + target, e);
        }
    }

    @Override
    public boolean delete(Fingerprint key) {
        try {
            return Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new StoreException("Failed to delete cache record " + fileFor(key), e);
        }
    }

    @Override
    public Set<Fingerprint> keys() {
        Set<Fingerprint> keys = new HashSet<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String hex = name.substring(0, name.length() - EXTENSION.length());
                try {
                    keys.add(Fingerprint.fromHex(hex));
                } catch (IllegalArgumentException e) {
                    logger.warn("Ignoring foreign file in cache directory: {}", file);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list cache directory " + directory, e);
        }
        return keys;
    }

    public Path getDirectory() {
        return directory;
    }

    private Path fileFor(Fingerprint key) {
        return directory.resolve(key.toHex() + EXTENSION);
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary cache file {}", temp, e);
        }
    }

    /**
     * I/O failure in the backing directory.
     */
    public static class StoreException extends CacheStoreException {
        public StoreException(String message, IOException cause) {
            super(message, cause);
        }
    }
}
