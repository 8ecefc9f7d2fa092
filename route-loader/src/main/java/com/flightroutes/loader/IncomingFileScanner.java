package com.flightroutes.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Optional;

/**
 * Finds the newest route file waiting in the incoming directory.
 */
public class IncomingFileScanner {

    private static final Logger LOG = LoggerFactory.getLogger(IncomingFileScanner.class);

    /**
     * Most recently modified regular file in {@code directory} whose name matches {@code glob}.
     *
     * @return the file, or empty when the directory is missing or holds no match
     */
    public Optional<Path> findLatest(Path directory, String glob) {
        if (!Files.isDirectory(directory)) {
            LOG.warn("Incoming directory does not exist: {}", directory);
            return Optional.empty();
        }

        Path latest = null;
        FileTime latestTime = null;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, glob)) {
            for (Path file : files) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                FileTime modified = Files.getLastModifiedTime(file);
                if (latestTime == null || modified.compareTo(latestTime) > 0) {
                    latest = file;
                    latestTime = modified;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + directory, e);
        }
        return Optional.ofNullable(latest);
    }

    /**
     * Fail when the file has no content.
     *
     * @return the file size in bytes
     */
    public long requireNonEmpty(Path file) {
        try {
            long size = Files.size(file);
            if (size == 0) {
                throw new IllegalStateException("File exists but is empty: " + file);
            }
            return size;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read size of " + file, e);
        }
    }
}
