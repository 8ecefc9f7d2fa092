package com.flightroutes.loader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Moves a published file out of the incoming directory, suffixing its name with a timestamp.
 * {@code routes_2024.csv} becomes {@code routes_2024_20241114_093000.csv}.
 */
public class FileArchiver {

    private static final DateTimeFormatter SUFFIX_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    public FileArchiver() {
        this(Clock.systemDefaultZone());
    }

    public FileArchiver(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the new location of the file
     */
    public Path archive(Path source, Path destinationDir) {
        if (!Files.exists(source)) {
            throw new IllegalStateException("Source file not found: " + source);
        }
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String name = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        String timestamp = LocalDateTime.now(clock).format(SUFFIX_FORMAT);

        try {
            Files.createDirectories(destinationDir);
            Path destination = destinationDir.resolve(name + "_" + timestamp + extension);
            return Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to move " + source + " to " + destinationDir, e);
        }
    }
}
