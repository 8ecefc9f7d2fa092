package com.flightroutes.loader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class FileArchiverTest {

    @TempDir
    Path root;

    private final FileArchiver archiver =
        new FileArchiver(Clock.fixed(Instant.parse("2024-11-14T09:30:05Z"), ZoneOffset.UTC));

    @Test
    void testArchive_MovesWithTimestampSuffix() throws Exception {
        Path source = Files.writeString(root.resolve("routes_2024.csv"), "origin_airport\nLAX\n");
        Path processed = root.resolve("processed").resolve("nested");

        Path archived = archiver.archive(source, processed);

        assertEquals(processed.resolve("routes_2024_20241114_093005.csv"), archived);
        assertTrue(Files.exists(archived));
        assertFalse(Files.exists(source));
        assertEquals("origin_airport\nLAX\n", Files.readString(archived));
    }

    @Test
    void testArchive_FileWithoutExtension() throws Exception {
        Path source = Files.writeString(root.resolve("routes"), "x");

        Path archived = archiver.archive(source, root.resolve("processed"));

        assertEquals("routes_20241114_093005", archived.getFileName().toString());
    }

    @Test
    void testArchive_MissingSource() {
        assertThrows(IllegalStateException.class,
            () -> archiver.archive(root.resolve("absent.csv"), root.resolve("processed")));
    }
}
