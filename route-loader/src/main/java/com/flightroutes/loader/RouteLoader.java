package com.flightroutes.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One load run: pick up the newest incoming route file, publish its rows,
 * then archive it. A file is only archived once every row was acknowledged.
 */
public class RouteLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RouteLoader.class);

    private final LoaderSettings settings;
    private final IncomingFileScanner scanner;
    private final RouteCsvReader reader;
    private final RoutePublisher publisher;
    private final FileArchiver archiver;

    public RouteLoader(LoaderSettings settings,
                       IncomingFileScanner scanner,
                       RouteCsvReader reader,
                       RoutePublisher publisher,
                       FileArchiver archiver) {
        this.settings = settings;
        this.scanner = scanner;
        this.reader = reader;
        this.publisher = publisher;
        this.archiver = archiver;
    }

    /**
     * Outcome of a run.
     *
     * @param source       the file that was loaded
     * @param rowsRead     rows read from the file
     * @param rowsSent     rows acknowledged by Kafka
     * @param archivedFile where the file was moved to
     */
    public record LoadResult(Path source, long rowsRead, long rowsSent, Path archivedFile) {
    }

    /**
     * @return the result, or empty when no file was waiting
     */
    public Optional<LoadResult> run() {
        Optional<Path> candidate = scanner.findLatest(settings.incomingDir(), settings.filePattern());
        if (candidate.isEmpty()) {
            LOG.info("No files matching '{}' found in {}", settings.filePattern(), settings.incomingDir());
            return Optional.empty();
        }

        Path file = candidate.get();
        long size = scanner.requireNonEmpty(file);
        LOG.info("Found route file: {} ({} bytes)", file, size);

        long rowsRead = reader.read(file, publisher::publish);
        long rowsSent = publisher.flush();
        LOG.info("Published {} of {} rows from {}", rowsSent, rowsRead, file.getFileName());

        Path archived = archiver.archive(file, settings.processedDir());
        LOG.info("Moved file to: {}", archived);

        return Optional.of(new LoadResult(file, rowsRead, rowsSent, archived));
    }
}
