package com.flightroutes.loader;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * File locations used by the route loader.
 *
 * @param incomingDir  directory scanned for new route files
 * @param processedDir directory that receives published files
 * @param filePattern  glob matched against file names in {@code incomingDir}
 */
public record LoaderSettings(Path incomingDir, Path processedDir, String filePattern) {

    public static final String DEFAULT_FILE_PATTERN = "routes_*.csv";

    public static LoaderSettings fromEnvironment() {
        return new LoaderSettings(
            Paths.get(System.getenv().getOrDefault("INCOMING_DATA_DIR", "data/incoming")),
            Paths.get(System.getenv().getOrDefault("PROCESSED_DATA_DIR", "data/processed")),
            System.getenv().getOrDefault("CSV_FILE_PATTERN", DEFAULT_FILE_PATTERN)
        );
    }
}
