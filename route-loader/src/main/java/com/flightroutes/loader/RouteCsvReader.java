package com.flightroutes.loader;

import com.flightroutes.common.model.BaseRouteProjection;
import com.flightroutes.common.model.BaseRouteRecord;
import com.opencsv.CSVReaderHeaderAware;
import com.opencsv.exceptions.CsvValidationException;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads staged route rows from a CSV file with a header line.
 * Each row is projected onto the base route columns; other columns are ignored.
 */
public class RouteCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(RouteCsvReader.class);

    /**
     * Stream every row of {@code file} to {@code sink}.
     *
     * @return number of rows read
     */
    public long read(Path file, Consumer<BaseRouteRecord> sink) {
        long rows = 0;
        // Spreadsheet exports often start with a UTF-8 byte-order mark that would stick to the first header
        try (Reader reader = new InputStreamReader(
                 BOMInputStream.builder().setInputStream(Files.newInputStream(file)).get(),
                 StandardCharsets.UTF_8);
             CSVReaderHeaderAware csv = new CSVReaderHeaderAware(reader)) {
            Map<String, String> row;
            while ((row = csv.readMap()) != null) {
                sink.accept(BaseRouteProjection.project(row));
                rows++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        } catch (CsvValidationException e) {
            throw new IllegalStateException("Malformed CSV in " + file + " after " + rows + " rows", e);
        }
        LOG.info("Read {} rows from {}", rows, file.getFileName());
        return rows;
    }
}
