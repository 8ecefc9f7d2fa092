package com.flightroutes.loader;

import com.flightroutes.common.model.BaseRouteRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteCsvReaderTest {

    private static final String HEADER = "origin_airport,destination_airport,origin_country,destination_country,"
        + "origin_region,destination_region,distance_km,stops,aircraft_type,codeshare,flight_number,"
        + "airline_code,airline_name,flight_date,flight_year,flight_month,flight_quarter,loaded_by\n";

    @TempDir
    Path dir;

    private final RouteCsvReader reader = new RouteCsvReader();

    @Test
    void testRead_ProjectsRows() throws Exception {
        Path csv = Files.writeString(dir.resolve("routes_1.csv"), HEADER
            + "LAX,SFO,US,US,West,West,543,0,A321,N,UA100,UA,United Airlines,2024-11-14,2024,11,4,etl\n"
            + "LAX,NRT,US,JP,West,Asia,8773.5,1,B789,Y,NH5,NH,\"All Nippon Airways, Ltd\",2024-11-14,2024,11,4,etl\n");

        List<BaseRouteRecord> rows = new ArrayList<>();
        long count = reader.read(csv, rows::add);

        assertEquals(2, count);
        assertEquals(2, rows.size());

        BaseRouteRecord first = rows.get(0);
        assertEquals("LAX", first.originAirport());
        assertEquals("SFO", first.destinationAirport());
        assertEquals(543.0, first.distanceKm());
        assertEquals(0, first.stops());
        assertEquals("United Airlines", first.airlineName());
        assertEquals(4, first.flightQuarter());

        BaseRouteRecord second = rows.get(1);
        assertEquals("All Nippon Airways, Ltd", second.airlineName());
        assertEquals(8773.5, second.distanceKm());
    }

    @Test
    void testRead_EmptyNumericCellsAreUnknown() throws Exception {
        Path csv = Files.writeString(dir.resolve("routes_2.csv"), HEADER
            + "CDG,FCO,FR,IT,Europe,Europe,,,A320,N,AF1404,AF,Air France,2024-11-14,2024,11,4,etl\n");

        List<BaseRouteRecord> rows = new ArrayList<>();
        reader.read(csv, rows::add);

        assertNull(rows.get(0).distanceKm());
        assertNull(rows.get(0).stops());
    }

    @Test
    void testRead_LeadingByteOrderMark() throws Exception {
        Path csv = Files.writeString(dir.resolve("routes_bom.csv"), "\uFEFF" + HEADER
            + "LAX,SFO,US,US,West,West,800,0,A321,N,UA100,UA,United Airlines,2024-11-14,2024,11,4,etl\n");

        List<BaseRouteRecord> rows = new ArrayList<>();
        reader.read(csv, rows::add);

        assertEquals("LAX", rows.get(0).originAirport());
        assertEquals("SFO", rows.get(0).destinationAirport());
    }

    @Test
    void testRead_HeaderOnly() throws Exception {
        Path csv = Files.writeString(dir.resolve("routes_3.csv"), HEADER);

        assertEquals(0, reader.read(csv, row -> fail("no rows expected")));
    }

    @Test
    void testRead_MissingFile() {
        assertThrows(UncheckedIOException.class, () -> reader.read(dir.resolve("absent.csv"), row -> { }));
    }
}
