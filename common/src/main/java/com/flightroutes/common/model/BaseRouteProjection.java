package com.flightroutes.common.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Selects the base route columns out of a staged row.
 * Columns outside the base set are dropped, including any previously derived columns.
 * Blank or unparseable numeric values are treated as unknown.
 */
public final class BaseRouteProjection {

    private static final Logger LOG = LoggerFactory.getLogger(BaseRouteProjection.class);

    public static final String ORIGIN_AIRPORT = "origin_airport";
    public static final String DESTINATION_AIRPORT = "destination_airport";
    public static final String ORIGIN_COUNTRY = "origin_country";
    public static final String DESTINATION_COUNTRY = "destination_country";
    public static final String ORIGIN_REGION = "origin_region";
    public static final String DESTINATION_REGION = "destination_region";
    public static final String DISTANCE_KM = "distance_km";
    public static final String STOPS = "stops";
    public static final String AIRCRAFT_TYPE = "aircraft_type";
    public static final String CODESHARE = "codeshare";
    public static final String FLIGHT_NUMBER = "flight_number";
    public static final String AIRLINE_CODE = "airline_code";
    public static final String AIRLINE_NAME = "airline_name";
    public static final String FLIGHT_DATE = "flight_date";
    public static final String FLIGHT_YEAR = "flight_year";
    public static final String FLIGHT_MONTH = "flight_month";
    public static final String FLIGHT_QUARTER = "flight_quarter";

    /**
     * Base columns in staged order.
     */
    public static final List<String> COLUMNS = List.of(
        ORIGIN_AIRPORT, DESTINATION_AIRPORT, ORIGIN_COUNTRY, DESTINATION_COUNTRY,
        ORIGIN_REGION, DESTINATION_REGION, DISTANCE_KM, STOPS, AIRCRAFT_TYPE,
        CODESHARE, FLIGHT_NUMBER, AIRLINE_CODE, AIRLINE_NAME, FLIGHT_DATE,
        FLIGHT_YEAR, FLIGHT_MONTH, FLIGHT_QUARTER
    );

    private BaseRouteProjection() {
    }

    /**
     * Project a staged row onto the base route columns.
     *
     * @param row column name to value; values may be strings or numbers
     * @return the projected record
     */
    public static BaseRouteRecord project(Map<String, ?> row) {
        return BaseRouteRecord.builder()
            .originAirport(text(row, ORIGIN_AIRPORT))
            .destinationAirport(text(row, DESTINATION_AIRPORT))
            .originCountry(text(row, ORIGIN_COUNTRY))
            .destinationCountry(text(row, DESTINATION_COUNTRY))
            .originRegion(text(row, ORIGIN_REGION))
            .destinationRegion(text(row, DESTINATION_REGION))
            .distanceKm(decimal(row, DISTANCE_KM))
            .stops(integer(row, STOPS))
            .aircraftType(text(row, AIRCRAFT_TYPE))
            .codeshare(text(row, CODESHARE))
            .flightNumber(text(row, FLIGHT_NUMBER))
            .airlineCode(text(row, AIRLINE_CODE))
            .airlineName(text(row, AIRLINE_NAME))
            .flightDate(text(row, FLIGHT_DATE))
            .flightYear(integer(row, FLIGHT_YEAR))
            .flightMonth(integer(row, FLIGHT_MONTH))
            .flightQuarter(integer(row, FLIGHT_QUARTER))
            .build();
    }

    private static String text(Map<String, ?> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    private static Double decimal(Map<String, ?> row, String column) {
        Object value = row.get(column);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String raw = blankToNull(value);
        if (raw == null) {
            return null;
        }
        Double parsed = parseDouble(raw);
        if (parsed == null) {
            LOG.warn("Treating unparseable {} '{}' as unknown", column, raw);
        }
        return parsed;
    }

    private static Integer integer(Map<String, ?> row, String column) {
        Object value = row.get(column);
        if (value instanceof Number number) {
            double numeric = number.doubleValue();
            if (numeric == Math.rint(numeric)) {
                return number.intValue();
            }
            LOG.warn("Treating non-integral {} '{}' as unknown", column, number);
            return null;
        }
        String raw = blankToNull(value);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.valueOf(raw);
        } catch (NumberFormatException e) {
            // Staging tools often write integral columns as "1.0"
            Double parsed = parseDouble(raw);
            if (parsed != null && parsed == Math.rint(parsed)) {
                return parsed.intValue();
            }
            LOG.warn("Treating unparseable {} '{}' as unknown", column, raw);
            return null;
        }
    }

    private static Double parseDouble(String raw) {
        try {
            return Double.valueOf(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(Object value) {
        if (value == null) {
            return null;
        }
        String raw = value.toString().trim();
        return raw.isEmpty() ? null : raw;
    }
}
