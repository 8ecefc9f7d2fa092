package com.flightroutes.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One staged origin-destination flight occurrence, as selected by the base routes projection.
 * Any field may be null when the staged dataset does not know the value.
 */
@JsonPropertyOrder({
    "origin_airport", "destination_airport", "origin_country", "destination_country",
    "origin_region", "destination_region", "distance_km", "stops", "aircraft_type",
    "codeshare", "flight_number", "airline_code", "airline_name", "flight_date",
    "flight_year", "flight_month", "flight_quarter"
})
public record BaseRouteRecord(
    @JsonProperty("origin_airport") String originAirport,
    @JsonProperty("destination_airport") String destinationAirport,
    @JsonProperty("origin_country") String originCountry,
    @JsonProperty("destination_country") String destinationCountry,
    @JsonProperty("origin_region") String originRegion,
    @JsonProperty("destination_region") String destinationRegion,
    @JsonProperty("distance_km") Double distanceKm,
    @JsonProperty("stops") Integer stops,
    @JsonProperty("aircraft_type") String aircraftType,
    @JsonProperty("codeshare") String codeshare,
    @JsonProperty("flight_number") String flightNumber,
    @JsonProperty("airline_code") String airlineCode,
    @JsonProperty("airline_name") String airlineName,
    @JsonProperty("flight_date") String flightDate,
    @JsonProperty("flight_year") Integer flightYear,
    @JsonProperty("flight_month") Integer flightMonth,
    @JsonProperty("flight_quarter") Integer flightQuarter
) {

    /**
     * Builder for records assembled field by field (CSV rows, tests).
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String originAirport;
        private String destinationAirport;
        private String originCountry;
        private String destinationCountry;
        private String originRegion;
        private String destinationRegion;
        private Double distanceKm;
        private Integer stops;
        private String aircraftType;
        private String codeshare;
        private String flightNumber;
        private String airlineCode;
        private String airlineName;
        private String flightDate;
        private Integer flightYear;
        private Integer flightMonth;
        private Integer flightQuarter;

        private Builder() {
        }

        public Builder originAirport(String originAirport) { this.originAirport = originAirport; return this; }
        public Builder destinationAirport(String destinationAirport) { this.destinationAirport = destinationAirport; return this; }
        public Builder originCountry(String originCountry) { this.originCountry = originCountry; return this; }
        public Builder destinationCountry(String destinationCountry) { this.destinationCountry = destinationCountry; return this; }
        public Builder originRegion(String originRegion) { this.originRegion = originRegion; return this; }
        public Builder destinationRegion(String destinationRegion) { this.destinationRegion = destinationRegion; return this; }
        public Builder distanceKm(Double distanceKm) { this.distanceKm = distanceKm; return this; }
        public Builder stops(Integer stops) { this.stops = stops; return this; }
        public Builder aircraftType(String aircraftType) { this.aircraftType = aircraftType; return this; }
        public Builder codeshare(String codeshare) { this.codeshare = codeshare; return this; }
        public Builder flightNumber(String flightNumber) { this.flightNumber = flightNumber; return this; }
        public Builder airlineCode(String airlineCode) { this.airlineCode = airlineCode; return this; }
        public Builder airlineName(String airlineName) { this.airlineName = airlineName; return this; }
        public Builder flightDate(String flightDate) { this.flightDate = flightDate; return this; }
        public Builder flightYear(Integer flightYear) { this.flightYear = flightYear; return this; }
        public Builder flightMonth(Integer flightMonth) { this.flightMonth = flightMonth; return this; }
        public Builder flightQuarter(Integer flightQuarter) { this.flightQuarter = flightQuarter; return this; }

        public BaseRouteRecord build() {
            return new BaseRouteRecord(
                originAirport, destinationAirport, originCountry, destinationCountry,
                originRegion, destinationRegion, distanceKm, stops, aircraftType,
                codeshare, flightNumber, airlineCode, airlineName, flightDate,
                flightYear, flightMonth, flightQuarter
            );
        }
    }
}
