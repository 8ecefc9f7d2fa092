package com.flightroutes.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A base route record with its five derived analytics columns appended.
 * Column order: all base fields in staged order, then distance_category,
 * route_type, region_pair, flight_type, route_id.
 */
@JsonPropertyOrder({
    "origin_airport", "destination_airport", "origin_country", "destination_country",
    "origin_region", "destination_region", "distance_km", "stops", "aircraft_type",
    "codeshare", "flight_number", "airline_code", "airline_name", "flight_date",
    "flight_year", "flight_month", "flight_quarter",
    "distance_category", "route_type", "region_pair", "flight_type", "route_id"
})
public record EnrichedRouteRecord(
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
    @JsonProperty("flight_quarter") Integer flightQuarter,
    @JsonProperty("distance_category") String distanceCategory,
    @JsonProperty("route_type") String routeType,
    @JsonProperty("region_pair") String regionPair,
    @JsonProperty("flight_type") String flightType,
    @JsonProperty("route_id") String routeId
) {

    /**
     * Append derived columns to a base record.
     */
    public static EnrichedRouteRecord of(BaseRouteRecord base,
                                         String distanceCategory,
                                         String routeType,
                                         String regionPair,
                                         String flightType,
                                         String routeId) {
        return new EnrichedRouteRecord(
            base.originAirport(),
            base.destinationAirport(),
            base.originCountry(),
            base.destinationCountry(),
            base.originRegion(),
            base.destinationRegion(),
            base.distanceKm(),
            base.stops(),
            base.aircraftType(),
            base.codeshare(),
            base.flightNumber(),
            base.airlineCode(),
            base.airlineName(),
            base.flightDate(),
            base.flightYear(),
            base.flightMonth(),
            base.flightQuarter(),
            distanceCategory,
            routeType,
            regionPair,
            flightType,
            routeId
        );
    }

    /**
     * The base columns of this record, without the derived ones.
     */
    @JsonIgnore
    public BaseRouteRecord base() {
        return new BaseRouteRecord(
            originAirport, destinationAirport, originCountry, destinationCountry,
            originRegion, destinationRegion, distanceKm, stops, aircraftType,
            codeshare, flightNumber, airlineCode, airlineName, flightDate,
            flightYear, flightMonth, flightQuarter
        );
    }
}
