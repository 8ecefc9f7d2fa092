package com.flightroutes.streams.enrichment;

import com.flightroutes.common.model.BaseRouteRecord;
import com.flightroutes.common.model.EnrichedRouteRecord;

import java.util.Objects;

/**
 * Derives the analytics columns of a route record.
 *
 * <p>Stateless and thread-safe: one instance can be shared by every stream thread.
 * Unknown inputs never fail enrichment; each rule falls back to a fixed label
 * ({@code Unknown}, {@code International}, {@code With Stops}) or renders the
 * missing value as an empty string.</p>
 */
public class RouteEnricher {

    private static final String REGION_SEPARATOR = " to ";
    private static final String AIRPORT_SEPARATOR = "-";

    private final DistanceThresholds thresholds;

    public RouteEnricher() {
        this(DistanceThresholds.DEFAULT);
    }

    public RouteEnricher(DistanceThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /**
     * Enrich one base route record.
     *
     * @param record the staged record
     * @return a new record carrying all base columns plus the five derived ones
     */
    public EnrichedRouteRecord enrich(BaseRouteRecord record) {
        return EnrichedRouteRecord.of(
            record,
            distanceCategory(record.distanceKm()).label(),
            routeType(record.originCountry(), record.destinationCountry()).label(),
            regionPair(record.originRegion(), record.destinationRegion()),
            flightType(record.stops()).label(),
            routeId(record.originAirport(), record.destinationAirport())
        );
    }

    public DistanceCategory distanceCategory(Double distanceKm) {
        // Unknown must be checked first: every known number falls into one of the bands
        if (distanceKm == null || distanceKm.isNaN()) {
            return DistanceCategory.UNKNOWN;
        }
        if (distanceKm < thresholds.mediumHaulFromKm()) {
            return DistanceCategory.SHORT_HAUL;
        }
        if (distanceKm < thresholds.longHaulFromKm()) {
            return DistanceCategory.MEDIUM_HAUL;
        }
        return DistanceCategory.LONG_HAUL;
    }

    public RouteType routeType(String originCountry, String destinationCountry) {
        if (originCountry != null && originCountry.equals(destinationCountry)) {
            return RouteType.DOMESTIC;
        }
        return RouteType.INTERNATIONAL;
    }

    public String regionPair(String originRegion, String destinationRegion) {
        return nullToEmpty(originRegion) + REGION_SEPARATOR + nullToEmpty(destinationRegion);
    }

    public FlightType flightType(Integer stops) {
        return stops != null && stops == 0 ? FlightType.DIRECT : FlightType.WITH_STOPS;
    }

    public String routeId(String originAirport, String destinationAirport) {
        return nullToEmpty(originAirport) + AIRPORT_SEPARATOR + nullToEmpty(destinationAirport);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
