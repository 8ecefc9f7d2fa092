package com.flightroutes.streams.enrichment;

/**
 * Lower bounds (in km) of the medium-haul and long-haul bands.
 * Each bound belongs to the band it opens.
 *
 * @param mediumHaulFromKm distances below this are short-haul
 * @param longHaulFromKm   distances at or above this are long-haul
 */
public record DistanceThresholds(double mediumHaulFromKm, double longHaulFromKm) {

    public static final double DEFAULT_MEDIUM_HAUL_FROM_KM = 1500;
    public static final double DEFAULT_LONG_HAUL_FROM_KM = 4000;

    public static final DistanceThresholds DEFAULT =
        new DistanceThresholds(DEFAULT_MEDIUM_HAUL_FROM_KM, DEFAULT_LONG_HAUL_FROM_KM);

    public DistanceThresholds {
        if (Double.isNaN(mediumHaulFromKm) || Double.isNaN(longHaulFromKm)) {
            throw new IllegalArgumentException("Distance thresholds must be numbers");
        }
        if (mediumHaulFromKm >= longHaulFromKm) {
            throw new IllegalArgumentException(String.format(
                "Medium-haul threshold (%s km) must be below long-haul threshold (%s km)",
                mediumHaulFromKm, longHaulFromKm));
        }
    }

    /**
     * Thresholds from SHORT_HAUL_MAX_KM / MEDIUM_HAUL_MAX_KM, falling back to the defaults.
     */
    public static DistanceThresholds fromEnvironment() {
        return fromValues(System.getenv("SHORT_HAUL_MAX_KM"), System.getenv("MEDIUM_HAUL_MAX_KM"));
    }

    static DistanceThresholds fromValues(String shortHaulMaxKm, String mediumHaulMaxKm) {
        return new DistanceThresholds(
            parseOrDefault("SHORT_HAUL_MAX_KM", shortHaulMaxKm, DEFAULT_MEDIUM_HAUL_FROM_KM),
            parseOrDefault("MEDIUM_HAUL_MAX_KM", mediumHaulMaxKm, DEFAULT_LONG_HAUL_FROM_KM));
    }

    private static double parseOrDefault(String name, String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }
}
