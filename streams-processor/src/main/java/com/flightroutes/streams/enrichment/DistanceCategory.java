package com.flightroutes.streams.enrichment;

/**
 * Flight length band ("haul") of a route.
 */
public enum DistanceCategory {

    SHORT_HAUL("Short-haul"),
    MEDIUM_HAUL("Medium-haul"),
    LONG_HAUL("Long-haul"),
    UNKNOWN("Unknown");

    private final String label;

    DistanceCategory(String label) {
        this.label = label;
    }

    /**
     * Column value written to enriched records.
     */
    public String label() {
        return label;
    }
}
