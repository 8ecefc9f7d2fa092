package com.flightroutes.streams.enrichment;

/**
 * Whether a route stays within one country.
 */
public enum RouteType {

    DOMESTIC("Domestic"),
    INTERNATIONAL("International");

    private final String label;

    RouteType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
