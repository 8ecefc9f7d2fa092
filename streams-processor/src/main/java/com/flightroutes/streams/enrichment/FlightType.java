package com.flightroutes.streams.enrichment;

public enum FlightType {

    DIRECT("Direct"),
    WITH_STOPS("With Stops");

    private final String label;

    FlightType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
