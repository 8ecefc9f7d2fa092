package com.flightroutes.common.serde;

import com.fasterxml.jackson.databind.JsonNode;
import com.flightroutes.common.model.BaseRouteProjection;
import com.flightroutes.common.model.BaseRouteRecord;
import com.flightroutes.common.model.EnrichedRouteRecord;
import org.apache.kafka.common.errors.SerializationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JSON serde used on the route topics.
 */
class JsonSerdeTest {

    private static final String TOPIC = "routes";

    private final JsonSerde<BaseRouteRecord> baseSerde = new JsonSerde<>(BaseRouteRecord.class);
    private final JsonSerde<EnrichedRouteRecord> enrichedSerde = new JsonSerde<>(EnrichedRouteRecord.class);

    private static BaseRouteRecord lax() {
        return BaseRouteRecord.builder()
            .originAirport("LAX").destinationAirport("SFO")
            .originCountry("US").destinationCountry("US")
            .originRegion("West").destinationRegion("West")
            .distanceKm(543.0).stops(0)
            .flightYear(2024).flightMonth(11).flightQuarter(4)
            .build();
    }

    @Test
    void testSerialize_SnakeCaseColumns() throws Exception {
        byte[] json = baseSerde.serializer().serialize(TOPIC, lax());

        JsonNode node = JsonSerde.getObjectMapper().readTree(json);
        assertEquals("LAX", node.get("origin_airport").asText());
        assertEquals(543.0, node.get("distance_km").asDouble());
        assertEquals(0, node.get("stops").asInt());
        assertTrue(node.get("airline_name").isNull());
    }

    @Test
    void testSerialize_EnrichedColumnOrder() throws Exception {
        EnrichedRouteRecord enriched = EnrichedRouteRecord.of(
            lax(), "Short-haul", "Domestic", "West to West", "Direct", "LAX-SFO");

        JsonNode node = JsonSerde.getObjectMapper().readTree(enrichedSerde.serializer().serialize(TOPIC, enriched));

        List<String> columns = new ArrayList<>();
        node.fieldNames().forEachRemaining(columns::add);

        List<String> expected = new ArrayList<>(BaseRouteProjection.COLUMNS);
        expected.addAll(List.of("distance_category", "route_type", "region_pair", "flight_type", "route_id"));
        assertEquals(expected, columns);
    }

    @Test
    void testDeserialize_ProjectsEnrichedRowOntoBaseColumns() {
        // Given an already enriched row
        EnrichedRouteRecord enriched = EnrichedRouteRecord.of(
            lax(), "Short-haul", "Domestic", "West to West", "Direct", "LAX-SFO");
        byte[] json = enrichedSerde.serializer().serialize(TOPIC, enriched);

        // When read back as a base record
        BaseRouteRecord base = baseSerde.deserializer().deserialize(TOPIC, json);

        // Then the derived columns are dropped and the base columns survive
        assertEquals(lax(), base);
        assertEquals(enriched.base(), base);
    }

    @Test
    void testDeserialize_MissingNumbersAreNull() {
        byte[] json = "{\"origin_airport\":\"LAX\",\"destination_airport\":\"SFO\"}"
            .getBytes(StandardCharsets.UTF_8);

        BaseRouteRecord base = baseSerde.deserializer().deserialize(TOPIC, json);

        assertEquals("LAX", base.originAirport());
        assertNull(base.distanceKm());
        assertNull(base.stops());
    }

    @Test
    void testNullAndEmptyPayloads() {
        assertNull(baseSerde.serializer().serialize(TOPIC, null));
        assertNull(baseSerde.deserializer().deserialize(TOPIC, null));
        assertNull(baseSerde.deserializer().deserialize(TOPIC, new byte[0]));
    }

    @Test
    void testDeserialize_MalformedJson() {
        byte[] garbage = "{not json".getBytes(StandardCharsets.UTF_8);

        assertThrows(SerializationException.class,
            () -> baseSerde.deserializer().deserialize(TOPIC, garbage));
    }
}
