package com.flightroutes.streams;

import com.flightroutes.common.KafkaConfig;
import com.flightroutes.common.model.BaseRouteRecord;
import com.flightroutes.common.model.EnrichedRouteRecord;
import com.flightroutes.common.serde.JsonSerde;
import com.flightroutes.streams.enrichment.RouteEnricher;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.streams.StreamsBuilder;
import org.apache.kafka.streams.Topology;
import org.apache.kafka.streams.kstream.Consumed;
import org.apache.kafka.streams.kstream.KStream;
import org.apache.kafka.streams.kstream.Named;
import org.apache.kafka.streams.kstream.Produced;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka Streams topology enriching staged flight routes.
 *
 * <pre>
 *   [flights.staged] --mapValues(RouteEnricher::enrich)--> [routes.enriched]
 * </pre>
 *
 * Stateless: no state stores, no repartitioning, keys pass through unchanged.
 */
public class RouteEnrichmentTopology {

    private static final Logger LOG = LoggerFactory.getLogger(RouteEnrichmentTopology.class);

    public static final String ENRICH_PROCESSOR_NAME = "enrich-routes";

    /**
     * Build the topology with the configured topic names.
     */
    public static Topology build(RouteEnricher enricher) {
        return build(enricher, KafkaConfig.getStagedRoutesTopic(), KafkaConfig.getEnrichedRoutesTopic());
    }

    /**
     * Build the topology.
     *
     * @param enricher    enrichment applied to every record
     * @param sourceTopic topic carrying base route records
     * @param sinkTopic   topic receiving enriched route records
     * @return Configured topology
     */
    public static Topology build(RouteEnricher enricher, String sourceTopic, String sinkTopic) {
        LOG.info("Building route enrichment topology: {} -> {}", sourceTopic, sinkTopic);

        StreamsBuilder builder = new StreamsBuilder();

        JsonSerde<BaseRouteRecord> baseRouteSerde = new JsonSerde<>(BaseRouteRecord.class);
        JsonSerde<EnrichedRouteRecord> enrichedRouteSerde = new JsonSerde<>(EnrichedRouteRecord.class);

        KStream<String, BaseRouteRecord> baseRoutes = builder.stream(
            sourceTopic,
            Consumed.with(Serdes.String(), baseRouteSerde)
        );

        KStream<String, EnrichedRouteRecord> enrichedRoutes = baseRoutes.mapValues(
            value -> value == null ? null : enricher.enrich(value),
            Named.as(ENRICH_PROCESSOR_NAME)
        );

        enrichedRoutes.peek((key, value) -> {
            if (value != null) {
                LOG.debug("Enriched route {}: {} / {} / {}",
                    value.routeId(), value.distanceCategory(), value.routeType(), value.flightType());
            }
        });

        enrichedRoutes.to(sinkTopic, Produced.with(Serdes.String(), enrichedRouteSerde));

        Topology topology = builder.build();
        LOG.info("Topology description:\n{}", topology.describe());

        return topology;
    }
}
