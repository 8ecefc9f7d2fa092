package com.flightroutes.streams;

import com.flightroutes.common.KafkaConfig;
import com.flightroutes.streams.enrichment.DistanceThresholds;
import com.flightroutes.streams.enrichment.RouteEnricher;
import org.apache.kafka.streams.KafkaStreams;
import org.apache.kafka.streams.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Main application for the route enrichment Kafka Streams processor.
 */
public class RouteEnrichmentApplication {

    private static final Logger LOG = LoggerFactory.getLogger(RouteEnrichmentApplication.class);
    private static final String APPLICATION_ID = "flight-routes-enrichment";

    public static void main(String[] args) {
        LOG.info("=".repeat(60));
        LOG.info("Flight Routes - Route Enrichment Processor");
        LOG.info("=".repeat(60));

        DistanceThresholds thresholds;
        Properties props;
        try {
            thresholds = DistanceThresholds.fromEnvironment();
            props = KafkaConfig.createStreamsConfig(APPLICATION_ID);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        Topology topology = RouteEnrichmentTopology.build(new RouteEnricher(thresholds));

        LOG.info("Streams configuration:");
        LOG.info("  Application ID: {}", APPLICATION_ID);
        LOG.info("  Bootstrap Servers: {}", KafkaConfig.getBootstrapServers());
        LOG.info("  Source topic: {}", KafkaConfig.getStagedRoutesTopic());
        LOG.info("  Sink topic: {}", KafkaConfig.getEnrichedRoutesTopic());
        LOG.info("  Medium-haul from: {} km, long-haul from: {} km",
            thresholds.mediumHaulFromKm(), thresholds.longHaulFromKm());

        final KafkaStreams streams = new KafkaStreams(topology, props);
        final CountDownLatch latch = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread("streams-shutdown-hook") {
            @Override
            public void run() {
                LOG.info("Shutting down route enrichment processor");
                streams.close();
                latch.countDown();
                LOG.info("Route enrichment processor shutdown complete");
            }
        });

        try {
            LOG.info("Starting Kafka Streams...");
            streams.start();
            LOG.info("Kafka Streams started, state: {}", streams.state());

            latch.await();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Application interrupted");
        } catch (Exception e) {
            LOG.error("Unexpected error", e);
            System.exit(1);
        }

        System.exit(0);
    }
}
