package com.flightroutes.loader;

import com.flightroutes.common.KafkaConfig;
import com.flightroutes.common.model.BaseRouteRecord;
import com.flightroutes.common.serde.JsonSerde;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for a single route load run.
 * Exits with status 1 when the run fails, so a scheduler can mark it failed and retry.
 */
public class LoaderMain {

    private static final Logger LOG = LoggerFactory.getLogger(LoaderMain.class);
    private static final String CLIENT_ID = "route-loader";

    public static void main(String[] args) {
        LOG.info("=".repeat(60));
        LOG.info("Flight Routes - Route Loader");
        LOG.info("=".repeat(60));

        LoaderSettings settings = LoaderSettings.fromEnvironment();
        LOG.info("Incoming directory: {}", settings.incomingDir());
        LOG.info("Processed directory: {}", settings.processedDir());
        LOG.info("File pattern: {}", settings.filePattern());
        LOG.info("Kafka: {} -> {}", KafkaConfig.getBootstrapServers(), KafkaConfig.getStagedRoutesTopic());

        KafkaProducer<String, BaseRouteRecord> producer = new KafkaProducer<>(
            KafkaConfig.createProducerConfig(CLIENT_ID),
            new StringSerializer(),
            new JsonSerde<>(BaseRouteRecord.class).serializer()
        );

        try (RoutePublisher publisher = new RoutePublisher(producer, KafkaConfig.getStagedRoutesTopic())) {
            RouteLoader loader = new RouteLoader(
                settings, new IncomingFileScanner(), new RouteCsvReader(), publisher, new FileArchiver());
            loader.run().ifPresent(result ->
                LOG.info("Load complete: {} rows from {}", result.rowsSent(), result.source().getFileName()));
        } catch (RuntimeException e) {
            LOG.error("Route load failed", e);
            System.exit(1);
        }
    }
}
