package com.flightroutes.common;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.common.serialization.StringSerializer;
import org.apache.kafka.streams.StreamsConfig;
import org.apache.kafka.streams.errors.LogAndContinueExceptionHandler;
import org.apache.kafka.streams.errors.LogAndContinueProcessingExceptionHandler;

import java.util.Properties;

/**
 * Centralized Kafka configuration for the route loader and the enrichment streams.
 */
public class KafkaConfig {

    private static final String BOOTSTRAP_SERVERS =
        System.getenv().getOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092");

    private static final String STAGED_ROUTES_TOPIC =
        System.getenv().getOrDefault("STAGED_ROUTES_TOPIC", "flights.staged");

    private static final String ENRICHED_ROUTES_TOPIC =
        System.getenv().getOrDefault("ENRICHED_ROUTES_TOPIC", "routes.enriched");

    private static final String STREAMS_NUM_THREADS =
        System.getenv().getOrDefault("STREAMS_NUM_THREADS", "1");

    /**
     * Create Kafka producer configuration with String keys.
     * The value serializer is passed to the producer constructor by the caller.
     *
     * @param clientId Unique client identifier
     * @return Producer properties
     */
    public static Properties createProducerConfig(String clientId) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, BOOTSTRAP_SERVERS);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        // Producer reliability settings
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, "3");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.LINGER_MS_CONFIG, "20");

        return props;
    }

    /**
     * Create Kafka Streams configuration.
     *
     * @param applicationId Streams application identifier
     * @return Streams properties
     * @throws IllegalArgumentException if STREAMS_NUM_THREADS is not a positive integer
     */
    public static Properties createStreamsConfig(String applicationId) {
        Properties props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG, applicationId);
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG, BOOTSTRAP_SERVERS);
        props.put(StreamsConfig.DEFAULT_KEY_SERDE_CLASS_CONFIG, Serdes.String().getClass());
        props.put(StreamsConfig.DEFAULT_VALUE_SERDE_CLASS_CONFIG, Serdes.String().getClass());

        // Stateless map: every thread works independently on its own partitions
        props.put(StreamsConfig.NUM_STREAM_THREADS_CONFIG, parseThreadCount(STREAMS_NUM_THREADS));
        props.put(StreamsConfig.PROCESSING_GUARANTEE_CONFIG, StreamsConfig.AT_LEAST_ONCE);
        props.put(StreamsConfig.STATE_DIR_CONFIG, "/tmp/kafka-streams/" + applicationId);

        // Exception handlers - continue on error instead of crashing the application
        props.put(StreamsConfig.DEFAULT_DESERIALIZATION_EXCEPTION_HANDLER_CLASS_CONFIG,
            LogAndContinueExceptionHandler.class);
        props.put(StreamsConfig.PROCESSING_EXCEPTION_HANDLER_CLASS_CONFIG,
            LogAndContinueProcessingExceptionHandler.class);
        // Custom handler for production exceptions (no built-in "continue" handler exists)
        props.put(StreamsConfig.DEFAULT_PRODUCTION_EXCEPTION_HANDLER_CLASS_CONFIG,
            "com.flightroutes.streams.handlers.LogAndContinueProductionHandler");

        return props;
    }

    static int parseThreadCount(String value) {
        int threads;
        try {
            threads = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("STREAMS_NUM_THREADS is not a number: " + value, e);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("STREAMS_NUM_THREADS must be at least 1: " + value);
        }
        return threads;
    }

    /**
     * Get the configured Kafka bootstrap servers.
     *
     * @return Bootstrap servers string
     */
    public static String getBootstrapServers() {
        return BOOTSTRAP_SERVERS;
    }

    /**
     * Topic carrying staged base route records.
     */
    public static String getStagedRoutesTopic() {
        return STAGED_ROUTES_TOPIC;
    }

    /**
     * Topic receiving enriched route records.
     */
    public static String getEnrichedRoutesTopic() {
        return ENRICHED_ROUTES_TOPIC;
    }
}
