package com.flightroutes.loader;

import com.flightroutes.common.model.BaseRouteRecord;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes base route records to the staged routes topic.
 * Records are keyed by {@code origin-destination}, the same text as the enriched {@code route_id},
 * so that one route always lands on the same partition. Unknown airports render as empty strings.
 */
public class RoutePublisher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RoutePublisher.class);

    private final Producer<String, BaseRouteRecord> producer;
    private final String topic;
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public RoutePublisher(Producer<String, BaseRouteRecord> producer, String topic) {
        this.producer = producer;
        this.topic = topic;
    }

    /**
     * Send one record asynchronously. Delivery is confirmed by {@link #flush()}.
     */
    public void publish(BaseRouteRecord route) {
        String key = routeKey(route);
        ProducerRecord<String, BaseRouteRecord> record = new ProducerRecord<>(topic, key, route);

        producer.send(record, (RecordMetadata metadata, Exception exception) -> {
            if (exception != null) {
                failed.incrementAndGet();
                LOG.error("Failed to send route: {}", key, exception);
            } else {
                sent.incrementAndGet();
                LOG.debug("Sent: {} to partition {} at offset {}", key, metadata.partition(), metadata.offset());
            }
        });
    }

    /**
     * Block until every pending record is acknowledged.
     *
     * @return number of records delivered so far
     * @throws IllegalStateException if any record could not be delivered
     */
    public long flush() {
        producer.flush();
        if (failed.get() > 0) {
            throw new IllegalStateException(failed.get() + " route records could not be published to " + topic);
        }
        return sent.get();
    }

    static String routeKey(BaseRouteRecord route) {
        return nullToEmpty(route.originAirport()) + "-" + nullToEmpty(route.destinationAirport());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public void close() {
        producer.close();
    }
}
