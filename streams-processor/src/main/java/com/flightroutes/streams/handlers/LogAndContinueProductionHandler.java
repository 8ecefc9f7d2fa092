package com.flightroutes.streams.handlers;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.streams.errors.ErrorHandlerContext;
import org.apache.kafka.streams.errors.ProductionExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Production exception handler that logs the failed enriched record and keeps the
 * processor running, so one unwritable route does not stop the whole stream.
 */
public class LogAndContinueProductionHandler implements ProductionExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(LogAndContinueProductionHandler.class);

    @Override
    public ProductionExceptionHandlerResponse handle(ErrorHandlerContext context,
                                                      ProducerRecord<byte[], byte[]> record,
                                                      Exception exception) {
        LOG.error("Failed to write enriched route - topic: {}, partition: {}, source offset: {}. Skipping record.",
            record.topic(), record.partition(), context.offset(), exception);
        return ProductionExceptionHandlerResponse.CONTINUE;
    }

    @Override
    public void configure(Map<String, ?> configs) {
        // No configuration needed
    }
}
