package com.flightroutes.streams.handlers;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.streams.errors.ErrorHandlerContext;
import org.apache.kafka.streams.errors.ProductionExceptionHandler.ProductionExceptionHandlerResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LogAndContinueProductionHandlerTest {

    @Mock
    ErrorHandlerContext context;

    @Test
    void testHandle_ContinuesAfterFailure() {
        LogAndContinueProductionHandler handler = new LogAndContinueProductionHandler();
        handler.configure(Map.of());
        when(context.offset()).thenReturn(42L);

        ProducerRecord<byte[], byte[]> record =
            new ProducerRecord<>("routes.enriched", 3, new byte[0], new byte[0]);

        ProductionExceptionHandlerResponse response =
            handler.handle(context, record, new RecordTooLargeException("too large"));

        assertEquals(ProductionExceptionHandlerResponse.CONTINUE, response);
        verify(context).offset();
    }
}
