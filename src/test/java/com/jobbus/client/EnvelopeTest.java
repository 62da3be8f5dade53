package com.jobbus.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EnvelopeTest {

    @Test
    void shouldReadRetriesCountFromNumberOrText() {
        Envelope envelope = new Envelope("order-1", "{}");
        assertEquals(0, envelope.getRetriesCount());

        envelope.setRetriesCount(3);
        assertEquals(3, envelope.getRetriesCount());

        envelope.getApplicationProperties().put(Envelope.RETRIES_COUNT_PROPERTY, " 7 ");
        assertEquals(7, envelope.getRetriesCount());
    }

    @Test
    void shouldTreatMalformedRetriesCountAsFirstRetry() {
        Envelope envelope = new Envelope("order-1", "{}");
        envelope.getApplicationProperties().put(Envelope.RETRIES_COUNT_PROPERTY, "three");

        assertEquals(0, envelope.getRetriesCount());
    }
}
