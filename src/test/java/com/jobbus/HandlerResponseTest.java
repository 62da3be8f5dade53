package com.jobbus;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlerResponseTest {

    @Test
    void finalOkShouldBeTerminalWithStatus200() {
        HandlerResponse<TestTopic> response = HandlerResponse.finalOk();

        assertEquals(200, response.getResultStatusCode());
        assertTrue(response.isFinal());
        assertNull(response.getContinueWithResult());
    }

    @Test
    void finalFailureShouldKeepStatusCode() {
        HandlerResponse<TestTopic> response = HandlerResponse.finalFailure(500);

        assertEquals(500, response.getResultStatusCode());
        assertTrue(response.isFinal());
    }

    @Test
    void continueWithShouldCarryMessageTopicAndTime() {
        OrderMessage next = new OrderMessage("order-2", "run-1", "book");
        Instant due = Instant.parse("2024-01-02T00:00:00Z");

        HandlerResponse<TestTopic> response = HandlerResponse.continueWith(next, TestTopic.Orders, due);

        assertFalse(response.isFinal());
        assertEquals(200, response.getResultStatusCode());
        assertSame(next, response.getContinueWithResult().message());
        assertEquals(TestTopic.Orders, response.getContinueWithResult().topicToPublish());
        assertEquals(due, response.getContinueWithResult().executeOnUtc());
    }

    @Test
    void continueWithShouldRejectMessageWithoutId() {
        OrderMessage invalid = new OrderMessage(" ", "run-1", "book");

        assertThrows(IllegalArgumentException.class,
                () -> HandlerResponse.<TestTopic>continueWith(invalid, TestTopic.Orders));
        assertThrows(NullPointerException.class,
                () -> HandlerResponse.<TestTopic>continueWith(new OrderMessage("id", "run-1", "book"), null));
    }
}
