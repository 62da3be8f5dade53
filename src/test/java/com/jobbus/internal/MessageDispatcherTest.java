package com.jobbus.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jobbus.HandlerResponse;
import com.jobbus.MessageBusException;
import com.jobbus.OrderMessage;
import com.jobbus.RecordingHandler;
import com.jobbus.TestTopic;
import com.jobbus.client.Envelope;
import com.jobbus.scheduling.JobDefinition;
import com.jobbus.scheduling.JobWindow;
import com.jobbus.scheduling.Schedule;
import com.jobbus.scheduling.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class MessageDispatcherTest {

    private ObjectMapper objectMapper;
    private MessageDispatcher.ContinuationPublisher<TestTopic> publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        publisher = mock(MessageDispatcher.ContinuationPublisher.class);
    }

    @Test
    void shouldIgnoreMessagesOfAnotherRunWithoutInvokingHandler() throws Exception {
        RecordingHandler<OrderMessage> handler = RecordingHandler.succeeding(OrderMessage.class);
        MessageDispatcher<TestTopic, OrderMessage> dispatcher = dispatcher(handler, "run-A");

        MessageDispatcher.Outcome outcome = dispatcher.dispatch(new OrderMessage("order-1", "run-B", "book"));

        assertEquals(MessageDispatcher.Outcome.IGNORED_FOREIGN_RUN, outcome);
        assertEquals(0, handler.getInvocations());
        verifyNoInteractions(publisher);
    }

    @Test
    void shouldAcceptEveryRunWhenNoRunIsConfigured() throws Exception {
        RecordingHandler<OrderMessage> handler = RecordingHandler.succeeding(OrderMessage.class);
        MessageDispatcher<TestTopic, OrderMessage> dispatcher = dispatcher(handler, null);

        assertEquals(MessageDispatcher.Outcome.COMPLETED,
                dispatcher.dispatch(new OrderMessage("order-1", "run-B", "book")));
        assertEquals(1, handler.getInvocations());
    }

    @Test
    void shouldCompleteWithoutPublishingOnFinalResponse() throws Exception {
        RecordingHandler<OrderMessage> handler = RecordingHandler.succeeding(OrderMessage.class);
        MessageDispatcher<TestTopic, OrderMessage> dispatcher = dispatcher(handler, "run-A");

        assertEquals(MessageDispatcher.Outcome.COMPLETED,
                dispatcher.dispatch(new OrderMessage("order-1", "run-A", "book")));
        verify(publisher, never()).publish(any(), any(), any());
    }

    @Test
    void shouldPublishContinuationWithDueTime() throws Exception {
        OrderMessage next = new OrderMessage("order-2", "run-A", "invoice");
        Instant due = Instant.parse("2030-01-01T10:00:00Z");
        RecordingHandler<OrderMessage> handler = new RecordingHandler<>(OrderMessage.class,
                (message, invocation) -> HandlerResponse.continueWith(next, TestTopic.Orders, due));
        MessageDispatcher<TestTopic, OrderMessage> dispatcher = dispatcher(handler, "run-A");

        assertEquals(MessageDispatcher.Outcome.CONTINUED,
                dispatcher.dispatch(new OrderMessage("order-1", "run-A", "book")));
        verify(publisher).publish(next, TestTopic.Orders, due);
    }

    @Test
    void shouldPropagateHandlerFailureWithoutPublishing() {
        RecordingHandler<OrderMessage> handler = RecordingHandler.failing(OrderMessage.class);
        MessageDispatcher<TestTopic, OrderMessage> dispatcher = dispatcher(handler, "run-A");

        assertThrows(IllegalStateException.class,
                () -> dispatcher.dispatch(new OrderMessage("order-1", "run-A", "book")));
        verifyNoInteractions(publisher);
    }

    @Test
    void shouldPropagateContinuationPublishFailure() {
        OrderMessage next = new OrderMessage("order-2", "run-A", "invoice");
        RecordingHandler<OrderMessage> handler = new RecordingHandler<>(OrderMessage.class,
                (message, invocation) -> HandlerResponse.continueWith(next, TestTopic.Orders));
        MessageDispatcher<TestTopic, OrderMessage> dispatcher = new MessageDispatcher<>(handler, "run-A",
                objectMapper, (message, topic, executeOnUtc) -> {
                    throw new MessageBusException("broker unavailable");
                }, "Orders:Orders_Billing");

        assertThrows(MessageBusException.class,
                () -> dispatcher.dispatch(new OrderMessage("order-1", "run-A", "book")));
    }

    @Test
    void shouldRejectNullResponse() {
        RecordingHandler<OrderMessage> handler = new RecordingHandler<>(OrderMessage.class,
                (message, invocation) -> null);
        MessageDispatcher<TestTopic, OrderMessage> dispatcher = dispatcher(handler, "run-A");

        assertThrows(IllegalStateException.class,
                () -> dispatcher.dispatch(new OrderMessage("order-1", "run-A", "book")));
    }

    @Test
    void shouldDecodeEnvelopeBodyIntoHandlerType() throws Exception {
        RecordingHandler<OrderMessage> handler = RecordingHandler.succeeding(OrderMessage.class);
        MessageDispatcher<TestTopic, OrderMessage> dispatcher = dispatcher(handler, "run-A");
        Envelope envelope = new Envelope("order-1",
                objectMapper.writeValueAsString(new OrderMessage("order-1", "run-A", "book")));

        dispatcher.onDelivery(envelope);

        assertEquals(1, handler.getReceived().size());
        assertEquals("book", handler.getReceived().get(0).getItem());
    }

    @Test
    void shouldFailDeliveryWhenBodyCannotBeDecoded() {
        RecordingHandler<OrderMessage> handler = RecordingHandler.succeeding(OrderMessage.class);
        MessageDispatcher<TestTopic, OrderMessage> dispatcher = dispatcher(handler, "run-A");

        assertThrows(MessageBusException.class, () -> dispatcher.onDelivery(new Envelope("order-1", "{not json")));
        assertThrows(MessageBusException.class, () -> dispatcher.onDelivery(new Envelope("order-1", null)));
        assertEquals(0, handler.getInvocations());
    }

    @Test
    void shouldConvertSubtypeObjectsToHandlerType() throws Exception {
        JobDefinition definition = new JobDefinition("job-1", "run-A", "R1", Schedule.every(3600));
        JobWindow window = JobWindow.of(definition, new TimeRange(
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T01:00:00Z")));
        RecordingHandler<JobDefinition> handler = RecordingHandler.succeeding(JobDefinition.class);
        MessageDispatcher<TestTopic, JobDefinition> dispatcher = new MessageDispatcher<>(handler, "run-A",
                objectMapper, publisher, "WindowReady:WindowReady_ScheduleNextRun");

        dispatcher.dispatchObject(window);
        dispatcher.dispatchObject(new OrderMessage("order-1", "run-A", "book"));

        assertEquals(2, handler.getReceived().size());
        assertInstanceOf(JobWindow.class, handler.getReceived().get(0));
        assertTrue(handler.getReceived().get(1).getClass() == JobDefinition.class);
        assertEquals("order-1", handler.getReceived().get(1).getId());
    }

    private MessageDispatcher<TestTopic, OrderMessage> dispatcher(RecordingHandler<OrderMessage> handler, String runId) {
        return new MessageDispatcher<>(handler, runId, objectMapper, publisher, "Orders:Orders_Billing");
    }
}
