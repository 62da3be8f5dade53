package com.jobbus.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClientEntityCacheTest {

    private ClientEntityFactory factory;
    private ClientEntityCache cache;

    @BeforeEach
    void setUp() {
        factory = mock(ClientEntityFactory.class);
        cache = new ClientEntityCache(factory);
    }

    @Test
    void shouldCreateEachHandleOnce() {
        TopicSender sender = mock(TopicSender.class);
        when(factory.createTopicSender("Orders")).thenReturn(sender);

        assertSame(sender, cache.topicSender("Orders"));
        assertSame(sender, cache.topicSender("Orders"));

        verify(factory, times(1)).createTopicSender("Orders");
        assertEquals(1, cache.size());
    }

    @Test
    void shouldKeepReceiverAndDeadLetterHandlesApart() {
        SubscriptionReceiver receiver = mock(SubscriptionReceiver.class);
        DeadLetterReceiver deadLetterReceiver = mock(DeadLetterReceiver.class);
        when(factory.createSubscriptionReceiver("Orders", "Orders_Billing")).thenReturn(receiver);
        when(factory.createDeadLetterReceiver("Orders", "Orders_Billing")).thenReturn(deadLetterReceiver);

        assertSame(receiver, cache.subscriptionReceiver("Orders", "Orders_Billing"));
        assertSame(deadLetterReceiver, cache.deadLetterReceiver("Orders", "Orders_Billing"));

        assertEquals(List.of(receiver), cache.subscriptionReceivers());
        assertEquals(2, cache.size());
    }

    @Test
    void shouldCloseEveryHandleEvenIfOneFails() {
        TopicSender failing = mock(TopicSender.class);
        TopicSender healthy = mock(TopicSender.class);
        when(factory.createTopicSender("Orders")).thenReturn(failing);
        when(factory.createTopicSender("PermanentErrors")).thenReturn(healthy);
        when(failing.getKey()).thenReturn(EntityKey.topicSender("Orders"));
        doThrow(new IllegalStateException("already gone")).when(failing).close();
        cache.topicSender("Orders");
        cache.topicSender("PermanentErrors");

        cache.closeAll();

        verify(failing).close();
        verify(healthy).close();
        assertEquals(0, cache.size());
    }

    @Test
    void shouldRefuseLookupsAfterClose() {
        cache.closeAll();

        assertThrows(IllegalStateException.class, () -> cache.topicSender("Orders"));
    }
}
