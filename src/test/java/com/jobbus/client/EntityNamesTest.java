package com.jobbus.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EntityNamesTest {

    @Test
    void shouldFormatSubscriptionAndDeadLetterPaths() {
        String subscriptionPath = EntityNames.formatSubscriptionPath("Orders", "Orders_Billing");

        assertEquals("Orders/Subscriptions/Orders_Billing", subscriptionPath);
        assertEquals("Orders/Subscriptions/Orders_Billing/$DeadLetterQueue",
                EntityNames.formatDeadLetterPath(subscriptionPath));
    }

    @Test
    void shouldDeriveOwningTopicFromPrefixBeforeFirstUnderscore() {
        assertEquals("Orders", EntityNames.owningTopic("Orders_Billing"));
        assertEquals("WindowReady", EntityNames.owningTopic("WindowReady_Schedule_Next_Run"));
        assertEquals("Orders", EntityNames.owningTopic("Orders"));
        assertThrows(IllegalArgumentException.class, () -> EntityNames.owningTopic("_Billing"));
        assertThrows(IllegalArgumentException.class, () -> EntityNames.owningTopic(" "));
    }

    @Test
    void shouldKeyHandlesByKindAndPath() {
        assertEquals(EntityKey.subscriptionReceiver("Orders", "Orders_Billing"),
                EntityKey.subscriptionReceiver("Orders", "Orders_Billing"));
        assertNotEquals(EntityKey.subscriptionReceiver("Orders", "Orders_Billing"),
                EntityKey.deadLetterReceiver("Orders", "Orders_Billing"));
        assertEquals("Orders/Subscriptions/Orders_Billing/$DeadLetterQueue",
                EntityKey.deadLetterReceiver("Orders", "Orders_Billing").path());
    }
}
