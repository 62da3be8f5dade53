package com.jobbus.client;

import java.util.Objects;

/**
 * Cache key of a broker handle: what kind of handle, on which entity path.
 */
public record EntityKey(EntityKind kind, String path) {

    public EntityKey {
        Objects.requireNonNull(kind, "kind must not be null");
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
    }

    public static EntityKey topicSender(String topicName) {
        return new EntityKey(EntityKind.TOPIC_SENDER, topicName);
    }

    public static EntityKey subscriptionReceiver(String topicName, String subscriptionName) {
        return new EntityKey(EntityKind.SUBSCRIPTION_RECEIVER,
                EntityNames.formatSubscriptionPath(topicName, subscriptionName));
    }

    public static EntityKey deadLetterReceiver(String topicName, String subscriptionName) {
        return new EntityKey(EntityKind.DEAD_LETTER_RECEIVER,
                EntityNames.formatDeadLetterPath(EntityNames.formatSubscriptionPath(topicName, subscriptionName)));
    }
}
