package com.jobbus.client;

/**
 * Entity path conventions shared by every backend.
 */
public final class EntityNames {

    public static final String SUBSCRIPTIONS_SEGMENT = "/Subscriptions/";
    public static final String DEAD_LETTER_SUFFIX = "/$DeadLetterQueue";

    private EntityNames() {
    }

    public static String formatSubscriptionPath(String topicName, String subscriptionName) {
        return topicName + SUBSCRIPTIONS_SEGMENT + subscriptionName;
    }

    public static String formatDeadLetterPath(String entityPath) {
        return entityPath + DEAD_LETTER_SUFFIX;
    }

    /**
     * Returns the topic a subscription belongs to: everything before the first underscore of its name.
     */
    public static String owningTopic(String subscriptionName) {
        if (subscriptionName == null || subscriptionName.isBlank()) {
            throw new IllegalArgumentException("subscriptionName must not be blank");
        }
        int separator = subscriptionName.indexOf('_');
        if (separator == 0) {
            throw new IllegalArgumentException("Subscription '" + subscriptionName + "' does not name a topic");
        }
        return separator < 0 ? subscriptionName : subscriptionName.substring(0, separator);
    }
}
