package com.jobbus.admin;

import java.time.Duration;

public class CreateSubscriptionOptions {

    public static final int DEFAULT_MAX_DELIVERY_COUNT = 5;
    public static final Duration DEFAULT_MESSAGE_TIME_TO_LIVE = Duration.ofDays(2);

    private final String topicName;
    private final String subscriptionName;
    private int maxDeliveryCount = DEFAULT_MAX_DELIVERY_COUNT;
    private Duration defaultMessageTimeToLive = DEFAULT_MESSAGE_TIME_TO_LIVE;

    public CreateSubscriptionOptions(String topicName, String subscriptionName) {
        if (topicName == null || topicName.isBlank()) {
            throw new IllegalArgumentException("Topic name must not be blank");
        }
        if (subscriptionName == null || subscriptionName.isBlank()) {
            throw new IllegalArgumentException("Subscription name must not be blank");
        }
        this.topicName = topicName;
        this.subscriptionName = subscriptionName;
    }

    public String getTopicName() {
        return topicName;
    }

    public String getSubscriptionName() {
        return subscriptionName;
    }

    public int getMaxDeliveryCount() {
        return maxDeliveryCount;
    }

    public CreateSubscriptionOptions setMaxDeliveryCount(int maxDeliveryCount) {
        if (maxDeliveryCount < 1) {
            throw new IllegalArgumentException("maxDeliveryCount must be >= 1");
        }
        this.maxDeliveryCount = maxDeliveryCount;
        return this;
    }

    public Duration getDefaultMessageTimeToLive() {
        return defaultMessageTimeToLive;
    }

    public CreateSubscriptionOptions setDefaultMessageTimeToLive(Duration defaultMessageTimeToLive) {
        if (defaultMessageTimeToLive == null || defaultMessageTimeToLive.isNegative()
                || defaultMessageTimeToLive.isZero()) {
            throw new IllegalArgumentException("defaultMessageTimeToLive must be positive");
        }
        this.defaultMessageTimeToLive = defaultMessageTimeToLive;
        return this;
    }
}
