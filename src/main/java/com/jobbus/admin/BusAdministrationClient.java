package com.jobbus.admin;

/**
 * Creates and inspects topics, subscriptions and their routing rules.
 */
public interface BusAdministrationClient {

    boolean topicExists(String topicName);

    void createTopic(CreateTopicOptions options);

    boolean subscriptionExists(String topicName, String subscriptionName);

    void createSubscription(CreateSubscriptionOptions options);

    /**
     * @throws com.jobbus.MessageBusException if the subscription does not exist
     */
    SubscriptionRule getRule(String topicName, String subscriptionName, String ruleName);

    void updateRule(String topicName, String subscriptionName, SubscriptionRule rule);
}
