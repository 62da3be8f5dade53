package com.jobbus.client;

/**
 * Creates broker handles. Each backend provides one implementation.
 */
public interface ClientEntityFactory {

    TopicSender createTopicSender(String topicName);

    SubscriptionReceiver createSubscriptionReceiver(String topicName, String subscriptionName);

    DeadLetterReceiver createDeadLetterReceiver(String topicName, String subscriptionName);
}
