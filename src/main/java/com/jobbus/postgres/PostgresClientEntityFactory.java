package com.jobbus.postgres;

import com.jobbus.client.ClientEntityFactory;
import com.jobbus.client.DeadLetterReceiver;
import com.jobbus.client.SubscriptionReceiver;
import com.jobbus.client.TopicSender;
import com.jobbus.config.JobBusProperties;

import java.util.UUID;

public class PostgresClientEntityFactory implements ClientEntityFactory {

    private final MessageStore messageStore;
    private final JobBusProperties.Receiver settings;
    private final String nodeId = "node-" + UUID.randomUUID();

    public PostgresClientEntityFactory(MessageStore messageStore, JobBusProperties.Receiver settings) {
        this.messageStore = messageStore;
        this.settings = settings;
    }

    @Override
    public TopicSender createTopicSender(String topicName) {
        return new PostgresTopicSender(topicName, messageStore);
    }

    @Override
    public SubscriptionReceiver createSubscriptionReceiver(String topicName, String subscriptionName) {
        return new PostgresSubscriptionReceiver(topicName, subscriptionName, messageStore, settings, nodeId);
    }

    @Override
    public DeadLetterReceiver createDeadLetterReceiver(String topicName, String subscriptionName) {
        return new PostgresDeadLetterReceiver(topicName, subscriptionName, messageStore, settings, nodeId);
    }

    public String getNodeId() {
        return nodeId;
    }
}
