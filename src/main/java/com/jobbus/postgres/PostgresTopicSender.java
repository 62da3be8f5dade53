package com.jobbus.postgres;

import com.jobbus.client.EntityKey;
import com.jobbus.client.Envelope;
import com.jobbus.client.TopicSender;

public class PostgresTopicSender implements TopicSender {

    private final EntityKey key;
    private final String topicName;
    private final MessageStore messageStore;
    private volatile boolean closed;

    public PostgresTopicSender(String topicName, MessageStore messageStore) {
        this.key = EntityKey.topicSender(topicName);
        this.topicName = topicName;
        this.messageStore = messageStore;
    }

    @Override
    public void send(Envelope envelope) {
        if (closed) {
            throw new IllegalStateException("Sender for topic " + topicName + " is closed");
        }
        messageStore.enqueue(topicName, envelope);
    }

    @Override
    public EntityKey getKey() {
        return key;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
