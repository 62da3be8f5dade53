package com.jobbus.postgres;

import com.jobbus.MessageBusException;
import com.jobbus.client.DeadLetterReceiver;
import com.jobbus.client.EntityKey;
import com.jobbus.client.Envelope;
import com.jobbus.config.JobBusProperties;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads a subscription's dead-lettered rows one at a time, polling until a message shows up or the wait elapses.
 */
public class PostgresDeadLetterReceiver implements DeadLetterReceiver {

    private final EntityKey key;
    private final String topicName;
    private final String subscriptionName;
    private final MessageStore messageStore;
    private final JobBusProperties.Receiver settings;
    private final String nodeId;
    private volatile boolean closed;

    public PostgresDeadLetterReceiver(
            String topicName,
            String subscriptionName,
            MessageStore messageStore,
            JobBusProperties.Receiver settings,
            String nodeId) {
        this.key = EntityKey.deadLetterReceiver(topicName, subscriptionName);
        this.topicName = topicName;
        this.subscriptionName = subscriptionName;
        this.messageStore = messageStore;
        this.settings = settings;
        this.nodeId = nodeId;
    }

    @Override
    public Envelope receive(Duration maxWaitTime) throws InterruptedException {
        long deadline = System.nanoTime() + maxWaitTime.toNanos();
        long pollNanos = settings.pollInterval().toNanos();
        while (!closed) {
            List<Envelope> leased = messageStore.leaseDeadLettered(
                    topicName, subscriptionName, 1, settings.lockDuration(), nodeId);
            if (!leased.isEmpty()) {
                return leased.get(0);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(remaining, pollNanos));
        }
        return null;
    }

    @Override
    public void complete(String lockToken) {
        if (!messageStore.complete(lockToken)) {
            throw new MessageBusException("Lock " + lockToken + " on " + key.path() + " was lost before completion");
        }
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
