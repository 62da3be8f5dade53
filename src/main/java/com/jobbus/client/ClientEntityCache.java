package com.jobbus.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Holds one handle per {@link EntityKey}, created on first use and closed exactly once by {@link #closeAll()}.
 */
public class ClientEntityCache {

    private static final Logger log = LoggerFactory.getLogger(ClientEntityCache.class);

    private final ClientEntityFactory factory;
    private final Map<EntityKey, ClientEntity> entities = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ClientEntityCache(ClientEntityFactory factory) {
        this.factory = factory;
    }

    public TopicSender topicSender(String topicName) {
        return getOrCreate(EntityKey.topicSender(topicName), () -> factory.createTopicSender(topicName));
    }

    public SubscriptionReceiver subscriptionReceiver(String topicName, String subscriptionName) {
        return getOrCreate(EntityKey.subscriptionReceiver(topicName, subscriptionName),
                () -> factory.createSubscriptionReceiver(topicName, subscriptionName));
    }

    public DeadLetterReceiver deadLetterReceiver(String topicName, String subscriptionName) {
        return getOrCreate(EntityKey.deadLetterReceiver(topicName, subscriptionName),
                () -> factory.createDeadLetterReceiver(topicName, subscriptionName));
    }

    public List<SubscriptionReceiver> subscriptionReceivers() {
        List<SubscriptionReceiver> receivers = new ArrayList<>();
        for (Map.Entry<EntityKey, ClientEntity> entry : entities.entrySet()) {
            if (entry.getKey().kind() == EntityKind.SUBSCRIPTION_RECEIVER) {
                receivers.add((SubscriptionReceiver) entry.getValue());
            }
        }
        return receivers;
    }

    public int size() {
        return entities.size();
    }

    /**
     * Closes and forgets every cached handle. Later lookups fail.
     */
    public void closeAll() {
        closed = true;
        for (EntityKey key : new ArrayList<>(entities.keySet())) {
            ClientEntity entity = entities.remove(key);
            if (entity == null) {
                continue;
            }
            try {
                entity.close();
                log.debug("Closed {} {}", key.kind(), key.path());
            } catch (RuntimeException e) {
                log.error("Failed to close {} {}", key.kind(), key.path(), e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private <E extends ClientEntity> E getOrCreate(EntityKey key, Supplier<E> creator) {
        if (closed) {
            throw new IllegalStateException("Client entities are closed; cannot open " + key.path());
        }
        return (E) entities.computeIfAbsent(key, ignored -> {
            log.debug("Opening {} {}", key.kind(), key.path());
            return creator.get();
        });
    }
}
