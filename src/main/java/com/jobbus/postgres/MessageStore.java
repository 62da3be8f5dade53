package com.jobbus.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobbus.MessageBusException;
import com.jobbus.client.Envelope;
import com.jobbus.config.JobBusProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Broker storage operations over the {@code jobbus_*} tables.
 * <p>
 * Publishing fans a message out into one row per accepting subscription. Receivers lease rows with
 * {@code FOR UPDATE SKIP LOCKED}; a lease is identified by its lock token until it is completed,
 * released, dead-lettered or expires.
 */
@Component
public class MessageStore {

    private static final Logger log = LoggerFactory.getLogger(MessageStore.class);

    public static final String MAX_DELIVERY_COUNT_EXCEEDED = "MaxDeliveryCountExceeded";

    private final StoredMessageRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final BusTables tables;

    public MessageStore(
            StoredMessageRepository repository,
            JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate,
            @Qualifier("jobbusObjectMapper") ObjectMapper objectMapper,
            JobBusProperties properties) {
        this.repository = repository;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.tables = BusTables.from(properties);
    }

    /**
     * Stores one copy of {@code envelope} for every subscription of {@code topic} whose rule accepts it.
     *
     * @return number of subscriptions the message was delivered to
     * @throws MessageBusException if the topic does not exist
     */
    public int enqueue(String topic, Envelope envelope) {
        String propertiesJson = toJson(envelope);
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        Instant scheduled = envelope.getScheduledEnqueueTime();
        OffsetDateTime visibleAt = scheduled != null ? scheduled.atOffset(ZoneOffset.UTC) : now;

        String sql = """
                INSERT INTO %1$s (id, message_id, topic, subscription, partition_key, to_address, content_type,
                                  body, application_properties, scheduled_enqueue_time, expires_at)
                SELECT gen_random_uuid(), ?, s.topic, s.name, ?, ?, ?, ?, CAST(? AS jsonb), CAST(? AS timestamptz),
                       CAST(? AS timestamptz) + s.default_message_ttl_seconds * INTERVAL '1 second'
                FROM %2$s s
                WHERE s.topic = ?
                  AND ((CAST(? AS varchar) IS NULL AND s.rule_accept_broadcast) OR s.name = ?)
                """.formatted(tables.messages(), tables.subscriptions());

        Integer inserted = transactionTemplate.execute(status -> {
            int rows = jdbcTemplate.update(sql, ps -> {
                ps.setString(1, envelope.getMessageId());
                ps.setString(2, envelope.getPartitionKey());
                ps.setString(3, envelope.getTo());
                ps.setString(4, envelope.getContentType());
                ps.setString(5, envelope.getBody());
                ps.setString(6, propertiesJson);
                ps.setObject(7, visibleAt);
                ps.setObject(8, visibleAt);
                ps.setString(9, topic);
                if (envelope.getTo() == null) {
                    ps.setNull(10, Types.VARCHAR);
                    ps.setNull(11, Types.VARCHAR);
                } else {
                    ps.setString(10, envelope.getTo());
                    ps.setString(11, envelope.getTo());
                }
            });
            if (rows == 0 && !topicExists(topic)) {
                throw new MessageBusException("Topic '" + topic + "' does not exist");
            }
            return rows;
        });

        int count = inserted == null ? 0 : inserted;
        if (count == 0) {
            log.debug("No subscription of {} accepted message {} (to={})", topic, envelope.getMessageId(),
                    envelope.getTo());
        }
        return count;
    }

    /**
     * Leases up to {@code maxCount} deliverable messages of a subscription.
     * <p>
     * A candidate whose delivery count already reached {@code maxDeliveryCount} (its previous lease
     * expired) is dead-lettered instead of being returned.
     */
    public List<Envelope> leaseDeliverable(
            String topic,
            String subscription,
            int maxCount,
            int maxDeliveryCount,
            Duration lockDuration,
            String lockedBy) {
        if (maxCount <= 0) {
            return List.of();
        }
        List<Envelope> leased = transactionTemplate.execute(status -> {
            OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
            List<StoredMessage> candidates = repository.findNextDeliverableForUpdate(
                    topic, subscription, now, PageRequest.of(0, maxCount));
            if (candidates.isEmpty()) {
                return List.<Envelope>of();
            }
            List<Envelope> envelopes = new ArrayList<>(candidates.size());
            for (StoredMessage message : candidates) {
                if (message.getDeliveryCount() >= maxDeliveryCount) {
                    message.setDeadLetteredAt(now);
                    message.setDeadLetterReason(MAX_DELIVERY_COUNT_EXCEEDED);
                    clearLock(message);
                    log.warn("Message {} on {}:{} exceeded {} deliveries, moved to dead-letter",
                            message.getMessageId(), topic, subscription, maxDeliveryCount);
                    continue;
                }
                lock(message, now, lockDuration, lockedBy);
                message.setDeliveryCount(message.getDeliveryCount() + 1);
                envelopes.add(toEnvelope(message));
            }
            repository.saveAll(candidates);
            return envelopes;
        });
        return leased == null ? List.of() : leased;
    }

    /**
     * Leases up to {@code maxCount} dead-lettered messages of a subscription.
     */
    public List<Envelope> leaseDeadLettered(
            String topic,
            String subscription,
            int maxCount,
            Duration lockDuration,
            String lockedBy) {
        List<Envelope> leased = transactionTemplate.execute(status -> {
            OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
            List<StoredMessage> candidates = repository.findNextDeadLetteredForUpdate(
                    topic, subscription, now, PageRequest.of(0, maxCount));
            if (candidates.isEmpty()) {
                return List.<Envelope>of();
            }
            List<Envelope> envelopes = new ArrayList<>(candidates.size());
            for (StoredMessage message : candidates) {
                lock(message, now, lockDuration, lockedBy);
                envelopes.add(toEnvelope(message));
            }
            repository.saveAll(candidates);
            return envelopes;
        });
        return leased == null ? List.of() : leased;
    }

    /**
     * Deletes a leased message.
     *
     * @return {@code false} if the lease was lost in the meantime
     */
    public boolean complete(String lockToken) {
        return repository.deleteLocked(UUID.fromString(lockToken), OffsetDateTime.now(ZoneOffset.UTC)) > 0;
    }

    /**
     * Ends a lease without deleting the message so it can be delivered again.
     */
    public boolean release(String lockToken) {
        return repository.releaseLock(UUID.fromString(lockToken)) > 0;
    }

    public boolean deadLetter(String lockToken, String reason) {
        return repository.moveToDeadLetter(UUID.fromString(lockToken), reason, OffsetDateTime.now(ZoneOffset.UTC)) > 0;
    }

    public boolean topicExists(String topic) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + tables.topics() + " WHERE name = ?", Integer.class, topic);
        return count != null && count > 0;
    }

    /**
     * @throws MessageBusException if the subscription does not exist
     */
    public int maxDeliveryCount(String topic, String subscription) {
        try {
            Integer value = jdbcTemplate.queryForObject(
                    "SELECT max_delivery_count FROM " + tables.subscriptions() + " WHERE topic = ? AND name = ?",
                    Integer.class, topic, subscription);
            if (value == null) {
                throw new MessageBusException("Subscription " + topic + ":" + subscription + " has no delivery limit");
            }
            return value;
        } catch (EmptyResultDataAccessException e) {
            throw new MessageBusException("Subscription " + topic + ":" + subscription + " does not exist", e);
        }
    }

    private void lock(StoredMessage message, OffsetDateTime now, Duration lockDuration, String lockedBy) {
        message.setLockToken(UUID.randomUUID());
        message.setLockedUntil(now.plus(lockDuration));
        message.setLockedBy(lockedBy);
    }

    private void clearLock(StoredMessage message) {
        message.setLockToken(null);
        message.setLockedUntil(null);
        message.setLockedBy(null);
    }

    private Envelope toEnvelope(StoredMessage message) {
        Envelope envelope = new Envelope();
        envelope.setMessageId(message.getMessageId());
        envelope.setContentType(message.getContentType());
        envelope.setBody(message.getBody());
        envelope.setPartitionKey(message.getPartitionKey());
        envelope.setTo(message.getToAddress());
        envelope.setScheduledEnqueueTime(message.getScheduledEnqueueTime() == null
                ? null
                : message.getScheduledEnqueueTime().toInstant());
        if (message.getApplicationProperties() != null) {
            envelope.getApplicationProperties().putAll(message.getApplicationProperties());
        }
        envelope.setLockToken(message.getLockToken() == null ? null : message.getLockToken().toString());
        envelope.setDeliveryCount(message.getDeliveryCount());
        envelope.setEnqueuedTime(message.getEnqueuedAt() == null ? null : message.getEnqueuedAt().toInstant());
        envelope.setDeadLetterReason(message.getDeadLetterReason());
        return envelope;
    }

    private String toJson(Envelope envelope) {
        try {
            return objectMapper.writeValueAsString(new LinkedHashMap<>(envelope.getApplicationProperties()));
        } catch (JsonProcessingException e) {
            throw new MessageBusException("Failed to serialize properties of message " + envelope.getMessageId(), e);
        }
    }
}
