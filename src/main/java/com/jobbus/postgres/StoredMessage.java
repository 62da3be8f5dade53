package com.jobbus.postgres;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One copy of a published message, owned by a single subscription.
 */
@Entity
@Table(name = "jobbus_messages")
public class StoredMessage {

    @Id
    private UUID id;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "message_id", nullable = false)
    private String messageId;

    @Column(nullable = false)
    private String topic;

    @Column(nullable = false)
    private String subscription;

    @Column(name = "partition_key")
    private String partitionKey;

    @Column(name = "to_address")
    private String toAddress;

    @Column(name = "content_type")
    private String contentType;

    @Column(columnDefinition = "text")
    private String body;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "application_properties", columnDefinition = "jsonb")
    private Map<String, Object> applicationProperties = new LinkedHashMap<>();

    @Column(name = "enqueued_at", insertable = false, updatable = false)
    private OffsetDateTime enqueuedAt;

    @Column(name = "scheduled_enqueue_time", nullable = false)
    private OffsetDateTime scheduledEnqueueTime;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "delivery_count")
    private int deliveryCount = 0;

    @Column(name = "lock_token")
    private UUID lockToken;

    @Column(name = "locked_until")
    private OffsetDateTime lockedUntil;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "dead_lettered_at")
    private OffsetDateTime deadLetteredAt;

    @Column(name = "dead_letter_reason", columnDefinition = "text")
    private String deadLetterReason;

    public StoredMessage() {
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public Long getSequenceNumber() {
        return sequenceNumber;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public String getSubscription() {
        return subscription;
    }

    public void setSubscription(String subscription) {
        this.subscription = subscription;
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    public void setPartitionKey(String partitionKey) {
        this.partitionKey = partitionKey;
    }

    public String getToAddress() {
        return toAddress;
    }

    public void setToAddress(String toAddress) {
        this.toAddress = toAddress;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public Map<String, Object> getApplicationProperties() {
        return applicationProperties;
    }

    public void setApplicationProperties(Map<String, Object> applicationProperties) {
        this.applicationProperties = applicationProperties;
    }

    public OffsetDateTime getEnqueuedAt() {
        return enqueuedAt;
    }

    public OffsetDateTime getScheduledEnqueueTime() {
        return scheduledEnqueueTime;
    }

    public void setScheduledEnqueueTime(OffsetDateTime scheduledEnqueueTime) {
        this.scheduledEnqueueTime = scheduledEnqueueTime;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public int getDeliveryCount() {
        return deliveryCount;
    }

    public void setDeliveryCount(int deliveryCount) {
        this.deliveryCount = deliveryCount;
    }

    public UUID getLockToken() {
        return lockToken;
    }

    public void setLockToken(UUID lockToken) {
        this.lockToken = lockToken;
    }

    public OffsetDateTime getLockedUntil() {
        return lockedUntil;
    }

    public void setLockedUntil(OffsetDateTime lockedUntil) {
        this.lockedUntil = lockedUntil;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public OffsetDateTime getDeadLetteredAt() {
        return deadLetteredAt;
    }

    public void setDeadLetteredAt(OffsetDateTime deadLetteredAt) {
        this.deadLetteredAt = deadLetteredAt;
    }

    public String getDeadLetterReason() {
        return deadLetterReason;
    }

    public void setDeadLetterReason(String deadLetterReason) {
        this.deadLetterReason = deadLetterReason;
    }
}
