package com.jobbus.client;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message as the broker sees it: a JSON body plus system and application properties.
 * <p>
 * The received-side fields ({@code lockToken}, {@code deliveryCount}, {@code enqueuedTime},
 * {@code deadLetterReason}) are filled by the broker and are not carried over by {@link #copy()}.
 */
public class Envelope {

    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final String RUN_ID_PROPERTY = "runId";
    public static final String RETRIES_COUNT_PROPERTY = "retriesCount";
    public static final String DEAD_LETTER_SOURCE_PROPERTY = "deadLetterSource";
    public static final String DEAD_LETTER_REASON_PROPERTY = "deadLetterReason";

    private String messageId;
    private String contentType;
    private String body;
    private String partitionKey;
    private String to;
    private Instant scheduledEnqueueTime;
    private final Map<String, Object> applicationProperties = new LinkedHashMap<>();

    private String lockToken;
    private int deliveryCount;
    private Instant enqueuedTime;
    private String deadLetterReason;

    public Envelope() {
    }

    public Envelope(String messageId, String body) {
        this.messageId = messageId;
        this.body = body;
        this.contentType = CONTENT_TYPE_JSON;
    }

    /**
     * Copies everything a sender controls: id, body, routing and application properties.
     */
    public Envelope copy() {
        Envelope clone = new Envelope();
        clone.messageId = messageId;
        clone.contentType = contentType;
        clone.body = body;
        clone.partitionKey = partitionKey;
        clone.to = to;
        clone.scheduledEnqueueTime = scheduledEnqueueTime;
        clone.applicationProperties.putAll(applicationProperties);
        return clone;
    }

    /**
     * @return the {@code retriesCount} property, or 0 when absent or not a number
     */
    public int getRetriesCount() {
        Object value = applicationProperties.get(RETRIES_COUNT_PROPERTY);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public void setRetriesCount(int retriesCount) {
        applicationProperties.put(RETRIES_COUNT_PROPERTY, retriesCount);
    }

    public String getRunId() {
        Object value = applicationProperties.get(RUN_ID_PROPERTY);
        return value == null ? null : value.toString();
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
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

    public String getPartitionKey() {
        return partitionKey;
    }

    public void setPartitionKey(String partitionKey) {
        this.partitionKey = partitionKey;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public Instant getScheduledEnqueueTime() {
        return scheduledEnqueueTime;
    }

    public void setScheduledEnqueueTime(Instant scheduledEnqueueTime) {
        this.scheduledEnqueueTime = scheduledEnqueueTime;
    }

    public Map<String, Object> getApplicationProperties() {
        return applicationProperties;
    }

    public String getLockToken() {
        return lockToken;
    }

    public void setLockToken(String lockToken) {
        this.lockToken = lockToken;
    }

    public int getDeliveryCount() {
        return deliveryCount;
    }

    public void setDeliveryCount(int deliveryCount) {
        this.deliveryCount = deliveryCount;
    }

    public Instant getEnqueuedTime() {
        return enqueuedTime;
    }

    public void setEnqueuedTime(Instant enqueuedTime) {
        this.enqueuedTime = enqueuedTime;
    }

    public String getDeadLetterReason() {
        return deadLetterReason;
    }

    public void setDeadLetterReason(String deadLetterReason) {
        this.deadLetterReason = deadLetterReason;
    }

    @Override
    public String toString() {
        return "Envelope{messageId='" + messageId + "', to='" + to + "', scheduledEnqueueTime="
                + scheduledEnqueueTime + ", deliveryCount=" + deliveryCount + ", properties="
                + applicationProperties + "}";
    }
}
