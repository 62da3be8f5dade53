package com.jobbus.internal;

import com.jobbus.CancellationSignal;
import com.jobbus.RetryPolicy;
import com.jobbus.client.DeadLetterReceiver;
import com.jobbus.client.EntityNames;
import com.jobbus.client.Envelope;
import com.jobbus.client.TopicSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drains one subscription's dead-letter path: resubmits messages with exponential backoff until
 * the policy's retry ceiling, then forwards them to the permanent-errors topic.
 * <p>
 * Every read ends in exactly one send followed by one completion. Messages of other runs are left
 * where they are. Any send or completion failure ends the loop.
 */
public class DeadLetterRetryEngine<T extends Enum<T>> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterRetryEngine.class);

    public enum Outcome {
        SKIPPED_FOREIGN_RUN,
        RESUBMITTED,
        FORWARDED_TO_PERMANENT_ERRORS
    }

    private final String topicName;
    private final String subscriptionName;
    private final RetryPolicy<T> retryPolicy;
    private final DeadLetterReceiver deadLetterReceiver;
    private final TopicSender originSender;
    private final TopicSender permanentErrorsSender;
    private final String runId;
    private final CancellationSignal cancellation;
    private final Duration receiveTimeout;
    private final Clock clock;

    public DeadLetterRetryEngine(
            String topicName,
            String subscriptionName,
            RetryPolicy<T> retryPolicy,
            DeadLetterReceiver deadLetterReceiver,
            TopicSender originSender,
            TopicSender permanentErrorsSender,
            String runId,
            CancellationSignal cancellation,
            Duration receiveTimeout,
            Clock clock) {
        this.topicName = topicName;
        this.subscriptionName = subscriptionName;
        this.retryPolicy = retryPolicy;
        this.deadLetterReceiver = deadLetterReceiver;
        this.originSender = originSender;
        this.permanentErrorsSender = permanentErrorsSender;
        this.runId = runId;
        this.cancellation = cancellation;
        this.receiveTimeout = receiveTimeout;
        this.clock = clock;
    }

    @Override
    public void run() {
        log.info("Dead-letter retry engine started for {}:{} with {}", topicName, subscriptionName, retryPolicy);
        while (!cancellation.isCancellationRequested()) {
            Envelope deadLettered;
            try {
                deadLettered = deadLetterReceiver.receive(receiveTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Dead-letter retry engine for {}:{} interrupted", topicName, subscriptionName);
                return;
            }
            if (deadLettered == null) {
                continue;
            }
            process(deadLettered);
        }
        log.info("Dead-letter retry engine for {}:{} stopped", topicName, subscriptionName);
    }

    public Outcome process(Envelope deadLettered) {
        if (!belongsToCurrentRun(deadLettered)) {
            log.debug("Skipping dead-lettered message {} of another run on {}:{}",
                    deadLettered.getMessageId(), topicName, subscriptionName);
            return Outcome.SKIPPED_FOREIGN_RUN;
        }

        int retriesCount = deadLettered.getRetriesCount();
        Envelope reSubmit = deadLettered.copy();

        if (retriesCount < retryPolicy.getMaxRetryCount()) {
            Duration delay = retryPolicy.getDelay(retriesCount);
            Instant dueTime = clock.instant().plus(delay);
            reSubmit.setTo(subscriptionName);
            reSubmit.setRetriesCount(retriesCount + 1);
            reSubmit.setScheduledEnqueueTime(dueTime);

            log.info("Scheduling retry#{} in {}sec due: {} Topic: {}, Subscription: {}",
                    retriesCount + 1, delay.toSeconds(), dueTime, topicName, subscriptionName);
            originSender.send(reSubmit);
            deadLetterReceiver.complete(deadLettered.getLockToken());
            return Outcome.RESUBMITTED;
        }

        T permanentErrorsTopic = retryPolicy.getPermanentErrorsTopic();
        log.error("Retries were exhausted for message {} on {}:{} after {} retries, moving to {}",
                deadLettered.getMessageId(), topicName, subscriptionName, retriesCount, permanentErrorsTopic);
        reSubmit.setTo(null);
        reSubmit.setScheduledEnqueueTime(null);
        reSubmit.getApplicationProperties().put(Envelope.DEAD_LETTER_SOURCE_PROPERTY,
                EntityNames.formatSubscriptionPath(topicName, subscriptionName));
        if (deadLettered.getDeadLetterReason() != null) {
            reSubmit.getApplicationProperties().put(Envelope.DEAD_LETTER_REASON_PROPERTY,
                    deadLettered.getDeadLetterReason());
        }
        permanentErrorsSender.send(reSubmit);
        deadLetterReceiver.complete(deadLettered.getLockToken());
        return Outcome.FORWARDED_TO_PERMANENT_ERRORS;
    }

    private boolean belongsToCurrentRun(Envelope envelope) {
        if (runId == null) {
            return true;
        }
        if (runId.equals(envelope.getRunId())) {
            return true;
        }
        return envelope.getMessageId() != null && envelope.getMessageId().contains(runId);
    }
}
