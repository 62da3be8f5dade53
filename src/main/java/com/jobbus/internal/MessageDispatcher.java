package com.jobbus.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobbus.BaseMessage;
import com.jobbus.HandlerResponse;
import com.jobbus.MessageBusException;
import com.jobbus.MessageHandler;
import com.jobbus.client.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;

import java.time.Instant;
import java.util.Objects;

/**
 * Sits between a broker delivery and a {@link MessageHandler}: decodes the body, drops messages of
 * other runs, invokes the handler and publishes its continuation.
 */
public class MessageDispatcher<T extends Enum<T>, M extends BaseMessage> {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    public enum Outcome {
        IGNORED_FOREIGN_RUN,
        COMPLETED,
        CONTINUED
    }

    @FunctionalInterface
    public interface ContinuationPublisher<T extends Enum<T>> {
        void publish(BaseMessage message, T topic, Instant executeOnUtc);
    }

    private final MessageHandler<T, M> handler;
    private final Class<M> messageClass;
    private final String runId;
    private final ObjectMapper objectMapper;
    private final ContinuationPublisher<T> continuationPublisher;
    private final String source;
    private final String handlerName;

    /**
     * @param runId run whose messages are handled; {@code null} accepts every run
     * @param source subscription label used in log lines
     */
    public MessageDispatcher(
            MessageHandler<T, M> handler,
            String runId,
            ObjectMapper objectMapper,
            ContinuationPublisher<T> continuationPublisher,
            String source) {
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.messageClass = handler.getMessageClass();
        this.runId = runId;
        this.objectMapper = objectMapper;
        this.continuationPublisher = Objects.requireNonNull(continuationPublisher,
                "continuationPublisher must not be null");
        this.source = source;
        this.handlerName = ClassUtils.getUserClass(handler).getSimpleName();
    }

    /**
     * Broker entry point. Throwing fails the delivery.
     */
    public void onDelivery(Envelope envelope) throws Exception {
        M message = decode(envelope);
        Outcome outcome = dispatch(message);
        log.debug("[{}] - [{}] delivery #{} on {} finished as {}",
                handlerName, envelope.getMessageId(), envelope.getDeliveryCount(), source, outcome);
    }

    /**
     * Emulator entry point: the message is handed over as an object rather than a JSON body.
     */
    public Outcome dispatchObject(BaseMessage message) throws Exception {
        if (messageClass.isInstance(message)) {
            return dispatch(messageClass.cast(message));
        }
        try {
            return dispatch(objectMapper.convertValue(message, messageClass));
        } catch (IllegalArgumentException e) {
            throw new MessageBusException("Cannot convert " + message.getClass().getName() + " into "
                    + messageClass.getName() + " for " + handlerName, e);
        }
    }

    public Outcome dispatch(M message) throws Exception {
        if (runId != null && !runId.equals(message.getRunId())) {
            log.debug("Ignoring message {} of run {} on {} (current run {})",
                    message.getId(), message.getRunId(), source, runId);
            return Outcome.IGNORED_FOREIGN_RUN;
        }

        log.info("Incoming {}/{} [{}] delegate to {}", source, message.getId(),
                message.getClass().getSimpleName(), handlerName);
        HandlerResponse<T> response = handler.handle(message);
        if (response == null) {
            throw new IllegalStateException("MessageHandler " + handlerName + " returned no response for message "
                    + message.getId());
        }

        HandlerResponse.ContinueWith<T> continuation = response.getContinueWithResult();
        if (continuation == null) {
            log.info("[{}] - [{}] Got to its final stage with status {}",
                    handlerName, message.getId(), response.getResultStatusCode());
            return Outcome.COMPLETED;
        }

        continuationPublisher.publish(continuation.message(), continuation.topicToPublish(),
                continuation.executeOnUtc());
        return Outcome.CONTINUED;
    }

    public Class<M> getMessageClass() {
        return messageClass;
    }

    public String getHandlerName() {
        return handlerName;
    }

    private M decode(Envelope envelope) {
        if (envelope.getBody() == null) {
            throw new MessageBusException("Message " + envelope.getMessageId() + " on " + source + " has no body");
        }
        try {
            return objectMapper.readValue(envelope.getBody(), messageClass);
        } catch (JsonProcessingException e) {
            throw new MessageBusException("Cannot decode message " + envelope.getMessageId() + " on " + source
                    + " into " + messageClass.getName(), e);
        }
    }
}
