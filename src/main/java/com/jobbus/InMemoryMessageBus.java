package com.jobbus;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jobbus.client.EntityNames;
import com.jobbus.config.JobBusProperties;
import com.jobbus.internal.MessageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process {@link MessageBus} for tests and local runs.
 * <p>
 * Immediate publishes are delivered synchronously, on the publishing thread, to every subscription
 * whose owning topic matches. Delayed publishes fire once on an internal scheduler. Failing handler
 * invocations are retried in place up to {@value #MAX_HANDLER_ATTEMPTS} times without backoff; there is
 * no dead-letter path, and the concurrency level and retry policy of a registration are ignored.
 */
public class InMemoryMessageBus<T extends Enum<T>, S extends Enum<S>> implements MessageBus<T, S> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    static final int MAX_HANDLER_ATTEMPTS = 10;
    static final int MAX_SYNCHRONOUS_DEPTH = 32;

    private final String runId;
    private final ObjectMapper objectMapper;
    private final Map<S, MessageDispatcher<T, ?>> registrations = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final ThreadLocal<Integer> deliveryDepth = ThreadLocal.withInitial(() -> 0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates an emulator that delivers messages of every run.
     */
    public InMemoryMessageBus() {
        this(null);
    }

    public InMemoryMessageBus(String runId) {
        this(runId, defaultObjectMapper());
    }

    public InMemoryMessageBus(String runId, ObjectMapper objectMapper) {
        this.runId = runId;
        this.objectMapper = objectMapper;
        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "jobbus-emulator-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void publish(BaseMessage message, T topic, Instant executeOnUtc) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        if (topic == null) {
            throw new IllegalArgumentException("topic must not be null");
        }
        ensureOpen();

        log.info("Publishing to {} MessageId: {} Time to Execute: {}",
                topic, message.getId(), executeOnUtc != null ? executeOnUtc : "NOW");
        try {
            if (executeOnUtc != null && executeOnUtc.isAfter(Instant.now())) {
                long delayMillis = Math.max(0, Duration.between(Instant.now(), executeOnUtc).toMillis());
                scheduler.schedule(() -> deliverToSubscribers(message, topic), delayMillis, TimeUnit.MILLISECONDS);
            } else if (deliveryDepth.get() >= MAX_SYNCHRONOUS_DEPTH) {
                log.debug("Continuation chain for {} reached depth {}, handing off", message.getId(),
                        MAX_SYNCHRONOUS_DEPTH);
                scheduler.execute(() -> deliverToSubscribers(message, topic));
            } else {
                deliverToSubscribers(message, topic);
            }
        } catch (RejectedExecutionException e) {
            log.error("Failed to publish message {} to {}", message.getId(), topic, e);
            throw new MessageBusException("Failed to publish message " + message.getId() + " to " + topic, e);
        }
    }

    @Override
    public <M extends BaseMessage> boolean registerSubscriber(
            T topic,
            S subscription,
            int concurrencyLevel,
            MessageHandler<T, M> handler,
            RetryPolicy<T> deadLetterRetrying,
            CancellationSignal cancellation) {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(subscription, "subscription must not be null");
        if (concurrencyLevel < 1) {
            throw new IllegalArgumentException("concurrencyLevel must be >= 1");
        }
        ensureOpen();

        MessageDispatcher<T, M> dispatcher = new MessageDispatcher<>(handler, runId, objectMapper, this::publish,
                topic + ":" + subscription);
        log.info("Registering {} Subscriber to: {}:{}", dispatcher.getHandlerName(), topic, subscription);
        if (deadLetterRetrying != null) {
            log.debug("Ignoring dead-letter retry policy for {}: the emulator has no dead-letter path", subscription);
        }
        registrations.put(subscription, dispatcher);
        return true;
    }

    @Override
    public void setupEntitiesIfNotExist(JobBusProperties.Provisioning configuration) {
        log.debug("Emulator needs no entity setup");
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Disposing in-memory message bus with {} registration(s)", registrations.size());
        scheduler.shutdownNow();
        registrations.clear();
    }

    private void deliverToSubscribers(BaseMessage message, T topic) {
        if (closed.get()) {
            log.debug("Dropping message {} for {}: bus is closed", message.getId(), topic);
            return;
        }
        String topicName = topic.name().toLowerCase(Locale.ROOT);
        int depth = deliveryDepth.get();
        deliveryDepth.set(depth + 1);
        try {
            for (Map.Entry<S, MessageDispatcher<T, ?>> registration : registrations.entrySet()) {
                String owningTopic = EntityNames.owningTopic(registration.getKey().name()).toLowerCase(Locale.ROOT);
                if (owningTopic.equals(topicName)) {
                    deliver(registration.getKey(), registration.getValue(), message);
                }
            }
        } finally {
            deliveryDepth.set(depth);
        }
    }

    private void deliver(S subscription, MessageDispatcher<T, ?> dispatcher, BaseMessage message) {
        for (int attempt = 1; attempt <= MAX_HANDLER_ATTEMPTS; attempt++) {
            try {
                MessageDispatcher.Outcome outcome = dispatcher.dispatchObject(message);
                log.debug("[{}] - [{}] - [{}] handled as {}", dispatcher.getHandlerName(), subscription,
                        message.getId(), outcome);
                return;
            } catch (Exception e) {
                log.error("[{}] - [{}] - [{}] Handler failed to handle msg on retry [{}] error: {}",
                        dispatcher.getHandlerName(), subscription, message.getId(), attempt, e.getMessage(), e);
            }
        }
        log.error("[{}] - [{}] - [{}] Giving up after {} attempts", dispatcher.getHandlerName(), subscription,
                message.getId(), MAX_HANDLER_ATTEMPTS);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Message bus is closed");
        }
    }

    private static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
