package com.jobbus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobbus.admin.BusAdministrationClient;
import com.jobbus.admin.CreateSubscriptionOptions;
import com.jobbus.admin.CreateTopicOptions;
import com.jobbus.admin.SubscriptionRule;
import com.jobbus.client.ClientEntityCache;
import com.jobbus.client.ClientEntityFactory;
import com.jobbus.client.EntityNames;
import com.jobbus.client.Envelope;
import com.jobbus.client.MessageHandlerOptions;
import com.jobbus.client.SubscriptionReceiver;
import com.jobbus.client.TopicSender;
import com.jobbus.config.JobBusProperties;
import com.jobbus.internal.DeadLetterRetryEngine;
import com.jobbus.internal.MessageDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MessageBus} over a distributed broker reached through a {@link ClientEntityFactory}.
 * <p>
 * Broker handles are opened lazily and cached for the lifetime of the bus. Subscriptions registered
 * with a {@link RetryPolicy} get a {@link DeadLetterRetryEngine} running on a bus-owned thread.
 * <p>
 * Once {@link #close()} starts, callers can no longer publish or register, but handlers that are still
 * running may publish their continuations until the broker handles are released.
 */
public class BrokerMessageBus<T extends Enum<T>, S extends Enum<S>> implements MessageBus<T, S> {

    private static final Logger log = LoggerFactory.getLogger(BrokerMessageBus.class);

    private final Class<T> topicType;
    private final Class<S> subscriptionType;
    private final String runId;
    private final ObjectMapper objectMapper;
    private final ClientEntityCache entities;
    private final BusAdministrationClient administrationClient;
    private final JobBusProperties properties;
    private final Clock clock;
    private final ExecutorService retryEngineExecutor;
    private final Map<S, CompletableFuture<Void>> retryEngines = new ConcurrentHashMap<>();
    private final CancellationSignal shutdownSignal = new CancellationSignal();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean disposed;

    public BrokerMessageBus(
            Class<T> topicType,
            Class<S> subscriptionType,
            String runId,
            ObjectMapper objectMapper,
            ClientEntityFactory entityFactory,
            BusAdministrationClient administrationClient,
            JobBusProperties properties) {
        this(topicType, subscriptionType, runId, objectMapper, entityFactory, administrationClient, properties,
                Clock.systemUTC());
    }

    public BrokerMessageBus(
            Class<T> topicType,
            Class<S> subscriptionType,
            String runId,
            ObjectMapper objectMapper,
            ClientEntityFactory entityFactory,
            BusAdministrationClient administrationClient,
            JobBusProperties properties,
            Clock clock) {
        this.topicType = Objects.requireNonNull(topicType, "topicType must not be null");
        this.subscriptionType = Objects.requireNonNull(subscriptionType, "subscriptionType must not be null");
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        this.runId = runId;
        this.objectMapper = objectMapper;
        this.entities = new ClientEntityCache(entityFactory);
        this.administrationClient = administrationClient;
        this.properties = properties;
        this.clock = clock;
        AtomicInteger threadCounter = new AtomicInteger();
        this.retryEngineExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "jobbus-dead-letter-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void publish(BaseMessage message, T topic, Instant executeOnUtc) {
        validateMessage(message);
        if (topic == null) {
            throw new IllegalArgumentException("topic must not be null");
        }
        ensureOpen();
        send(message, topic, executeOnUtc);
    }

    private void publishContinuation(BaseMessage message, T topic, Instant executeOnUtc) {
        validateMessage(message);
        if (topic == null) {
            throw new IllegalArgumentException("topic must not be null");
        }
        if (disposed) {
            throw new IllegalStateException("Message bus is closed");
        }
        send(message, topic, executeOnUtc);
    }

    private void send(BaseMessage message, T topic, Instant executeOnUtc) {
        Envelope envelope = toEnvelope(message, executeOnUtc);
        log.info("Publishing to {} MessageId: {} Time to Execute: {}",
                topic, message.getId(), executeOnUtc != null ? executeOnUtc : "NOW");
        try {
            TopicSender sender = entities.topicSender(topic.name());
            sender.send(envelope);
        } catch (RuntimeException e) {
            log.error("Failed to publish message {} to {}", message.getId(), topic, e);
            if (e instanceof MessageBusException) {
                throw e;
            }
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
        Objects.requireNonNull(handler, "handler must not be null");
        if (concurrencyLevel < 1) {
            throw new IllegalArgumentException("concurrencyLevel must be >= 1");
        }
        ensureOpen();

        SubscriptionReceiver receiver = entities.subscriptionReceiver(topic.name(), subscription.name());
        if (deadLetterRetrying != null) {
            startDeadLetterRetryEngine(topic, subscription, deadLetterRetrying,
                    cancellation != null ? cancellation : new CancellationSignal());
        }

        String source = topic + ":" + subscription;
        MessageDispatcher<T, M> dispatcher = new MessageDispatcher<>(handler, runId, objectMapper, this::publishContinuation,
                source);
        log.info("Registering {} Subscriber to: {} with concurrency {}", dispatcher.getHandlerName(), source,
                concurrencyLevel);
        receiver.registerMessageHandler(dispatcher::onDelivery, new MessageHandlerOptions(
                concurrencyLevel,
                true,
                context -> log.error("Message handler encountered an exception on {} ({})",
                        context.entityPath(), context.action(), context.exception())));
        return true;
    }

    @Override
    public void setupEntitiesIfNotExist(JobBusProperties.Provisioning configuration) {
        JobBusProperties.Provisioning provisioning = configuration != null
                ? configuration
                : properties.getProvisioning();
        log.warn("Running message bus setup for {} and {}", topicType.getSimpleName(),
                subscriptionType.getSimpleName());

        for (T topic : topicType.getEnumConstants()) {
            String topicName = topic.name();
            if (administrationClient.topicExists(topicName)) {
                log.debug("Topic {} already exists", topicName);
                continue;
            }
            CreateTopicOptions options = provisioning.topicOptions(topicName);
            log.warn("Creating missing topic {} (maxSizeInMegabytes={}, enablePartitioning={})",
                    topicName, options.getMaxSizeInMegabytes(), options.isEnablePartitioning());
            administrationClient.createTopic(options);
        }

        for (S subscription : subscriptionType.getEnumConstants()) {
            String subscriptionName = subscription.name();
            String topicName = EntityNames.owningTopic(subscriptionName);
            if (administrationClient.subscriptionExists(topicName, subscriptionName)) {
                log.debug("Subscription {}:{} already exists", topicName, subscriptionName);
                continue;
            }
            CreateSubscriptionOptions options = provisioning.subscriptionOptions(topicName, subscriptionName);
            log.warn("Creating missing subscription {}:{} (maxDeliveryCount={}, defaultMessageTimeToLive={})",
                    topicName, subscriptionName, options.getMaxDeliveryCount(),
                    options.getDefaultMessageTimeToLive());
            administrationClient.createSubscription(options);

            SubscriptionRule rule = administrationClient.getRule(topicName, subscriptionName,
                    SubscriptionRule.DEFAULT_RULE_NAME);
            SubscriptionRule routing = new SubscriptionRule(rule.name(), true);
            log.info("Setting rule {} of {}:{} to '{}'", routing.name(), topicName, subscriptionName,
                    routing.filterExpression(subscriptionName));
            administrationClient.updateRule(topicName, subscriptionName, routing);
        }
    }

    /**
     * @return the completion of the subscription's dead-letter retry engine, if one was started
     */
    public Optional<CompletableFuture<Void>> retryEngine(S subscription) {
        return Optional.ofNullable(retryEngines.get(subscription));
    }

    public String getRunId() {
        return runId;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.warn("Gracefully disposing message bus");
        shutdownSignal.cancel();

        Duration unregisterTimeout = properties.getShutdown().unregisterTimeout();
        Duration gracePeriod = properties.getShutdown().gracePeriod();
        long deadline = System.nanoTime() + gracePeriod.toNanos();
        List<SubscriptionReceiver> busy = new ArrayList<>();
        for (SubscriptionReceiver receiver : entities.subscriptionReceivers()) {
            log.warn("Stopping listener.. {}", receiver.getKey().path());
            if (!receiver.unregisterMessageHandler(unregisterTimeout)) {
                busy.add(receiver);
            }
        }
        for (SubscriptionReceiver receiver : busy) {
            if (!receiver.awaitInFlight(remaining(deadline))) {
                log.warn("Listener {} still had in-flight messages after {} ms",
                        receiver.getKey().path(), unregisterTimeout.plus(gracePeriod).toMillis());
            }
        }

        retryEngineExecutor.shutdown();
        try {
            if (!retryEngineExecutor.awaitTermination(remaining(deadline).toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Dead-letter retry engines did not stop within {} ms, interrupting", gracePeriod.toMillis());
                retryEngineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            retryEngineExecutor.shutdownNow();
        }

        disposed = true;
        log.warn("Closing connections!");
        entities.closeAll();
        log.warn("All connections gracefully closed");
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    ClientEntityCache entities() {
        return entities;
    }

    private void startDeadLetterRetryEngine(
            T topic, S subscription, RetryPolicy<T> retryPolicy, CancellationSignal cancellation) {
        retryEngines.compute(subscription, (key, existing) -> {
            if (existing != null && !existing.isDone()) {
                log.debug("Dead-letter retry engine for {}:{} is already running", topic, subscription);
                return existing;
            }
            DeadLetterRetryEngine<T> engine = new DeadLetterRetryEngine<>(
                    topic.name(),
                    subscription.name(),
                    retryPolicy,
                    entities.deadLetterReceiver(topic.name(), subscription.name()),
                    entities.topicSender(topic.name()),
                    entities.topicSender(retryPolicy.getPermanentErrorsTopic().name()),
                    runId,
                    CancellationSignal.linked(cancellation, shutdownSignal),
                    properties.getReceiver().deadLetterReceiveTimeout(),
                    clock);
            return CompletableFuture.runAsync(engine, retryEngineExecutor)
                    .whenComplete((ignored, failure) -> {
                        if (failure != null) {
                            log.error("Dead-letter retry engine for {}:{} terminated", topic, subscription, failure);
                        }
                    });
        });
    }

    private Envelope toEnvelope(BaseMessage message, Instant executeOnUtc) {
        String body;
        try {
            body = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new MessageBusException("Failed to serialize message " + message.getId(), e);
        }
        Envelope envelope = new Envelope(message.getId(), body);
        envelope.setPartitionKey(message.getId());
        envelope.setScheduledEnqueueTime(executeOnUtc);
        envelope.getApplicationProperties().put(Envelope.RUN_ID_PROPERTY, message.getRunId());
        return envelope;
    }

    private void validateMessage(BaseMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        if (message.getId() == null || message.getId().isBlank()) {
            throw new IllegalArgumentException("message id must not be blank");
        }
        if (message.getRunId() == null || message.getRunId().isBlank()) {
            throw new IllegalArgumentException("message runId must not be blank");
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Message bus is closed");
        }
    }
}
