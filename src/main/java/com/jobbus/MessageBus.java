package com.jobbus;

import com.jobbus.config.JobBusProperties;

import java.time.Instant;

/**
 * Publish/subscribe contract shared by the PostgreSQL broker and the in-process emulator.
 * <p>
 * Topics and subscriptions are closed enums. A subscription constant is named
 * {@code <Topic>_<Subscription>}; the part before the first underscore names the topic it belongs to.
 *
 * @param <T> topic enum
 * @param <S> subscription enum
 */
public interface MessageBus<T extends Enum<T>, S extends Enum<S>> extends AutoCloseable {

    default void publish(BaseMessage message, T topic) {
        publish(message, topic, null);
    }

    /**
     * Publishes {@code message} to {@code topic}.
     *
     * @param executeOnUtc earliest delivery time; {@code null} or a past instant means immediately
     * @throws MessageBusException if the broker rejected the message
     */
    void publish(BaseMessage message, T topic, Instant executeOnUtc);

    /**
     * Binds {@code handler} to {@code subscription} with at most {@code concurrencyLevel} concurrent
     * invocations. Registering the same subscription again replaces the previous binding.
     *
     * @param deadLetterRetrying when not {@code null}, starts the dead-letter retry engine for the subscription
     * @param cancellation stops the retry engine when cancelled
     * @return {@code true} once the handler is bound
     */
    <M extends BaseMessage> boolean registerSubscriber(
            T topic,
            S subscription,
            int concurrencyLevel,
            MessageHandler<T, M> handler,
            RetryPolicy<T> deadLetterRetrying,
            CancellationSignal cancellation);

    /**
     * Creates every topic and subscription of the enums that does not exist yet.
     */
    void setupEntitiesIfNotExist(JobBusProperties.Provisioning configuration);

    /**
     * Stops delivery, waits a bounded time for in-flight work and releases every broker handle.
     * Calling it more than once has no further effect.
     */
    @Override
    void close();
}
