package com.jobbus;

import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Processes messages delivered to one subscription.
 *
 * @param <T> topic enum of the bus, used for continuations
 * @param <M> the message type this handler expects
 */
public interface MessageHandler<T extends Enum<T>, M extends BaseMessage> {

    Map<Class<?>, Class<?>> MESSAGE_CLASS_CACHE = new ConcurrentHashMap<>();

    /**
     * Handles a single message.
     * Any exception thrown here fails the delivery; the broker redelivers it and eventually
     * moves it to the subscription's dead-letter path.
     *
     * @param message the decoded message
     * @return a terminal response or a continuation
     * @throws Exception if processing fails
     */
    HandlerResponse<T> handle(M message) throws Exception;

    /**
     * Returns the class message bodies are decoded into. By default, this is inferred from
     * {@code MessageHandler<T, M>}.
     */
    @SuppressWarnings("unchecked")
    default Class<M> getMessageClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        Class<?> messageClass = MESSAGE_CLASS_CACHE.computeIfAbsent(targetClass, MessageHandler::inferMessageClass);
        return (Class<M>) messageClass;
    }

    private static Class<?> inferMessageClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass)
                .as(MessageHandler.class)
                .getGeneric(1)
                .resolve();
        if (resolved == null) {
            throw new IllegalStateException("MessageHandler " + targetClass.getName()
                    + " message type cannot be inferred. Specify a concrete generic type or override getMessageClass().");
        }
        return resolved;
    }
}
