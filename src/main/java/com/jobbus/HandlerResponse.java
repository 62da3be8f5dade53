package com.jobbus;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of a single handler invocation: a status code and at most one continuation.
 * <p>
 * A response without a continuation is terminal. A continuation asks the dispatcher to publish
 * {@code message} to {@code topicToPublish}, optionally not before {@code executeOnUtc}, before the
 * current delivery is acknowledged.
 *
 * @param <T> topic enum of the bus
 */
public final class HandlerResponse<T extends Enum<T>> {

    public static final int OK = 200;

    private final int resultStatusCode;
    private final ContinueWith<T> continueWithResult;

    private HandlerResponse(int resultStatusCode, ContinueWith<T> continueWithResult) {
        this.resultStatusCode = resultStatusCode;
        this.continueWithResult = continueWithResult;
    }

    public static <T extends Enum<T>> HandlerResponse<T> finalOk() {
        return new HandlerResponse<>(OK, null);
    }

    public static <T extends Enum<T>> HandlerResponse<T> finalFailure(int resultStatusCode) {
        return new HandlerResponse<>(resultStatusCode, null);
    }

    public static <T extends Enum<T>> HandlerResponse<T> continueWith(BaseMessage message, T topicToPublish) {
        return continueWith(message, topicToPublish, null);
    }

    public static <T extends Enum<T>> HandlerResponse<T> continueWith(
            BaseMessage message, T topicToPublish, Instant executeOnUtc) {
        return new HandlerResponse<>(OK, new ContinueWith<>(message, topicToPublish, executeOnUtc));
    }

    public int getResultStatusCode() {
        return resultStatusCode;
    }

    /**
     * @return the continuation, or {@code null} when this response is terminal
     */
    public ContinueWith<T> getContinueWithResult() {
        return continueWithResult;
    }

    public boolean isFinal() {
        return continueWithResult == null;
    }

    @Override
    public String toString() {
        return "HandlerResponse{status=" + resultStatusCode + ", continueWith=" + continueWithResult + "}";
    }

    public record ContinueWith<T extends Enum<T>>(BaseMessage message, T topicToPublish, Instant executeOnUtc) {

        public ContinueWith {
            Objects.requireNonNull(message, "continuation message must not be null");
            Objects.requireNonNull(topicToPublish, "continuation topic must not be null");
            if (message.getId() == null || message.getId().isBlank()) {
                throw new IllegalArgumentException("continuation message must carry an id");
            }
        }
    }
}
