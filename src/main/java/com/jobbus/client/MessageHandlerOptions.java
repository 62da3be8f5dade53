package com.jobbus.client;

import java.util.Objects;
import java.util.function.Consumer;

public final class MessageHandlerOptions {

    private final int maxConcurrentCalls;
    private final boolean autoComplete;
    private final Consumer<ExceptionReceivedContext> exceptionReceivedHandler;

    public MessageHandlerOptions(
            int maxConcurrentCalls,
            boolean autoComplete,
            Consumer<ExceptionReceivedContext> exceptionReceivedHandler) {
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("maxConcurrentCalls must be >= 1");
        }
        this.maxConcurrentCalls = maxConcurrentCalls;
        this.autoComplete = autoComplete;
        this.exceptionReceivedHandler = Objects.requireNonNull(exceptionReceivedHandler,
                "exceptionReceivedHandler must not be null");
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public boolean isAutoComplete() {
        return autoComplete;
    }

    public Consumer<ExceptionReceivedContext> getExceptionReceivedHandler() {
        return exceptionReceivedHandler;
    }
}
