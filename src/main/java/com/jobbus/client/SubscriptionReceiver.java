package com.jobbus.client;

import java.time.Duration;

public interface SubscriptionReceiver extends ClientEntity {

    /**
     * Starts pumping the subscription into {@code callback}. A second registration replaces the first.
     */
    void registerMessageHandler(DeliveryCallback callback, MessageHandlerOptions options);

    /**
     * Stops fetching new messages and waits up to {@code inflightWaitTimeout} for running callbacks.
     *
     * @return {@code true} if no callback was still running when this method returned
     */
    boolean unregisterMessageHandler(Duration inflightWaitTimeout);

    /**
     * Waits up to {@code timeout} for callbacks of unregistered or replaced handlers that are still running.
     *
     * @return {@code true} if no such callback is running
     */
    boolean awaitInFlight(Duration timeout);
}
