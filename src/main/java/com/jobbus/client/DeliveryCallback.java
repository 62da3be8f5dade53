package com.jobbus.client;

@FunctionalInterface
public interface DeliveryCallback {

    /**
     * Returning normally completes the delivery when auto-complete is on; throwing abandons it.
     */
    void onMessage(Envelope envelope) throws Exception;
}
