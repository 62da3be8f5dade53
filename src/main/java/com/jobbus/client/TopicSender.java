package com.jobbus.client;

public interface TopicSender extends ClientEntity {

    /**
     * Hands the envelope to the broker. Returns once the broker has accepted it.
     */
    void send(Envelope envelope);
}
