package com.jobbus.client;

import java.time.Duration;

public interface DeadLetterReceiver extends ClientEntity {

    /**
     * Leases the next dead-lettered message.
     *
     * @return the message, or {@code null} if none arrived within {@code maxWaitTime}
     */
    Envelope receive(Duration maxWaitTime) throws InterruptedException;

    /**
     * Removes a leased message from the dead-letter path.
     */
    void complete(String lockToken);
}
