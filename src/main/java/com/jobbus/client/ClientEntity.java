package com.jobbus.client;

/**
 * A long-lived broker handle owned by exactly one bus.
 */
public interface ClientEntity extends AutoCloseable {

    EntityKey getKey();

    boolean isClosed();

    @Override
    void close();
}
