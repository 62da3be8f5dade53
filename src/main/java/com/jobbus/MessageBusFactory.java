package com.jobbus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobbus.admin.BusAdministrationClient;
import com.jobbus.config.JobBusProperties;
import com.jobbus.postgres.MessageStore;
import com.jobbus.postgres.PostgresClientEntityFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Builds {@link BrokerMessageBus} instances backed by the application's PostgreSQL database.
 * The caller owns the returned bus and must close it.
 */
@Service
public class MessageBusFactory {

    private final MessageStore messageStore;
    private final BusAdministrationClient administrationClient;
    private final ObjectMapper objectMapper;
    private final JobBusProperties properties;

    public MessageBusFactory(
            MessageStore messageStore,
            BusAdministrationClient administrationClient,
            @Qualifier("jobbusObjectMapper") ObjectMapper objectMapper,
            JobBusProperties properties) {
        this.messageStore = messageStore;
        this.administrationClient = administrationClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public <T extends Enum<T>, S extends Enum<S>> BrokerMessageBus<T, S> create(
            Class<T> topicType, Class<S> subscriptionType) {
        return create(topicType, subscriptionType, properties.getRunId());
    }

    public <T extends Enum<T>, S extends Enum<S>> BrokerMessageBus<T, S> create(
            Class<T> topicType, Class<S> subscriptionType, String runId) {
        return new BrokerMessageBus<>(
                topicType,
                subscriptionType,
                runId,
                objectMapper,
                new PostgresClientEntityFactory(messageStore, properties.getReceiver()),
                administrationClient,
                properties);
    }
}
