package com.jobbus.postgres;

import com.jobbus.MessageBusException;
import com.jobbus.admin.BusAdministrationClient;
import com.jobbus.admin.CreateSubscriptionOptions;
import com.jobbus.admin.CreateTopicOptions;
import com.jobbus.admin.SubscriptionRule;
import com.jobbus.config.JobBusProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Provisioning over the {@code jobbus_topics} and {@code jobbus_subscriptions} tables.
 * Creation is idempotent: a concurrent creator winning the race is not an error.
 */
@Component
public class PostgresBusAdministrationClient implements BusAdministrationClient {

    private static final Logger log = LoggerFactory.getLogger(PostgresBusAdministrationClient.class);

    private final JdbcTemplate jdbcTemplate;
    private final BusTables tables;

    public PostgresBusAdministrationClient(JdbcTemplate jdbcTemplate, JobBusProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.tables = BusTables.from(properties);
    }

    @Override
    public boolean topicExists(String topicName) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + tables.topics() + " WHERE name = ?", Integer.class, topicName);
        return count != null && count > 0;
    }

    @Override
    public void createTopic(CreateTopicOptions options) {
        int created = jdbcTemplate.update(
                "INSERT INTO " + tables.topics() + " (name, max_size_in_megabytes, enable_partitioning) "
                        + "VALUES (?, ?, ?) ON CONFLICT (name) DO NOTHING",
                options.getName(), options.getMaxSizeInMegabytes(), options.isEnablePartitioning());
        if (created == 0) {
            log.debug("Topic {} was created concurrently", options.getName());
        }
    }

    @Override
    public boolean subscriptionExists(String topicName, String subscriptionName) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + tables.subscriptions() + " WHERE topic = ? AND name = ?",
                Integer.class, topicName, subscriptionName);
        return count != null && count > 0;
    }

    @Override
    public void createSubscription(CreateSubscriptionOptions options) {
        if (!topicExists(options.getTopicName())) {
            throw new MessageBusException("Cannot create subscription " + options.getSubscriptionName()
                    + ": topic '" + options.getTopicName() + "' does not exist");
        }
        SubscriptionRule rule = SubscriptionRule.broadcastOrAddressed();
        int created = jdbcTemplate.update(
                "INSERT INTO " + tables.subscriptions()
                        + " (topic, name, max_delivery_count, default_message_ttl_seconds, rule_name, rule_accept_broadcast) "
                        + "VALUES (?, ?, ?, ?, ?, ?) ON CONFLICT (topic, name) DO NOTHING",
                options.getTopicName(),
                options.getSubscriptionName(),
                options.getMaxDeliveryCount(),
                options.getDefaultMessageTimeToLive().toSeconds(),
                rule.name(),
                rule.acceptBroadcast());
        if (created == 0) {
            log.debug("Subscription {}:{} was created concurrently", options.getTopicName(),
                    options.getSubscriptionName());
        }
    }

    @Override
    public SubscriptionRule getRule(String topicName, String subscriptionName, String ruleName) {
        List<SubscriptionRule> rules = jdbcTemplate.query(
                "SELECT rule_name, rule_accept_broadcast FROM " + tables.subscriptions()
                        + " WHERE topic = ? AND name = ? AND rule_name = ?",
                (rs, rowNum) -> new SubscriptionRule(rs.getString("rule_name"), rs.getBoolean("rule_accept_broadcast")),
                topicName, subscriptionName, ruleName);
        if (rules.isEmpty()) {
            throw new MessageBusException("Rule " + ruleName + " of subscription " + topicName + ":"
                    + subscriptionName + " does not exist");
        }
        return rules.get(0);
    }

    @Override
    public void updateRule(String topicName, String subscriptionName, SubscriptionRule rule) {
        int updated = jdbcTemplate.update(
                "UPDATE " + tables.subscriptions() + " SET rule_name = ?, rule_accept_broadcast = ? "
                        + "WHERE topic = ? AND name = ?",
                rule.name(), rule.acceptBroadcast(), topicName, subscriptionName);
        if (updated == 0) {
            throw new MessageBusException("Subscription " + topicName + ":" + subscriptionName + " does not exist");
        }
    }
}
