package com.jobbus.config;

import com.jobbus.admin.CreateSubscriptionOptions;
import com.jobbus.admin.CreateTopicOptions;
import com.jobbus.internal.Durations;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@ConfigurationProperties(prefix = "jobbus")
public class JobBusProperties {

    /**
     * Run this process belongs to. Messages published by another run are dropped on delivery.
     */
    private String runId = UUID.randomUUID().toString();
    private final Database database = new Database();
    private final Receiver receiver = new Receiver();
    private final Shutdown shutdown = new Shutdown();
    private final Provisioning provisioning = new Provisioning();
    private final Cleanup cleanup = new Cleanup();

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public Database getDatabase() {
        return database;
    }

    public Receiver getReceiver() {
        return receiver;
    }

    public Shutdown getShutdown() {
        return shutdown;
    }

    public Provisioning getProvisioning() {
        return provisioning;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public static class Database {
        /**
         * Whether to skip automatic creation of the JobBus tables.
         */
        private boolean skipCreate = false;

        /**
         * Prefix applied to every JobBus table and index name.
         */
        private String tablePrefix = "";

        /**
         * Whether a failed schema migration aborts application startup.
         */
        private boolean failOnMigrationError = true;

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Receiver {
        private long pollIntervalInMillis = 500;
        private long lockDurationInSeconds = 30;
        private long deadLetterReceiveTimeoutInMillis = 1000;

        public long getPollIntervalInMillis() {
            return pollIntervalInMillis;
        }

        public void setPollIntervalInMillis(long pollIntervalInMillis) {
            if (pollIntervalInMillis < 1) {
                throw new IllegalArgumentException("poll-interval-in-millis must be >= 1");
            }
            this.pollIntervalInMillis = pollIntervalInMillis;
        }

        public long getLockDurationInSeconds() {
            return lockDurationInSeconds;
        }

        public void setLockDurationInSeconds(long lockDurationInSeconds) {
            if (lockDurationInSeconds < 1) {
                throw new IllegalArgumentException("lock-duration-in-seconds must be >= 1");
            }
            this.lockDurationInSeconds = lockDurationInSeconds;
        }

        public long getDeadLetterReceiveTimeoutInMillis() {
            return deadLetterReceiveTimeoutInMillis;
        }

        public void setDeadLetterReceiveTimeoutInMillis(long deadLetterReceiveTimeoutInMillis) {
            if (deadLetterReceiveTimeoutInMillis < 1) {
                throw new IllegalArgumentException("dead-letter-receive-timeout-in-millis must be >= 1");
            }
            this.deadLetterReceiveTimeoutInMillis = deadLetterReceiveTimeoutInMillis;
        }

        public Duration pollInterval() {
            return Duration.ofMillis(pollIntervalInMillis);
        }

        public Duration lockDuration() {
            return Duration.ofSeconds(lockDurationInSeconds);
        }

        public Duration deadLetterReceiveTimeout() {
            return Duration.ofMillis(deadLetterReceiveTimeoutInMillis);
        }
    }

    public static class Shutdown {
        /**
         * How long closing the bus waits for each receiver's in-flight callbacks.
         */
        private long unregisterTimeoutInMillis = 500;

        /**
         * How long closing the bus waits for in-flight callbacks and retry engines before closing connections.
         */
        private long gracePeriodInMillis = 3500;

        public long getUnregisterTimeoutInMillis() {
            return unregisterTimeoutInMillis;
        }

        public void setUnregisterTimeoutInMillis(long unregisterTimeoutInMillis) {
            this.unregisterTimeoutInMillis = Math.max(0, unregisterTimeoutInMillis);
        }

        public long getGracePeriodInMillis() {
            return gracePeriodInMillis;
        }

        public void setGracePeriodInMillis(long gracePeriodInMillis) {
            this.gracePeriodInMillis = Math.max(0, gracePeriodInMillis);
        }

        public Duration unregisterTimeout() {
            return Duration.ofMillis(unregisterTimeoutInMillis);
        }

        public Duration gracePeriod() {
            return Duration.ofMillis(gracePeriodInMillis);
        }
    }

    /**
     * Settings used by {@code setupEntitiesIfNotExist}. Topic entries are keyed by topic name and
     * subscription entries by the name of the topic they belong to.
     */
    public static class Provisioning {
        private Map<String, TopicConfig> topics = new LinkedHashMap<>();
        private Map<String, SubscriptionConfig> subscriptions = new LinkedHashMap<>();

        /**
         * Time-to-live of messages in newly created subscriptions. ISO-8601 or shorthand such as "36h" or "2d".
         */
        private String defaultMessageTimeToLive = "2d";

        public Map<String, TopicConfig> getTopics() {
            return topics;
        }

        public void setTopics(Map<String, TopicConfig> topics) {
            this.topics = topics;
        }

        public Map<String, SubscriptionConfig> getSubscriptions() {
            return subscriptions;
        }

        public void setSubscriptions(Map<String, SubscriptionConfig> subscriptions) {
            this.subscriptions = subscriptions;
        }

        public String getDefaultMessageTimeToLive() {
            return defaultMessageTimeToLive;
        }

        public void setDefaultMessageTimeToLive(String defaultMessageTimeToLive) {
            this.defaultMessageTimeToLive = defaultMessageTimeToLive;
        }

        public CreateTopicOptions topicOptions(String topicName) {
            TopicConfig config = lookup(topics, topicName, new TopicConfig());
            return new CreateTopicOptions(topicName)
                    .setMaxSizeInMegabytes(config.getMaxSizeInMegabytes())
                    .setEnablePartitioning(config.isEnablePartitioning());
        }

        public CreateSubscriptionOptions subscriptionOptions(String topicName, String subscriptionName) {
            SubscriptionConfig config = lookup(subscriptions, topicName, new SubscriptionConfig());
            return new CreateSubscriptionOptions(topicName, subscriptionName)
                    .setMaxDeliveryCount(config.getMaxImmediateRetriesInBatch())
                    .setDefaultMessageTimeToLive(Durations.parse(defaultMessageTimeToLive));
        }

        private static <V> V lookup(Map<String, V> entries, String name, V fallback) {
            V exact = entries.get(name);
            if (exact != null) {
                return exact;
            }
            for (Map.Entry<String, V> entry : entries.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    return entry.getValue();
                }
            }
            return fallback;
        }

        public static class TopicConfig {
            private int maxSizeInMegabytes = CreateTopicOptions.DEFAULT_MAX_SIZE_IN_MEGABYTES;
            private boolean enablePartitioning = false;

            public int getMaxSizeInMegabytes() {
                return maxSizeInMegabytes;
            }

            public void setMaxSizeInMegabytes(int maxSizeInMegabytes) {
                this.maxSizeInMegabytes = maxSizeInMegabytes;
            }

            public boolean isEnablePartitioning() {
                return enablePartitioning;
            }

            public void setEnablePartitioning(boolean enablePartitioning) {
                this.enablePartitioning = enablePartitioning;
            }
        }

        public static class SubscriptionConfig {
            /**
             * Deliveries attempted before a message is dead-lettered.
             */
            private int maxImmediateRetriesInBatch = CreateSubscriptionOptions.DEFAULT_MAX_DELIVERY_COUNT;

            public int getMaxImmediateRetriesInBatch() {
                return maxImmediateRetriesInBatch;
            }

            public void setMaxImmediateRetriesInBatch(int maxImmediateRetriesInBatch) {
                this.maxImmediateRetriesInBatch = maxImmediateRetriesInBatch;
            }
        }
    }

    public static class Cleanup {
        /**
         * Whether expired messages are purged hourly.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
