package com.jobbus.postgres;

import com.jobbus.ExponentialBackoff;
import com.jobbus.client.DeliveryCallback;
import com.jobbus.client.EntityKey;
import com.jobbus.client.Envelope;
import com.jobbus.client.ExceptionReceivedContext;
import com.jobbus.client.MessageHandlerOptions;
import com.jobbus.client.SubscriptionReceiver;
import com.jobbus.config.JobBusProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pumps one subscription into a callback.
 * <p>
 * A single poller thread leases at most as many messages as there are free permits, so no more than
 * {@code maxConcurrentCalls} callbacks ever run at once. A replacement handler starts leasing only once
 * the callbacks of the handlers it replaced have returned. A callback that returns completes its message;
 * one that throws releases it for redelivery, or dead-letters it once the subscription's delivery
 * limit is reached.
 */
public class PostgresSubscriptionReceiver implements SubscriptionReceiver {

    private static final Logger log = LoggerFactory.getLogger(PostgresSubscriptionReceiver.class);
    private static final ExponentialBackoff POLL_FAILURE_BACKOFF =
            new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofMinutes(5), 2.0d);

    private final EntityKey key;
    private final String topicName;
    private final String subscriptionName;
    private final MessageStore messageStore;
    private final JobBusProperties.Receiver settings;
    private final String nodeId;
    private final Object registrationMonitor = new Object();

    private volatile Pump pump;
    private volatile Pump draining;
    private volatile boolean closed;

    public PostgresSubscriptionReceiver(
            String topicName,
            String subscriptionName,
            MessageStore messageStore,
            JobBusProperties.Receiver settings,
            String nodeId) {
        this.key = EntityKey.subscriptionReceiver(topicName, subscriptionName);
        this.topicName = topicName;
        this.subscriptionName = subscriptionName;
        this.messageStore = messageStore;
        this.settings = settings;
        this.nodeId = nodeId;
    }

    @Override
    public void registerMessageHandler(DeliveryCallback callback, MessageHandlerOptions options) {
        synchronized (registrationMonitor) {
            if (closed) {
                throw new IllegalStateException("Receiver " + key.path() + " is closed");
            }
            int maxDeliveryCount = messageStore.maxDeliveryCount(topicName, subscriptionName);
            List<Pump> predecessors = new ArrayList<>();
            Pump previous = pump;
            if (previous == null) {
                previous = draining;
            } else {
                log.info("Replacing message handler on {}", key.path());
                previous.stop(Duration.ZERO);
            }
            if (previous != null) {
                predecessors.addAll(previous.pendingPredecessors());
                predecessors.add(previous);
            }
            Pump next = new Pump(callback, options, maxDeliveryCount, predecessors);
            pump = next;
            draining = null;
            next.start();
            log.info("Receiver {} on {} started with {} concurrent call(s), max delivery count {}",
                    nodeId, key.path(), options.getMaxConcurrentCalls(), maxDeliveryCount);
        }
    }

    @Override
    public boolean unregisterMessageHandler(Duration inflightWaitTimeout) {
        Pump current;
        synchronized (registrationMonitor) {
            current = pump;
            pump = null;
            if (current != null) {
                draining = current;
            }
        }
        if (current == null) {
            return awaitInFlight(inflightWaitTimeout);
        }
        return current.stop(inflightWaitTimeout);
    }

    @Override
    public boolean awaitInFlight(Duration timeout) {
        Pump current = draining;
        return current == null || current.awaitDrained(timeout);
    }

    @Override
    public EntityKey getKey() {
        return key;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        unregisterMessageHandler(Duration.ZERO);
    }

    int inFlight() {
        Pump current = pump;
        return current == null ? 0 : current.options.getMaxConcurrentCalls() - current.permits.availablePermits();
    }

    private final class Pump {

        private final DeliveryCallback callback;
        private final MessageHandlerOptions options;
        private final int maxDeliveryCount;
        private final Semaphore permits;
        private final ScheduledExecutorService pollingExecutor;
        private final ThreadPoolExecutor processingExecutor;
        private final List<Pump> predecessors;
        private volatile boolean stopped;
        private int consecutivePollFailures;
        private long pausedUntilNanos;

        private Pump(DeliveryCallback callback, MessageHandlerOptions options, int maxDeliveryCount,
                List<Pump> predecessors) {
            this.callback = callback;
            this.predecessors = predecessors;
            this.options = options;
            this.maxDeliveryCount = maxDeliveryCount;
            int workers = options.getMaxConcurrentCalls();
            this.permits = new Semaphore(workers);
            AtomicInteger threadCounter = new AtomicInteger();
            String threadPrefix = "jobbus-" + subscriptionName + "-";
            this.pollingExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, threadPrefix + "poller");
                thread.setDaemon(true);
                return thread;
            });
            this.processingExecutor = new ThreadPoolExecutor(
                    workers,
                    workers,
                    0L,
                    TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(),
                    runnable -> {
                        Thread thread = new Thread(runnable, threadPrefix + threadCounter.incrementAndGet());
                        thread.setDaemon(true);
                        return thread;
                    });
        }

        private void start() {
            long interval = settings.getPollIntervalInMillis();
            pollingExecutor.scheduleWithFixedDelay(this::pollSafely, 0L, interval, TimeUnit.MILLISECONDS);
        }

        private void pollSafely() {
            try {
                poll();
            } catch (RuntimeException e) {
                log.error("Unexpected error while polling {}", key.path(), e);
            }
        }

        private synchronized void poll() {
            if (stopped || System.nanoTime() < pausedUntilNanos) {
                return;
            }
            predecessors.removeIf(Pump::isDrained);
            if (!predecessors.isEmpty()) {
                return;
            }
            int available = permits.availablePermits();
            if (available <= 0) {
                return;
            }

            List<Envelope> leased;
            try {
                leased = messageStore.leaseDeliverable(
                        topicName, subscriptionName, available, maxDeliveryCount, settings.lockDuration(), nodeId);
                consecutivePollFailures = 0;
            } catch (RuntimeException e) {
                Duration backoff = POLL_FAILURE_BACKOFF.delayFor(consecutivePollFailures++);
                pausedUntilNanos = System.nanoTime() + backoff.toNanos();
                log.warn("Polling {} failed, pausing for {} ms", key.path(), backoff.toMillis());
                reportException(e, ExceptionReceivedContext.RECEIVE);
                return;
            }

            for (Envelope envelope : leased) {
                if (stopped || !permits.tryAcquire()) {
                    releaseQuietly(envelope);
                    continue;
                }
                try {
                    processingExecutor.execute(() -> process(envelope));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    releaseQuietly(envelope);
                }
            }
        }

        private void process(Envelope envelope) {
            try {
                log.debug("Delivering message {} (delivery #{}) from {}",
                        envelope.getMessageId(), envelope.getDeliveryCount(), key.path());
                callback.onMessage(envelope);
                if (options.isAutoComplete() && !messageStore.complete(envelope.getLockToken())) {
                    log.warn("Lock of message {} on {} expired before completion; it will be delivered again",
                            envelope.getMessageId(), key.path());
                }
            } catch (Exception e) {
                reportException(e, ExceptionReceivedContext.USER_CALLBACK);
                abandon(envelope);
            } finally {
                permits.release();
            }
        }

        private void abandon(Envelope envelope) {
            try {
                if (envelope.getDeliveryCount() >= maxDeliveryCount) {
                    messageStore.deadLetter(envelope.getLockToken(), MessageStore.MAX_DELIVERY_COUNT_EXCEEDED);
                    log.warn("Message {} on {} failed {} deliveries, moved to dead-letter",
                            envelope.getMessageId(), key.path(), envelope.getDeliveryCount());
                } else {
                    messageStore.release(envelope.getLockToken());
                }
            } catch (RuntimeException e) {
                log.error("Failed to abandon message {} on {}; it will be redelivered once its lock expires",
                        envelope.getMessageId(), key.path(), e);
            }
        }

        private void releaseQuietly(Envelope envelope) {
            try {
                messageStore.release(envelope.getLockToken());
            } catch (RuntimeException e) {
                log.warn("Failed to release message {} on {}; it will be redelivered once its lock expires",
                        envelope.getMessageId(), key.path(), e);
            }
        }

        private void reportException(Exception exception, String action) {
            try {
                options.getExceptionReceivedHandler().accept(
                        new ExceptionReceivedContext(exception, key.path(), action));
            } catch (RuntimeException handlerFailure) {
                log.warn("Exception handler of {} failed", key.path(), handlerFailure);
            }
        }

        private synchronized List<Pump> pendingPredecessors() {
            predecessors.removeIf(Pump::isDrained);
            return new ArrayList<>(predecessors);
        }

        private boolean isDrained() {
            return processingExecutor.isTerminated();
        }

        private boolean stop(Duration inflightWaitTimeout) {
            stopped = true;
            pollingExecutor.shutdownNow();
            processingExecutor.shutdown();
            return awaitDrained(inflightWaitTimeout);
        }

        private boolean awaitDrained(Duration timeout) {
            long deadline = System.nanoTime() + timeout.toNanos();
            try {
                for (Pump predecessor : pendingPredecessors()) {
                    if (!predecessor.processingExecutor.awaitTermination(
                            Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                        return false;
                    }
                }
                return processingExecutor.awaitTermination(
                        Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
