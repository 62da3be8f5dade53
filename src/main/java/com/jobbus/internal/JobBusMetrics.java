package com.jobbus.internal;

import com.jobbus.postgres.StoredMessageRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class JobBusMetrics {

    private static final Logger log = LoggerFactory.getLogger(JobBusMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final StoredMessageRepository repository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile StateSnapshot cachedSnapshot = StateSnapshot.empty();
    private volatile long snapshotCapturedAtNanos = 0L;

    public JobBusMetrics(StoredMessageRepository repository, MeterRegistry meterRegistry) {
        this.repository = repository;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering JobBus gauges...");

        for (State state : State.values()) {
            Gauge.builder("jobbus.messages.count", this, metrics -> metrics.countFor(state))
                    .description("Number of JobBus messages by broker state")
                    .tag("state", state.name())
                    .register(meterRegistry);
        }

        Gauge.builder("jobbus.messages.total", this, JobBusMetrics::totalCount)
                .description("Total number of JobBus messages in the database")
                .register(meterRegistry);
    }

    private double countFor(State state) {
        StateSnapshot snapshot = getSnapshot();
        return switch (state) {
            case ACTIVE -> snapshot.activeCount();
            case SCHEDULED -> snapshot.scheduledCount();
            case LOCKED -> snapshot.lockedCount();
            case DEAD_LETTERED -> snapshot.deadLetteredCount();
        };
    }

    private double totalCount() {
        StateSnapshot snapshot = getSnapshot();
        return snapshot.activeCount() + snapshot.scheduledCount() + snapshot.lockedCount()
                + snapshot.deadLetteredCount();
    }

    private StateSnapshot getSnapshot() {
        long now = System.nanoTime();
        if (now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            return cachedSnapshot;
        }
    }

    private StateSnapshot loadSnapshot() {
        try {
            StoredMessageRepository.StateCounts counts = repository.countStates();
            return new StateSnapshot(
                    countOrZero(counts.getActiveCount()),
                    countOrZero(counts.getScheduledCount()),
                    countOrZero(counts.getLockedCount()),
                    countOrZero(counts.getDeadLetteredCount()));
        } catch (Exception e) {
            log.trace("Failed to query message state counts for metrics: {}", e.getMessage());
            return StateSnapshot.empty();
        }
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private enum State {
        ACTIVE,
        SCHEDULED,
        LOCKED,
        DEAD_LETTERED
    }

    private record StateSnapshot(long activeCount, long scheduledCount, long lockedCount, long deadLetteredCount) {
        private static StateSnapshot empty() {
            return new StateSnapshot(0, 0, 0, 0);
        }
    }
}
