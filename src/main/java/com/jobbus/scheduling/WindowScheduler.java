package com.jobbus.scheduling;

import com.jobbus.HandlerResponse;
import com.jobbus.MessageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps a recurring job running: for each job definition (or completed window) it receives, it
 * publishes the next {@link JobWindow} to the window-ready topic, due when the window closes plus
 * the schedule's run delay. Non-periodic and exhausted schedules end the chain.
 *
 * @param <T> topic enum of the bus
 */
public class WindowScheduler<T extends Enum<T>> implements MessageHandler<T, JobDefinition> {

    private static final Logger log = LoggerFactory.getLogger(WindowScheduler.class);

    private final T windowReadyTopic;

    public WindowScheduler(T windowReadyTopic) {
        this.windowReadyTopic = Objects.requireNonNull(windowReadyTopic, "windowReadyTopic must not be null");
    }

    @Override
    public HandlerResponse<T> handle(JobDefinition definition) {
        Schedule schedule = definition.getSchedule();
        boolean periodic = schedule != null && schedule.isPeriodicJob();
        log.info("Handling JobDefinition {} (rule {}), should reschedule for later: {}",
                definition.getId(), definition.getRuleId(), periodic);
        if (!periodic) {
            return HandlerResponse.finalOk();
        }

        Optional<JobWindow> next = nextWindow(definition);
        if (next.isEmpty()) {
            log.info("Schedule of rule {} has no window after {}", definition.getRuleId(),
                    definition.getLastRunWindowUpperBound());
            return HandlerResponse.finalOk();
        }

        JobWindow window = next.get();
        Instant executeOnUtc = window.getToTime().plus(runDelay(schedule));
        log.info("Scheduling next window {}: {} -> {}, executed on {}",
                window.getId(), window.getFromTime(), window.getToTime(), executeOnUtc);
        return HandlerResponse.continueWith(window, windowReadyTopic, executeOnUtc);
    }

    @Override
    public Class<JobDefinition> getMessageClass() {
        return JobDefinition.class;
    }

    public Optional<JobWindow> nextWindow(JobDefinition definition) {
        if (definition.getSchedule() == null) {
            return Optional.empty();
        }
        return definition.getSchedule()
                .getNextScheduleWindowTimeRange(definition.getLastRunWindowUpperBound())
                .map(range -> JobWindow.of(definition, range));
    }

    private static Duration runDelay(Schedule schedule) {
        Integer seconds = schedule.getRunDelayUponDueTimeSeconds();
        return seconds == null ? Duration.ZERO : Duration.ofSeconds(seconds);
    }
}
