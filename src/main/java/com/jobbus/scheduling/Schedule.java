package com.jobbus.scheduling;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * When a job runs. A periodic schedule cuts time into contiguous windows, either of a fixed
 * length ({@code repeatIntervalSeconds}) or between consecutive fire times of a cron expression
 * evaluated in UTC.
 */
public class Schedule {

    private boolean periodicJob;
    private Long repeatIntervalSeconds;
    private String cronExpression;
    private Instant startTime;
    private Instant scheduleEndTime;
    private boolean suspended;
    private Integer runDelayUponDueTimeSeconds;
    private boolean forceSuppressWindowValidation;

    public Schedule() {
    }

    public static Schedule every(long repeatIntervalSeconds) {
        Schedule schedule = new Schedule();
        schedule.setPeriodicJob(true);
        schedule.setRepeatIntervalSeconds(repeatIntervalSeconds);
        return schedule;
    }

    public static Schedule cron(String cronExpression) {
        Schedule schedule = new Schedule();
        schedule.setPeriodicJob(true);
        schedule.setCronExpression(cronExpression);
        return schedule;
    }

    public static Schedule once() {
        return new Schedule();
    }

    /**
     * Computes the window following {@code lastUpperBound}.
     * <p>
     * The window starts at {@code lastUpperBound}, or at {@link #getStartTime()} when no window ran yet.
     * It is empty when the schedule is not periodic, is suspended, has neither interval nor cron
     * expression, or would end after {@link #getScheduleEndTime()}.
     */
    public Optional<TimeRange> getNextScheduleWindowTimeRange(Instant lastUpperBound) {
        if (!periodicJob || suspended) {
            return Optional.empty();
        }
        Instant from = lastUpperBound != null ? lastUpperBound : startTime;
        if (from == null) {
            return Optional.empty();
        }

        Instant to;
        if (cronExpression != null && !cronExpression.isBlank()) {
            ZonedDateTime next = CronExpression.parse(cronExpression).next(from.atZone(ZoneOffset.UTC));
            if (next == null) {
                return Optional.empty();
            }
            to = next.toInstant();
        } else if (repeatIntervalSeconds != null && repeatIntervalSeconds > 0) {
            to = from.plusSeconds(repeatIntervalSeconds);
        } else {
            return Optional.empty();
        }

        if (scheduleEndTime != null && to.isAfter(scheduleEndTime)) {
            return Optional.empty();
        }
        return Optional.of(new TimeRange(from, to));
    }

    public boolean isPeriodicJob() {
        return periodicJob;
    }

    public void setPeriodicJob(boolean periodicJob) {
        this.periodicJob = periodicJob;
    }

    public Long getRepeatIntervalSeconds() {
        return repeatIntervalSeconds;
    }

    public void setRepeatIntervalSeconds(Long repeatIntervalSeconds) {
        this.repeatIntervalSeconds = repeatIntervalSeconds;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        if (cronExpression != null && !cronExpression.isBlank() && !CronExpression.isValidExpression(cronExpression)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpression);
        }
        this.cronExpression = cronExpression;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getScheduleEndTime() {
        return scheduleEndTime;
    }

    public void setScheduleEndTime(Instant scheduleEndTime) {
        this.scheduleEndTime = scheduleEndTime;
    }

    public boolean isSuspended() {
        return suspended;
    }

    public void setSuspended(boolean suspended) {
        this.suspended = suspended;
    }

    public Integer getRunDelayUponDueTimeSeconds() {
        return runDelayUponDueTimeSeconds;
    }

    public void setRunDelayUponDueTimeSeconds(Integer runDelayUponDueTimeSeconds) {
        this.runDelayUponDueTimeSeconds = runDelayUponDueTimeSeconds;
    }

    public boolean isForceSuppressWindowValidation() {
        return forceSuppressWindowValidation;
    }

    public void setForceSuppressWindowValidation(boolean forceSuppressWindowValidation) {
        this.forceSuppressWindowValidation = forceSuppressWindowValidation;
    }
}
