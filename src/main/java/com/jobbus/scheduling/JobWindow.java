package com.jobbus.scheduling;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * One concrete run of a {@link JobDefinition} over {@code [fromTime, toTime)}.
 * <p>
 * Its id is {@code "HH:mm:ss-HH:mm:ss#ruleId"} in UTC; a window ending exactly at midnight shows its
 * upper bound as {@code 24:00:00}.
 */
public class JobWindow extends JobDefinition {

    private static final DateTimeFormatter WINDOW_TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final String END_OF_DAY = "24:00:00";

    private Instant fromTime;
    private Instant toTime;
    private boolean skipNextWindowValidation;

    public JobWindow() {
    }

    /**
     * Builds the window that follows {@code definition}, carrying over its identity and configuration.
     */
    public static JobWindow of(JobDefinition definition, TimeRange range) {
        JobWindow window = new JobWindow();
        window.setId(formatId(range.from(), range.to(), definition.getRuleId()));
        window.setRunId(definition.getRunId());
        window.setName("");
        window.setRuleId(definition.getRuleId());
        window.setSchedule(definition.getSchedule());
        window.setFromTime(range.from());
        window.setToTime(range.to());
        window.setEtag(definition.getEtag());
        window.setLastRunWindowUpperBound(range.to());
        window.setJobDefinitionChangeTime(definition.getJobDefinitionChangeTime());
        window.setStatus(definition.getStatus());
        window.setBehaviorMode(definition.getBehaviorMode());
        window.setSkipNextWindowValidation(definition.getSchedule() != null
                && definition.getSchedule().isForceSuppressWindowValidation());
        return window;
    }

    public static String formatId(Instant from, Instant to, String ruleId) {
        String upper = to.isAfter(from) && LocalTime.MIDNIGHT.equals(to.atOffset(ZoneOffset.UTC).toLocalTime())
                ? END_OF_DAY
                : WINDOW_TIME.format(to);
        return WINDOW_TIME.format(from) + "-" + upper + "#" + ruleId;
    }

    public Instant getFromTime() {
        return fromTime;
    }

    public void setFromTime(Instant fromTime) {
        this.fromTime = fromTime;
    }

    public Instant getToTime() {
        return toTime;
    }

    public void setToTime(Instant toTime) {
        this.toTime = toTime;
    }

    public boolean isSkipNextWindowValidation() {
        return skipNextWindowValidation;
    }

    public void setSkipNextWindowValidation(boolean skipNextWindowValidation) {
        this.skipNextWindowValidation = skipNextWindowValidation;
    }
}
