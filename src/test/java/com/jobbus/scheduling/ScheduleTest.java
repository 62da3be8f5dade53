package com.jobbus.scheduling;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void shouldStartFirstWindowAtStartTime() {
        Schedule schedule = Schedule.every(3600);
        schedule.setStartTime(START);

        Optional<TimeRange> window = schedule.getNextScheduleWindowTimeRange(null);

        assertEquals(Optional.of(new TimeRange(START, START.plusSeconds(3600))), window);
    }

    @Test
    void shouldContinueFromLastUpperBound() {
        Schedule schedule = Schedule.every(900);
        schedule.setStartTime(START);
        Instant lastUpperBound = Instant.parse("2024-01-01T05:15:00Z");

        TimeRange window = schedule.getNextScheduleWindowTimeRange(lastUpperBound).orElseThrow();

        assertEquals(lastUpperBound, window.from());
        assertEquals(Instant.parse("2024-01-01T05:30:00Z"), window.to());
    }

    @Test
    void shouldUseConsecutiveCronFireTimesInUtc() {
        Schedule schedule = Schedule.cron("0 0 2 * * *");
        schedule.setStartTime(Instant.parse("2024-03-10T02:00:00Z"));

        TimeRange first = schedule.getNextScheduleWindowTimeRange(null).orElseThrow();
        TimeRange second = schedule.getNextScheduleWindowTimeRange(first.to()).orElseThrow();

        assertEquals(Instant.parse("2024-03-11T02:00:00Z"), first.to());
        assertEquals(first.to(), second.from());
        assertEquals(Instant.parse("2024-03-12T02:00:00Z"), second.to());
    }

    @Test
    void shouldHaveNoWindowWhenNotPeriodicSuspendedOrUnanchored() {
        Schedule once = Schedule.once();
        once.setStartTime(START);
        assertTrue(once.getNextScheduleWindowTimeRange(null).isEmpty());

        Schedule suspended = Schedule.every(60);
        suspended.setStartTime(START);
        suspended.setSuspended(true);
        assertTrue(suspended.getNextScheduleWindowTimeRange(null).isEmpty());

        Schedule unanchored = Schedule.every(60);
        assertTrue(unanchored.getNextScheduleWindowTimeRange(null).isEmpty());

        Schedule noInterval = new Schedule();
        noInterval.setPeriodicJob(true);
        noInterval.setStartTime(START);
        assertTrue(noInterval.getNextScheduleWindowTimeRange(null).isEmpty());
    }

    @Test
    void shouldStopAtScheduleEndTime() {
        Schedule schedule = Schedule.every(86400);
        schedule.setStartTime(START);
        schedule.setScheduleEndTime(Instant.parse("2024-01-02T12:00:00Z"));

        TimeRange first = schedule.getNextScheduleWindowTimeRange(null).orElseThrow();

        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), first.to());
        assertTrue(schedule.getNextScheduleWindowTimeRange(first.to()).isEmpty());
    }

    @Test
    void shouldRejectInvalidCronExpression() {
        assertThrows(IllegalArgumentException.class, () -> Schedule.cron("every tuesday"));
    }
}
