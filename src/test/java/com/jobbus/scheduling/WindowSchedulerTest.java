package com.jobbus.scheduling;

import com.jobbus.HandlerResponse;
import com.jobbus.TestTopic;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowSchedulerTest {

    private final WindowScheduler<TestTopic> scheduler = new WindowScheduler<>(TestTopic.WindowReady);

    @Test
    void shouldPublishFirstDailyWindowDueAtItsEndPlusRunDelay() {
        Schedule schedule = Schedule.every(86400);
        schedule.setStartTime(Instant.parse("2024-01-01T00:00:00Z"));
        schedule.setRunDelayUponDueTimeSeconds(30);
        JobDefinition definition = new JobDefinition("job-1", "run-1", "R1", schedule);

        HandlerResponse<TestTopic> response = scheduler.handle(definition);

        assertEquals(200, response.getResultStatusCode());
        HandlerResponse.ContinueWith<TestTopic> continuation = response.getContinueWithResult();
        assertEquals(TestTopic.WindowReady, continuation.topicToPublish());
        assertEquals(Instant.parse("2024-01-02T00:00:30Z"), continuation.executeOnUtc());

        JobWindow window = assertInstanceOf(JobWindow.class, continuation.message());
        assertEquals("00:00:00-24:00:00#R1", window.getId());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), window.getFromTime());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), window.getToTime());
        assertEquals(window.getToTime(), window.getLastRunWindowUpperBound());
        assertEquals("run-1", window.getRunId());
        assertEquals("", window.getName());
    }

    @Test
    void shouldBeDueExactlyAtWindowEndWithoutRunDelay() {
        Schedule schedule = Schedule.every(3600);
        schedule.setStartTime(Instant.parse("2024-01-01T10:00:00Z"));

        HandlerResponse<TestTopic> response = scheduler.handle(new JobDefinition("job-1", "run-1", "R9", schedule));

        assertEquals(Instant.parse("2024-01-01T11:00:00Z"), response.getContinueWithResult().executeOnUtc());
        assertEquals("10:00:00-11:00:00#R9", response.getContinueWithResult().message().getId());
    }

    @Test
    void shouldEndChainForNonPeriodicOrExhaustedSchedules() {
        assertTrue(scheduler.handle(new JobDefinition("job-1", "run-1", "R1", Schedule.once())).isFinal());
        assertTrue(scheduler.handle(new JobDefinition("job-2", "run-1", "R2", null)).isFinal());

        Schedule exhausted = Schedule.every(3600);
        exhausted.setStartTime(Instant.parse("2024-01-01T00:00:00Z"));
        exhausted.setScheduleEndTime(Instant.parse("2024-01-01T00:30:00Z"));
        HandlerResponse<TestTopic> response = scheduler.handle(new JobDefinition("job-3", "run-1", "R3", exhausted));
        assertTrue(response.isFinal());
        assertEquals(200, response.getResultStatusCode());
    }

    @Test
    void shouldProduceContiguousWindowsWhenFedItsOwnOutput() {
        Schedule schedule = Schedule.every(7200);
        schedule.setStartTime(Instant.parse("2024-01-01T00:00:00Z"));
        JobDefinition current = new JobDefinition("job-1", "run-1", "R1", schedule);

        JobWindow previous = null;
        for (int i = 0; i < 24; i++) {
            JobWindow window = (JobWindow) scheduler.handle(current).getContinueWithResult().message();
            if (previous != null) {
                assertEquals(previous.getToTime(), window.getFromTime());
            }
            previous = window;
            current = window;
        }
        assertEquals(Instant.parse("2024-01-03T00:00:00Z"), previous.getToTime());
        assertEquals("22:00:00-24:00:00#R1", previous.getId());
    }

    @Test
    void shouldCarryDefinitionFieldsIntoWindow() {
        Schedule schedule = Schedule.every(3600);
        schedule.setStartTime(Instant.parse("2024-01-01T00:00:00Z"));
        schedule.setForceSuppressWindowValidation(true);
        JobDefinition definition = new JobDefinition("job-1", "run-1", "R1", schedule);
        definition.setEtag("etag-3");
        definition.setStatus("Active");
        definition.setBehaviorMode("Normal");
        definition.setJobDefinitionChangeTime(Instant.parse("2023-12-31T08:00:00Z"));

        JobWindow window = scheduler.nextWindow(definition).orElseThrow();

        assertEquals("R1", window.getRuleId());
        assertEquals("etag-3", window.getEtag());
        assertEquals("Active", window.getStatus());
        assertEquals("Normal", window.getBehaviorMode());
        assertEquals(Instant.parse("2023-12-31T08:00:00Z"), window.getJobDefinitionChangeTime());
        assertTrue(window.isSkipNextWindowValidation());
    }

    @Test
    void shouldFormatMidnightLowerBoundAsZero() {
        assertEquals("00:00:00-01:00:00#R1", JobWindow.formatId(
                Instant.parse("2024-01-02T00:00:00Z"), Instant.parse("2024-01-02T01:00:00Z"), "R1"));
        assertEquals("23:00:00-24:00:00#R1", JobWindow.formatId(
                Instant.parse("2024-01-01T23:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"), "R1"));
    }
}
