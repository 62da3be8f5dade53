package com.jobbus;

import com.jobbus.postgres.StoredMessageRepository;
import com.jobbus.scheduling.JobDefinition;
import com.jobbus.scheduling.JobWindow;
import com.jobbus.scheduling.Schedule;
import com.jobbus.scheduling.WindowScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(classes = TestApplication.class,
        properties = "jobbus.provisioning.subscriptions[Orders].max-immediate-retries-in-batch=2")
@ActiveProfiles("test")
@Testcontainers
public class JobBusIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("testcontainers.postgresql.host", postgres::getHost);
        registry.add("testcontainers.postgresql.port", postgres::getFirstMappedPort);
        registry.add("testcontainers.postgresql.database", postgres::getDatabaseName);
        registry.add("testcontainers.postgresql.username", postgres::getUsername);
        registry.add("testcontainers.postgresql.password", postgres::getPassword);
    }

    @Autowired
    MessageBusFactory messageBusFactory;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    StoredMessageRepository storedMessageRepository;

    private String runId;
    private BrokerMessageBus<TestTopic, TestSubscription> bus;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM jobbus_messages");
        runId = "it-" + UUID.randomUUID();
        bus = messageBusFactory.create(TestTopic.class, TestSubscription.class, runId);
        bus.setupEntitiesIfNotExist(null);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void shouldCreateBusTablesOnStartup() {
        List<String> tables = jdbcTemplate.queryForList(
                "SELECT table_name FROM information_schema.tables WHERE table_name LIKE 'jobbus_%' ORDER BY table_name",
                String.class);

        assertTrue(tables.containsAll(List.of("jobbus_messages", "jobbus_schema_migrations",
                "jobbus_subscriptions", "jobbus_topics")), "tables: " + tables);
    }

    @Test
    void shouldProvisionEveryEntityIdempotently() {
        bus.setupEntitiesIfNotExist(null);

        Integer topics = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM jobbus_topics", Integer.class);
        Integer subscriptions = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM jobbus_subscriptions", Integer.class);
        assertEquals(TestTopic.values().length, topics);
        assertEquals(TestSubscription.values().length, subscriptions);

        Integer ordersLimit = jdbcTemplate.queryForObject(
                "SELECT max_delivery_count FROM jobbus_subscriptions WHERE name = 'Orders_Billing'", Integer.class);
        Integer windowLimit = jdbcTemplate.queryForObject(
                "SELECT max_delivery_count FROM jobbus_subscriptions WHERE name = 'WindowReady_Recorder'", Integer.class);
        Boolean broadcast = jdbcTemplate.queryForObject(
                "SELECT rule_accept_broadcast FROM jobbus_subscriptions WHERE name = 'WindowReady_Recorder'",
                Boolean.class);
        assertEquals(2, ordersLimit);
        assertEquals(5, windowLimit);
        assertTrue(broadcast);
    }

    @Test
    void shouldFanOutPublishedMessageToEverySubscription() {
        RecordingHandler<OrderMessage> billing = RecordingHandler.succeeding(OrderMessage.class);
        RecordingHandler<OrderMessage> audit = RecordingHandler.succeeding(OrderMessage.class);
        bus.registerSubscriber(TestTopic.Orders, TestSubscription.Orders_Billing, 2, billing, null, null);
        bus.registerSubscriber(TestTopic.Orders, TestSubscription.Orders_Audit, 1, audit, null, null);

        bus.publish(new OrderMessage("order-" + runId, runId, "book"), TestTopic.Orders);

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            assertEquals(1, billing.getInvocations());
            assertEquals(1, audit.getInvocations());
        });
        assertEquals("book", billing.getReceived().get(0).getItem());
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertEquals(0, countMessages("order-" + runId)));
    }

    @Test
    void shouldHoldScheduledMessageUntilDue() throws Exception {
        RecordingHandler<OrderMessage> billing = RecordingHandler.succeeding(OrderMessage.class);
        bus.registerSubscriber(TestTopic.Orders, TestSubscription.Orders_Billing, 1, billing, null, null);

        Instant due = Instant.now().plusSeconds(2);
        bus.publish(new OrderMessage("later-" + runId, runId, "book"), TestTopic.Orders, due);

        Thread.sleep(1000);
        assertEquals(0, billing.getInvocations());
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> assertEquals(1, billing.getInvocations()));
        assertFalse(Instant.now().isBefore(due));
    }

    @Test
    void shouldAcknowledgeMessagesOfAnotherRunWithoutHandling() {
        RecordingHandler<OrderMessage> billing = RecordingHandler.succeeding(OrderMessage.class);
        bus.registerSubscriber(TestTopic.Orders, TestSubscription.Orders_Billing, 1, billing, null, null);

        bus.publish(new OrderMessage("foreign-" + runId, "another-run", "book"), TestTopic.Orders);

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> assertEquals(0, countMessages(
                "foreign-" + runId, "Orders_Billing")));
        assertEquals(0, billing.getInvocations());
    }

    @Test
    void shouldRetryThroughDeadLetterAndForwardToPermanentErrors() {
        RecordingHandler<OrderMessage> billing = RecordingHandler.failing(OrderMessage.class);
        RecordingHandler<OrderMessage> audit = RecordingHandler.succeeding(OrderMessage.class);
        RecordingHandler<OrderMessage> inspector = RecordingHandler.succeeding(OrderMessage.class);
        RetryPolicy<TestTopic> policy = RetryPolicy.exponential(TestTopic.PermanentErrors,
                Duration.ofSeconds(1), Duration.ofSeconds(2), 1);
        bus.registerSubscriber(TestTopic.Orders, TestSubscription.Orders_Billing, 1, billing, policy,
                new CancellationSignal());
        bus.registerSubscriber(TestTopic.Orders, TestSubscription.Orders_Audit, 1, audit, null, null);
        bus.registerSubscriber(TestTopic.PermanentErrors, TestSubscription.PermanentErrors_Inspector, 1, inspector,
                null, null);

        bus.publish(new OrderMessage("poison-" + runId, runId, "book"), TestTopic.Orders);

        await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> assertEquals(1, inspector.getInvocations()));
        assertEquals(4, billing.getInvocations());
        assertEquals(1, audit.getInvocations());
        assertEquals("poison-" + runId, inspector.getReceived().get(0).getId());
        assertEquals("book", inspector.getReceived().get(0).getItem());
        assertFalse(bus.retryEngine(TestSubscription.Orders_Billing).orElseThrow().isDone());
    }

    @Test
    void shouldChainDailyWindowsUntilScheduleEnd() {
        RecordingHandler<JobWindow> recorder = RecordingHandler.succeeding(JobWindow.class);
        bus.registerSubscriber(TestTopic.JobDefinitions, TestSubscription.JobDefinitions_ScheduleFirstRun, 1,
                new WindowScheduler<>(TestTopic.WindowReady), null, null);
        bus.registerSubscriber(TestTopic.WindowReady, TestSubscription.WindowReady_ScheduleNextRun, 1,
                new WindowScheduler<>(TestTopic.WindowReady), null, null);
        bus.registerSubscriber(TestTopic.WindowReady, TestSubscription.WindowReady_Recorder, 1, recorder, null, null);

        Schedule daily = Schedule.every(86400);
        daily.setStartTime(Instant.parse("2024-01-01T00:00:00Z"));
        daily.setScheduleEndTime(Instant.parse("2024-01-04T00:00:00Z"));
        bus.publish(new JobDefinition("job-" + runId, runId, "R1", daily), TestTopic.JobDefinitions);

        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> assertEquals(3, recorder.getInvocations()));
        List<JobWindow> windows = recorder.getReceived().stream()
                .sorted(Comparator.comparing(JobWindow::getFromTime))
                .toList();
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), windows.get(0).getFromTime());
        assertEquals(windows.get(0).getToTime(), windows.get(1).getFromTime());
        assertEquals(windows.get(1).getToTime(), windows.get(2).getFromTime());
        assertEquals(Instant.parse("2024-01-04T00:00:00Z"), windows.get(2).getToTime());
        assertEquals("00:00:00-24:00:00#R1", windows.get(2).getId());
        assertEquals(runId, windows.get(2).getRunId());
    }

    @Test
    void shouldRejectPublishToMissingTopic() {
        jdbcTemplate.update("DELETE FROM jobbus_subscriptions WHERE topic = 'PermanentErrors'");
        jdbcTemplate.update("DELETE FROM jobbus_topics WHERE name = 'PermanentErrors'");
        try {
            assertThrows(MessageBusException.class,
                    () -> bus.publish(new OrderMessage("lost-" + runId, runId, "book"), TestTopic.PermanentErrors));
        } finally {
            bus.setupEntitiesIfNotExist(null);
        }
    }

    @Test
    void shouldKeepLeasedMessagesWhenPurgingExpired() {
        String messageId = "expired-" + runId;
        bus.publish(new OrderMessage(messageId, runId, "book"), TestTopic.Orders);
        jdbcTemplate.update("UPDATE jobbus_messages SET expires_at = now() - interval '1 minute' WHERE message_id = ?",
                messageId);
        jdbcTemplate.update("UPDATE jobbus_messages SET lock_token = ?, locked_until = now() + interval '5 minutes',"
                + " locked_by = 'node-it' WHERE message_id = ? AND subscription = 'Orders_Billing'",
                UUID.randomUUID(), messageId);

        int purged = storedMessageRepository.deleteExpired(OffsetDateTime.now(ZoneOffset.UTC));

        assertEquals(1, purged);
        assertEquals(1, countMessages(messageId, "Orders_Billing"));
        assertEquals(0, countMessages(messageId, "Orders_Audit"));
    }

    private int countMessages(String messageId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM jobbus_messages WHERE message_id = ?", Integer.class, messageId);
        return count == null ? 0 : count;
    }

    private int countMessages(String messageId, String subscription) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM jobbus_messages WHERE message_id = ? AND subscription = ?",
                Integer.class, messageId, subscription);
        return count == null ? 0 : count;
    }
}
