package com.jobbus.internal;

import com.jobbus.postgres.StoredMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Purges messages whose time-to-live elapsed before they were delivered. Dead-lettered messages are kept.
 */
@Component
@ConditionalOnProperty(prefix = "jobbus.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExpiredMessageCleaner {

    private static final Logger log = LoggerFactory.getLogger(ExpiredMessageCleaner.class);

    private final StoredMessageRepository repository;

    public ExpiredMessageCleaner(StoredMessageRepository repository) {
        this.repository = repository;
    }

    @Scheduled(fixedDelay = 3600000, initialDelay = 60000)
    public void cleanup() {
        log.debug("Running JobBus expired message cleanup...");
        try {
            int purged = repository.deleteExpired(OffsetDateTime.now(ZoneOffset.UTC));
            if (purged > 0) {
                log.info("Purged {} expired messages", purged);
            }
        } catch (Exception e) {
            log.error("Failed to purge expired messages: {}", e.getMessage(), e);
        }
    }
}
