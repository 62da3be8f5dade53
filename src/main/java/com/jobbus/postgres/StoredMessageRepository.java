package com.jobbus.postgres;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface StoredMessageRepository extends JpaRepository<StoredMessage, UUID> {

    /**
     * Message counters by broker state, fetched in a single query.
     */
    interface StateCounts {
        Long getActiveCount();

        Long getScheduledCount();

        Long getLockedCount();

        Long getDeadLetteredCount();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT m FROM StoredMessage m
            WHERE m.topic = :topic
              AND m.subscription = :subscription
              AND m.deadLetteredAt IS NULL
              AND m.scheduledEnqueueTime <= :now
              AND m.expiresAt > :now
              AND (m.lockedUntil IS NULL OR m.lockedUntil < :now)
            ORDER BY m.scheduledEnqueueTime ASC, m.sequenceNumber ASC
            """)
    List<StoredMessage> findNextDeliverableForUpdate(
            @Param("topic") String topic,
            @Param("subscription") String subscription,
            @Param("now") OffsetDateTime now,
            Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({ @QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2") }) // SKIP LOCKED
    @Query("""
            SELECT m FROM StoredMessage m
            WHERE m.topic = :topic
              AND m.subscription = :subscription
              AND m.deadLetteredAt IS NOT NULL
              AND (m.lockedUntil IS NULL OR m.lockedUntil < :now)
            ORDER BY m.deadLetteredAt ASC, m.sequenceNumber ASC
            """)
    List<StoredMessage> findNextDeadLetteredForUpdate(
            @Param("topic") String topic,
            @Param("subscription") String subscription,
            @Param("now") OffsetDateTime now,
            Pageable pageable);

    @Modifying
    @Transactional
    @Query("DELETE FROM StoredMessage m WHERE m.lockToken = :lockToken AND m.lockedUntil >= :now")
    int deleteLocked(@Param("lockToken") UUID lockToken, @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("""
            UPDATE StoredMessage m
            SET m.lockToken = NULL,
                m.lockedUntil = NULL,
                m.lockedBy = NULL
            WHERE m.lockToken = :lockToken
            """)
    int releaseLock(@Param("lockToken") UUID lockToken);

    @Modifying
    @Transactional
    @Query("""
            UPDATE StoredMessage m
            SET m.deadLetteredAt = :now,
                m.deadLetterReason = :reason,
                m.lockToken = NULL,
                m.lockedUntil = NULL,
                m.lockedBy = NULL
            WHERE m.lockToken = :lockToken
              AND m.deadLetteredAt IS NULL
            """)
    int moveToDeadLetter(
            @Param("lockToken") UUID lockToken,
            @Param("reason") String reason,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Transactional
    @Query("""
            DELETE FROM StoredMessage m
            WHERE m.expiresAt < :now
              AND m.deadLetteredAt IS NULL
              AND (m.lockedUntil IS NULL OR m.lockedUntil < :now)
            """)
    int deleteExpired(@Param("now") OffsetDateTime now);

    long countByTopicAndSubscriptionAndDeadLetteredAtIsNull(String topic, String subscription);

    long countByTopicAndSubscriptionAndDeadLetteredAtIsNotNull(String topic, String subscription);

    @Query("""
            SELECT
              COALESCE(SUM(CASE
                WHEN m.deadLetteredAt IS NULL AND m.scheduledEnqueueTime <= CURRENT_TIMESTAMP
                     AND (m.lockedUntil IS NULL OR m.lockedUntil < CURRENT_TIMESTAMP)
                THEN 1 ELSE 0 END), 0) AS activeCount,
              COALESCE(SUM(CASE
                WHEN m.deadLetteredAt IS NULL AND m.scheduledEnqueueTime > CURRENT_TIMESTAMP
                THEN 1 ELSE 0 END), 0) AS scheduledCount,
              COALESCE(SUM(CASE
                WHEN m.deadLetteredAt IS NULL AND m.lockedUntil >= CURRENT_TIMESTAMP
                THEN 1 ELSE 0 END), 0) AS lockedCount,
              COALESCE(SUM(CASE
                WHEN m.deadLetteredAt IS NOT NULL
                THEN 1 ELSE 0 END), 0) AS deadLetteredCount
            FROM StoredMessage m
            """)
    StateCounts countStates();
}
