package com.fintech.permits.repository;

import com.fintech.permits.entity.WebhookEvent;
import com.fintech.permits.entity.WebhookProcessingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, Long> {

    Optional<WebhookEvent> findByEventId(String eventId);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE WebhookEvent w SET w.processingStatus = :status, w.processedAt = :now, " +
            "w.lastError = :error, w.retryCount = w.retryCount + :retryIncrement " +
            "WHERE w.eventId = :eventId")
    int updateOutcome(@Param("eventId") String eventId,
                      @Param("status") WebhookProcessingStatus status,
                      @Param("error") String error,
                      @Param("retryIncrement") int retryIncrement,
                      @Param("now") LocalDateTime now);

    /**
     * Hand a failed event back to a redelivery. Only one concurrent caller gets 1.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE WebhookEvent w SET w.processingStatus = :pending " +
            "WHERE w.eventId = :eventId AND w.processingStatus = :failed")
    int reclaim(@Param("eventId") String eventId,
                @Param("failed") WebhookProcessingStatus failed,
                @Param("pending") WebhookProcessingStatus pending);

    @Modifying
    @Transactional
    @Query("DELETE FROM WebhookEvent w WHERE w.processingStatus = :status AND w.processedAt < :before")
    int deleteByStatusProcessedBefore(@Param("status") WebhookProcessingStatus status,
                                      @Param("before") LocalDateTime before);
}
