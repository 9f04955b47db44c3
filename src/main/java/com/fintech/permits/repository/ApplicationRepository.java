package com.fintech.permits.repository;

import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.QueueStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for permit applications, including the durable permit job queue
 * stored in the queue_* columns.
 * <p>
 * Queue transitions are conditional UPDATE statements: the affected row count tells
 * the caller whether it won the claim, so several instances can poll the same table.
 */
@Repository
public interface ApplicationRepository extends JpaRepository<Application, Long> {

    Optional<Application> findByPaymentOrderId(String paymentOrderId);

    /**
     * Lock the application row for a status transition.
     * Concurrent transitions of the same application serialize on this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Application a WHERE a.id = :id")
    Optional<Application> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Application a WHERE a.paymentOrderId = :orderId")
    Optional<Application> findByPaymentOrderIdForUpdate(@Param("orderId") String orderId);

    long countByQueueStatus(QueueStatus queueStatus);

    // ---------------------------------------------------------------------
    // Job queue
    // ---------------------------------------------------------------------

    /**
     * Put an application on the queue unless it is already queued, running or done.
     *
     * @return 1 if the application was enqueued by this call, 0 otherwise
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Application a SET a.queueStatus = :queued, a.queuePriority = :priority, " +
            "a.queueEnteredAt = :now, a.queueStartedAt = NULL, a.queueCompletedAt = NULL, " +
            "a.queueWaitMs = NULL, a.durationMs = NULL, a.queueAttempts = 0, a.queueError = NULL, " +
            "a.updatedAt = :now " +
            "WHERE a.id = :id AND a.status IN :eligibleStatuses " +
            "AND (a.queueStatus IS NULL OR a.queueStatus IN :requeueable)")
    int markQueued(@Param("id") Long id,
                   @Param("priority") int priority,
                   @Param("now") LocalDateTime now,
                   @Param("queued") QueueStatus queued,
                   @Param("eligibleStatuses") Collection<ApplicationStatus> eligibleStatuses,
                   @Param("requeueable") Collection<QueueStatus> requeueable);

    /**
     * Next jobs to run: highest priority first, FIFO within a priority.
     */
    @Query("SELECT a FROM Application a WHERE a.queueStatus = :queued " +
            "ORDER BY a.queuePriority DESC, a.queueEnteredAt ASC, a.id ASC")
    List<Application> findQueued(@Param("queued") QueueStatus queued, Pageable pageable);

    /**
     * Claim a queued job. Skips the row if another dispatcher already claimed it.
     *
     * @return 1 if claimed by this call
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Application a SET a.queueStatus = :processing, a.queueStartedAt = :now, " +
            "a.queueWaitMs = :waitMs, a.updatedAt = :now " +
            "WHERE a.id = :id AND a.queueStatus = :queued")
    int claimQueued(@Param("id") Long id,
                    @Param("now") LocalDateTime now,
                    @Param("waitMs") long waitMs,
                    @Param("queued") QueueStatus queued,
                    @Param("processing") QueueStatus processing);

    /**
     * Put a claimed job back when no worker could take it.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Application a SET a.queueStatus = :queued, a.queueStartedAt = NULL, a.queueWaitMs = NULL " +
            "WHERE a.id = :id AND a.queueStatus = :processing")
    int releaseClaim(@Param("id") Long id,
                     @Param("queued") QueueStatus queued,
                     @Param("processing") QueueStatus processing);

    /**
     * Close a running job without a status transition (the transition itself failed).
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Application a SET a.queueStatus = :outcome, a.queueCompletedAt = :now, " +
            "a.durationMs = :durationMs, a.queueAttempts = :attempts, a.queueError = :error, a.updatedAt = :now " +
            "WHERE a.id = :id AND a.queueStatus = :processing")
    int finishJob(@Param("id") Long id,
                  @Param("outcome") QueueStatus outcome,
                  @Param("now") LocalDateTime now,
                  @Param("durationMs") long durationMs,
                  @Param("attempts") int attempts,
                  @Param("error") String error,
                  @Param("processing") QueueStatus processing);

    /**
     * Remove a job from the queue. Running jobs are not touched.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Application a SET a.queueStatus = :cancelled, a.updatedAt = :now " +
            "WHERE a.id = :id AND a.queueStatus = :queued")
    int cancelQueued(@Param("id") Long id,
                     @Param("now") LocalDateTime now,
                     @Param("queued") QueueStatus queued,
                     @Param("cancelled") QueueStatus cancelled);

    @Query("SELECT COUNT(a) FROM Application a WHERE a.queueStatus = :queued " +
            "AND (a.queuePriority > :priority " +
            "OR (a.queuePriority = :priority AND a.queueEnteredAt < :enteredAt))")
    long countQueuedAhead(@Param("queued") QueueStatus queued,
                          @Param("priority") int priority,
                          @Param("enteredAt") LocalDateTime enteredAt);

    @Query("SELECT AVG(a.queueWaitMs) FROM Application a " +
            "WHERE a.queueCompletedAt > :since AND a.queueStatus IN :finished")
    Double averageWaitMsSince(@Param("since") LocalDateTime since,
                              @Param("finished") Collection<QueueStatus> finished);

    @Query("SELECT AVG(a.durationMs) FROM Application a " +
            "WHERE a.queueCompletedAt > :since AND a.queueStatus IN :finished")
    Double averageProcessingMsSince(@Param("since") LocalDateTime since,
                                    @Param("finished") Collection<QueueStatus> finished);

    // ---------------------------------------------------------------------
    // Health and scanner queries
    // ---------------------------------------------------------------------

    /**
     * Applications in an in-flight status that have not been touched since the given time.
     */
    @Query("SELECT a FROM Application a WHERE a.status IN :statuses AND a.updatedAt < :updatedBefore " +
            "ORDER BY a.updatedAt ASC")
    List<Application> findStuck(@Param("statuses") Collection<ApplicationStatus> statuses,
                                @Param("updatedBefore") LocalDateTime updatedBefore,
                                Pageable pageable);

    /**
     * Payments waiting on the gateway for too long that recovery does not track yet.
     */
    @Query("SELECT a FROM Application a WHERE a.status IN :statuses " +
            "AND a.paymentIntentId IS NOT NULL AND a.updatedAt < :updatedBefore " +
            "AND NOT EXISTS (SELECT r.id FROM RecoveryAttempt r " +
            "WHERE r.applicationId = a.id AND r.paymentIntentId = a.paymentIntentId) " +
            "ORDER BY a.updatedAt ASC")
    List<Application> findUntrackedStalePayments(@Param("statuses") Collection<ApplicationStatus> statuses,
                                                 @Param("updatedBefore") LocalDateTime updatedBefore,
                                                 Pageable pageable);

    /**
     * Ready permits expiring within (from, until] without a reminder of the given type.
     */
    @Query("SELECT a FROM Application a WHERE a.status = :status " +
            "AND a.permitExpiresAt > :from AND a.permitExpiresAt <= :until " +
            "AND NOT EXISTS (SELECT r.id FROM ReminderRecord r " +
            "WHERE r.applicationId = a.id AND r.reminderType = :reminderType) " +
            "ORDER BY a.permitExpiresAt ASC")
    List<Application> findPermitsExpiringWithoutReminder(@Param("status") ApplicationStatus status,
                                                         @Param("from") LocalDateTime from,
                                                         @Param("until") LocalDateTime until,
                                                         @Param("reminderType") String reminderType,
                                                         Pageable pageable);
}
