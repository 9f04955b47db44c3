package com.fintech.permits.repository;

import com.fintech.permits.entity.RecoveryAttempt;
import com.fintech.permits.entity.RecoveryStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
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
 * Repository for recovery attempts.
 * <p>
 * The attempt counter is never read, incremented in Java and written back;
 * every increment is a single conditional UPDATE.
 */
@Repository
public interface RecoveryAttemptRepository extends JpaRepository<RecoveryAttempt, Long> {

    Optional<RecoveryAttempt> findByApplicationIdAndPaymentIntentId(Long applicationId, String paymentIntentId);

    /**
     * Increment path of the attempt upsert.
     *
     * @return 0 when no active row below the attempt limit exists
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE RecoveryAttempt r SET r.attemptCount = r.attemptCount + 1, " +
            "r.lastAttemptTime = :now, r.lastError = :error, r.status = :status, r.updatedAt = :now " +
            "WHERE r.applicationId = :applicationId AND r.paymentIntentId = :intentId " +
            "AND r.status IN :active AND r.attemptCount < :maxAttempts")
    int incrementAttempt(@Param("applicationId") Long applicationId,
                         @Param("intentId") String intentId,
                         @Param("now") LocalDateTime now,
                         @Param("error") String error,
                         @Param("status") RecoveryStatus status,
                         @Param("active") Collection<RecoveryStatus> active,
                         @Param("maxAttempts") int maxAttempts);

    /**
     * Claim a row for this scan: compare-and-set on the attempt count seen when the row was read.
     * Another scanner that already claimed the row makes this return 0.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE RecoveryAttempt r SET r.attemptCount = r.attemptCount + 1, " +
            "r.lastAttemptTime = :now, r.status = :recovering, r.updatedAt = :now " +
            "WHERE r.id = :id AND r.attemptCount = :expectedCount AND r.status IN :active")
    int claimAttempt(@Param("id") Long id,
                     @Param("expectedCount") int expectedCount,
                     @Param("now") LocalDateTime now,
                     @Param("recovering") RecoveryStatus recovering,
                     @Param("active") Collection<RecoveryStatus> active);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE RecoveryAttempt r SET r.status = :status, r.lastError = :error, r.updatedAt = :now " +
            "WHERE r.id = :id")
    int updateOutcome(@Param("id") Long id,
                      @Param("status") RecoveryStatus status,
                      @Param("error") String error,
                      @Param("now") LocalDateTime now);

    /**
     * Close out active rows whose attempts are used up.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE RecoveryAttempt r SET r.status = :exhausted, r.updatedAt = :now " +
            "WHERE r.status IN :active AND r.attemptCount >= :maxAttempts")
    int markExhausted(@Param("maxAttempts") int maxAttempts,
                      @Param("now") LocalDateTime now,
                      @Param("active") Collection<RecoveryStatus> active,
                      @Param("exhausted") RecoveryStatus exhausted);

    /**
     * Rows due for another attempt, oldest attempt first.
     */
    @Query("SELECT r FROM RecoveryAttempt r WHERE r.status IN :active " +
            "AND r.lastAttemptTime < :lastAttemptBefore AND r.attemptCount < :maxAttempts " +
            "ORDER BY r.lastAttemptTime ASC, r.id ASC")
    List<RecoveryAttempt> findDueForRecovery(@Param("active") Collection<RecoveryStatus> active,
                                             @Param("lastAttemptBefore") LocalDateTime lastAttemptBefore,
                                             @Param("maxAttempts") int maxAttempts,
                                             Pageable pageable);

    List<RecoveryAttempt> findByStatusOrderByUpdatedAtAsc(RecoveryStatus status);

    long countByStatusAndCreatedAtAfter(RecoveryStatus status, LocalDateTime since);

    long countByCreatedAtAfter(LocalDateTime since);

    @Query("SELECT AVG(r.attemptCount) FROM RecoveryAttempt r WHERE r.createdAt > :since")
    Double averageAttemptsSince(@Param("since") LocalDateTime since);

    @Modifying
    @Transactional
    @Query("DELETE FROM RecoveryAttempt r WHERE r.status IN :finished AND r.updatedAt < :before")
    int deleteFinishedBefore(@Param("finished") Collection<RecoveryStatus> finished,
                             @Param("before") LocalDateTime before);
}
