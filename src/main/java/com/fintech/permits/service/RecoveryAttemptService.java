package com.fintech.permits.service;

import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.entity.RecoveryAttempt;
import com.fintech.permits.entity.RecoveryStatus;
import com.fintech.permits.repository.RecoveryAttemptRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Bookkeeping for payment recovery attempts.
 * <p>
 * attempt_count only changes through conditional UPDATE statements. Inserts race on the
 * (application_id, payment_intent_id) constraint; the loser falls back to the update.
 */
@Service
@Slf4j
public class RecoveryAttemptService {

    private static final int MAX_ERROR_LENGTH = 500;

    private final RecoveryAttemptRepository repository;
    private final TransactionTemplate requiresNew;
    private final PipelineProperties properties;
    private final Clock clock;

    public RecoveryAttemptService(RecoveryAttemptRepository repository,
                                  PlatformTransactionManager transactionManager,
                                  PipelineProperties properties,
                                  Clock clock) {
        this.repository = repository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Count one failed attempt for the payment, creating the row on first use.
     */
    public void upsertAttempt(Long applicationId, String paymentIntentId, String error) {
        String lastError = truncate(error);
        if (increment(applicationId, paymentIntentId, lastError)) {
            return;
        }

        if (repository.findByApplicationIdAndPaymentIntentId(applicationId, paymentIntentId).isPresent()) {
            log.debug("Recovery for application {} / {} already finished or exhausted, attempt not counted",
                    applicationId, paymentIntentId);
            return;
        }

        LocalDateTime now = now();
        try {
            requiresNew.executeWithoutResult(status -> repository.saveAndFlush(RecoveryAttempt.builder()
                    .applicationId(applicationId)
                    .paymentIntentId(paymentIntentId)
                    .attemptCount(1)
                    .lastAttemptTime(now)
                    .lastError(lastError)
                    .status(RecoveryStatus.RECOVERING)
                    .createdAt(now)
                    .updatedAt(now)
                    .build()));
            log.info("Started recovery tracking for application {} / {}", applicationId, paymentIntentId);
        } catch (DataIntegrityViolationException race) {
            // Inserted concurrently by another caller
            increment(applicationId, paymentIntentId, lastError);
        }
    }

    /**
     * Register a stuck payment for the recovery scan without counting an attempt.
     *
     * @param stuckSince last local update of the payment; the row becomes due from there
     * @return true if the payment was not tracked before
     */
    public boolean track(Long applicationId, String paymentIntentId, LocalDateTime stuckSince) {
        LocalDateTime now = now();
        try {
            requiresNew.executeWithoutResult(status -> repository.saveAndFlush(RecoveryAttempt.builder()
                    .applicationId(applicationId)
                    .paymentIntentId(paymentIntentId)
                    .attemptCount(0)
                    .lastAttemptTime(stuckSince != null ? stuckSince : now)
                    .status(RecoveryStatus.PENDING)
                    .createdAt(now)
                    .updatedAt(now)
                    .build()));
            log.info("Tracking stuck payment for application {} / {}", applicationId, paymentIntentId);
            return true;
        } catch (DataIntegrityViolationException alreadyTracked) {
            return false;
        }
    }

    /**
     * Claim an attempt for this scan, incrementing its counter.
     *
     * @return false if another scanner claimed it first
     */
    public boolean claim(RecoveryAttempt attempt) {
        return repository.claimAttempt(attempt.getId(), attempt.getAttemptCount(), now(),
                RecoveryStatus.RECOVERING, RecoveryStatus.active()) == 1;
    }

    public void recordOutcome(Long attemptId, RecoveryStatus status, String error) {
        repository.updateOutcome(attemptId, status, truncate(error), now());
    }

    /**
     * Close out active attempts that already used every try.
     */
    public int markExhausted() {
        return repository.markExhausted(properties.getRecovery().getMaxAttempts(), now(),
                RecoveryStatus.active(), RecoveryStatus.MAX_ATTEMPTS_REACHED);
    }

    /**
     * Active attempts whose last try is older than the stale threshold, oldest first.
     */
    public List<RecoveryAttempt> findDue() {
        PipelineProperties.Recovery recovery = properties.getRecovery();
        LocalDateTime lastAttemptBefore = now().minusMinutes(recovery.getStaleThresholdMinutes());
        return repository.findDueForRecovery(RecoveryStatus.active(), lastAttemptBefore,
                recovery.getMaxAttempts(), PageRequest.of(0, recovery.getBatchSize()));
    }

    public List<RecoveryAttempt> findNeedingReview() {
        return repository.findByStatusOrderByUpdatedAtAsc(RecoveryStatus.MAX_ATTEMPTS_REACHED);
    }

    public long countCreatedSince(LocalDateTime since) {
        return repository.countByCreatedAtAfter(since);
    }

    public long countCreatedSince(RecoveryStatus status, LocalDateTime since) {
        return repository.countByStatusAndCreatedAtAfter(status, since);
    }

    public double averageAttemptsSince(LocalDateTime since) {
        Double average = repository.averageAttemptsSince(since);
        return average != null ? average : 0.0;
    }

    public int purgeFinishedBefore(LocalDateTime before) {
        return repository.deleteFinishedBefore(RecoveryStatus.finished(), before);
    }

    private boolean increment(Long applicationId, String paymentIntentId, String lastError) {
        return repository.incrementAttempt(applicationId, paymentIntentId, now(), lastError,
                RecoveryStatus.RECOVERING, RecoveryStatus.active(),
                properties.getRecovery().getMaxAttempts()) == 1;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
