package com.fintech.permits.service;

import com.fintech.permits.entity.WebhookEvent;
import com.fintech.permits.entity.WebhookProcessingStatus;
import com.fintech.permits.exception.LedgerWriteException;
import com.fintech.permits.repository.WebhookEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Idempotency ledger for inbound webhooks.
 * <p>
 * Deduplication relies only on the unique event_id constraint: the insert either
 * creates the row (first delivery) or violates the constraint (duplicate). No read
 * happens before the insert, so concurrent deliveries cannot both win.
 * <p>
 * If the ledger itself is unavailable the event is treated as new (fail open) and an
 * operational alert is raised; the state machine is idempotent per transition, so a
 * rare double processing is safer than dropping a payment confirmation.
 */
@Service
@Slf4j
public class WebhookEventLedger {

    private static final int MAX_ERROR_LENGTH = 500;

    private final WebhookEventRepository repository;
    private final TransactionTemplate requiresNew;
    private final RetryTemplate ledgerRetryTemplate;
    private final OperationalAlerts alerts;
    private final Clock clock;

    public WebhookEventLedger(WebhookEventRepository repository,
                              PlatformTransactionManager transactionManager,
                              @Qualifier("ledgerRetryTemplate") RetryTemplate ledgerRetryTemplate,
                              OperationalAlerts alerts,
                              Clock clock) {
        this.repository = repository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ledgerRetryTemplate = ledgerRetryTemplate;
        this.alerts = alerts;
        this.clock = clock;
    }

    /**
     * Record the event if this is its first delivery.
     *
     * @return true if this call created the ledger row (or the ledger is unavailable),
     * false if the event id was already recorded
     */
    public boolean recordIfNew(String eventId, String eventType) {
        try {
            ledgerRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Retrying ledger insert for event {} (attempt {})", eventId, context.getRetryCount() + 1);
                }
                requiresNew.executeWithoutResult(status -> repository.saveAndFlush(WebhookEvent.builder()
                        .eventId(eventId)
                        .eventType(eventType)
                        .processingStatus(WebhookProcessingStatus.PENDING)
                        .createdAt(LocalDateTime.now(clock))
                        .build()));
                return null;
            });
            log.debug("Recorded webhook event {} ({})", eventId, eventType);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Duplicate webhook event {} ignored", eventId);
            return false;
        } catch (DataAccessException | TransactionException e) {
            LedgerWriteException failure = new LedgerWriteException(eventId, e);
            alerts.raise(OperationalAlerts.LEDGER_UNAVAILABLE,
                    "Idempotency ledger unavailable, processing event " + eventId + " without deduplication",
                    failure);
            return true;
        }
    }

    /**
     * Record the processing outcome. A FAILED outcome increments retry_count.
     */
    public void markProcessed(String eventId, WebhookProcessingStatus status, String error) {
        int retryIncrement = status == WebhookProcessingStatus.FAILED ? 1 : 0;
        int updated = repository.updateOutcome(eventId, status, truncate(error), retryIncrement,
                LocalDateTime.now(clock));
        if (updated == 0) {
            // Row missing only when the ledger failed open on insert
            log.warn("No ledger row for webhook event {}, outcome {} not recorded", eventId, status);
        }
    }

    /**
     * Hand an event whose processing failed back to a redelivery.
     *
     * @return true if this caller may process the event again
     */
    public boolean reclaimFailed(String eventId) {
        boolean reclaimed = repository.reclaim(eventId,
                WebhookProcessingStatus.FAILED, WebhookProcessingStatus.PENDING) == 1;
        if (reclaimed) {
            log.info("Reprocessing previously failed webhook event {}", eventId);
        }
        return reclaimed;
    }

    public int purgeProcessedBefore(LocalDateTime before) {
        return repository.deleteByStatusProcessedBefore(WebhookProcessingStatus.PROCESSED, before);
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
