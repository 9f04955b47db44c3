package com.fintech.permits.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.permits.dto.StateChange;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.PaymentEvent;
import com.fintech.permits.exception.InvalidStateTransitionException;
import com.fintech.permits.exception.NotFoundException;
import com.fintech.permits.exception.PipelineException;
import com.fintech.permits.repository.ApplicationRepository;
import com.fintech.permits.repository.PaymentEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies status changes to applications.
 * <p>
 * Every change locks the application row, validates the move against
 * {@link PaymentStateMachine}, updates the row and appends a {@link PaymentEvent}
 * in one transaction. Either both writes commit or neither does.
 */
@Service
@Slf4j
public class ApplicationStateService {

    private final ApplicationRepository applicationRepository;
    private final PaymentEventRepository paymentEventRepository;
    private final PaymentStateMachine stateMachine;
    private final PaymentStateTokenService tokenService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ApplicationStateService(ApplicationRepository applicationRepository,
                                   PaymentEventRepository paymentEventRepository,
                                   PaymentStateMachine stateMachine,
                                   PaymentStateTokenService tokenService,
                                   ObjectMapper objectMapper,
                                   Clock clock) {
        this.applicationRepository = applicationRepository;
        this.paymentEventRepository = paymentEventRepository;
        this.stateMachine = stateMachine;
        this.tokenService = tokenService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Record a payment order update for an application.
     */
    @Transactional
    public Application updateOrder(Long applicationId, String orderId, ApplicationStatus status,
                                   String voucherReference, Map<String, Object> details) {
        Application application = lock(applicationId);
        return apply(application, StateChange.builder()
                .targetStatus(status)
                .eventType(defaultEventType(status))
                .orderId(orderId)
                .voucherReference(voucherReference)
                .data(details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>())
                .build());
    }

    /**
     * Apply a gateway-reported change to the application owning the order.
     *
     * @throws NotFoundException if no application carries the order id
     */
    @Transactional
    public Application applyGatewayEvent(String orderId, StateChange change) {
        Application application = applicationRepository.findByPaymentOrderIdForUpdate(orderId)
                .orElseThrow(() -> NotFoundException.order(orderId));
        return apply(application, change);
    }

    @Transactional
    public Application transition(Long applicationId, ApplicationStatus status, String eventType,
                                  Map<String, Object> data) {
        return transition(applicationId, StateChange.builder()
                .targetStatus(status)
                .eventType(eventType)
                .data(data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>())
                .build());
    }

    @Transactional
    public Application transition(Long applicationId, StateChange change) {
        return apply(lock(applicationId), change);
    }

    /**
     * Bind a gateway payment order to an application (INITIATED -> PENDING_PAYMENT).
     * The only transition a client can request; it needs the application's payment state token.
     */
    @Transactional
    public Application attachOrder(Long applicationId, String orderId, String paymentIntentId,
                                   BigDecimal amount, String currency, String stateToken) {
        // Consumed first: the bulk update clears the persistence context
        tokenService.consume(applicationId, stateToken);

        Application application = lock(applicationId);
        if (application.getPaymentOrderId() != null) {
            throw new InvalidStateTransitionException(applicationId, application.getStatus(),
                    ApplicationStatus.PENDING_PAYMENT, "a payment order is already attached");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("paymentIntentId", paymentIntentId);

        return apply(application, StateChange.builder()
                .targetStatus(ApplicationStatus.PENDING_PAYMENT)
                .eventType(PaymentEvent.ORDER_CREATED)
                .orderId(orderId)
                .paymentIntentId(paymentIntentId)
                .amount(amount)
                .currency(currency)
                .data(data)
                .build());
    }

    @Transactional(readOnly = true)
    public Application getApplication(Long applicationId) {
        return applicationRepository.findById(applicationId)
                .orElseThrow(() -> NotFoundException.application(applicationId));
    }

    @Transactional(readOnly = true)
    public List<PaymentEvent> getEvents(Long applicationId) {
        return paymentEventRepository.findByApplicationIdOrderByIdAsc(applicationId);
    }

    private Application lock(Long applicationId) {
        return applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> NotFoundException.application(applicationId));
    }

    private Application apply(Application application, StateChange change) {
        ApplicationStatus from = application.getStatus();
        ApplicationStatus to = change.getTargetStatus();

        if (from == to) {
            log.debug("Application {} already in {}, ignoring {}", application.getId(), to, change.getEventType());
            return application;
        }

        String orderId = change.getOrderId() != null ? change.getOrderId() : application.getPaymentOrderId();
        stateMachine.validate(application.getId(), from, to, orderId);

        LocalDateTime now = LocalDateTime.now(clock);

        application.setStatus(to);
        application.setPaymentOrderId(orderId);
        if (change.getPaymentIntentId() != null) {
            application.setPaymentIntentId(change.getPaymentIntentId());
        }
        if (change.getVoucherReference() != null) {
            application.setPaymentReference(change.getVoucherReference());
        }
        if (change.getVoucherExpiresAt() != null) {
            application.setVoucherExpiresAt(change.getVoucherExpiresAt());
        }
        if (change.getAmount() != null) {
            application.setAmount(change.getAmount());
        }
        if (change.getCurrency() != null) {
            application.setCurrency(change.getCurrency());
        }
        if (change.getFailureReason() != null) {
            application.setFailureReason(change.getFailureReason());
        }
        if (change.getPermitArtifactLocation() != null) {
            application.setPermitArtifactLocation(change.getPermitArtifactLocation());
        }
        if (change.getPermitExpiresAt() != null) {
            application.setPermitExpiresAt(change.getPermitExpiresAt());
        }
        if (change.getQueueStatus() != null) {
            application.setQueueStatus(change.getQueueStatus());
            application.setQueueCompletedAt(change.getQueueCompletedAt());
            application.setDurationMs(change.getDurationMs());
            application.setQueueAttempts(change.getQueueAttempts());
            application.setQueueError(change.getQueueError());
        }
        application.setUpdatedAt(now);
        Application saved = applicationRepository.save(application);

        Map<String, Object> data = new LinkedHashMap<>(change.getData());
        data.put("previousStatus", from.name());
        data.put("newStatus", to.name());

        paymentEventRepository.saveAndFlush(PaymentEvent.builder()
                .applicationId(application.getId())
                .orderId(orderId)
                .eventType(change.getEventType() != null ? change.getEventType() : defaultEventType(to))
                .eventData(toJson(data))
                .amount(change.getAmount() != null ? change.getAmount() : application.getAmount())
                .currency(change.getCurrency() != null ? change.getCurrency() : application.getCurrency())
                .expiresAt(change.getVoucherExpiresAt())
                .createdAt(now)
                .build());

        log.info("Application {} moved from {} to {} ({})", application.getId(), from, to, change.getEventType());
        return saved;
    }

    private String toJson(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new PipelineException("Could not serialize payment event data", e);
        }
    }

    private static String defaultEventType(ApplicationStatus status) {
        return switch (status) {
            case PENDING_PAYMENT -> PaymentEvent.ORDER_CREATED;
            case PROCESSING_PAYMENT -> PaymentEvent.PAYMENT_PROCESSING;
            case AWAITING_VOUCHER_PAYMENT -> PaymentEvent.VOUCHER_CREATED;
            case PAYMENT_RECEIVED -> PaymentEvent.PAYMENT_SUCCEEDED;
            case PAYMENT_FAILED -> PaymentEvent.PAYMENT_FAILED;
            case GENERATING_PERMIT -> PaymentEvent.PERMIT_GENERATION_STARTED;
            case PERMIT_READY -> PaymentEvent.PERMIT_READY;
            case FAILED -> PaymentEvent.PERMIT_FAILED;
            case INITIATED -> "application.initiated";
        };
    }
}
