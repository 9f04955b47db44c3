package com.fintech.permits.service;

import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.PaymentStateToken;
import com.fintech.permits.exception.InvalidPaymentStateTokenException;
import com.fintech.permits.exception.InvalidStateTransitionException;
import com.fintech.permits.exception.NotFoundException;
import com.fintech.permits.repository.ApplicationRepository;
import com.fintech.permits.repository.PaymentStateTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;

/**
 * Short-lived, single-use tokens that tie a client's payment request to an application.
 */
@Service
@Slf4j
public class PaymentStateTokenService {

    private static final int TOKEN_BYTES = 32;

    private final PaymentStateTokenRepository tokenRepository;
    private final ApplicationRepository applicationRepository;
    private final PipelineProperties properties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public PaymentStateTokenService(PaymentStateTokenRepository tokenRepository,
                                    ApplicationRepository applicationRepository,
                                    PipelineProperties properties,
                                    Clock clock) {
        this.tokenRepository = tokenRepository;
        this.applicationRepository = applicationRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public PaymentStateToken issue(Long applicationId) {
        Application application = applicationRepository.findById(applicationId)
                .orElseThrow(() -> NotFoundException.application(applicationId));
        if (application.getStatus() != ApplicationStatus.INITIATED) {
            throw new InvalidStateTransitionException(applicationId, application.getStatus(),
                    ApplicationStatus.PENDING_PAYMENT, "payment already started");
        }

        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);

        LocalDateTime now = LocalDateTime.now(clock);
        PaymentStateToken token = PaymentStateToken.builder()
                .applicationId(applicationId)
                .token(HexFormat.of().formatHex(bytes))
                .expiresAt(now.plusMinutes(properties.getStateToken().getTtlMinutes()))
                .createdAt(now)
                .build();

        log.debug("Issued payment state token for application {}", applicationId);
        return tokenRepository.save(token);
    }

    /**
     * Invalidate the token. Joins the caller's transaction, so a failed caller leaves it unused.
     *
     * @throws InvalidPaymentStateTokenException if the token is unknown, expired, used or bound elsewhere
     */
    @Transactional
    public void consume(Long applicationId, String token) {
        if (token == null || token.isBlank()
                || tokenRepository.consume(applicationId, token, LocalDateTime.now(clock)) != 1) {
            log.warn("Rejected payment state token for application {}", applicationId);
            throw new InvalidPaymentStateTokenException(applicationId);
        }
    }

    public int purgeExpired(LocalDateTime before) {
        return tokenRepository.deleteExpiredBefore(before);
    }
}
