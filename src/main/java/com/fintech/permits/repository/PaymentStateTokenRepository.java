package com.fintech.permits.repository;

import com.fintech.permits.entity.PaymentStateToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface PaymentStateTokenRepository extends JpaRepository<PaymentStateToken, Long> {

    Optional<PaymentStateToken> findByToken(String token);

    /**
     * Single-use consumption: only the first caller presenting a live token gets 1.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE PaymentStateToken t SET t.used = true, t.usedAt = :now " +
            "WHERE t.applicationId = :applicationId AND t.token = :token " +
            "AND t.used = false AND t.expiresAt > :now")
    int consume(@Param("applicationId") Long applicationId,
                @Param("token") String token,
                @Param("now") LocalDateTime now);

    @Modifying
    @Transactional
    @Query("DELETE FROM PaymentStateToken t WHERE t.expiresAt < :before")
    int deleteExpiredBefore(@Param("before") LocalDateTime before);
}
