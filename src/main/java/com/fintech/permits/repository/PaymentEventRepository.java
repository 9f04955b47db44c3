package com.fintech.permits.repository;

import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.PaymentEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only access to the payment event ledger. Only inserts and reads are used.
 */
@Repository
public interface PaymentEventRepository extends JpaRepository<PaymentEvent, Long> {

    List<PaymentEvent> findByApplicationIdOrderByIdAsc(Long applicationId);

    long countByApplicationId(Long applicationId);

    long countByApplicationIdAndEventType(Long applicationId, String eventType);

    /**
     * Latest voucher event per application (highest event id wins) whose instrument
     * expires within (now, horizon], for applications still waiting on the voucher and
     * not yet reminded.
     */
    @Query("SELECT e FROM PaymentEvent e, Application a " +
            "WHERE a.id = e.applicationId AND e.eventType = :eventType " +
            "AND e.id = (SELECT MAX(e2.id) FROM PaymentEvent e2 " +
            "WHERE e2.applicationId = e.applicationId AND e2.eventType = :eventType) " +
            "AND a.status = :status " +
            "AND e.expiresAt > :now AND e.expiresAt <= :horizon " +
            "AND NOT EXISTS (SELECT r.id FROM ReminderRecord r " +
            "WHERE r.applicationId = e.applicationId AND r.reminderType = :reminderType) " +
            "ORDER BY e.expiresAt ASC")
    List<PaymentEvent> findLatestExpiringVoucherEvents(@Param("eventType") String eventType,
                                                       @Param("status") ApplicationStatus status,
                                                       @Param("now") LocalDateTime now,
                                                       @Param("horizon") LocalDateTime horizon,
                                                       @Param("reminderType") String reminderType,
                                                       Pageable pageable);
}
