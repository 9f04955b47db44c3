package com.fintech.permits.repository;

import com.fintech.permits.entity.ReminderRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Reminder records are inserted once and never updated. The unique
 * (application_id, reminder_type) constraint is the exactly-once guard.
 */
@Repository
public interface ReminderRecordRepository extends JpaRepository<ReminderRecord, Long> {

    long countByApplicationIdAndReminderType(Long applicationId, String reminderType);

    List<ReminderRecord> findByApplicationIdOrderBySentAtDesc(Long applicationId);

    @Query("SELECT r.reminderType, COUNT(r) FROM ReminderRecord r WHERE r.sentAt >= :since " +
            "GROUP BY r.reminderType")
    List<Object[]> countByTypeSince(@Param("since") LocalDateTime since);

    @Modifying
    @Transactional
    @Query("DELETE FROM ReminderRecord r WHERE r.sentAt < :before")
    int deleteSentBefore(@Param("before") LocalDateTime before);
}
