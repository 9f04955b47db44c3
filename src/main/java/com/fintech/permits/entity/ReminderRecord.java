package com.fintech.permits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Proof that a reminder of a given type was issued for an application.
 * <p>
 * Created once, never updated. The (application_id, reminder_type) constraint
 * guarantees a notification is claimed at most once.
 */
@Entity
@Table(name = "reminder_records", uniqueConstraints = {
        @UniqueConstraint(name = "uk_reminder_app_type", columnNames = {"application_id", "reminder_type"})
}, indexes = {
        @Index(name = "idx_reminder_sent_at", columnList = "sent_at")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReminderRecord {

    public static final String VOUCHER_EXPIRATION = "voucher_expiration";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_id", nullable = false, updatable = false)
    private Long applicationId;

    @Column(name = "reminder_type", nullable = false, length = 50, updatable = false)
    private String reminderType;

    /**
     * Expiry of the voucher or permit the reminder warns about.
     */
    @Column(name = "subject_expires_at", updatable = false)
    private LocalDateTime subjectExpiresAt;

    @Column(name = "sent_at", nullable = false, updatable = false)
    private LocalDateTime sentAt;

    public static String permitExpiryType(int daysBefore) {
        return "permit_expiry_" + daysBefore + "d";
    }
}
