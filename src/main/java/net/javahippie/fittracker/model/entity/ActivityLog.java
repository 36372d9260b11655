package net.javahippie.fittracker.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Completion record of one activity on one calendar day.
 * Unique on (activity_id, log_date): logging the same day again overwrites this row.
 */
@Entity
@Table(name = "activity_logs",
       uniqueConstraints = @UniqueConstraint(name = "uq_activity_log_day", columnNames = {"activity_id", "log_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActivityLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "activity_id", nullable = false)
    private Long activityId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false)
    private boolean completed;

    @Column(name = "actual_value")
    private Double actualValue;

    @Column(length = 2000)
    private String notes;

    @Column(name = "log_date", nullable = false)
    private LocalDate logDate;

    @UpdateTimestamp
    @Column(name = "logged_at", nullable = false)
    private LocalDateTime loggedAt;
}
