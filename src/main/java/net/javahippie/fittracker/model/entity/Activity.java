package net.javahippie.fittracker.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A custom, user-owned habit or fitness activity that can be logged once per day.
 * Deleting an activity only clears its active flag so historical logs keep their parent.
 */
@Entity
@Table(name = "fitness_activities")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Activity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(length = 20)
    private String icon;

    @Column(name = "target_value")
    private Double targetValue;

    @Column(name = "target_unit", length = 30)
    private String targetUnit;

    @Column(length = 30)
    private String category;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
