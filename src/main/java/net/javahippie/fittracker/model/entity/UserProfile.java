package net.javahippie.fittracker.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Fitness profile of a user. Exactly one per user, created empty at registration.
 */
@Entity
@Table(name = "user_profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId;

    private Integer age;

    private Double weight;

    private Double height;

    @Column(length = 20)
    private String gender;

    @Column(name = "fitness_goal")
    private String fitnessGoal;
}
