package net.javahippie.fittracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.fittracker.model.entity.WorkoutSession;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutSessionDTO {

    private Long id;
    private String workoutType;
    private Integer durationMinutes;
    private Double caloriesBurned;
    private String intensity;
    private String notes;
    private LocalDate sessionDate;
    private LocalDateTime createdAt;

    public static WorkoutSessionDTO fromEntity(WorkoutSession session) {
        return WorkoutSessionDTO.builder()
            .id(session.getId())
            .workoutType(session.getWorkoutType())
            .durationMinutes(session.getDurationMinutes())
            .caloriesBurned(session.getCaloriesBurned())
            .intensity(session.getIntensity())
            .notes(session.getNotes())
            .sessionDate(session.getSessionDate())
            .createdAt(session.getCreatedAt())
            .build();
    }
}
