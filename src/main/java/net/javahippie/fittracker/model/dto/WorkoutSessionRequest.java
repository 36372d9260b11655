package net.javahippie.fittracker.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutSessionRequest {

    @NotBlank(message = "Workout type is required")
    @Size(max = 50, message = "Workout type must not exceed 50 characters")
    private String workoutType;

    @PositiveOrZero(message = "Duration must not be negative")
    private Integer durationMinutes;

    @PositiveOrZero(message = "Calories burned must not be negative")
    private Double caloriesBurned;

    @Size(max = 20, message = "Intensity must not exceed 20 characters")
    private String intensity;

    @Size(max = 2000, message = "Notes must not exceed 2000 characters")
    private String notes;

    @NotNull(message = "Session date is required")
    private LocalDate sessionDate;
}
