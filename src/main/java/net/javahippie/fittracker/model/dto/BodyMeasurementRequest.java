package net.javahippie.fittracker.model.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BodyMeasurementRequest {

    @Positive(message = "Weight must be positive")
    private Double weight;

    @DecimalMin(value = "0.0", message = "Body fat percentage must be between 0 and 100")
    @DecimalMax(value = "100.0", message = "Body fat percentage must be between 0 and 100")
    private Double bodyFatPercentage;

    @Positive(message = "Muscle mass must be positive")
    private Double muscleMass;

    @Positive(message = "Waist circumference must be positive")
    private Double waistCircumference;

    @NotNull(message = "Measurement date is required")
    private LocalDate measurementDate;
}
