package net.javahippie.fittracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.fittracker.model.entity.BodyMeasurement;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BodyMeasurementDTO {

    private Long id;
    private Double weight;
    private Double bodyFatPercentage;
    private Double muscleMass;
    private Double waistCircumference;
    private LocalDate measurementDate;

    public static BodyMeasurementDTO fromEntity(BodyMeasurement measurement) {
        return BodyMeasurementDTO.builder()
            .id(measurement.getId())
            .weight(measurement.getWeight())
            .bodyFatPercentage(measurement.getBodyFatPercentage())
            .muscleMass(measurement.getMuscleMass())
            .waistCircumference(measurement.getWaistCircumference())
            .measurementDate(measurement.getMeasurementDate())
            .build();
    }
}
