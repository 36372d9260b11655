package net.javahippie.fittracker.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for creating or editing an activity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityRequest {

    @NotBlank(message = "Activity name is required")
    @Size(max = 100, message = "Activity name must not exceed 100 characters")
    private String name;

    @Size(max = 2000, message = "Description must not exceed 2000 characters")
    private String description;

    @Size(max = 20, message = "Icon must not exceed 20 characters")
    private String icon;

    @PositiveOrZero(message = "Target value must not be negative")
    private Double targetValue;

    @Size(max = 30, message = "Target unit must not exceed 30 characters")
    private String targetUnit;

    @Size(max = 30, message = "Category must not exceed 30 characters")
    private String category;
}
