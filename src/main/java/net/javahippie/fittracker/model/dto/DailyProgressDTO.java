package net.javahippie.fittracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * How many of the user's active activities were completed on one day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyProgressDTO {

    private LocalDate date;
    private int completedCount;
    private int totalActivities;

    /**
     * Rounded to a whole percent, 0 when the user has no active activities.
     */
    private int percentage;
}
