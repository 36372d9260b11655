package net.javahippie.fittracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Completion statistics of one activity over a date range.
 * {@code completionRate} is a percentage (0 to 100) and is 0 when nothing was logged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityStatDTO {

    private Long activityId;
    private String name;
    private String category;
    private long completedCount;
    private long totalCount;
    private double completionRate;
}
