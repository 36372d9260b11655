package net.javahippie.fittracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.fittracker.model.entity.Activity;
import net.javahippie.fittracker.model.entity.ActivityLog;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A daily log joined with the activity it belongs to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityLogDTO {

    private Long id;
    private Long activityId;
    private Long userId;
    private LocalDate logDate;
    private boolean completed;
    private Double actualValue;
    private String notes;
    private LocalDateTime loggedAt;

    // Activity fields from the join
    private String name;
    private String description;
    private String icon;
    private Double targetValue;
    private String targetUnit;
    private String category;

    public static ActivityLogDTO from(ActivityLog log, Activity activity) {
        return ActivityLogDTO.builder()
            .id(log.getId())
            .activityId(log.getActivityId())
            .userId(log.getUserId())
            .logDate(log.getLogDate())
            .completed(log.isCompleted())
            .actualValue(log.getActualValue())
            .notes(log.getNotes())
            .loggedAt(log.getLoggedAt())
            .name(activity.getName())
            .description(activity.getDescription())
            .icon(activity.getIcon())
            .targetValue(activity.getTargetValue())
            .targetUnit(activity.getTargetUnit())
            .category(activity.getCategory())
            .build();
    }
}
