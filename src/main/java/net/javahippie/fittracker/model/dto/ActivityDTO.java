package net.javahippie.fittracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.fittracker.model.entity.Activity;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityDTO {

    private Long id;
    private Long userId;
    private String name;
    private String description;
    private String icon;
    private Double targetValue;
    private String targetUnit;
    private String category;
    private boolean active;
    private LocalDateTime createdAt;

    public static ActivityDTO fromEntity(Activity activity) {
        return ActivityDTO.builder()
            .id(activity.getId())
            .userId(activity.getUserId())
            .name(activity.getName())
            .description(activity.getDescription())
            .icon(activity.getIcon())
            .targetValue(activity.getTargetValue())
            .targetUnit(activity.getTargetUnit())
            .category(activity.getCategory())
            .active(activity.isActive())
            .createdAt(activity.getCreatedAt())
            .build();
    }
}
