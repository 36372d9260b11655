package net.javahippie.fittracker.service;

import net.javahippie.fittracker.model.dto.ActivityStatDTO;
import org.springframework.stereotype.Component;

/**
 * Maps rows of the native completion-statistics query to {@link ActivityStatDTO}.
 *
 * Expected Object[] structure: [activity id, name, category, completed_count, total_count]
 */
@Component
public class ActivityStatsMapper {

    public ActivityStatDTO mapToActivityStatDTO(Object[] row) {
        int idx = 0;
        Long activityId = ((Number) row[idx++]).longValue();
        String name = (String) row[idx++];
        String category = (String) row[idx++];
        long completedCount = toLong(row[idx++]);
        long totalCount = toLong(row[idx]);

        return ActivityStatDTO.builder()
            .activityId(activityId)
            .name(name)
            .category(category)
            .completedCount(completedCount)
            .totalCount(totalCount)
            .completionRate(completionRate(completedCount, totalCount))
            .build();
    }

    /**
     * Percentage of completed logs. An activity without logs in range has a rate of 0.
     */
    static double completionRate(long completedCount, long totalCount) {
        if (totalCount == 0) {
            return 0.0;
        }
        return completedCount * 100.0 / totalCount;
    }

    private static long toLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
