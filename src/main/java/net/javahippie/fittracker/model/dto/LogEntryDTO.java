package net.javahippie.fittracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Compact view of one day's log, keyed by activity id in {@code getTodayLogs}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogEntryDTO {

    private boolean completed;
    private Double actualValue;
    private String notes;

    public static LogEntryDTO fromLog(ActivityLogDTO log) {
        return new LogEntryDTO(log.isCompleted(), log.getActualValue(), log.getNotes());
    }
}
