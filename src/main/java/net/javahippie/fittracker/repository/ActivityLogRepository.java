package net.javahippie.fittracker.repository;

import net.javahippie.fittracker.model.entity.ActivityLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for daily activity logs.
 */
@Repository
public interface ActivityLogRepository extends JpaRepository<ActivityLog, Long> {

    /**
     * Find the log of an activity on a given day.
     * At most one exists thanks to the (activity_id, log_date) unique constraint.
     */
    Optional<ActivityLog> findByActivityIdAndLogDate(Long activityId, LocalDate logDate);

    /**
     * Logs of one user on one date, each paired with its activity.
     * Each element is {@code [ActivityLog, Activity]}.
     */
    @Query("SELECT l, a FROM ActivityLog l JOIN Activity a ON a.id = l.activityId " +
           "WHERE l.userId = :userId AND l.logDate = :logDate " +
           "ORDER BY a.id")
    List<Object[]> findWithActivityByUserIdAndLogDate(
        @Param("userId") Long userId,
        @Param("logDate") LocalDate logDate
    );

    long countByActivityIdAndLogDate(Long activityId, LocalDate logDate);

    long countByUserId(Long userId);

    @Modifying
    @Query("DELETE FROM ActivityLog l WHERE l.userId = :userId")
    int deleteAllForUser(@Param("userId") Long userId);
}
