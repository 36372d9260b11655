package net.javahippie.fittracker.repository;

import net.javahippie.fittracker.model.entity.Activity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Activity entities.
 */
@Repository
public interface ActivityRepository extends JpaRepository<Activity, Long> {

    /**
     * Find all active activities for a user, newest first.
     *
     * @param userId the user ID
     * @return list of activities
     */
    List<Activity> findByUserIdAndActiveTrueOrderByCreatedAtDescIdDesc(Long userId);

    /**
     * Find an activity owned by the given user, regardless of its active flag.
     *
     * @param id the activity ID
     * @param userId the owner's user ID
     * @return optional activity
     */
    Optional<Activity> findByIdAndUserId(Long id, Long userId);

    /**
     * Count all activities of a user, including soft-deleted ones.
     */
    long countByUserId(Long userId);

    /**
     * Soft-delete a single activity.
     *
     * @param activityId the activity ID
     * @return number of updated rows, 0 if the activity does not exist
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Activity a SET a.active = false WHERE a.id = :activityId")
    int deactivate(@Param("activityId") Long activityId);

    /**
     * Completion statistics per active activity within a date range.
     * Logs are LEFT JOINed so activities without logs in range still appear, with zero counts.
     *
     * Columns: activity id, name, category, completed_count, total_count
     */
    @Query(value = """
            SELECT fa.id,
                   fa.name,
                   fa.category,
                   COUNT(CASE WHEN al.completed = TRUE THEN 1 END) AS completed_count,
                   COUNT(al.id) AS total_count
            FROM fitness_activities fa
            LEFT JOIN activity_logs al
                   ON al.activity_id = fa.id
                  AND al.log_date BETWEEN :startDate AND :endDate
            WHERE fa.user_id = :userId
              AND fa.is_active = TRUE
            GROUP BY fa.id, fa.name, fa.category
            ORDER BY fa.id
            """, nativeQuery = true)
    List<Object[]> findCompletionStats(
        @Param("userId") Long userId,
        @Param("startDate") LocalDate startDate,
        @Param("endDate") LocalDate endDate
    );

    @Modifying
    @Query("DELETE FROM Activity a WHERE a.userId = :userId")
    int deleteAllForUser(@Param("userId") Long userId);
}
