package net.javahippie.fittracker.repository;

import net.javahippie.fittracker.model.entity.WorkoutSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface WorkoutSessionRepository extends JpaRepository<WorkoutSession, Long> {

    /**
     * Find all sessions of a user within a date range (inclusive), most recent first.
     */
    List<WorkoutSession> findByUserIdAndSessionDateBetweenOrderBySessionDateDescIdDesc(
        Long userId,
        LocalDate startDate,
        LocalDate endDate
    );

    long countByUserId(Long userId);

    @Modifying
    @Query("DELETE FROM WorkoutSession w WHERE w.userId = :userId")
    int deleteAllForUser(@Param("userId") Long userId);
}
