package net.javahippie.fittracker.repository;

import net.javahippie.fittracker.model.entity.BodyMeasurement;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BodyMeasurementRepository extends JpaRepository<BodyMeasurement, Long> {

    /**
     * Most recent measurements of a user. The page size acts as the limit.
     */
    List<BodyMeasurement> findByUserIdOrderByMeasurementDateDescIdDesc(Long userId, Pageable pageable);

    long countByUserId(Long userId);

    @Modifying
    @Query("DELETE FROM BodyMeasurement m WHERE m.userId = :userId")
    int deleteAllForUser(@Param("userId") Long userId);
}
