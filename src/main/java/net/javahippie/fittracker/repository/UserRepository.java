package net.javahippie.fittracker.repository;

import net.javahippie.fittracker.model.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for User entity.
 * Provides methods for registration and credential lookup.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Finds a user by normalized email.
     * Used for login and password verification.
     *
     * @param email the lower-cased email address
     * @return optional user
     */
    Optional<User> findByEmail(String email);

    /**
     * Checks if an email already exists.
     * Used during registration.
     *
     * @param email the lower-cased email address
     * @return true if email exists
     */
    boolean existsByEmail(String email);

    /**
     * Replaces the stored credential of a user.
     *
     * @return number of updated rows
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE User u SET u.passwordHash = :passwordHash WHERE u.id = :userId")
    int updatePasswordHash(@Param("userId") Long userId, @Param("passwordHash") String passwordHash);

    /**
     * Deletes a user row. Child rows go with it through ON DELETE CASCADE foreign keys.
     *
     * @return number of deleted rows
     */
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM User u WHERE u.id = :userId")
    int deleteUserById(@Param("userId") Long userId);
}
