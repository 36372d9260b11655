package net.javahippie.fittracker.service;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.fittracker.exception.DuplicateEmailException;
import net.javahippie.fittracker.exception.InvalidCredentialsException;
import net.javahippie.fittracker.exception.NotFoundException;
import net.javahippie.fittracker.exception.ValidationException;
import net.javahippie.fittracker.model.dto.ActivityDTO;
import net.javahippie.fittracker.model.dto.ActivityLogDTO;
import net.javahippie.fittracker.model.dto.ActivityRequest;
import net.javahippie.fittracker.model.dto.ActivityStatDTO;
import net.javahippie.fittracker.model.dto.BodyMeasurementDTO;
import net.javahippie.fittracker.model.dto.BodyMeasurementRequest;
import net.javahippie.fittracker.model.dto.DailyProgressDTO;
import net.javahippie.fittracker.model.dto.LogEntryDTO;
import net.javahippie.fittracker.model.dto.ProfileUpdateRequest;
import net.javahippie.fittracker.model.dto.UserDTO;
import net.javahippie.fittracker.model.dto.UserProfileDTO;
import net.javahippie.fittracker.model.dto.WorkoutSessionDTO;
import net.javahippie.fittracker.model.dto.WorkoutSessionRequest;
import net.javahippie.fittracker.model.entity.Activity;
import net.javahippie.fittracker.model.entity.User;
import net.javahippie.fittracker.security.CredentialPolicy;
import net.javahippie.fittracker.session.SessionStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for the presentation layer: account lifecycle (registration, login, logout,
 * password change, profile, deletion) and the user-scoped tracking operations.
 *
 * <p>The credential hasher and the relational store are never exposed; callers only see DTOs
 * without password hashes.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    static final String INVALID_CREDENTIALS = "Invalid email or password";
    static final int MAX_NOTES_LENGTH = 2000;

    private final FitnessDataStore dataStore;
    private final SessionStore sessionStore;
    private final PasswordEncoder passwordEncoder;
    private final CredentialPolicy credentialPolicy;
    private final RequestValidator requestValidator;

    @Value("${fittracker.measurements.default-limit:30}")
    private int defaultMeasurementLimit = 30;

    private volatile String timingEqualizationHash;

    @PostConstruct
    void initTimingEqualization() {
        timingEqualizationHash();
    }

    // ------------------------------------------------------------- accounts

    /**
     * Register a new account, seed it with the default activities and log it in.
     *
     * @param email email address, normalized to lower case
     * @param password plaintext password, must satisfy the strength policy
     * @param fullName display name, trimmed
     * @return the public user record
     * @throws ValidationException if email, password or name are malformed
     * @throws DuplicateEmailException if the email is already registered
     */
    public UserDTO register(String email, String password, String fullName) {
        credentialPolicy.validateEmail(email);
        credentialPolicy.validatePassword(password);
        String name = credentialPolicy.validateFullName(fullName);
        String normalizedEmail = credentialPolicy.normalizeEmail(email);

        log.info("Registering new user: {}", normalizedEmail);

        if (dataStore.findUserByEmail(normalizedEmail).isPresent()) {
            throw new DuplicateEmailException("Email already registered");
        }

        String passwordHash = passwordEncoder.encode(password);
        User user = dataStore.createAccount(normalizedEmail, passwordHash, name, DefaultActivityCatalog.ACTIVITIES);

        UserDTO publicUser = UserDTO.fromEntity(user);
        sessionStore.createSession(publicUser);

        log.info("User registered successfully: {}", user.getId());
        return publicUser;
    }

    /**
     * Verify credentials and start a session.
     *
     * @return the public user record
     * @throws InvalidCredentialsException for an unknown email or a wrong password, indistinguishably
     */
    public UserDTO login(String email, String password) {
        String normalizedEmail = credentialPolicy.normalizeEmail(email);
        Optional<User> candidate = normalizedEmail == null
            ? Optional.empty()
            : dataStore.findUserByEmail(normalizedEmail);

        if (candidate.isEmpty()) {
            // Burn the same KDF time as a real verification
            passwordEncoder.matches(password, timingEqualizationHash());
            log.warn("Login failed: invalid credentials");
            throw new InvalidCredentialsException(INVALID_CREDENTIALS);
        }

        User user = candidate.get();
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            log.warn("Login failed: invalid credentials");
            throw new InvalidCredentialsException(INVALID_CREDENTIALS);
        }

        UserDTO publicUser = UserDTO.fromEntity(user);
        sessionStore.createSession(publicUser);

        log.info("User logged in successfully: {}", user.getId());
        return publicUser;
    }

    /**
     * End the current session. Calling it without a session is fine.
     */
    public void logout() {
        sessionStore.clearSession();
        log.info("User logged out");
    }

    public Optional<UserDTO> getCurrentUser() {
        return sessionStore.getCurrentUser();
    }

    /**
     * Replace the password after re-verifying the current one.
     *
     * @throws NotFoundException if the user does not exist
     * @throws InvalidCredentialsException if the current password is wrong
     * @throws ValidationException if the new password is too weak
     */
    public void changePassword(Long userId, String currentPassword, String newPassword) {
        User user = requireUser(userId);

        if (!passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            log.warn("Password change rejected for user {}: current password is incorrect", userId);
            throw new InvalidCredentialsException("Current password is incorrect");
        }

        credentialPolicy.validatePassword(newPassword);

        dataStore.updatePasswordHash(userId, passwordEncoder.encode(newPassword));
        log.info("Password changed for user {}", userId);
    }

    public UserProfileDTO updateProfile(Long userId, ProfileUpdateRequest request) {
        requireUser(userId);
        requestValidator.validate(request);
        return UserProfileDTO.fromEntity(dataStore.upsertProfile(userId, request));
    }

    /**
     * Get the profile of a user. A user whose data was cleared gets an empty profile.
     */
    public UserProfileDTO getProfile(Long userId) {
        requireUser(userId);
        return dataStore.findProfile(userId)
            .map(UserProfileDTO::fromEntity)
            .orElseGet(() -> UserProfileDTO.builder().userId(userId).build());
    }

    /**
     * Permanently delete an account and everything it owns.
     * Requires the password, and ends the session if it belongs to the deleted user.
     *
     * @throws InvalidCredentialsException if the password is wrong
     */
    public void deleteAccount(Long userId, String password) {
        User user = requireUser(userId);

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new InvalidCredentialsException("Invalid password");
        }

        dataStore.deleteUser(userId);

        sessionStore.getCurrentUser()
            .filter(current -> userId.equals(current.getId()))
            .ifPresent(current -> sessionStore.clearSession());

        log.info("Account deleted: {}", userId);
    }

    /**
     * Remove all activities, logs, workouts, measurements and the profile of a user.
     * The account itself stays.
     */
    public void clearUserData(Long userId) {
        requireUser(userId);
        dataStore.clearUserData(userId);
        log.info("Cleared all tracking data of user {}", userId);
    }

    // ----------------------------------------------------------- activities

    /**
     * Active activities of a user, newest first.
     */
    public List<ActivityDTO> listActivities(Long userId) {
        return dataStore.findActiveActivities(userId).stream()
            .map(ActivityDTO::fromEntity)
            .collect(Collectors.toList());
    }

    public ActivityDTO createActivity(Long userId, ActivityRequest request) {
        requireUser(userId);
        requestValidator.validate(request);
        return ActivityDTO.fromEntity(dataStore.createActivity(userId, request));
    }

    public ActivityDTO updateActivity(Long userId, Long activityId, ActivityRequest request) {
        requestValidator.validate(request);
        requireActiveActivity(userId, activityId);
        return ActivityDTO.fromEntity(dataStore.updateActivity(activityId, request));
    }

    /**
     * Soft-delete one of the user's activities. Past logs stay in the store.
     */
    public void deleteActivity(Long userId, Long activityId) {
        requireActiveActivity(userId, activityId);
        dataStore.deleteActivity(activityId);
        log.debug("Activity {} of user {} deactivated", activityId, userId);
    }

    /**
     * Log or re-log one activity for one day. Re-logging replaces the earlier entry.
     *
     * @throws NotFoundException if the activity is unknown, inactive or owned by someone else
     */
    public void logActivity(Long userId, Long activityId, LocalDate date, boolean completed,
                            Double actualValue, String notes) {
        if (date == null) {
            throw new ValidationException("Log date is required");
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new ValidationException("Notes must not exceed " + MAX_NOTES_LENGTH + " characters");
        }
        requireActiveActivity(userId, activityId);
        dataStore.logActivity(userId, activityId, date, completed, actualValue, notes);
    }

    /**
     * Logs of the given day keyed by activity id.
     */
    public Map<Long, LogEntryDTO> getTodayLogs(Long userId, LocalDate date) {
        Map<Long, LogEntryDTO> logs = new LinkedHashMap<>();
        for (ActivityLogDTO entry : getLogsForDate(userId, date)) {
            logs.put(entry.getActivityId(), LogEntryDTO.fromLog(entry));
        }
        return logs;
    }

    public List<ActivityLogDTO> getLogsForDate(Long userId, LocalDate date) {
        if (date == null) {
            throw new ValidationException("Date is required");
        }
        return dataStore.getActivityLogsForDate(userId, date);
    }

    /**
     * Completion statistics per active activity, both dates inclusive.
     */
    public List<ActivityStatDTO> getStats(Long userId, LocalDate startDate, LocalDate endDate) {
        requireRange(startDate, endDate);
        return dataStore.getActivityStats(userId, startDate, endDate);
    }

    /**
     * Share of the user's active activities completed on the given day.
     */
    public DailyProgressDTO getDailyProgress(Long userId, LocalDate date) {
        List<ActivityDTO> activities = listActivities(userId);
        Set<Long> completedIds = getTodayLogs(userId, date).entrySet().stream()
            .filter(e -> e.getValue().isCompleted())
            .map(Map.Entry::getKey)
            .collect(Collectors.toSet());

        int completed = (int) activities.stream()
            .filter(a -> completedIds.contains(a.getId()))
            .count();
        int total = activities.size();
        int percentage = total > 0 ? (int) Math.round(completed * 100.0 / total) : 0;

        return DailyProgressDTO.builder()
            .date(date)
            .completedCount(completed)
            .totalActivities(total)
            .percentage(percentage)
            .build();
    }

    // --------------------------------------------------- workouts & measurements

    public WorkoutSessionDTO logWorkoutSession(Long userId, WorkoutSessionRequest request) {
        requireUser(userId);
        requestValidator.validate(request);
        return WorkoutSessionDTO.fromEntity(dataStore.createWorkoutSession(userId, request));
    }

    public List<WorkoutSessionDTO> getWorkoutSessions(Long userId, LocalDate startDate, LocalDate endDate) {
        requireRange(startDate, endDate);
        return dataStore.findWorkoutSessions(userId, startDate, endDate).stream()
            .map(WorkoutSessionDTO::fromEntity)
            .collect(Collectors.toList());
    }

    public BodyMeasurementDTO addBodyMeasurement(Long userId, BodyMeasurementRequest request) {
        requireUser(userId);
        requestValidator.validate(request);
        return BodyMeasurementDTO.fromEntity(dataStore.addBodyMeasurement(userId, request));
    }

    public List<BodyMeasurementDTO> getBodyMeasurements(Long userId) {
        return getBodyMeasurements(userId, defaultMeasurementLimit);
    }

    /**
     * Most recent measurements first.
     */
    public List<BodyMeasurementDTO> getBodyMeasurements(Long userId, int limit) {
        if (limit < 1) {
            throw new ValidationException("Limit must be positive");
        }
        return dataStore.findBodyMeasurements(userId, limit).stream()
            .map(BodyMeasurementDTO::fromEntity)
            .collect(Collectors.toList());
    }

    // -------------------------------------------------------------- helpers

    private User requireUser(Long userId) {
        if (userId == null) {
            throw new NotFoundException("User not found");
        }
        return dataStore.findUserById(userId)
            .orElseThrow(() -> new NotFoundException("User not found: " + userId));
    }

    private Activity requireActiveActivity(Long userId, Long activityId) {
        if (userId == null || activityId == null) {
            throw new NotFoundException("Activity not found");
        }
        return dataStore.findActivity(userId, activityId)
            .filter(Activity::isActive)
            .orElseThrow(() -> new NotFoundException("Activity not found: " + activityId));
    }

    private static void requireRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new ValidationException("Start and end date are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new ValidationException("Start date must not be after end date");
        }
    }

    /**
     * Credential of a random password, used to spend KDF time when no account matches.
     */
    private String timingEqualizationHash() {
        String hash = timingEqualizationHash;
        if (hash == null) {
            hash = passwordEncoder.encode(UUID.randomUUID().toString());
            timingEqualizationHash = hash;
        }
        return hash;
    }
}
