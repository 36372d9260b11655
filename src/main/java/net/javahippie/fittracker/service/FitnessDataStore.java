package net.javahippie.fittracker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.fittracker.exception.DuplicateEmailException;
import net.javahippie.fittracker.exception.NotFoundException;
import net.javahippie.fittracker.model.dto.ActivityLogDTO;
import net.javahippie.fittracker.model.dto.ActivityRequest;
import net.javahippie.fittracker.model.dto.ActivityStatDTO;
import net.javahippie.fittracker.model.dto.BodyMeasurementRequest;
import net.javahippie.fittracker.model.dto.ProfileUpdateRequest;
import net.javahippie.fittracker.model.dto.WorkoutSessionRequest;
import net.javahippie.fittracker.model.entity.Activity;
import net.javahippie.fittracker.model.entity.ActivityLog;
import net.javahippie.fittracker.model.entity.BodyMeasurement;
import net.javahippie.fittracker.model.entity.User;
import net.javahippie.fittracker.model.entity.UserProfile;
import net.javahippie.fittracker.model.entity.WorkoutSession;
import net.javahippie.fittracker.repository.ActivityLogRepository;
import net.javahippie.fittracker.repository.ActivityRepository;
import net.javahippie.fittracker.repository.BodyMeasurementRepository;
import net.javahippie.fittracker.repository.UserProfileRepository;
import net.javahippie.fittracker.repository.UserRepository;
import net.javahippie.fittracker.repository.WorkoutSessionRepository;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Local relational store for accounts and everything they own.
 *
 * <p>All writes are serialized through one exclusive lock that is held for the whole transaction,
 * commit included. Two quick toggles of the same activity on the same day therefore end in one row
 * holding the last value. Reads run in read-only transactions and only see committed data.</p>
 *
 * <p>Every child row (profile, activities, logs, workouts, measurements) references its user with an
 * {@code ON DELETE CASCADE} foreign key.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FitnessDataStore {

    private final UserRepository userRepository;
    private final UserProfileRepository userProfileRepository;
    private final ActivityRepository activityRepository;
    private final ActivityLogRepository activityLogRepository;
    private final WorkoutSessionRepository workoutSessionRepository;
    private final BodyMeasurementRepository bodyMeasurementRepository;
    private final ActivityStatsMapper activityStatsMapper;
    private final TransactionTemplate transactionTemplate;

    private static final String EMAIL_UNIQUE_CONSTRAINT = "UQ_USERS_EMAIL";

    private final ReentrantLock writeLock = new ReentrantLock(true);

    // ---------------------------------------------------------------- users

    /**
     * Create a user together with an empty profile and the given starter activities, atomically.
     *
     * @param email normalized email
     * @param passwordHash {@code salt:digest} credential
     * @param fullName trimmed full name
     * @param starterActivities activities to create for the new user
     * @return the persisted user
     * @throws DuplicateEmailException if the email is already registered
     */
    public User createAccount(String email, String passwordHash, String fullName, List<ActivityRequest> starterActivities) {
        try {
            return inWriteTransaction(status -> {
                if (userRepository.existsByEmail(email)) {
                    throw new DuplicateEmailException("Email already registered");
                }

                User user = userRepository.save(User.builder()
                    .email(email)
                    .passwordHash(passwordHash)
                    .fullName(fullName)
                    .build());

                userProfileRepository.save(UserProfile.builder()
                    .userId(user.getId())
                    .build());

                for (ActivityRequest request : starterActivities) {
                    Activity activity = Activity.builder().userId(user.getId()).build();
                    applyActivityFields(activity, request);
                    activityRepository.save(activity);
                }

                log.debug("Created account {} with {} starter activities", user.getId(), starterActivities.size());
                return user;
            });
        } catch (DataIntegrityViolationException e) {
            if (isDuplicateEmail(e)) {
                throw new DuplicateEmailException("Email already registered", e);
            }
            throw e;
        }
    }

    @Transactional(readOnly = true)
    public Optional<User> findUserByEmail(String email) {
        return userRepository.findByEmail(email);
    }

    @Transactional(readOnly = true)
    public Optional<User> findUserById(Long userId) {
        return userRepository.findById(userId);
    }

    @Transactional(readOnly = true)
    public boolean userExists(Long userId) {
        return userRepository.existsById(userId);
    }

    public void updatePasswordHash(Long userId, String passwordHash) {
        inWriteTransaction(status -> {
            if (userRepository.updatePasswordHash(userId, passwordHash) == 0) {
                throw new NotFoundException("User not found: " + userId);
            }
            return null;
        });
    }

    /**
     * Delete a user. The database cascades the delete through all five child tables.
     *
     * @throws NotFoundException if the user does not exist
     */
    public void deleteUser(Long userId) {
        inWriteTransaction(status -> {
            if (userRepository.deleteUserById(userId) == 0) {
                throw new NotFoundException("User not found: " + userId);
            }
            log.debug("Deleted user {}", userId);
            return null;
        });
    }

    // ------------------------------------------------------------- profiles

    /**
     * Insert or replace the profile of a user.
     */
    public UserProfile upsertProfile(Long userId, ProfileUpdateRequest request) {
        return inWriteTransaction(status -> {
            UserProfile profile = userProfileRepository.findByUserId(userId)
                .orElseGet(() -> UserProfile.builder().userId(userId).build());

            profile.setAge(request.getAge());
            profile.setWeight(request.getWeight());
            profile.setHeight(request.getHeight());
            profile.setGender(request.getGender());
            profile.setFitnessGoal(request.getFitnessGoal());

            return userProfileRepository.save(profile);
        });
    }

    @Transactional(readOnly = true)
    public Optional<UserProfile> findProfile(Long userId) {
        return userProfileRepository.findByUserId(userId);
    }

    // ----------------------------------------------------------- activities

    public Activity createActivity(Long userId, ActivityRequest request) {
        return inWriteTransaction(status -> {
            Activity activity = Activity.builder().userId(userId).build();
            applyActivityFields(activity, request);
            return activityRepository.save(activity);
        });
    }

    /**
     * Active activities of a user, newest first.
     */
    @Transactional(readOnly = true)
    public List<Activity> findActiveActivities(Long userId) {
        return activityRepository.findByUserIdAndActiveTrueOrderByCreatedAtDescIdDesc(userId);
    }

    /**
     * Find an activity owned by the given user, including soft-deleted ones.
     */
    @Transactional(readOnly = true)
    public Optional<Activity> findActivity(Long userId, Long activityId) {
        return activityRepository.findByIdAndUserId(activityId, userId);
    }

    public Activity updateActivity(Long activityId, ActivityRequest request) {
        return inWriteTransaction(status -> {
            Activity activity = activityRepository.findById(activityId)
                .orElseThrow(() -> new NotFoundException("Activity not found: " + activityId));
            applyActivityFields(activity, request);
            return activityRepository.save(activity);
        });
    }

    /**
     * Soft-delete exactly one activity. Its logs are kept.
     *
     * @throws NotFoundException if no activity has this id
     */
    public void deleteActivity(Long activityId) {
        inWriteTransaction(status -> {
            if (activityRepository.deactivate(activityId) == 0) {
                throw new NotFoundException("Activity not found: " + activityId);
            }
            return null;
        });
    }

    // ----------------------------------------------------------------- logs

    /**
     * Record completion of an activity on a day. A second call for the same activity and day
     * overwrites the first instead of adding a row.
     */
    public ActivityLog logActivity(Long userId, Long activityId, LocalDate date, boolean completed,
                                   Double actualValue, String notes) {
        return inWriteTransaction(status -> {
            ActivityLog entry = activityLogRepository.findByActivityIdAndLogDate(activityId, date)
                .orElseGet(ActivityLog::new);

            entry.setActivityId(activityId);
            entry.setUserId(userId);
            entry.setLogDate(date);
            entry.setCompleted(completed);
            entry.setActualValue(actualValue);
            entry.setNotes(notes);

            ActivityLog saved = activityLogRepository.save(entry);
            log.debug("Logged activity {} for {} (completed={})", activityId, date, completed);
            return saved;
        });
    }

    /**
     * Logs of one user on one date, joined with their activities.
     */
    @Transactional(readOnly = true)
    public List<ActivityLogDTO> getActivityLogsForDate(Long userId, LocalDate date) {
        return activityLogRepository.findWithActivityByUserIdAndLogDate(userId, date).stream()
            .map(row -> ActivityLogDTO.from((ActivityLog) row[0], (Activity) row[1]))
            .collect(Collectors.toList());
    }

    /**
     * Completion statistics per active activity between two dates, both inclusive.
     */
    @Transactional(readOnly = true)
    public List<ActivityStatDTO> getActivityStats(Long userId, LocalDate startDate, LocalDate endDate) {
        return activityRepository.findCompletionStats(userId, startDate, endDate).stream()
            .map(activityStatsMapper::mapToActivityStatDTO)
            .collect(Collectors.toList());
    }

    // ------------------------------------------------------------- workouts

    public WorkoutSession createWorkoutSession(Long userId, WorkoutSessionRequest request) {
        return inWriteTransaction(status -> workoutSessionRepository.save(WorkoutSession.builder()
            .userId(userId)
            .workoutType(request.getWorkoutType())
            .durationMinutes(request.getDurationMinutes())
            .caloriesBurned(request.getCaloriesBurned())
            .intensity(request.getIntensity())
            .notes(request.getNotes())
            .sessionDate(request.getSessionDate())
            .build()));
    }

    @Transactional(readOnly = true)
    public List<WorkoutSession> findWorkoutSessions(Long userId, LocalDate startDate, LocalDate endDate) {
        return workoutSessionRepository.findByUserIdAndSessionDateBetweenOrderBySessionDateDescIdDesc(
            userId, startDate, endDate);
    }

    // --------------------------------------------------------- measurements

    public BodyMeasurement addBodyMeasurement(Long userId, BodyMeasurementRequest request) {
        return inWriteTransaction(status -> bodyMeasurementRepository.save(BodyMeasurement.builder()
            .userId(userId)
            .weight(request.getWeight())
            .bodyFatPercentage(request.getBodyFatPercentage())
            .muscleMass(request.getMuscleMass())
            .waistCircumference(request.getWaistCircumference())
            .measurementDate(request.getMeasurementDate())
            .build()));
    }

    @Transactional(readOnly = true)
    public List<BodyMeasurement> findBodyMeasurements(Long userId, int limit) {
        return bodyMeasurementRepository.findByUserIdOrderByMeasurementDateDescIdDesc(userId, PageRequest.of(0, limit));
    }

    // -------------------------------------------------------------- cleanup

    /**
     * Remove every row the user owns in the five child tables, in one transaction.
     * The user row itself stays.
     */
    public void clearUserData(Long userId) {
        inWriteTransaction(status -> {
            int logs = activityLogRepository.deleteAllForUser(userId);
            int activities = activityRepository.deleteAllForUser(userId);
            int workouts = workoutSessionRepository.deleteAllForUser(userId);
            int measurements = bodyMeasurementRepository.deleteAllForUser(userId);
            int profiles = userProfileRepository.deleteAllForUser(userId);
            log.debug("Cleared data of user {}: logs={}, activities={}, workouts={}, measurements={}, profiles={}",
                userId, logs, activities, workouts, measurements, profiles);
            return null;
        });
    }

    private <T> T inWriteTransaction(TransactionCallback<T> action) {
        writeLock.lock();
        try {
            return transactionTemplate.execute(action);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Whether an integrity failure comes from the unique email constraint.
     */
    private static boolean isDuplicateEmail(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        String message = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
        return message != null && message.toUpperCase(Locale.ROOT).contains(EMAIL_UNIQUE_CONSTRAINT);
    }

    private static void applyActivityFields(Activity activity, ActivityRequest request) {
        activity.setName(request.getName().trim());
        activity.setDescription(request.getDescription());
        activity.setIcon(request.getIcon());
        activity.setTargetValue(request.getTargetValue());
        activity.setTargetUnit(request.getTargetUnit());
        activity.setCategory(request.getCategory());
    }
}
