package net.javahippie.fittracker.service;

import net.javahippie.fittracker.exception.DuplicateEmailException;
import net.javahippie.fittracker.exception.NotFoundException;
import net.javahippie.fittracker.model.dto.ActivityLogDTO;
import net.javahippie.fittracker.model.dto.ActivityRequest;
import net.javahippie.fittracker.model.dto.ActivityStatDTO;
import net.javahippie.fittracker.model.dto.BodyMeasurementRequest;
import net.javahippie.fittracker.model.dto.ProfileUpdateRequest;
import net.javahippie.fittracker.model.dto.WorkoutSessionRequest;
import net.javahippie.fittracker.model.entity.Activity;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for FitnessDataStore against the embedded database and the real schema.
 * Not transactional: every write commits, so the tests see what a later session would see.
 */
@SpringBootTest
@ActiveProfiles("test")
class FitnessDataStoreIntegrationTest {

    @Autowired
    private FitnessDataStore dataStore;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private UserProfileRepository userProfileRepository;

    @Autowired
    private ActivityRepository activityRepository;

    @Autowired
    private ActivityLogRepository activityLogRepository;

    @Autowired
    private WorkoutSessionRepository workoutSessionRepository;

    @Autowired
    private BodyMeasurementRepository bodyMeasurementRepository;

    private LocalDate today;

    @BeforeEach
    void setUp() {
        today = LocalDate.of(2024, 3, 15);
    }

    @Test
    @DisplayName("New account should come with a profile and its starter activities")
    void testCreateAccount() {
        User user = dataStore.createAccount(uniqueEmail(), "aaaa:bbbb", "Test User", DefaultActivityCatalog.ACTIVITIES);

        assertNotNull(user.getId());
        assertNotNull(user.getCreatedAt());
        assertTrue(dataStore.findProfile(user.getId()).isPresent());
        assertThat(dataStore.findActiveActivities(user.getId()))
            .hasSize(7)
            .allMatch(Activity::isActive)
            .extracting(Activity::getName)
            .contains("💧 Hydration", "📊 Track Progress");
    }

    @Test
    @DisplayName("Second account with the same email should be rejected")
    void testCreateAccount_Duplicate() {
        String email = uniqueEmail();
        dataStore.createAccount(email, "aaaa:bbbb", "Test User", List.of());

        assertThrows(DuplicateEmailException.class,
            () -> dataStore.createAccount(email, "cccc:dddd", "Other User", List.of()));
        assertEquals(1, userRepository.findAll().stream().filter(u -> u.getEmail().equals(email)).count());
    }

    @Test
    @DisplayName("Integrity failures other than the unique email should not be reported as duplicates")
    void testCreateAccount_OtherIntegrityFailure() {
        String email = "user-" + "a".repeat(300) + "@test.com";

        DataIntegrityViolationException e = assertThrows(DataIntegrityViolationException.class,
            () -> dataStore.createAccount(email, "aaaa:bbbb", "Long Mail", List.of()));

        assertThat(e).isNotInstanceOf(DuplicateKeyException.class);
        assertTrue(dataStore.findUserByEmail(email).isEmpty());
    }

    @Test
    @DisplayName("Concurrent registrations of one email should produce exactly one account")
    void testCreateAccount_ConcurrentDuplicate() throws Exception {
        String email = uniqueEmail();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        dataStore.createAccount(email, "aaaa:bbbb", "Test User", List.of());
                        return true;
                    } catch (DuplicateEmailException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int created = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    created++;
                }
            }
            assertEquals(1, created);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Logging the same activity twice on one day should keep one row with the last value")
    void testLogActivity_Upsert() {
        // Given
        Long userId = createUser();
        Long activityId = createActivity(userId, "Cardio").getId();

        // When
        dataStore.logActivity(userId, activityId, today, true, 30.0, "first");
        dataStore.logActivity(userId, activityId, today, false, null, "second");

        // Then
        assertEquals(1, activityLogRepository.countByActivityIdAndLogDate(activityId, today));
        List<ActivityLogDTO> logs = dataStore.getActivityLogsForDate(userId, today);
        assertEquals(1, logs.size());
        assertFalse(logs.get(0).isCompleted());
        assertNull(logs.get(0).getActualValue());
        assertEquals("second", logs.get(0).getNotes());
    }

    @Test
    @DisplayName("Logs on different days should be separate rows")
    void testLogActivity_DifferentDays() {
        Long userId = createUser();
        Long activityId = createActivity(userId, "Cardio").getId();

        dataStore.logActivity(userId, activityId, today, true, null, null);
        dataStore.logActivity(userId, activityId, today.plusDays(1), true, null, null);

        assertEquals(2, activityLogRepository.countByUserId(userId));
    }

    @Test
    @DisplayName("Concurrent toggles of one activity on one day should never create a second row")
    void testLogActivity_ConcurrentToggles() throws Exception {
        // Given
        Long userId = createUser();
        Long activityId = createActivity(userId, "Hydration").getId();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            final boolean value = t % 2 == 0;
            tasks.add(() -> {
                start.await();
                for (int i = 0; i < 10; i++) {
                    dataStore.logActivity(userId, activityId, today, value, null, null);
                }
                return null;
            });
        }

        // When
        try {
            List<Future<Void>> futures = new ArrayList<>();
            for (Callable<Void> task : tasks) {
                futures.add(executor.submit(task));
            }
            start.countDown();
            for (Future<Void> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        dataStore.logActivity(userId, activityId, today, true, 8.0, null);

        // Then
        assertEquals(1, activityLogRepository.countByActivityIdAndLogDate(activityId, today));
        ActivityLogDTO log = dataStore.getActivityLogsForDate(userId, today).get(0);
        assertTrue(log.isCompleted());
        assertEquals(8.0, log.getActualValue());
    }

    @Test
    @DisplayName("Logs for a date should carry the activity fields")
    void testGetActivityLogsForDate() {
        Long userId = createUser();
        Activity cardio = createActivity(userId, "Cardio");
        Activity sleep = createActivity(userId, "Sleep");
        dataStore.logActivity(userId, cardio.getId(), today, true, 25.0, null);
        dataStore.logActivity(userId, sleep.getId(), today.minusDays(1), true, 8.0, null);

        List<ActivityLogDTO> logs = dataStore.getActivityLogsForDate(userId, today);

        assertEquals(1, logs.size());
        assertEquals("Cardio", logs.get(0).getName());
        assertEquals("exercise", logs.get(0).getCategory());
        assertEquals(today, logs.get(0).getLogDate());
    }

    @Test
    @DisplayName("Logs and stats of one user should never include another user's rows")
    void testLogsAndStats_UserIsolation() {
        // Given
        Long userA = createUser();
        Long userB = createUser();
        Activity cardioA = createActivity(userA, "Cardio A");
        Activity sleepA = createActivity(userA, "Sleep A");
        Activity cardioB = createActivity(userB, "Cardio B");
        dataStore.logActivity(userA, cardioA.getId(), today, true, 30.0, null);
        dataStore.logActivity(userA, sleepA.getId(), today, false, null, null);
        dataStore.logActivity(userB, cardioB.getId(), today, false, 10.0, null);

        // When
        List<ActivityLogDTO> logsB = dataStore.getActivityLogsForDate(userB, today);
        List<ActivityStatDTO> statsB = dataStore.getActivityStats(userB, today, today);

        // Then
        assertThat(logsB)
            .extracting(ActivityLogDTO::getActivityId)
            .containsExactly(cardioB.getId());
        assertThat(logsB).allMatch(log -> log.getUserId().equals(userB));

        assertEquals(1, statsB.size());
        assertEquals(cardioB.getId(), statsB.get(0).getActivityId());
        assertEquals(0, statsB.get(0).getCompletedCount());
        assertEquals(1, statsB.get(0).getTotalCount());

        assertThat(dataStore.getActivityLogsForDate(userA, today))
            .extracting(ActivityLogDTO::getActivityId)
            .containsExactlyInAnyOrder(cardioA.getId(), sleepA.getId());
        assertThat(dataStore.getActivityStats(userA, today, today))
            .extracting(ActivityStatDTO::getActivityId)
            .containsExactlyInAnyOrder(cardioA.getId(), sleepA.getId());
    }

    @Test
    @DisplayName("Stats should count logs in range and report zero for activities without logs")
    void testGetActivityStats() {
        // Given
        Long userId = createUser();
        Activity cardio = createActivity(userId, "Cardio");
        Activity sleep = createActivity(userId, "Sleep");
        dataStore.logActivity(userId, cardio.getId(), today.minusDays(2), true, null, null);
        dataStore.logActivity(userId, cardio.getId(), today.minusDays(1), false, null, null);
        dataStore.logActivity(userId, cardio.getId(), today, true, null, null);
        dataStore.logActivity(userId, cardio.getId(), today.minusDays(30), true, null, null);

        // When
        List<ActivityStatDTO> stats = dataStore.getActivityStats(userId, today.minusDays(6), today);

        // Then
        assertEquals(2, stats.size());
        ActivityStatDTO cardioStat = stats.stream()
            .filter(s -> s.getActivityId().equals(cardio.getId())).findFirst().orElseThrow();
        assertEquals(2, cardioStat.getCompletedCount());
        assertEquals(3, cardioStat.getTotalCount());
        assertEquals(200.0 / 3, cardioStat.getCompletionRate(), 0.001);

        ActivityStatDTO sleepStat = stats.stream()
            .filter(s -> s.getActivityId().equals(sleep.getId())).findFirst().orElseThrow();
        assertEquals(0, sleepStat.getCompletedCount());
        assertEquals(0, sleepStat.getTotalCount());
        assertEquals(0.0, sleepStat.getCompletionRate());
    }

    @Test
    @DisplayName("Deleted activities should drop out of stats and lists but keep their logs")
    void testDeleteActivity_SoftDelete() {
        // Given
        Long userId = createUser();
        Activity cardio = createActivity(userId, "Cardio");
        Activity sleep = createActivity(userId, "Sleep");
        Activity stretch = createActivity(userId, "Stretching");
        dataStore.logActivity(userId, sleep.getId(), today, true, null, null);

        // When
        dataStore.deleteActivity(sleep.getId());

        // Then
        assertThat(dataStore.findActiveActivities(userId))
            .extracting(Activity::getId)
            .containsExactlyInAnyOrder(cardio.getId(), stretch.getId());
        assertThat(dataStore.getActivityStats(userId, today, today))
            .extracting(ActivityStatDTO::getActivityId)
            .doesNotContain(sleep.getId());
        assertEquals(1, activityLogRepository.countByActivityIdAndLogDate(sleep.getId(), today));
        assertFalse(dataStore.findActivity(userId, sleep.getId()).orElseThrow().isActive());
        assertEquals(3, activityRepository.countByUserId(userId));
    }

    @Test
    @DisplayName("Deleting an unknown activity should fail with not found")
    void testDeleteActivity_Unknown() {
        assertThrows(NotFoundException.class, () -> dataStore.deleteActivity(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("Activity lookup should be scoped to its owner")
    void testFindActivity_Ownership() {
        Long owner = createUser();
        Long other = createUser();
        Activity cardio = createActivity(owner, "Cardio");

        assertTrue(dataStore.findActivity(owner, cardio.getId()).isPresent());
        assertTrue(dataStore.findActivity(other, cardio.getId()).isEmpty());
    }

    @Test
    @DisplayName("Updating an activity should replace its fields")
    void testUpdateActivity() {
        Long userId = createUser();
        Activity cardio = createActivity(userId, "Cardio");

        Activity updated = dataStore.updateActivity(cardio.getId(), ActivityRequest.builder()
            .name("  Running  ")
            .targetValue(5.0)
            .targetUnit("km")
            .category("exercise")
            .build());

        assertEquals("Running", updated.getName());
        assertEquals(5.0, updated.getTargetValue());
        assertEquals("km", updated.getTargetUnit());
        assertTrue(updated.isActive());
    }

    @Test
    @DisplayName("Deleting a user should cascade to all owned rows and leave other users untouched")
    void testDeleteUser_Cascade() {
        // Given
        Long doomed = createUserWithData();
        Long survivor = createUserWithData();

        // When
        dataStore.deleteUser(doomed);

        // Then
        assertFalse(dataStore.userExists(doomed));
        assertEquals(0, activityRepository.countByUserId(doomed));
        assertEquals(0, activityLogRepository.countByUserId(doomed));
        assertEquals(0, workoutSessionRepository.countByUserId(doomed));
        assertEquals(0, bodyMeasurementRepository.countByUserId(doomed));
        assertTrue(userProfileRepository.findByUserId(doomed).isEmpty());

        assertTrue(dataStore.userExists(survivor));
        assertEquals(1, activityRepository.countByUserId(survivor));
        assertEquals(1, activityLogRepository.countByUserId(survivor));
        assertEquals(1, workoutSessionRepository.countByUserId(survivor));
        assertEquals(1, bodyMeasurementRepository.countByUserId(survivor));
        assertTrue(userProfileRepository.findByUserId(survivor).isPresent());
    }

    @Test
    @DisplayName("Deleting an unknown user should fail with not found")
    void testDeleteUser_Unknown() {
        assertThrows(NotFoundException.class, () -> dataStore.deleteUser(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("Clearing data should empty the child tables of one user only")
    void testClearUserData() {
        // Given
        Long cleared = createUserWithData();
        Long other = createUserWithData();

        // When
        dataStore.clearUserData(cleared);

        // Then
        assertTrue(dataStore.userExists(cleared));
        assertEquals(0, activityRepository.countByUserId(cleared));
        assertEquals(0, activityLogRepository.countByUserId(cleared));
        assertEquals(0, workoutSessionRepository.countByUserId(cleared));
        assertEquals(0, bodyMeasurementRepository.countByUserId(cleared));
        assertTrue(userProfileRepository.findByUserId(cleared).isEmpty());

        assertEquals(1, activityRepository.countByUserId(other));
        assertEquals(1, activityLogRepository.countByUserId(other));
        assertEquals(1, workoutSessionRepository.countByUserId(other));
        assertEquals(1, bodyMeasurementRepository.countByUserId(other));
    }

    @Test
    @DisplayName("Password update should only touch the given user")
    void testUpdatePasswordHash() {
        Long userId = createUser();
        Long other = createUser();

        dataStore.updatePasswordHash(userId, "eeee:ffff");

        assertEquals("eeee:ffff", dataStore.findUserById(userId).orElseThrow().getPasswordHash());
        assertEquals("aaaa:bbbb", dataStore.findUserById(other).orElseThrow().getPasswordHash());
        assertThrows(NotFoundException.class, () -> dataStore.updatePasswordHash(Long.MAX_VALUE, "eeee:ffff"));
    }

    @Test
    @DisplayName("Profile upsert should replace the existing profile row")
    void testUpsertProfile() {
        Long userId = createUser();

        dataStore.upsertProfile(userId, ProfileUpdateRequest.builder().age(30).weight(70.0).build());
        dataStore.upsertProfile(userId, ProfileUpdateRequest.builder().age(31).fitnessGoal("Run a 10k").build());

        UserProfile profile = dataStore.findProfile(userId).orElseThrow();
        assertEquals(31, profile.getAge());
        assertNull(profile.getWeight());
        assertEquals("Run a 10k", profile.getFitnessGoal());
    }

    @Test
    @DisplayName("Measurements should be returned newest first up to the limit")
    void testFindBodyMeasurements() {
        Long userId = createUser();
        for (int i = 0; i < 5; i++) {
            dataStore.addBodyMeasurement(userId, BodyMeasurementRequest.builder()
                .weight(80.0 - i)
                .measurementDate(today.minusWeeks(4 - i))
                .build());
        }

        List<BodyMeasurement> latest = dataStore.findBodyMeasurements(userId, 3);

        assertThat(latest)
            .extracting(BodyMeasurement::getMeasurementDate)
            .containsExactly(today, today.minusWeeks(1), today.minusWeeks(2));
    }

    @Test
    @DisplayName("Workout sessions should be filtered by the inclusive date range")
    void testFindWorkoutSessions() {
        Long userId = createUser();
        dataStore.createWorkoutSession(userId, workout("Running", today.minusDays(10)));
        dataStore.createWorkoutSession(userId, workout("Cycling", today.minusDays(7)));
        dataStore.createWorkoutSession(userId, workout("Yoga", today));

        List<WorkoutSession> sessions = dataStore.findWorkoutSessions(userId, today.minusDays(7), today);

        assertThat(sessions)
            .extracting(WorkoutSession::getWorkoutType)
            .containsExactly("Yoga", "Cycling");
    }

    private Long createUser() {
        return dataStore.createAccount(uniqueEmail(), "aaaa:bbbb", "Test User", List.of()).getId();
    }

    private Long createUserWithData() {
        Long userId = createUser();
        Activity activity = createActivity(userId, "Cardio");
        dataStore.logActivity(userId, activity.getId(), today, true, 30.0, null);
        dataStore.createWorkoutSession(userId, workout("Running", today));
        dataStore.addBodyMeasurement(userId, BodyMeasurementRequest.builder()
            .weight(75.0)
            .measurementDate(today)
            .build());
        return userId;
    }

    private Activity createActivity(Long userId, String name) {
        return dataStore.createActivity(userId, ActivityRequest.builder()
            .name(name)
            .targetValue(30.0)
            .targetUnit("minutes")
            .category("exercise")
            .build());
    }

    private static WorkoutSessionRequest workout(String type, LocalDate date) {
        return WorkoutSessionRequest.builder()
            .workoutType(type)
            .durationMinutes(45)
            .intensity("moderate")
            .sessionDate(date)
            .build();
    }

    private static String uniqueEmail() {
        return "user-" + UUID.randomUUID() + "@test.com";
    }
}
