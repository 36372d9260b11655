package net.javahippie.fittracker.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.fittracker.exception.StorageException;
import net.javahippie.fittracker.model.dto.UserDTO;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps "who is logged in" on local disk, independent of the relational store.
 *
 * <p>The session lives in a single JSON file named after a fixed namespace key inside the session
 * directory. It survives process restarts until {@link #clearSession()} is called.</p>
 */
@Component
@Slf4j
public class SessionStore {

    private final ObjectMapper objectMapper;
    private final Path sessionFile;
    private final Clock clock;

    @Autowired
    public SessionStore(
            ObjectMapper objectMapper,
            @Value("${fittracker.session.directory}") String directory,
            @Value("${fittracker.session.key:fitness_tracker_session}") String key) {
        this(objectMapper, Paths.get(directory), key, Clock.systemUTC());
    }

    SessionStore(ObjectMapper objectMapper, Path directory, String key, Clock clock) {
        this.objectMapper = objectMapper;
        this.sessionFile = directory.resolve(key + ".json");
        this.clock = clock;
    }

    /**
     * Persist the given user as the current session, replacing any previous one.
     *
     * @param user public user record
     * @throws StorageException if the session file cannot be written
     */
    public void createSession(UserDTO user) {
        StoredSession session = new StoredSession(user, Instant.now(clock));
        try {
            Files.createDirectories(sessionFile.getParent());
            Path tmp = Files.createTempFile(sessionFile.getParent(), "session", ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), session);
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Session stored for user {}", user.getId());
        } catch (IOException e) {
            throw new StorageException("Failed to store session", e);
        }
    }

    /**
     * Read the current session's user.
     *
     * @return the user, or empty when no session exists or it cannot be read
     */
    public Optional<UserDTO> getCurrentUser() {
        return readSession().map(StoredSession::user);
    }

    /**
     * Read the full stored session, including its creation time.
     */
    public Optional<StoredSession> readSession() {
        if (!Files.exists(sessionFile)) {
            return Optional.empty();
        }
        try {
            StoredSession session = objectMapper.readValue(sessionFile.toFile(), StoredSession.class);
            if (session == null || session.user() == null) {
                log.warn("Session file {} holds no user, ignoring it", sessionFile);
                return Optional.empty();
            }
            return Optional.of(session);
        } catch (JsonProcessingException e) {
            log.warn("Session file {} is corrupt, ignoring it: {}", sessionFile, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Could not read session file {}: {}", sessionFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Remove the stored session. Does nothing when there is none.
     *
     * @throws StorageException if the session file exists but cannot be removed
     */
    public void clearSession() {
        try {
            if (Files.deleteIfExists(sessionFile)) {
                log.debug("Session cleared");
            }
        } catch (IOException e) {
            throw new StorageException("Failed to clear session", e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, sessionFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, sessionFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
