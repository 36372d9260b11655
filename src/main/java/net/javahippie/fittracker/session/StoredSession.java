package net.javahippie.fittracker.session;

import net.javahippie.fittracker.model.dto.UserDTO;

import java.time.Instant;

/**
 * Persisted marker of the authenticated user.
 *
 * @param user public user record, never carries a password hash
 * @param createdAt when the session was created
 */
public record StoredSession(UserDTO user, Instant createdAt) {
}
