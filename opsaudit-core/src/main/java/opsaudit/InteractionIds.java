package opsaudit;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.UUID;

/**
 * Identifier factory for sessions and interactions.
 *
 * <p>Identifiers are monotonic ULIDs rendered as UUIDs, so they sort by creation time in
 * both the store's UUID columns and in logs.
 */
public final class InteractionIds {

    private InteractionIds() {
    }

    public static UUID newInteractionId() {
        return UlidCreator.getMonotonicUlid().toUuid();
    }

    public static UUID newSessionId() {
        return UlidCreator.getMonotonicUlid().toUuid();
    }

    /**
     * Parses a session id presented by a client (for example a cookie value), minting a new
     * one when the value is absent or malformed.
     *
     * @param value the presented value, may be {@code null}
     * @return the parsed id, or a fresh one
     */
    public static UUID sessionIdOrNew(String value) {
        if (value == null || value.isBlank()) {
            return newSessionId();
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            return newSessionId();
        }
    }
}
