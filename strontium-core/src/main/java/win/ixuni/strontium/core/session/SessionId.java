package win.ixuni.strontium.core.session;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque session identifier
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SessionId {

    private final String value;

    /**
     * Generate a fresh identifier from a random UUID
     * <p>
     * Collisions are not checked; the 122 random bits make them negligible.
     */
    public static SessionId random() {
        return new SessionId(UUID.randomUUID().toString());
    }

    public static SessionId of(String value) {
        Objects.requireNonNull(value, "session id");
        return new SessionId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
