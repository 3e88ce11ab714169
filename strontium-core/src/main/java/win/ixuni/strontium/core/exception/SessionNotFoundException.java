package win.ixuni.strontium.core.exception;

import lombok.Getter;

/**
 * Session not found exception
 */
@Getter
public class SessionNotFoundException extends StrontiumException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("invalid session id", "No active session with ID " + sessionId, 404);
        this.sessionId = sessionId;
    }
}
