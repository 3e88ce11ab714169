package win.ixuni.strontium.core.session;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.strontium.core.driver.AutomationDriver;
import win.ixuni.strontium.core.driver.Capabilities;
import win.ixuni.strontium.core.driver.DriverFactory;
import win.ixuni.strontium.core.driver.DriverRegistry;
import win.ixuni.strontium.core.exception.SessionCreationFailedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Manages the sessions active in the server
 * <p>
 * One instance per server, created at startup and handed to every component that needs it.
 * Create and remove run under the write lock and the id snapshot under the read lock;
 * single lookups read the concurrent map directly.
 */
@Slf4j
public class SessionManager {

    private final DriverRegistry driverRegistry;

    private final Map<SessionId, DriverSession> sessions = new ConcurrentHashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public SessionManager(DriverRegistry driverRegistry) {
        this.driverRegistry = driverRegistry;
    }

    /**
     * Create a new session with the desired capabilities
     *
     * @param desiredCapabilities capabilities requested by the client
     * @return the id of the created session
     * @throws SessionCreationFailedException if no driver matches or the driver cannot be created
     */
    public SessionId createSession(Capabilities desiredCapabilities) {
        Capabilities desired = desiredCapabilities != null ? desiredCapabilities : Capabilities.empty();
        DriverFactory factory = driverRegistry.resolve(desired)
                .orElseThrow(() -> new SessionCreationFailedException(
                        "No registered driver matches " + desired));

        AutomationDriver driver;
        try {
            driver = factory.createDriver(desired);
        } catch (RuntimeException e) {
            throw new SessionCreationFailedException(
                    "Failed to create driver " + factory.getDriverType() + ": " + e.getMessage(), e);
        }
        if (driver == null) {
            throw new SessionCreationFailedException("Driver factory " + factory.getDriverType() + " returned no driver");
        }

        SessionId sessionId = SessionId.random();
        DriverSession session = new DriverSession(sessionId, desired, driver);
        lock.writeLock().lock();
        try {
            sessions.put(sessionId, session);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Created session {} using driver {}", sessionId, factory.getDriverType());
        return sessionId;
    }

    /**
     * Get an existing session
     *
     * @param sessionId session id, may be null
     * @return the session, empty if the id is unknown
     */
    public Optional<DriverSession> getSession(SessionId sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<DriverSession> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return getSession(SessionId.of(sessionId));
    }

    /**
     * Remove a session; unknown ids are ignored
     * <p>
     * The driver is not shut down here. The caller owning the session's lifecycle closes it.
     *
     * @param sessionId session id
     * @return the removed session, empty if there was none
     */
    public Optional<DriverSession> removeSession(SessionId sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        DriverSession removed;
        lock.writeLock().lock();
        try {
            removed = sessions.remove(sessionId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            log.info("Removed session {}", sessionId);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Get the ids of the currently active sessions
     *
     * @return snapshot of session ids
     */
    public List<String> listSessionIds() {
        lock.readLock().lock();
        try {
            List<String> ids = new ArrayList<>(sessions.size());
            for (SessionId id : sessions.keySet()) {
                ids.add(id.toString());
            }
            return ids;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DriverSession> listSessions() {
        lock.readLock().lock();
        try {
            return List.copyOf(sessions.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getSessionCount() {
        return sessions.size();
    }

    /**
     * Remove every session and shut its driver down
     */
    public void closeAll() {
        List<DriverSession> removed;
        lock.writeLock().lock();
        try {
            removed = new ArrayList<>(sessions.values());
            sessions.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Closing {} active sessions", removed.size());
        removed.forEach(DriverSession::close);
    }
}
