package win.ixuni.strontium.core.session;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.strontium.core.driver.AutomationDriver;
import win.ixuni.strontium.core.driver.Capabilities;
import win.ixuni.strontium.core.exception.SessionNotFoundException;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * An active automation session
 * <p>
 * Owns its driver exclusively. Drivers are not safe for concurrent use, so every command runs
 * through {@link #execute(Supplier)}, which admits one command per session at a time while
 * commands on different sessions proceed in parallel.
 */
@Slf4j
public class DriverSession {

    @Getter
    private final SessionId id;

    @Getter
    private final Capabilities capabilities;

    @Getter
    private final AutomationDriver driver;

    @Getter
    private final Instant createdAt;

    private volatile Instant lastAccessTime;

    private volatile boolean closed;

    private final ReentrantLock commandLock = new ReentrantLock(true);

    DriverSession(SessionId id, Capabilities capabilities, AutomationDriver driver) {
        this.id = id;
        this.capabilities = capabilities;
        this.driver = driver;
        this.createdAt = Instant.now();
        this.lastAccessTime = createdAt;
    }

    /**
     * Run one command against the driver while holding the session lock
     *
     * @param action command body
     * @param <T>    result type
     * @return the action's result
     * @throws SessionNotFoundException if the session was closed while the command waited
     */
    public <T> T execute(Supplier<T> action) {
        commandLock.lock();
        try {
            log.debug("[SESSION_LOCK] Acquired lock for session={}", id);
            if (closed) {
                throw new SessionNotFoundException(id.toString());
            }
            lastAccessTime = Instant.now();
            return action.get();
        } finally {
            lastAccessTime = Instant.now();
            commandLock.unlock();
            log.debug("[SESSION_LOCK] Released lock for session={}", id);
        }
    }

    public Instant getLastAccessTime() {
        return lastAccessTime;
    }

    public boolean isBusy() {
        return commandLock.isLocked();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Quit the driver once any in-flight command has finished
     * <p>
     * The session is marked closed before the driver quits, so commands still waiting for the
     * lock fail instead of reaching the driver. Quitting an already closed session does nothing.
     *
     * @throws RuntimeException whatever the driver throws while quitting
     */
    public void quit() {
        commandLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            driver.quit();
            log.info("Driver for session {} shut down", id);
        } finally {
            commandLock.unlock();
        }
    }

    /**
     * Same as {@link #quit()}, but a failing quit is logged, not rethrown: the session is
     * already gone from the store.
     */
    public void close() {
        try {
            quit();
        } catch (RuntimeException e) {
            log.error("Error shutting down driver for session {}: {}", id, e.getMessage(), e);
        }
    }
}
