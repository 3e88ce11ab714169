package win.ixuni.strontium.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import win.ixuni.strontium.core.config.StrontiumProperties;
import win.ixuni.strontium.core.session.DriverSession;
import win.ixuni.strontium.core.session.SessionManager;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Quits sessions that have been idle for too long
 * <p>
 * Disabled unless {@code strontium.session.idle-timeout} is set to a positive duration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdleSessionReaper {

    private final StrontiumProperties properties;
    private final SessionManager sessionManager;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${strontium.session.reaper-interval:PT60S}")
    public void scheduledReap() {
        Duration idleTimeout = properties.getSession().getIdleTimeout();
        if (idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()) {
            log.trace("Idle session expiry is disabled");
            return;
        }

        if (!running.compareAndSet(false, true)) {
            log.warn("Previous idle session sweep is still running, skipping this run");
            return;
        }

        try {
            reapIdleSessions(idleTimeout, Instant.now());
        } finally {
            running.set(false);
        }
    }

    /**
     * Remove and quit every session idle since before {@code now - idleTimeout}
     * <p>
     * Sessions with a command in flight are never reaped.
     *
     * @return number of sessions reaped
     */
    public int reapIdleSessions(Duration idleTimeout, Instant now) {
        Instant cutoff = now.minus(idleTimeout);
        int reaped = 0;
        for (DriverSession session : sessionManager.listSessions()) {
            if (session.isBusy() || !session.getLastAccessTime().isBefore(cutoff)) {
                continue;
            }
            if (sessionManager.removeSession(session.getId()).isPresent()) {
                log.info("Session {} idle since {}, quitting", session.getId(), session.getLastAccessTime());
                session.close();
                reaped++;
            }
        }
        if (reaped > 0) {
            log.info("Reaped {} idle sessions", reaped);
        }
        return reaped;
    }
}
