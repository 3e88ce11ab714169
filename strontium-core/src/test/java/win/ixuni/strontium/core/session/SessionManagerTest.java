package win.ixuni.strontium.core.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import win.ixuni.strontium.core.driver.Capabilities;
import win.ixuni.strontium.core.driver.DriverRegistry;
import win.ixuni.strontium.core.driver.DriverTypeLoader;
import win.ixuni.strontium.core.exception.SessionCreationFailedException;
import win.ixuni.strontium.core.support.FakeAutomationDriver;
import win.ixuni.strontium.core.support.TestDrivers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Session store tests
 */
class SessionManagerTest {

    private static final Capabilities TEST_BROWSER = Capabilities.of("browser", "test");

    private DriverRegistry driverRegistry;
    private SessionManager sessionManager;

    @BeforeEach
    void setUp() {
        driverRegistry = new DriverRegistry(new DriverTypeLoader(Path.of("target", "no-driver-libraries")));
        driverRegistry.registerDriver(TEST_BROWSER, FakeAutomationDriver.class.getName());
        sessionManager = new SessionManager(driverRegistry);
    }

    @Test
    void createdSessionCanBeRetrieved() {
        SessionId id = sessionManager.createSession(TEST_BROWSER);

        DriverSession session = sessionManager.getSession(id).orElseThrow();
        assertEquals(id, session.getId());
        assertEquals(TEST_BROWSER, session.getCapabilities());
        assertInstanceOf(FakeAutomationDriver.class, session.getDriver());
        assertEquals(session, sessionManager.getSession(id.toString()).orElseThrow());
        assertEquals(List.of(id.toString()), sessionManager.listSessionIds());
    }

    @Test
    void sequentialSessionsHaveDistinctIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(sessionManager.createSession(TEST_BROWSER).toString());
        }

        assertEquals(50, ids.size());
        assertEquals(ids, new HashSet<>(sessionManager.listSessionIds()));
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrent creation yields one distinct id per session")
    void concurrentSessionsHaveDistinctIds() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<SessionId> ids = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(sessionManager.createSession(TEST_BROWSER));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, ids.size());
        assertEquals(threads * perThread, sessionManager.listSessionIds().size());
        assertEquals(threads * perThread, sessionManager.getSessionCount());
    }

    @Test
    void removedSessionIsAbsent() {
        SessionId id = sessionManager.createSession(TEST_BROWSER);

        assertTrue(sessionManager.removeSession(id).isPresent());

        assertTrue(sessionManager.getSession(id).isEmpty());
        assertTrue(sessionManager.listSessionIds().isEmpty());
    }

    @Test
    @DisplayName("Removing an unknown session is a no-op")
    void removingUnknownSessionIsNoOp() {
        SessionId kept = sessionManager.createSession(TEST_BROWSER);
        List<String> before = sessionManager.listSessionIds();

        assertDoesNotThrow(() -> sessionManager.removeSession(SessionId.random()));
        assertDoesNotThrow(() -> sessionManager.removeSession(null));

        assertEquals(before, sessionManager.listSessionIds());
        assertTrue(sessionManager.getSession(kept).isPresent());

        sessionManager.removeSession(kept);
        assertTrue(sessionManager.removeSession(kept).isEmpty());
    }

    @Test
    void unknownOrNullIdIsAbsent() {
        assertTrue(sessionManager.getSession(SessionId.random()).isEmpty());
        assertTrue(sessionManager.getSession((SessionId) null).isEmpty());
        assertTrue(sessionManager.getSession((String) null).isEmpty());
        assertTrue(sessionManager.getSession("not-a-session").isEmpty());
    }

    @Test
    void creationFailsWithoutMatchingDriver() {
        SessionCreationFailedException e = assertThrows(SessionCreationFailedException.class,
                () -> sessionManager.createSession(Capabilities.of("browser", "unknown")));

        assertEquals("session not created", e.getErrorCode());
        assertTrue(sessionManager.listSessionIds().isEmpty());
    }

    @Test
    void creationFailsWhenDriverCannotBeInstantiated() {
        Capabilities failing = Capabilities.of("browser", "failing");
        driverRegistry.registerDriver(failing, TestDrivers.FailingDriver.class.getName());

        SessionCreationFailedException e = assertThrows(SessionCreationFailedException.class,
                () -> sessionManager.createSession(failing));

        assertTrue(e.getMessage().contains("browser binary not found"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(sessionManager.listSessionIds().isEmpty());
    }

    @Test
    void closeAllQuitsEveryDriver() {
        SessionId first = sessionManager.createSession(TEST_BROWSER);
        SessionId second = sessionManager.createSession(TEST_BROWSER);
        FakeAutomationDriver firstDriver = (FakeAutomationDriver) sessionManager.getSession(first).orElseThrow().getDriver();
        FakeAutomationDriver secondDriver = (FakeAutomationDriver) sessionManager.getSession(second).orElseThrow().getDriver();

        sessionManager.closeAll();

        assertEquals(0, sessionManager.getSessionCount());
        assertTrue(firstDriver.isQuit());
        assertTrue(secondDriver.isQuit());
    }

    @Test
    void removalDoesNotQuitDriver() {
        SessionId id = sessionManager.createSession(TEST_BROWSER);
        DriverSession session = sessionManager.removeSession(id).orElseThrow();

        assertFalse(((FakeAutomationDriver) session.getDriver()).isQuit());
        session.close();
        assertTrue(((FakeAutomationDriver) session.getDriver()).isQuit());
    }
}
