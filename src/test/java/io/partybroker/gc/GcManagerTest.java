package io.partybroker.gc;

import io.partybroker.config.BrokerConfig;
import io.partybroker.config.BrokerSettings;
import io.partybroker.config.PartyRegistry;
import io.partybroker.model.QueryResult;
import io.partybroker.model.SessionStatus;
import io.partybroker.model.Status;
import io.partybroker.rpc.HttpInterPartyStub;
import io.partybroker.runtime.BrokerApp;
import io.partybroker.session.ExecuteInfo;
import io.partybroker.session.Session;
import io.partybroker.storage.SessionStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class GcManagerTest {

    @Test
    void sessionGcRemovesExactlyTheCanceledSessions() throws Exception {
        Path root = Files.createTempDirectory("partybroker-test-gc-session-");
        try {
            BrokerApp app = newApp(root);
            Session keep1 = app.createSession(info("job-1"), false);
            Session doomed = app.createSession(info("job-2"), false);
            Session keep2 = app.createSession(info("job-3"), false);
            // another replica of this party canceled job-2
            app.sessionStore().markSessionCanceled("job-2", 1_000L);

            GcManager gc = new GcManager(app, "replica-a");
            GcManager.SessionGcOutcome outcome = gc.sessionGcTick();

            Assertions.assertEquals(3, outcome.checked());
            Assertions.assertEquals(List.of("job-2"), outcome.removed());
            Assertions.assertNull(outcome.error());
            Assertions.assertEquals(2, app.sessions().size());
            Assertions.assertTrue(doomed.cancellation().isCanceled());
            Assertions.assertFalse(keep1.cancellation().isCanceled());
            Assertions.assertFalse(keep2.cancellation().isCanceled());

            GcManager.SessionGcOutcome second = gc.sessionGcTick();
            Assertions.assertEquals(2, second.checked());
            Assertions.assertTrue(second.removed().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sessionGcWithNoSessionsDoesNothing() throws Exception {
        Path root = Files.createTempDirectory("partybroker-test-gc-empty-");
        try {
            GcManager.SessionGcOutcome outcome = new GcManager(newApp(root), "replica-a").sessionGcTick();
            Assertions.assertEquals(0, outcome.checked());
            Assertions.assertTrue(outcome.removed().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void onlyTheLeaseHolderRunsStorageGc() throws Exception {
        Path root = Files.createTempDirectory("partybroker-test-gc-storage-lease-");
        try {
            BrokerApp app = newApp(root);
            long ttl = app.settings().sessionCheckIntervalMs();
            GcManager a = new GcManager(app, "replica-a");
            GcManager b = new GcManager(app, "replica-b");

            Assertions.assertTrue(a.storageGcTick(1_000L).leaseHeld());
            Assertions.assertFalse(b.storageGcTick(2_000L).leaseHeld());
            Assertions.assertTrue(a.storageGcTick(2_000L).leaseHeld());
            Assertions.assertFalse(b.storageGcTick(2_000L + ttl - 1L).leaseHeld());

            GcManager.StorageGcOutcome takeover = b.storageGcTick(2_000L + ttl);
            Assertions.assertTrue(takeover.leaseHeld());
            Assertions.assertEquals("replica-b", takeover.owner());
            Assertions.assertEquals("replica-b", app.sessionStore().currentGcLock().orElseThrow().owner());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storageGcExpiresOldResults() throws Exception {
        Path root = Files.createTempDirectory("partybroker-test-gc-storage-expire-");
        try {
            BrokerApp app = newApp(root);
            SessionStore store = app.sessionStore();
            long expire = app.settings().sessionExpireMs();
            store.persistSessionInfo(sessionInfo("old", 0L));
            store.saveSessionResult("old", result(), 0L);
            store.persistSessionInfo(sessionInfo("fresh", expire));
            store.saveSessionResult("fresh", result(), expire);

            GcManager.StorageGcOutcome outcome = new GcManager(app, "replica-a").storageGcTick(expire + 10L);

            Assertions.assertTrue(outcome.leaseHeld());
            Assertions.assertEquals(1, outcome.resultsRemoved());
            Assertions.assertEquals(1, outcome.sessionsExpired());
            Assertions.assertNull(outcome.error());
            Assertions.assertTrue(store.getSessionResult("old").isEmpty());
            Assertions.assertTrue(store.getSessionResult("fresh").isPresent());
            Assertions.assertEquals(SessionStatus.EXPIRED, store.getSessionInfo("old").orElseThrow().status());
            Assertions.assertEquals(SessionStatus.FINISHED, store.getSessionInfo("fresh").orElseThrow().status());

            List<Map<String, Object>> audit = app.auditLogger().readAll();
            Assertions.assertEquals("gc.storage", audit.get(audit.size() - 1).get("action"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storageGcFailureIsReportedAsTransient() throws Exception {
        Path root = Files.createTempDirectory("partybroker-test-gc-storage-fail-");
        try {
            BrokerApp app = newApp(root);
            // a fresh empty file has no gc_locks table
            for (String suffix : List.of("", "-wal", "-shm")) {
                Files.deleteIfExists(Path.of(app.config().dbFile() + suffix));
            }

            GcManager.StorageGcOutcome outcome = new GcManager(app, "replica-a").storageGcTick(1_000L);

            Assertions.assertFalse(outcome.leaseHeld());
            Assertions.assertNotNull(outcome.error());
            Assertions.assertTrue(outcome.error().startsWith("GC_TRANSIENT"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static BrokerApp newApp(Path root) {
        BrokerApp app = new BrokerApp(
                BrokerConfig.fromRoot(root.toString(), "alice"),
                BrokerSettings.defaults(),
                new PartyRegistry(List.of()),
                new HttpInterPartyStub(),
                null,
                null,
                null
        );
        app.init();
        return app;
    }

    private static ExecuteInfo info(String jobId) {
        return new ExecuteInfo("proj", jobId, "alice", "select 1", null, null);
    }

    private static SessionStore.SessionInfo sessionInfo(String id, long createdAtMs) {
        return new SessionStore.SessionInfo(id, "proj", "alice", "select 1", SessionStatus.RUNNING,
                List.of("cnt"), "{}", "alice-engine:8003", createdAtMs, createdAtMs);
    }

    private static QueryResult result() {
        return new QueryResult(Status.ok(), List.of(), 0L, 0.5, List.of());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
