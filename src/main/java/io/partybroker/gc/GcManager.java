package io.partybroker.gc;

import io.partybroker.error.ErrorCode;
import io.partybroker.runtime.BrokerApp;
import io.partybroker.storage.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Background clean-up of one broker replica.
 *
 * <p>The storage loop expires old session results, guarded by a lease row so that only one replica
 * of the party scans per lease window. The session loop tears down in-memory sessions that any
 * replica has marked canceled. A failed tick is logged and retried on the next one; neither loop
 * ends on its own.
 */
public final class GcManager {
    private static final Logger log = LoggerFactory.getLogger(GcManager.class);

    private final BrokerApp app;
    private final String owner;

    public GcManager(BrokerApp app) {
        this(app, app.gcOwner());
    }

    public GcManager(BrokerApp app, String owner) {
        this.app = app;
        this.owner = owner;
    }

    public String owner() {
        return owner;
    }

    public StorageGcOutcome storageGcTick() {
        return storageGcTick(System.currentTimeMillis());
    }

    public StorageGcOutcome storageGcTick(long nowMs) {
        SessionStore store = app.sessionStore();
        try {
            store.initGcLockIfNecessary();
            if (!store.holdGcLock(owner, app.settings().sessionCheckIntervalMs(), nowMs)) {
                log.debug("gc lease held by another replica, skip tick");
                return new StorageGcOutcome(owner, false, 0, 0, null);
            }
            SessionStore.ClearOutcome cleared = store.clearExpiredResults(app.settings().sessionExpireMs(), nowMs);
            if (cleared.resultsRemoved() > 0 || cleared.sessionsExpired() > 0) {
                log.info("storage gc removed {} results, expired {} sessions", cleared.resultsRemoved(), cleared.sessionsExpired());
                app.auditLogger().log("gc.storage", null, "ok", Map.of(
                        "owner", owner,
                        "resultsRemoved", cleared.resultsRemoved(),
                        "sessionsExpired", cleared.sessionsExpired()
                ));
            }
            return new StorageGcOutcome(owner, true, cleared.resultsRemoved(), cleared.sessionsExpired(), null);
        } catch (RuntimeException e) {
            log.warn("storage gc tick failed: {}", e.getMessage(), e);
            return new StorageGcOutcome(owner, false, 0, 0, ErrorCode.GC_TRANSIENT + ": " + e.getMessage());
        }
    }

    public SessionGcOutcome sessionGcTick() {
        List<String> ids = app.sessions().snapshotIds();
        if (ids.isEmpty()) {
            return new SessionGcOutcome(0, List.of(), null);
        }
        Set<String> canceled;
        try {
            canceled = app.sessionStore().checkIdCanceled(ids);
        } catch (RuntimeException e) {
            log.warn("session gc lookup failed: {}", e.getMessage(), e);
            return new SessionGcOutcome(ids.size(), List.of(), ErrorCode.GC_TRANSIENT + ": " + e.getMessage());
        }
        List<String> removed = new ArrayList<>();
        for (String id : canceled) {
            if (app.deleteSession(id).isPresent()) {
                removed.add(id);
            }
        }
        if (!removed.isEmpty()) {
            log.info("session gc removed canceled sessions {}", removed);
        }
        return new SessionGcOutcome(ids.size(), removed, null);
    }

    public void runStorageGc() {
        loop("storage", this::storageGcTick);
    }

    public void runSessionGc() {
        loop("session", this::sessionGcTick);
    }

    public void start() {
        startDaemon("gc-storage", this::runStorageGc);
        startDaemon("gc-session", this::runSessionGc);
        log.info("gc loops started, owner={} interval={}ms", owner, app.settings().sessionCheckIntervalMs());
    }

    private void loop(String name, Runnable tick) {
        Duration interval = Duration.ofMillis(app.settings().sessionCheckIntervalMs());
        while (!Thread.currentThread().isInterrupted()) {
            try {
                app.sleeper().sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                tick.run();
            } catch (RuntimeException e) {
                log.error("{} gc tick crashed", name, e);
            }
        }
        log.info("{} gc loop stopped", name);
    }

    private static void startDaemon(String name, Runnable body) {
        Thread t = new Thread(body, name);
        t.setDaemon(true);
        t.start();
    }

    public record StorageGcOutcome(String owner, boolean leaseHeld, int resultsRemoved, int sessionsExpired, String error) {
    }

    public record SessionGcOutcome(int checked, List<String> removed, String error) {
        public SessionGcOutcome {
            removed = removed == null ? List.of() : List.copyOf(removed);
        }
    }
}
