package io.partybroker.runtime;

import io.partybroker.config.BrokerConfig;
import io.partybroker.config.BrokerSettings;
import io.partybroker.config.PartyRegistry;
import io.partybroker.error.BrokerException;
import io.partybroker.error.ErrorCode;
import io.partybroker.executor.QueryRunner;
import io.partybroker.executor.Sleeper;
import io.partybroker.model.SessionStatus;
import io.partybroker.observability.AuditLogger;
import io.partybroker.plan.Compiler;
import io.partybroker.plan.ExecutionEngine;
import io.partybroker.rpc.HttpInterPartyStub;
import io.partybroker.rpc.InterPartyService;
import io.partybroker.rpc.InterPartyStub;
import io.partybroker.rpc.ProjectInfoSync;
import io.partybroker.session.CancellationSignal;
import io.partybroker.session.ExecuteInfo;
import io.partybroker.session.Session;
import io.partybroker.session.SessionRegistry;
import io.partybroker.storage.Database;
import io.partybroker.storage.MetaStore;
import io.partybroker.storage.SessionStore;
import io.partybroker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

public final class BrokerApp {
    private static final Logger log = LoggerFactory.getLogger(BrokerApp.class);

    private final BrokerConfig config;
    private final BrokerSettings settings;
    private final PartyRegistry registry;
    private final Database database;
    private final MetaStore metaStore;
    private final SessionStore sessionStore;
    private final SessionRegistry sessions;
    private final InterPartyStub interStub;
    private final ProjectInfoSync projectInfoSync;
    private final AuditLogger auditLogger;
    private final Compiler compiler;
    private final ExecutionEngine engine;
    private final Sleeper sleeper;

    /**
     * Peer-facing broker: exchanges job info, answers metadata requests and runs GC. It has no
     * compiler or engine, so {@link #newQueryRunner} refuses to build runners.
     */
    public BrokerApp(BrokerConfig config) {
        this(
                config,
                BrokerSettings.load(config.settingsFile()),
                PartyRegistry.load(config.partiesFile()),
                new HttpInterPartyStub(),
                null,
                null,
                Sleeper.system()
        );
    }

    public BrokerApp(
            BrokerConfig config,
            BrokerSettings settings,
            PartyRegistry registry,
            InterPartyStub interStub,
            Compiler compiler,
            ExecutionEngine engine,
            Sleeper sleeper
    ) {
        this.config = config;
        this.settings = settings;
        this.registry = registry;
        this.database = new Database(config);
        this.metaStore = new MetaStore(database);
        this.sessionStore = new SessionStore(database);
        this.sessions = new SessionRegistry();
        this.interStub = interStub;
        this.projectInfoSync = new ProjectInfoSync(config.partyCode(), registry, interStub, metaStore);
        this.auditLogger = new AuditLogger(config.auditFile(), config.partyCode());
        this.compiler = compiler;
        this.engine = engine;
        this.sleeper = sleeper == null ? Sleeper.system() : sleeper;
    }

    public void init() {
        database.init();
        sessionStore.initGcLockIfNecessary();
    }

    public Session createSession(ExecuteInfo info, boolean asyncMode) {
        Session session = new Session(info, config.partyCode(), System.currentTimeMillis(), asyncMode, new CancellationSignal());
        session.saveEndpoint(config.partyCode(), settings.selfEngineEndpoint());
        sessions.register(session);
        log.info("session {} created for project {} issued by {}", session.id(), info.projectId(), info.issuer());
        return session;
    }

    public QueryRunner newQueryRunner(Session session) {
        if (compiler == null || engine == null) {
            throw new IllegalStateException("broker has no compiler or engine configured");
        }
        return new QueryRunner(session, this);
    }

    // Local teardown only; the session row in storage is left alone.
    public Optional<Session> deleteSession(String sessionId) {
        Optional<Session> removed = sessions.delete(sessionId);
        removed.ifPresent(s -> {
            s.cancellation().cancel();
            log.info("session {} removed", sessionId);
        });
        return removed;
    }

    // Marks the session canceled for every replica of this party, then tears it down here.
    public boolean cancelSession(String sessionId) {
        sessionStore.markSessionCanceled(sessionId, System.currentTimeMillis());
        boolean local = deleteSession(sessionId).isPresent();
        auditLogger.log("session.cancel", sessionId, "ok", Map.of("local", local));
        return local;
    }

    public void persistSessionInfo(Session session) {
        long nowMs = System.currentTimeMillis();
        sessionStore.persistSessionInfo(new SessionStore.SessionInfo(
                session.id(),
                session.executeInfo().projectId(),
                session.executeInfo().issuer(),
                session.executeInfo().query(),
                SessionStatus.RUNNING,
                session.outputNames(),
                session.warning() == null ? "{}" : Jsons.toCompactJson(session.warning()),
                session.engineEndpoint(config.partyCode()).orElse(""),
                session.createdAtMs(),
                nowMs
        ));
    }

    public InterPartyService interPartyService() {
        return new InterPartyService(config.partyCode(), sessions, metaStore);
    }

    // HOSTNAME identifies the replica; without it every replica of the party shares one owner name.
    public String gcOwner() {
        String host = System.getenv("HOSTNAME");
        if (host != null && !host.isBlank()) {
            return host.trim();
        }
        log.warn("HOSTNAME is not set, using party code {} as gc lease owner", config.partyCode());
        return config.partyCode();
    }

    public BrokerConfig config() {
        return config;
    }

    public BrokerSettings settings() {
        return settings;
    }

    public PartyRegistry registry() {
        return registry;
    }

    public Database database() {
        return database;
    }

    public MetaStore metaStore() {
        return metaStore;
    }

    public SessionStore sessionStore() {
        return sessionStore;
    }

    public SessionRegistry sessions() {
        return sessions;
    }

    public InterPartyStub interStub() {
        return interStub;
    }

    public ProjectInfoSync projectInfoSync() {
        return projectInfoSync;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public Compiler compiler() {
        if (compiler == null) {
            throw new BrokerException(ErrorCode.INVALID_STATE, "no compiler configured");
        }
        return compiler;
    }

    public ExecutionEngine engine() {
        if (engine == null) {
            throw new BrokerException(ErrorCode.INVALID_STATE, "no execution engine configured");
        }
        return engine;
    }

    public Sleeper sleeper() {
        return sleeper;
    }
}
