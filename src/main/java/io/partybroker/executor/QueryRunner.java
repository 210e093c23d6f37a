package io.partybroker.executor;

import io.partybroker.checksum.ChecksumEngine;
import io.partybroker.config.BrokerSettings;
import io.partybroker.error.BrokerException;
import io.partybroker.error.ErrorCode;
import io.partybroker.error.TableNotFoundException;
import io.partybroker.model.Checksum;
import io.partybroker.model.ColumnControl;
import io.partybroker.model.ColumnMeta;
import io.partybroker.model.CompareResult;
import io.partybroker.model.DbTable;
import io.partybroker.model.DbType;
import io.partybroker.model.QueryResult;
import io.partybroker.model.RefTable;
import io.partybroker.model.Status;
import io.partybroker.model.TableMeta;
import io.partybroker.plan.CompileQueryRequest;
import io.partybroker.plan.CompiledPlan;
import io.partybroker.plan.EngineJob;
import io.partybroker.plan.RunExecutionPlanResponse;
import io.partybroker.plan.SecurityConfig;
import io.partybroker.plan.TableEntry;
import io.partybroker.rpc.ExchangeJobInfoRequest;
import io.partybroker.rpc.ExchangeJobInfoResponse;
import io.partybroker.runtime.BrokerApp;
import io.partybroker.session.ExecuteInfo;
import io.partybroker.session.Session;
import io.partybroker.storage.MetaTransaction;
import io.partybroker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one session through preparation, checksum agreement, compilation, dispatch and engine
 * execution. A runner belongs to a single session and its steps run sequentially on the caller's
 * thread; {@link #requestResync()} may be called from any thread.
 */
public final class QueryRunner {
    private static final Logger log = LoggerFactory.getLogger(QueryRunner.class);

    static final String GROUP_THRESHOLD_WARNING =
            "for safety, we filter the results for groups which contain less than 4 items.";

    private final Session session;
    private final BrokerApp app;
    private final AtomicReference<QueryState> state = new AtomicReference<>(QueryState.CREATED);
    private final AtomicBoolean resyncRequested = new AtomicBoolean(false);

    private volatile List<TableMeta> tables;
    private volatile EnginesInfo enginesInfo;
    private volatile List<ColumnControl> ccls;

    public QueryRunner(Session session, BrokerApp app) {
        this.session = session;
        this.app = app;
    }

    public QueryState state() {
        return state.get();
    }

    public List<TableMeta> tables() {
        return tables;
    }

    public EnginesInfo enginesInfo() {
        return enginesInfo;
    }

    public List<ColumnControl> ccls() {
        return ccls;
    }

    // The next execute() re-reads metadata and re-checks agreement with every data party.
    public void requestResync() {
        resyncRequested.set(true);
    }

    public boolean resyncPending() {
        return resyncRequested.get();
    }

    /**
     * Full lifecycle of a query submitted to this broker.
     */
    public void run(List<String> usedTables) {
        try {
            transition(QueryState.PREPARING);
            prepare(usedTables);
            saveLocalChecksums();

            session.cancellation().throwIfCanceled("checksum exchange");
            transition(QueryState.CHECKSUM_EXCHANGE);
            String issuer = session.executeInfo().issuer();
            Set<String> inconsistent = getChecksumFromOtherParties(issuer);
            if (!session.isIssuer() && session.executeInfo().dataParties().contains(issuer)) {
                awaitIssuerChecksum(issuer);
            }
            if (inconsistent.isEmpty()) {
                checkChecksum();
            } else {
                pullMetadataFrom(inconsistent);
                requestResync();
            }
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        }
        execute(usedTables);
    }

    /**
     * Resolves the tables of the query and replaces this runner's tables, engines info and column
     * controls. Peers are asked for missing tables only on the first preparation; nothing is
     * replaced when resolution fails.
     */
    public PrepareOutcome prepare(List<String> usedTables) {
        return prepare(usedTables, !resyncRequested.get());
    }

    PrepareOutcome prepare(List<String> usedTables, boolean askPeers) {
        ExecuteInfo info = session.executeInfo();
        String projectId = info.projectId();
        MetaTransaction txn = app.metaStore().createMetaTransaction();
        RuntimeException failure = null;
        try {
            MetaTransaction.TableLookup lookup = txn.getTableMetasByTableNames(projectId, usedTables);
            if (!lookup.notFound().isEmpty() && askPeers) {
                List<String> members = txn.getProjectMembers(projectId);
                txn.finish(null);
                List<String> peers = members.stream().filter(p -> !p.equals(session.selfPartyCode())).toList();
                try {
                    app.projectInfoSync().askProjectInfoFromParties(projectId, lookup.notFound(), peers);
                } catch (BrokerException e) {
                    log.warn("session {}: asking peers for tables {} failed: {}", session.id(), lookup.notFound(), e.getMessage());
                }
                txn = app.metaStore().createMetaTransaction();
                lookup = txn.getTableMetasByTableNames(projectId, usedTables);
            }
            if (!lookup.notFound().isEmpty()) {
                throw new TableNotFoundException(lookup.notFound());
            }

            List<TableMeta> resolved = lookup.found();
            for (TableMeta table : resolved) {
                for (ColumnMeta column : table.columns()) {
                    if (!column.hasSupportedType()) {
                        throw new BrokerException(
                                ErrorCode.UNSUPPORTED_COLUMN_TYPE,
                                "column " + table.dbTable() + "." + column.columnName() + " has unsupported type " + column.dataType()
                        );
                    }
                }
            }
            Set<String> owners = new TreeSet<>();
            Map<String, List<DbTable>> tablesByParty = new TreeMap<>();
            Map<DbTable, RefTable> refTables = new LinkedHashMap<>();
            for (TableMeta table : resolved) {
                owners.add(table.owner());
                tablesByParty.computeIfAbsent(table.owner(), k -> new ArrayList<>()).add(table.dbTable());
                refTables.put(table.dbTable(), new RefTable(DbTable.parse(table.refTable()), DbType.parse(table.dbType())));
            }
            Set<String> workSet = new TreeSet<>(owners);
            workSet.add(info.issuer());
            List<String> dataParties = List.copyOf(owners);
            List<String> workParties = List.copyOf(workSet);

            Map<String, List<DbTable>> frozen = new TreeMap<>();
            tablesByParty.forEach((party, list) -> frozen.put(party, List.copyOf(list)));
            EnginesInfo nextInfo = new EnginesInfo(frozen, refTables, app.registry().partyInfoOf(workParties));

            List<String> tableNames = resolved.stream().map(TableMeta::tableName).toList();
            List<ColumnControl> nextCcls = new ArrayList<>();
            for (MetaTransaction.ColumnPriv priv : txn.listColumnConstraints(projectId, tableNames, workParties)) {
                nextCcls.add(priv.toColumnControl());
            }

            this.tables = List.copyOf(resolved);
            this.enginesInfo = nextInfo;
            this.ccls = List.copyOf(nextCcls);
            info.setParties(dataParties, workParties);
            log.info("session {} prepared: dataParties={} workParties={}", session.id(), dataParties, workParties);
            return new PrepareOutcome(dataParties, workParties);
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            txn.finish(failure);
        }
    }

    public Map<String, Checksum> saveLocalChecksums() {
        requirePrepared();
        Map<String, Checksum> computed = ChecksumEngine.computeAll(session.executeInfo().dataParties(), tables, ccls);
        session.executeInfo().checksums().saveLocal(computed);
        return computed;
    }

    /**
     * Exchanges job info with one peer broker. Only a {@code SESSION_NOT_FOUND} answer is retried;
     * a {@code DATA_INCONSISTENCY} answer is returned to the caller.
     */
    public ExchangeJobInfoResponse exchangeJobInfo(String targetParty) {
        ExecuteInfo info = session.executeInfo();
        String self = session.selfPartyCode();
        Checksum serverChecksum = null;
        if (info.dataParties().contains(targetParty)) {
            serverChecksum = info.checksums().local(targetParty)
                    .orElseThrow(() -> new BrokerException(ErrorCode.INVALID_STATE, "no local checksum for party " + targetParty));
        }
        Checksum clientChecksum = info.dataParties().contains(self) ? info.checksums().local(self).orElse(null) : null;
        ExchangeJobInfoRequest req = new ExchangeJobInfoRequest(
                info.projectId(),
                info.jobId(),
                self,
                serverChecksum,
                clientChecksum,
                session.engineEndpoint(self).orElse(null)
        );

        String url;
        try {
            url = app.registry().brokerUrlOf(targetParty);
        } catch (IllegalArgumentException e) {
            throw new BrokerException(ErrorCode.TRANSPORT_ERROR, "no broker url for party " + targetParty, e);
        }

        BrokerSettings settings = app.settings();
        int retryTimes = settings.exchangeJobInfoRetryTimes();
        ExchangeJobInfoResponse response = null;
        for (int i = 0; i < retryTimes; i++) {
            session.cancellation().throwIfCanceled("exchanging job info with " + targetParty);
            try {
                response = app.interStub().exchangeJobInfo(url, req);
            } catch (IOException e) {
                throw new BrokerException(ErrorCode.TRANSPORT_ERROR, "exchange job info with " + targetParty + " failed: " + e.getMessage(), e);
            }
            if (response == null || response.status() == null) {
                throw new BrokerException(ErrorCode.TRANSPORT_ERROR, "empty response from party " + targetParty);
            }
            switch (response.status().kind()) {
                case OK, DATA_INCONSISTENCY -> {
                    return response;
                }
                case SESSION_NOT_FOUND -> {
                    if (i < retryTimes - 1) {
                        sleep(Duration.ofMillis(settings.exchangeJobInfoRetryIntervalMs()));
                    }
                }
                case OTHER -> throw new BrokerException(
                        ErrorCode.TRANSPORT_ERROR,
                        "failed to exchange job info with " + targetParty + ", status " + response.status().code()
                                + ": " + response.status().message()
                );
            }
        }
        throw new BrokerException(
                ErrorCode.TRANSPORT_ERROR,
                "party " + targetParty + " has no session " + info.jobId() + " after " + retryTimes + " attempts"
        );
    }

    /**
     * Collects the checksums of every data party other than this one and the issuer.
     *
     * @return parties that answered with a checksum different from the one sent to them
     */
    public Set<String> getChecksumFromOtherParties(String issuer) {
        ExecuteInfo info = session.executeInfo();
        Set<String> inconsistent = new LinkedHashSet<>();
        for (String party : info.dataParties()) {
            if (party.equals(issuer) || party.equals(session.selfPartyCode())) {
                continue;
            }
            ExchangeJobInfoResponse response = exchangeJobInfo(party);
            session.saveEndpoint(party, response.endpoint());
            info.checksums().saveRemote(party, response.expectedServerChecksum());
            if (response.status().kind() == Status.Kind.DATA_INCONSISTENCY) {
                inconsistent.add(party);
            }
        }
        return inconsistent;
    }

    /**
     * Waits for the issuer's own exchange call to deliver its checksum. Bounded by the exchange
     * retry settings; cancellation ends the wait.
     */
    void awaitIssuerChecksum(String issuer) {
        ExecuteInfo info = session.executeInfo();
        BrokerSettings settings = app.settings();
        int retryTimes = settings.exchangeJobInfoRetryTimes();
        for (int i = 0; i < retryTimes; i++) {
            if (info.checksums().remote(issuer).isPresent()) {
                return;
            }
            session.cancellation().throwIfCanceled("waiting for checksum of issuer " + issuer);
            sleep(Duration.ofMillis(settings.exchangeJobInfoRetryIntervalMs()));
        }
        if (info.checksums().remote(issuer).isPresent()) {
            return;
        }
        throw new BrokerException(
                ErrorCode.TRANSPORT_ERROR,
                "issuer " + issuer + " did not send its checksum for job " + info.jobId() + " after " + retryTimes + " attempts"
        );
    }

    public void checkChecksum() {
        ExecuteInfo info = session.executeInfo();
        for (String party : info.dataParties()) {
            if (party.equals(session.selfPartyCode())) {
                continue;
            }
            CompareResult result = info.checksums().compareChecksumFor(party);
            if (result != CompareResult.EQUAL) {
                throw new BrokerException(ErrorCode.CHECKSUM_MISMATCH, "checksum not equal with party " + party + ": " + result);
            }
        }
    }

    /**
     * Checks agreement and compiles the query without reaching the engine.
     */
    public void dryRun() {
        requirePrepared();
        checkChecksum();
        try {
            app.compiler().compile(buildCompileQueryRequest());
        } catch (RuntimeException e) {
            throw new BrokerException(ErrorCode.COMPILE_ERROR, "failed to compile query: " + e.getMessage(), e);
        }
    }

    public void execute(List<String> usedTables) {
        try {
            if (resyncRequested.get()) {
                log.info("session {}: resync requested, reading metadata again", session.id());
                transition(QueryState.PREPARING);
                prepare(usedTables, false);
                session.executeInfo().checksums().clearLocal();
                saveLocalChecksums();
                session.cancellation().throwIfCanceled("checksum exchange");
                transition(QueryState.CHECKSUM_EXCHANGE);
                getChecksumFromOtherParties(session.executeInfo().issuer());
                checkChecksum();
                resyncRequested.set(false);
            }
            requirePrepared();

            session.cancellation().throwIfCanceled("compiling");
            transition(QueryState.COMPILING);
            CompiledPlan plan;
            try {
                plan = app.compiler().compile(buildCompileQueryRequest());
            } catch (RuntimeException e) {
                throw new BrokerException(ErrorCode.COMPILE_ERROR, "failed to compile query to plan: " + e.getMessage(), e);
            }
            if (plan == null) {
                throw new BrokerException(ErrorCode.COMPILE_ERROR, "failed to compile query to plan: compiler returned nothing");
            }
            if (plan.explain() != null && !plan.explain().isBlank()) {
                log.debug("session {} execution plan:\n{}", session.id(), plan.explain());
            }

            session.cancellation().throwIfCanceled("dispatching");
            transition(QueryState.DISPATCHING);
            EngineJob job = new ExecutionDispatcher(session, app.registry(), app.settings()).buildJob(plan);
            session.setOutputNames(job.outputNames());
            session.setWarning(Jsons.compact().valueToTree(plan.warning()));
            if (session.isIssuer()) {
                try {
                    app.persistSessionInfo(session);
                } catch (RuntimeException e) {
                    throw new BrokerException(ErrorCode.STORAGE_ERROR, "failed to persist session info: " + e.getMessage(), e);
                }
            }

            session.cancellation().throwIfCanceled("executing");
            transition(QueryState.EXECUTING);
            RunExecutionPlanResponse ret = runEngine(job);
            if (!session.asyncMode()) {
                storeResult(plan, ret);
            }
            transition(QueryState.COMPLETED);
            app.auditLogger().log("query.completed", session.id(), "ok", Map.of(
                    "async", session.asyncMode(),
                    "dataParties", session.executeInfo().dataParties()
            ));
        } catch (RuntimeException e) {
            fail(e);
            throw e;
        }
    }

    CompileQueryRequest buildCompileQueryRequest() {
        ExecuteInfo info = session.executeInfo();
        List<TableEntry> catalog = new ArrayList<>(tables.size());
        for (TableMeta table : tables) {
            List<TableEntry.Column> columns = table.columns().stream()
                    .map(c -> new TableEntry.Column(c.columnName(), c.dataType()))
                    .toList();
            catalog.add(new TableEntry(
                    table.projectId() + "." + table.tableName(),
                    false,
                    table.refTable(),
                    table.dbType(),
                    table.owner(),
                    columns
            ));
        }
        return new CompileQueryRequest(
                info.query(),
                info.projectId(),
                info.issuer(),
                true,
                new SecurityConfig(ccls),
                catalog,
                info.compileOpts()
        );
    }

    private RunExecutionPlanResponse runEngine(EngineJob job) {
        RunExecutionPlanResponse ret;
        try {
            ret = app.engine().runExecutionPlan(job, session.asyncMode(), session.cancellation());
        } catch (IOException e) {
            if (session.cancellation().isCanceled()) {
                throw new BrokerException(ErrorCode.CANCELED, "session canceled during execution", e);
            }
            throw new BrokerException(ErrorCode.ENGINE_EXECUTION_ERROR, "engine call failed: " + e.getMessage(), e);
        }
        if (ret == null || ret.status() == null) {
            throw new BrokerException(ErrorCode.ENGINE_EXECUTION_ERROR, "engine returned no status");
        }
        if (ret.status().code() != 0) {
            if (session.cancellation().isCanceled()) {
                throw new BrokerException(ErrorCode.CANCELED, "session canceled during execution");
            }
            throw new BrokerException(
                    ErrorCode.ENGINE_EXECUTION_ERROR,
                    "engine status " + ret.status().code() + ": " + ret.status().message()
            );
        }
        return ret;
    }

    private void storeResult(CompiledPlan plan, RunExecutionPlanResponse ret) {
        long nowMs = System.currentTimeMillis();
        double costSeconds = Math.max(0L, nowMs - session.createdAtMs()) / 1000.0;
        List<String> warnings = new ArrayList<>();
        if (plan.warning().mayAffectedByGroupThreshold()) {
            log.info("session {}: {}", session.id(), GROUP_THRESHOLD_WARNING);
            warnings.add(GROUP_THRESHOLD_WARNING);
        }
        QueryResult result = new QueryResult(ret.status(), ret.outColumns(), ret.affectedRows(), costSeconds, warnings);
        if (!session.setResultSafely(result)) {
            log.warn("session {} already has a result, engine reply dropped", session.id());
            return;
        }
        if (session.isIssuer()) {
            try {
                app.sessionStore().saveSessionResult(session.id(), result, nowMs);
            } catch (RuntimeException e) {
                log.warn("session {}: failed to persist result: {}", session.id(), e.getMessage());
            }
        }
    }

    private void pullMetadataFrom(Set<String> parties) {
        ExecuteInfo info = session.executeInfo();
        for (String party : parties) {
            List<String> owned = enginesInfo.tablesOf(party).stream().map(DbTable::tableName).toList();
            log.info("session {}: party {} disagrees on tables {}, pulling its metadata", session.id(), party, owned);
            try {
                app.projectInfoSync().askProjectInfoFromParties(info.projectId(), owned, List.of(party));
            } catch (BrokerException e) {
                log.warn("session {}: pulling metadata from {} failed: {}", session.id(), party, e.getMessage());
            }
        }
    }

    private void sleep(Duration interval) {
        try {
            app.sleeper().sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException(ErrorCode.CANCELED, "interrupted while waiting for peer", e);
        }
    }

    private void requirePrepared() {
        if (tables == null || enginesInfo == null || ccls == null) {
            throw new BrokerException(ErrorCode.INVALID_STATE, "session " + session.id() + " has not been prepared");
        }
    }

    private void transition(QueryState next) {
        QueryState previous = state.getAndSet(next);
        log.debug("session {}: {} -> {}", session.id(), previous, next);
    }

    private void fail(RuntimeException e) {
        if (state.getAndSet(QueryState.FAILED) == QueryState.FAILED) {
            return;
        }
        String code = e instanceof BrokerException be ? be.code().name() : e.getClass().getSimpleName();
        log.warn("session {} failed: {}", session.id(), e.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("code", code);
        details.put("message", String.valueOf(e.getMessage()));
        app.auditLogger().log("query.failed", session.id(), "error", details);
    }

    public record PrepareOutcome(List<String> dataParties, List<String> workParties) {
    }
}
