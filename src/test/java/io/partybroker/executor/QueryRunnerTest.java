package io.partybroker.executor;

import io.partybroker.error.BrokerException;
import io.partybroker.error.ErrorCode;
import io.partybroker.error.TableNotFoundException;
import io.partybroker.model.ColumnControl;
import io.partybroker.model.ColumnMeta;
import io.partybroker.model.PartyInfo;
import io.partybroker.model.QueryResult;
import io.partybroker.model.SessionStatus;
import io.partybroker.model.Status;
import io.partybroker.model.StatusCode;
import io.partybroker.model.TableMeta;
import io.partybroker.model.Visibility;
import io.partybroker.runtime.BrokerApp;
import io.partybroker.session.Session;
import io.partybroker.storage.SessionStore;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryRunnerTest {

    @Test
    void twoPartyQueryShouldCompleteWhenChecksumsAgree() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice", "bob")) {
            fx.registerSharedProject("alice", "int");
            fx.registerSharedProject("bob", "int");
            Session sessionA = fx.createSession("alice", "job-1", "alice");
            Session sessionB = fx.createSession("bob", "job-1", "alice");

            QueryRunner runnerB = fx.app("bob").newQueryRunner(sessionB);
            runnerB.prepare(BrokerFixture.QUERY_TABLES);
            runnerB.saveLocalChecksums();

            QueryRunner runnerA = fx.app("alice").newQueryRunner(sessionA);
            runnerA.run(BrokerFixture.QUERY_TABLES);

            assertEquals(QueryState.COMPLETED, runnerA.state());
            assertEquals(List.of("alice", "bob"), sessionA.executeInfo().dataParties());
            assertEquals(1, fx.compiler("alice").calls.get());
            assertEquals(1, fx.engine("alice").calls.get());
            assertEquals(Optional.of("bob-engine:8003"), sessionA.engineEndpoint("bob"));

            QueryResult result = sessionA.result().orElseThrow();
            assertEquals(1L, result.affectedRows());
            assertEquals(42, result.outColumns().get(0).path("value").asInt());
            assertTrue(result.warnings().isEmpty());

            SessionStore store = fx.app("alice").sessionStore();
            SessionStore.SessionInfo info = store.getSessionInfo("job-1").orElseThrow();
            assertEquals(SessionStatus.FINISHED, info.status());
            assertEquals(List.of("cnt"), info.outputNames());
            assertTrue(store.getSessionResult("job-1").isPresent());

            // bob learned alice's checksum and endpoint from the exchange and can go on by itself
            runnerB.checkChecksum();
            runnerB.execute(BrokerFixture.QUERY_TABLES);
            assertEquals(QueryState.COMPLETED, runnerB.state());
            assertEquals(Set.of("bob"), fx.engine("bob").lastJob.requests().keySet());
            assertTrue(fx.engine("bob").lastJob.outputNames().isEmpty());
            assertTrue(fx.app("bob").sessionStore().getSessionInfo("job-1").isEmpty());
        }
    }

    @Test
    void driftedMetadataShouldBeReportedBeforeCompiling() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice", "bob")) {
            fx.registerSharedProject("alice", "bigint");
            fx.registerSharedProject("bob", "int");
            Session sessionA = fx.createSession("alice", "job-2", "alice");
            Session sessionB = fx.createSession("bob", "job-2", "alice");

            QueryRunner runnerB = fx.app("bob").newQueryRunner(sessionB);
            runnerB.prepare(BrokerFixture.QUERY_TABLES);
            runnerB.saveLocalChecksums();

            QueryRunner runnerA = fx.app("alice").newQueryRunner(sessionA);
            runnerA.prepare(BrokerFixture.QUERY_TABLES);
            runnerA.saveLocalChecksums();

            assertEquals(Set.of("bob"), runnerA.getChecksumFromOtherParties("alice"));
            BrokerException error = assertThrows(BrokerException.class, runnerA::checkChecksum);
            assertEquals(ErrorCode.CHECKSUM_MISMATCH, error.code());
            assertTrue(error.getMessage().contains("bob"));
            assertEquals(0, fx.compiler("alice").calls.get());
            assertEquals(0, fx.engine("alice").calls.get());
        }
    }

    @Test
    void issuerShouldPullOwnerMetadataAndResyncOnDisagreement() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice", "bob")) {
            fx.registerSharedProject("alice", "bigint");
            fx.registerSharedProject("bob", "int");
            Session sessionA = fx.createSession("alice", "job-3", "alice");
            Session sessionB = fx.createSession("bob", "job-3", "alice");

            QueryRunner runnerB = fx.app("bob").newQueryRunner(sessionB);
            runnerB.prepare(BrokerFixture.QUERY_TABLES);
            runnerB.saveLocalChecksums();

            QueryRunner runnerA = fx.app("alice").newQueryRunner(sessionA);
            runnerA.run(BrokerFixture.QUERY_TABLES);

            assertEquals(QueryState.COMPLETED, runnerA.state());
            assertFalse(runnerA.resyncPending());
            assertEquals(1, fx.routes.askInfoCalls.get());
            assertEquals(2, fx.routes.exchangeCalls.get());
            TableMeta tb = runnerA.tables().stream()
                    .filter(t -> t.tableName().equals("tb"))
                    .findFirst()
                    .orElseThrow();
            assertEquals("int", tb.columns().get(0).dataType());
            assertEquals(1, fx.compiler("alice").calls.get());
        }
    }

    @Test
    void missingTableShouldLeavePreparedStateUntouched() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice", "bob")) {
            fx.registerSharedProject("alice", "int");
            fx.registerSharedProject("bob", "int");
            Session session = fx.createSession("alice", "job-4", "alice");
            QueryRunner runner = fx.app("alice").newQueryRunner(session);
            runner.prepare(BrokerFixture.QUERY_TABLES);

            List<TableMeta> tables = runner.tables();
            EnginesInfo enginesInfo = runner.enginesInfo();
            List<ColumnControl> ccls = runner.ccls();

            TableNotFoundException error = assertThrows(
                    TableNotFoundException.class,
                    () -> runner.prepare(List.of("ta", "ghost"))
            );
            assertEquals(List.of("ghost"), error.missingTables());
            assertEquals(1, fx.routes.askInfoCalls.get());
            assertSame(tables, runner.tables());
            assertSame(enginesInfo, runner.enginesInfo());
            assertSame(ccls, runner.ccls());
            assertEquals(List.of("alice", "bob"), session.executeInfo().dataParties());

            QueryRunner fresh = fx.app("alice").newQueryRunner(fx.createSession("alice", "job-5", "alice"));
            assertThrows(TableNotFoundException.class, () -> fresh.run(List.of("ghost")));
            assertEquals(QueryState.FAILED, fresh.state());
            assertNull(fresh.tables());
            assertEquals(0, fx.compiler("alice").calls.get());
        }
    }

    @Test
    void tablesMissingLocallyShouldBeFetchedFromOwners() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice", "bob")) {
            fx.app("alice").metaStore().createProject(BrokerFixture.PROJECT, "alice", List.of("alice", "bob"), 1L);
            BrokerFixture.registerTable(fx.app("alice"), BrokerFixture.table("ta", "alice", "int"));
            fx.registerSharedProject("bob", "int");

            QueryRunner runner = fx.app("alice").newQueryRunner(fx.createSession("alice", "job-6", "alice"));
            runner.prepare(BrokerFixture.QUERY_TABLES);

            assertEquals(List.of("ta", "tb"), runner.tables().stream().map(TableMeta::tableName).toList());
            assertEquals("bob", runner.tables().get(1).owner());
            assertEquals(8, runner.ccls().size());
        }
    }

    @Test
    void partiesShouldNotDependOnTableOrder() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("carol")) {
            BrokerApp carol = fx.app("carol");
            carol.metaStore().createProject(BrokerFixture.PROJECT, "alice", List.of("alice", "bob", "carol"), 1L);
            BrokerFixture.registerTable(carol, BrokerFixture.table("ta", "alice", "int"));
            BrokerFixture.registerTable(carol, BrokerFixture.table("tb", "bob", "int"));

            QueryRunner first = carol.newQueryRunner(fx.createSession("carol", "job-7", "carol"));
            QueryRunner second = carol.newQueryRunner(fx.createSession("carol", "job-8", "carol"));
            QueryRunner.PrepareOutcome forward = first.prepare(List.of("ta", "tb"));
            QueryRunner.PrepareOutcome backward = second.prepare(List.of("tb", "ta"));

            assertEquals(List.of("alice", "bob"), forward.dataParties());
            assertEquals(List.of("alice", "bob", "carol"), forward.workParties());
            assertEquals(forward, backward);
            assertEquals(
                    List.of("alice", "bob", "carol"),
                    first.enginesInfo().parties().stream().map(PartyInfo::code).toList()
            );
            assertEquals(first.ccls(), second.ccls());
            assertEquals(first.saveLocalChecksums(), second.saveLocalChecksums());
            assertEquals("db_bob.tb", first.enginesInfo()
                    .refTableOf(first.enginesInfo().tablesOf("bob").get(0))
                    .orElseThrow()
                    .table()
                    .toString());
        }
    }

    @Test
    void compileFailureShouldFailTheQuery() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            fx.registerSharedProject("alice", "int");
            fx.compiler("alice").failWith = "unknown column";
            QueryRunner runner = fx.app("alice").newQueryRunner(fx.createSession("alice", "job-9", "alice"));

            BrokerException error = assertThrows(BrokerException.class, () -> runner.run(List.of("ta")));
            assertEquals(ErrorCode.COMPILE_ERROR, error.code());
            assertTrue(error.getMessage().startsWith("failed to compile query to plan: "));
            assertEquals(QueryState.FAILED, runner.state());
            assertEquals(0, fx.engine("alice").calls.get());
        }
    }

    @Test
    void engineFailureShouldHappenAfterSessionInfoIsPersisted() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            fx.registerSharedProject("alice", "int");
            BrokerApp app = fx.app("alice");
            AtomicBoolean persistedBeforeEngine = new AtomicBoolean(false);
            fx.engine("alice").onRun = () -> persistedBeforeEngine.set(app.sessionStore().getSessionInfo("job-10").isPresent());
            fx.engine("alice").failWith = new IOException("engine unreachable");
            Session session = fx.createSession("alice", "job-10", "alice");
            QueryRunner runner = app.newQueryRunner(session);

            BrokerException error = assertThrows(BrokerException.class, () -> runner.run(List.of("ta")));
            assertEquals(ErrorCode.ENGINE_EXECUTION_ERROR, error.code());
            assertTrue(persistedBeforeEngine.get());
            assertEquals(QueryState.FAILED, runner.state());
            assertTrue(session.result().isEmpty());
        }
    }

    @Test
    void engineStatusErrorShouldFailTheQuery() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            fx.registerSharedProject("alice", "int");
            fx.engine("alice").status = Status.of(StatusCode.INTERNAL, "spu crashed");
            QueryRunner runner = fx.app("alice").newQueryRunner(fx.createSession("alice", "job-11", "alice"));

            BrokerException error = assertThrows(BrokerException.class, () -> runner.run(List.of("ta")));
            assertEquals(ErrorCode.ENGINE_EXECUTION_ERROR, error.code());
            assertTrue(error.getMessage().contains("spu crashed"));
        }
    }

    @Test
    void canceledSessionShouldStopBeforeCompiling() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            fx.registerSharedProject("alice", "int");
            Session session = fx.createSession("alice", "job-12", "alice");
            QueryRunner runner = fx.app("alice").newQueryRunner(session);
            session.cancellation().cancel();

            BrokerException error = assertThrows(BrokerException.class, () -> runner.run(List.of("ta")));
            assertEquals(ErrorCode.CANCELED, error.code());
            assertEquals(QueryState.FAILED, runner.state());
            assertEquals(0, fx.compiler("alice").calls.get());
        }
    }

    @Test
    void cancelDuringEngineCallShouldReportCanceled() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            fx.registerSharedProject("alice", "int");
            Session session = fx.createSession("alice", "job-13", "alice");
            fx.engine("alice").onRun = () -> fx.app("alice").cancelSession("job-13");
            fx.engine("alice").failWith = new IOException("stream closed");
            QueryRunner runner = fx.app("alice").newQueryRunner(session);

            BrokerException error = assertThrows(BrokerException.class, () -> runner.run(List.of("ta")));
            assertEquals(ErrorCode.CANCELED, error.code());
            assertTrue(fx.app("alice").sessions().get("job-13").isEmpty());
        }
    }

    @Test
    void dryRunShouldCompileWithoutExecuting() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            fx.registerSharedProject("alice", "int");
            QueryRunner runner = fx.app("alice").newQueryRunner(fx.createSession("alice", "job-14", "alice"));
            runner.prepare(List.of("ta"));
            runner.saveLocalChecksums();

            runner.dryRun();

            assertEquals(1, fx.compiler("alice").calls.get());
            assertEquals(0, fx.engine("alice").calls.get());
            assertEquals("proj.ta", fx.compiler("alice").lastRequest.catalog().get(0).tableName());
            assertEquals("proj", fx.compiler("alice").lastRequest.dbName());
        }
    }

    @Test
    void dryRunShouldRequirePreparation() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            QueryRunner runner = fx.app("alice").newQueryRunner(fx.createSession("alice", "job-15", "alice"));
            BrokerException error = assertThrows(BrokerException.class, runner::dryRun);
            assertEquals(ErrorCode.INVALID_STATE, error.code());
        }
    }

    @Test
    void groupThresholdPlanShouldCarryWarning() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            fx.registerSharedProject("alice", "int");
            fx.compiler("alice").groupThresholdWarning = true;
            Session session = fx.createSession("alice", "job-16", "alice");
            fx.app("alice").newQueryRunner(session).run(List.of("ta"));

            assertEquals(List.of(QueryRunner.GROUP_THRESHOLD_WARNING), session.result().orElseThrow().warnings());
            assertTrue(session.warning().path("mayAffectedByGroupThreshold").asBoolean());
        }
    }

    @Test
    void asyncQueryShouldLeaveResultToEngineCallback() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            fx.registerSharedProject("alice", "int");
            Session session = fx.createSession("alice", "job-17", "alice", true);
            QueryRunner runner = fx.app("alice").newQueryRunner(session);
            runner.run(List.of("ta"));

            assertEquals(QueryState.COMPLETED, runner.state());
            assertTrue(fx.engine("alice").lastAsync);
            assertTrue(session.result().isEmpty());
            SessionStore store = fx.app("alice").sessionStore();
            assertEquals(SessionStatus.RUNNING, store.getSessionInfo("job-17").orElseThrow().status());
            assertTrue(store.getSessionResult("job-17").isEmpty());
        }
    }

    @Test
    void nonIssuerRunShouldWaitForIssuerChecksum() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create(400, Sleeper.system(), "alice", "bob")) {
            fx.registerSharedProject("alice", "int");
            fx.registerSharedProject("bob", "int");
            Session sessionA = fx.createSession("alice", "job-18", "alice");
            Session sessionB = fx.createSession("bob", "job-18", "alice");
            QueryRunner runnerA = fx.app("alice").newQueryRunner(sessionA);
            QueryRunner runnerB = fx.app("bob").newQueryRunner(sessionB);

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<?> bob = pool.submit(() -> runnerB.run(BrokerFixture.QUERY_TABLES));
                Future<?> alice = pool.submit(() -> runnerA.run(BrokerFixture.QUERY_TABLES));
                alice.get(30, TimeUnit.SECONDS);
                bob.get(30, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }

            assertEquals(QueryState.COMPLETED, runnerA.state());
            assertEquals(QueryState.COMPLETED, runnerB.state());
            assertTrue(sessionA.result().isPresent());
            assertEquals(Optional.of("alice-engine:8003"), sessionB.engineEndpoint("alice"));
            assertEquals(Set.of("bob"), fx.engine("bob").lastJob.requests().keySet());
            assertTrue(fx.engine("bob").lastJob.outputNames().isEmpty());
        }
    }

    @Test
    void nonIssuerRunShouldGiveUpWhenIssuerNeverCalls() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice", "bob")) {
            fx.registerSharedProject("bob", "int");
            QueryRunner runnerB = fx.app("bob").newQueryRunner(fx.createSession("bob", "job-19", "alice"));

            BrokerException error = assertThrows(BrokerException.class, () -> runnerB.run(BrokerFixture.QUERY_TABLES));
            assertEquals(ErrorCode.TRANSPORT_ERROR, error.code());
            assertTrue(error.getMessage().startsWith("issuer alice did not send its checksum"));
            assertEquals(QueryState.FAILED, runnerB.state());
            assertEquals(3, fx.sleeper.sleeps.size());
            assertEquals(0, fx.routes.exchangeCalls.get());
            assertEquals(0, fx.compiler("bob").calls.get());
        }
    }

    @Test
    void cancelWhileWaitingForIssuerShouldReportCanceled() throws Exception {
        AtomicReference<Session> waiting = new AtomicReference<>();
        AtomicInteger sleeps = new AtomicInteger();
        Sleeper cancelOnFirstSleep = duration -> {
            sleeps.incrementAndGet();
            waiting.get().cancellation().cancel();
        };
        try (BrokerFixture fx = BrokerFixture.create(5, cancelOnFirstSleep, "alice", "bob")) {
            fx.registerSharedProject("bob", "int");
            Session sessionB = fx.createSession("bob", "job-20", "alice");
            waiting.set(sessionB);
            QueryRunner runnerB = fx.app("bob").newQueryRunner(sessionB);

            BrokerException error = assertThrows(BrokerException.class, () -> runnerB.run(BrokerFixture.QUERY_TABLES));
            assertEquals(ErrorCode.CANCELED, error.code());
            assertEquals(1, sleeps.get());
            assertEquals(QueryState.FAILED, runnerB.state());
        }
    }

    @Test
    void pulledMetadataShouldDropGrantsTheOwnerNoLongerHas() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice", "bob")) {
            fx.registerSharedProject("alice", "int");
            BrokerApp bob = fx.app("bob");
            bob.metaStore().createProject(BrokerFixture.PROJECT, "alice", List.of("alice", "bob"), 1L);
            BrokerFixture.registerTable(bob, BrokerFixture.table("ta", "alice", "int"));
            TableMeta tb = BrokerFixture.table("tb", "bob", "int");
            bob.metaStore().registerTable(tb, List.of(
                    new ColumnControl(BrokerFixture.PROJECT, "tb", "id", "alice", Visibility.PLAINTEXT),
                    new ColumnControl(BrokerFixture.PROJECT, "tb", "id", "bob", Visibility.PLAINTEXT),
                    new ColumnControl(BrokerFixture.PROJECT, "tb", "score", "bob", Visibility.PLAINTEXT)
            ), 1L);

            Session sessionA = fx.createSession("alice", "job-21", "alice");
            Session sessionB = fx.createSession("bob", "job-21", "alice");
            QueryRunner runnerB = bob.newQueryRunner(sessionB);
            runnerB.prepare(BrokerFixture.QUERY_TABLES);
            runnerB.saveLocalChecksums();

            QueryRunner runnerA = fx.app("alice").newQueryRunner(sessionA);
            runnerA.run(BrokerFixture.QUERY_TABLES);

            assertEquals(QueryState.COMPLETED, runnerA.state());
            assertEquals(1, fx.routes.askInfoCalls.get());
            assertEquals(7, runnerA.ccls().size());
            assertFalse(runnerA.ccls().stream()
                    .anyMatch(c -> c.tableName().equals("tb") && c.columnName().equals("score") && c.partyCode().equals("alice")));
        }
    }

    @Test
    void unsupportedColumnTypeShouldFailPreparation() throws Exception {
        try (BrokerFixture fx = BrokerFixture.create("alice")) {
            BrokerApp alice = fx.app("alice");
            fx.registerSharedProject("alice", "int");
            BrokerFixture.registerTable(alice, new TableMeta(BrokerFixture.PROJECT, "tc", "alice", "db_alice.tc", "mysql", List.of(
                    new ColumnMeta("id", "varchar(64)"),
                    new ColumnMeta("shape", "geometry")
            )));
            QueryRunner runner = alice.newQueryRunner(fx.createSession("alice", "job-22", "alice"));
            runner.prepare(List.of("ta"));
            List<TableMeta> tables = runner.tables();

            BrokerException error = assertThrows(BrokerException.class, () -> runner.prepare(List.of("ta", "tc")));
            assertEquals(ErrorCode.UNSUPPORTED_COLUMN_TYPE, error.code());
            assertTrue(error.getMessage().contains("shape"));
            assertSame(tables, runner.tables());

            QueryRunner fresh = alice.newQueryRunner(fx.createSession("alice", "job-23", "alice"));
            assertThrows(BrokerException.class, () -> fresh.run(List.of("tc")));
            assertEquals(QueryState.FAILED, fresh.state());
            assertNull(fresh.tables());
            assertEquals(0, fx.compiler("alice").calls.get());
        }
    }
}
