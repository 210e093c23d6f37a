package io.partybroker.cli;

import io.partybroker.checksum.ChecksumEngine;
import io.partybroker.config.BrokerConfig;
import io.partybroker.gc.GcManager;
import io.partybroker.model.Checksum;
import io.partybroker.model.ColumnControl;
import io.partybroker.model.TableMeta;
import io.partybroker.rpc.InterPartyHttpServer;
import io.partybroker.runtime.BrokerApp;
import io.partybroker.storage.MetaTransaction;
import io.partybroker.storage.SessionStore;
import io.partybroker.util.Hashing;
import io.partybroker.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "partybroker",
        mixinStandardHelpOptions = true,
        description = "Query broker of one party in a multi-party secure query federation",
        subcommands = {
                BrokerCommand.InitCommand.class,
                BrokerCommand.RegisterTableCommand.class,
                BrokerCommand.ChecksumCommand.class,
                BrokerCommand.LeaseCommand.class,
                BrokerCommand.GcOnceCommand.class,
                BrokerCommand.CancelCommand.class,
                BrokerCommand.ServeCommand.class
        }
)
public final class BrokerCommand implements Runnable {
    @Option(names = {"--root"}, description = "Broker data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--party"}, required = true, description = "Code of the party this broker serves")
    String party;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | register-table | checksum | lease | gc-once | cancel | serve");
    }

    BrokerConfig config() {
        return BrokerConfig.fromRoot(root, party);
    }

    BrokerApp app() {
        BrokerApp app = new BrokerApp(config());
        app.init();
        return app;
    }

    @Command(name = "init", description = "Initialize directories, SQLite schema and the gc lease row")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        BrokerCommand parent;

        @Override
        public Integer call() {
            parent.app();
            System.out.println("Initialized broker of party " + parent.party + " at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "register-table", description = "Register a project, its tables and column controls from a JSON file")
    static final class RegisterTableCommand implements Callable<Integer> {
        @ParentCommand
        BrokerCommand parent;

        @Option(names = {"--file"}, required = true, description = "Registration JSON file")
        Path file;

        @Override
        public Integer call() throws IOException {
            Registration reg = Jsons.mapper().readValue(file.toFile(), Registration.class);
            if (reg.projectId() == null || reg.projectId().isBlank()) {
                System.err.println("projectId is required");
                return 2;
            }
            BrokerApp app = parent.app();
            long nowMs = System.currentTimeMillis();
            List<String> members = reg.members() == null ? List.of(parent.party) : reg.members();
            app.metaStore().createProject(reg.projectId(), reg.creator() == null ? parent.party : reg.creator(), members, nowMs);
            List<TableMeta> tables = reg.tables() == null ? List.of() : reg.tables();
            List<ColumnControl> ccls = reg.ccls() == null ? List.of() : reg.ccls();
            app.metaStore().saveRemoteMetadata(reg.projectId(), tables, ccls, nowMs);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("projectId", reg.projectId());
            out.put("members", members);
            out.put("tables", tables.stream().map(TableMeta::tableName).toList());
            out.put("ccls", ccls.size());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "checksum", description = "Print the checksum of one party's tables from the local store")
    static final class ChecksumCommand implements Callable<Integer> {
        @ParentCommand
        BrokerCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project id")
        String project;

        @Option(names = {"--owner"}, description = "Party whose tables are fingerprinted (defaults to --party)")
        String owner;

        @Option(names = {"--tables"}, required = true, split = ",", description = "Comma separated table names")
        List<String> tables;

        @Override
        public Integer call() {
            BrokerApp app = parent.app();
            String target = owner == null || owner.isBlank() ? parent.party : owner;
            try (MetaTransaction txn = app.metaStore().createMetaTransaction()) {
                MetaTransaction.TableLookup lookup = txn.getTableMetasByTableNames(project, tables);
                if (!lookup.notFound().isEmpty()) {
                    txn.finish(null);
                    System.err.println("tables not found: " + lookup.notFound());
                    return 1;
                }
                List<ColumnControl> ccls = new ArrayList<>();
                for (MetaTransaction.ColumnPriv priv : txn.listColumnConstraints(project, tables, List.of())) {
                    ccls.add(priv.toColumnControl());
                }
                txn.finish(null);
                Checksum checksum = ChecksumEngine.compute(target, lookup.found(), ccls);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("project", project);
                out.put("party", target);
                out.put("tableSchema", Hashing.toHex(checksum.tableSchema()));
                out.put("ccl", Hashing.toHex(checksum.ccl()));
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "lease", description = "Show the storage gc lease")
    static final class LeaseCommand implements Callable<Integer> {
        @ParentCommand
        BrokerCommand parent;

        @Override
        public Integer call() {
            BrokerApp app = parent.app();
            Map<String, Object> out = new LinkedHashMap<>();
            SessionStore.GcLease lease = app.sessionStore().currentGcLock().orElse(new SessionStore.GcLease("", 0L));
            long nowMs = System.currentTimeMillis();
            out.put("owner", lease.owner());
            out.put("expiredAtMs", lease.expiredAtMs());
            out.put("active", !lease.owner().isBlank() && lease.expiredAtMs() > nowMs);
            out.put("self", app.gcOwner());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "gc-once", description = "Run one storage gc tick under this replica's identity")
    static final class GcOnceCommand implements Callable<Integer> {
        @ParentCommand
        BrokerCommand parent;

        @Option(names = {"--owner"}, description = "Lease owner identity (defaults to HOSTNAME, then party code)")
        String owner;

        @Override
        public Integer call() {
            BrokerApp app = parent.app();
            GcManager gc = owner == null || owner.isBlank() ? new GcManager(app) : new GcManager(app, owner.trim());
            GcManager.StorageGcOutcome outcome = gc.storageGcTick();
            System.out.println(Jsons.toJson(outcome));
            return outcome.error() == null ? 0 : 1;
        }
    }

    @Command(name = "cancel", description = "Mark sessions canceled for every replica of this party")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        BrokerCommand parent;

        @Option(names = {"--session"}, required = true, split = ",", description = "Comma separated session ids")
        String[] sessions;

        @Override
        public Integer call() {
            BrokerApp app = parent.app();
            for (String id : sessions) {
                app.cancelSession(id.trim());
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("canceled", Arrays.stream(sessions).map(String::trim).toList());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "serve", description = {
            "Serve inter-party requests and run the gc loops",
            "Queries are not accepted here; they are submitted through an embedding front end"
    })
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        BrokerCommand parent;

        @Option(names = {"--port"}, defaultValue = "8081", description = "Inter-party HTTP port")
        int port;

        @Override
        public Integer call() throws Exception {
            BrokerApp app = parent.app();
            CountDownLatch stopped = new CountDownLatch(1);
            try (InterPartyHttpServer server = new InterPartyHttpServer(app.interPartyService(), port)) {
                server.start();
                new GcManager(app).start();
                Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown, "broker-shutdown"));
                System.out.println("Broker of party " + parent.party + " listening on port " + server.port());
                stopped.await();
            }
            return 0;
        }
    }

    record Registration(
            String projectId,
            String creator,
            List<String> members,
            List<TableMeta> tables,
            List<ColumnControl> ccls
    ) {
    }
}
