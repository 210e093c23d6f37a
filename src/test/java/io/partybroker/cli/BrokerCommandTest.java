package io.partybroker.cli;

import io.partybroker.config.BrokerConfig;
import io.partybroker.runtime.BrokerApp;
import io.partybroker.session.ExecuteInfo;
import io.partybroker.session.Session;
import io.partybroker.storage.MetaTransaction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

final class BrokerCommandTest {

    @Test
    void registerThenChecksumAndCancel() throws Exception {
        Path root = Files.createTempDirectory("partybroker-test-cli-");
        try {
            Path registration = root.resolve("registration.json");
            Files.writeString(registration, """
                    {
                      "projectId": "proj",
                      "creator": "alice",
                      "members": ["alice", "bob"],
                      "tables": [
                        {"projectId": "proj", "tableName": "ta", "owner": "alice", "refTable": "db_alice.ta", "dbType": "mysql",
                         "columns": [{"columnName": "id", "dataType": "int"}]}
                      ],
                      "ccls": [
                        {"dbName": "proj", "tableName": "ta", "columnName": "id", "partyCode": "bob", "visibility": "ENCRYPTED_ONLY"}
                      ]
                    }
                    """, StandardCharsets.UTF_8);
            String dataRoot = root.resolve("data").toString();

            Assertions.assertEquals(0, run("--root", dataRoot, "--party", "alice", "init"));
            Assertions.assertEquals(0, run("--root", dataRoot, "--party", "alice", "register-table", "--file", registration.toString()));
            Assertions.assertEquals(0, run("--root", dataRoot, "--party", "alice", "checksum", "--project", "proj", "--tables", "ta"));
            Assertions.assertEquals(1, run("--root", dataRoot, "--party", "alice", "checksum", "--project", "proj", "--tables", "ta,ghost"));
            Assertions.assertEquals(0, run("--root", dataRoot, "--party", "alice", "cancel", "--session", "job-1,job-2"));
            Assertions.assertEquals(0, run("--root", dataRoot, "--party", "alice", "gc-once", "--owner", "replica-a"));
            Assertions.assertEquals(0, run("--root", dataRoot, "--party", "alice", "lease"));

            BrokerApp app = new BrokerApp(BrokerConfig.fromRoot(dataRoot, "alice"));
            try (MetaTransaction txn = app.metaStore().createMetaTransaction()) {
                Assertions.assertEquals(List.of("alice", "bob"), txn.getProjectMembers("proj"));
                Assertions.assertEquals("db_alice.ta", txn.getTableMetasByTableNames("proj", List.of("ta")).found().get(0).refTable());
                txn.finish(null);
            }
            Assertions.assertEquals(Set.of("job-1", "job-2"), app.sessionStore().checkIdCanceled(List.of("job-1", "job-2", "job-3")));
            Assertions.assertEquals("replica-a", app.sessionStore().currentGcLock().orElseThrow().owner());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void servedBrokerAnswersPeersButRefusesQueries() throws Exception {
        Path root = Files.createTempDirectory("partybroker-test-cli-");
        try {
            BrokerApp app = new BrokerApp(BrokerConfig.fromRoot(root.resolve("data").toString(), "alice"));
            app.init();
            Session session = app.createSession(new ExecuteInfo("proj", "job-1", "alice", "select 1", null, null), false);

            Assertions.assertNotNull(app.interPartyService());
            Assertions.assertThrows(IllegalStateException.class, () -> app.newQueryRunner(session));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void partyIsRequired() {
        Assertions.assertNotEquals(0, run("init"));
    }

    private static int run(String... args) {
        return new CommandLine(new BrokerCommand()).execute(args);
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
