package io.partybroker.storage;

import io.partybroker.model.ColumnControl;
import io.partybroker.model.TableMeta;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/**
 * Project, table and column-control metadata owned by this broker. Readers open a
 * {@link MetaTransaction}; the write helpers here each run in their own transaction.
 */
public final class MetaStore {
    private final Database database;

    public MetaStore(Database database) {
        this.database = database;
    }

    public MetaTransaction createMetaTransaction() {
        Connection connection = null;
        try {
            connection = database.openConnection();
            return new MetaTransaction(connection);
        } catch (SQLException e) {
            closeQuietly(connection, e);
            throw new RuntimeException("Failed to open metadata transaction", e);
        }
    }

    public void createProject(String projectId, String creator, Collection<String> members, long nowMs) {
        MetaTransaction txn = createMetaTransaction();
        RuntimeException failure = null;
        try {
            txn.addProject(projectId, creator, nowMs);
            txn.addProjectMembers(projectId, members);
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            txn.finish(failure);
        }
    }

    public void registerTable(TableMeta table, Collection<ColumnControl> ccls, long nowMs) {
        saveRemoteMetadata(table.projectId(), List.of(table), ccls, nowMs);
    }

    // Upserts tables under one transaction; the given column controls replace every grant stored for those tables.
    public void saveRemoteMetadata(String projectId, Collection<TableMeta> tables, Collection<ColumnControl> ccls, long nowMs) {
        MetaTransaction txn = createMetaTransaction();
        RuntimeException failure = null;
        try {
            for (TableMeta table : tables) {
                if (!projectId.equals(table.projectId())) {
                    throw new IllegalArgumentException(
                            "table " + table.tableName() + " belongs to project " + table.projectId() + ", not " + projectId);
                }
                txn.upsertTable(table, nowMs);
                txn.deleteColumnPrivs(projectId, table.tableName());
            }
            for (ColumnControl ccl : ccls) {
                txn.upsertColumnPriv(ccl);
            }
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            txn.finish(failure);
        }
    }

    public List<String> projectMembers(String projectId) {
        try (MetaTransaction txn = createMetaTransaction()) {
            List<String> members = txn.getProjectMembers(projectId);
            txn.finish(null);
            return members;
        }
    }

    private static void closeQuietly(Connection connection, SQLException cause) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
