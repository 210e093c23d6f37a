package io.partybroker.storage;

import io.partybroker.model.ColumnControl;
import io.partybroker.model.ColumnMeta;
import io.partybroker.model.TableMeta;
import io.partybroker.model.Visibility;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A unit of work against the metadata tables. Reads see one consistent snapshot; writes become
 * visible when {@link #finish(Throwable)} is called with a {@code null} error.
 */
public final class MetaTransaction implements AutoCloseable {
    private final Connection connection;
    private boolean finished;

    MetaTransaction(Connection connection) throws SQLException {
        this.connection = connection;
        connection.setAutoCommit(false);
    }

    public TableLookup getTableMetasByTableNames(String projectId, Collection<String> tableNames) {
        Set<String> wanted = new LinkedHashSet<>(tableNames);
        if (wanted.isEmpty()) {
            return new TableLookup(List.of(), List.of());
        }
        Map<String, TableMeta> found = new LinkedHashMap<>();
        String sql = "SELECT table_name,owner,ref_table,db_type FROM table_metas WHERE project_id=? AND table_name IN ("
                + placeholders(wanted.size()) + ")";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, projectId);
            int idx = 2;
            for (String name : wanted) {
                ps.setString(idx++, name);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String tableName = rs.getString("table_name");
                    found.put(tableName, new TableMeta(
                            projectId,
                            tableName,
                            rs.getString("owner"),
                            rs.getString("ref_table"),
                            rs.getString("db_type"),
                            readColumns(projectId, tableName)
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read table metas of project " + projectId, e);
        }
        List<TableMeta> ordered = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        for (String name : wanted) {
            TableMeta meta = found.get(name);
            if (meta == null) {
                notFound.add(name);
            } else {
                ordered.add(meta);
            }
        }
        return new TableLookup(ordered, notFound);
    }

    public List<String> getProjectMembers(String projectId) {
        List<String> members = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT party_code FROM project_members WHERE project_id=? ORDER BY party_code")) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    members.add(rs.getString("party_code"));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read members of project " + projectId, e);
        }
        return members;
    }

    // Empty destParties means every destination party.
    public List<ColumnPriv> listColumnConstraints(String projectId, Collection<String> tableNames, Collection<String> destParties) {
        Set<String> tables = new LinkedHashSet<>(tableNames);
        Set<String> parties = new LinkedHashSet<>(destParties);
        if (tables.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder(
                "SELECT table_name,column_name,dest_party,priv FROM column_privs WHERE project_id=? AND table_name IN (")
                .append(placeholders(tables.size())).append(")");
        if (!parties.isEmpty()) {
            sql.append(" AND dest_party IN (").append(placeholders(parties.size())).append(")");
        }
        sql.append(" ORDER BY table_name,column_name,dest_party");
        List<ColumnPriv> out = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql.toString())) {
            int idx = 1;
            ps.setString(idx++, projectId);
            for (String table : tables) {
                ps.setString(idx++, table);
            }
            for (String party : parties) {
                ps.setString(idx++, party);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ColumnPriv(
                            projectId,
                            rs.getString("table_name"),
                            rs.getString("column_name"),
                            rs.getString("dest_party"),
                            rs.getString("priv")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list column constraints of project " + projectId, e);
        }
        return out;
    }

    public void addProject(String projectId, String creator, long nowMs) {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT OR IGNORE INTO projects(project_id,creator,created_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, projectId);
            ps.setString(2, creator == null ? "" : creator);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to add project " + projectId, e);
        }
    }

    public void addProjectMembers(String projectId, Collection<String> parties) {
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT OR IGNORE INTO project_members(project_id,party_code) VALUES(?,?)")) {
            for (String party : parties) {
                ps.setString(1, projectId);
                ps.setString(2, party);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to add members to project " + projectId, e);
        }
    }

    // Replaces the table row and its full column list.
    public void upsertTable(TableMeta table, long nowMs) {
        try (PreparedStatement up = connection.prepareStatement("""
                INSERT INTO table_metas(project_id,table_name,owner,ref_table,db_type,updated_at_ms) VALUES(?,?,?,?,?,?)
                ON CONFLICT(project_id,table_name) DO UPDATE SET
                    owner=excluded.owner,
                    ref_table=excluded.ref_table,
                    db_type=excluded.db_type,
                    updated_at_ms=excluded.updated_at_ms
                """);
             PreparedStatement del = connection.prepareStatement(
                     "DELETE FROM column_metas WHERE project_id=? AND table_name=?");
             PreparedStatement col = connection.prepareStatement(
                     "INSERT INTO column_metas(project_id,table_name,column_name,data_type,ordinal) VALUES(?,?,?,?,?)")) {
            up.setString(1, table.projectId());
            up.setString(2, table.tableName());
            up.setString(3, table.owner());
            up.setString(4, table.refTable());
            up.setString(5, table.dbType() == null ? "" : table.dbType());
            up.setLong(6, nowMs);
            up.executeUpdate();

            del.setString(1, table.projectId());
            del.setString(2, table.tableName());
            del.executeUpdate();

            int ordinal = 0;
            for (ColumnMeta column : table.columns()) {
                col.setString(1, table.projectId());
                col.setString(2, table.tableName());
                col.setString(3, column.columnName());
                col.setString(4, column.dataType());
                col.setInt(5, ordinal++);
                col.executeUpdate();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert table " + table.dbTable(), e);
        }
    }

    public void upsertColumnPriv(ColumnControl ccl) {
        try (PreparedStatement ps = connection.prepareStatement("""
                INSERT INTO column_privs(project_id,table_name,column_name,dest_party,priv) VALUES(?,?,?,?,?)
                ON CONFLICT(project_id,table_name,column_name,dest_party) DO UPDATE SET priv=excluded.priv
                """)) {
            ps.setString(1, ccl.dbName());
            ps.setString(2, ccl.tableName());
            ps.setString(3, ccl.columnName());
            ps.setString(4, ccl.partyCode());
            ps.setString(5, ccl.visibility().name());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert column privilege on " + ccl.tableName() + "." + ccl.columnName(), e);
        }
    }

    public int deleteColumnPrivs(String projectId, String tableName) {
        try (PreparedStatement ps = connection.prepareStatement(
                "DELETE FROM column_privs WHERE project_id=? AND table_name=?")) {
            ps.setString(1, projectId);
            ps.setString(2, tableName);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete column privileges of " + projectId + "." + tableName, e);
        }
    }

    /**
     * Commits when {@code error} is null, rolls back otherwise, then releases the connection.
     * Calling it again is a no-op.
     */
    public void finish(Throwable error) {
        if (finished) {
            return;
        }
        finished = true;
        try {
            if (error == null) {
                connection.commit();
            } else {
                connection.rollback();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish metadata transaction", e);
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to close metadata connection", e);
            }
        }
    }

    public boolean isFinished() {
        return finished;
    }

    @Override
    public void close() {
        if (!finished) {
            finish(new IllegalStateException("metadata transaction closed without finish"));
        }
    }

    private List<ColumnMeta> readColumns(String projectId, String tableName) throws SQLException {
        List<ColumnMeta> columns = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT column_name,data_type FROM column_metas WHERE project_id=? AND table_name=? ORDER BY ordinal")) {
            ps.setString(1, projectId);
            ps.setString(2, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(new ColumnMeta(rs.getString("column_name"), rs.getString("data_type")));
                }
            }
        }
        return columns;
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }

    public record TableLookup(List<TableMeta> found, List<String> notFound) {
    }

    public record ColumnPriv(String projectId, String tableName, String columnName, String destParty, String priv) {
        public ColumnControl toColumnControl() {
            return new ColumnControl(projectId, tableName, columnName, destParty, Visibility.fromPriv(priv));
        }
    }
}
