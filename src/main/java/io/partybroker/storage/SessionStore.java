package io.partybroker.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.partybroker.model.QueryResult;
import io.partybroker.model.SessionStatus;
import io.partybroker.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable session bookkeeping shared by every broker replica of one party: session rows, stored
 * results, cancellation marks and the storage GC lease.
 */
public final class SessionStore {
    public static final String STORAGE_GC_LOCK = "storage_gc";
    static final int ID_CHUNK = 500;

    private final Database database;

    public SessionStore(Database database) {
        this.database = database;
    }

    public void persistSessionInfo(SessionInfo info) {
        String sql = """
                INSERT INTO session_infos(session_id,project_id,issuer,query,status,output_names,warning,engine_endpoint,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(session_id) DO UPDATE SET
                    project_id=excluded.project_id,
                    issuer=excluded.issuer,
                    query=excluded.query,
                    status=excluded.status,
                    output_names=excluded.output_names,
                    warning=excluded.warning,
                    engine_endpoint=excluded.engine_endpoint,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, info.sessionId());
            ps.setString(2, nullToEmpty(info.projectId()));
            ps.setString(3, nullToEmpty(info.issuer()));
            ps.setString(4, nullToEmpty(info.query()));
            ps.setString(5, info.status().name());
            ps.setString(6, Jsons.toCompactJson(info.outputNames()));
            ps.setString(7, info.warningJson() == null || info.warningJson().isBlank() ? "{}" : info.warningJson());
            ps.setString(8, nullToEmpty(info.engineEndpoint()));
            ps.setLong(9, info.createdAtMs());
            ps.setLong(10, info.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to persist session info " + info.sessionId(), e);
        }
    }

    public Optional<SessionInfo> getSessionInfo(String sessionId) {
        String sql = "SELECT * FROM session_infos WHERE session_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new SessionInfo(
                        rs.getString("session_id"),
                        rs.getString("project_id"),
                        rs.getString("issuer"),
                        rs.getString("query"),
                        SessionStatus.valueOf(rs.getString("status")),
                        parseNames(rs.getString("output_names")),
                        rs.getString("warning"),
                        rs.getString("engine_endpoint"),
                        rs.getLong("created_at_ms"),
                        rs.getLong("updated_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read session info " + sessionId, e);
        }
    }

    // Stores the result and flips a known session row to FINISHED.
    public void saveSessionResult(String sessionId, QueryResult result, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps1 = c.prepareStatement("""
                    INSERT INTO session_results(session_id,result,created_at_ms) VALUES(?,?,?)
                    ON CONFLICT(session_id) DO UPDATE SET result=excluded.result,created_at_ms=excluded.created_at_ms
                    """);
                 PreparedStatement ps2 = c.prepareStatement(
                         "UPDATE session_infos SET status=?,updated_at_ms=? WHERE session_id=? AND status=?")) {
                ps1.setString(1, sessionId);
                ps1.setString(2, Jsons.toCompactJson(result));
                ps1.setLong(3, nowMs);
                ps1.executeUpdate();
                ps2.setString(1, SessionStatus.FINISHED.name());
                ps2.setLong(2, nowMs);
                ps2.setString(3, sessionId);
                ps2.setString(4, SessionStatus.RUNNING.name());
                ps2.executeUpdate();
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to save result of session " + sessionId, e);
        }
    }

    public Optional<QueryResult> getSessionResult(String sessionId) {
        String sql = "SELECT result FROM session_results WHERE session_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(Jsons.fromJson(rs.getString("result"), QueryResult.class));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read result of session " + sessionId, e);
        }
    }

    public void markSessionCanceled(String sessionId, long nowMs) {
        String sql = """
                INSERT INTO session_infos(session_id,status,created_at_ms,updated_at_ms) VALUES(?,?,?,?)
                ON CONFLICT(session_id) DO UPDATE SET status=excluded.status,updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sessionId);
            ps.setString(2, SessionStatus.CANCELED.name());
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cancel session " + sessionId, e);
        }
    }

    /**
     * Returns the subset of {@code sessionIds} that some replica has marked canceled.
     */
    public Set<String> checkIdCanceled(Collection<String> sessionIds) {
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(sessionIds));
        Set<String> canceled = new LinkedHashSet<>();
        if (ids.isEmpty()) {
            return canceled;
        }
        try (Connection c = database.openConnection()) {
            for (int from = 0; from < ids.size(); from += ID_CHUNK) {
                List<String> chunk = ids.subList(from, Math.min(ids.size(), from + ID_CHUNK));
                String sql = "SELECT session_id FROM session_infos WHERE status=? AND session_id IN ("
                        + String.join(",", Collections.nCopies(chunk.size(), "?")) + ")";
                try (PreparedStatement ps = c.prepareStatement(sql)) {
                    ps.setString(1, SessionStatus.CANCELED.name());
                    int idx = 2;
                    for (String id : chunk) {
                        ps.setString(idx++, id);
                    }
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            canceled.add(rs.getString("session_id"));
                        }
                    }
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check canceled sessions", e);
        }
        return canceled;
    }

    public void initGcLockIfNecessary() {
        String sql = "INSERT OR IGNORE INTO gc_locks(lock_name,owner,expired_at_ms) VALUES(?,'',0)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, STORAGE_GC_LOCK);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to init gc lock", e);
        }
    }

    /**
     * Takes or renews the storage GC lease. Succeeds when the lease is already ours or has expired;
     * the single conditional update makes concurrent callers from different replicas exclusive.
     */
    public boolean holdGcLock(String owner, long ttlMs, long nowMs) {
        String sql = "UPDATE gc_locks SET owner=?,expired_at_ms=? WHERE lock_name=? AND (owner=? OR expired_at_ms<=?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, owner);
            ps.setLong(2, nowMs + Math.max(0L, ttlMs));
            ps.setString(3, STORAGE_GC_LOCK);
            ps.setString(4, owner);
            ps.setLong(5, nowMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to hold gc lock", e);
        }
    }

    public Optional<GcLease> currentGcLock() {
        String sql = "SELECT owner,expired_at_ms FROM gc_locks WHERE lock_name=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, STORAGE_GC_LOCK);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new GcLease(rs.getString("owner"), rs.getLong("expired_at_ms")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read gc lock", e);
        }
    }

    // Drops results older than expireMs and marks stale sessions EXPIRED; canceled rows are kept.
    public ClearOutcome clearExpiredResults(long expireMs, long nowMs) {
        long cutoff = nowMs - Math.max(0L, expireMs);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps1 = c.prepareStatement("DELETE FROM session_results WHERE created_at_ms<?");
                 PreparedStatement ps2 = c.prepareStatement(
                         "UPDATE session_infos SET status=?,updated_at_ms=? WHERE created_at_ms<? AND status IN (?,?,?)")) {
                ps1.setLong(1, cutoff);
                int results = ps1.executeUpdate();
                ps2.setString(1, SessionStatus.EXPIRED.name());
                ps2.setLong(2, nowMs);
                ps2.setLong(3, cutoff);
                ps2.setString(4, SessionStatus.RUNNING.name());
                ps2.setString(5, SessionStatus.FINISHED.name());
                ps2.setString(6, SessionStatus.FAILED.name());
                int sessions = ps2.executeUpdate();
                c.commit();
                return new ClearOutcome(results, sessions);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to clear expired session results", e);
        }
    }

    private static List<String> parseNames(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return Jsons.compact().readValue(raw, new TypeReference<List<String>>() {
            });
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse output names", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public record SessionInfo(
            String sessionId,
            String projectId,
            String issuer,
            String query,
            SessionStatus status,
            List<String> outputNames,
            String warningJson,
            String engineEndpoint,
            long createdAtMs,
            long updatedAtMs
    ) {
        public SessionInfo {
            outputNames = outputNames == null ? List.of() : List.copyOf(outputNames);
        }
    }

    public record GcLease(String owner, long expiredAtMs) {
    }

    public record ClearOutcome(int resultsRemoved, int sessionsExpired) {
    }
}
