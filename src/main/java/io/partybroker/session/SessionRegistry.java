package io.partybroker.session;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live sessions of this broker, keyed by job id. Shared by query threads and the session GC loop.
 */
public final class SessionRegistry {
    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();

    public void register(Session session) {
        Session previous = sessions.putIfAbsent(session.id(), session);
        if (previous != null) {
            throw new IllegalStateException("session already exists: " + session.id());
        }
    }

    public Optional<Session> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    // Deleting an unknown id is a no-op.
    public Optional<Session> delete(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public List<String> snapshotIds() {
        return List.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }
}
