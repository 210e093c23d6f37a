package io.partybroker.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.partybroker.model.QueryResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory state of one query on this broker. The result slot is written at most once: a
 * synchronous completion and an asynchronous engine callback race through {@link #setResultSafely}.
 */
public final class Session {
    private final ExecuteInfo executeInfo;
    private final String selfPartyCode;
    private final long createdAtMs;
    private final boolean asyncMode;
    private final CancellationSignal cancellation;
    private final Map<String, String> engineEndpoints = new ConcurrentHashMap<>();
    private final AtomicReference<QueryResult> result = new AtomicReference<>();
    private volatile List<String> outputNames = List.of();
    private volatile JsonNode warning;

    public Session(ExecuteInfo executeInfo, String selfPartyCode, long createdAtMs, boolean asyncMode, CancellationSignal cancellation) {
        this.executeInfo = executeInfo;
        this.selfPartyCode = selfPartyCode;
        this.createdAtMs = createdAtMs;
        this.asyncMode = asyncMode;
        this.cancellation = cancellation == null ? new CancellationSignal() : cancellation;
    }

    public String id() {
        return executeInfo.jobId();
    }

    public ExecuteInfo executeInfo() {
        return executeInfo;
    }

    public String selfPartyCode() {
        return selfPartyCode;
    }

    public boolean isIssuer() {
        return selfPartyCode.equals(executeInfo.issuer());
    }

    public long createdAtMs() {
        return createdAtMs;
    }

    public boolean asyncMode() {
        return asyncMode;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    public void saveEndpoint(String partyCode, String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return;
        }
        engineEndpoints.put(partyCode, endpoint.trim());
    }

    public Optional<String> engineEndpoint(String partyCode) {
        return Optional.ofNullable(engineEndpoints.get(partyCode));
    }

    public boolean setResultSafely(QueryResult value) {
        return result.compareAndSet(null, value);
    }

    public Optional<QueryResult> result() {
        return Optional.ofNullable(result.get());
    }

    public List<String> outputNames() {
        return outputNames;
    }

    public void setOutputNames(List<String> names) {
        this.outputNames = names == null ? List.of() : List.copyOf(names);
    }

    public JsonNode warning() {
        return warning;
    }

    public void setWarning(JsonNode warning) {
        this.warning = warning;
    }
}
