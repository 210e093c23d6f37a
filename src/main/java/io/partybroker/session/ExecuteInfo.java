package io.partybroker.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * What a session is asked to run and which parties take part in it. The party lists are replaced
 * by each successful preparation.
 */
public final class ExecuteInfo {
    private final String projectId;
    private final String jobId;
    private final String issuer;
    private final String query;
    private final JsonNode compileOpts;
    private final JsonNode debugOpts;
    private final ChecksumStore checksums = new ChecksumStore();
    private volatile List<String> dataParties = List.of();
    private volatile List<String> workParties = List.of();

    public ExecuteInfo(String projectId, String jobId, String issuer, String query, JsonNode compileOpts, JsonNode debugOpts) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("project id must not be blank");
        }
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be blank");
        }
        this.projectId = projectId;
        this.jobId = jobId;
        this.issuer = issuer;
        this.query = query == null ? "" : query;
        this.compileOpts = compileOpts;
        this.debugOpts = debugOpts;
    }

    public String projectId() {
        return projectId;
    }

    public String jobId() {
        return jobId;
    }

    public String issuer() {
        return issuer;
    }

    public String query() {
        return query;
    }

    public JsonNode compileOpts() {
        return compileOpts;
    }

    public JsonNode debugOpts() {
        return debugOpts;
    }

    public ChecksumStore checksums() {
        return checksums;
    }

    public List<String> dataParties() {
        return dataParties;
    }

    public List<String> workParties() {
        return workParties;
    }

    public void setParties(List<String> dataParties, List<String> workParties) {
        this.dataParties = List.copyOf(dataParties);
        this.workParties = List.copyOf(workParties);
    }
}
