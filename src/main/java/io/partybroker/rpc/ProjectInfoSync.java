package io.partybroker.rpc;

import io.partybroker.config.PartyRegistry;
import io.partybroker.error.BrokerException;
import io.partybroker.error.ErrorCode;
import io.partybroker.model.ColumnControl;
import io.partybroker.model.TableMeta;
import io.partybroker.storage.MetaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pulls table metadata this broker lacks from the parties that own it. A peer may only contribute
 * tables it owns itself.
 */
public final class ProjectInfoSync {
    private static final Logger log = LoggerFactory.getLogger(ProjectInfoSync.class);

    private final String selfPartyCode;
    private final PartyRegistry registry;
    private final InterPartyStub stub;
    private final MetaStore metaStore;

    public ProjectInfoSync(String selfPartyCode, PartyRegistry registry, InterPartyStub stub, MetaStore metaStore) {
        this.selfPartyCode = selfPartyCode;
        this.registry = registry;
        this.stub = stub;
        this.metaStore = metaStore;
    }

    /**
     * Asks every target party for {@code tableNames} and stores what they return. Every target is
     * asked even when an earlier one failed; the failures are then reported together.
     *
     * @return number of tables stored
     */
    public int askProjectInfoFromParties(String projectId, Collection<String> tableNames, Collection<String> targets) {
        List<String> failures = new ArrayList<>();
        int stored = 0;
        for (String target : targets) {
            if (selfPartyCode.equals(target)) {
                continue;
            }
            try {
                String url = registry.brokerUrlOf(target);
                AskInfoResponse response = stub.askInfo(url, new AskInfoRequest(projectId, List.copyOf(tableNames), selfPartyCode));
                if (response == null || response.status() == null) {
                    failures.add(target + ": empty response");
                    continue;
                }
                switch (response.status().kind()) {
                    case OK -> stored += store(projectId, target, response);
                    case SESSION_NOT_FOUND, DATA_INCONSISTENCY, OTHER ->
                            failures.add(target + ": " + response.status().code() + " " + response.status().message());
                }
            } catch (IOException | IllegalArgumentException e) {
                failures.add(target + ": " + e.getMessage());
            }
        }
        if (!failures.isEmpty()) {
            throw new BrokerException(ErrorCode.TRANSPORT_ERROR, "failed to ask project info: " + String.join("; ", failures));
        }
        return stored;
    }

    private int store(String projectId, String target, AskInfoResponse response) {
        List<TableMeta> owned = response.tables().stream()
                .filter(t -> target.equals(t.owner()) && projectId.equals(t.projectId()))
                .toList();
        if (owned.size() != response.tables().size()) {
            log.warn("party {} returned {} tables it does not own, ignored", target, response.tables().size() - owned.size());
        }
        if (owned.isEmpty()) {
            return 0;
        }
        Set<String> ownedNames = owned.stream().map(TableMeta::tableName).collect(Collectors.toSet());
        List<ColumnControl> ccls = response.ccls().stream()
                .filter(c -> projectId.equals(c.dbName()) && ownedNames.contains(c.tableName()))
                .toList();
        metaStore.saveRemoteMetadata(projectId, owned, ccls, System.currentTimeMillis());
        log.info("stored {} tables and {} column controls of project {} from party {}", owned.size(), ccls.size(), projectId, target);
        return owned.size();
    }
}
