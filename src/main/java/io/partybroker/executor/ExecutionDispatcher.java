package io.partybroker.executor;

import com.fasterxml.jackson.databind.JsonNode;
import io.partybroker.config.BrokerSettings;
import io.partybroker.config.PartyRegistry;
import io.partybroker.error.BrokerException;
import io.partybroker.error.ErrorCode;
import io.partybroker.plan.CompiledPlan;
import io.partybroker.plan.EngineJob;
import io.partybroker.plan.EngineStub;
import io.partybroker.plan.PartyEntry;
import io.partybroker.plan.RunExecutionPlanRequest;
import io.partybroker.plan.SessionStartParams;
import io.partybroker.session.Session;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a compiled plan into the request this party hands to its engine. A party's rank is its
 * index in the plan's party list.
 */
public final class ExecutionDispatcher {
    private final Session session;
    private final PartyRegistry registry;
    private final BrokerSettings settings;

    public ExecutionDispatcher(Session session, PartyRegistry registry, BrokerSettings settings) {
        this.session = session;
        this.registry = registry;
        this.settings = settings;
    }

    public EngineJob buildJob(CompiledPlan plan) {
        String self = session.selfPartyCode();
        List<PartyEntry> parties = new ArrayList<>(plan.parties().size());
        String selfEndpoint = null;
        String selfPubKey = null;
        for (int rank = 0; rank < plan.parties().size(); rank++) {
            String code = plan.parties().get(rank);
            String endpoint = session.engineEndpoint(code)
                    .orElseThrow(() -> new BrokerException(ErrorCode.DISPATCH_ERROR, "no engine endpoint for party " + code));
            String pubKey = publicKeyOf(code);
            parties.add(new PartyEntry(code, code, rank, endpoint, pubKey));
            if (self.equals(code)) {
                selfEndpoint = endpoint;
                selfPubKey = pubKey;
            }
        }
        JsonNode graph = plan.subGraphs().get(self);
        if (graph == null) {
            throw new BrokerException(ErrorCode.DISPATCH_ERROR, "no subgraph for party " + self + " in compiled plan");
        }
        if (selfEndpoint == null) {
            selfEndpoint = session.engineEndpoint(self)
                    .orElseThrow(() -> new BrokerException(ErrorCode.DISPATCH_ERROR, "no engine endpoint for party " + self));
            selfPubKey = publicKeyOf(self);
        }

        RunExecutionPlanRequest request = new RunExecutionPlanRequest(
                new SessionStartParams(self, session.id(), plan.spuRuntimeConfig(), parties),
                graph,
                session.asyncMode(),
                session.executeInfo().debugOpts()
        );
        List<String> outputNames = session.isIssuer() ? plan.outputColumns() : List.of();
        EngineStub stub = new EngineStub(
                session.id(),
                settings.intraProtocol(),
                settings.callbackHost(),
                settings.engineCallbackPath(),
                List.of(new EngineStub.Participant(self, selfEndpoint, selfPubKey))
        );
        return new EngineJob(Map.of(self, request), outputNames, stub);
    }

    private String publicKeyOf(String code) {
        String pubKey;
        try {
            pubKey = registry.pubKeyOf(code);
        } catch (IllegalArgumentException e) {
            throw new BrokerException(ErrorCode.DISPATCH_ERROR, "no public key for party " + code, e);
        }
        if (pubKey == null || pubKey.isBlank()) {
            throw new BrokerException(ErrorCode.DISPATCH_ERROR, "no public key for party " + code);
        }
        return pubKey;
    }
}
