package io.partybroker.executor;

import com.fasterxml.jackson.databind.JsonNode;
import io.partybroker.model.Status;
import io.partybroker.plan.EngineJob;
import io.partybroker.plan.ExecutionEngine;
import io.partybroker.plan.RunExecutionPlanResponse;
import io.partybroker.session.CancellationSignal;
import io.partybroker.util.Jsons;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class FakeEngine implements ExecutionEngine {
    final AtomicInteger calls = new AtomicInteger();
    volatile EngineJob lastJob;
    volatile boolean lastAsync;
    volatile Status status = Status.ok();
    volatile IOException failWith;
    volatile Runnable onRun = () -> {
    };

    @Override
    public RunExecutionPlanResponse runExecutionPlan(EngineJob job, boolean async, CancellationSignal cancellation) throws IOException {
        calls.incrementAndGet();
        lastJob = job;
        lastAsync = async;
        onRun.run();
        if (failWith != null) {
            throw failWith;
        }
        JsonNode column = Jsons.compact().createObjectNode().put("name", "cnt").put("value", 42);
        return new RunExecutionPlanResponse(status, List.of(column), 1L);
    }
}
