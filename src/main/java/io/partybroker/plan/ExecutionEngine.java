package io.partybroker.plan;

import io.partybroker.session.CancellationSignal;

import java.io.IOException;

/**
 * Secure computation engine of this party. A non-OK status in the response is a failed run; an
 * {@link IOException} means the engine could not be reached.
 */
public interface ExecutionEngine {
    RunExecutionPlanResponse runExecutionPlan(EngineJob job, boolean async, CancellationSignal cancellation) throws IOException;
}
