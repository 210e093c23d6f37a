package io.partybroker.plan;

/**
 * Turns a query and its catalog into a per-party execution plan. Implementations report failure by
 * throwing an unchecked exception carrying the compiler's message.
 */
public interface Compiler {
    CompiledPlan compile(CompileQueryRequest request);
}
