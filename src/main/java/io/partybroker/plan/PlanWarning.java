package io.partybroker.plan;

public record PlanWarning(boolean mayAffectedByGroupThreshold) {
    public static PlanWarning none() {
        return new PlanWarning(false);
    }
}
