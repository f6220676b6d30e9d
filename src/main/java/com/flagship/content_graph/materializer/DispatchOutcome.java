package com.flagship.content_graph.materializer;

/**
 * Result of materializing one ledger event or transaction.
 *
 * Fatal conditions are not outcomes: they are thrown as
 * {@link com.flagship.content_graph.exception.FatalIngestionException}.
 */
public record DispatchOutcome(Status status, String reason) {

    public enum Status {
        APPLIED,    // Store mutated
        DROPPED,    // Recoverable rejection, store unchanged
        SKIPPED     // Not handled on this path (transaction wrapper events)
    }

    private static final DispatchOutcome APPLIED = new DispatchOutcome(Status.APPLIED, null);

    public static DispatchOutcome applied() {
        return APPLIED;
    }

    public static DispatchOutcome dropped(String reason) {
        return new DispatchOutcome(Status.DROPPED, reason);
    }

    public static DispatchOutcome skipped(String reason) {
        return new DispatchOutcome(Status.SKIPPED, reason);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    public boolean isDropped() {
        return status == Status.DROPPED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
