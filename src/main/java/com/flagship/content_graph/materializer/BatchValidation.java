package com.flagship.content_graph.materializer;

import java.util.Optional;

/**
 * Verdict of the integrity scan over a ledger transaction.
 */
public final class BatchValidation {

    private static final BatchValidation APPLICABLE = new BatchValidation(null);

    private final UnresolvedReference firstUnresolved;

    private BatchValidation(UnresolvedReference firstUnresolved) {
        this.firstUnresolved = firstUnresolved;
    }

    public static BatchValidation applicable() {
        return APPLICABLE;
    }

    public static BatchValidation ignored(UnresolvedReference firstUnresolved) {
        return new BatchValidation(firstUnresolved);
    }

    public boolean isApplicable() {
        return firstUnresolved == null;
    }

    /**
     * The reference that caused the batch to be ignored.
     */
    public Optional<UnresolvedReference> firstUnresolved() {
        return Optional.ofNullable(firstUnresolved);
    }
}
