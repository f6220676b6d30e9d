package com.flagship.content_graph.event;

import java.util.List;

/**
 * A batch of entity creations submitted in one ledger transaction.
 * Applied all-or-nothing.
 */
public record LedgerTransaction(long blockNumber, List<CreateEntityOperation> operations) {

    public LedgerTransaction {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
