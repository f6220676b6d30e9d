package com.flagship.content_graph.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * The ledger call that emitted an event, with its decoded arguments.
 */
public record Extrinsic(String method, List<JsonNode> args) {

    public static final String TRANSACTION_METHOD = "transaction";

    public Extrinsic {
        args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * Multi-operation wrappers are materialized as a {@link LedgerTransaction}
     * instead of event by event.
     */
    public boolean isTransaction() {
        return TRANSACTION_METHOD.equals(method);
    }

    public Optional<JsonNode> arg(int index) {
        if (index < 0 || index >= args.size()) {
            return Optional.empty();
        }
        JsonNode node = args.get(index);
        return node == null || node.isNull() ? Optional.empty() : Optional.of(node);
    }
}
