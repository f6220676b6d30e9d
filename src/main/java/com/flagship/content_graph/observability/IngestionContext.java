package com.flagship.content_graph.observability;

import org.slf4j.MDC;

/**
 * MDC context of the ledger message being materialized.
 *
 * The block number and entity id flow into every log statement made while
 * the message is processed (see {@code logging.pattern.level}).
 */
public final class IngestionContext {

    public static final String BLOCK_NUMBER_MDC_KEY = "blockNumber";
    public static final String ENTITY_ID_MDC_KEY = "entityId";

    private IngestionContext() {
        // Utility class
    }

    public static void enter(long blockNumber, String entityId) {
        MDC.put(BLOCK_NUMBER_MDC_KEY, Long.toString(blockNumber));
        if (entityId != null) {
            MDC.put(ENTITY_ID_MDC_KEY, entityId);
        } else {
            MDC.remove(ENTITY_ID_MDC_KEY);
        }
    }

    /**
     * Clears the context. Must be called when the message settles.
     */
    public static void clear() {
        MDC.remove(BLOCK_NUMBER_MDC_KEY);
        MDC.remove(ENTITY_ID_MDC_KEY);
    }

    public static String currentBlockNumber() {
        return MDC.get(BLOCK_NUMBER_MDC_KEY);
    }
}
