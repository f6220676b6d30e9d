package com.flagship.content_graph.exception;

/**
 * Entity ids of a ledger transaction do not increase with batch position,
 * or start below the next entity id already recorded.
 */
public class BatchOrderingException extends FatalIngestionException {

    public BatchOrderingException(String message) {
        super(message);
    }
}
