package com.flagship.content_graph.exception;

/**
 * Base class for conditions that must halt ingestion of the current block.
 *
 * Recoverable conditions (dangling references, unregistered classes during
 * schema attachment) are never thrown; they are reported as a dropped
 * dispatch outcome instead.
 */
public abstract class FatalIngestionException extends RuntimeException {

    protected FatalIngestionException(String message) {
        super(message);
    }

    protected FatalIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
