package com.flagship.content_graph.handler;

/**
 * The ledger block a mutation belongs to.
 */
public record BlockContext(long height) {

    public BlockContext {
        if (height < 0) {
            throw new IllegalArgumentException("Block height must not be negative: " + height);
        }
    }
}
