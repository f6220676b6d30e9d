package com.flagship.content_graph.exception;

public class MissingExtrinsicDataException extends FatalIngestionException {

    public MissingExtrinsicDataException(String kind, long blockNumber, String entityId) {
        super(String.format("Extrinsic data not found for %s event: block=%d, entity=%s",
                kind, blockNumber, entityId));
    }
}
