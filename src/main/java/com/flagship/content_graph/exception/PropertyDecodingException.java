package com.flagship.content_graph.exception;

/**
 * A raw property value does not match the declared type of its layout slot.
 */
public class PropertyDecodingException extends FatalIngestionException {

    public PropertyDecodingException(String message) {
        super(message);
    }
}
