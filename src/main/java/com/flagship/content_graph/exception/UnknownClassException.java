package com.flagship.content_graph.exception;

/**
 * An update or removal targets an entity whose class cannot be resolved to
 * a known class, or a registered class name is outside the known-class
 * enumeration.
 */
public class UnknownClassException extends FatalIngestionException {

    public UnknownClassException(String message) {
        super(message);
    }

    public static UnknownClassException forEntity(String entityId) {
        return new UnknownClassException("Unknown class for entity: " + entityId);
    }

    public static UnknownClassException forClassName(String className) {
        return new UnknownClassException("Unknown class name: " + className);
    }
}
