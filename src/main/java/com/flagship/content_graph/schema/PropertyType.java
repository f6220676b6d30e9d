package com.flagship.content_graph.schema;

/**
 * Declared type of a property slot, with the tag its raw value carries on
 * the wire.
 */
public enum PropertyType {
    TEXT("Text"),
    BOOL("Bool"),
    UINT16("Uint16"),
    UINT32("Uint32"),
    UINT64("Uint64"),
    INT64("Int64"),
    REFERENCE("Reference");

    private final String wireTag;

    PropertyType(String wireTag) {
        this.wireTag = wireTag;
    }

    public String wireTag() {
        return wireTag;
    }
}
