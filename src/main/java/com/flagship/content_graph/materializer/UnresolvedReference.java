package com.flagship.content_graph.materializer;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.ReferenceProperty;

/**
 * A reference whose target could not be found.
 */
public record UnresolvedReference(KnownClass sourceClass, String sourceEntityId, ReferenceProperty property) {

    public String describe() {
        return String.format("%s %s.%s -> %s %s (%s)",
                sourceClass.className(),
                sourceEntityId,
                property.property(),
                property.targetClass().className(),
                property.reference().targetEntityId(),
                property.reference().existing() ? "existing" : "same transaction");
    }
}
