package com.flagship.content_graph.handler;

import com.flagship.content_graph.schema.KnownClass;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup of the lifecycle handler for each known class.
 * Refuses to start unless every known class has exactly one handler.
 */
@Component
public class HandlerRegistry {

    private final Map<KnownClass, EntityLifecycleHandler> handlers = new EnumMap<>(KnownClass.class);

    public HandlerRegistry(List<EntityLifecycleHandler> handlers) {
        for (EntityLifecycleHandler handler : handlers) {
            EntityLifecycleHandler previous = this.handlers.put(handler.knownClass(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for " + handler.knownClass() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        Set<KnownClass> missing = EnumSet.allOf(KnownClass.class);
        missing.removeAll(this.handlers.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No lifecycle handler for " + missing);
        }
    }

    public EntityLifecycleHandler handlerFor(KnownClass knownClass) {
        return handlers.get(knownClass);
    }
}
