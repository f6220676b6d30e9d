package com.flagship.content_graph.schema;

import com.flagship.content_graph.config.MaterializerProperties;
import com.flagship.content_graph.store.ClassEntity;
import com.flagship.content_graph.store.EntityStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Class registry backed by the {@code class_entities} index and the
 * configured class id mapping.
 */
@Component
@RequiredArgsConstructor
public class StoreBackedClassRegistry implements ClassRegistry {

    private final EntityStore store;
    private final MaterializerProperties properties;

    @Override
    public ClassResolution resolveClass(String entityId) {
        return store.find(ClassEntity.class, entityId)
                .map(classEntity -> classOf(classEntity.getClassId()))
                .orElse(ClassResolution.unindexed());
    }

    @Override
    public ClassResolution classOf(int classId) {
        String className = properties.getClasses().get(classId);
        return className == null
                ? ClassResolution.unregistered(classId)
                : ClassResolution.registered(classId, className);
    }

    @Override
    public List<PropertyDefinition> propertyLayout(KnownClass knownClass) {
        return ClassSchemas.layoutOf(knownClass);
    }
}
