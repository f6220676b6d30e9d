package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.CategoryEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.CategoryProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class CategoryHandler extends AbstractEntityHandler<CategoryEntity, CategoryProperties> {

    public CategoryHandler(EntityStore store) {
        super(store, KnownClass.CATEGORY, CategoryEntity.class, CategoryProperties.class, CategoryEntity::new);
    }

    @Override
    protected void apply(CategoryEntity row, CategoryProperties properties) {
        assign(properties.name(), row::setName);
        assign(properties.description(), row::setDescription);
    }
}
