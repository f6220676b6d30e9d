package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.FeaturedVideoEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.FeaturedVideoProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class FeaturedVideoHandler extends AbstractEntityHandler<FeaturedVideoEntity, FeaturedVideoProperties> {

    public FeaturedVideoHandler(EntityStore store) {
        super(store, KnownClass.FEATURED_VIDEO, FeaturedVideoEntity.class, FeaturedVideoProperties.class, FeaturedVideoEntity::new);
    }

    @Override
    protected void apply(FeaturedVideoEntity row, FeaturedVideoProperties properties) {
        assignReference(properties.video(), row::setVideoId);
    }
}
