package com.flagship.content_graph.handler;

import com.flagship.content_graph.content.ChannelEntity;
import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.properties.ChannelProperties;
import com.flagship.content_graph.store.EntityStore;
import org.springframework.stereotype.Component;

@Component
public class ChannelHandler extends AbstractEntityHandler<ChannelEntity, ChannelProperties> {

    public ChannelHandler(EntityStore store) {
        super(store, KnownClass.CHANNEL, ChannelEntity.class, ChannelProperties.class, ChannelEntity::new);
    }

    @Override
    protected void apply(ChannelEntity row, ChannelProperties properties) {
        assign(properties.handle(), row::setHandle);
        assign(properties.description(), row::setDescription);
        assign(properties.coverPhotoUrl(), row::setCoverPhotoUrl);
        assign(properties.avatarPhotoUrl(), row::setAvatarPhotoUrl);
        assign(properties.isPublic(), row::setIsPublic);
        assign(properties.isCurated(), row::setIsCurated);
        assignReference(properties.language(), row::setLanguageId);
    }
}
