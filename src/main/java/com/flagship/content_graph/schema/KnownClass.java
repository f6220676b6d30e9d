package com.flagship.content_graph.schema;

import com.flagship.content_graph.content.CategoryEntity;
import com.flagship.content_graph.content.ChannelEntity;
import com.flagship.content_graph.content.FeaturedVideoEntity;
import com.flagship.content_graph.content.HttpMediaLocationEntity;
import com.flagship.content_graph.content.JoystreamMediaLocationEntity;
import com.flagship.content_graph.content.KnownLicenseEntity;
import com.flagship.content_graph.content.LanguageEntity;
import com.flagship.content_graph.content.LicenseEntity;
import com.flagship.content_graph.content.MediaLocationEntity;
import com.flagship.content_graph.content.TypedEntity;
import com.flagship.content_graph.content.UserDefinedLicenseEntity;
import com.flagship.content_graph.content.VideoEntity;
import com.flagship.content_graph.content.VideoMediaEncodingEntity;
import com.flagship.content_graph.content.VideoMediaEntity;

import java.util.Arrays;
import java.util.Optional;

/**
 * The content directory classes the materializer understands.
 *
 * Every entity whose class is not listed here stays a bare
 * {@code ClassEntity} row and never acquires a typed row.
 */
public enum KnownClass {
    CHANNEL("Channel", ChannelEntity.class),
    CATEGORY("Category", CategoryEntity.class),
    KNOWN_LICENSE("KnownLicense", KnownLicenseEntity.class),
    USER_DEFINED_LICENSE("UserDefinedLicense", UserDefinedLicenseEntity.class),
    JOYSTREAM_MEDIA_LOCATION("JoystreamMediaLocation", JoystreamMediaLocationEntity.class),
    HTTP_MEDIA_LOCATION("HttpMediaLocation", HttpMediaLocationEntity.class),
    VIDEO_MEDIA_ENCODING("VideoMediaEncoding", VideoMediaEncodingEntity.class),
    VIDEO_MEDIA("VideoMedia", VideoMediaEntity.class),
    VIDEO("Video", VideoEntity.class),
    LANGUAGE("Language", LanguageEntity.class),
    LICENSE("License", LicenseEntity.class),
    MEDIA_LOCATION("MediaLocation", MediaLocationEntity.class),
    FEATURED_VIDEO("FeaturedVideo", FeaturedVideoEntity.class);

    private final String className;
    private final Class<? extends TypedEntity> rowType;

    KnownClass(String className, Class<? extends TypedEntity> rowType) {
        this.className = className;
        this.rowType = rowType;
    }

    /**
     * Name of the class as registered on the ledger.
     */
    public String className() {
        return className;
    }

    /**
     * JPA entity holding the typed rows of this class.
     */
    public Class<? extends TypedEntity> rowType() {
        return rowType;
    }

    public static Optional<KnownClass> fromClassName(String className) {
        if (className == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(k -> k.className.equals(className))
                .findFirst();
    }
}
