package com.flagship.content_graph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.content_graph.exception.PropertyDecodingException;
import com.flagship.content_graph.schema.properties.CategoryProperties;
import com.flagship.content_graph.schema.properties.ChannelProperties;
import com.flagship.content_graph.schema.properties.EntityProperties;
import com.flagship.content_graph.schema.properties.FeaturedVideoProperties;
import com.flagship.content_graph.schema.properties.HttpMediaLocationProperties;
import com.flagship.content_graph.schema.properties.JoystreamMediaLocationProperties;
import com.flagship.content_graph.schema.properties.KnownLicenseProperties;
import com.flagship.content_graph.schema.properties.LanguageProperties;
import com.flagship.content_graph.schema.properties.LicenseProperties;
import com.flagship.content_graph.schema.properties.MediaLocationProperties;
import com.flagship.content_graph.schema.properties.UserDefinedLicenseProperties;
import com.flagship.content_graph.schema.properties.VideoMediaEncodingProperties;
import com.flagship.content_graph.schema.properties.VideoMediaProperties;
import com.flagship.content_graph.schema.properties.VideoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes the raw property value map of a ledger call into typed properties.
 *
 * The raw map is keyed by property id (the position in the class layout).
 * Each value is a single-entry object whose key is the wire tag of its type:
 * <pre>
 * {"0": {"Text": "my-channel"}, "6": {"Reference": {"ExistingEntity": 42}}}
 * </pre>
 * A reference tagged {@code InternalEntityJustAdded} points at an entity
 * created by the same ledger transaction.
 *
 * Decoding never touches the store.
 */
@Component
@Slf4j
public class PropertyDecoder {

    static final String EXISTING_ENTITY_TAG = "ExistingEntity";
    static final String INTERNAL_ENTITY_TAG = "InternalEntityJustAdded";

    private static final long UINT16_MAX = 0xFFFFL;
    private static final long UINT32_MAX = 0xFFFFFFFFL;

    /**
     * Decodes raw values into the statically typed property set of the class.
     *
     * @throws PropertyDecodingException if a value does not match its declared type
     */
    public EntityProperties decode(KnownClass knownClass, List<PropertyDefinition> layout, JsonNode rawValues) {
        PropertyBag bag = decodeBag(knownClass, layout, rawValues);
        return switch (knownClass) {
            case CHANNEL -> ChannelProperties.from(bag);
            case CATEGORY -> CategoryProperties.from(bag);
            case KNOWN_LICENSE -> KnownLicenseProperties.from(bag);
            case USER_DEFINED_LICENSE -> UserDefinedLicenseProperties.from(bag);
            case JOYSTREAM_MEDIA_LOCATION -> JoystreamMediaLocationProperties.from(bag);
            case HTTP_MEDIA_LOCATION -> HttpMediaLocationProperties.from(bag);
            case VIDEO_MEDIA_ENCODING -> VideoMediaEncodingProperties.from(bag);
            case VIDEO_MEDIA -> VideoMediaProperties.from(bag);
            case VIDEO -> VideoProperties.from(bag);
            case LANGUAGE -> LanguageProperties.from(bag);
            case LICENSE -> LicenseProperties.from(bag);
            case MEDIA_LOCATION -> MediaLocationProperties.from(bag);
            case FEATURED_VIDEO -> FeaturedVideoProperties.from(bag);
        };
    }

    /**
     * Decodes raw values into a name-keyed bag. Property ids outside the
     * layout are ignored.
     */
    public PropertyBag decodeBag(KnownClass knownClass, List<PropertyDefinition> layout, JsonNode rawValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (rawValues == null || rawValues.isNull()) {
            return new PropertyBag(knownClass, values);
        }
        if (!rawValues.isObject()) {
            throw new PropertyDecodingException(String.format(
                    "Property values of %s must be a map keyed by property id, got %s",
                    knownClass.className(), rawValues.getNodeType()));
        }

        Iterator<Map.Entry<String, JsonNode>> fields = rawValues.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int propertyId = parsePropertyId(knownClass, field.getKey());
            if (propertyId >= layout.size()) {
                log.debug("Ignoring property id {} outside the {} layout", propertyId, knownClass.className());
                continue;
            }
            JsonNode raw = field.getValue();
            if (raw == null || raw.isNull()) {
                continue;
            }
            PropertyDefinition definition = layout.get(propertyId);
            values.put(definition.name(), decodeValue(knownClass, definition, raw));
        }
        return new PropertyBag(knownClass, values);
    }

    private int parsePropertyId(KnownClass knownClass, String key) {
        try {
            int id = Integer.parseInt(key);
            if (id < 0) {
                throw new NumberFormatException(key);
            }
            return id;
        } catch (NumberFormatException e) {
            throw new PropertyDecodingException(String.format(
                    "Invalid property id '%s' for %s", key, knownClass.className()));
        }
    }

    private Object decodeValue(KnownClass knownClass, PropertyDefinition definition, JsonNode raw) {
        String tag = definition.type().wireTag();
        if (!raw.isObject() || raw.size() != 1 || !raw.has(tag)) {
            throw mismatch(knownClass, definition, raw);
        }
        JsonNode value = raw.get(tag);

        return switch (definition.type()) {
            case TEXT -> {
                if (!value.isTextual()) {
                    throw mismatch(knownClass, definition, raw);
                }
                yield value.asText();
            }
            case BOOL -> {
                if (!value.isBoolean()) {
                    throw mismatch(knownClass, definition, raw);
                }
                yield value.booleanValue();
            }
            case UINT16 -> (int) unsigned(knownClass, definition, raw, value, UINT16_MAX);
            case UINT32 -> unsigned(knownClass, definition, raw, value, UINT32_MAX);
            case UINT64 -> unsigned64(knownClass, definition, raw, value);
            case INT64 -> {
                if (!value.isIntegralNumber() || !value.canConvertToLong()) {
                    throw mismatch(knownClass, definition, raw);
                }
                yield value.longValue();
            }
            case REFERENCE -> decodeReference(knownClass, definition, raw, value);
        };
    }

    private long unsigned(KnownClass knownClass, PropertyDefinition definition,
                          JsonNode raw, JsonNode value, long max) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw mismatch(knownClass, definition, raw);
        }
        long number = value.longValue();
        if (number < 0 || number > max) {
            throw new PropertyDecodingException(String.format(
                    "Property %s.%s out of range for %s: %d",
                    knownClass.className(), definition.name(), definition.type(), number));
        }
        return number;
    }

    private BigInteger unsigned64(KnownClass knownClass, PropertyDefinition definition,
                                  JsonNode raw, JsonNode value) {
        if (!value.isIntegralNumber()) {
            throw mismatch(knownClass, definition, raw);
        }
        BigInteger number = value.bigIntegerValue();
        if (number.signum() < 0 || number.bitLength() > Long.SIZE) {
            throw new PropertyDecodingException(String.format(
                    "Property %s.%s out of range for %s: %s",
                    knownClass.className(), definition.name(), definition.type(), number));
        }
        return number;
    }

    private Reference decodeReference(KnownClass knownClass, PropertyDefinition definition,
                                      JsonNode raw, JsonNode value) {
        if (!value.isObject() || value.size() != 1) {
            throw mismatch(knownClass, definition, raw);
        }
        boolean existing;
        JsonNode target;
        if (value.has(EXISTING_ENTITY_TAG)) {
            existing = true;
            target = value.get(EXISTING_ENTITY_TAG);
        } else if (value.has(INTERNAL_ENTITY_TAG)) {
            existing = false;
            target = value.get(INTERNAL_ENTITY_TAG);
        } else {
            throw mismatch(knownClass, definition, raw);
        }
        if (!target.isIntegralNumber() || !target.canConvertToLong() || target.longValue() < 0) {
            throw mismatch(knownClass, definition, raw);
        }
        return new Reference(Long.toString(target.longValue()), existing);
    }

    private PropertyDecodingException mismatch(KnownClass knownClass, PropertyDefinition definition, JsonNode raw) {
        return new PropertyDecodingException(String.format(
                "Property %s.%s expects a %s value, got %s",
                knownClass.className(), definition.name(), definition.type().wireTag(), raw));
    }
}
