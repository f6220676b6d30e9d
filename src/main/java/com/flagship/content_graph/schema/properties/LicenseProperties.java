package com.flagship.content_graph.schema.properties;

import com.flagship.content_graph.schema.KnownClass;
import com.flagship.content_graph.schema.PropertyBag;
import com.flagship.content_graph.schema.Reference;

import java.util.List;

public record LicenseProperties(Reference knownLicense, Reference userDefinedLicense) implements EntityProperties {

    public static LicenseProperties from(PropertyBag bag) {
        return new LicenseProperties(bag.reference("knownLicense"), bag.reference("userDefinedLicense"));
    }

    @Override
    public KnownClass knownClass() {
        return KnownClass.LICENSE;
    }

    @Override
    public List<ReferenceProperty> references() {
        return ReferenceProperty.present(
                ReferenceProperty.of("knownLicense", KnownClass.KNOWN_LICENSE, knownLicense),
                ReferenceProperty.of("userDefinedLicense", KnownClass.USER_DEFINED_LICENSE, userDefinedLicense));
    }
}
