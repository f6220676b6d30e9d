package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A license: exactly one of the two reference columns is expected to be set.
 */
@Entity
@Table(name = "licenses")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class LicenseEntity extends TypedEntity {

    @Column(name = "known_license_id")
    private String knownLicenseId;

    @Column(name = "user_defined_license_id")
    private String userDefinedLicenseId;
}
