package com.flagship.content_graph.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "user_defined_licenses")
@Getter
@Setter
@ToString(callSuper = true)
@NoArgsConstructor
public class UserDefinedLicenseEntity extends TypedEntity {

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;
}
