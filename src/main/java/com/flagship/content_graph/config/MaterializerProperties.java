package com.flagship.content_graph.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Materializer settings bound from the {@code materializer} prefix.
 *
 * {@code classes} maps ledger class ids to class names. Class ids missing
 * from the map are unregistered; names outside the known-class enumeration
 * are registered but unknown.
 */
@ConfigurationProperties(prefix = "materializer")
@Getter
@Setter
public class MaterializerProperties {

    private Map<Integer, String> classes = new HashMap<>();
}
