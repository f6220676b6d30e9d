package com.flagship.content_graph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContentGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentGraphApplication.class, args);
    }
}
