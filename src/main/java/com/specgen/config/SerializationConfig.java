package com.specgen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.core.util.Yaml;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * A Spring configuration class that exposes the document encoders as beans.
 * <p>
 * Both mappers come from swagger-core, which registers the serializers needed to write
 * {@link io.swagger.v3.oas.models.OpenAPI} documents the way the OpenAPI format expects (no nulls, {@code $ref}
 * nodes without siblings, enum values in lower case).
 */
@Configuration
public class SerializationConfig {

    /**
     * @return The shared JSON mapper. It is the primary {@link ObjectMapper} of the application context.
     */
    @Bean
    @Primary
    public ObjectMapper jsonMapper() {
        return Json.mapper();
    }

    @Bean
    public ObjectMapper yamlMapper() {
        return Yaml.mapper();
    }
}
