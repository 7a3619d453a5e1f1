package com.specgen.model;

import io.swagger.v3.oas.models.media.Schema;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named data shape: either declared by a {@code !schema} line or inferred from a {@code !model} class.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchemaRecord {

    private String name;

    private String description;

    private Schema<Object> schema;

    /**
     * Example values keyed by property name.
     */
    private Map<String, Object> examples = new LinkedHashMap<>();
}
