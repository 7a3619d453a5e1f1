package com.specgen.model;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * The mutable accumulator of one generation run.
 * <p>
 * One instance is created per run, threaded through every file visit by the
 * {@link com.specgen.walker.DeclarationWalker} and read once by the
 * {@link com.specgen.assembler.SpecAssembler}. All collections keep insertion order so that two runs over the
 * same tree assemble equal documents.
 * <p>
 * Lombok's {@code @Data} annotation generates the accessors.
 */
@Data
public class SpecState {

    public static final String DEFAULT_OPENAPI_VERSION = "3.0.3";

    /**
     * The OpenAPI version written to the document's {@code openapi} field.
     */
    private String openApiVersion;

    /**
     * Title, version, description, contact, license and terms of service. Each annotation overwrites the
     * values it names.
     */
    private Info info = new Info();

    private List<Server> servers = new ArrayList<>();

    private List<Tag> tags = new ArrayList<>();

    /**
     * Operations in discovery order. Only operations with both a method and a path are ever added.
     */
    private List<OperationRecord> operations = new ArrayList<>();

    /**
     * Schemas declared through {@code !schema} lines, keyed by name.
     */
    private Map<String, SchemaRecord> explicitSchemas = new LinkedHashMap<>();

    /**
     * Schemas inferred from {@code !model} declarations, keyed by the declared type name.
     */
    private Map<String, SchemaRecord> globalSchemas = new LinkedHashMap<>();

    private Map<String, SecurityScheme> securitySchemes = new LinkedHashMap<>();

    private ExternalDocumentation externalDocs;

    /**
     * Extra documentation links, rendered into the info description at assembly time.
     */
    private List<LinkRecord> links = new ArrayList<>();

    public SpecState() {
        this(DEFAULT_OPENAPI_VERSION);
    }

    public SpecState(String defaultVersion) {
        this.openApiVersion = defaultVersion == null || defaultVersion.isBlank() ? DEFAULT_OPENAPI_VERSION : defaultVersion;
    }

    /**
     * Adds an operation if it carries a route.
     *
     * @return {@code true} if the operation was added, {@code false} if it was discarded.
     */
    public boolean addOperation(OperationRecord operation) {
        if (operation == null || !operation.hasRoute()) {
            return false;
        }
        operations.add(operation);
        return true;
    }

    /**
     * Stores an explicit schema unless one with the same name is already known.
     *
     * @return {@code true} if the record was stored.
     */
    public boolean putExplicitSchema(SchemaRecord record) {
        return explicitSchemas.putIfAbsent(record.getName(), record) == null;
    }

    /**
     * Stores a model-inferred schema unless one with the same name is already known.
     *
     * @return {@code true} if the record was stored.
     */
    public boolean putGlobalSchema(SchemaRecord record) {
        return globalSchemas.putIfAbsent(record.getName(), record) == null;
    }
}
