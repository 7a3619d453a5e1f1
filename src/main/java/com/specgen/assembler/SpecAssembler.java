package com.specgen.assembler;

import com.specgen.model.LinkRecord;
import com.specgen.model.OperationRecord;
import com.specgen.model.SchemaRecord;
import com.specgen.model.SpecState;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponses;
import io.swagger.v3.oas.models.security.SecurityScheme;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a finished {@link SpecState} into an {@link OpenAPI} document.
 * <p>
 * Operations are grouped into path items by path; a later operation with the same path and method replaces
 * the earlier one. Explicit schemas take precedence over model-inferred ones of the same name. The state is
 * only read, so assembling twice gives equal documents.
 */
@Component
@Slf4j
public class SpecAssembler {

    static final String LINKS_HEADING = "\n\nSome useful links:\n";

    public OpenAPI assemble(SpecState state) {
        OpenAPI document = new OpenAPI();
        document.setOpenapi(state.getOpenApiVersion());
        document.setInfo(buildInfo(state));
        if (!state.getServers().isEmpty()) {
            document.setServers(new ArrayList<>(state.getServers()));
        }
        if (!state.getTags().isEmpty()) {
            document.setTags(new ArrayList<>(state.getTags()));
        }
        document.setExternalDocs(state.getExternalDocs());
        document.setPaths(buildPaths(state));
        document.setComponents(buildComponents(state));
        log.info("Assembled document with {} paths, {} schemas and {} security schemes.",
                document.getPaths().size(),
                document.getComponents() == null || document.getComponents().getSchemas() == null ? 0 : document.getComponents().getSchemas().size(),
                state.getSecuritySchemes().size());
        return document;
    }

    /**
     * Copies the info block, appending the collected links to the description.
     */
    private Info buildInfo(SpecState state) {
        Info source = state.getInfo();
        Info info = new Info()
                .title(source.getTitle())
                .version(source.getVersion())
                .description(source.getDescription())
                .termsOfService(source.getTermsOfService())
                .contact(source.getContact())
                .license(source.getLicense());
        if (!state.getLinks().isEmpty()) {
            StringBuilder description = new StringBuilder(source.getDescription() == null ? "" : source.getDescription());
            description.append(LINKS_HEADING);
            for (LinkRecord link : state.getLinks()) {
                description.append("- [").append(link.label()).append("](").append(link.url()).append(")\n");
            }
            info.setDescription(description.toString());
        }
        return info;
    }

    private Paths buildPaths(SpecState state) {
        Paths paths = new Paths();
        for (OperationRecord record : state.getOperations()) {
            PathItem item = paths.computeIfAbsent(record.getPath(), path -> new PathItem());
            PathItem.HttpMethod method;
            try {
                method = PathItem.HttpMethod.valueOf(record.getMethod());
            } catch (IllegalArgumentException e) {
                log.debug("Skipping operation {} {}: unsupported method.", record.getMethod(), record.getPath());
                continue;
            }
            item.operation(method, buildOperation(record));
        }
        return paths;
    }

    private Operation buildOperation(OperationRecord record) {
        Operation operation = new Operation()
                .operationId(record.getOperationId())
                .summary(record.getSummary())
                .description(record.getDescription());
        if (!record.getTags().isEmpty()) {
            operation.setTags(new ArrayList<>(record.getTags()));
        }
        if (record.isDeprecated()) {
            operation.setDeprecated(true);
        }
        if (!record.getParameters().isEmpty()) {
            operation.setParameters(new ArrayList<>(record.getParameters()));
        }
        operation.setRequestBody(record.getRequestBody());
        ApiResponses responses = new ApiResponses();
        record.getResponses().forEach(responses::addApiResponse);
        operation.setResponses(responses);
        if (!record.getSecurity().isEmpty()) {
            operation.setSecurity(new ArrayList<>(record.getSecurity()));
        }
        return operation;
    }

    /**
     * @return The components block, or {@code null} when there are neither schemas nor security schemes.
     */
    private Components buildComponents(SpecState state) {
        Map<String, Schema> schemas = new LinkedHashMap<>();
        for (SchemaRecord record : state.getExplicitSchemas().values()) {
            schemas.putIfAbsent(record.getName(), record.getSchema());
        }
        for (SchemaRecord record : state.getGlobalSchemas().values()) {
            schemas.putIfAbsent(record.getName(), record.getSchema());
        }
        Map<String, SecurityScheme> securitySchemes = new LinkedHashMap<>(state.getSecuritySchemes());
        if (schemas.isEmpty() && securitySchemes.isEmpty()) {
            return null;
        }
        Components components = new Components();
        if (!schemas.isEmpty()) {
            components.setSchemas(schemas);
        }
        if (!securitySchemes.isEmpty()) {
            components.setSecuritySchemes(securitySchemes);
        }
        return components;
    }
}
