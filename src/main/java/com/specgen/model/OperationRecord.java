package com.specgen.model;

import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * One route discovered on a method declaration, folded from the method's annotations.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class OperationRecord {

    /**
     * The upper-case HTTP method, e.g. "GET".
     */
    private String method;

    /**
     * The path template, which may include path parameters (e.g. "/users/{id}").
     */
    private String path;

    private String operationId;

    private String summary;

    private String description;

    private List<String> tags = new ArrayList<>();

    private boolean deprecated;

    private List<Parameter> parameters = new ArrayList<>();

    private RequestBody requestBody;

    /**
     * Responses keyed by status code ("200", "4XX", "default").
     */
    private Map<String, ApiResponse> responses = new LinkedHashMap<>();

    private List<SecurityRequirement> security = new ArrayList<>();

    /**
     * @return {@code true} when both the method and the path were set by a route annotation.
     */
    public boolean hasRoute() {
        return method != null && !method.isBlank() && path != null && !path.isBlank();
    }
}
