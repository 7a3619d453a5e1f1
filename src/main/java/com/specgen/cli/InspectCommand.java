package com.specgen.cli;

import com.specgen.dto.response.CommandResponse;
import com.specgen.service.api.DocumentationService;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.security.OAuthFlow;
import io.swagger.v3.oas.models.security.OAuthFlows;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.Map;

/**
 * A Spring Shell component for inspecting what the annotations of a source tree describe, without writing
 * a document.
 */
@ShellComponent
public class InspectCommand {

    // ANSI escape codes for coloring the output
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private final DocumentationService documentationService;

    public InspectCommand(DocumentationService documentationService) {
        this.documentationService = documentationService;
    }

    /**
     * Lists the operations discovered under a source directory.
     *
     * @param source The directory to scan.
     */
    @ShellMethod(key = "routes", value = "List the operations declared by annotations in a source tree.")
    public void routes(@ShellOption(value = {"--source", "-s"}, help = "The directory to scan.", defaultValue = ".") String source) {
        OpenAPI document;
        try {
            document = documentationService.generate(Path.of(source));
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "Failed to scan '" + source + "': " + e.getMessage()).toAnsiString());
            return;
        }
        if (document.getPaths() == null || document.getPaths().isEmpty()) {
            System.out.println(ANSI_YELLOW + "No operations found under '" + source + "'." + ANSI_RESET);
            return;
        }
        System.out.println(ANSI_CYAN + "Operations declared under: " + ANSI_YELLOW + source + ANSI_RESET);
        document.getPaths().forEach((path, item) ->
                item.readOperationsMap().forEach((method, operation) -> printOperation(path, method, operation)));
    }

    private void printOperation(String path, PathItem.HttpMethod method, Operation op) {
        System.out.println("-".repeat(50));
        System.out.println("  " + ANSI_PURPLE + method + ANSI_RESET + " " + path
                + (Boolean.TRUE.equals(op.getDeprecated()) ? ANSI_YELLOW + " (deprecated)" + ANSI_RESET : ""));
        if (op.getOperationId() != null) {
            System.out.println(ANSI_GREEN + "  Operation ID: " + ANSI_YELLOW + op.getOperationId() + ANSI_RESET);
        }
        if (op.getSummary() != null) {
            System.out.println("  Summary: " + op.getSummary());
        }
        if (op.getParameters() != null && !op.getParameters().isEmpty()) {
            System.out.println(ANSI_CYAN + "  Parameters:" + ANSI_RESET);
            for (Parameter p : op.getParameters()) {
                System.out.println("    - " + p.getName() + " (in: " + p.getIn() + ", required: " + Boolean.TRUE.equals(p.getRequired()) + ")");
            }
        }
        if (op.getResponses() != null && !op.getResponses().isEmpty()) {
            System.out.println(ANSI_CYAN + "  Responses: " + ANSI_RESET + String.join(", ", op.getResponses().keySet()));
        }
    }

    /**
     * Displays the security schemes declared under a source directory.
     *
     * @param source The directory to scan.
     */
    @ShellMethod(key = "auth-info", value = "Show the security schemes declared by annotations in a source tree.")
    public void authInfo(@ShellOption(value = {"--source", "-s"}, help = "The directory to scan.", defaultValue = ".") String source) {
        OpenAPI document;
        try {
            document = documentationService.generate(Path.of(source));
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "Failed to scan '" + source + "': " + e.getMessage()).toAnsiString());
            return;
        }

        Map<String, SecurityScheme> securitySchemes = document.getComponents() == null ? null : document.getComponents().getSecuritySchemes();
        if (securitySchemes == null || securitySchemes.isEmpty()) {
            System.out.println(ANSI_YELLOW + "No security schemes declared under '" + source + "'." + ANSI_RESET);
            return;
        }

        System.out.println(ANSI_CYAN + "Security schemes declared under: " + ANSI_YELLOW + source + ANSI_RESET);
        securitySchemes.forEach((name, scheme) -> {
            System.out.println("-".repeat(50));
            System.out.println(ANSI_GREEN + "Scheme Name: " + ANSI_YELLOW + name + ANSI_RESET);
            System.out.println("  Type: " + scheme.getType());
            switch (scheme.getType()) {
                case APIKEY:
                    System.out.println("  Location: " + scheme.getIn());
                    System.out.println("  Header/Parameter Name: " + scheme.getName());
                    break;
                case HTTP:
                    System.out.println("  Scheme: " + scheme.getScheme());
                    if (scheme.getBearerFormat() != null) {
                        System.out.println("  Bearer Format: " + scheme.getBearerFormat());
                    }
                    break;
                case OAUTH2:
                    printFlows(scheme.getFlows());
                    break;
                case OPENIDCONNECT:
                    System.out.println("  Discovery URL: " + scheme.getOpenIdConnectUrl());
                    break;
                default:
                    System.out.println("  (Details for this authentication type are not displayed.)");
            }
        });
    }

    private void printFlows(OAuthFlows flows) {
        if (flows == null) {
            return;
        }
        printFlow("implicit", flows.getImplicit());
        printFlow("password", flows.getPassword());
        printFlow("clientCredentials", flows.getClientCredentials());
        printFlow("authorizationCode", flows.getAuthorizationCode());
    }

    private void printFlow(String name, OAuthFlow flow) {
        if (flow == null) {
            return;
        }
        System.out.println("  Flow: " + name);
        if (flow.getAuthorizationUrl() != null) {
            System.out.println("    Authorization URL: " + flow.getAuthorizationUrl());
        }
        if (flow.getTokenUrl() != null) {
            System.out.println("    Token URL: " + flow.getTokenUrl());
        }
        if (flow.getScopes() != null && !flow.getScopes().isEmpty()) {
            System.out.println("    Scopes:");
            flow.getScopes().forEach((scope, description) -> System.out.println("      - " + scope + ": " + description));
        }
    }
}
