package com.specgen.service.impl;

import com.specgen.model.OutputFormat;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.core.util.Yaml;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SpecWriterImplTest {

    @TempDir
    Path tempDir;

    private SpecWriterImpl writer;
    private OpenAPI document;

    @BeforeEach
    void setUp() {
        writer = new SpecWriterImpl(Json.mapper(), Yaml.mapper());
        document = new OpenAPI()
                .openapi("3.0.3")
                .info(new Info().title("Test API").version("1.0.0"))
                .paths(new Paths().addPathItem("/users", new PathItem().get(new Operation()
                        .operationId("listUsers")
                        .responses(new ApiResponses().addApiResponse("200", new ApiResponse().description("OK"))))));
    }

    @Test
    void render_yamlIsAValidDocument() {
        String yaml = writer.render(document, OutputFormat.YAML, false);

        SwaggerParseResult result = new OpenAPIV3Parser().readContents(yaml, null, new ParseOptions());

        assertThat(result.getMessages()).isNullOrEmpty();
        assertThat(result.getOpenAPI().getInfo().getTitle()).isEqualTo("Test API");
        assertThat(result.getOpenAPI().getPaths().get("/users").getGet().getOperationId()).isEqualTo("listUsers");
    }

    @Test
    void render_jsonIsCompactUnlessPretty() {
        String compact = writer.render(document, OutputFormat.JSON, false);
        String pretty = writer.render(document, OutputFormat.JSON, true);

        assertThat(compact).contains("\"openapi\":\"3.0.3\"").doesNotContain("\n");
        assertThat(pretty).contains("\"openapi\" : \"3.0.3\"").contains("\n");
        assertThat(new OpenAPIV3Parser().readContents(pretty, null, new ParseOptions()).getOpenAPI().getInfo().getVersion())
                .isEqualTo("1.0.0");
    }

    @Test
    void write_createsParentDirectories() throws IOException {
        Path target = tempDir.resolve("docs/api/openapi.json");

        writer.write(document, target, OutputFormat.JSON, true);

        assertThat(Files.readString(target)).isEqualTo(writer.render(document, OutputFormat.JSON, true));
    }
}
