package com.specgen.cli;

import com.specgen.exception.SpecGenException;
import com.specgen.model.OutputFormat;
import com.specgen.service.api.DocumentationService;
import com.specgen.service.api.SpecWriter;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Schema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerateCommandTest {

    @Mock
    private DocumentationService documentationService;

    @Mock
    private SpecWriter specWriter;

    @InjectMocks
    private GenerateCommand generateCommand;

    private static OpenAPI document(String title) {
        return new OpenAPI()
                .info(new Info().title(title).version("1.0.0"))
                .paths(new Paths()
                        .addPathItem("/users", new PathItem())
                        .addPathItem("/users/{id}", new PathItem()))
                .components(new Components().addSchemas("User", new Schema<>()));
    }

    @Test
    void generate_printsDocumentWhenNoOutputIsGiven() {
        OpenAPI document = document("Test API");
        when(documentationService.generate(Path.of("src"))).thenReturn(document);
        when(specWriter.render(document, OutputFormat.YAML, false)).thenReturn("openapi: 3.0.3\n");

        String result = generateCommand.generate("src", null, null, false, false);

        assertThat(result).isEqualTo("openapi: 3.0.3\n");
        verify(specWriter, never()).write(any(), any(), any(), anyBoolean());
    }

    @Test
    void generate_writesFileInFormatDerivedFromExtension() {
        OpenAPI document = document("Test API");
        when(documentationService.generate(Path.of("."))).thenReturn(document);

        String result = generateCommand.generate(".", null, "out/openapi.json", true, false);

        verify(specWriter).write(document, Path.of("out/openapi.json"), OutputFormat.JSON, true);
        assertThat(result).contains("Successfully wrote 'out/openapi.json' (2 paths, 1 schemas).");
        assertThat(result).startsWith("\u001B[32m");
    }

    @Test
    void generate_explicitFormatOverridesExtension() {
        OpenAPI document = document("Test API");
        when(documentationService.generate(Path.of("."))).thenReturn(document);

        generateCommand.generate(".", "yml", "openapi.json", false, false);

        verify(specWriter).write(document, Path.of("openapi.json"), OutputFormat.YAML, false);
    }

    @Test
    void generate_reportsTreeWithoutInfoTitle() {
        when(documentationService.generate(Path.of("empty"))).thenReturn(document(null));

        String result = generateCommand.generate("empty", null, null, false, false);

        assertThat(result).contains("No annotations found in 'empty'");
        assertThat(result).startsWith("\u001B[31m");
    }

    @Test
    void generate_reportsUnsupportedFormat() {
        String result = generateCommand.generate(".", "xml", null, false, false);

        assertThat(result).contains("Failed to generate documentation: Unsupported output format 'xml'");
        verify(documentationService, never()).generate(any());
    }

    @Test
    void generate_reportsScanFailure() {
        when(documentationService.generate(Path.of("missing")))
                .thenThrow(new SpecGenException("Source directory not found: missing"));

        String result = generateCommand.generate("missing", null, null, false, true);

        assertThat(result).contains("Failed to generate documentation: Source directory not found: missing");
    }
}
