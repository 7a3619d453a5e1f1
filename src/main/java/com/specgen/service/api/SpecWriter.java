package com.specgen.service.api;

import com.specgen.model.OutputFormat;
import io.swagger.v3.oas.models.OpenAPI;

import java.nio.file.Path;

public interface SpecWriter {
    /**
     * Encodes a document as text.
     * @param document The document to encode.
     * @param format   YAML or JSON.
     * @param pretty   Whether JSON output is indented. YAML is always written in block style.
     * @return The encoded document.
     */
    String render(OpenAPI document, OutputFormat format, boolean pretty);

    /**
     * Encodes a document and writes it to a file, creating parent directories as needed.
     */
    void write(OpenAPI document, Path target, OutputFormat format, boolean pretty);
}
