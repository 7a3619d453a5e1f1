package com.specgen.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specgen.exception.SpecGenException;
import com.specgen.model.OutputFormat;
import com.specgen.service.api.SpecWriter;
import io.swagger.v3.oas.models.OpenAPI;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SpecWriterImpl implements SpecWriter {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public SpecWriterImpl(@Qualifier("jsonMapper") ObjectMapper jsonMapper, @Qualifier("yamlMapper") ObjectMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    @Override
    public String render(OpenAPI document, OutputFormat format, boolean pretty) {
        try {
            if (format == OutputFormat.JSON) {
                return pretty
                        ? jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                        : jsonMapper.writeValueAsString(document);
            }
            return yamlMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new SpecGenException("Failed to encode the document as " + format, e);
        }
    }

    @Override
    public void write(OpenAPI document, Path target, OutputFormat format, boolean pretty) {
        String content = render(document, format, pretty);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SpecGenException("Failed to write the document to " + target, e);
        }
        log.info("Wrote {} document to {}", format, target);
    }
}
