package com.specgen.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.specgen.annotation.AnnotationParser;
import com.specgen.assembler.SpecAssembler;
import com.specgen.exception.SpecGenException;
import com.specgen.model.SpecState;
import com.specgen.schema.TypeResolver;
import com.specgen.walker.DeclarationWalker;
import com.specgen.walker.JacksonTagReader;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.media.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentationServiceImplTest {

    @TempDir
    Path root;

    private DocumentationServiceImpl service;

    @BeforeEach
    void setUp() throws IOException {
        DeclarationWalker walker = new DeclarationWalker(new AnnotationParser(), new TypeResolver(), new JacksonTagReader());
        service = new DocumentationServiceImpl(new JavaSourceScannerImpl(), walker, new SpecAssembler());

        write("src/main/java/demo/Api.java", """
                package demo;

                // !api 3.0.3
                // !info "T" 1.0.0
                public class Api {

                    /**
                     * !GET /items
                     * !ok []Item
                     */
                    public void list() {
                    }
                }
                """);
        write("src/main/java/demo/Item.java", """
                package demo;

                /**
                 * !model
                 */
                public class Item {
                    private long id;
                    private String name;
                }
                """);
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void generate_buildsDocumentFromAnnotatedTree() {
        OpenAPI document = service.generate(root);

        assertThat(document.getOpenapi()).isEqualTo("3.0.3");
        assertThat(document.getInfo().getTitle()).isEqualTo("T");
        assertThat(document.getInfo().getVersion()).isEqualTo("1.0.0");

        Schema<?> listed = document.getPaths().get("/items").getGet().getResponses().get("200")
                .getContent().get("application/json").getSchema();
        assertThat(listed.getType()).isEqualTo("array");
        assertThat(listed.getItems().get$ref()).isEqualTo("#/components/schemas/Item");

        Schema<?> item = document.getComponents().getSchemas().get("Item");
        assertThat(item.getType()).isEqualTo("object");
        assertThat(item.getProperties()).containsOnlyKeys("id", "name");
        assertThat(item.getProperties().get("id").getType()).isEqualTo("integer");
        assertThat(item.getProperties().get("id").getFormat()).isEqualTo("int64");
        assertThat(item.getProperties().get("name").getType()).isEqualTo("string");
        assertThat(item.getRequired()).containsExactly("id", "name");
    }

    @Test
    void generate_isIdempotent() throws JsonProcessingException {
        String first = Json.mapper().writeValueAsString(service.generate(root));
        String second = Json.mapper().writeValueAsString(service.generate(root));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void generate_laterFileWinsForTheSameRoute() throws IOException {
        write("src/main/java/demo/A.java", """
                package demo;
                class A {
                    /** !GET /items -> fromA */
                    void items() {
                    }
                }
                """);
        write("src/main/java/demo/B.java", """
                package demo;
                class B {
                    /** !GET /items -> fromB */
                    void items() {
                    }
                }
                """);

        OpenAPI document = service.generate(root);

        // A.java, Api.java, B.java, Item.java
        assertThat(document.getPaths().get("/items").getGet().getOperationId()).isEqualTo("fromB");
    }

    @Test
    void collect_usesConfiguredDefaultVersionWithoutApiLine() throws IOException {
        Path other = Files.createDirectories(root.resolve("other"));
        Files.writeString(other.resolve("Only.java"), "// !info \"Only\"\nclass Only {}\n");
        ReflectionTestUtils.setField(service, "defaultVersion", "3.1.0");

        SpecState state = service.collect(other);

        assertThat(state.getOpenApiVersion()).isEqualTo("3.1.0");
        assertThat(state.getInfo().getTitle()).isEqualTo("Only");
    }

    @Test
    void collect_abortsOnUnparseableFileByDefault() throws IOException {
        write("src/main/java/demo/Broken.java", "package demo; class Broken {");

        assertThatThrownBy(() -> service.collect(root))
                .isInstanceOf(SpecGenException.class)
                .hasMessageContaining("Broken.java");
    }

    @Test
    void collect_skipsUnparseableFileWhenConfigured() throws IOException {
        write("src/main/java/demo/Broken.java", "package demo; class Broken {");
        ReflectionTestUtils.setField(service, "failOnError", false);

        SpecState state = service.collect(root);

        assertThat(state.getOperations()).hasSize(1);
        assertThat(state.getGlobalSchemas()).containsOnlyKeys("Item");
    }

    @Test
    void collect_failsForMissingDirectory() {
        assertThatThrownBy(() -> service.collect(root.resolve("missing")))
                .isInstanceOf(SpecGenException.class)
                .hasMessageStartingWith("Source directory not found");
    }
}
