package com.specgen.cli;

import com.specgen.dto.request.GenerateRequest;
import com.specgen.dto.response.CommandResponse;
import com.specgen.model.OutputFormat;
import com.specgen.service.api.DocumentationService;
import com.specgen.service.api.SpecWriter;
import io.swagger.v3.oas.models.OpenAPI;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;

/**
 * A Spring Shell component that generates an OpenAPI document from annotated Java sources.
 */
@ShellComponent
public class GenerateCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private static final String APP_LOGGER = "com.specgen";

    private final DocumentationService documentationService;
    private final SpecWriter specWriter;

    /**
     * Constructs a new GenerateCommand.
     *
     * @param documentationService The service that scans sources and assembles the document.
     * @param specWriter           The service that encodes and writes the document.
     */
    public GenerateCommand(DocumentationService documentationService, SpecWriter specWriter) {
        this.documentationService = documentationService;
        this.specWriter = specWriter;
    }

    /**
     * Scans a source tree and writes the resulting document.
     * <p>
     * When no output file is given the encoded document itself is returned, so it is printed by the shell.
     * A tree without an {@code !info} title is reported as a failure, since the result would not be a usable
     * document.
     *
     * @param source  The directory to scan.
     * @param format  "yaml" or "json"; when absent, derived from the output file extension.
     * @param output  The file to write.
     * @param pretty  Indent JSON output.
     * @param verbose Enable debug logging for the duration of the command.
     * @return The encoded document, or an ANSI-colored status message.
     */
    @ShellMethod(key = "generate", value = "Generates an OpenAPI document from !-annotations in Java sources.")
    public String generate(
            @ShellOption(value = {"--source", "-s"}, help = "The directory to scan.", defaultValue = ".") String source,
            @ShellOption(value = {"--format", "-f"}, help = "The output format: yaml or json.", defaultValue = ShellOption.NULL) String format,
            @ShellOption(value = {"--output", "-o"}, help = "The file to write. Prints the document when omitted.", defaultValue = ShellOption.NULL) String output,
            @ShellOption(value = "--pretty", help = "Indent JSON output.", defaultValue = "false", arity = 0) boolean pretty,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        ch.qos.logback.classic.Logger appLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(APP_LOGGER);
        ch.qos.logback.classic.Level originalLevel = appLogger.getLevel();
        if (verbose) {
            appLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            System.out.println(ANSI_PURPLE + "-- Verbose mode enabled --" + ANSI_RESET);
        }
        CommandResponse response;
        try {
            Path outputPath = output == null ? null : Path.of(output);
            OutputFormat outputFormat = format != null ? OutputFormat.fromName(format) : OutputFormat.detect(outputPath);
            var request = new GenerateRequest(Path.of(source), outputPath, outputFormat, pretty);

            OpenAPI document = documentationService.generate(request.source());
            if (document.getInfo() == null || document.getInfo().getTitle() == null || document.getInfo().getTitle().isBlank()) {
                response = new CommandResponse(false, "No annotations found in '" + request.source()
                        + "'. Add an !info line to a comment to describe the API.");
            } else if (request.output() == null) {
                return specWriter.render(document, request.format(), request.pretty());
            } else {
                specWriter.write(document, request.output(), request.format(), request.pretty());
                int schemas = document.getComponents() == null || document.getComponents().getSchemas() == null
                        ? 0 : document.getComponents().getSchemas().size();
                response = new CommandResponse(true, "Successfully wrote '" + request.output() + "' ("
                        + document.getPaths().size() + " paths, " + schemas + " schemas).");
            }
        } catch (Exception e) {
            response = new CommandResponse(false, "Failed to generate documentation: " + e.getMessage());
        } finally {
            if (verbose) {
                appLogger.setLevel(originalLevel);
                System.out.println(ANSI_PURPLE + "-- Verbose mode disabled --" + ANSI_RESET);
            }
        }
        return response.toAnsiString();
    }
}
