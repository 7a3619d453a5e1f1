package com.specgen.dto.request;

import com.specgen.model.OutputFormat;

import java.nio.file.Path;

/**
 * A record that carries the options of one {@code generate} command invocation.
 *
 * @param source The directory to scan for annotated sources.
 * @param output The file to write, or {@code null} to print the document.
 * @param format The output encoding.
 * @param pretty Whether JSON output is indented.
 */
public record GenerateRequest(Path source, Path output, OutputFormat format, boolean pretty) {
}
