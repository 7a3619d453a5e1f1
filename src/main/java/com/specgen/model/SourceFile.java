package com.specgen.model;

import com.github.javaparser.ast.CompilationUnit;
import java.nio.file.Path;
import java.util.List;

/**
 * A parsed Java source file handed from the scanner to the walker.
 *
 * @param path  The file location, used in log messages.
 * @param unit  The JavaParser compilation unit, parsed with comments attributed.
 * @param lines The raw source lines, used to tell stand-alone comments from trailing ones.
 */
public record SourceFile(Path path, CompilationUnit unit, List<String> lines) {
}
