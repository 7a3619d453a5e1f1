package com.specgen.service.api;

import com.specgen.model.SourceFile;

import java.nio.file.Path;
import java.util.List;

public interface SourceScanner {
    /**
     * Finds the Java source files under a directory, honoring the configured exclusions.
     * @param root The directory to scan.
     * @return The files in sorted path order.
     * @throws com.specgen.exception.SpecGenException if the directory is missing or cannot be read.
     */
    List<Path> findSourceFiles(Path root);

    /**
     * Reads and parses one source file with its comments.
     * @param file The file to parse.
     * @return The parsed file.
     * @throws com.specgen.exception.SpecGenException if the file cannot be read or is not valid Java.
     */
    SourceFile parse(Path file);
}
