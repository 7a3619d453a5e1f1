package com.specgen.service.impl;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.specgen.exception.SpecGenException;
import com.specgen.model.SourceFile;
import com.specgen.service.api.SourceScanner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class JavaSourceScannerImpl implements SourceScanner {

    @Value("${specgen.scan.exclude-dirs:target,build,out,node_modules}")
    private String[] excludeDirs = {"target", "build", "out", "node_modules"};

    @Value("${specgen.scan.include-tests:false}")
    private boolean includeTests;

    private final JavaParser javaParser =
            new JavaParser(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    /**
     * {@inheritDoc}
     * Hidden directories are always skipped. Unless test sources are included, {@code src/test} trees and
     * files named {@code *Test.java} or {@code *Tests.java} are skipped as well.
     */
    @Override
    public List<Path> findSourceFiles(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new SpecGenException("Source directory not found: " + root);
        }
        List<String> excluded = Arrays.stream(excludeDirs).map(String::trim).collect(Collectors.toList());
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String name = dir.getFileName().toString();
                    if (name.startsWith(".") || excluded.contains(name) || (!includeTests && isTestTree(dir))) {
                        log.debug("Skipping directory {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String name = file.getFileName().toString();
                    if (name.endsWith(".java") && (includeTests || !isTestFile(name))) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new SpecGenException("Failed to scan source directory " + root, e);
        }
        Collections.sort(files);
        log.info("Found {} Java source files under {}", files.size(), root);
        return files;
    }

    @Override
    public SourceFile parse(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SpecGenException("Failed to read source file " + file, e);
        }
        return parseContent(file, content);
    }

    /**
     * Parses source text that has already been read.
     *
     * @param file    The path reported in errors and log messages.
     * @param content The Java source.
     * @return The parsed file.
     */
    public SourceFile parseContent(Path file, String content) {
        ParseResult<CompilationUnit> result = javaParser.parse(content);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new SpecGenException("Failed to parse " + file + ": " + problems);
        }
        return new SourceFile(file, result.getResult().get(), content.lines().collect(Collectors.toList()));
    }

    private static boolean isTestTree(Path dir) {
        Path parent = dir.getParent();
        return dir.getFileName().toString().equals("test")
                && parent != null && parent.getFileName() != null
                && parent.getFileName().toString().equals("src");
    }

    private static boolean isTestFile(String name) {
        return name.endsWith("Test.java") || name.endsWith("Tests.java");
    }
}
