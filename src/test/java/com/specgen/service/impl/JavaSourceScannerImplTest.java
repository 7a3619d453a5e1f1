package com.specgen.service.impl;

import com.specgen.exception.SpecGenException;
import com.specgen.model.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaSourceScannerImplTest {

    @TempDir
    Path root;

    private JavaSourceScannerImpl scanner;

    @BeforeEach
    void setUp() throws IOException {
        scanner = new JavaSourceScannerImpl();
        write("src/main/java/demo/B.java", "package demo; class B {}");
        write("src/main/java/demo/A.java", "package demo; class A {}");
        write("src/main/java/demo/ATest.java", "package demo; class ATest {}");
        write("src/main/resources/notes.txt", "not java");
        write("src/test/java/demo/Fixture.java", "package demo; class Fixture {}");
        write("target/generated/Gen.java", "class Gen {}");
        write("node_modules/pkg/Lib.java", "class Lib {}");
        write(".git/hooks/Hook.java", "class Hook {}");
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private List<String> relative(List<Path> files) {
        return files.stream().map(f -> root.relativize(f).toString().replace('\\', '/')).collect(Collectors.toList());
    }

    @Test
    void findSourceFiles_returnsSortedJavaFilesOutsideExcludedTrees() {
        List<Path> files = scanner.findSourceFiles(root);

        assertThat(relative(files)).containsExactly("src/main/java/demo/A.java", "src/main/java/demo/B.java");
    }

    @Test
    void findSourceFiles_includesTestSourcesWhenEnabled() {
        ReflectionTestUtils.setField(scanner, "includeTests", true);

        List<Path> files = scanner.findSourceFiles(root);

        assertThat(relative(files)).containsExactly(
                "src/main/java/demo/A.java",
                "src/main/java/demo/ATest.java",
                "src/main/java/demo/B.java",
                "src/test/java/demo/Fixture.java");
    }

    @Test
    void findSourceFiles_honorsConfiguredExclusions() {
        ReflectionTestUtils.setField(scanner, "excludeDirs", new String[]{"main"});

        List<Path> files = scanner.findSourceFiles(root);

        assertThat(relative(files)).containsExactly("node_modules/pkg/Lib.java", "target/generated/Gen.java");
    }

    @Test
    void findSourceFiles_failsForMissingDirectory() {
        Path missing = root.resolve("nope");

        assertThatThrownBy(() -> scanner.findSourceFiles(missing))
                .isInstanceOf(SpecGenException.class)
                .hasMessage("Source directory not found: " + missing);
    }

    @Test
    void parse_readsAndParsesFile() {
        SourceFile file = scanner.parse(root.resolve("src/main/java/demo/A.java"));

        assertThat(file.unit().getClassByName("A")).isPresent();
        assertThat(file.lines()).containsExactly("package demo; class A {}");
    }

    @Test
    void parse_acceptsRecords() {
        SourceFile file = scanner.parseContent(Path.of("P.java"), "record P(int x, int y) {}\n");

        assertThat(file.unit().getRecordByName("P")).isPresent();
    }

    @Test
    void parse_reportsSyntaxErrorsWithTheFileName() throws IOException {
        write("src/main/java/demo/Broken.java", "package demo; class Broken {");
        Path broken = root.resolve("src/main/java/demo/Broken.java");

        assertThatThrownBy(() -> scanner.parse(broken))
                .isInstanceOf(SpecGenException.class)
                .hasMessageStartingWith("Failed to parse " + broken + ":");
    }
}
