package com.specgen.walker;

import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.specgen.model.SourceFile;
import com.specgen.service.impl.JavaSourceScannerImpl;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CommentBlocksTest {

    private static final String SOURCE = """
            package demo;

            // !api 3.1.0
            // !info "Demo" 1.0

            // class note
            class Demo {

                /**
                 * Loads everything.
                 * !GET /all
                 */
                void all() {}

                int id; // the id
                // name of the thing
                // !field name "Name"
                String name;

                /* block */ int count;
            }
            """;

    private static SourceFile parse(String source) {
        return new JavaSourceScannerImpl().parseContent(Path.of("Demo.java"), source);
    }

    private static FieldDeclaration field(SourceFile file, String name) {
        return file.unit().findFirst(FieldDeclaration.class,
                f -> f.getVariable(0).getNameAsString().equals(name)).orElseThrow();
    }

    @Test
    void all_mergesAdjacentLineCommentsOnly() {
        CommentBlocks blocks = CommentBlocks.of(parse(SOURCE).unit(), parse(SOURCE).lines());

        assertThat(blocks.all()).extracting(CommentBlock::text).containsExactly(
                "!api 3.1.0\n!info \"Demo\" 1.0",
                "class note",
                "Loads everything.\n!GET /all",
                "the id",
                "name of the thing\n!field name \"Name\"",
                "block");
    }

    @Test
    void all_marksTrailingCommentsAsNotStandalone() {
        SourceFile file = parse(SOURCE);
        CommentBlocks blocks = CommentBlocks.of(file.unit(), file.lines());

        CommentBlock trailing = blocks.all().get(3);
        assertThat(trailing.standalone()).isFalse();
        assertThat(blocks.all().get(4).standalone()).isTrue();
    }

    @Test
    void docFor_findsJavadocAndLineCommentRuns() {
        SourceFile file = parse(SOURCE);
        CommentBlocks blocks = CommentBlocks.of(file.unit(), file.lines());
        MethodDeclaration all = file.unit().findFirst(MethodDeclaration.class).orElseThrow();

        assertThat(blocks.docFor(all)).map(CommentBlock::text).contains("Loads everything.\n!GET /all");
        assertThat(blocks.docFor(field(file, "name"))).map(CommentBlock::text)
                .contains("name of the thing\n!field name \"Name\"");
        assertThat(blocks.docFor(field(file, "id"))).isEmpty();
    }

    @Test
    void docFor_takesOnlyTheRunDirectlyAboveTheDeclaration() {
        SourceFile file = parse(SOURCE);
        CommentBlocks blocks = CommentBlocks.of(file.unit(), file.lines());
        var demo = file.unit().getClassByName("Demo").orElseThrow();

        Optional<CommentBlock> doc = blocks.docFor(demo);

        assertThat(doc).map(CommentBlock::text).contains("class note");
    }

    @Test
    void docFor_doesNotHandTheEnclosingDocToMembersOnTheSameLine() {
        SourceFile file = parse("""
                /**
                 * A pair.
                 */
                record Pair(int left, int right) {} // trailing
                """);
        CommentBlocks blocks = CommentBlocks.of(file.unit(), file.lines());
        var left = file.unit().findFirst(Parameter.class).orElseThrow();

        assertThat(blocks.docFor(left)).isEmpty();
        assertThat(blocks.trailingFor(left)).isEmpty();
        assertThat(blocks.docFor(file.unit().getRecordByName("Pair").orElseThrow()))
                .map(CommentBlock::text).contains("A pair.");
    }

    @Test
    void trailingFor_findsCommentAfterTheDeclaration() {
        SourceFile file = parse(SOURCE);
        CommentBlocks blocks = CommentBlocks.of(file.unit(), file.lines());

        assertThat(blocks.trailingFor(field(file, "id"))).map(CommentBlock::text).contains("the id");
        assertThat(blocks.trailingFor(field(file, "name"))).isEmpty();
        assertThat(blocks.trailingFor(field(file, "count"))).isEmpty();
    }

    @Test
    void prose_dropsAnnotationLinesAndJavadocTags() {
        assertThat(CommentBlocks.prose("Lists users.\n!GET /users\nPaged.\n@param page the page\n@return users"))
                .isEqualTo("Lists users.\nPaged.");
        assertThat(CommentBlocks.prose("!model \"x\"\n!field a")).isNull();
        assertThat(CommentBlocks.prose(null)).isNull();
    }

    @Test
    void hasAnnotations_detectsAnnotationShapedLines() {
        assertThat(CommentBlocks.hasAnnotations("text\n  !GET /x")).isTrue();
        assertThat(CommentBlocks.hasAnnotations("Wow! Great.\n! not one")).isFalse();
        assertThat(CommentBlocks.hasAnnotations(null)).isFalse();
    }
}
