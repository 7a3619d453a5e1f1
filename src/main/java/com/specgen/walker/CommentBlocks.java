package com.specgen.walker;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.comments.LineComment;
import com.specgen.annotation.AnnotationParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The comment blocks of one compilation unit in source order, with lookups from declarations to their
 * doc comment and trailing comment.
 * <p>
 * JavaParser attaches only the last line of a {@code //} run to the following declaration, so the blocks are
 * rebuilt here from every comment of the unit and the raw source lines.
 */
public final class CommentBlocks {

    private final List<CommentBlock> blocks;
    private final Map<Comment, CommentBlock> blockByComment;

    private CommentBlocks(List<CommentBlock> blocks, Map<Comment, CommentBlock> blockByComment) {
        this.blocks = blocks;
        this.blockByComment = blockByComment;
    }

    /**
     * Collects and groups the comments of a compilation unit.
     *
     * @param unit  The parsed unit.
     * @param lines The raw source lines of the same file.
     */
    public static CommentBlocks of(CompilationUnit unit, List<String> lines) {
        Set<Comment> comments = Collections.newSetFromMap(new IdentityHashMap<>());
        comments.addAll(unit.getAllContainedComments());
        unit.getComment().ifPresent(comments::add);
        List<Comment> ordered = comments.stream()
                .filter(c -> c.getRange().isPresent())
                .sorted(Comparator.comparing((Comment c) -> c.getRange().get().begin))
                .collect(Collectors.toList());

        List<CommentBlock> blocks = new ArrayList<>();
        Map<Comment, CommentBlock> blockByComment = new IdentityHashMap<>();
        List<Comment> run = new ArrayList<>();
        for (Comment comment : ordered) {
            boolean standalone = isStandalone(comment, lines);
            if (comment instanceof LineComment && standalone && !run.isEmpty()
                    && line(run.get(run.size() - 1), true) + 1 == line(comment, false)) {
                run.add(comment);
                continue;
            }
            flush(run, lines, blocks, blockByComment);
            if (comment instanceof LineComment && standalone) {
                run.add(comment);
            } else {
                CommentBlock block = new CommentBlock(normalize(comment), line(comment, false), line(comment, true),
                        comment.getRange().get().begin.column, standalone);
                blocks.add(block);
                blockByComment.put(comment, block);
            }
        }
        flush(run, lines, blocks, blockByComment);
        return new CommentBlocks(List.copyOf(blocks), blockByComment);
    }

    private static void flush(List<Comment> run, List<String> lines, List<CommentBlock> blocks,
                              Map<Comment, CommentBlock> blockByComment) {
        if (run.isEmpty()) {
            return;
        }
        String text = run.stream().map(CommentBlocks::normalize).collect(Collectors.joining("\n"));
        Comment first = run.get(0);
        CommentBlock block = new CommentBlock(text, line(first, false), line(run.get(run.size() - 1), true),
                first.getRange().get().begin.column, true);
        blocks.add(block);
        run.forEach(c -> blockByComment.put(c, block));
        run.clear();
    }

    /**
     * @return All blocks in source order.
     */
    public List<CommentBlock> all() {
        return blocks;
    }

    /**
     * Finds the doc comment of a declaration: the comment JavaParser attached to it when that comment ends
     * above the declaration, else the stand-alone block ending on the line directly above it. A block that
     * does not lie inside the enclosing declaration belongs to that declaration, not to this node.
     */
    public Optional<CommentBlock> docFor(Node node) {
        Optional<Range> range = node.getRange();
        if (range.isEmpty()) {
            return Optional.empty();
        }
        int declarationLine = range.get().begin.line;
        Optional<Comment> attached = node.getComment();
        if (attached.isPresent() && attached.get().getRange().isPresent()
                && attached.get().getRange().get().end.line < declarationLine) {
            CommentBlock block = blockByComment.get(attached.get());
            if (block != null) {
                return Optional.of(block);
            }
        }
        return blocks.stream()
                .filter(b -> b.standalone() && b.endLine() == declarationLine - 1)
                .filter(b -> insideParent(node, b))
                .findFirst();
    }

    /**
     * Finds a comment that follows the declaration on its last line, such as {@code int id; // the id}.
     */
    public Optional<CommentBlock> trailingFor(Node node) {
        Optional<Range> range = node.getRange();
        if (range.isEmpty()) {
            return Optional.empty();
        }
        Position end = range.get().end;
        return blocks.stream()
                .filter(b -> b.beginLine() == end.line && b.beginColumn() > end.column)
                .filter(b -> insideParent(node, b))
                .findFirst();
    }

    /**
     * Strips annotation lines and the Javadoc tag section from comment text.
     *
     * @return The remaining prose, or {@code null} when nothing is left.
     */
    public static String prose(String text) {
        if (text == null) {
            return null;
        }
        List<String> kept = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("@")) {
                break;
            }
            if (!AnnotationParser.isAnnotationLine(trimmed)) {
                kept.add(trimmed);
            }
        }
        String joined = String.join("\n", kept).strip();
        return joined.isEmpty() ? null : joined;
    }

    /**
     * @return {@code true} when at least one line of the text has the shape of an annotation.
     */
    public static boolean hasAnnotations(String text) {
        if (text == null) {
            return false;
        }
        for (String line : text.split("\\R")) {
            if (AnnotationParser.isAnnotationLine(line)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} when the block starts within the range of the node's enclosing declaration. Top-level
     *         declarations accept any block.
     */
    private static boolean insideParent(Node node, CommentBlock block) {
        Optional<Node> parent = node.getParentNode();
        if (parent.isEmpty() || parent.get() instanceof CompilationUnit || parent.get().getRange().isEmpty()) {
            return true;
        }
        Range range = parent.get().getRange().get();
        Position begin = new Position(block.beginLine(), block.beginColumn());
        return begin.isAfter(range.begin) && begin.isBefore(range.end);
    }

    private static String normalize(Comment comment) {
        if (comment instanceof LineComment) {
            return comment.getContent().trim();
        }
        List<String> cleaned = new ArrayList<>();
        for (String line : comment.getContent().split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("*")) {
                trimmed = trimmed.substring(1).trim();
            }
            cleaned.add(trimmed);
        }
        return String.join("\n", cleaned).strip();
    }

    private static boolean isStandalone(Comment comment, List<String> lines) {
        Position begin = comment.getRange().get().begin;
        if (begin.line < 1 || begin.line > lines.size()) {
            return true;
        }
        String line = lines.get(begin.line - 1);
        int prefixEnd = Math.min(Math.max(begin.column - 1, 0), line.length());
        return line.substring(0, prefixEnd).isBlank();
    }

    private static int line(Comment comment, boolean end) {
        Range range = comment.getRange().get();
        return end ? range.end.line : range.begin.line;
    }
}
