package com.specgen.walker;

/**
 * One logical comment: a Javadoc or block comment, or a run of {@code //} lines on consecutive source lines.
 *
 * @param text        The normalized text, without comment delimiters or leading {@code *}, one line per source line.
 * @param beginLine   The first source line (1-based).
 * @param endLine     The last source line (1-based).
 * @param beginColumn The column of the opening delimiter (1-based).
 * @param standalone  {@code false} when code precedes the comment on its first line.
 */
public record CommentBlock(String text, int beginLine, int endLine, int beginColumn, boolean standalone) {
}
