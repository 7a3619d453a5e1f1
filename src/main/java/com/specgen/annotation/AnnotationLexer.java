package com.specgen.annotation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Splits the argument part of an annotation line into {@link Token}s.
 * <p>
 * The lexer is strict about delimiters: an unterminated quoted string, angle bracket or parenthesis makes the
 * whole line unusable, which is reported as an empty result rather than an exception.
 */
public final class AnnotationLexer {

    private static final Pattern FLAG_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");
    private static final Pattern COMPOUND = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$.\\-]*:[^/:\\s]\\S*");

    private final String input;
    private int pos;

    private AnnotationLexer(String input) {
        this.input = input;
    }

    /**
     * Tokenizes the given text.
     *
     * @param text The annotation arguments, i.e. everything after the verb.
     * @return The tokens in source order, or an empty {@link Optional} when the text is malformed.
     */
    public static Optional<List<Token>> tokenize(String text) {
        return new AnnotationLexer(text == null ? "" : text).run();
    }

    private Optional<List<Token>> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                return Optional.of(tokens);
            }
            Token token = next();
            if (token == null) {
                return Optional.empty();
            }
            tokens.add(token);
        }
    }

    private Token next() {
        char c = input.charAt(pos);
        switch (c) {
            case '"': {
                String quoted = readQuoted();
                return quoted == null ? null : Token.of(Token.Type.QUOTED, quoted);
            }
            case '<': {
                String value = readDelimited('<', '>');
                return value == null ? null : Token.of(Token.Type.ANGLE, value);
            }
            case '(': {
                String value = readDelimited('(', ')');
                return value == null ? null : Token.of(Token.Type.PAREN, value);
            }
            default:
                break;
        }
        if (c == '#' && pos + 1 < input.length() && !Character.isWhitespace(input.charAt(pos + 1))) {
            pos++;
            return Token.of(Token.Type.TAG, readBare());
        }
        if (input.startsWith("->", pos) && (pos + 2 == input.length() || Character.isWhitespace(input.charAt(pos + 2)))) {
            pos += 2;
            return Token.of(Token.Type.ARROW, "->");
        }
        return readWordOrFlag();
    }

    private Token readWordOrFlag() {
        int start = pos;
        while (pos < input.length() && !Character.isWhitespace(input.charAt(pos))) {
            char c = input.charAt(pos);
            if (c == '=' && FLAG_KEY.matcher(input.substring(start, pos)).matches()) {
                String key = input.substring(start, pos);
                pos++;
                if (pos < input.length() && input.charAt(pos) == '"') {
                    String value = readQuoted();
                    return value == null ? null : Token.flag(key, value);
                }
                return Token.flag(key, readBare());
            }
            pos++;
        }
        String word = input.substring(start, pos);
        if (COMPOUND.matcher(word).matches()) {
            return Token.of(Token.Type.COMPOUND, word);
        }
        return Token.of(Token.Type.WORD, word);
    }

    private String readBare() {
        int start = pos;
        while (pos < input.length() && !Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    /**
     * Reads a double-quoted string starting at the current position. Supports {@code \"} and {@code \\}.
     *
     * @return The unescaped content, or {@code null} when the closing quote is missing.
     */
    private String readQuoted() {
        StringBuilder sb = new StringBuilder();
        pos++; // opening quote
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\\' && pos + 1 < input.length()) {
                char escaped = input.charAt(pos + 1);
                if (escaped == '"' || escaped == '\\') {
                    sb.append(escaped);
                } else {
                    sb.append(c).append(escaped);
                }
                pos += 2;
                continue;
            }
            if (c == '"') {
                pos++;
                return sb.toString();
            }
            sb.append(c);
            pos++;
        }
        return null;
    }

    private String readDelimited(char open, char close) {
        int depth = 0;
        int start = pos + 1;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    String value = input.substring(start, pos);
                    pos++;
                    return value.trim();
                }
            }
            pos++;
        }
        return null;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
