package com.specgen.annotation;

/**
 * One lexical unit of an annotation line.
 *
 * @param type The token kind.
 * @param text The token value with delimiters removed (quotes, angle brackets, parentheses, the {@code #} of a tag).
 *             For a {@link Type#FLAG} this is the flag value.
 * @param key  The flag name for a {@link Type#FLAG}, otherwise {@code null}.
 */
public record Token(Type type, String text, String key) {

    public enum Type {
        /** A bare word such as {@code /users} or {@code required}. */
        WORD,
        /** A bare {@code name:type} word such as {@code limit:integer}. */
        COMPOUND,
        /** A double-quoted string. */
        QUOTED,
        /** An {@code <angle-bracketed>} value. */
        ANGLE,
        /** A {@code (parenthesized)} value. */
        PAREN,
        /** A {@code #tag} marker. */
        TAG,
        /** A {@code key=value} flag. */
        FLAG,
        /** The {@code ->} route separator. */
        ARROW
    }

    static Token of(Type type, String text) {
        return new Token(type, text, null);
    }

    static Token flag(String key, String value) {
        return new Token(Type.FLAG, value, key);
    }

    /**
     * @return {@code true} for tokens that are written without quotes and carry a plain value.
     */
    public boolean isBare() {
        return type == Type.WORD || type == Type.COMPOUND;
    }

    /**
     * @return {@code true} for any token that can stand for a positional value.
     */
    public boolean isValue() {
        return isBare() || type == Type.QUOTED;
    }

    /**
     * @return The part before the first colon of a compound token, or the whole text otherwise.
     */
    public String compoundName() {
        if (type != Type.COMPOUND) {
            return text;
        }
        return text.substring(0, text.indexOf(':'));
    }

    /**
     * @return The part after the first colon of a compound token, or {@code null} otherwise.
     */
    public String compoundType() {
        if (type != Type.COMPOUND) {
            return null;
        }
        return text.substring(text.indexOf(':') + 1);
    }
}
