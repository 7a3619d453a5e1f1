package com.specgen.annotation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AnnotationLexerTest {

    private static List<Token> lex(String text) {
        Optional<List<Token>> tokens = AnnotationLexer.tokenize(text);
        assertThat(tokens).isPresent();
        return tokens.get();
    }

    @Test
    void tokenize_routeLine_yieldsPathArrowIdSummaryAndTag() {
        List<Token> tokens = lex("/users -> getUsers \"Get all users\" #users");

        assertThat(tokens).extracting(Token::type).containsExactly(
                Token.Type.WORD, Token.Type.ARROW, Token.Type.WORD, Token.Type.QUOTED, Token.Type.TAG);
        assertThat(tokens).extracting(Token::text).containsExactly(
                "/users", "->", "getUsers", "Get all users", "users");
    }

    @Test
    void tokenize_compoundAndFlag() {
        List<Token> tokens = lex("limit:integer \"Number of results\" default=10 example=\"two words\"");

        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(0).type()).isEqualTo(Token.Type.COMPOUND);
        assertThat(tokens.get(0).compoundName()).isEqualTo("limit");
        assertThat(tokens.get(0).compoundType()).isEqualTo("integer");
        assertThat(tokens.get(2).type()).isEqualTo(Token.Type.FLAG);
        assertThat(tokens.get(2).key()).isEqualTo("default");
        assertThat(tokens.get(2).text()).isEqualTo("10");
        assertThat(tokens.get(3).key()).isEqualTo("example");
        assertThat(tokens.get(3).text()).isEqualTo("two words");
    }

    @Test
    void tokenize_urlsAreNotCompoundTokens() {
        List<Token> tokens = lex("https://api.test.com/v1?page=2");

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).type()).isEqualTo(Token.Type.WORD);
        assertThat(tokens.get(0).compoundType()).isNull();
    }

    @Test
    void tokenize_angleAndParenthesizedValues() {
        List<Token> tokens = lex("\"Support\" < support@test.com > (https://test.com/help)");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(Token.Type.QUOTED, Token.Type.ANGLE, Token.Type.PAREN);
        assertThat(tokens).extracting(Token::text)
                .containsExactly("Support", "support@test.com", "https://test.com/help");
    }

    @Test
    void tokenize_unescapesQuotesInsideStrings() {
        List<Token> tokens = lex("\"say \\\"hi\\\" \\\\ now\"");

        assertThat(tokens).singleElement().extracting(Token::text).isEqualTo("say \"hi\" \\ now");
    }

    @Test
    void tokenize_arrowNeedsTrailingWhitespace() {
        List<Token> tokens = lex("->x ->");

        assertThat(tokens).extracting(Token::type).containsExactly(Token.Type.WORD, Token.Type.ARROW);
    }

    @Test
    void tokenize_unterminatedDelimitersFail() {
        assertThat(AnnotationLexer.tokenize("\"open ended")).isEmpty();
        assertThat(AnnotationLexer.tokenize("<support@test.com")).isEmpty();
        assertThat(AnnotationLexer.tokenize("(https://test.com")).isEmpty();
    }

    @Test
    void tokenize_blankInputYieldsNoTokens() {
        assertThat(lex("   ")).isEmpty();
        assertThat(AnnotationLexer.tokenize(null)).contains(List.of());
    }
}
