package json5;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import json5.Json5.Lexer;
import json5.Json5.Token;
import json5.Json5.TokenType;
import org.junit.jupiter.api.Test;

class LexerTest {

    private static List<Token> tokenize(String source) {
        var lexer = new Lexer(source);
        var tokens = new ArrayList<Token>();
        while (lexer.current().type() != TokenType.EOF) {
            tokens.add(lexer.current());
            lexer.advance();
        }
        tokens.add(lexer.current());
        return tokens;
    }

    @Test
    void tokenTypes() {
        var tokens = tokenize("{a: 'b', \"c\": [1, +.5e3, 0x1f, -Infinity, NaN], d: true, e: false, f: null}");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LBRACE,
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.STRING, TokenType.COMMA,
                TokenType.STRING, TokenType.COLON, TokenType.LBRACKET,
                TokenType.NUMBER, TokenType.COMMA, TokenType.NUMBER, TokenType.COMMA, TokenType.NUMBER,
                TokenType.COMMA, TokenType.NUMBER, TokenType.COMMA, TokenType.NUMBER,
                TokenType.RBRACKET, TokenType.COMMA,
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.TRUE, TokenType.COMMA,
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.FALSE, TokenType.COMMA,
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.NULL,
                TokenType.RBRACE,
                TokenType.EOF);
        assertThat(tokens)
                .filteredOn(t -> t.type() == TokenType.NUMBER)
                .extracting(Token::lexeme)
                .containsExactly("1", "+.5e3", "0x1f", "-Infinity", "NaN");
    }

    @Test
    void punctuators() {
        var tokens = tokenize("{}[]:, 'x' 1 y true null");
        assertThat(tokens)
                .filteredOn(t -> t.type().isPunctuator())
                .extracting(Token::lexeme)
                .containsExactly("{", "}", "[", "]", ":", ",");
        assertThat(TokenType.STRING.isPunctuator()).isFalse();
        assertThat(TokenType.EOF.isPunctuator()).isFalse();
    }

    @Test
    void decodedText() {
        // @spotless:off
        var table = new Object[][] {
                {"'plain'", TokenType.STRING, "plain"},
                {"\"esc\\u0041\\x42\\n\"", TokenType.STRING, "escAB\n"},
                {"name", TokenType.IDENTIFIER, "name"},
                {"\\u0061bc", TokenType.IDENTIFIER, "abc"},
                {"a\\u0062c", TokenType.IDENTIFIER, "abc"},
                {"\\u0074rue", TokenType.IDENTIFIER, "true"},
                {"_$x9", TokenType.IDENTIFIER, "_$x9"},
                {"café", TokenType.IDENTIFIER, "café"},
                {"a\u203Fb", TokenType.IDENTIFIER, "a\u203Fb"},
        };
        // @spotless:on

        assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
            var row = table[i];
            var input = (String) row[0];
            var token = tokenize(input).get(0);
            assertThat(token.type()).as("Case %d: input=%s", i, input).isEqualTo(row[1]);
            assertThat(token.text()).as("Case %d: input=%s", i, input).isEqualTo(row[2]);
            assertThat(token.lexeme()).as("Case %d: input=%s", i, input).isEqualTo(input);
        }));
    }

    @Test
    void whitespaceAndComments() {
        var source = "\uFEFF\t\u000B\f \u00A0\u2028\u2029\u3000 // line\r\n/* block */ 1 /* tail */";
        var tokens = tokenize(source);

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.NUMBER, TokenType.EOF);
        assertThat(tokens.get(0).span().extract(source)).isEqualTo("1");
    }

    @Test
    void commentMarkersInsideStringsAreText() {
        var tokens = tokenize("'// not a comment /* nor this */'");
        assertThat(tokens.get(0).text()).isEqualTo("// not a comment /* nor this */");
    }

    @Test
    void tokenSpans() {
        var source = "[\n  'ab',\r\n  12\n]";
        var tokens = tokenize(source);

        var string = tokens.get(1);
        assertThat(string.span().start()).isEqualTo(new Span.Position(4, 2, 3));
        assertThat(string.span().end()).isEqualTo(new Span.Position(8, 2, 7));

        var number = tokens.get(3);
        assertThat(number.span().start()).isEqualTo(new Span.Position(13, 3, 3));
        assertThat(number.span().extract(source)).isEqualTo("12");

        var eof = tokens.get(tokens.size() - 1);
        assertThat(eof.type()).isEqualTo(TokenType.EOF);
        assertThat(eof.span().length()).isZero();
        assertThat(eof.span().start()).isEqualTo(new Span.Position(source.length(), 4, 2));
    }

    @Test
    void lineSeparatorsAdvanceLines() {
        var tokens = tokenize("1\r2\u20283\u20294");
        assertThat(tokens)
                .filteredOn(t -> t.type() == TokenType.NUMBER)
                .extracting(t -> t.span().start().line())
                .containsExactly(1, 2, 3, 4);
    }

    @Test
    void describe() {
        var tokens = tokenize("{ 'str' 42 ident true }");
        assertThat(tokens).extracting(Token::describe).containsExactly(
                "'{'", "string 'str'", "number 42", "identifier 'ident'", "'true'", "'}'", "end of input");

        var longString = tokenize("'" + "x".repeat(40) + "'").get(0);
        assertThat(longString.describe()).isEqualTo("string '" + "x".repeat(28) + "...");
    }

    @Test
    void firstErrorIsTerminal() {
        assertThatCode(() -> tokenize("[1, 'ok', \"unterminated"))
                .isInstanceOf(Json5.LexException.class)
                .hasMessage("Unterminated string literal at line 1, column 11");
    }

    @Test
    void hexValueMatchesDigitSet() {
        var digits = "0123456789abcdefABCDEF";
        for (int k = 0; k < digits.length(); k++) {
            assertThat(Lexer.hexValue(digits.charAt(k))).isBetween(0, 15);
        }
        assertThat(Lexer.hexValue('g')).isEqualTo(-1);
        assertThat(Lexer.hexValue('F')).isEqualTo(15);
    }

    @Test
    void identifierNames() {
        assertThat(Lexer.isIdentifierName("abc")).isTrue();
        assertThat(Lexer.isIdentifierName("$")).isTrue();
        assertThat(Lexer.isIdentifierName("a1")).isTrue();
        assertThat(Lexer.isIdentifierName("1a")).isFalse();
        assertThat(Lexer.isIdentifierName("a-b")).isFalse();
        assertThat(Lexer.isIdentifierName("")).isFalse();
        assertThat(Lexer.isIdentifierName("a b")).isFalse();
    }
}
