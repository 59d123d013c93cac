package json5;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

/**
 * JSON5 parser that keeps source locations, and the matching stringifier.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * JsonNode root = Json5.parse("{port: 0x1F90, hosts: ['a', 'b',]}");
 * JsonNode port = ((JsonObject) root).get("port");
 * // -> JsonInteger[8080], port.span() -> 1:8-1:14
 * String text = Json5.stringify(root);
 * // -> {"port":8080,"hosts":["a","b"]}
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Json5 {

    private static final Parser defaultParser = Parser.builder().build();
    private static final Writer defaultWriter = Writer.builder().build();

    private Json5() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Parse a JSON5 document: exactly one value, optionally surrounded by whitespace and comments.
     *
     * @param source JSON5 text, not {@code null}
     * @return the root node; every node carries the span it was parsed from
     * @throws ParseException on the first lexical or syntax error, never with a partial tree
     */
    public static JsonNode parse(String source) {
        return defaultParser.parse(source);
    }

    /**
     * Render a node tree as compact JSON5 with double-quoted strings and keys.
     *
     * @param node any node, not {@code null}
     * @return non-null JSON5 text
     */
    public static String stringify(JsonNode node) {
        return defaultWriter.write(node);
    }

    /**
     * Render a node tree with the given writer settings.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var writer = Json5.Writer.builder().indent("  ").quoteStyle(Json5.QuoteStyle.SINGLE).build();
     * String text = Json5.stringify(node, writer);
     * }</pre>
     */
    public static String stringify(JsonNode node, Writer writer) {
        Objects.requireNonNull(writer, "writer");
        return writer.write(node);
    }

    // ============================================================
    // Lexer
    // ============================================================

    enum TokenType {
        LBRACE("'{'"),
        RBRACE("'}'"),
        LBRACKET("'['"),
        RBRACKET("']'"),
        COLON("':'"),
        COMMA("','"),
        STRING("string"),
        NUMBER("number"),
        IDENTIFIER("identifier"),
        TRUE("'true'"),
        FALSE("'false'"),
        NULL("'null'"),
        EOF("end of input");

        private final String description;

        TokenType(String description) {
            this.description = description;
        }

        boolean isPunctuator() {
            return ordinal() <= COMMA.ordinal();
        }
    }

    /**
     * One lexical unit. {@code text} is the decoded value of strings and identifiers, {@code null} otherwise.
     */
    record Token(TokenType type, String lexeme, @Nullable String text, Span span) {

        String describe() {
            return switch (type) {
                case STRING, NUMBER -> type.description + " " + abbreviate(lexeme);
                case IDENTIFIER -> type.description + " '" + abbreviate(lexeme) + "'";
                default -> type.description;
            };
        }

        private static String abbreviate(String s) {
            return s.length() <= 32 ? s : s.substring(0, 29) + "...";
        }
    }

    @Slf4j
    static final class Lexer {
        private final String s;
        private int i = 0, line = 1, col = 1;
        private Token current;

        Lexer(String s) {
            this.s = Objects.requireNonNull(s);
            advance();
        }

        Token current() {
            return current;
        }

        void advance() {
            skipTrivia();
            var start = position();
            if (eof()) {
                current = new Token(TokenType.EOF, "", null, Span.at(start));
                return;
            }
            char c = peek();
            current = switch (c) {
                case '{' -> punctuator(TokenType.LBRACE, start);
                case '}' -> punctuator(TokenType.RBRACE, start);
                case '[' -> punctuator(TokenType.LBRACKET, start);
                case ']' -> punctuator(TokenType.RBRACKET, start);
                case ':' -> punctuator(TokenType.COLON, start);
                case ',' -> punctuator(TokenType.COMMA, start);
                case '"', '\'' -> readString(start);
                default -> {
                    if (c == '+' || c == '-' || c == '.' || isDigit(c)) yield readNumber(start);
                    if (c == '\\' || isIdentifierStart(s.codePointAt(i))) yield readWord(start);
                    consumeCodePoint();
                    throw new LexException(
                            ParseException.Kind.UNEXPECTED_CHARACTER,
                            "Unexpected character: " + describeChar(s.codePointAt(start.offset())),
                            span(start));
                }
            };
            if (log.isTraceEnabled()) log.trace("{} at {}", current.describe(), current.span());
        }

        private Token punctuator(TokenType type, Span.Position start) {
            consume();
            return new Token(type, s.substring(start.offset(), i), null, span(start));
        }

        private void skipTrivia() {
            while (!eof()) {
                char c = peek();
                if (isWhitespace(c)) consume();
                else if (c == '/' && peekNext() == '/') {
                    while (!eof() && !isLineTerminator(peek())) consume();
                } else if (c == '/' && peekNext() == '*') {
                    skipBlockComment();
                } else break;
            }
        }

        private void skipBlockComment() {
            var start = position();
            consume();
            consume();
            while (!eof()) {
                if (peek() == '*' && peekNext() == '/') {
                    consume();
                    consume();
                    return;
                }
                consume();
            }
            throw new LexException(
                    ParseException.Kind.UNTERMINATED_COMMENT, "Unterminated block comment", span(start));
        }

        private Token readString(Span.Position start) {
            char quote = consume();
            var sb = new StringBuilder();
            while (!eof()) {
                char c = peek();
                if (c == quote) {
                    consume();
                    return new Token(TokenType.STRING, s.substring(start.offset(), i), sb.toString(), span(start));
                }
                if (c == '\n' || c == '\r') break; // U+2028 and U+2029 are allowed unescaped
                if (c == '\\') readEscape(sb);
                else sb.append(consume());
            }
            throw new LexException(ParseException.Kind.UNTERMINATED_STRING, "Unterminated string literal", span(start));
        }

        private void readEscape(StringBuilder sb) {
            var start = position();
            consume(); // backslash
            if (eof()) return;
            char e = consume();
            switch (e) {
                case '\'', '"', '\\', '/' -> sb.append(e);
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'v' -> sb.append('\u000B');
                case '0' -> {
                    if (!eof() && isDigit(peek())) {
                        throw new LexException(
                                ParseException.Kind.INVALID_ESCAPE,
                                "Octal escape sequences are not allowed",
                                span(start));
                    }
                    sb.append('\0');
                }
                case '1', '2', '3', '4', '5', '6', '7', '8', '9' -> throw new LexException(
                        ParseException.Kind.INVALID_ESCAPE, "Invalid escape sequence: \\" + e, span(start));
                case 'x' -> sb.append((char) readHex(2, start));
                case 'u' -> sb.append((char) readHex(4, start));
                case '\r' -> {
                    if (!eof() && peek() == '\n') consume();
                }
                case '\n', '\u2028', '\u2029' -> {
                    // line continuation
                }
                default -> sb.append(e);
            }
        }

        private int readHex(int digits, Span.Position escapeStart) {
            int cp = 0;
            for (int k = 0; k < digits; k++) {
                int v = eof() ? -1 : hexValue(peek());
                if (v < 0) {
                    throw new LexException(
                            ParseException.Kind.INVALID_ESCAPE,
                            "Invalid hexadecimal digit in escape sequence",
                            span(escapeStart));
                }
                consume();
                cp = (cp << 4) | v;
            }
            return cp;
        }

        /**
         * An identifier name; unescaped {@code true}, {@code false}, {@code null}, {@code Infinity}
         * and {@code NaN} become keyword or number tokens.
         */
        private Token readWord(Span.Position start) {
            String name = scanIdentifierName();
            String lexeme = s.substring(start.offset(), i);
            if (!name.equals(lexeme)) return new Token(TokenType.IDENTIFIER, lexeme, name, span(start));
            return switch (name) {
                case "true" -> new Token(TokenType.TRUE, lexeme, null, span(start));
                case "false" -> new Token(TokenType.FALSE, lexeme, null, span(start));
                case "null" -> new Token(TokenType.NULL, lexeme, null, span(start));
                case "Infinity", "NaN" -> new Token(TokenType.NUMBER, lexeme, null, span(start));
                default -> new Token(TokenType.IDENTIFIER, lexeme, name, span(start));
            };
        }

        private String scanIdentifierName() {
            var sb = new StringBuilder();
            boolean first = true;
            while (!eof()) {
                int cp = s.codePointAt(i);
                if (cp == '\\') {
                    var start = position();
                    consume();
                    if (eof() || peek() != 'u') {
                        throw new LexException(
                                ParseException.Kind.INVALID_ESCAPE,
                                "Only \\u escapes are allowed in identifiers",
                                span(start));
                    }
                    consume();
                    int decoded = readHex(4, start);
                    if (first ? !isIdentifierStart(decoded) : !isIdentifierPart(decoded)) {
                        throw new LexException(
                                ParseException.Kind.INVALID_ESCAPE,
                                "Escaped character " + describeChar(decoded) + " is not allowed in an identifier",
                                span(start));
                    }
                    sb.append((char) decoded);
                } else if (first ? isIdentifierStart(cp) : isIdentifierPart(cp)) {
                    sb.appendCodePoint(cp);
                    consumeCodePoint();
                } else break;
                first = false;
            }
            return sb.toString();
        }

        private Token readNumber(Span.Position start) {
            if (peek() == '+' || peek() == '-') consume();
            if (eof()) throw invalidNumber("Unexpected end of input in number", start);
            char c = peek();
            if (isIdentifierStart(s.codePointAt(i))) {
                // signed Infinity or NaN, spelled without escapes
                int wordStart = i;
                scanIdentifierName();
                String word = s.substring(wordStart, i);
                if (!word.equals("Infinity") && !word.equals("NaN")) {
                    throw invalidNumber("Invalid number: " + s.substring(start.offset(), i), start);
                }
            } else if (c == '0' && (peekNext() == 'x' || peekNext() == 'X')) {
                consume();
                consume();
                if (eof() || hexValue(peek()) < 0) throw invalidNumber("Missing hexadecimal digits", start);
                while (!eof() && hexValue(peek()) >= 0) consume();
            } else {
                boolean digits = false;
                if (c == '0') {
                    consume();
                    digits = true;
                    if (!eof() && isDigit(peek())) throw invalidNumber("Leading zeros are not allowed", start);
                } else {
                    while (!eof() && isDigit(peek())) {
                        consume();
                        digits = true;
                    }
                }
                if (!eof() && peek() == '.') {
                    consume();
                    while (!eof() && isDigit(peek())) {
                        consume();
                        digits = true;
                    }
                }
                if (!digits) throw invalidNumber("Invalid number format (no digits)", start);
                if (!eof() && (peek() == 'e' || peek() == 'E')) {
                    consume();
                    if (!eof() && (peek() == '+' || peek() == '-')) consume();
                    if (eof() || !isDigit(peek())) throw invalidNumber("Invalid number format (exponent part)", start);
                    while (!eof() && isDigit(peek())) consume();
                }
            }
            if (!eof() && (peek() == '\\' || isIdentifierPart(s.codePointAt(i)))) {
                consumeCodePoint();
                throw invalidNumber("Invalid character after number", start);
            }
            return new Token(TokenType.NUMBER, s.substring(start.offset(), i), null, span(start));
        }

        private LexException invalidNumber(String reason, Span.Position start) {
            return new LexException(ParseException.Kind.INVALID_NUMBER, reason, span(start));
        }

        private boolean eof() {
            return i >= s.length();
        }

        private char peek() {
            return s.charAt(i);
        }

        private char peekNext() {
            return (i + 1 < s.length()) ? s.charAt(i + 1) : '\0';
        }

        private char consume() {
            char c = s.charAt(i++);
            if (c == '\n' || c == '\u2028' || c == '\u2029' || (c == '\r' && (eof() || peek() != '\n'))) {
                line++;
                col = 1;
            } else col++;
            return c;
        }

        private void consumeCodePoint() {
            if (Character.isHighSurrogate(consume()) && !eof() && Character.isLowSurrogate(peek())) consume();
        }

        private Span.Position position() {
            return new Span.Position(i, line, col);
        }

        private Span span(Span.Position start) {
            return Span.of(start, position());
        }

        /**
         * Shared by the lexer's digit scanning and the parser's hex conversion.
         */
        static int hexValue(char c) {
            if (c >= '0' && c <= '9') return c - '0';
            if (c >= 'a' && c <= 'f') return 10 + (c - 'a');
            if (c >= 'A' && c <= 'F') return 10 + (c - 'A');
            return -1;
        }

        static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        static boolean isWhitespace(char c) {
            return switch (c) {
                case '\t', '\n', '\u000B', '\f', '\r', ' ', '\u00A0', '\u2028', '\u2029', '\uFEFF' -> true;
                default -> Character.getType(c) == Character.SPACE_SEPARATOR;
            };
        }

        static boolean isLineTerminator(char c) {
            return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
        }

        static boolean isIdentifierStart(int cp) {
            return cp == '$' || cp == '_' || Character.isLetter(cp) || Character.getType(cp) == Character.LETTER_NUMBER;
        }

        static boolean isIdentifierPart(int cp) {
            if (isIdentifierStart(cp)) return true;
            return switch (Character.getType(cp)) {
                case Character.DECIMAL_DIGIT_NUMBER,
                        Character.NON_SPACING_MARK,
                        Character.COMBINING_SPACING_MARK,
                        Character.CONNECTOR_PUNCTUATION -> true;
                default -> cp == '\u200C' || cp == '\u200D';
            };
        }

        static boolean isIdentifierName(String s) {
            if (s.isEmpty() || !isIdentifierStart(s.codePointAt(0))) return false;
            for (int k = Character.charCount(s.codePointAt(0)); k < s.length(); ) {
                int cp = s.codePointAt(k);
                if (!isIdentifierPart(cp)) return false;
                k += Character.charCount(cp);
            }
            return true;
        }

        static String describeChar(int cp) {
            if (cp < 0x20 || Character.isWhitespace(cp) || Character.isISOControl(cp)) {
                return String.format("U+%04X", cp);
            }
            return "'" + new String(Character.toChars(cp)) + "'";
        }
    }

    // ============================================================
    // Parser
    // ============================================================

    /**
     * What to do when an object literal repeats a key.
     */
    public enum DuplicateKeyPolicy {
        /**
         * Fail with {@link ParseException.Kind#DUPLICATE_KEY} at the repeated key.
         */
        REJECT,
        /**
         * Keep the last value; the key stays at the position where it first appeared.
         */
        LAST_WINS
    }

    /**
     * Recursive-descent JSON5 parser. Instances are immutable and may be shared across threads.
     */
    @Slf4j
    @Getter
    @Builder(toBuilder = true)
    public static final class Parser {

        public static final int DEFAULT_MAX_DEPTH = 1000;

        @Builder.Default
        private final DuplicateKeyPolicy duplicateKeyPolicy = DuplicateKeyPolicy.REJECT;

        /**
         * Maximum nesting of arrays and objects; the top-level value is depth 1.
         */
        @Builder.Default
        private final int maxDepth = DEFAULT_MAX_DEPTH;

        public JsonNode parse(String source) {
            Objects.requireNonNull(source, "source");
            try {
                var lexer = new Lexer(source);
                var root = parseValue(lexer, 0);
                var next = lexer.current();
                if (next.type() != TokenType.EOF) {
                    throw new SyntaxException(
                            ParseException.Kind.TRAILING_CONTENT,
                            "Trailing content after top-level value: " + next.describe(),
                            next.span());
                }
                log.debug("Parsed {} chars into {} node", source.length(), root.type());
                return root;
            } catch (ParseException e) {
                log.debug("Parse failed with {}: {}", e.getKind(), e.getMessage());
                throw e;
            }
        }

        private JsonNode parseValue(Lexer lexer, int depth) {
            var token = lexer.current();
            return switch (token.type()) {
                case LBRACE -> parseObject(lexer, depth + 1);
                case LBRACKET -> parseArray(lexer, depth + 1);
                case STRING -> {
                    lexer.advance();
                    yield new JsonString(token.text(), token.span());
                }
                case NUMBER -> {
                    lexer.advance();
                    yield toNumber(token);
                }
                case TRUE, FALSE -> {
                    lexer.advance();
                    yield new JsonBoolean(token.type() == TokenType.TRUE, token.span());
                }
                case NULL -> {
                    lexer.advance();
                    yield new JsonNull(token.span());
                }
                default -> throw unexpected(token, "a value");
            };
        }

        private JsonObject parseObject(Lexer lexer, int depth) {
            var open = lexer.current();
            checkDepth(open, depth);
            lexer.advance();
            var members = OrderedMembers.builder();
            while (true) {
                var keyToken = lexer.current();
                if (keyToken.type() == TokenType.EOF) throw unterminated(open, "object", '}');
                if (keyToken.type() == TokenType.RBRACE) {
                    lexer.advance();
                    return new JsonObject(members.build(), Span.of(open.span().start(), keyToken.span().end()));
                }
                String key = keyOf(keyToken);
                if (duplicateKeyPolicy == DuplicateKeyPolicy.REJECT && members.containsKey(key)) {
                    throw new SyntaxException(
                            ParseException.Kind.DUPLICATE_KEY, "Duplicate key '" + key + "'", keyToken.span());
                }
                lexer.advance();

                var colon = lexer.current();
                if (colon.type() == TokenType.EOF) throw unterminated(open, "object", '}');
                if (colon.type() != TokenType.COLON) throw unexpected(colon, "':'");
                lexer.advance();

                if (lexer.current().type() == TokenType.EOF) throw unterminated(open, "object", '}');
                var value = parseValue(lexer, depth);
                members.put(new JsonObject.Member(key, keyToken.span(), value));

                var separator = lexer.current();
                if (separator.type() == TokenType.COMMA) lexer.advance();
                else if (separator.type() == TokenType.EOF) throw unterminated(open, "object", '}');
                else if (separator.type() != TokenType.RBRACE) throw unexpected(separator, "',' or '}'");
            }
        }

        private JsonArray parseArray(Lexer lexer, int depth) {
            var open = lexer.current();
            checkDepth(open, depth);
            lexer.advance();
            var elements = new ArrayList<JsonNode>();
            while (true) {
                var token = lexer.current();
                if (token.type() == TokenType.EOF) throw unterminated(open, "array", ']');
                if (token.type() == TokenType.RBRACKET) {
                    lexer.advance();
                    return new JsonArray(elements, Span.of(open.span().start(), token.span().end()));
                }
                elements.add(parseValue(lexer, depth));

                var separator = lexer.current();
                if (separator.type() == TokenType.COMMA) lexer.advance();
                else if (separator.type() == TokenType.EOF) throw unterminated(open, "array", ']');
                else if (separator.type() != TokenType.RBRACKET) throw unexpected(separator, "',' or ']'");
            }
        }

        private void checkDepth(Token open, int depth) {
            if (depth > maxDepth) {
                throw new SyntaxException(
                        ParseException.Kind.NESTING_TOO_DEEP,
                        "Nesting depth exceeds maximum of " + maxDepth,
                        open.span());
            }
        }

        /**
         * Keys are strings or identifier names, including names spelled like keywords.
         */
        private static String keyOf(Token token) {
            return switch (token.type()) {
                case STRING, IDENTIFIER -> token.text();
                case TRUE, FALSE, NULL -> token.lexeme();
                case NUMBER -> {
                    if (token.lexeme().equals("Infinity") || token.lexeme().equals("NaN")) yield token.lexeme();
                    throw unexpected(token, "an object key");
                }
                default -> throw unexpected(token, "an object key");
            };
        }

        private static SyntaxException unexpected(Token token, String expected) {
            return new SyntaxException(
                    ParseException.Kind.UNEXPECTED_TOKEN,
                    "Expected " + expected + " but found " + token.describe(),
                    token.span());
        }

        private static SyntaxException unterminated(Token open, String structure, char closer) {
            return new SyntaxException(
                    ParseException.Kind.UNTERMINATED_STRUCTURE,
                    "Unterminated " + structure + ", missing '" + closer + "'",
                    open.span());
        }

        /**
         * Integer when the literal is a plain or hex integer whose value fits in a {@code long},
         * float otherwise. Only called on lexemes the lexer accepted, so it cannot fail.
         */
        static JsonNode toNumber(Token token) {
            String lexeme = token.lexeme();
            Span span = token.span();
            char sign = lexeme.charAt(0);
            boolean negative = sign == '-';
            String body = (sign == '-' || sign == '+') ? lexeme.substring(1) : lexeme;

            if (body.equals("Infinity")) {
                return new JsonFloat(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY, span);
            }
            if (body.equals("NaN")) return new JsonFloat(Double.NaN, span);
            if (body.length() > 2 && (body.charAt(1) == 'x' || body.charAt(1) == 'X')) {
                return integerOrFloat(body.substring(2), 16, negative, span);
            }
            for (int k = 0; k < body.length(); k++) {
                if (!Lexer.isDigit(body.charAt(k))) return new JsonFloat(Double.parseDouble(lexeme), span);
            }
            return integerOrFloat(body, 10, negative, span);
        }

        private static JsonNode integerOrFloat(String digits, int radix, boolean negative, Span span) {
            // 15 hex digits or 18 decimal digits always fit in a long
            int safeDigits = radix == 16 ? 15 : 18;
            if (digits.length() <= safeDigits) {
                long v = 0;
                for (int k = 0; k < digits.length(); k++) v = v * radix + Lexer.hexValue(digits.charAt(k));
                return new JsonInteger(negative ? -v : v, span);
            }
            var big = BigInteger.ZERO;
            var bigRadix = BigInteger.valueOf(radix);
            for (int k = 0; k < digits.length(); k++) {
                big = big.multiply(bigRadix).add(BigInteger.valueOf(Lexer.hexValue(digits.charAt(k))));
            }
            if (negative) big = big.negate();
            if (big.bitLength() < Long.SIZE) return new JsonInteger(big.longValue(), span);
            return new JsonFloat(big.doubleValue(), span);
        }
    }

    // ============================================================
    // Writer
    // ============================================================

    public enum QuoteStyle {
        DOUBLE,
        SINGLE,
        /**
         * Whichever quote needs fewer escapes in each string; double on a tie.
         */
        PREFERRED
    }

    public enum Dialect {
        JSON5,
        /**
         * Strict JSON: double quotes, quoted keys, no trailing commas, non-finite floats as {@code null}.
         */
        JSON
    }

    /**
     * Stringify settings. Writing never fails on a well-formed tree, however deep.
     */
    @Getter
    public static final class Writer {

        /**
         * Indentation unit for multi-line output; {@code null} writes everything on one line.
         * Only JSON5 whitespace is allowed.
         */
        private final @Nullable String indent;

        private final QuoteStyle quoteStyle;

        /**
         * Emit a comma after the last element or member. Only applies to multi-line JSON5 output.
         */
        private final boolean trailingCommas;

        /**
         * Write keys that are valid identifier names without quotes. Ignored for JSON.
         */
        private final boolean unquotedKeys;

        private final Dialect dialect;

        /**
         * Unset {@code quoteStyle} and {@code dialect} default to {@link QuoteStyle#DOUBLE} and {@link Dialect#JSON5}.
         *
         * @throws IllegalArgumentException if {@code indent} contains a character that is not JSON5 whitespace
         */
        @Builder(toBuilder = true)
        private Writer(
                @Nullable String indent,
                @Nullable QuoteStyle quoteStyle,
                boolean trailingCommas,
                boolean unquotedKeys,
                @Nullable Dialect dialect) {
            if (indent != null) {
                for (int k = 0; k < indent.length(); k++) {
                    if (!Lexer.isWhitespace(indent.charAt(k))) {
                        throw new IllegalArgumentException(
                                "Indent must be whitespace, found " + Lexer.describeChar(indent.charAt(k)));
                    }
                }
            }
            this.indent = indent;
            this.quoteStyle = quoteStyle != null ? quoteStyle : QuoteStyle.DOUBLE;
            this.trailingCommas = trailingCommas;
            this.unquotedKeys = unquotedKeys;
            this.dialect = dialect != null ? dialect : Dialect.JSON5;
        }

        public static Writer json() {
            return builder().dialect(Dialect.JSON).build();
        }

        /**
         * Containers are walked with an explicit stack of open frames, so nesting depth is bounded by heap, not by
         * the thread's stack.
         */
        public String write(JsonNode node) {
            Objects.requireNonNull(node, "node");
            var out = new StringBuilder();
            var open = new ArrayDeque<Frame>();
            writeValue(out, node, open);
            while (!open.isEmpty()) {
                var frame = open.peek();
                if (frame.index == frame.size()) {
                    open.pop();
                    closeMultiline(out, open.size());
                    out.append(frame.closer());
                    continue;
                }
                if (frame.index > 0) out.append(',');
                newline(out, open.size());
                JsonNode next;
                if (frame.members != null) {
                    var member = frame.members.get(frame.index);
                    writeKey(out, member.key());
                    out.append(indent == null ? ":" : ": ");
                    next = member.value();
                } else {
                    next = frame.elements.get(frame.index);
                }
                frame.index++;
                writeValue(out, next, open);
            }
            return out.toString();
        }

        /**
         * Write a scalar or an empty container in full; open a frame for a non-empty container.
         */
        private void writeValue(StringBuilder out, JsonNode node, Deque<Frame> open) {
            if (node instanceof JsonNull) {
                out.append("null");
                return;
            }
            if (node instanceof JsonBoolean b) {
                out.append(b.value() ? "true" : "false");
                return;
            }
            if (node instanceof JsonInteger n) {
                out.append(n.value());
                return;
            }
            if (node instanceof JsonFloat f) {
                writeFloat(out, f.value());
                return;
            }
            if (node instanceof JsonString s) {
                writeString(out, s.value());
                return;
            }
            if (node instanceof JsonArray a) {
                if (a.isEmpty()) {
                    out.append("[]");
                } else {
                    out.append('[');
                    open.push(new Frame(a.elements(), null));
                }
                return;
            }
            if (node instanceof JsonObject o) {
                if (o.isEmpty()) {
                    out.append("{}");
                } else {
                    out.append('{');
                    open.push(new Frame(null, o.members().asList()));
                }
                return;
            }
            throw new IllegalStateException("Unknown JsonNode type: " + node.getClass());
        }

        void writeFloat(StringBuilder out, double d) {
            if (Double.isFinite(d)) {
                out.append(d); // Double.toString always has '.' or 'E', so it reads back as a float
            } else if (dialect == Dialect.JSON) {
                out.append("null");
            } else if (Double.isNaN(d)) {
                out.append("NaN");
            } else {
                out.append(d > 0 ? "Infinity" : "-Infinity");
            }
        }

        private void writeKey(StringBuilder out, String key) {
            if (unquotedKeys && dialect == Dialect.JSON5 && Lexer.isIdentifierName(key)) out.append(key);
            else writeString(out, key);
        }

        private void closeMultiline(StringBuilder out, int level) {
            if (indent == null) return;
            if (trailingCommas && dialect == Dialect.JSON5) out.append(',');
            newline(out, level);
        }

        private void newline(StringBuilder out, int level) {
            if (indent == null) return;
            out.append('\n');
            for (int k = 0; k < level; k++) out.append(indent);
        }

        void writeString(StringBuilder out, String s) {
            char quote = quoteFor(s);
            out.append(quote);
            escapeTo(out, s, quote);
            out.append(quote);
        }

        char quoteFor(String s) {
            if (dialect == Dialect.JSON) return '"';
            return switch (quoteStyle) {
                case DOUBLE -> '"';
                case SINGLE -> '\'';
                case PREFERRED -> {
                    int doubles = 0, singles = 0;
                    for (int i = 0; i < s.length(); i++) {
                        if (s.charAt(i) == '"') doubles++;
                        else if (s.charAt(i) == '\'') singles++;
                    }
                    yield singles < doubles ? '\'' : '"';
                }
            };
        }

        static void escapeTo(StringBuilder out, String s, char quote) {
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c == quote) {
                    out.append('\\').append(c);
                    continue;
                }
                switch (c) {
                    case '\\' -> out.append("\\\\");
                    case '\b' -> out.append("\\b");
                    case '\f' -> out.append("\\f");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    case '\u2028', '\u2029' -> appendUnicodeEscape(out, c);
                    default -> {
                        if (c < 0x20) appendUnicodeEscape(out, c);
                        else out.append(c);
                    }
                }
            }
        }

        private static void appendUnicodeEscape(StringBuilder out, char c) {
            out.append("\\u");
            String hex = Integer.toHexString(c);
            for (int k = hex.length(); k < 4; k++) out.append('0');
            out.append(hex);
        }

        /**
         * An array or object being written: exactly one of {@code elements} and {@code members} is set.
         */
        private static final class Frame {
            private final @Nullable List<JsonNode> elements;
            private final @Nullable List<JsonObject.Member> members;
            private int index;

            Frame(@Nullable List<JsonNode> elements, @Nullable List<JsonObject.Member> members) {
                this.elements = elements;
                this.members = members;
            }

            int size() {
                return members != null ? members.size() : elements.size();
            }

            char closer() {
                return members != null ? '}' : ']';
            }
        }
    }

    // ============================================================
    // Utils
    // ============================================================

    static int mapCap(int size) {
        return size < 3 ? size + 1 : (int) (size / 0.75f + 1.0f);
    }

    /**
     * Base of all exceptions thrown by this library.
     *
     * @since 0.1.0
     */
    public abstract static class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }

        public Exception(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A JSON5 document could not be parsed. Carries the kind of failure and the span of the offending text.
     *
     * <p> The message reads {@code "<reason> at line L, column C"}; {@link #getReason()} is the bare reason
     * for callers that format locations themselves.
     *
     * @since 0.1.0
     */
    public static class ParseException extends Exception {
        private final Kind kind;
        private final String reason;
        private final Span span;

        public ParseException(Kind kind, String reason, Span span) {
            super(String.format("%s at line %d, column %d", reason, span.start().line(), span.start().column()));
            this.kind = Objects.requireNonNull(kind, "kind");
            this.reason = reason;
            this.span = span;
        }

        public Kind getKind() {
            return kind;
        }

        public String getReason() {
            return reason;
        }

        public Span getSpan() {
            return span;
        }

        public int getLine() {
            return span.start().line();
        }

        public int getColumn() {
            return span.start().column();
        }

        public int getOffset() {
            return span.start().offset();
        }

        public enum Kind {
            UNTERMINATED_STRING(true),
            UNTERMINATED_COMMENT(true),
            INVALID_ESCAPE(true),
            INVALID_NUMBER(true),
            UNEXPECTED_CHARACTER(true),
            UNEXPECTED_TOKEN(false),
            UNTERMINATED_STRUCTURE(false),
            TRAILING_CONTENT(false),
            DUPLICATE_KEY(false),
            NESTING_TOO_DEEP(false);

            private final boolean lexical;

            Kind(boolean lexical) {
                this.lexical = lexical;
            }

            public boolean isLexical() {
                return lexical;
            }
        }
    }

    /**
     * Malformed token: bad string, escape, number or character.
     *
     * @since 0.1.0
     */
    public static class LexException extends ParseException {
        public LexException(Kind kind, String reason, Span span) {
            super(kind, reason, span);
            if (!kind.isLexical()) throw new IllegalArgumentException("Not a lexical error kind: " + kind);
        }
    }

    /**
     * Well-formed tokens in an order the JSON5 grammar does not allow.
     *
     * @since 0.1.0
     */
    public static class SyntaxException extends ParseException {
        public SyntaxException(Kind kind, String reason, Span span) {
            super(kind, reason, span);
            if (kind.isLexical()) throw new IllegalArgumentException("Not a syntax error kind: " + kind);
        }
    }
}
