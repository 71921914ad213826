package co.fanki.machineflow.expression.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a guard or template expression into tokens.
 *
 * <p>Recognizes number and string literals (single or double quoted, with
 * backslash escapes), identifiers, the keywords {@code true},
 * {@code false}, {@code null} and {@code in}, and the operators
 * {@code && || ! == != < <= > >= + - * / % . , ( ) [ ] ? :}. The
 * JavaScript spellings {@code ===} and {@code !==} lex as {@code ==} and
 * {@code !=}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExpressionLexer {

    /** Token types produced by the lexer. */
    public enum TokenType {
        NUMBER, STRING, IDENTIFIER, TRUE, FALSE, NULL, IN,
        AND, OR, NOT, EQ, NE, LT, LE, GT, GE,
        PLUS, MINUS, STAR, SLASH, PERCENT,
        DOT, COMMA, LPAREN, RPAREN, LBRACKET, RBRACKET, QUESTION, COLON,
        EOF
    }

    /**
     * A single token.
     *
     * @param type the token type
     * @param text the token text; for strings, the unescaped content
     * @param position the offset of the token in the source
     */
    public record Token(TokenType type, String text, int position) {}

    /** Longest accepted expression, in tokens. */
    static final int MAX_TOKENS = 1024;

    private final String source;

    private int index;

    private ExpressionLexer(final String theSource) {
        this.source = theSource;
        this.index = 0;
    }

    /**
     * Tokenizes an expression. The returned list always ends with an
     * {@link TokenType#EOF} token.
     *
     * @param source the expression source
     * @return the tokens
     * @throws ExpressionError on an unexpected character, an unterminated
     *         string or an expression over {@link #MAX_TOKENS} tokens
     */
    public static List<Token> tokenize(final String source) {
        return new ExpressionLexer(source).run();
    }

    private List<Token> run() {
        final List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (index >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", index));
                return Collections.unmodifiableList(tokens);
            }
            if (tokens.size() >= MAX_TOKENS) {
                throw error("Expression longer than " + MAX_TOKENS
                        + " tokens", index);
            }
            tokens.add(next());
        }
    }

    private Token next() {
        final int start = index;
        final char c = source.charAt(index);

        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return number(start);
        }
        if (c == '\'' || c == '"') {
            return string(start, c);
        }
        if (isIdentifierStart(c)) {
            return identifier(start);
        }

        switch (c) {
            case '&':
                return pair(start, '&', TokenType.AND);
            case '|':
                return pair(start, '|', TokenType.OR);
            case '=':
                if (peek(1) == '=') {
                    index += peek(2) == '=' ? 3 : 2;
                    return new Token(TokenType.EQ, "==", start);
                }
                throw error("Unexpected '='; use '==' to compare", start);
            case '!':
                if (peek(1) == '=') {
                    index += peek(2) == '=' ? 3 : 2;
                    return new Token(TokenType.NE, "!=", start);
                }
                return single(start, TokenType.NOT);
            case '<':
                if (peek(1) == '=') {
                    index += 2;
                    return new Token(TokenType.LE, "<=", start);
                }
                return single(start, TokenType.LT);
            case '>':
                if (peek(1) == '=') {
                    index += 2;
                    return new Token(TokenType.GE, ">=", start);
                }
                return single(start, TokenType.GT);
            case '+':
                return single(start, TokenType.PLUS);
            case '-':
                return single(start, TokenType.MINUS);
            case '*':
                return single(start, TokenType.STAR);
            case '/':
                return single(start, TokenType.SLASH);
            case '%':
                return single(start, TokenType.PERCENT);
            case '.':
                return single(start, TokenType.DOT);
            case ',':
                return single(start, TokenType.COMMA);
            case '(':
                return single(start, TokenType.LPAREN);
            case ')':
                return single(start, TokenType.RPAREN);
            case '[':
                return single(start, TokenType.LBRACKET);
            case ']':
                return single(start, TokenType.RBRACKET);
            case '?':
                return single(start, TokenType.QUESTION);
            case ':':
                return single(start, TokenType.COLON);
            default:
                throw error("Unexpected character", start);
        }
    }

    private Token number(final int start) {
        while (isDigit(peek(0))) {
            index++;
        }
        if (peek(0) == '.' && isDigit(peek(1))) {
            index++;
            while (isDigit(peek(0))) {
                index++;
            }
        }
        if (peek(0) == 'e' || peek(0) == 'E') {
            final int exponentStart = index;
            index++;
            if (peek(0) == '+' || peek(0) == '-') {
                index++;
            }
            if (!isDigit(peek(0))) {
                throw error("Malformed exponent", exponentStart);
            }
            while (isDigit(peek(0))) {
                index++;
            }
        }
        return new Token(TokenType.NUMBER, source.substring(start, index),
                start);
    }

    private Token string(final int start, final char quote) {
        final StringBuilder text = new StringBuilder();
        index++;
        while (index < source.length()) {
            final char c = source.charAt(index);
            if (c == quote) {
                index++;
                return new Token(TokenType.STRING, text.toString(), start);
            }
            if (c == '\\' && index + 1 < source.length()) {
                final char escaped = source.charAt(index + 1);
                switch (escaped) {
                    case 'n' -> text.append('\n');
                    case 't' -> text.append('\t');
                    case 'r' -> text.append('\r');
                    default -> text.append(escaped);
                }
                index += 2;
                continue;
            }
            text.append(c);
            index++;
        }
        throw error("Unterminated string literal", start);
    }

    private Token identifier(final int start) {
        while (index < source.length()
                && isIdentifierPart(source.charAt(index))) {
            index++;
        }
        final String word = source.substring(start, index);
        final TokenType type = switch (word) {
            case "true" -> TokenType.TRUE;
            case "false" -> TokenType.FALSE;
            case "null" -> TokenType.NULL;
            case "in" -> TokenType.IN;
            default -> TokenType.IDENTIFIER;
        };
        return new Token(type, word, start);
    }

    private Token pair(final int start, final char expected,
            final TokenType type) {
        if (peek(1) != expected) {
            throw error("Unexpected character; expected '" + expected
                    + expected + "'", start);
        }
        index += 2;
        return new Token(type, source.substring(start, index), start);
    }

    private Token single(final int start, final TokenType type) {
        index++;
        return new Token(type, source.substring(start, index), start);
    }

    private void skipWhitespace() {
        while (index < source.length()
                && Character.isWhitespace(source.charAt(index))) {
            index++;
        }
    }

    private char peek(final int offset) {
        final int at = index + offset;
        return at < source.length() ? source.charAt(at) : '\0';
    }

    private ExpressionError error(final String message, final int at) {
        final int end = Math.min(source.length(), at + 10);
        return new ExpressionError(message, source,
                source.substring(at, end), at);
    }

    /** Only ASCII digits start or continue a number literal. */
    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(final char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(final char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

}
