package co.fanki.machineflow.expression.domain;

import co.fanki.machineflow.expression.domain.ExpressionLexer.Token;
import co.fanki.machineflow.expression.domain.ExpressionLexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for guard and template expressions.
 *
 * <p>Grammar, lowest precedence first:</p>
 * <pre>
 *   conditional    := or ( '?' conditional ':' conditional )?
 *   or             := and ( '||' and )*
 *   and            := relation ( '&amp;&amp;' relation )*
 *   relation       := additive ( ( == | != | &lt; | &lt;= | &gt; | &gt;= | in ) additive )*
 *   additive       := multiplicative ( ( + | - ) multiplicative )*
 *   multiplicative := unary ( ( * | / | % ) unary )*
 *   unary          := ( ! | - ) unary | postfix
 *   postfix        := primary ( '.' name [ '(' args ')' ] | '[' conditional ']' )*
 *   primary        := number | string | true | false | null
 *                   | name [ '(' args ')' ] | '(' conditional ')' | '[' args ']'
 * </pre>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ExpressionParser {

    private static final Set<TokenType> RELATIONS = EnumSet.of(
            TokenType.EQ, TokenType.NE, TokenType.LT, TokenType.LE,
            TokenType.GT, TokenType.GE, TokenType.IN);

    private static final Set<TokenType> MEMBER_NAMES = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.TRUE, TokenType.FALSE,
            TokenType.NULL, TokenType.IN);

    /** Deepest accepted nesting of parentheses, brackets and unary operators. */
    static final int MAX_DEPTH = 64;

    private final String source;

    private final List<Token> tokens;

    private int current;

    private int depth;

    private ExpressionParser(final String theSource) {
        this.source = theSource;
        this.tokens = ExpressionLexer.tokenize(theSource);
        this.current = 0;
    }

    /**
     * Parses an expression.
     *
     * @param source the expression source
     * @return the parsed expression
     * @throws ExpressionError if the source is empty or not valid
     */
    public static ParsedExpression parse(final String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionError("Empty expression",
                    source == null ? "" : source, "", 0);
        }
        final ExpressionParser parser = new ExpressionParser(source);
        final Expression root = parser.conditional();
        if (parser.peek().type() != TokenType.EOF) {
            throw parser.error("Unexpected token", parser.peek());
        }
        return new ParsedExpression(source, root);
    }

    private Expression conditional() {
        enter();
        try {
            return ternary();
        } finally {
            depth--;
        }
    }

    private Expression ternary() {
        final Expression condition = or();
        if (match(TokenType.QUESTION)) {
            final Expression whenTrue = conditional();
            expect(TokenType.COLON, "Expected ':' in conditional");
            final Expression whenFalse = conditional();
            return new Expression.Conditional(condition, whenTrue, whenFalse,
                    condition.position());
        }
        return condition;
    }

    private Expression or() {
        Expression left = and();
        while (check(TokenType.OR)) {
            final Token operator = advance();
            left = new Expression.Logical(TokenType.OR, left, and(),
                    operator.position());
        }
        return left;
    }

    private Expression and() {
        Expression left = relation();
        while (check(TokenType.AND)) {
            final Token operator = advance();
            left = new Expression.Logical(TokenType.AND, left, relation(),
                    operator.position());
        }
        return left;
    }

    private Expression relation() {
        Expression left = additive();
        while (RELATIONS.contains(peek().type())) {
            final Token operator = advance();
            left = new Expression.Binary(operator.type(), left, additive(),
                    operator.position());
        }
        return left;
    }

    private Expression additive() {
        Expression left = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            final Token operator = advance();
            left = new Expression.Binary(operator.type(), left,
                    multiplicative(), operator.position());
        }
        return left;
    }

    private Expression multiplicative() {
        Expression left = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH)
                || check(TokenType.PERCENT)) {
            final Token operator = advance();
            left = new Expression.Binary(operator.type(), left, unary(),
                    operator.position());
        }
        return left;
    }

    private Expression unary() {
        if (check(TokenType.NOT) || check(TokenType.MINUS)) {
            final Token operator = advance();
            enter();
            try {
                return new Expression.Unary(operator.type(), unary(),
                        operator.position());
            } finally {
                depth--;
            }
        }
        return postfix();
    }

    private Expression postfix() {
        Expression expression = primary();
        while (true) {
            if (match(TokenType.DOT)) {
                final Token name = peek();
                if (!MEMBER_NAMES.contains(name.type())) {
                    throw error("Expected member name after '.'", name);
                }
                advance();
                if (match(TokenType.LPAREN)) {
                    final Functions.Method method =
                            Functions.Method.bySymbol(name.text());
                    if (method == null) {
                        throw error("Unknown method", name);
                    }
                    final List<Expression> arguments = arguments(
                            TokenType.RPAREN);
                    requireArity(method.arity(), arguments, name);
                    expression = new Expression.MethodCall(expression, method,
                            arguments, name.position());
                } else {
                    expression = new Expression.Member(expression,
                            name.text(), name.position());
                }
            } else if (check(TokenType.LBRACKET)) {
                final Token bracket = advance();
                final Expression index = conditional();
                expect(TokenType.RBRACKET, "Expected ']'");
                expression = new Expression.Index(expression, index,
                        bracket.position());
            } else {
                return expression;
            }
        }
    }

    private Expression primary() {
        final Token token = peek();
        switch (token.type()) {
            case NUMBER:
                advance();
                return new Expression.Literal(Value.of(number(token)),
                        token.position());
            case STRING:
                advance();
                return new Expression.Literal(Value.of(token.text()),
                        token.position());
            case TRUE:
                advance();
                return new Expression.Literal(Value.TRUE, token.position());
            case FALSE:
                advance();
                return new Expression.Literal(Value.FALSE, token.position());
            case NULL:
                advance();
                return new Expression.Literal(Value.NULL, token.position());
            case IDENTIFIER:
                advance();
                if (match(TokenType.LPAREN)) {
                    final Functions.Function function =
                            Functions.Function.bySymbol(token.text());
                    if (function == null) {
                        throw error("Unknown function", token);
                    }
                    final List<Expression> arguments = arguments(
                            TokenType.RPAREN);
                    requireArity(function.arity(), arguments, token);
                    return new Expression.Call(function, arguments,
                            token.position());
                }
                return new Expression.Variable(token.text(), token.position());
            case LPAREN:
                advance();
                final Expression inner = conditional();
                expect(TokenType.RPAREN, "Expected ')'");
                return inner;
            case LBRACKET:
                advance();
                return new Expression.ListLiteral(
                        arguments(TokenType.RBRACKET), token.position());
            case EOF:
                throw error("Unexpected end of expression", token);
            default:
                throw error("Unexpected token", token);
        }
    }

    private double number(final Token token) {
        try {
            return Double.parseDouble(token.text());
        } catch (final NumberFormatException e) {
            throw error("Malformed number", token);
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("Expression nested deeper than " + MAX_DEPTH, peek());
        }
    }

    private List<Expression> arguments(final TokenType closing) {
        final List<Expression> arguments = new ArrayList<>();
        if (match(closing)) {
            return arguments;
        }
        do {
            arguments.add(conditional());
        } while (match(TokenType.COMMA));
        expect(closing, "Expected '" + (closing == TokenType.RPAREN
                ? ")" : "]") + "'");
        return arguments;
    }

    private void requireArity(final int arity,
            final List<Expression> arguments, final Token name) {
        if (arguments.size() != arity) {
            throw error(name.text() + " expects " + arity
                    + " argument(s), got " + arguments.size(), name);
        }
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean check(final TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        final Token token = tokens.get(current);
        if (token.type() != TokenType.EOF) {
            current++;
        }
        return token;
    }

    private boolean match(final TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(final TokenType type, final String message) {
        if (!match(type)) {
            throw error(message, peek());
        }
    }

    private ExpressionError error(final String message, final Token token) {
        final int at = token.position();
        final String fragment = token.type() == TokenType.EOF
                ? "<end>"
                : source.substring(at, Math.min(source.length(), at + 10));
        return new ExpressionError(message, source, fragment, at);
    }

}
