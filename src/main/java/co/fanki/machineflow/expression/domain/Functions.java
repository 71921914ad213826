package co.fanki.machineflow.expression.domain;

import co.fanki.machineflow.expression.domain.Expression.EvaluationFailure;

import java.util.List;

/**
 * Built-in functions and methods available to expressions.
 *
 * <p>Functions: {@code has(x)} (existence check), {@code size(x)},
 * {@code string(x)}, {@code int(x)}. Methods on strings and lists:
 * {@code contains}, {@code startsWith}, {@code endsWith},
 * {@code size}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Functions {

    private Functions() {
    }

    /** Global functions. */
    public enum Function {
        HAS("has", 1), SIZE("size", 1), STRING("string", 1), INT("int", 1);

        private final String symbol;
        private final int arity;

        Function(final String theSymbol, final int theArity) {
            this.symbol = theSymbol;
            this.arity = theArity;
        }

        public String symbol() {
            return symbol;
        }

        public int arity() {
            return arity;
        }

        /**
         * Finds a function by name.
         *
         * @param name the name used in the expression
         * @return the function, or null if unknown
         */
        public static Function bySymbol(final String name) {
            for (final Function function : values()) {
                if (function.symbol.equals(name)) {
                    return function;
                }
            }
            return null;
        }
    }

    /** Methods invoked on a receiver. */
    public enum Method {
        CONTAINS("contains", 1), STARTS_WITH("startsWith", 1),
        ENDS_WITH("endsWith", 1), SIZE("size", 0);

        private final String symbol;
        private final int arity;

        Method(final String theSymbol, final int theArity) {
            this.symbol = theSymbol;
            this.arity = theArity;
        }

        public String symbol() {
            return symbol;
        }

        public int arity() {
            return arity;
        }

        /**
         * Finds a method by name.
         *
         * @param name the name used in the expression
         * @return the method, or null if unknown
         */
        public static Method bySymbol(final String name) {
            for (final Method method : values()) {
                if (method.symbol.equals(name)) {
                    return method;
                }
            }
            return null;
        }
    }

    static Value call(final Function function, final List<Value> arguments,
            final int position) {
        final Value argument = arguments.get(0);
        switch (function) {
            case HAS:
                return Value.of(!argument.isUndefined());
            case SIZE:
                return size(argument, position);
            case STRING:
                if (argument.isUndefined()) {
                    return Value.UNDEFINED;
                }
                return Value.of(argument.render());
            default:
                if (argument.isUndefined()) {
                    return Value.UNDEFINED;
                }
                final Double number = argument.numericValue();
                if (number == null) {
                    throw new EvaluationFailure("Cannot convert "
                            + argument.kind() + " to int", position);
                }
                return Value.of((double) number.longValue());
        }
    }

    static Value invoke(final Method method, final Value receiver,
            final List<Value> arguments, final int position) {
        if (receiver.isUndefined()) {
            return Value.UNDEFINED;
        }
        if (method == Method.SIZE) {
            return size(receiver, position);
        }
        final Value argument = arguments.get(0);
        if (argument.isUndefined()) {
            return Value.FALSE;
        }
        if (receiver.isList() && method == Method.CONTAINS) {
            for (final Value item : receiver.asList()) {
                if (Operators.equal(item, argument)) {
                    return Value.TRUE;
                }
            }
            return Value.FALSE;
        }
        if (!receiver.isString()) {
            throw new EvaluationFailure(method.symbol()
                    + "() is not defined on " + receiver.kind(), position);
        }
        final String text = receiver.asString();
        final String other = argument.render();
        return switch (method) {
            case CONTAINS -> Value.of(text.contains(other));
            case STARTS_WITH -> Value.of(text.startsWith(other));
            default -> Value.of(text.endsWith(other));
        };
    }

    private static Value size(final Value value, final int position) {
        return switch (value.kind()) {
            case UNDEFINED -> Value.UNDEFINED;
            case STRING -> Value.of(value.asString().length());
            case LIST -> Value.of(value.asList().size());
            case MAP -> Value.of(value.asMap().size());
            default -> throw new EvaluationFailure(
                    "size() is not defined on " + value.kind(), position);
        };
    }

}
