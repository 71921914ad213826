package co.fanki.machineflow.expression.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of a parsed expression tree.
 *
 * <p>Nodes are immutable and evaluate themselves against a
 * {@link VariableContext}. Evaluation never throws for missing variables:
 * those resolve to {@link Value#UNDEFINED}. Type errors raise an
 * {@link EvaluationFailure}, which {@link ParsedExpression} turns into an
 * {@link ExpressionError} carrying the source text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface Expression {

    /**
     * Evaluates this node.
     *
     * @param context the variables
     * @return the value, possibly {@link Value#UNDEFINED}
     * @throws EvaluationFailure on a type error
     */
    Value evaluate(VariableContext context);

    /**
     * Returns the offset of this node in the source.
     *
     * @return the offset
     */
    int position();

    /** A literal. */
    record Literal(Value value, int position) implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            return value;
        }
    }

    /** A root variable reference. */
    record Variable(String name, int position) implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            return context.lookup(name);
        }
    }

    /** Member access, {@code target.name}. */
    record Member(Expression target, String name, int position)
            implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            return target.evaluate(context).member(name);
        }
    }

    /** Index access, {@code target[index]}. */
    record Index(Expression target, Expression index, int position)
            implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            final Value container = target.evaluate(context);
            final Value key = index.evaluate(context);
            if (container.isUndefined() || key.isUndefined()) {
                return Value.UNDEFINED;
            }
            if (container.isMap()) {
                return container.member(key.render());
            }
            if (container.isList()) {
                final Double number = key.numericValue();
                if (number == null) {
                    throw new EvaluationFailure(
                            "List index must be a number", position);
                }
                final int at = number.intValue();
                final List<Value> items = container.asList();
                if (at < 0 || at >= items.size()) {
                    return Value.UNDEFINED;
                }
                return items.get(at);
            }
            return Value.UNDEFINED;
        }
    }

    /** Unary operator, {@code !x} or {@code -x}. */
    record Unary(ExpressionLexer.TokenType operator, Expression operand,
            int position) implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            final Value value = operand.evaluate(context);
            if (operator == ExpressionLexer.TokenType.NOT) {
                return Value.of(!value.truthy());
            }
            if (value.isUndefined()) {
                return Value.UNDEFINED;
            }
            final Double number = value.numericValue();
            if (number == null) {
                throw new EvaluationFailure(
                        "Cannot negate " + value.kind(), position);
            }
            return Value.of(-number);
        }
    }

    /** Arithmetic, comparison or membership operator. */
    record Binary(ExpressionLexer.TokenType operator, Expression left,
            Expression right, int position) implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            return Operators.apply(operator, left.evaluate(context),
                    right.evaluate(context), position);
        }
    }

    /** Short-circuit {@code &&} and {@code ||}. */
    record Logical(ExpressionLexer.TokenType operator, Expression left,
            Expression right, int position) implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            final boolean first = left.evaluate(context).truthy();
            if (operator == ExpressionLexer.TokenType.AND) {
                return Value.of(first && right.evaluate(context).truthy());
            }
            return Value.of(first || right.evaluate(context).truthy());
        }
    }

    /** Ternary {@code condition ? whenTrue : whenFalse}. */
    record Conditional(Expression condition, Expression whenTrue,
            Expression whenFalse, int position) implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            return condition.evaluate(context).truthy()
                    ? whenTrue.evaluate(context)
                    : whenFalse.evaluate(context);
        }
    }

    /** List literal, {@code [a, b]}. */
    record ListLiteral(List<Expression> items, int position)
            implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            final List<Value> values = new ArrayList<>();
            for (final Expression item : items) {
                values.add(item.evaluate(context));
            }
            return Value.list(values);
        }
    }

    /** Global function call, e.g. {@code has(a.b)} or {@code size(x)}. */
    record Call(Functions.Function function, List<Expression> arguments,
            int position) implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            final List<Value> values = new ArrayList<>();
            for (final Expression argument : arguments) {
                values.add(argument.evaluate(context));
            }
            return Functions.call(function, values, position);
        }
    }

    /** Method call on a value, e.g. {@code name.startsWith('a')}. */
    record MethodCall(Expression target, Functions.Method method,
            List<Expression> arguments, int position) implements Expression {

        @Override
        public Value evaluate(final VariableContext context) {
            final Value receiver = target.evaluate(context);
            final List<Value> values = new ArrayList<>();
            for (final Expression argument : arguments) {
                values.add(argument.evaluate(context));
            }
            return Functions.invoke(method, receiver, values, position);
        }
    }

    /**
     * Type error raised while evaluating a node.
     */
    final class EvaluationFailure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final int position;

        /**
         * Creates a new failure.
         *
         * @param message what went wrong
         * @param thePosition the offset of the failing node
         */
        public EvaluationFailure(final String message, final int thePosition) {
            super(message);
            this.position = thePosition;
        }

        /**
         * Returns the offset of the failing node.
         *
         * @return the offset
         */
        public int getPosition() {
            return position;
        }
    }

}
