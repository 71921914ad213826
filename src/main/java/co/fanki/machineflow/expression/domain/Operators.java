package co.fanki.machineflow.expression.domain;

import co.fanki.machineflow.expression.domain.Expression.EvaluationFailure;
import co.fanki.machineflow.expression.domain.ExpressionLexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Semantics of the binary operators.
 *
 * <p>Comparisons and membership tests involving {@link Value#UNDEFINED}
 * are false. A numeric-looking string compared with a number is read as a
 * number; two strings compare as text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class Operators {

    private Operators() {
    }

    static Value apply(final TokenType operator, final Value left,
            final Value right, final int position) {
        switch (operator) {
            case EQ:
                if (left.isUndefined() || right.isUndefined()) {
                    return Value.FALSE;
                }
                return Value.of(equal(left, right));
            case NE:
                if (left.isUndefined() || right.isUndefined()) {
                    return Value.FALSE;
                }
                return Value.of(!equal(left, right));
            case LT:
            case LE:
            case GT:
            case GE:
                return order(operator, left, right, position);
            case IN:
                return membership(left, right, position);
            case PLUS:
                return plus(left, right, position);
            case MINUS:
            case STAR:
            case SLASH:
            case PERCENT:
                return arithmetic(operator, left, right, position);
            default:
                throw new EvaluationFailure(
                        "Unsupported operator " + operator, position);
        }
    }

    static boolean equal(final Value left, final Value right) {
        if (left.kind() == right.kind()) {
            if (left.isNumber()) {
                return left.asNumber() == right.asNumber();
            }
            return left.equals(right);
        }
        if (left.isNumber() || right.isNumber()) {
            final Double a = left.numericValue();
            final Double b = right.numericValue();
            return a != null && b != null && a.doubleValue() == b.doubleValue();
        }
        return false;
    }

    private static Value order(final TokenType operator, final Value left,
            final Value right, final int position) {
        if (left.isUndefined() || right.isUndefined()
                || left.isNull() || right.isNull()) {
            return Value.FALSE;
        }
        final int comparison;
        if (left.isString() && right.isString()) {
            comparison = left.asString().compareTo(right.asString());
        } else {
            final Double a = left.numericValue();
            final Double b = right.numericValue();
            if (a == null || b == null || left.isBoolean()
                    || right.isBoolean()) {
                throw new EvaluationFailure("Cannot compare " + left.kind()
                        + " with " + right.kind(), position);
            }
            if (Double.isNaN(a) || Double.isNaN(b)) {
                return Value.FALSE;
            }
            comparison = Double.compare(a, b);
        }
        return switch (operator) {
            case LT -> Value.of(comparison < 0);
            case LE -> Value.of(comparison <= 0);
            case GT -> Value.of(comparison > 0);
            default -> Value.of(comparison >= 0);
        };
    }

    private static Value membership(final Value element,
            final Value container, final int position) {
        if (element.isUndefined() || container.isUndefined()) {
            return Value.FALSE;
        }
        if (container.isList()) {
            for (final Value item : container.asList()) {
                if (equal(element, item)) {
                    return Value.TRUE;
                }
            }
            return Value.FALSE;
        }
        if (container.isMap()) {
            return Value.of(container.asMap().containsKey(element.render()));
        }
        if (container.isString()) {
            return Value.of(container.asString().contains(element.render()));
        }
        if (container.isNull()) {
            return Value.FALSE;
        }
        throw new EvaluationFailure(
                "Cannot test membership in " + container.kind(), position);
    }

    private static Value plus(final Value left, final Value right,
            final int position) {
        if (left.isUndefined() || right.isUndefined()) {
            return Value.UNDEFINED;
        }
        if (left.isString() || right.isString()) {
            return Value.of(left.render() + right.render());
        }
        if (left.isNumber() && right.isNumber()) {
            return Value.of(left.asNumber() + right.asNumber());
        }
        if (left.isList() && right.isList()) {
            final List<Value> items = new ArrayList<>(left.asList());
            items.addAll(right.asList());
            return Value.list(items);
        }
        throw new EvaluationFailure("Cannot add " + left.kind() + " and "
                + right.kind(), position);
    }

    private static Value arithmetic(final TokenType operator,
            final Value left, final Value right, final int position) {
        if (left.isUndefined() || right.isUndefined()) {
            return Value.UNDEFINED;
        }
        final Double a = left.numericValue();
        final Double b = right.numericValue();
        if (a == null || b == null) {
            throw new EvaluationFailure("Arithmetic needs numbers, got "
                    + left.kind() + " and " + right.kind(), position);
        }
        return switch (operator) {
            case MINUS -> Value.of(a - b);
            case STAR -> Value.of(a * b);
            case SLASH -> {
                if (b == 0) {
                    throw new EvaluationFailure("Division by zero", position);
                }
                yield Value.of(a / b);
            }
            default -> {
                if (b == 0) {
                    throw new EvaluationFailure("Modulo by zero", position);
                }
                yield Value.of(a % b);
            }
        };
    }

}
