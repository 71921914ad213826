package co.fanki.machineflow.expression.domain;

import co.fanki.machineflow.expression.domain.Expression.EvaluationFailure;

/**
 * A parsed expression together with its source text.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ParsedExpression {

    private final String source;

    private final Expression root;

    ParsedExpression(final String theSource, final Expression theRoot) {
        this.source = theSource;
        this.root = theRoot;
    }

    /**
     * Returns the source text.
     *
     * @return the source
     */
    public String source() {
        return source;
    }

    /**
     * Returns the root node of the tree.
     *
     * @return the root
     */
    public Expression root() {
        return root;
    }

    /**
     * Evaluates the expression.
     *
     * @param context the variables
     * @return the value, possibly {@link Value#UNDEFINED}
     * @throws ExpressionError on a type error
     */
    public Value evaluate(final VariableContext context) {
        try {
            return root.evaluate(context);
        } catch (final EvaluationFailure e) {
            final int at = Math.max(0, Math.min(e.getPosition(),
                    source.length()));
            throw new ExpressionError(e.getMessage(), source,
                    source.substring(at, Math.min(source.length(), at + 10)),
                    e.getPosition());
        }
    }

}
