package co.fanki.machineflow.expression.domain;

import co.fanki.machineflow.shared.DomainException;

/**
 * Raised when a guard or template expression cannot be parsed or
 * evaluated.
 *
 * <p>Carries the offending fragment and its offset in the source. Callers
 * at the guard and template boundaries recover from it: the edge is
 * treated as ineligible, the template span is left verbatim.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ExpressionError extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code of every expression error. */
    public static final String CODE = "EXPRESSION_ERROR";

    private final String expression;

    private final String fragment;

    private final int position;

    /**
     * Creates a new expression error.
     *
     * @param message what went wrong
     * @param theExpression the full expression source
     * @param theFragment the offending fragment
     * @param thePosition the offset of the fragment, -1 if unknown
     */
    public ExpressionError(final String message, final String theExpression,
            final String theFragment, final int thePosition) {
        super(message + " near '" + theFragment + "'"
                + (thePosition >= 0 ? " at " + thePosition : "")
                + " in: " + theExpression, CODE);
        this.expression = theExpression;
        this.fragment = theFragment;
        this.position = thePosition;
    }

    /**
     * Returns the full expression source.
     *
     * @return the expression
     */
    public String getExpression() {
        return expression;
    }

    /**
     * Returns the offending fragment.
     *
     * @return the fragment
     */
    public String getFragment() {
        return fragment;
    }

    /**
     * Returns the offset of the offending fragment.
     *
     * @return the offset, -1 if unknown
     */
    public int getPosition() {
        return position;
    }

}
