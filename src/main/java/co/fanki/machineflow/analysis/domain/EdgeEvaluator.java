package co.fanki.machineflow.analysis.domain;

import co.fanki.machineflow.expression.domain.ExpressionError;
import co.fanki.machineflow.expression.domain.ExpressionEvaluator;
import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.expression.domain.VariableContext;
import co.fanki.machineflow.machine.domain.Attribute;
import co.fanki.machineflow.machine.domain.AttributeValues;
import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.machine.domain.MachineContexts;
import co.fanki.machineflow.machine.domain.MachineEdge;
import co.fanki.machineflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Previews which edges are active before any run, using a static context.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class EdgeEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(
            EdgeEvaluator.class);

    private final ExpressionEvaluator expressionEvaluator;

    /**
     * Creates a new EdgeEvaluator.
     *
     * @param theExpressionEvaluator the evaluator for guards
     */
    public EdgeEvaluator(final ExpressionEvaluator theExpressionEvaluator) {
        this.expressionEvaluator = Preconditions.requireNonNull(
                theExpressionEvaluator, "Expression evaluator is required");
    }

    /**
     * The preview of one edge.
     *
     * @param active whether the edge would be taken
     * @param hasCondition whether the edge carries a guard
     * @param condition the guard, null when absent
     * @param error the evaluation error, null when the guard evaluated
     */
    public record EdgeEvaluation(boolean active, boolean hasCondition,
            String condition, String error) {}

    /**
     * Evaluates an edge guard against a static context.
     *
     * <p>Unguarded edges are active. A guard that fails to evaluate makes
     * the edge inactive and carries the error message.</p>
     *
     * @param edge the edge
     * @param context the static context
     * @return the preview
     */
    public EdgeEvaluation evaluateEdge(final MachineEdge edge,
            final VariableContext context) {
        if (!edge.hasGuard()) {
            return new EdgeEvaluation(true, false, null, null);
        }
        try {
            final boolean active = expressionEvaluator.evaluateCondition(
                    edge.guard(), context);
            return new EdgeEvaluation(active, true, edge.guard(), null);
        } catch (final ExpressionError e) {
            LOG.warn("Failed to evaluate edge condition {}: {}", edge.guard(),
                    e.getMessage());
            return new EdgeEvaluation(false, true, edge.guard(),
                    e.getMessage());
        }
    }

    /**
     * Evaluates every edge of a machine against its static context.
     *
     * @param machine the machine
     * @return one preview per edge, in edge order
     */
    public List<EdgeEvaluation> evaluateEdges(final Machine machine) {
        final VariableContext context = staticContext(machine);
        final List<EdgeEvaluation> evaluations = new ArrayList<>();
        for (final MachineEdge edge : machine.edges()) {
            evaluations.add(evaluateEdge(edge, context));
        }
        return evaluations;
    }

    /**
     * Builds the context a machine is previewed with: the declared node
     * attribute defaults plus {@link #createDefaultContext(List)} of the
     * machine attributes.
     *
     * @param machine the machine
     * @return the context
     */
    public VariableContext staticContext(final Machine machine) {
        return MachineContexts.attributeDefaults(machine,
                VariableContext.builder())
                .putAll(createDefaultContext(machine.attributes()))
                .build();
    }

    /**
     * Builds a static context from machine-level attributes.
     *
     * <p>Metadata attributes such as {@code description} or {@code prompt}
     * are skipped. String values lose their surrounding quotes. The
     * attributes {@code errorCount} and {@code activeState}, when present,
     * override the defaults of zero and the empty string.</p>
     *
     * @param attributes the machine attributes, may be null
     * @return the context
     */
    public VariableContext createDefaultContext(
            final List<Attribute> attributes) {
        final VariableContext.Builder builder = VariableContext.builder();
        Value errorCount = Value.of(0);
        Value activeState = Value.of("");
        if (attributes != null) {
            for (final Attribute attribute : attributes) {
                if (MachineContexts.METADATA_ATTRIBUTES.contains(
                        attribute.name())) {
                    continue;
                }
                Value value = attribute.value();
                if (value.isString()) {
                    value = Value.of(AttributeValues.stripQuotes(
                            value.asString()));
                }
                builder.put("attributes." + attribute.name(), value);
                builder.put(attribute.name(), value);
                if (MachineContexts.ERROR_COUNT.equals(attribute.name())) {
                    final Double number = value.numericValue();
                    errorCount = Value.of(number == null ? 0 : number);
                } else if (MachineContexts.ACTIVE_STATE.equals(
                        attribute.name())) {
                    activeState = Value.of(value.render());
                }
            }
        }
        return builder
                .put(MachineContexts.ERROR_COUNT, errorCount)
                .put(MachineContexts.ERRORS, errorCount)
                .put(MachineContexts.ACTIVE_STATE, activeState)
                .build();
    }

}
