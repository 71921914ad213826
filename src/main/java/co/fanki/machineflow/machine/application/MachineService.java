package co.fanki.machineflow.machine.application;

import co.fanki.machineflow.analysis.domain.EdgeEvaluator;
import co.fanki.machineflow.analysis.domain.EdgeEvaluator.EdgeEvaluation;
import co.fanki.machineflow.analysis.domain.GraphAnalyzer;
import co.fanki.machineflow.analysis.domain.GraphStatistics;
import co.fanki.machineflow.analysis.domain.GraphValidationResult;
import co.fanki.machineflow.analysis.domain.StructuralWarning;
import co.fanki.machineflow.expression.domain.ExpressionEvaluator;
import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.expression.domain.VariableContext;
import co.fanki.machineflow.machine.domain.Machine;
import co.fanki.machineflow.machine.domain.MachineEdge;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Application service for loading machines and analysing them statically.
 *
 * <p>Every query resolves the machine through the {@link MachineRegistry}
 * by id or name and builds a fresh {@link GraphAnalyzer}; machines are
 * immutable, so nothing needs to be invalidated.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class MachineService {

    private static final Logger LOG = LoggerFactory.getLogger(
            MachineService.class);

    private final MachineJsonReader machineJsonReader;

    private final MachineRegistry machineRegistry;

    private final ExpressionEvaluator expressionEvaluator;

    private final EdgeEvaluator edgeEvaluator;

    /**
     * Creates a new MachineService.
     *
     * @param theMachineJsonReader the JSON reader
     * @param theMachineRegistry the registry
     * @param theExpressionEvaluator the expression evaluator
     * @param theEdgeEvaluator the static edge evaluator
     */
    public MachineService(final MachineJsonReader theMachineJsonReader,
            final MachineRegistry theMachineRegistry,
            final ExpressionEvaluator theExpressionEvaluator,
            final EdgeEvaluator theEdgeEvaluator) {
        this.machineJsonReader = theMachineJsonReader;
        this.machineRegistry = theMachineRegistry;
        this.expressionEvaluator = theExpressionEvaluator;
        this.edgeEvaluator = theEdgeEvaluator;
    }

    /**
     * Reads and registers a machine.
     *
     * @param name the name to register it under, may be null
     * @param json the machine JSON
     * @return the registration
     */
    public RegisteredMachine register(final String name, final JsonNode json) {
        final Machine machine = machineJsonReader.read(json);
        final RegisteredMachine registered = machineRegistry.register(name,
                machine);

        final List<StructuralWarning> warnings =
                new GraphAnalyzer(machine).structuralWarnings();
        if (!warnings.isEmpty()) {
            LOG.info("Machine '{}' registered with {} structural warning(s)",
                    registered.name(), warnings.size());
        }
        return registered;
    }

    public RegisteredMachine get(final String idOrName) {
        return machineRegistry.resolve(idOrName);
    }

    public List<RegisteredMachine> list() {
        return machineRegistry.list();
    }

    public boolean remove(final String id) {
        return machineRegistry.remove(id);
    }

    public GraphValidationResult validate(final String idOrName) {
        return analyzer(idOrName).validate();
    }

    public GraphStatistics statistics(final String idOrName) {
        return analyzer(idOrName).statistics();
    }

    public List<StructuralWarning> warnings(final String idOrName) {
        return analyzer(idOrName).structuralWarnings();
    }

    /**
     * Finds the shortest path between two nodes.
     *
     * @param idOrName the machine
     * @param source the source node
     * @param target the target node
     * @return the node names, empty when unreachable
     */
    public List<String> path(final String idOrName, final String source,
            final String target) {
        return analyzer(idOrName).findPath(source, target);
    }

    /**
     * Previews every edge against the machine's static context.
     *
     * @param idOrName the machine
     * @return one preview per edge, in declaration order
     */
    public List<EdgePreview> previewEdges(final String idOrName) {
        final Machine machine = get(idOrName).machine();
        final List<EdgeEvaluation> evaluations =
                edgeEvaluator.evaluateEdges(machine);
        final List<EdgePreview> previews = new ArrayList<>();
        for (int i = 0; i < evaluations.size(); i++) {
            final MachineEdge edge = machine.edges().get(i);
            final EdgeEvaluation evaluation = evaluations.get(i);
            previews.add(new EdgePreview(edge.source(), edge.target(),
                    edge.label(), evaluation.active(),
                    evaluation.hasCondition(), evaluation.condition(),
                    evaluation.error()));
        }
        return previews;
    }

    /**
     * Evaluates a condition against the static context, overlaid with the
     * given variables.
     *
     * @param idOrName the machine
     * @param condition the condition
     * @param variables extra variables, may be null
     * @return the truthiness of the result
     * @throws co.fanki.machineflow.expression.domain.ExpressionError when
     *         the condition is not valid
     */
    public boolean evaluateCondition(final String idOrName,
            final String condition, final Map<String, Object> variables) {
        return expressionEvaluator.evaluateCondition(condition,
                context(idOrName, variables));
    }

    /**
     * Evaluates an expression against the static context.
     *
     * @param idOrName the machine
     * @param expression the expression
     * @param variables extra variables, may be null
     * @return the value
     */
    public Value evaluate(final String idOrName, final String expression,
            final Map<String, Object> variables) {
        return expressionEvaluator.evaluate(expression,
                context(idOrName, variables));
    }

    /**
     * Resolves a template against the static context.
     *
     * @param idOrName the machine
     * @param template the template text
     * @param variables extra variables, may be null
     * @return the resolved text
     */
    public String resolveTemplate(final String idOrName,
            final String template, final Map<String, Object> variables) {
        return expressionEvaluator.resolveTemplate(template,
                context(idOrName, variables));
    }

    private VariableContext context(final String idOrName,
            final Map<String, Object> variables) {
        final VariableContext base = edgeEvaluator.staticContext(
                get(idOrName).machine());
        if (variables == null || variables.isEmpty()) {
            return base;
        }
        return VariableContext.builder()
                .putAll(base)
                .putAll(VariableContext.fromJava(variables))
                .build();
    }

    private GraphAnalyzer analyzer(final String idOrName) {
        return new GraphAnalyzer(get(idOrName).machine());
    }

    /**
     * Static preview of one edge.
     *
     * @param source the source node
     * @param target the target node
     * @param label the label
     * @param active whether the edge would be taken
     * @param hasCondition whether the edge has a guard
     * @param condition the guard
     * @param error the evaluation error
     */
    public record EdgePreview(String source, String target, String label,
            boolean active, boolean hasCondition, String condition,
            String error) {}

}
