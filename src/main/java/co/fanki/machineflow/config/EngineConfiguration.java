package co.fanki.machineflow.config;

import co.fanki.machineflow.analysis.domain.EdgeEvaluator;
import co.fanki.machineflow.execution.domain.ExecutionLimits;
import co.fanki.machineflow.execution.domain.WaitPolicy;
import co.fanki.machineflow.expression.domain.ExpressionEvaluator;
import co.fanki.machineflow.machine.application.MachineJsonReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the engine collaborators as Spring beans.
 *
 * <p>The domain classes are plain Java; this is the only place that turns
 * them into singletons and feeds them the {@code engine.*} settings.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class EngineConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            EngineConfiguration.class);

    @Value("${engine.max-node-invocations:100}")
    private int maxNodeInvocations;

    @Value("${engine.max-steps:1000}")
    private int maxSteps;

    @Value("${engine.max-paths:100}")
    private int maxPaths;

    @Value("${engine.wait-timeout:PT0S}")
    private Duration waitTimeout;

    @Value("${engine.expression-cache-size:1024}")
    private int expressionCacheSize;

    /**
     * Creates the shared expression evaluator.
     *
     * @return the evaluator
     */
    @Bean
    public ExpressionEvaluator expressionEvaluator() {
        return new ExpressionEvaluator(expressionCacheSize);
    }

    /**
     * Creates the static edge evaluator.
     *
     * @param evaluator the expression evaluator
     * @return the edge evaluator
     */
    @Bean
    public EdgeEvaluator edgeEvaluator(final ExpressionEvaluator evaluator) {
        return new EdgeEvaluator(evaluator);
    }

    /**
     * Creates the machine JSON reader.
     *
     * @param objectMapper the Boot-configured mapper
     * @return the reader
     */
    @Bean
    public MachineJsonReader machineJsonReader(
            final ObjectMapper objectMapper) {
        return new MachineJsonReader(objectMapper);
    }

    /**
     * Builds the limits every new run is created with.
     *
     * @return the limits
     */
    @Bean
    public ExecutionLimits executionLimits() {
        final ExecutionLimits limits = new ExecutionLimits(maxNodeInvocations,
                maxSteps, maxPaths, waitTimeout);
        LOG.info("Engine limits: {}", limits);
        return limits;
    }

    @Bean
    public WaitPolicy waitPolicy() {
        return WaitPolicy.EXTERNAL_ANNOTATION;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

}
