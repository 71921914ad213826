package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.shared.ValueObject;

import java.time.Instant;

/**
 * One history entry of a path.
 *
 * @param from the node left
 * @param to the node entered
 * @param transitionLabel why the move happened
 * @param timestamp when it happened
 * @param output the result recorded for the entered node, null if none
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Transition(String from, String to, String transitionLabel,
        Instant timestamp, String output) implements ValueObject {

    /**
     * Returns a copy carrying an output.
     *
     * @param theOutput the output
     * @return the new entry
     */
    public Transition withOutput(final String theOutput) {
        return new Transition(from, to, transitionLabel, timestamp, theOutput);
    }

}
