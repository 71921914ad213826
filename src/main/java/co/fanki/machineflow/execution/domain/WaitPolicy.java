package co.fanki.machineflow.execution.domain;

import co.fanki.machineflow.machine.domain.MachineNode;

/**
 * Decides whether a path must wait after entering a node.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface WaitPolicy {

    /**
     * Waits on nodes annotated with {@code @external}, whose work is done
     * outside the engine and reported back through resume.
     */
    WaitPolicy EXTERNAL_ANNOTATION = (node, path) ->
            node.hasAnnotation("external");

    /**
     * Whether the path waits on the node it just entered.
     *
     * @param node the entered node
     * @param path the path, already on the node
     * @return true to suspend the path
     */
    boolean shouldWait(MachineNode node, ExecutionPath path);

    /**
     * Combines this policy with another one; either may request a wait.
     *
     * @param other the other policy
     * @return the combined policy
     */
    default WaitPolicy or(final WaitPolicy other) {
        return (node, path) -> shouldWait(node, path)
                || other.shouldWait(node, path);
    }

}
