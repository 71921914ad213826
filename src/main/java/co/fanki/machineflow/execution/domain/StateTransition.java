package co.fanki.machineflow.execution.domain;

import java.time.Instant;

/**
 * Records that a path entered a state node.
 *
 * @param stateName the state entered
 * @param timestamp when
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record StateTransition(String stateName, Instant timestamp) {}
