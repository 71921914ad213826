package co.fanki.machineflow.shared;

import java.io.Serializable;

/**
 * Marker for immutable model values: node attributes, annotations,
 * transitions and evaluated expression values.
 *
 * <p>Implementations compare by value and validate in their
 * constructors.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
