package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.shared.Preconditions;
import co.fanki.machineflow.shared.ValueObject;

/**
 * An annotation such as {@code @external} or {@code @maxSteps(3)}.
 *
 * @param name the annotation name, without the leading {@code @}
 * @param value the optional argument, null when absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Annotation(String name, String value) implements ValueObject {

    public Annotation {
        Preconditions.requireNonBlank(name, "Annotation name is required");
        name = name.startsWith("@") ? name.substring(1) : name;
    }

    /**
     * Creates an annotation without a value.
     *
     * @param name the annotation name
     * @return the annotation
     */
    public static Annotation of(final String name) {
        return new Annotation(name, null);
    }

}
