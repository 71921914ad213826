package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.expression.domain.Value;
import co.fanki.machineflow.shared.Preconditions;
import co.fanki.machineflow.shared.ValueObject;

/**
 * A named attribute of a node or of the machine.
 *
 * @param name the attribute name
 * @param type the declared type, null when untyped
 * @param value the parsed value
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Attribute(String name, String type, Value value)
        implements ValueObject {

    public Attribute {
        Preconditions.requireNonBlank(name, "Attribute name is required");
        value = value == null ? Value.NULL : value;
    }

    /**
     * Creates an attribute parsing its raw text by declared type.
     *
     * @param name the attribute name
     * @param type the declared type, may be null
     * @param raw the raw text
     * @return the attribute
     */
    public static Attribute parse(final String name, final String type,
            final String raw) {
        return new Attribute(name, type, AttributeValues.parse(type, raw));
    }

}
