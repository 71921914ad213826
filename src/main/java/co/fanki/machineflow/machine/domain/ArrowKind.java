package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.shared.DomainException;

import java.util.Locale;

/**
 * Arrow kind of an edge. Advisory metadata, except that
 * {@link #BIDIRECTIONAL} edges are traversable both ways.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ArrowKind {

    ASSOCIATION("->"),
    DEPENDENCY("-->"),
    THICK("=>"),
    BIDIRECTIONAL("<-->"),
    INHERITANCE("<|--"),
    COMPOSITION("*-->"),
    AGGREGATION("o-->");

    private final String symbol;

    ArrowKind(final String theSymbol) {
        this.symbol = theSymbol;
    }

    /**
     * Returns the arrow as written in machine source.
     *
     * @return the symbol
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Resolves an arrow kind from either its symbol or its name.
     *
     * <p>A missing arrow means {@link #ASSOCIATION}. The symbol
     * {@code <->} is accepted for bidirectional edges.</p>
     *
     * @param text the symbol or name, may be null
     * @return the arrow kind
     * @throws DomainException with code {@code MACHINE_UNKNOWN_ARROW}
     */
    public static ArrowKind parse(final String text) {
        if (text == null || text.isBlank()) {
            return ASSOCIATION;
        }
        final String trimmed = text.trim();
        if ("<->".equals(trimmed)) {
            return BIDIRECTIONAL;
        }
        for (final ArrowKind kind : values()) {
            if (kind.symbol.equals(trimmed)
                    || kind.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return kind;
            }
        }
        throw new DomainException("Unknown arrow type: " + text,
                "MACHINE_UNKNOWN_ARROW");
    }

}
