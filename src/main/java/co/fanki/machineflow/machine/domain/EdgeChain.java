package co.fanki.machineflow.machine.domain;

import co.fanki.machineflow.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * A multi-segment edge statement such as {@code A -> B, C -> D}.
 *
 * <p>Expansion uses chain semantics: the targets of each segment are the
 * sources of the next one, so the example yields {@code A->B}, {@code A->C},
 * {@code B->D} and {@code C->D}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EdgeChain {

    private final List<String> sources;

    private final List<Segment> segments;

    /**
     * Creates a chain.
     *
     * @param theSources the initial sources, never empty
     * @param theSegments the segments, never empty
     */
    public EdgeChain(final List<String> theSources,
            final List<Segment> theSegments) {
        Preconditions.require(theSources != null && !theSources.isEmpty(),
                "Edge chain needs at least one source");
        Preconditions.require(theSegments != null && !theSegments.isEmpty(),
                "Edge chain needs at least one segment");
        this.sources = List.copyOf(theSources);
        this.segments = List.copyOf(theSegments);
    }

    /**
     * Expands the chain into directed edges, in statement order.
     *
     * @return the edges
     */
    public List<MachineEdge> expand() {
        final List<MachineEdge> edges = new ArrayList<>();
        List<String> current = sources;
        for (final Segment segment : segments) {
            final String guard = segment.guard() != null
                    ? segment.guard() : EdgeConditions.extract(segment.label());
            for (final String source : current) {
                for (final String target : segment.targets()) {
                    edges.add(new MachineEdge(source, target,
                            segment.arrowKind(), segment.label(), guard,
                            segment.annotations()));
                }
            }
            current = segment.targets();
        }
        return edges;
    }

    /**
     * One arrow of a chain with the targets it points to.
     *
     * @param targets the target names, never empty
     * @param arrowKind the arrow kind
     * @param label the label, may be null
     * @param guard an explicit guard, may be null
     * @param annotations the annotations
     */
    public record Segment(List<String> targets, ArrowKind arrowKind,
            String label, String guard, List<Annotation> annotations) {

        public Segment {
            Preconditions.require(targets != null && !targets.isEmpty(),
                    "Edge segment needs at least one target");
            targets = List.copyOf(targets);
            annotations = annotations == null
                    ? List.of() : List.copyOf(annotations);
        }

        /**
         * Creates a plain segment.
         *
         * @param targets the targets
         * @return the segment
         */
        public static Segment to(final String... targets) {
            return new Segment(List.of(targets), ArrowKind.ASSOCIATION, null,
                    null, null);
        }
    }

}
