package octave.java17.tools;

import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Block;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.Node;
import octave.java17.core.OctaveAst.Section;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/// Counts of the structure of a document, compared before and after a write.
/// @param sectionMarkers every `§ID` in the document
/// @param blocks blocks including META
/// @param assignments assignments at any depth
record StructuralMetrics(Set<String> sectionMarkers, int blocks, int assignments) {

    static final String SECTION_MARKERS_REMOVED = "W_STRUCT_001";
    static final String BLOCKS_REMOVED = "W_STRUCT_002";
    static final String ASSIGNMENTS_REMOVED = "W_STRUCT_003";

    static StructuralMetrics of(Document document) {
        final var counter = new Counter();
        document.meta().ifPresent(meta -> counter.visit(List.<Node>of(meta)));
        counter.visit(document.sections());
        return new StructuralMetrics(counter.markers, counter.blocks, counter.assignments);
    }

    /// Describes a rewrite from `before` to `after` text.
    /// @param previous metrics of the old document, null when there was none or it did not parse
    static String diff(String before, String after, StructuralMetrics previous, StructuralMetrics current) {
        if (before.equals(after)) {
            return "No changes";
        }
        final var sb = new StringBuilder();
        sb.append(bytes(before)).append(" -> ").append(bytes(after)).append(" bytes");
        if (previous == null) {
            return sb.toString();
        }
        final List<String> warnings = new ArrayList<>();
        final var lost = new TreeSet<>(previous.sectionMarkers);
        lost.removeAll(current.sectionMarkers);
        if (!lost.isEmpty()) {
            warnings.add(SECTION_MARKERS_REMOVED + ": section markers removed (" + String.join(", ", lost) + ")");
        }
        if (current.blocks < previous.blocks) {
            warnings.add(BLOCKS_REMOVED + ": " + (previous.blocks - current.blocks) + " block(s) removed");
        }
        if (current.assignments < previous.assignments) {
            warnings.add(ASSIGNMENTS_REMOVED + ": " + (previous.assignments - current.assignments) + " assignment(s) removed");
        }
        if (!warnings.isEmpty()) {
            sb.append(" | WARNINGS: ").append(String.join("; ", warnings));
        }
        return sb.toString();
    }

    private static int bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    private static final class Counter {
        final Set<String> markers = new TreeSet<>();
        int blocks;
        int assignments;

        void visit(List<Node> nodes) {
            for (Node node : nodes) {
                if (node instanceof Assignment) {
                    assignments++;
                } else if (node instanceof Block b) {
                    blocks++;
                    visit(b.children());
                } else if (node instanceof Section s) {
                    markers.add("§" + s.id());
                    visit(s.children());
                }
            }
        }
    }
}
