package octave.java17.tools;

import octave.java17.core.CanonicalEmitter;
import octave.java17.core.OctaveAst;
import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Block;
import octave.java17.core.OctaveAst.Comment;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.LiteralZone;
import octave.java17.core.OctaveAst.Node;
import octave.java17.core.OctaveAst.Section;
import octave.java17.core.OctaveAst.StringLiteral;

import java.util.List;

/// Renders a document as Markdown for reading.
///
/// The document name is the `#` heading, META and every block or section open a heading one
/// level below their parent (never deeper than `######`), assignments are `- **KEY**: value`
/// items and literal zones are fenced code blocks. Comments are not rendered.
final class MarkdownRenderer {

    private static final int MAX_HEADING = 6;

    private MarkdownRenderer() {
    }

    static String render(Document document) {
        final var out = new StringBuilder(256);
        out.append("# ").append(document.name()).append('\n');
        document.meta().ifPresent(meta -> new Writer(out, 2).visitBlock(meta));
        final var writer = new Writer(out, 2);
        boolean items = false;
        for (Node node : document.sections()) {
            if (node instanceof Assignment && !items) {
                out.append('\n');
                items = true;
            } else if (!(node instanceof Assignment)) {
                items = false;
            }
            node.accept(writer);
        }
        return out.toString();
    }

    static String inline(OctaveAst.Value value) {
        if (value instanceof StringLiteral s) {
            return s.value();
        }
        return "`" + CanonicalEmitter.emitValue(value) + "`";
    }

    private static final class Writer implements OctaveAst.NodeVisitor<Void> {
        private final StringBuilder out;
        private final int level;

        Writer(StringBuilder out, int level) {
            this.out = out;
            this.level = level;
        }

        @Override
        public Void visitSection(Section section) {
            heading("§" + section.id() + "::" + section.key(), section.children());
            return null;
        }

        @Override
        public Void visitBlock(Block block) {
            heading(block.key(), block.children());
            return null;
        }

        private void heading(String title, List<Node> children) {
            out.append('\n').append("#".repeat(Math.min(level, MAX_HEADING))).append(' ').append(title).append("\n\n");
            final var child = new Writer(out, level + 1);
            children.forEach(n -> n.accept(child));
        }

        @Override
        public Void visitAssignment(Assignment assignment) {
            if (assignment.value() instanceof LiteralZone zone) {
                out.append("- **").append(assignment.key()).append("**:\n\n");
                out.append("```").append(zone.info()).append('\n').append(zone.content());
                if (!zone.content().isEmpty() && !zone.content().endsWith("\n")) {
                    out.append('\n');
                }
                out.append("```\n\n");
                return null;
            }
            out.append("- **").append(assignment.key()).append("**: ").append(inline(assignment.value())).append('\n');
            return null;
        }

        @Override
        public Void visitComment(Comment comment) {
            return null;
        }
    }
}
