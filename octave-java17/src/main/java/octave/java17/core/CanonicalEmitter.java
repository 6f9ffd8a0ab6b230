package octave.java17.core;

import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Block;
import octave.java17.core.OctaveAst.BooleanLiteral;
import octave.java17.core.OctaveAst.Comment;
import octave.java17.core.OctaveAst.Constructor;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.FlowExpression;
import octave.java17.core.OctaveAst.InlineMap;
import octave.java17.core.OctaveAst.ListValue;
import octave.java17.core.OctaveAst.LiteralZone;
import octave.java17.core.OctaveAst.NullLiteral;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.Section;
import octave.java17.core.OctaveAst.SectionTarget;
import octave.java17.core.OctaveAst.StringLiteral;
import octave.java17.core.OctaveAst.Value;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static octave.java17.core.OctaveLogging.LOG;

/// Renders an AST in the one canonical textual form.
///
/// Canonical form: explicit envelope, META first, 2-space indentation, `KEY::value` without
/// spaces, single-line lists, canonical operator symbols and a final newline. Emission never
/// fails; parsing the output of a parsed canonical document yields an equal AST.
public final class CanonicalEmitter {

    private static final String INDENT = "  ";

    private CanonicalEmitter() {
    }

    public static String emit(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        final var out = new StringBuilder(256);
        document.grammarVersion().ifPresent(version -> out.append("OCTAVE::").append(version).append('\n'));
        out.append("===").append(document.name()).append("===\n");
        document.meta().ifPresent(meta -> {
            new NodeWriter(out, 0).visitBlock(meta);
            if (document.separator()) {
                out.append("---\n");
            }
        });
        final var writer = new NodeWriter(out, 0);
        document.sections().forEach(node -> node.accept(writer));
        out.append("===END===\n");
        LOG.finer(() -> "Emitted " + document.name() + " as " + out.length() + " chars");
        return out.toString();
    }

    /// Renders a single value as it appears after `::`.
    public static String emitValue(Value value) {
        return value.accept(VALUE_WRITER);
    }

    /// Quotes a string so that the lexer decodes it back to the same value.
    /// A backslash is doubled only where it would otherwise start an escape.
    public static String quote(String value) {
        final var sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\\' -> {
                    final boolean escape = i + 1 == value.length() || "\"\\nt".indexOf(value.charAt(i + 1)) >= 0;
                    sb.append(escape ? "\\\\" : "\\");
                }
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static final OctaveAst.ValueVisitor<String> VALUE_WRITER = new OctaveAst.ValueVisitor<>() {
        @Override
        public String visitString(StringLiteral value) {
            return !value.quoted() && OctaveLexer.isBareWord(value.value()) ? value.value() : quote(value.value());
        }

        @Override
        public String visitNumber(NumberLiteral value) {
            return value.lexeme();
        }

        @Override
        public String visitBoolean(BooleanLiteral value) {
            return Boolean.toString(value.value());
        }

        @Override
        public String visitNull(NullLiteral value) {
            return "null";
        }

        @Override
        public String visitList(ListValue value) {
            return join(value.items());
        }

        @Override
        public String visitInlineMap(InlineMap value) {
            return value.pairs().entrySet().stream()
                .map(e -> e.getKey() + "::" + e.getValue().accept(this))
                .collect(Collectors.joining(",", "[", "]"));
        }

        @Override
        public String visitFlow(FlowExpression value) {
            final var sb = new StringBuilder(value.steps().get(0).accept(this));
            for (int i = 0; i < value.operators().size(); i++) {
                sb.append(value.operators().get(i).symbol()).append(value.steps().get(i + 1).accept(this));
            }
            return sb.toString();
        }

        @Override
        public String visitSectionTarget(SectionTarget value) {
            return value.canonical();
        }

        @Override
        public String visitConstructor(Constructor value) {
            return value.name() + join(value.args().items());
        }

        // only reachable for zones built outside the parser in a non-assignment position
        @Override
        public String visitLiteralZone(LiteralZone value) {
            return quote(value.content());
        }

        private String join(List<Value> items) {
            return items.stream().map(v -> v.accept(this)).collect(Collectors.joining(",", "[", "]"));
        }
    };

    private static final class NodeWriter implements OctaveAst.NodeVisitor<Void> {
        private final StringBuilder out;
        private final int depth;

        NodeWriter(StringBuilder out, int depth) {
            this.out = out;
            this.depth = depth;
        }

        private String indent() {
            return INDENT.repeat(depth);
        }

        @Override
        public Void visitSection(Section section) {
            out.append(indent()).append('§').append(section.id()).append("::").append(section.key());
            section.annotation().ifPresent(a -> out.append(emitValue(a)));
            out.append('\n');
            final var child = new NodeWriter(out, depth + 1);
            section.children().forEach(n -> n.accept(child));
            return null;
        }

        @Override
        public Void visitBlock(Block block) {
            out.append(indent()).append(block.key());
            block.target().ifPresent(t -> out.append("[→").append(t.canonical()).append(']'));
            out.append(":\n");
            final var child = new NodeWriter(out, depth + 1);
            block.children().forEach(n -> n.accept(child));
            return null;
        }

        @Override
        public Void visitAssignment(Assignment assignment) {
            out.append(indent()).append(assignment.key()).append("::");
            if (assignment.value() instanceof LiteralZone zone) {
                out.append('\n').append(indent()).append(zone.fence()).append(zone.info()).append('\n');
                out.append(zone.content());
                out.append(indent()).append(zone.fence()).append('\n');
                return null;
            }
            out.append(emitValue(assignment.value()));
            assignment.comment().ifPresent(c -> out.append(" //").append(c));
            out.append('\n');
            return null;
        }

        @Override
        public Void visitComment(Comment comment) {
            out.append(indent()).append("//").append(comment.text()).append('\n');
            return null;
        }
    }
}
