package octave.java17.core;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// AST for OCTAVE documents.
///
/// Document structure:
/// - Document: one envelope, an optional META block and the ordered body
/// - Node: Section, Block, Assignment or Comment
/// - Value: scalars, lists, inline maps, flow expressions, section targets,
///   constructors and literal zones
///
/// Dispatch over nodes and values goes through [NodeVisitor] and [ValueVisitor], so adding a
/// variant fails compilation everywhere the new variant is not handled.
public sealed interface OctaveAst permits OctaveAst.Document, OctaveAst.Node, OctaveAst.Value {

    /// A single document.
    /// @param name the envelope name, `INFERRED` when the envelope was synthesized
    /// @param envelopeInferred true when the source had no envelope
    /// @param meta the META block, always first when present
    /// @param separator true when a `---` line follows META
    /// @param sections the ordered body
    /// @param grammarVersion the version declared by an `OCTAVE::N` line ahead of the envelope
    record Document(String name, boolean envelopeInferred, Optional<Block> meta, boolean separator,
                    List<Node> sections, Optional<String> grammarVersion) implements OctaveAst {
        public Document {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(meta, "meta must not be null");
            sections = List.copyOf(Objects.requireNonNull(sections, "sections must not be null"));
            Objects.requireNonNull(grammarVersion, "grammarVersion must not be null");
        }

        public Document(String name, boolean envelopeInferred, Optional<Block> meta, boolean separator,
                        List<Node> sections) {
            this(name, envelopeInferred, meta, separator, sections, Optional.empty());
        }

        /// Returns the META value for the key, if present.
        public Optional<Value> metaValue(String key) {
            return meta.flatMap(m -> m.assignment(key)).map(Assignment::value);
        }

        /// Returns a copy with the body replaced.
        public Document withSections(List<Node> replacement) {
            return new Document(name, envelopeInferred, meta, separator, replacement, grammarVersion);
        }

        /// Returns a copy with the META block replaced.
        public Document withMeta(Optional<Block> replacement) {
            return new Document(name, envelopeInferred, replacement, separator, sections, grammarVersion);
        }
    }

    /// A body element.
    sealed interface Node extends OctaveAst permits Section, Block, Assignment, Comment {
        <R> R accept(NodeVisitor<R> visitor);
    }

    /// A numbered or named section `§ID::NAME[annotation]` with indented children.
    record Section(String id, String key, Optional<ListValue> annotation, List<Node> children) implements Node {
        public Section {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(annotation, "annotation must not be null");
            children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
        }

        public Section withChildren(List<Node> replacement) {
            return new Section(id, key, annotation, replacement);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSection(this);
        }
    }

    /// `KEY:` or `KEY[→§TARGET]:` with indented children.
    /// Children without their own target inherit `target`.
    record Block(String key, Optional<SectionTarget> target, List<Node> children) implements Node {
        public Block {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(target, "target must not be null");
            children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
        }

        /// Direct child assignment with the given key.
        public Optional<Assignment> assignment(String childKey) {
            return children.stream()
                .filter(Assignment.class::isInstance)
                .map(Assignment.class::cast)
                .filter(a -> a.key().equals(childKey))
                .findFirst();
        }

        /// Direct child block with the given key.
        public Optional<Block> block(String childKey) {
            return children.stream()
                .filter(Block.class::isInstance)
                .map(Block.class::cast)
                .filter(b -> b.key().equals(childKey))
                .findFirst();
        }

        public Block withChildren(List<Node> replacement) {
            return new Block(key, target, replacement);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /// `KEY::value`, optionally followed by a trailing comment.
    record Assignment(String key, Value value, Optional<String> comment) implements Node {
        public Assignment {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(comment, "comment must not be null");
        }

        public Assignment(String key, Value value) {
            this(key, value, Optional.empty());
        }

        public Assignment withValue(Value replacement) {
            return new Assignment(key, replacement, comment);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /// A full-line `//` comment; `text` is everything after the slashes.
    record Comment(String text) implements Node {
        public Comment {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitComment(this);
        }
    }

    /// A value in assignment, list, map or flow position.
    sealed interface Value extends OctaveAst
        permits StringLiteral, NumberLiteral, BooleanLiteral, NullLiteral, ListValue, InlineMap,
        FlowExpression, SectionTarget, Constructor, LiteralZone {

        <R> R accept(ValueVisitor<R> visitor);

        /// Atoms are the values allowed inside inline maps.
        default boolean isAtom() {
            return false;
        }
    }

    /// A string, either written bare (an identifier) or quoted.
    record StringLiteral(String value, boolean quoted) implements Value {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
        }

        /// Creates a literal that is quoted exactly when it cannot be written bare.
        public static StringLiteral of(String value) {
            return new StringLiteral(value, !OctaveLexer.isBareWord(value));
        }

        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    /// A number kept as its source lexeme so it renders exactly as written.
    record NumberLiteral(String lexeme) implements Value {
        public NumberLiteral {
            Objects.requireNonNull(lexeme, "lexeme must not be null");
            if (!OctaveLexer.NUMBER.matcher(lexeme).matches()) {
                throw new IllegalArgumentException("Not a number lexeme: " + lexeme);
            }
        }

        public BigDecimal toBigDecimal() {
            return new BigDecimal(lexeme);
        }

        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    record BooleanLiteral(boolean value) implements Value {
        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    record NullLiteral() implements Value {
        public static final NullLiteral INSTANCE = new NullLiteral();

        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitNull(this);
        }
    }

    /// `[a,b,c]`.
    ///
    /// `sourceTokens` is the slice of the parse's token stream from `[` to `]` inclusive.
    /// Lists built programmatically have an empty slice. Equality ignores the slice: two lists
    /// are equal when their items are.
    record ListValue(List<Value> items, List<Token> sourceTokens) implements Value {
        public ListValue {
            items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
            sourceTokens = Collections.unmodifiableList(Objects.requireNonNull(sourceTokens, "sourceTokens must not be null"));
        }

        public static ListValue of(List<Value> items) {
            return new ListValue(items, List.of());
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ListValue other && items.equals(other.items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return "ListValue" + items;
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    /// `[k::v,k2::v2]` holding atoms only.
    record InlineMap(Map<String, Value> pairs) implements Value {
        public InlineMap {
            Objects.requireNonNull(pairs, "pairs must not be null");
            pairs.forEach((k, v) -> {
                if (!v.isAtom()) {
                    throw new IllegalArgumentException("Inline map value for '" + k + "' must be an atom");
                }
            });
            pairs = Collections.unmodifiableMap(new LinkedHashMap<>(pairs));
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitInlineMap(this);
        }
    }

    /// A chain of values joined by operators, for example `A→B→C` or `"x"∧REQ→§SELF`.
    /// The chain groups to the right: `A→B→C` reads `A→(B→C)`.
    record FlowExpression(List<Value> steps, List<Operator> operators) implements Value {
        public FlowExpression {
            steps = List.copyOf(Objects.requireNonNull(steps, "steps must not be null"));
            operators = List.copyOf(Objects.requireNonNull(operators, "operators must not be null"));
            if (steps.size() < 2 || operators.size() != steps.size() - 1) {
                throw new IllegalArgumentException("A flow expression needs n steps and n-1 operators");
            }
        }

        /// The leftmost step.
        public Value head() {
            return steps.get(0);
        }

        /// The operator between the head and the rest.
        public Operator operator() {
            return operators.get(0);
        }

        /// The right operand of the head: the last step, or the remaining chain.
        public Value tail() {
            if (steps.size() == 2) {
                return steps.get(1);
            }
            return new FlowExpression(steps.subList(1, steps.size()), operators.subList(1, operators.size()));
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitFlow(this);
        }
    }

    /// A routing or section reference, rendered `§NAME`.
    record SectionTarget(String name) implements Value {
        public SectionTarget {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isEmpty() || name.startsWith("§")) {
                throw new IllegalArgumentException("Section target name must be non-empty and unprefixed: " + name);
            }
        }

        /// The canonical spelling, always with `§`.
        public String canonical() {
            return "§" + name;
        }

        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitSectionTarget(this);
        }
    }

    /// `NAME[args]` where the bracket directly follows the name, for example `ENUM[A,B]`.
    record Constructor(String name, ListValue args) implements Value {
        public Constructor {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(args, "args must not be null");
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitConstructor(this);
        }
    }

    /// A fenced verbatim span. `content` is every line between the fences, each ending in a newline.
    record LiteralZone(String fence, String info, String content) implements Value {
        public LiteralZone {
            Objects.requireNonNull(fence, "fence must not be null");
            Objects.requireNonNull(info, "info must not be null");
            Objects.requireNonNull(content, "content must not be null");
            if (fence.length() < 3 || !fence.chars().allMatch(c -> c == '`')) {
                throw new IllegalArgumentException("Fence must be three or more backticks: " + fence);
            }
            if (!content.isEmpty() && !content.endsWith("\n")) {
                throw new IllegalArgumentException("Literal zone content must end with a newline");
            }
        }

        @Override
        public <R> R accept(ValueVisitor<R> visitor) {
            return visitor.visitLiteralZone(this);
        }
    }

    /// Operators that chain values in a flow expression.
    enum Operator {
        FLOW("→"),
        CONSTRAINT("∧"),
        ALTERNATIVE("∨"),
        SYNTHESIS("⊕"),
        CONCAT("⧺"),
        TENSION("⇌"),
        AT("@");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        static Operator of(TokenKind kind) {
            return switch (kind) {
                case FLOW -> FLOW;
                case CONSTRAINT -> CONSTRAINT;
                case ALTERNATIVE -> ALTERNATIVE;
                case SYNTHESIS -> SYNTHESIS;
                case CONCAT -> CONCAT;
                case TENSION -> TENSION;
                case AT -> AT;
                default -> throw new IllegalArgumentException("Not an operator: " + kind);
            };
        }
    }

    /// Visitor over body nodes.
    interface NodeVisitor<R> {
        R visitSection(Section section);

        R visitBlock(Block block);

        R visitAssignment(Assignment assignment);

        R visitComment(Comment comment);
    }

    /// Visitor over values.
    interface ValueVisitor<R> {
        R visitString(StringLiteral value);

        R visitNumber(NumberLiteral value);

        R visitBoolean(BooleanLiteral value);

        R visitNull(NullLiteral value);

        R visitList(ListValue value);

        R visitInlineMap(InlineMap value);

        R visitFlow(FlowExpression value);

        R visitSectionTarget(SectionTarget value);

        R visitConstructor(Constructor value);

        R visitLiteralZone(LiteralZone value);
    }
}
