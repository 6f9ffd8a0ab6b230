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
import octave.java17.core.OctaveAst.Node;
import octave.java17.core.OctaveAst.NullLiteral;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.Operator;
import octave.java17.core.OctaveAst.Section;
import octave.java17.core.OctaveAst.SectionTarget;
import octave.java17.core.OctaveAst.StringLiteral;
import octave.java17.core.OctaveAst.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static octave.java17.core.OctaveLogging.LOG;

/// Recursive descent parser from tokens to [OctaveAst].
///
/// Grammar, one construct per line:
/// - `===NAME===` … `===END===` envelope
/// - `META:` block, first when present, optionally followed by `---`
/// - `§ID::NAME[annotation]` section with indented children
/// - `KEY::value` assignment with optional trailing `// comment`
/// - `KEY:` or `KEY[→§TARGET]:` block with indented children
/// - `// comment`
///
/// Values are scalars, `§NAME`, `[lists]`, `[k::v]` inline maps, `NAME[args]` constructors
/// and operator chains of those. A literal zone may follow `KEY::` on the next line.
///
/// The strict entry point refuses a missing envelope. The lenient one synthesizes it for a
/// single implicit document and records the synthesis in the repair log.
public final class OctaveParser {

    static final String INFERRED_NAME = "INFERRED";
    private static final String META = "META";

    private final List<Token> tokens;
    private final boolean lenient;
    private final RepairLog log = new RepairLog();
    private final Set<Integer> joinedGaps = new HashSet<>();
    private int pos;

    private OctaveParser(List<Token> tokens, boolean lenient) {
        this.tokens = List.copyOf(tokens);
        this.lenient = lenient;
        if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).kind() != TokenKind.EOF) {
            throw new IllegalArgumentException("token stream must end with EOF");
        }
    }

    /// Parses exactly one document with an explicit envelope.
    /// @throws OctaveParseException if the tokens do not form one enveloped document
    public static ParseResult parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        return new OctaveParser(tokens, false).single();
    }

    /// Parses exactly one document, synthesizing a missing envelope or a missing `===END===`.
    /// Each synthesis is logged as a NORMALIZATION entry.
    public static ParseResult parseWithWarnings(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        return new OctaveParser(tokens, true).single();
    }

    /// Parses a stream of explicitly enveloped documents.
    public static StreamParseResult parseAll(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        final var parser = new OctaveParser(tokens, false);
        final var documents = new ArrayList<Document>();
        while (parser.peek().kind() != TokenKind.EOF) {
            documents.add(parser.document(false));
        }
        LOG.fine(() -> "Parsed stream of " + documents.size() + " documents");
        return new StreamParseResult(documents, parser.log.entries());
    }

    private ParseResult single() {
        final Document document = document(true);
        if (peek().kind() != TokenKind.EOF) {
            final Token extra = peek();
            throw new OctaveParseException(OctaveError.TRAILING_CONTENT,
                OctaveError.TRAILING_CONTENT.message(extra.raw()), extra);
        }
        StructuredLog.fine(LOG, "parse.done", "name", document.name(), "sections", document.sections().size(),
            "repairs", log.size());
        return new ParseResult(document, log.entries());
    }

    private Document document(boolean allowImplicit) {
        Optional<String> grammarVersion = Optional.empty();
        if (peek().kind() == TokenKind.GRAMMAR_SENTINEL) {
            final Token sentinel = next();
            expectEndOfLine();
            grammarVersion = Optional.of(sentinel.normalized());
            StructuredLog.finer(LOG, "parse.grammar_sentinel", "version", sentinel.normalized(), "line", sentinel.line());
        }
        final Token first = peek();
        final String name;
        final boolean inferred;
        if (first.kind() == TokenKind.ENVELOPE_START) {
            next();
            expectEndOfLine();
            name = first.normalized();
            inferred = false;
        } else if (!allowImplicit) {
            throw new OctaveParseException(OctaveError.CONTENT_OUTSIDE_ENVELOPE,
                OctaveError.CONTENT_OUTSIDE_ENVELOPE.message(lineText(first)), first);
        } else if (!lenient) {
            throw new OctaveParseException(OctaveError.MISSING_ENVELOPE, OctaveError.MISSING_ENVELOPE.message(), first);
        } else {
            log.append(RepairEntry.normalization("ENVELOPE_SYNTHESIS", "", "===" + INFERRED_NAME + "===",
                first.line(), first.column()));
            name = INFERRED_NAME;
            inferred = true;
        }

        final List<Node> head = children(-1, 0);
        boolean separator = false;
        final List<Node> body = new ArrayList<>(head);
        if (peek().kind() == TokenKind.SEPARATOR) {
            final Token sep = next();
            final List<Node> significant = withoutComments(head);
            if (!(significant.size() == 1 && significant.get(0) instanceof Block b && b.key().equals(META))) {
                throw unexpected(sep, "here, '---' may only follow the META block");
            }
            expectEndOfLine();
            separator = true;
            body.addAll(children(-1, 0));
        }

        // comments are trivia: META may follow them and they are written after it
        Optional<Block> meta = Optional.empty();
        int metaIndex = -1;
        int leadingComments = 0;
        for (int i = 0; i < body.size(); i++) {
            final Node node = body.get(i);
            if (node instanceof Comment && leadingComments == i) {
                leadingComments++;
                continue;
            }
            if (META.equals(keyOf(node))) {
                if (i != leadingComments || !(node instanceof Block)) {
                    throw new OctaveParseException(OctaveError.META_NOT_FIRST, OctaveError.META_NOT_FIRST.message(),
                        first.line(), first.column(), META);
                }
                meta = Optional.of((Block) node);
                metaIndex = i;
            }
        }
        if (meta.isPresent()) {
            body.remove(metaIndex);
            for (int i = 0; i < leadingComments; i++) {
                final var comment = (Comment) body.get(i);
                log.append(RepairEntry.normalization("COMMENT_MOVED", "//" + comment.text(), "META\\n//" + comment.text(),
                    first.line(), first.column()));
            }
        }

        final Token end = peek();
        if (end.kind() == TokenKind.ENVELOPE_END) {
            next();
            expectEndOfLine();
        } else if (end.kind() == TokenKind.EOF) {
            if (!inferred) {
                if (!lenient) {
                    throw new OctaveParseException(OctaveError.UNTERMINATED_ENVELOPE,
                        OctaveError.UNTERMINATED_ENVELOPE.message(name), first);
                }
                log.append(RepairEntry.normalization("ENVELOPE_END_SYNTHESIS", "", "===END===", end.line(), end.column()));
            }
        } else if (end.kind() == TokenKind.ENVELOPE_START) {
            if (inferred) {
                throw new OctaveParseException(OctaveError.CONTENT_OUTSIDE_ENVELOPE,
                    OctaveError.CONTENT_OUTSIDE_ENVELOPE.message(lineText(first)), first);
            }
            throw new OctaveParseException(OctaveError.UNTERMINATED_ENVELOPE,
                OctaveError.UNTERMINATED_ENVELOPE.message(name), first);
        } else {
            throw unexpected(end, "inside the envelope");
        }
        LOG.finer(() -> "Parsed document " + name + " inferred=" + inferred);
        return new Document(name, inferred, meta, separator, body, grammarVersion);
    }

    private static List<Node> withoutComments(List<Node> nodes) {
        final var result = new ArrayList<Node>();
        for (Node node : nodes) {
            if (!(node instanceof Comment)) {
                result.add(node);
            }
        }
        return result;
    }

    // parses the lines indented deeper than parentIndent; the first such line fixes the level
    private List<Node> children(int parentIndent, int depth) {
        final var nodes = new ArrayList<Node>();
        final var keys = new HashSet<String>();
        int level = -1;
        while (true) {
            final Token start = peek();
            final TokenKind kind = start.kind();
            if (kind == TokenKind.EOF || kind == TokenKind.ENVELOPE_START || kind == TokenKind.ENVELOPE_END
                || (kind == TokenKind.SEPARATOR && depth == 0)) {
                break;
            }
            final int indent = kind == TokenKind.INDENT ? start.raw().length() : 0;
            if (indent <= parentIndent) {
                break;
            }
            if (level < 0) {
                level = indent;
            } else if (indent != level) {
                throw new OctaveParseException(OctaveError.INCONSISTENT_INDENTATION,
                    OctaveError.INCONSISTENT_INDENTATION.message(indent), start);
            }
            if (kind == TokenKind.INDENT) {
                next();
            }
            final int canonical = depth * 2;
            if (indent != canonical) {
                final Token first = peek();
                log.append(RepairEntry.normalization("INDENTATION", " ".repeat(indent) + first.raw(),
                    " ".repeat(canonical) + first.raw(), first.line(), 1));
            }
            final Node node = line(indent, depth);
            final String key = keyOf(node);
            if (key != null && !keys.add(key)) {
                throw new OctaveParseException(OctaveError.DUPLICATE_KEY, OctaveError.DUPLICATE_KEY.message(key),
                    start.line(), start.column(), key);
            }
            nodes.add(node);
        }
        return nodes;
    }

    private Node line(int indent, int depth) {
        final Token t = peek();
        switch (t.kind()) {
            case COMMENT -> {
                next();
                expectEndOfLine();
                return new Comment(t.normalized());
            }
            case SECTION_MARKER -> {
                return section(indent, depth);
            }
            case IDENTIFIER -> {
                return keyed(indent, depth);
            }
            default -> throw unexpected(t, "at start of line");
        }
    }

    private Node keyed(int indent, int depth) {
        final Token keyToken = next();
        final String key = keyToken.normalized();
        final Token after = peek();
        switch (after.kind()) {
            case ASSIGN -> {
                return assignment(keyToken, depth);
            }
            case BLOCK -> {
                return block(keyToken, Optional.empty(), indent, depth);
            }
            case LIST_START -> {
                final int from = pos;
                final SectionTarget target = blockTarget(key);
                spacing(from - 1, pos);
                return block(keyToken, Optional.of(target), indent, depth);
            }
            default -> throw new OctaveParseException(OctaveError.BARE_LINE,
                OctaveError.BARE_LINE.message(lineText(keyToken)), keyToken);
        }
    }

    private Assignment assignment(Token keyToken, int depth) {
        final Token assign = next();
        gap(keyToken, assign, "ASSIGN_SPACING");
        final Token first = peek();
        if (first.kind() == TokenKind.NEWLINE) {
            next();
            final int indent = peek().kind() == TokenKind.INDENT ? peek().raw().length() : 0;
            if (peek().kind() == TokenKind.INDENT) {
                next();
            }
            if (peek().kind() == TokenKind.LITERAL_ZONE) {
                final Token zone = next();
                final int expected = depth * 2;
                if (indent != expected) {
                    log.append(RepairEntry.normalization("INDENTATION", " ".repeat(indent) + fenceOf(zone),
                        " ".repeat(expected) + fenceOf(zone), zone.line(), 1));
                }
                expectEndOfLine();
                return new Assignment(keyToken.normalized(), literalZone(zone));
            }
            throw new OctaveParseException(OctaveError.MISSING_VALUE,
                OctaveError.MISSING_VALUE.message(keyToken.normalized()), assign);
        }
        if (first.kind() == TokenKind.COMMENT || first.kind() == TokenKind.EOF) {
            throw new OctaveParseException(OctaveError.MISSING_VALUE,
                OctaveError.MISSING_VALUE.message(keyToken.normalized()), assign);
        }
        gap(assign, first, "ASSIGN_SPACING");
        final int from = pos;
        final Value value = expression();
        spacing(from, pos);
        final Optional<String> comment = trailingComment(value);
        expectEndOfLine();
        return new Assignment(keyToken.normalized(), value, comment);
    }

    private Block block(Token keyToken, Optional<SectionTarget> target, int indent, int depth) {
        final Token colon = next();
        if (colon.kind() != TokenKind.BLOCK) {
            throw new OctaveParseException(OctaveError.MALFORMED_BLOCK_TARGET,
                OctaveError.MALFORMED_BLOCK_TARGET.message(keyToken.normalized()), colon);
        }
        gap(tokens.get(pos - 2), colon, "TOKEN_SPACING");
        final var children = new ArrayList<Node>();
        if (peek().kind() == TokenKind.COMMENT) {
            final Token comment = next();
            log.append(RepairEntry.normalization("COMMENT_MOVED", colon.raw() + " " + comment.raw(),
                colon.raw() + "\\n" + comment.raw(), comment.line(), comment.column()));
            children.add(new Comment(comment.normalized()));
        }
        expectEndOfLine();
        children.addAll(children(indent, depth + 1));
        return new Block(keyToken.normalized(), target, children);
    }

    // [→§TARGET] after a block key
    private SectionTarget blockTarget(String key) {
        next();
        final Token flow = next();
        final Token marker = next();
        final Token name = next();
        final Token close = next();
        if (flow.kind() != TokenKind.FLOW || marker.kind() != TokenKind.SECTION_MARKER
            || !(name.kind() == TokenKind.IDENTIFIER || name.kind() == TokenKind.NUMBER)
            || close.kind() != TokenKind.LIST_END) {
            throw new OctaveParseException(OctaveError.MALFORMED_BLOCK_TARGET,
                OctaveError.MALFORMED_BLOCK_TARGET.message(key), flow);
        }
        return new SectionTarget(name.raw());
    }

    private Section section(int indent, int depth) {
        final int from = pos;
        final Token marker = next();
        final Token id = peek();
        if (id.kind() != TokenKind.IDENTIFIER && id.kind() != TokenKind.NUMBER) {
            throw new OctaveParseException(OctaveError.ORPHAN_SECTION_MARKER,
                OctaveError.ORPHAN_SECTION_MARKER.message(), marker);
        }
        next();
        final Token assign = peek();
        if (assign.kind() != TokenKind.ASSIGN) {
            throw unexpected(assign, "after section id, expected '::'");
        }
        next();
        String key = "";
        if (peek().kind() == TokenKind.IDENTIFIER) {
            key = next().normalized();
        }
        Optional<ListValue> annotation = Optional.empty();
        if (peek().kind() == TokenKind.LIST_START) {
            final Value list = list();
            if (!(list instanceof ListValue lv)) {
                throw unexpected(tokens.get(from), "in section annotation, annotations are plain lists");
            }
            annotation = Optional.of(lv);
        }
        spacing(from, pos);
        final var children = new ArrayList<Node>();
        if (peek().kind() == TokenKind.COMMENT) {
            final Token comment = next();
            log.append(RepairEntry.normalization("COMMENT_MOVED", comment.raw(), "\\n" + comment.raw(),
                comment.line(), comment.column()));
            children.add(new Comment(comment.normalized()));
        }
        expectEndOfLine();
        children.addAll(children(indent, depth + 1));
        return new Section(id.raw(), key, annotation, children);
    }

    // operand (operator operand)*
    private Value expression() {
        final var steps = new ArrayList<Value>();
        final var operators = new ArrayList<Operator>();
        steps.add(term());
        while (peek().kind().isOperator()) {
            operators.add(Operator.of(next().kind()));
            steps.add(term());
        }
        return steps.size() == 1 ? steps.get(0) : new FlowExpression(steps, operators);
    }

    // every kind is listed so that a new token kind cannot fall through unhandled
    private Value term() {
        final Token t = peek();
        return switch (t.kind()) {
            case STRING -> {
                next();
                yield new StringLiteral(t.normalized(), true);
            }
            case NUMBER, BOOLEAN, NULL, VARIABLE -> bareRun();
            case IDENTIFIER -> {
                if (isAdjacentList(pos + 1)) {
                    next();
                    final Value args = list();
                    if (!(args instanceof ListValue lv)) {
                        throw unexpected(t, "constructor, arguments must be a plain list");
                    }
                    yield new Constructor(t.normalized(), lv);
                }
                yield bareRun();
            }
            case SECTION_MARKER -> sectionTarget();
            case LIST_START -> list();
            case ASSIGN, BLOCK, LIST_END, COMMA, FLOW, CONSTRAINT, ALTERNATIVE, SYNTHESIS, CONCAT, TENSION, AT,
                 GRAMMAR_SENTINEL, ENVELOPE_START, ENVELOPE_END, SEPARATOR, COMMENT, LITERAL_ZONE, INDENT, NEWLINE,
                 EOF -> throw unexpected(t, "where a value was expected");
        };
    }

    // one bare word, or several on one line joined into a quoted string
    private Value bareRun() {
        final Token first = next();
        if (!isBare(peek()) || peek().line() != first.line()) {
            return switch (first.kind()) {
                case NUMBER -> new NumberLiteral(first.raw());
                case BOOLEAN -> new BooleanLiteral(Boolean.parseBoolean(first.raw()));
                case NULL -> NullLiteral.INSTANCE;
                default -> new StringLiteral(first.normalized(), false);
            };
        }
        final var joined = new StringBuilder(first.raw());
        final var source = new StringBuilder(first.raw());
        Token last = first;
        while (isBare(peek()) && peek().line() == first.line()) {
            final Token word = next();
            joinedGaps.add(pos - 1);
            joined.append(' ').append(word.raw());
            source.append(" ".repeat(Math.max(1, word.column() - last.endColumn()))).append(word.raw());
            last = word;
        }
        final String value = joined.toString();
        log.append(RepairEntry.normalization("MULTIWORD_QUOTE", source.toString(), CanonicalEmitter.quote(value),
            first.line(), first.column()));
        return new StringLiteral(value, true);
    }

    private SectionTarget sectionTarget() {
        final Token marker = next();
        final Token name = peek();
        if (name.kind() != TokenKind.IDENTIFIER && name.kind() != TokenKind.NUMBER) {
            throw new OctaveParseException(OctaveError.ORPHAN_SECTION_MARKER,
                OctaveError.ORPHAN_SECTION_MARKER.message(), marker);
        }
        next();
        return new SectionTarget(name.raw());
    }

    // [items] or [k::v,...]; the token slice is kept on the resulting ListValue
    private Value list() {
        final int open = pos;
        next();
        final var items = new ArrayList<Value>();
        final var pairs = new LinkedHashMap<String, Value>();
        boolean sawItem = false;
        boolean sawPair = false;
        while (peek().kind() != TokenKind.LIST_END) {
            if (peek().kind() == TokenKind.IDENTIFIER && peek(1).kind() == TokenKind.ASSIGN) {
                final Token key = next();
                next();
                final Value value = expression();
                if (!value.isAtom()) {
                    throw new OctaveParseException(OctaveError.NESTED_INLINE_MAP,
                        OctaveError.NESTED_INLINE_MAP.message(key.normalized()), key);
                }
                if (pairs.put(key.normalized(), value) != null) {
                    throw new OctaveParseException(OctaveError.DUPLICATE_KEY,
                        OctaveError.DUPLICATE_KEY.message(key.normalized()), key);
                }
                sawPair = true;
            } else {
                items.add(expression());
                sawItem = true;
            }
            if (sawPair && sawItem) {
                throw new OctaveParseException(OctaveError.MIXED_LIST, OctaveError.MIXED_LIST.message(), tokens.get(open));
            }
            final Token sep = peek();
            if (sep.kind() == TokenKind.COMMA) {
                next();
                if (peek().kind() == TokenKind.LIST_END) {
                    log.append(RepairEntry.normalization("TRAILING_COMMA", ",]", "]", sep.line(), sep.column()));
                }
            } else if (sep.kind() != TokenKind.LIST_END) {
                throw unexpected(sep, "in list, items are separated by ','");
            }
        }
        next();
        final List<Token> slice = tokens.subList(open, pos);
        if (sawPair) {
            return new InlineMap(pairs);
        }
        return new ListValue(items, slice);
    }

    private LiteralZone literalZone(Token zone) {
        final String raw = zone.raw();
        final int eol = raw.indexOf('\n');
        final String opening = eol < 0 ? raw : raw.substring(0, eol);
        final String fence = fenceOf(zone);
        return new LiteralZone(fence, opening.substring(fence.length()).strip(), zone.normalized());
    }

    private Optional<String> trailingComment(Value value) {
        final Token t = peek();
        if (t.kind() == TokenKind.COMMENT) {
            final Token previous = tokens.get(pos - 1);
            if (previous.line() == t.line() && t.column() - previous.endColumn() != 1) {
                log.append(RepairEntry.normalization("COMMENT_SPACING",
                    " ".repeat(Math.max(0, t.column() - previous.endColumn())) + t.raw(), " " + t.raw(),
                    t.line(), previous.endColumn()));
            }
            next();
            return Optional.of(t.normalized());
        }
        if (t.kind() == TokenKind.NEWLINE || t.kind() == TokenKind.EOF) {
            return Optional.empty();
        }
        if (t.kind() == TokenKind.STRING || t.kind() == TokenKind.LIST_START || isBare(t)) {
            throw new OctaveParseException(OctaveError.AMBIGUOUS_VALUE,
                OctaveError.AMBIGUOUS_VALUE.message(lineText(t)), t);
        }
        throw unexpected(t, "after value " + value.getClass().getSimpleName());
    }

    // logs every same-line gap between consecutive tokens in [from, to)
    private void spacing(int from, int to) {
        for (int i = Math.max(from + 1, 1); i < to; i++) {
            if (!joinedGaps.contains(i)) {
                gap(tokens.get(i - 1), tokens.get(i), "TOKEN_SPACING");
            }
        }
    }

    private void gap(Token a, Token b, String rule) {
        if (a.line() == b.line() && a.raw().indexOf('\n') < 0 && b.column() > a.endColumn()) {
            final String spaces = " ".repeat(b.column() - a.endColumn());
            log.append(RepairEntry.normalization(rule, a.raw() + spaces + b.raw(), a.raw() + b.raw(),
                a.line(), a.endColumn()));
        }
    }

    private void expectEndOfLine() {
        final Token t = peek();
        if (t.kind() == TokenKind.NEWLINE) {
            next();
        } else if (t.kind() != TokenKind.EOF) {
            throw unexpected(t, "at end of line");
        }
    }

    private boolean isAdjacentList(int index) {
        return index > 0 && tokens.get(index).kind() == TokenKind.LIST_START
            && tokens.get(index - 1).kind() == TokenKind.IDENTIFIER
            && tokens.get(index - 1).isAdjacentTo(tokens.get(index));
    }

    private static boolean isBare(Token t) {
        return switch (t.kind()) {
            case IDENTIFIER, NUMBER, BOOLEAN, NULL, VARIABLE -> true;
            default -> false;
        };
    }

    private static String keyOf(Node node) {
        if (node instanceof Assignment a) {
            return a.key();
        }
        if (node instanceof Block b) {
            return b.key();
        }
        if (node instanceof Section s) {
            return "§" + s.id();
        }
        return null;
    }

    private static String fenceOf(Token zone) {
        int n = 0;
        while (n < zone.raw().length() && zone.raw().charAt(n) == '`') {
            n++;
        }
        return zone.raw().substring(0, n);
    }

    private String lineText(Token at) {
        final var sb = new StringBuilder();
        Token previous = null;
        for (Token t : tokens) {
            if (t.line() != at.line() || t.kind() == TokenKind.NEWLINE || t.kind() == TokenKind.INDENT) {
                continue;
            }
            if (previous != null && t.column() > previous.endColumn()) {
                sb.append(' ');
            }
            sb.append(t.raw());
            previous = t;
        }
        return sb.toString();
    }

    private static String tokenName(Token t) {
        return t.kind().name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    private OctaveParseException unexpected(Token t, String what) {
        final String shown = t.raw().isBlank() ? tokenName(t) : t.raw();
        return new OctaveParseException(OctaveError.UNEXPECTED_TOKEN,
            OctaveError.UNEXPECTED_TOKEN.message(shown, what), t);
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token next() {
        final Token t = tokens.get(pos);
        if (t.kind() != TokenKind.EOF) {
            pos++;
        }
        return t;
    }
}
