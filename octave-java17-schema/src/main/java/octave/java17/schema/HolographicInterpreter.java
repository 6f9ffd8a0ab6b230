package octave.java17.schema;

import octave.java17.core.OctaveAst.BooleanLiteral;
import octave.java17.core.OctaveAst.ListValue;
import octave.java17.core.OctaveAst.NullLiteral;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.SectionTarget;
import octave.java17.core.OctaveAst.StringLiteral;
import octave.java17.core.OctaveAst.Value;
import octave.java17.core.OctaveError;
import octave.java17.core.StructuredLog;
import octave.java17.core.Token;
import octave.java17.core.TokenKind;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

import static octave.java17.schema.SchemaLogging.LOG;

/// Decodes a holographic pattern from the token slice kept on a [ListValue].
///
/// Grammar over token kinds, outer brackets excluded:
///
/// ```
/// pattern    := example ( '∧' constraint )* ( '→' '§' NAME )?
/// example    := STRING | NUMBER | BOOLEAN | NULL | IDENTIFIER+ | '§' NAME | list
/// constraint := IDENTIFIER ( '[' arg ( ',' arg )* ']' )?
/// ```
///
/// Every decision is taken on the token kind. A STRING token is a literal whatever its text,
/// so `["∧"∧REQ]` has the example `∧` and the single constraint `REQ`.
public final class HolographicInterpreter {

    private final String field;
    private final List<Token> tokens;
    private final int end;
    private int pos;

    private HolographicInterpreter(String field, List<Token> tokens) {
        this.field = field;
        this.tokens = tokens;
        this.end = tokens.size() - 1;
        this.pos = 1;
    }

    /// Decodes the pattern of one field.
    /// @param field the field path, for messages
    /// @param list a list parsed from source, carrying its token slice
    /// @throws SchemaLoadException if the slice is not a well-formed pattern
    public static HolographicPattern interpret(String field, ListValue list) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(list, "list must not be null");
        final List<Token> slice = list.sourceTokens();
        if (slice.size() < 2 || slice.get(0).kind() != TokenKind.LIST_START
            || slice.get(slice.size() - 1).kind() != TokenKind.LIST_END) {
            throw new SchemaLoadException(OctaveError.MALFORMED_PATTERN,
                OctaveError.MALFORMED_PATTERN.message(field, "the list carries no source tokens"), field);
        }
        final var pattern = new HolographicInterpreter(field, slice).pattern();
        StructuredLog.finer(LOG, "pattern", "field", field, "constraints", pattern.constraints().size(),
            "target", pattern.target().orElse(""));
        return pattern;
    }

    private HolographicPattern pattern() {
        if (pos >= end) {
            throw malformed("the pattern is empty");
        }
        final Value example = example();
        final var constraints = new ArrayList<Constraint>();
        Optional<String> target = Optional.empty();
        while (pos < end) {
            final Token t = tokens.get(pos);
            switch (t.kind()) {
                case CONSTRAINT -> {
                    if (target.isPresent()) {
                        throw malformed("constraints must precede the target");
                    }
                    pos++;
                    constraints.add(constraint());
                }
                case FLOW -> {
                    if (target.isPresent()) {
                        throw malformed("a pattern has at most one target");
                    }
                    pos++;
                    target = Optional.of(target());
                }
                case COMMA -> throw malformed("a pattern holds one example, found ','");
                default -> throw malformed("unexpected '" + t.raw() + "' after the example");
            }
        }
        final boolean required = constraints.stream().anyMatch(Constraint.Required.class::isInstance);
        final boolean optional = constraints.stream().anyMatch(Constraint.Optional.class::isInstance);
        if (required && optional) {
            throw malformed("REQ and OPT exclude each other");
        }
        return new HolographicPattern(example, constraints, target);
    }

    private Value example() {
        final Token t = tokens.get(pos);
        return switch (t.kind()) {
            case STRING -> {
                pos++;
                yield new StringLiteral(t.normalized(), true);
            }
            case NUMBER, BOOLEAN, NULL, IDENTIFIER, VARIABLE -> bare();
            case SECTION_MARKER -> new SectionTarget(sectionName());
            case LIST_START -> nestedList();
            case ASSIGN, BLOCK, LIST_END, COMMA, FLOW, CONSTRAINT, ALTERNATIVE, SYNTHESIS, CONCAT, TENSION, AT,
                 GRAMMAR_SENTINEL, ENVELOPE_START, ENVELOPE_END, SEPARATOR, COMMENT, LITERAL_ZONE, INDENT, NEWLINE,
                 EOF ->
                throw malformed("expected an example, found '" + t.raw() + "'");
        };
    }

    // one bare token, or a same-line run of them joined by single spaces
    private Value bare() {
        final Token first = tokens.get(pos++);
        if (pos < end && isBare(tokens.get(pos)) && tokens.get(pos).line() == first.line()) {
            final var sb = new StringBuilder(first.raw());
            while (pos < end && isBare(tokens.get(pos)) && tokens.get(pos).line() == first.line()) {
                sb.append(' ').append(tokens.get(pos++).raw());
            }
            return new StringLiteral(sb.toString(), true);
        }
        return atom(first);
    }

    private ListValue nestedList() {
        final int open = pos++;
        final var items = new ArrayList<Value>();
        while (pos < end && tokens.get(pos).kind() != TokenKind.LIST_END) {
            items.add(example());
            if (tokens.get(pos).kind() == TokenKind.COMMA) {
                pos++;
            } else if (tokens.get(pos).kind() != TokenKind.LIST_END) {
                throw malformed("unexpected '" + tokens.get(pos).raw() + "' in the example list");
            }
        }
        if (pos >= end) {
            throw malformed("the example list is not closed");
        }
        pos++;
        return new ListValue(items, tokens.subList(open, pos));
    }

    private Constraint constraint() {
        final Token name = tokens.get(pos);
        if (name.kind() != TokenKind.IDENTIFIER) {
            throw malformed("expected a constraint name after '∧', found '" + name.raw() + "'");
        }
        pos++;
        List<Token> args = List.of();
        final boolean hasArgs = pos < end && tokens.get(pos).kind() == TokenKind.LIST_START;
        if (hasArgs) {
            args = arguments(name.raw());
        }
        final String n = name.raw();
        try {
            return switch (n) {
                case "REQ" -> noArgs(n, hasArgs, new Constraint.Required());
                case "OPT" -> noArgs(n, hasArgs, new Constraint.Optional());
                case "DIR" -> noArgs(n, hasArgs, new Constraint.Directory());
                case "APPEND_ONLY" -> noArgs(n, hasArgs, new Constraint.AppendOnly());
                case "DATE" -> noArgs(n, hasArgs, new Constraint.Date());
                case "ISO8601" -> noArgs(n, hasArgs, new Constraint.Iso8601());
                case "ENUM" -> new Constraint.Enum(texts(n, args, 1, Integer.MAX_VALUE));
                case "CONST" -> new Constraint.ConstEquals(atom(single(n, args)));
                case "REGEX" -> new Constraint.Regex(single(n, args).normalized());
                case "TYPE" -> {
                    final String typeName = single(n, args).normalized();
                    yield new Constraint.Type(ValueType.parse(typeName)
                        .orElseThrow(() -> malformed("TYPE takes STRING, NUMBER, BOOLEAN or LIST, found " + typeName)));
                }
                case "RANGE" -> {
                    final List<Token> bounds = arity(n, args, 2, 2);
                    yield new Constraint.Range(number(n, bounds.get(0)), number(n, bounds.get(1)));
                }
                case "MAX_LENGTH" -> new Constraint.MaxLength(length(n, single(n, args)));
                case "MIN_LENGTH" -> new Constraint.MinLength(length(n, single(n, args)));
                default -> throw new SchemaLoadException(OctaveError.UNKNOWN_CONSTRAINT,
                    OctaveError.UNKNOWN_CONSTRAINT.message(n), field);
            };
        } catch (PatternSyntaxException e) {
            throw new SchemaLoadException(OctaveError.MALFORMED_PATTERN,
                OctaveError.MALFORMED_PATTERN.message(field, "REGEX does not compile: " + e.getDescription()), field, e);
        } catch (IllegalArgumentException e) {
            throw new SchemaLoadException(OctaveError.MALFORMED_PATTERN,
                OctaveError.MALFORMED_PATTERN.message(field, e.getMessage()), field, e);
        }
    }

    // '[' arg (',' arg)* ']' after a constraint name; arguments are single tokens
    private List<Token> arguments(String name) {
        pos++;
        final var args = new ArrayList<Token>();
        while (pos < end && tokens.get(pos).kind() != TokenKind.LIST_END) {
            final Token arg = tokens.get(pos);
            if (!isBare(arg) && arg.kind() != TokenKind.STRING) {
                throw malformed(name + " arguments must be single values, found '" + arg.raw() + "'");
            }
            args.add(arg);
            pos++;
            if (pos < end && tokens.get(pos).kind() == TokenKind.COMMA) {
                pos++;
            } else if (pos < end && tokens.get(pos).kind() != TokenKind.LIST_END) {
                throw malformed(name + " arguments are separated by ','");
            }
        }
        if (pos >= end) {
            throw malformed(name + " arguments are not closed");
        }
        pos++;
        return args;
    }

    private String target() {
        if (pos >= end || tokens.get(pos).kind() != TokenKind.SECTION_MARKER) {
            throw malformed("'→' must be followed by §TARGET");
        }
        return sectionName();
    }

    private String sectionName() {
        pos++;
        if (pos >= end || !(tokens.get(pos).kind() == TokenKind.IDENTIFIER || tokens.get(pos).kind() == TokenKind.NUMBER)) {
            throw malformed("'§' must be followed by a name");
        }
        return tokens.get(pos++).raw();
    }

    private Constraint noArgs(String name, boolean hasArgs, Constraint constraint) {
        if (hasArgs) {
            throw malformed(name + " takes no arguments");
        }
        return constraint;
    }

    private List<Token> arity(String name, List<Token> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            final String expected = min == max ? Integer.toString(min) : "at least " + min;
            throw malformed(name + " takes " + expected + " argument(s), found " + args.size());
        }
        return args;
    }

    private Token single(String name, List<Token> args) {
        return arity(name, args, 1, 1).get(0);
    }

    private List<String> texts(String name, List<Token> args, int min, int max) {
        return arity(name, args, min, max).stream().map(Token::normalized).toList();
    }

    private BigDecimal number(String name, Token t) {
        if (t.kind() != TokenKind.NUMBER) {
            throw malformed(name + " bounds must be numbers, found '" + t.raw() + "'");
        }
        return new BigDecimal(t.raw());
    }

    private int length(String name, Token t) {
        if (t.kind() != TokenKind.NUMBER || !t.raw().matches("\\d+")) {
            throw malformed(name + " takes a non-negative integer, found '" + t.raw() + "'");
        }
        return Integer.parseInt(t.raw());
    }

    private static Value atom(Token t) {
        return switch (t.kind()) {
            case NUMBER -> new NumberLiteral(t.raw());
            case BOOLEAN -> new BooleanLiteral(Boolean.parseBoolean(t.raw()));
            case NULL -> NullLiteral.INSTANCE;
            case STRING -> new StringLiteral(t.normalized(), true);
            default -> new StringLiteral(t.normalized(), false);
        };
    }

    private static boolean isBare(Token t) {
        return t.kind() == TokenKind.IDENTIFIER || t.kind() == TokenKind.NUMBER || t.kind() == TokenKind.VARIABLE
            || t.kind() == TokenKind.BOOLEAN || t.kind() == TokenKind.NULL;
    }

    private SchemaLoadException malformed(String detail) {
        return new SchemaLoadException(OctaveError.MALFORMED_PATTERN, OctaveError.MALFORMED_PATTERN.message(field, detail), field);
    }
}
